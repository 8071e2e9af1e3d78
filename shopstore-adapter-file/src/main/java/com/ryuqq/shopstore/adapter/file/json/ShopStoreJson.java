package com.ryuqq.shopstore.adapter.file.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 파일 어댑터 공용 ObjectMapper 설정.
 *
 * <ul>
 *   <li>java.time 지원 (ISO-8601 문자열, timestamp 숫자 사용 안 함)</li>
 *   <li>알 수 없는 필드는 무시 (이전/이후 버전 파일 호환)</li>
 *   <li>들여쓰기 출력 (사람이 직접 열어보는 파일)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ShopStoreJson {

    private ShopStoreJson() {
    }

    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
