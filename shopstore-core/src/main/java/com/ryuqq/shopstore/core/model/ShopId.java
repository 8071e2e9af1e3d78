package com.ryuqq.shopstore.core.model;

import com.ryuqq.shopstore.core.exception.ShopValidationException;

import java.util.Locale;

/**
 * 상점의 전역 고유 식별자.
 *
 * <p>ShopId는 메타데이터 파일 이름({@code {id}-metadata.json})과
 * 백엔드 네임스페이스({@code shop-{id}})에 그대로 사용되므로,
 * 경로 구분자나 점(.)을 허용하지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ShopId implements Comparable<ShopId> {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private ShopId(String value) {
        if (value == null || value.isBlank()) {
            throw new ShopValidationException("shop id cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new ShopValidationException("shop id length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new ShopValidationException(
                "shop id contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed: " + value
            );
        }
        this.value = value;
    }

    /**
     * ShopId 생성.
     *
     * @param value ShopId 값
     * @return ShopId 인스턴스
     * @throws ShopValidationException 유효하지 않은 값인 경우
     */
    public static ShopId of(String value) {
        return new ShopId(value);
    }

    /**
     * 상점 이름으로부터 URL용 slug를 만듭니다.
     *
     * <p>소문자 변환, 공백은 하이픈으로, 그 외 허용되지 않는 문자는 제거,
     * 연속 하이픈은 하나로 합치고 양 끝 하이픈은 제거합니다.
     * 예: {@code "Alice's Goods"} → {@code "alices-goods"}</p>
     *
     * @param name 상점 이름
     * @return slug (이름에 쓸 수 있는 문자가 없으면 빈 문자열)
     */
    public static String slugOf(String name) {
        if (name == null) {
            return "";
        }
        String slug = name.toLowerCase(Locale.ROOT)
            .replace(' ', '-')
            .replaceAll("[^a-z0-9-]", "")
            .replaceAll("-+", "-");
        return trimHyphens(slug);
    }

    private static String trimHyphens(String slug) {
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }

    /**
     * ShopId 값 조회.
     *
     * @return ShopId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ShopId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ShopId shopId = (ShopId) o;
        return value.equals(shopId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
