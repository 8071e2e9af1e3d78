package com.ryuqq.shopstore.adapter.file.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.shopstore.adapter.file.json.ShopStoreJson;
import com.ryuqq.shopstore.core.document.ShopExport;
import com.ryuqq.shopstore.core.exception.ShopValidationException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 상점 이관 번들 JSON 코덱.
 *
 * <p>형식: {@code {"shopData": {...}, "metadata": {...}}} (들여쓰기 포함).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JsonShopExportCodec {

    private final ObjectMapper objectMapper;

    public JsonShopExportCodec() {
        this(ShopStoreJson.newObjectMapper());
    }

    public JsonShopExportCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    public String encode(ShopExport export) {
        if (export == null) {
            throw new IllegalArgumentException("export cannot be null");
        }
        try {
            return objectMapper.writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode export of shop " + export.shopData().id(), e);
        }
    }

    /**
     * JSON 번들 해석.
     *
     * @throws ShopValidationException 형식이 잘못되었거나 shopData가 없는 경우
     */
    public ShopExport decode(String json) {
        if (json == null || json.isBlank()) {
            throw new ShopValidationException("export bundle cannot be empty");
        }
        try {
            return objectMapper.readValue(json, ShopExport.class);
        } catch (JsonProcessingException e) {
            throw new ShopValidationException("invalid export bundle: " + e.getOriginalMessage(), e);
        }
    }

    public void write(ShopExport export, Path file) {
        try {
            Files.writeString(file, encode(export), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write export bundle to " + file, e);
        }
    }

    public ShopExport read(Path file) {
        try {
            return decode(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read export bundle from " + file, e);
        }
    }
}
