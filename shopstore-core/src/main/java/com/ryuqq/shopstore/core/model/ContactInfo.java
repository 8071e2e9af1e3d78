package com.ryuqq.shopstore.core.model;

/**
 * 상점 연락처.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ContactInfo(String email, String phone, String location) {

    public static final ContactInfo EMPTY = new ContactInfo(null, null, null);
}
