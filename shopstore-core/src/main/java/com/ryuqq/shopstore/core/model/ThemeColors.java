package com.ryuqq.shopstore.core.model;

/**
 * 상점 테마 색상 ({@code #rrggbb}).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ThemeColors(String primaryColor, String secondaryColor, String tertiaryColor) {

    public static final ThemeColors DEFAULT = new ThemeColors("#000000", "#ffffff", "#808080");
}
