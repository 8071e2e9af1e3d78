package com.ryuqq.shopstore.core.model;

import com.ryuqq.shopstore.core.exception.ShopValidationException;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * 영속화 직전 레코드 검증.
 *
 * <ul>
 *   <li>id: {@link ShopId} 규칙</li>
 *   <li>owner, name: 비어 있으면 안 됨</li>
 *   <li>상품: 이름 필수, 가격 0 이상</li>
 *   <li>테마 색상: 값이 있으면 {@code #rrggbb}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ShopRecordValidator {

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9a-fA-F]{6}$");

    private ShopRecordValidator() {
    }

    /**
     * 레코드 검증.
     *
     * @param record 검증할 레코드
     * @return 검증된 id
     * @throws ShopValidationException 불변식 위반 시
     */
    public static ShopId validate(ShopRecord record) {
        if (record == null) {
            throw new ShopValidationException("shop record cannot be null");
        }
        ShopId shopId = ShopId.of(record.getId());
        if (isBlank(record.getOwner())) {
            throw new ShopValidationException("shop owner is required: " + shopId);
        }
        if (isBlank(record.getName())) {
            throw new ShopValidationException("shop name is required: " + shopId);
        }
        ShopContent content = record.getContent();
        if (content != null) {
            for (LineItem item : content.getItems()) {
                validateItem(shopId, item);
            }
            validateTheme(shopId, content.getTheme());
        }
        return shopId;
    }

    private static void validateItem(ShopId shopId, LineItem item) {
        if (item == null) {
            throw new ShopValidationException("item cannot be null: " + shopId);
        }
        if (isBlank(item.name())) {
            throw new ShopValidationException("item name is required: " + shopId);
        }
        if (item.price() != null && item.price().compareTo(BigDecimal.ZERO) < 0) {
            throw new ShopValidationException(
                "item price must not be negative (current: " + item.price() + "): " + shopId
            );
        }
    }

    private static void validateTheme(ShopId shopId, ThemeColors theme) {
        if (theme == null) {
            return;
        }
        checkColor(shopId, "primaryColor", theme.primaryColor());
        checkColor(shopId, "secondaryColor", theme.secondaryColor());
        checkColor(shopId, "tertiaryColor", theme.tertiaryColor());
    }

    private static void checkColor(ShopId shopId, String field, String value) {
        if (value != null && !HEX_COLOR.matcher(value).matches()) {
            throw new ShopValidationException(field + " must be a #rrggbb hex color (current: " + value + "): " + shopId);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
