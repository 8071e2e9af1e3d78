package com.ryuqq.shopstore.application.manager;

import com.ryuqq.shopstore.core.model.ShopRecord;

import java.util.Comparator;
import java.util.Locale;

/**
 * 목록 정렬 기준.
 *
 * <p>모든 비교자는 id를 마지막 기준으로 사용하므로 순서가 항상 결정적입니다.
 * {@link #NONE}은 정렬하지 않습니다 (조회 완료 순서).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SortField {

    NAME,
    ID,
    OWNER,
    NONE;

    private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());
    private static final Comparator<ShopRecord> BY_ID = Comparator.comparing(ShopRecord::getId, NULLS_FIRST);

    /**
     * 정렬 비교자.
     *
     * @param descending 내림차순 여부
     * @return 비교자, {@link #NONE}이면 null
     */
    public Comparator<ShopRecord> comparator(boolean descending) {
        Comparator<ShopRecord> comparator;
        switch (this) {
            case NAME:
                comparator = Comparator.comparing(ShopRecord::getName, NULLS_FIRST).thenComparing(BY_ID);
                break;
            case OWNER:
                comparator = Comparator.comparing(ShopRecord::getOwner, NULLS_FIRST).thenComparing(BY_ID);
                break;
            case ID:
                comparator = BY_ID;
                break;
            default:
                return null;
        }
        return descending ? comparator.reversed() : comparator;
    }

    /**
     * 문자열에서 변환.
     *
     * <p>null 또는 빈 문자열은 {@link #NONE}, 알 수 없는 값은 {@link #NAME}.</p>
     */
    public static SortField from(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "id":
                return ID;
            case "owner":
                return OWNER;
            case "none":
                return NONE;
            default:
                return NAME;
        }
    }
}
