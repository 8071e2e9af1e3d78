package com.ryuqq.shopstore.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 콘텐츠 주소 기반 에셋 참조 (로고, 상품 이미지).
 *
 * <p>가변 객체입니다. {@link #copy()}는 리스트까지 복사합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ShopAssets {

    private String logoRef;
    private final List<String> itemImageRefs;

    public ShopAssets() {
        this(null, List.of());
    }

    public ShopAssets(String logoRef, List<String> itemImageRefs) {
        this.logoRef = logoRef;
        this.itemImageRefs = itemImageRefs == null ? new ArrayList<>() : new ArrayList<>(itemImageRefs);
    }

    public String getLogoRef() {
        return logoRef;
    }

    public void setLogoRef(String logoRef) {
        this.logoRef = logoRef;
    }

    /**
     * 상품 이미지 참조 목록 (변경 가능한 내부 리스트).
     */
    public List<String> getItemImageRefs() {
        return itemImageRefs;
    }

    /**
     * 에셋 연결. LOGO는 교체, ITEM_IMAGE는 중복 없이 추가합니다.
     *
     * @param type 에셋 종류
     * @param ref 에셋 참조
     */
    public void attach(AssetType type, String ref) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (ref == null || ref.isBlank()) {
            throw new IllegalArgumentException("ref cannot be null or blank");
        }
        if (type == AssetType.LOGO) {
            logoRef = ref;
        } else if (!itemImageRefs.contains(ref)) {
            itemImageRefs.add(ref);
        }
    }

    /**
     * 에셋 연결 해제.
     *
     * @return 실제로 제거된 경우 true
     */
    public boolean detach(AssetType type, String ref) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type == AssetType.LOGO) {
            if (logoRef != null && logoRef.equals(ref)) {
                logoRef = null;
                return true;
            }
            return false;
        }
        return itemImageRefs.remove(ref);
    }

    public ShopAssets copy() {
        return new ShopAssets(logoRef, itemImageRefs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ShopAssets that = (ShopAssets) o;
        return Objects.equals(logoRef, that.logoRef) && itemImageRefs.equals(that.itemImageRefs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(logoRef, itemImageRefs);
    }
}
