package com.ryuqq.shopstore.core.model;

/**
 * 상점에 연결되는 외부 에셋 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AssetType {

    /** 상점 로고 (최대 1개) */
    LOGO,

    /** 상품 이미지 (여러 개) */
    ITEM_IMAGE
}
