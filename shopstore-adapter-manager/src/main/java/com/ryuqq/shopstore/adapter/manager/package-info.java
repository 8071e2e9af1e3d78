/**
 * Manager Adapter Layer - ShopManager 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.shopstore.adapter.manager.DefaultShopManager} - 캐시, 레지스트리, 메타데이터 인덱스를 조합한 파사드</li>
 *   <li>{@link com.ryuqq.shopstore.adapter.manager.ConcurrentShopFetcher} - 목록 조회용 제한 동시성 작업 풀</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-manager (DefaultShopManager)
 *   ↓ implements
 * application (ShopManager, StoreHandleRegistry, ShopCache)
 *   ↓ depends on
 * core (ShopRecord, ShopDocument, DocumentStore SPI, MetadataIndex SPI)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.shopstore.adapter.manager;
