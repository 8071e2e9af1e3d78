package com.ryuqq.shopstore.application.manager;

/**
 * 저장소 전체 통계.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param totalStores 메타데이터 기준 전체 상점 수
 * @param loadedStores 현재 열린 저장소 수
 * @param totalRecords 열린 저장소의 문서 수 합계
 * @param averageRecordsPerStore 열린 저장소당 평균 문서 수 (열린 저장소가 없으면 0)
 */
public record DatabaseStats(int totalStores, int loadedStores, long totalRecords, double averageRecordsPerStore) {
}
