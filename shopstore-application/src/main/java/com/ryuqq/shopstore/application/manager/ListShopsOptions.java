package com.ryuqq.shopstore.application.manager;

/**
 * 목록 조회 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>owner: 소유자 필터 (null이면 필터 없음). 페이지를 자른 뒤 조회한 결과에 적용됨</li>
 *   <li>limit: 페이지 크기 (0이면 매니저 기본값, 기본 100)</li>
 *   <li>offset: 시작 위치 (기본 0)</li>
 *   <li>sortBy: 정렬 기준 (기본 NAME)</li>
 *   <li>descending: 내림차순 여부 (기본 false)</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 소유자 필터는 페이지네이션 이후에 적용되므로,
 * 필터가 있으면 한 페이지에 limit보다 적은 결과가 나올 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param owner 소유자 필터 (nullable)
 * @param limit 페이지 크기 (0 이상, 0은 기본값 사용)
 * @param offset 시작 위치 (0 이상)
 * @param sortBy 정렬 기준 (null 불가)
 * @param descending 내림차순 여부
 */
public record ListShopsOptions(
    String owner,
    int limit,
    int offset,
    SortField sortBy,
    boolean descending
) {

    /** 매니저 설정의 기본 페이지 크기를 사용. */
    public static final int DEFAULT_LIMIT = 0;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: owner=null, limit=기본값, offset=0, sortBy=NAME, descending=false</p>
     */
    public ListShopsOptions() {
        this(null, DEFAULT_LIMIT, 0, SortField.NAME, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ListShopsOptions {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative (current: " + limit + ")");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative (current: " + offset + ")");
        }
        if (sortBy == null) {
            throw new IllegalArgumentException("sortBy cannot be null");
        }
    }

    public boolean hasOwnerFilter() {
        return owner != null && !owner.isBlank();
    }

    /**
     * owner만 변경한 새 인스턴스 생성.
     */
    public ListShopsOptions withOwner(String owner) {
        return new ListShopsOptions(owner, limit, offset, sortBy, descending);
    }

    /**
     * limit만 변경한 새 인스턴스 생성.
     */
    public ListShopsOptions withLimit(int limit) {
        return new ListShopsOptions(owner, limit, offset, sortBy, descending);
    }

    /**
     * offset만 변경한 새 인스턴스 생성.
     */
    public ListShopsOptions withOffset(int offset) {
        return new ListShopsOptions(owner, limit, offset, sortBy, descending);
    }

    /**
     * sortBy만 변경한 새 인스턴스 생성.
     */
    public ListShopsOptions withSortBy(SortField sortBy) {
        return new ListShopsOptions(owner, limit, offset, sortBy, descending);
    }

    /**
     * descending만 변경한 새 인스턴스 생성.
     */
    public ListShopsOptions withDescending(boolean descending) {
        return new ListShopsOptions(owner, limit, offset, sortBy, descending);
    }
}
