package com.ryuqq.shopstore.application.manager;

import com.ryuqq.shopstore.application.registry.HandleInfo;
import com.ryuqq.shopstore.application.registry.ReconnectSummary;
import com.ryuqq.shopstore.core.document.ShopExport;
import com.ryuqq.shopstore.core.model.AssetType;
import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopRecord;

import java.util.List;

/**
 * 상점 저장소 파사드.
 *
 * <p>레지스트리, 캐시, 메타데이터 인덱스를 조합하여 단건 CRUD, 목록 조회,
 * 저장소 생명주기 작업을 제공합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (ShopManager manager = new DefaultShopManager(documentStore, metadataIndex)) {
 *     manager.start();
 *
 *     ShopRecord created = manager.createShop(ShopRecord.of("alice-shop", "0xABC", "Alice's Goods"));
 *     ShopRecord loaded = manager.getShop(ShopId.of("alice-shop"));
 *
 *     List&lt;ShopRecord&gt; page = manager.listShops(new ListShopsOptions().withLimit(20));
 * }
 * </pre>
 *
 * <p><strong>격리:</strong> 반환되는 레코드는 항상 독립된 복사본입니다.
 * 호출자가 수정해도 캐시나 저장소에 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ShopManager extends AutoCloseable {

    /**
     * 재연결 스캔을 실행합니다. 실패는 로그로만 남깁니다.
     */
    void start();

    /**
     * 상점 조회 (캐시 → 메타데이터 → 저장소).
     *
     * @throws com.ryuqq.shopstore.core.exception.ShopNotFoundException 메타데이터나 문서가 없는 경우
     * @throws com.ryuqq.shopstore.core.exception.StoreUnavailableException 저장소를 열 수 없는 경우
     */
    ShopRecord getShop(ShopId shopId);

    /**
     * 신규 생성. created와 updated는 현재 시각으로 설정됩니다.
     *
     * @return 저장된 레코드
     * @throws com.ryuqq.shopstore.core.exception.ShopValidationException 검증 실패 시
     * @throws com.ryuqq.shopstore.core.exception.ShopAlreadyExistsException 이미 문서가 있는 경우
     */
    ShopRecord createShop(ShopRecord record);

    /**
     * 수정. 저장된 문서의 created를 유지하고 updated만 갱신합니다.
     *
     * @return 저장된 레코드
     * @throws com.ryuqq.shopstore.core.exception.ShopNotFoundException 기존 문서가 없는 경우
     */
    ShopRecord updateShop(ShopRecord record);

    /**
     * 있으면 수정, 없으면 생성.
     */
    ShopRecord saveShop(ShopRecord record);

    /**
     * 삭제. 문서 삭제 → 캐시 제거 → 핸들 닫기 → 메타데이터 삭제 순서.
     *
     * @throws com.ryuqq.shopstore.core.exception.ShopNotFoundException 메타데이터가 없는 경우
     */
    void deleteShop(ShopId shopId);

    /**
     * 목록 조회. 페이지를 먼저 자르고, 제한된 동시성으로 조회한 뒤 소유자 필터와 정렬을 적용합니다.
     *
     * <p>일부 조회 실패는 허용합니다 (로그). 소유자 필터 이후 남은 결과가 없고
     * 실패가 하나라도 있으면 예외가 발생합니다.</p>
     *
     * @throws com.ryuqq.shopstore.core.exception.AggregateShopException 필터 이후 결과가 없고 조회 실패가 있는 경우
     */
    List<ShopRecord> listShops(ListShopsOptions options);

    /**
     * 소유자의 상점 목록 (기본 페이지, 이름순).
     */
    List<ShopRecord> listShopsByOwner(String owner);

    /**
     * 메타데이터 기준 상점 수.
     */
    int countShops();

    /**
     * 에셋 연결 후 저장.
     */
    ShopRecord addAsset(ShopId shopId, AssetType type, String ref);

    /**
     * 에셋 연결 해제 후 저장.
     */
    ShopRecord removeAsset(ShopId shopId, AssetType type, String ref);

    /**
     * 문서와 메타데이터를 번들로 내보냅니다.
     */
    ShopExport exportShop(ShopId shopId);

    /**
     * 번들을 가져옵니다. 주소가 없거나 오래되었으면 새 저장소를 만듭니다.
     *
     * @return 가져온 레코드
     */
    ShopRecord importShop(ShopExport export);

    ReconnectSummary reconnectAll();

    ReconnectSummary reloadAll();

    /**
     * 저장소 복구 (닫고, create-if-missing으로 다시 열고, 로드).
     */
    void repairStore(ShopId shopId);

    /**
     * 저장소 핸들 닫기. 열려 있지 않으면 {@link com.ryuqq.shopstore.core.exception.HandleNotOpenException}.
     */
    void closeStore(ShopId shopId);

    DatabaseStatus databaseStatus(ShopId shopId);

    DatabaseStats databaseStats();

    List<HandleInfo> connectedStores();

    /**
     * 모든 핸들을 닫고 캐시를 비우고 작업 스레드를 종료합니다.
     */
    @Override
    void close();
}
