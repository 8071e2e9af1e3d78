package com.ryuqq.shopstore.application.registry;

import com.ryuqq.shopstore.core.exception.AggregateShopException;
import com.ryuqq.shopstore.core.exception.HandleNotOpenException;
import com.ryuqq.shopstore.core.exception.ShopNotFoundException;
import com.ryuqq.shopstore.core.exception.StoreUnavailableException;
import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopMetadata;
import com.ryuqq.shopstore.core.spi.DocumentHandle;
import com.ryuqq.shopstore.core.spi.DocumentStore;
import com.ryuqq.shopstore.core.spi.DocumentStoreException;
import com.ryuqq.shopstore.core.spi.MetadataIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * StoreHandleRegistry 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>open-or-create 분기와 메타데이터 기록 순서</li>
 *   <li>load 실패 시 핸들 정리</li>
 *   <li>같은 id 동시 miss의 single-flight</li>
 *   <li>close / repair / reconnectAll / reloadAll / attach</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StoreHandleRegistryTest {

    private static final ShopId SHOP = ShopId.of("s1");
    private static final String ADDRESS = "/mem/1/shop-s1";

    @Mock
    private DocumentStore documentStore;

    @Mock
    private MetadataIndex metadataIndex;

    @Mock
    private DocumentHandle handle;

    private StoreHandleRegistry registry;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);
        registry = new StoreHandleRegistry(documentStore, metadataIndex, clock);
    }

    // ============================================================
    // 1. getOrCreate
    // ============================================================

    @Test
    void getOrCreate_주소가_있으면_열고_로드한_뒤_캐시함() {
        // given
        when(metadataIndex.find(SHOP)).thenReturn(Optional.of(new ShopMetadata("s1", "n", "o", ADDRESS)));
        when(documentStore.open(ADDRESS, false)).thenReturn(handle);

        // when
        DocumentHandle first = registry.getOrCreate(SHOP);
        DocumentHandle second = registry.getOrCreate(SHOP);

        // then
        assertThat(first).isSameAs(handle);
        assertThat(second).isSameAs(handle);
        verify(documentStore, times(1)).open(ADDRESS, false);
        verify(handle).load(DocumentHandle.FULL_DEPTH);
        verify(documentStore, never()).create(anyString());
        assertThat(registry.isOpen(SHOP)).isTrue();
    }

    @Test
    void getOrCreate_주소가_없으면_생성하고_주소를_load보다_먼저_기록함() {
        // given
        when(metadataIndex.find(SHOP)).thenReturn(Optional.empty());
        when(documentStore.create("shop-s1")).thenReturn(handle);
        when(handle.address()).thenReturn(ADDRESS);

        // when
        registry.getOrCreate(SHOP);

        // then
        InOrder inOrder = inOrder(documentStore, metadataIndex, handle);
        inOrder.verify(documentStore).create("shop-s1");
        ArgumentCaptor<ShopMetadata> saved = ArgumentCaptor.forClass(ShopMetadata.class);
        inOrder.verify(metadataIndex).save(saved.capture());
        inOrder.verify(handle).load(DocumentHandle.FULL_DEPTH);

        assertThat(saved.getValue().id()).isEqualTo("s1");
        assertThat(saved.getValue().storageAddress()).isEqualTo(ADDRESS);
    }

    @Test
    void getOrCreate_기존_메타데이터의_이름과_소유자를_유지하며_주소를_기록함() {
        // given
        when(metadataIndex.find(SHOP)).thenReturn(Optional.of(new ShopMetadata("s1", "Name", "0x1", null)));
        when(documentStore.create("shop-s1")).thenReturn(handle);
        when(handle.address()).thenReturn(ADDRESS);

        // when
        registry.getOrCreate(SHOP);

        // then
        verify(metadataIndex).save(new ShopMetadata("s1", "Name", "0x1", ADDRESS));
    }

    @Test
    void getOrCreate_load_실패시_핸들을_닫고_StoreUnavailable을_던짐() {
        // given
        when(metadataIndex.find(SHOP)).thenReturn(Optional.of(new ShopMetadata("s1", "n", "o", ADDRESS)));
        when(documentStore.open(ADDRESS, false)).thenReturn(handle);
        doThrow(new DocumentStoreException("corrupt log")).when(handle).load(DocumentHandle.FULL_DEPTH);

        // when & then
        assertThatThrownBy(() -> registry.getOrCreate(SHOP))
            .isInstanceOf(StoreUnavailableException.class)
            .hasCauseInstanceOf(DocumentStoreException.class);
        verify(handle).close();
        assertThat(registry.isOpen(SHOP)).isFalse();
    }

    @Test
    void getOrCreate_open_실패시_StoreUnavailable을_던짐() {
        // given
        when(metadataIndex.find(SHOP)).thenReturn(Optional.of(new ShopMetadata("s1", "n", "o", ADDRESS)));
        when(documentStore.open(ADDRESS, false)).thenThrow(new DocumentStoreException("no such store"));

        // when & then
        assertThatThrownBy(() -> registry.getOrCreate(SHOP))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining(ADDRESS);
        assertThat(registry.size()).isZero();
    }

    @Test
    void getOrCreate_메타데이터_기록_실패시_새_핸들을_닫음() {
        // given
        when(metadataIndex.find(SHOP)).thenReturn(Optional.empty());
        when(documentStore.create("shop-s1")).thenReturn(handle);
        when(handle.address()).thenReturn(ADDRESS);
        doThrow(new IllegalStateException("disk full")).when(metadataIndex).save(any());

        // when & then
        assertThatThrownBy(() -> registry.getOrCreate(SHOP))
            .isInstanceOf(IllegalStateException.class);
        verify(handle).close();
        verify(handle, never()).load(anyInt());
    }

    @Test
    void getOrCreate_같은_id_동시_호출은_한_번만_엶() throws Exception {
        // given
        int threads = 8;
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch release = new CountDownLatch(1);
        when(metadataIndex.find(SHOP)).thenReturn(Optional.of(new ShopMetadata("s1", "n", "o", ADDRESS)));
        when(documentStore.open(ADDRESS, false)).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return handle;
        });

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<DocumentHandle>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    return registry.getOrCreate(SHOP);
                }));
            }

            // when
            ready.await(5, TimeUnit.SECONDS);
            Thread.sleep(50);
            release.countDown();

            // then
            for (Future<DocumentHandle> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(handle);
            }
        } finally {
            pool.shutdownNow();
        }
        verify(documentStore, times(1)).open(ADDRESS, false);
        verify(handle, times(1)).load(DocumentHandle.FULL_DEPTH);
    }

    // ============================================================
    // 2. close
    // ============================================================

    @Test
    void close_두번째_호출은_HandleNotOpen을_던짐() {
        // given
        when(metadataIndex.find(SHOP)).thenReturn(Optional.of(new ShopMetadata("s1", "n", "o", ADDRESS)));
        when(documentStore.open(ADDRESS, false)).thenReturn(handle);
        registry.getOrCreate(SHOP);

        // when
        registry.close(SHOP);

        // then
        verify(handle).close();
        assertThatThrownBy(() -> registry.close(SHOP))
            .isInstanceOf(HandleNotOpenException.class)
            .hasMessageContaining("not open");
    }

    @Test
    void close_열린적_없는_id는_HandleNotOpen을_던짐() {
        assertThatThrownBy(() -> registry.close(SHOP))
            .isInstanceOf(HandleNotOpenException.class);
    }

    // ============================================================
    // 3. repair
    // ============================================================

    @Test
    void repair_메타데이터가_없으면_ShopNotFound를_던짐() {
        // given
        when(metadataIndex.find(SHOP)).thenReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> registry.repair(SHOP))
            .isInstanceOf(ShopNotFoundException.class);
    }

    @Test
    void repair_열린_핸들을_닫고_createIfMissing으로_다시_엶() {
        // given
        DocumentHandle repaired = mock(DocumentHandle.class);
        when(metadataIndex.find(SHOP)).thenReturn(Optional.of(new ShopMetadata("s1", "n", "o", ADDRESS)));
        when(documentStore.open(ADDRESS, false)).thenReturn(handle);
        when(documentStore.open(ADDRESS, true)).thenReturn(repaired);
        registry.getOrCreate(SHOP);

        // when
        DocumentHandle result = registry.repair(SHOP);

        // then
        assertThat(result).isSameAs(repaired);
        verify(handle).close();
        verify(repaired).load(DocumentHandle.FULL_DEPTH);
        assertThat(registry.find(SHOP)).containsSame(repaired);
    }

    @Test
    void repair_로드_실패시_레지스트리에_핸들이_남지_않음() {
        // given
        when(metadataIndex.find(SHOP)).thenReturn(Optional.of(new ShopMetadata("s1", "n", "o", ADDRESS)));
        when(documentStore.open(ADDRESS, true)).thenReturn(handle);
        doThrow(new DocumentStoreException("still corrupt")).when(handle).load(DocumentHandle.FULL_DEPTH);

        // when & then
        assertThatThrownBy(() -> registry.repair(SHOP))
            .isInstanceOf(StoreUnavailableException.class);
        assertThat(registry.isOpen(SHOP)).isFalse();
    }

    @Test
    void repair_진행_중의_getOrCreate는_복구된_핸들을_받고_따로_열지_않음() throws Exception {
        // given
        DocumentHandle repaired = mock(DocumentHandle.class);
        CountDownLatch repairing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(metadataIndex.find(SHOP)).thenReturn(Optional.of(new ShopMetadata("s1", "n", "o", ADDRESS)));
        when(documentStore.open(ADDRESS, true)).thenAnswer(invocation -> {
            repairing.countDown();
            release.await(5, TimeUnit.SECONDS);
            return repaired;
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<DocumentHandle> repair = pool.submit(() -> registry.repair(SHOP));
            assertThat(repairing.await(5, TimeUnit.SECONDS)).isTrue();

            // when
            Future<DocumentHandle> reader = pool.submit(() -> registry.getOrCreate(SHOP));
            Thread.sleep(50);
            release.countDown();

            // then
            assertThat(repair.get(5, TimeUnit.SECONDS)).isSameAs(repaired);
            assertThat(reader.get(5, TimeUnit.SECONDS)).isSameAs(repaired);
        } finally {
            pool.shutdownNow();
        }
        verify(documentStore, never()).open(ADDRESS, false);
        verify(repaired, never()).close();
        assertThat(registry.find(SHOP)).containsSame(repaired);
    }

    // ============================================================
    // 4. reconnectAll / reloadAll
    // ============================================================

    @Test
    void reconnectAll_일부_실패는_요약에_담고_계속_진행함() {
        // given
        ShopId a = ShopId.of("a");
        ShopId b = ShopId.of("b");
        ShopId c = ShopId.of("c");
        when(metadataIndex.listIds()).thenReturn(List.of(a, b, c));
        when(metadataIndex.find(a)).thenReturn(Optional.of(new ShopMetadata("a", "A", "o", "/mem/a")));
        when(metadataIndex.find(b)).thenReturn(Optional.of(new ShopMetadata("b", "B", "o", "/mem/b")));
        when(metadataIndex.find(c)).thenReturn(Optional.of(new ShopMetadata("c", "C", "o", null)));
        when(documentStore.open("/mem/a", false)).thenReturn(handle);
        when(documentStore.open("/mem/b", false)).thenThrow(new DocumentStoreException("gone"));

        // when
        ReconnectSummary summary = registry.reconnectAll();

        // then
        assertThat(summary.attempted()).isEqualTo(2);
        assertThat(summary.reconnected()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(summary.failures()).containsOnlyKeys("b");
        assertThat(registry.openIds()).containsExactly(a);
        verify(documentStore, never()).create(anyString());
    }

    @Test
    void reconnectAll_모두_실패하면_AggregateShopException을_던짐() {
        // given
        ShopId a = ShopId.of("a");
        when(metadataIndex.listIds()).thenReturn(List.of(a));
        when(metadataIndex.find(a)).thenReturn(Optional.of(new ShopMetadata("a", "A", "o", "/mem/a")));
        when(documentStore.open("/mem/a", false)).thenThrow(new DocumentStoreException("gone"));

        // when & then
        assertThatThrownBy(() -> registry.reconnectAll())
            .isInstanceOf(AggregateShopException.class)
            .satisfies(e -> assertThat(((AggregateShopException) e).getFailures()).containsOnlyKeys("a"));
    }

    @Test
    void reconnectAll_메타데이터가_비어있으면_아무것도_하지_않음() {
        // given
        when(metadataIndex.listIds()).thenReturn(List.of());

        // when
        ReconnectSummary summary = registry.reconnectAll();

        // then
        assertThat(summary.attempted()).isZero();
        assertThat(summary.hasFailures()).isFalse();
    }

    @Test
    void reloadAll_열린_핸들을_닫고_다시_엶() {
        // given
        DocumentHandle reopened = mock(DocumentHandle.class);
        when(metadataIndex.find(SHOP)).thenReturn(Optional.of(new ShopMetadata("s1", "n", "o", ADDRESS)));
        when(documentStore.open(ADDRESS, false)).thenReturn(handle, reopened);
        when(metadataIndex.listIds()).thenReturn(List.of(SHOP));
        registry.getOrCreate(SHOP);

        // when
        ReconnectSummary summary = registry.reloadAll();

        // then
        verify(handle).close();
        assertThat(summary.reconnected()).isEqualTo(1);
        assertThat(registry.find(SHOP)).containsSame(reopened);
    }

    // ============================================================
    // 5. attach / snapshot
    // ============================================================

    @Test
    void attach_주소가_오래되었으면_새_저장소를_만들고_주소를_기록함() {
        // given
        DocumentHandle created = mock(DocumentHandle.class);
        when(documentStore.open("/stale")).thenThrow(new DocumentStoreException("unknown address"));
        when(metadataIndex.find(SHOP)).thenReturn(Optional.empty());
        when(documentStore.create("shop-s1")).thenReturn(created);
        when(created.address()).thenReturn("/mem/new/shop-s1");

        // when
        DocumentHandle result = registry.attach(SHOP, "/stale");

        // then
        assertThat(result).isSameAs(created);
        verify(metadataIndex).save(ShopMetadata.addressOnly(SHOP, "/mem/new/shop-s1"));
        verify(created).load(DocumentHandle.FULL_DEPTH);
    }

    @Test
    void snapshot_열린_핸들_정보를_반환함() {
        // given
        when(metadataIndex.find(SHOP)).thenReturn(Optional.of(new ShopMetadata("s1", "n", "o", ADDRESS)));
        when(documentStore.open(ADDRESS, false)).thenReturn(handle);
        when(handle.address()).thenReturn(ADDRESS);
        registry.getOrCreate(SHOP);

        // when
        List<HandleInfo> infos = registry.snapshot();

        // then
        assertThat(infos).containsExactly(new HandleInfo(SHOP, ADDRESS, Instant.parse("2024-03-01T00:00:00Z")));
        assertThat(registry.closeAll()).isEqualTo(1);
        assertThat(registry.size()).isZero();
    }
}
