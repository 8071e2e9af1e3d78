package com.ryuqq.shopstore.adapter.manager;

import com.ryuqq.shopstore.core.exception.ErrorCode;
import com.ryuqq.shopstore.core.exception.ShopStoreException;
import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * 제한된 동시성으로 여러 상점을 조회하는 작업 풀.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * fetchAll(ids, loader)
 *   ↓
 * For each id:
 *   1. semaphore.acquire() → 동시 조회 수 제한
 *   2. workers.submit(loader.apply(id))
 *      - 성공 → records에 추가 (lock)
 *      - 실패 → failures에 추가 (lock)
 *      - finally: semaphore.release(), latch.countDown()
 *   ↓
 * latch.await() → 모든 조회 완료 대기
 * </pre>
 *
 * <p><strong>취소:</strong> 호출 스레드가 인터럽트되면 새 조회를 시작하지 않고,
 * 진행 중인 조회를 인터럽트한 뒤 인터럽트 플래그를 복원하고
 * {@link ErrorCode#CANCELLED} 예외를 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConcurrentShopFetcher {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentShopFetcher.class);

    private final int concurrency;
    private final ExecutorService workers;

    /**
     * 생성자.
     *
     * @param concurrency 동시 조회 수 (작업 스레드 수와 같음)
     * @throws IllegalArgumentException concurrency가 양수가 아닌 경우
     */
    public ConcurrentShopFetcher(int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        this.concurrency = concurrency;
        AtomicInteger sequence = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(concurrency, runnable -> {
            Thread thread = new Thread(runnable, "shopstore-fetch-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 모든 id를 조회합니다. 개별 실패는 결과에 담기며 예외로 전파되지 않습니다.
     *
     * @param shopIds 조회할 id 목록
     * @param loader 단건 조회 함수
     * @return 성공 레코드와 실패 원인
     * @throws ShopStoreException 인터럽트된 경우 ({@link ErrorCode#CANCELLED})
     */
    public FetchResult fetchAll(List<ShopId> shopIds, Function<ShopId, ShopRecord> loader) {
        if (shopIds == null) {
            throw new IllegalArgumentException("shopIds cannot be null");
        }
        if (loader == null) {
            throw new IllegalArgumentException("loader cannot be null");
        }
        if (shopIds.isEmpty()) {
            return FetchResult.empty();
        }

        List<ShopRecord> records = new ArrayList<>(shopIds.size());
        Map<ShopId, Throwable> failures = new LinkedHashMap<>();
        ReentrantLock resultLock = new ReentrantLock();
        Semaphore permits = new Semaphore(concurrency);
        CountDownLatch done = new CountDownLatch(shopIds.size());
        List<Future<?>> launched = new ArrayList<>(shopIds.size());

        try {
            for (ShopId shopId : shopIds) {
                permits.acquire();
                try {
                    launched.add(workers.submit(() -> fetchOne(shopId, loader, records, failures, resultLock, permits, done)));
                } catch (RejectedExecutionException e) {
                    permits.release();
                    throw new IllegalStateException("fetcher has been shut down", e);
                }
            }
            done.await();
        } catch (InterruptedException e) {
            launched.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new ShopStoreException(ErrorCode.CANCELLED,
                "listing cancelled after launching " + launched.size() + " of " + shopIds.size() + " fetches", e);
        }

        resultLock.lock();
        try {
            return new FetchResult(records, failures);
        } finally {
            resultLock.unlock();
        }
    }

    /**
     * 작업 스레드 종료. 제한 시간 안에 끝나지 않으면 강제 종료합니다.
     *
     * @param timeout 대기 시간
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown(Duration timeout) throws InterruptedException {
        workers.shutdown();
        if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Fetch workers did not stop within {}, forcing shutdown", timeout);
            workers.shutdownNow();
        }
    }

    public boolean isShutdown() {
        return workers.isShutdown();
    }

    public int concurrency() {
        return concurrency;
    }

    private static void fetchOne(
        ShopId shopId,
        Function<ShopId, ShopRecord> loader,
        List<ShopRecord> records,
        Map<ShopId, Throwable> failures,
        ReentrantLock resultLock,
        Semaphore permits,
        CountDownLatch done
    ) {
        try {
            ShopRecord record = loader.apply(shopId);
            resultLock.lock();
            try {
                records.add(record);
            } finally {
                resultLock.unlock();
            }
        } catch (RuntimeException | Error e) {
            // Error도 실패로 기록
            log.debug("Fetch failed for shop {}: {}", shopId, e.toString());
            resultLock.lock();
            try {
                failures.put(shopId, e);
            } finally {
                resultLock.unlock();
            }
        } finally {
            permits.release();
            done.countDown();
        }
    }
}
