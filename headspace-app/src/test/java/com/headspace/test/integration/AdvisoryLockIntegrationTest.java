package com.headspace.test.integration;

import com.headspace.Application;
import com.headspace.domain.lock.adapter.repository.IAdvisoryLockCatalogRepository;
import com.headspace.domain.lock.model.valobj.HeldAdvisoryLockVO;
import com.headspace.domain.lock.model.valobj.LockHandle;
import com.headspace.domain.lock.model.valobj.LockKey;
import com.headspace.domain.lock.service.AdvisoryLockManager;
import com.headspace.types.enums.LockNamespaceEnum;
import com.headspace.types.exception.LockReentrancyException;
import com.headspace.types.exception.LockTimeoutException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@SpringBootTest(
        classes = Application.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "spring.task.scheduling.enabled=false"
        }
)
@EnabledIfSystemProperty(named = "it.docker.enabled", matches = "true")
public class AdvisoryLockIntegrationTest extends PostgresIntegrationTestSupport {

    @Autowired
    private AdvisoryLockManager lockManager;

    @Autowired
    private IAdvisoryLockCatalogRepository lockCatalogRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Test
    public void shouldSerializeHoldersAcrossSessions() throws Exception {
        int workers = 6;
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch ready = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                futures.add(executor.submit(() -> {
                    ready.await();
                    try (LockHandle ignored = lockManager.acquireBlocking(LockNamespaceEnum.AGENT, 101L,
                            Duration.ofSeconds(10))) {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        Thread.sleep(40L);
                        inside.decrementAndGet();
                    }
                    return null;
                }));
            }
            ready.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        Assertions.assertEquals(1, maxInside.get());
        Assertions.assertTrue(heldLocks(101L).isEmpty());
    }

    @Test
    public void shouldTimeOutAndLeaveNoSessionBehind() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (LockHandle held = lockManager.acquireBlocking(LockNamespaceEnum.AGENT, 102L, Duration.ofSeconds(5))) {
            Assertions.assertTrue(held.isAcquired());

            Future<Throwable> contender = executor.submit(() -> {
                try (LockHandle ignored = lockManager.acquireBlocking(LockNamespaceEnum.AGENT, 102L,
                        Duration.ofMillis(300))) {
                    return null;
                } catch (Throwable ex) {
                    return ex;
                }
            });

            Throwable failure = contender.get(10, TimeUnit.SECONDS);
            Assertions.assertTrue(failure instanceof LockTimeoutException);
            Assertions.assertEquals(1, heldLocks(102L).size());
        } finally {
            executor.shutdownNow();
        }

        try (LockHandle again = lockManager.acquireBlocking(LockNamespaceEnum.AGENT, 102L, Duration.ofSeconds(1))) {
            Assertions.assertTrue(again.isAcquired());
        }
        Assertions.assertTrue(heldLocks(102L).isEmpty());
    }

    @Test
    public void shouldFailFastOnReentryAndSkipWhenBusy() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (LockHandle held = lockManager.acquireBlocking(LockNamespaceEnum.AGENT, 103L, Duration.ofSeconds(5))) {
            long start = System.nanoTime();
            Assertions.assertThrows(LockReentrancyException.class,
                    () -> lockManager.acquireBlocking(LockNamespaceEnum.AGENT, 103L, Duration.ofSeconds(5)));
            Assertions.assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(1));

            LockHandle reentry = lockManager.acquireNonBlocking(LockNamespaceEnum.AGENT, 103L);
            Assertions.assertFalse(reentry.isAcquired());

            Boolean otherThreadAcquired = executor.submit(() -> {
                try (LockHandle attempt = lockManager.acquireNonBlocking(LockNamespaceEnum.AGENT, 103L)) {
                    return attempt.isAcquired();
                }
            }).get(5, TimeUnit.SECONDS);
            Assertions.assertFalse(otherThreadAcquired);
            Assertions.assertTrue(held.isAcquired());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void shouldKeepLockAcrossRolledBackTransaction() {
        try (LockHandle held = lockManager.acquireBlocking(LockNamespaceEnum.AGENT, 104L, Duration.ofSeconds(5))) {
            Assertions.assertThrows(IllegalStateException.class, () -> transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.update("INSERT INTO agents (session_uuid, started_at, last_seen_at, created_at, updated_at) "
                        + "VALUES ('rollback-me', now(), now(), now(), now())");
                throw new IllegalStateException("rollback");
            }));

            Integer agents = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM agents", Integer.class);
            Assertions.assertEquals(0, agents);
            Assertions.assertTrue(lockManager.isHeldByCurrentThread(LockKey.of(LockNamespaceEnum.AGENT, 104L)));
            Assertions.assertEquals(1, heldLocks(104L).size());
            Assertions.assertTrue(held.isAcquired());
        }
        Assertions.assertTrue(heldLocks(104L).isEmpty());
    }

    private List<HeldAdvisoryLockVO> heldLocks(long entityId) {
        List<HeldAdvisoryLockVO> result = new ArrayList<>();
        for (HeldAdvisoryLockVO lock : lockCatalogRepository.findHeldLocks()) {
            if (Integer.valueOf(LockNamespaceEnum.AGENT.getCode()).equals(lock.getNamespace())
                    && Long.valueOf(entityId).equals(lock.getEntityId())
                    && Boolean.TRUE.equals(lock.getGranted())) {
                result.add(lock);
            }
        }
        return result;
    }
}
