package taskescrow.registry.service;

import taskescrow.registry.core.TaskEventBus;
import taskescrow.registry.error.RegistryError;
import taskescrow.registry.error.RegistryException;
import taskescrow.registry.funds.AccountLedger;
import taskescrow.registry.model.CompletionResult;
import taskescrow.registry.model.TaskStatus;
import taskescrow.registry.store.Database;
import taskescrow.registry.store.JdbcParticipantRepository;
import taskescrow.registry.store.JdbcPlatformRepository;
import taskescrow.registry.store.JdbcTaskRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Races between callers hitting the same registry from many threads.
 */
class TaskRegistryConcurrencyTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant DEADLINE = NOW.plus(Duration.ofDays(1));
    private static final int THREADS = 8;

    private Database db;
    private AccountLedger ledger;
    private TaskRegistry registry;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-concurrency-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", THREADS);
        JdbcPlatformRepository platformRepository = new JdbcPlatformRepository(db);
        platformRepository.initialize("owner", 5);
        ledger = new AccountLedger();

        registry = new TaskRegistry(db,
                new JdbcTaskRepository(db),
                new JdbcParticipantRepository(db),
                platformRepository,
                ledger,
                new TaskEventBus(),
                new MutableClock(NOW));
        pool = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() throws Exception {
        pool.shutdownNow();
        pool.awaitTermination(5, TimeUnit.SECONDS);
        db.close();
    }

    @Test
    @Timeout(30)
    void concurrentCreatesGetDistinctSequentialIds() throws Exception {
        int perThread = 10;
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Long>>> futures = new ArrayList<>();

        for (int t = 0; t < THREADS; t++) {
            String client = "client-" + t;
            futures.add(pool.submit(() -> {
                start.await();
                List<Long> ids = new ArrayList<>();
                for (int i = 0; i < perThread; i++) {
                    ids.add(registry.createTask("task", "", DEADLINE, 10, client));
                }
                return ids;
            }));
        }
        start.countDown();

        Set<Long> all = new HashSet<>();
        for (Future<List<Long>> f : futures) {
            all.addAll(f.get());
        }

        int total = THREADS * perThread;
        assertEquals(total, all.size());
        for (long id = 1; id <= total; id++) {
            assertTrue(all.contains(id), "missing id " + id);
        }
        assertEquals(total, registry.getTotalTasks());
        assertEquals(total * 10L, registry.getPlatformState().heldBalance());
    }

    @Test
    @Timeout(30)
    void exactlyOneFreelancerWinsTheRace() throws Exception {
        long id = registry.createTask("contested", "", DEADLINE, 100, "alice");
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        AtomicInteger invalidState = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < THREADS; t++) {
            String freelancer = "freelancer-" + t;
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    registry.acceptTask(id, freelancer);
                    winners.incrementAndGet();
                } catch (RegistryException e) {
                    if (e.error() == RegistryError.INVALID_STATE) {
                        invalidState.incrementAndGet();
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get();
        }

        assertEquals(1, winners.get());
        assertEquals(THREADS - 1, invalidState.get());
        assertEquals(TaskStatus.ASSIGNED, registry.getTask(id).status());
    }

    @Test
    @Timeout(30)
    void cancelRacingAcceptHasSingleOutcome() throws Exception {
        long id = registry.createTask("contested", "", DEADLINE, 100, "alice");
        CountDownLatch start = new CountDownLatch(1);

        Future<Boolean> accept = pool.submit(() -> {
            start.await();
            try {
                registry.acceptTask(id, "bob");
                return true;
            } catch (RegistryException e) {
                return false;
            }
        });
        Future<Boolean> cancel = pool.submit(() -> {
            start.await();
            try {
                registry.cancelTask(id, "alice");
                return true;
            } catch (RegistryException e) {
                return false;
            }
        });
        start.countDown();

        assertTrue(accept.get() ^ cancel.get());
        TaskStatus status = registry.getTask(id).status();
        if (cancel.get()) {
            assertEquals(TaskStatus.CANCELLED, status);
            assertEquals(100, ledger.balanceOf("alice"));
        } else {
            assertEquals(TaskStatus.ASSIGNED, status);
            assertEquals(0, ledger.balanceOf("alice"));
        }
    }

    @Test
    @Timeout(30)
    void concurrentApprovalsPayOnce() throws Exception {
        long id = registry.createTask("payout", "", DEADLINE, 100, "alice");
        registry.acceptTask(id, "bob");
        registry.completeTask(id, "bob");

        CountDownLatch start = new CountDownLatch(1);
        List<Future<CompletionResult>> futures = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    return registry.completeTask(id, "alice");
                } catch (RegistryException e) {
                    return null;
                }
            }));
        }
        start.countDown();

        int completed = 0;
        for (Future<CompletionResult> f : futures) {
            if (f.get() == CompletionResult.COMPLETED) {
                completed++;
            }
        }

        assertEquals(1, completed);
        assertEquals(95, ledger.balanceOf("bob"));
        assertEquals(5, ledger.balanceOf("owner"));
        assertEquals(0, registry.getPlatformState().heldBalance());
    }
}
