package com.toolhub.registry;

import com.toolhub.catalog.LoadMode;
import com.toolhub.catalog.ToolCatalog;
import com.toolhub.health.HealthRecord;
import com.toolhub.health.HealthTracker;
import com.toolhub.tools.ExecutionContext;
import com.toolhub.tools.ResourceCleanup;
import com.toolhub.tools.Tool;
import com.toolhub.tools.error.ErrorKind;
import com.toolhub.tools.error.ToolConfigException;
import com.toolhub.tools.error.ToolDependencyException;
import com.toolhub.tools.error.ToolError;
import com.toolhub.tools.spec.ToolSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolInstanceCacheTest {

    private ToolCatalog catalog;
    private TypeRegistry types;
    private HealthTracker health;
    private ToolInstanceCache cache;

    @BeforeEach
    void setUp() {
        catalog = new ToolCatalog();
        types = new TypeRegistry();
        health = new HealthTracker();
        cache = new ToolInstanceCache(catalog, types, health);
    }

    private void catalogOf(ToolSpec... specs) {
        catalog.load(List.of(specs), LoadMode.MERGE);
    }

    private static class CountingTool implements Tool, ResourceCleanup {
        final AtomicInteger exits = new AtomicInteger();

        @Override
        public Object execute(Map<String, Object> arguments, ExecutionContext context) {
            return arguments;
        }

        @Override
        public void onExit() {
            exits.incrementAndGet();
        }
    }

    @Test
    void unknownNameIsNotFoundWithoutHealthRecord() {
        InstanceOutcome outcome = cache.getOrCreate("Missing");

        assertFalse(outcome.isSuccess());
        assertEquals(ErrorKind.NOT_FOUND, outcome.getError().orElseThrow().getKind());
        assertTrue(health.status("Missing").isEmpty());
    }

    @Test
    void constructsOnceAndReturnsCachedInstance() {
        AtomicInteger creations = new AtomicInteger();
        types.registerEager("Counting", spec -> {
            creations.incrementAndGet();
            return new CountingTool();
        });
        catalogOf(ToolSpec.builder("A", "Counting").build());

        Tool first = cache.getOrCreate("A").getInstance().orElseThrow();
        Tool second = cache.getOrCreate("A").getInstance().orElseThrow();

        assertSame(first, second);
        assertEquals(1, creations.get());
        assertTrue(health.status("A").orElseThrow().isAvailable());
        assertEquals(Set.of("A"), cache.cachedNames());
    }

    @Test
    void concurrentCallersShareOneConstruction() throws Exception {
        AtomicInteger creations = new AtomicInteger();
        CountDownLatch inFactory = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        types.registerEager("Slow", spec -> {
            creations.incrementAndGet();
            inFactory.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new CountingTool();
        });
        catalogOf(ToolSpec.builder("Slow", "Slow").build());

        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        List<Future<InstanceOutcome>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> cache.getOrCreate("Slow")));
            }
            assertTrue(inFactory.await(5, TimeUnit.SECONDS));
            Thread.sleep(50);
            release.countDown();

            Tool expected = null;
            for (Future<InstanceOutcome> f : futures) {
                Tool t = f.get(5, TimeUnit.SECONDS).getInstance().orElseThrow();
                if (expected == null) expected = t;
                assertSame(expected, t);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, creations.get());
    }

    @Test
    void slowConstructionDoesNotBlockOtherNames() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        types.registerEager("Slow", spec -> {
            release.await(5, TimeUnit.SECONDS);
            return new CountingTool();
        });
        types.registerEager("Fast", spec -> new CountingTool());
        catalogOf(ToolSpec.builder("Slow", "Slow").build(), ToolSpec.builder("Fast", "Fast").build());

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<InstanceOutcome> slow = pool.submit(() -> cache.getOrCreate("Slow"));

            assertTrue(cache.getOrCreate("Fast").isSuccess());
            assertFalse(slow.isDone());

            release.countDown();
            assertTrue(slow.get(5, TimeUnit.SECONDS).isSuccess());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failedConstructionIsNotCachedAndRecovers() {
        AtomicInteger attempts = new AtomicInteger();
        types.registerEager("Flaky", spec -> {
            if (attempts.incrementAndGet() == 1) {
                throw ToolConfigException.missingEnv(spec.getName(), "FLAKY_API_KEY");
            }
            return new CountingTool();
        });
        catalogOf(ToolSpec.builder("Flaky", "Flaky").build());

        ToolError error = cache.getOrCreate("Flaky").getError().orElseThrow();
        assertEquals(ErrorKind.CONSTRUCTION, error.getKind());
        assertEquals("Flaky", error.getToolName());
        assertTrue(error.getNextSteps().contains("Set environment variable FLAKY_API_KEY"));
        assertFalse(health.status("Flaky").orElseThrow().isAvailable());
        assertFalse(cache.isCached("Flaky"));

        assertTrue(cache.getOrCreate("Flaky").isSuccess());
        HealthRecord record = health.status("Flaky").orElseThrow();
        assertTrue(record.isAvailable());
        assertEquals(1, record.getErrorCount());
        assertEquals(2, attempts.get());
    }

    @Test
    void dependencyExceptionFromFactoryIsDependencyError() {
        types.registerEager("Lib", spec -> {
            throw new ToolDependencyException("native library libfoo not found");
        });
        catalogOf(ToolSpec.builder("Lib", "Lib").build());

        assertEquals(ErrorKind.DEPENDENCY, cache.getOrCreate("Lib").getError().orElseThrow().getKind());
    }

    @Test
    void unexpectedFactoryExceptionAndNullInstanceAreConstructionErrors() {
        types.registerEager("Boom", spec -> {
            throw new IllegalStateException("boom");
        });
        types.registerEager("Null", spec -> null);
        catalogOf(ToolSpec.builder("Boom", "Boom").build(), ToolSpec.builder("Null", "Null").build());

        ToolError boom = cache.getOrCreate("Boom").getError().orElseThrow();
        assertEquals(ErrorKind.CONSTRUCTION, boom.getKind());
        assertTrue(boom.getMessage().contains("boom"));
        assertEquals(ErrorKind.CONSTRUCTION, cache.getOrCreate("Null").getError().orElseThrow().getKind());
    }

    @Test
    void errorThrownByFactoryIsConstructionFailureRecordedInHealth() {
        types.registerEager("Recursive", spec -> {
            throw new StackOverflowError();
        });
        types.registerEager("Asserting", spec -> {
            throw new AssertionError("settings invariant broken");
        });
        catalogOf(ToolSpec.builder("Recursive", "Recursive").build(), ToolSpec.builder("Asserting", "Asserting").build());

        InstanceOutcome recursive = cache.getOrCreate("Recursive");
        ToolError error = recursive.getError().orElseThrow();
        assertEquals(ErrorKind.CONSTRUCTION, error.getKind());
        assertEquals("Failed to construct Recursive: StackOverflowError", error.getMessage());
        assertFalse(health.status("Recursive").orElseThrow().isAvailable());
        assertFalse(cache.isCached("Recursive"));

        ToolError asserting = cache.getOrCreate("Asserting").getError().orElseThrow();
        assertEquals(ErrorKind.CONSTRUCTION, asserting.getKind());
        assertTrue(asserting.getMessage().contains("settings invariant broken"));
        assertEquals(1, health.status("Asserting").orElseThrow().getErrorCount());
    }

    @Test
    void typeResolutionFailureIsBoundToToolNameAndMarksUnhealthy() {
        catalogOf(ToolSpec.builder("Orphan", "UnregisteredType").build());

        ToolError error = cache.getOrCreate("Orphan").getError().orElseThrow();

        assertEquals(ErrorKind.DEPENDENCY, error.getKind());
        assertEquals("Orphan", error.getToolName());
        assertFalse(health.status("Orphan").orElseThrow().isAvailable());
    }

    @Test
    void lazyTypeFailureSharedAcrossToolsResolvesOnce() {
        AtomicInteger runs = new AtomicInteger();
        types.registerLazy("Broken", () -> {
            runs.incrementAndGet();
            throw new ClassNotFoundException("com.vendor.Client");
        });
        catalogOf(ToolSpec.builder("One", "Broken").build(), ToolSpec.builder("Two", "Broken").build());

        cache.getOrCreate("One");
        cache.getOrCreate("Two");
        cache.getOrCreate("One");

        assertEquals(1, runs.get());
        assertEquals(2, health.allUnhealthy().size());
    }

    @Test
    void nonConcurrentToolsAreSerialized() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        types.registerEager("Stateful", spec -> (Tool) (args, ctx) -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            active.decrementAndGet();
            return null;
        });
        catalogOf(ToolSpec.builder("Stateful", "Stateful").concurrentExecute(false).build());

        Tool tool = cache.getOrCreate("Stateful").getInstance().orElseThrow();
        assertFalse(tool.supportsConcurrentExecute());

        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<Object>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> tool.execute(Map.of(), ExecutionContext.unbounded("Stateful"))));
            }
            for (Future<Object> f : futures) f.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, maxActive.get());
    }

    @Test
    void toolDeclaringNoConcurrencyIsWrappedEvenIfSpecAllowsIt() {
        Tool single = new Tool() {
            @Override
            public Object execute(Map<String, Object> arguments, ExecutionContext context) {
                return null;
            }

            @Override
            public boolean supportsConcurrentExecute() {
                return false;
            }
        };
        types.registerEager("Single", spec -> single);
        catalogOf(ToolSpec.builder("Single", "Single").build());

        Tool live = cache.getOrCreate("Single").getInstance().orElseThrow();
        assertInstanceOf(SerializedTool.class, live);
        assertSame(single, ((SerializedTool) live).getDelegate());
    }

    @Test
    void evictRunsCleanupAndForcesReconstruction() {
        List<CountingTool> built = new ArrayList<>();
        types.registerEager("Counting", spec -> {
            CountingTool t = new CountingTool();
            built.add(t);
            return t;
        });
        catalogOf(ToolSpec.builder("A", "Counting").build());

        Tool first = cache.getOrCreate("A").getInstance().orElseThrow();
        assertTrue(cache.evict("A"));
        assertFalse(cache.evict("A"));
        Tool second = cache.getOrCreate("A").getInstance().orElseThrow();

        assertNotSame(first, second);
        assertEquals(1, built.get(0).exits.get());
    }

    @Test
    void closeCleansUpEveryInstanceEvenWhenOneCleanupFails() {
        CountingTool ok = new CountingTool();
        types.registerEager("Ok", spec -> ok);
        types.registerEager("BadExit", spec -> new CountingTool() {
            @Override
            public void onExit() {
                throw new IllegalStateException("socket already closed");
            }
        });
        catalogOf(ToolSpec.builder("Ok", "Ok").build(), ToolSpec.builder("Bad", "BadExit").build());
        cache.getOrCreate("Ok");
        cache.getOrCreate("Bad");

        cache.close();

        assertEquals(1, ok.exits.get());
        assertTrue(cache.cachedNames().isEmpty());
    }

    @Test
    void retainOnlyEvictsNamesOutsideTheSet() {
        types.registerEager("Counting", spec -> new CountingTool());
        catalogOf(ToolSpec.builder("A", "Counting").build(), ToolSpec.builder("B", "Counting").build());
        cache.getOrCreate("A");
        cache.getOrCreate("B");

        assertEquals(1, cache.retainOnly(Set.of("A")));
        assertEquals(Set.of("A"), cache.cachedNames());
    }
}
