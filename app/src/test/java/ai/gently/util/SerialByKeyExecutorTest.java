package ai.gently.util;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;

class SerialByKeyExecutorTest {

    private static final ExecutorService executorService = Executors.newFixedThreadPool(3);
    private static final SerialByKeyExecutor serialByKeyExecutor = new SerialByKeyExecutor(executorService);

    @AfterAll
    static void afterAll() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(1, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void testWritersForSameProjectRunInOrder() throws Exception {
        var executionOrder = new CopyOnWriteArrayList<String>();
        var key = "demo";

        var future1 = serialByKeyExecutor.submit(key, () -> {
            executionOrder.add("add-clan");
            Thread.sleep(100);
            return "clan-0-alpha";
        });
        var future2 = serialByKeyExecutor.submit(key, () -> {
            executionOrder.add("add-clan-2");
            Thread.sleep(50);
            return "clan-1-beta";
        });
        var future3 = serialByKeyExecutor.submit(key, () -> {
            executionOrder.add("collapse");
            return "win-1";
        });

        assertEquals("clan-0-alpha", future1.get(1, TimeUnit.SECONDS));
        assertEquals("clan-1-beta", future2.get(1, TimeUnit.SECONDS));
        assertEquals("win-1", future3.get(1, TimeUnit.SECONDS));

        assertEquals(List.of("add-clan", "add-clan-2", "collapse"), executionOrder);
        assertEquals(0, serialByKeyExecutor.getActiveKeyCount());
    }

    @Test
    void testDifferentProjectsRunConcurrently() throws Exception {
        var executionOrder = new CopyOnWriteArrayList<String>();
        var task1Started = new CountDownLatch(1);
        var task2Started = new CountDownLatch(1);

        var future1 = serialByKeyExecutor.submit("project-a", () -> {
            executionOrder.add("a-started");
            task1Started.countDown();
            if (!task2Started.await(500, TimeUnit.MILLISECONDS)) {
                executionOrder.add("a-timed-out");
            }
            executionOrder.add("a-finished");
            return "a";
        });
        var future2 = serialByKeyExecutor.submit("project-b", () -> {
            executionOrder.add("b-started");
            task2Started.countDown();
            if (!task1Started.await(500, TimeUnit.MILLISECONDS)) {
                executionOrder.add("b-timed-out");
            }
            executionOrder.add("b-finished");
            return "b";
        });

        assertEquals("a", future1.get(1, TimeUnit.SECONDS));
        assertEquals("b", future2.get(1, TimeUnit.SECONDS));

        assertEquals(4, executionOrder.size());
        assertTrue(executionOrder.subList(0, 2).containsAll(List.of("a-started", "b-started")));
        assertTrue(executionOrder.subList(2, 4).containsAll(List.of("a-finished", "b-finished")));
    }

    @Test
    void testCallRethrowsCheckedExceptionUnwrapped() {
        var thrown = assertThrows(
                IOException.class,
                () -> serialByKeyExecutor.call(
                        "failing",
                        () -> {
                            throw new IOException("disk full");
                        },
                        IOException.class));
        assertEquals("disk full", thrown.getMessage());
    }

    @Test
    void testCallRethrowsRuntimeExceptionUnwrapped() {
        var thrown = assertThrows(
                IllegalStateException.class,
                () -> serialByKeyExecutor.call(
                        "failing-runtime",
                        () -> {
                            throw new IllegalStateException("frozen");
                        },
                        IOException.class));
        assertEquals("frozen", thrown.getMessage());
    }

    @Test
    void testFailedTaskDoesNotBlockNextTaskForSameKey() throws Exception {
        var key = "recovering";
        var failing = serialByKeyExecutor.submit(key, () -> {
            throw new IOException("boom");
        });
        var next = serialByKeyExecutor.submit(key, () -> "ok");

        assertThrows(Exception.class, () -> failing.get(1, TimeUnit.SECONDS));
        assertEquals("ok", next.get(1, TimeUnit.SECONDS));
    }
}
