package ai.gently.util;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Submits tasks to an ExecutorService with the constraint that tasks submitted with the same key run one at a time,
 * in submission order. Tasks with different keys run concurrently.
 */
public class SerialByKeyExecutor {

    private static final Logger logger = LogManager.getLogger(SerialByKeyExecutor.class);

    private final ExecutorService executor;

    /** Maps task key to the last future submitted with that key. */
    private final ConcurrentHashMap<String, CompletableFuture<?>> activeFutures = new ConcurrentHashMap<>();

    public SerialByKeyExecutor(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    /**
     * Submits a task for execution. Tasks with the same key are executed in the order they were submitted.
     *
     * @return a CompletableFuture representing the pending completion of the task
     */
    public <T> CompletableFuture<T> submit(String key, Callable<T> task) {
        var supplier = toSupplier(() -> {
            try {
                return task.call();
            } catch (Exception e) {
                logger.debug("Task for key '{}' failed: {}", key, e.getMessage());
                throw e;
            }
        });

        /*
         * A placeholder future goes into the map first. Once the real work finishes we remove the map entry and then
         * complete the placeholder, so callers that observe completion never see a stale key.
         */
        @SuppressWarnings("unchecked")
        CompletableFuture<T> placeholder = (CompletableFuture<T>) activeFutures.compute(
                key, (String k, @Nullable CompletableFuture<?> previous) -> {
                    var resultFuture = new CompletableFuture<T>();

                    Runnable scheduleTask = () -> CompletableFuture.supplyAsync(supplier, executor)
                            .whenCompleteAsync(
                                    (T res, @Nullable Throwable err) -> {
                                        activeFutures.remove(k, resultFuture);
                                        if (err != null) {
                                            resultFuture.completeExceptionally(err);
                                        } else {
                                            resultFuture.complete(res);
                                        }
                                    },
                                    executor);

                    if (previous == null) {
                        scheduleTask.run();
                    } else {
                        // chain after the previous placeholder regardless of its outcome
                        previous.whenCompleteAsync((r, e) -> scheduleTask.run(), executor);
                    }

                    return resultFuture;
                });

        return placeholder;
    }

    /**
     * Submits a task and blocks until it has run. The task's own exception is rethrown unwrapped when it is an
     * unchecked exception or an instance of {@code checkedType}.
     */
    public <T, E extends Exception> T call(String key, Callable<T> task, Class<E> checkedType)
            throws E, InterruptedException {
        try {
            return submit(key, task).get();
        } catch (ExecutionException e) {
            var cause = unwrap(e.getCause());
            if (checkedType.isInstance(cause)) {
                throw checkedType.cast(cause);
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(cause);
        }
    }

    /** @return the number of keys with pending or running tasks. */
    public int getActiveKeyCount() {
        return activeFutures.size();
    }

    private static Throwable unwrap(Throwable t) {
        // toSupplier wraps checked exceptions
        while ((t instanceof WrappedCheckedException || t instanceof java.util.concurrent.CompletionException)
                && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /** Converts a Callable into a Supplier, wrapping checked exceptions so they survive the CompletableFuture chain. */
    private static <T> Supplier<T> toSupplier(Callable<T> callable) {
        return () -> {
            try {
                return callable.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new WrappedCheckedException(e);
            }
        };
    }

    private static final class WrappedCheckedException extends RuntimeException {
        WrappedCheckedException(Exception cause) {
            super(cause);
        }
    }
}
