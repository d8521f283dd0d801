package com.ryuqq.collections.testkit.contract;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntConsumer;

/**
 * Runs a task on several threads released at the same moment.
 *
 * <p>Every thread waits on a shared start gate, so the tasks overlap as much as the
 * scheduler allows. A failure in any thread fails the caller with an
 * {@link ExecutionException} carrying the original cause.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ConcurrentExecution.run(8, thread -&gt; {
 *     for (int i = 0; i &lt; 1000; i++) {
 *         dictionary.put("k-" + thread + "-" + i, i);
 *     }
 * });
 * </pre>
 *
 * @author Collections Team
 * @since 1.0.0
 */
public final class ConcurrentExecution {

    private static final long TIMEOUT_SECONDS = 30;

    private ConcurrentExecution() {
    }

    /**
     * Runs {@code task} once per thread and waits for all of them.
     *
     * @param threads number of threads (positive)
     * @param task receives the zero-based thread number
     * @throws InterruptedException if interrupted while waiting
     * @throws ExecutionException if a task threw
     * @throws TimeoutException if the tasks did not finish in time
     */
    public static void run(int threads, IntConsumer task)
            throws InterruptedException, ExecutionException, TimeoutException {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive (current: " + threads + ")");
        }
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }

        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>(threads);
        try {
            for (int i = 0; i < threads; i++) {
                int thread = i;
                futures.add(executorService.submit(() -> {
                    startGate.await();
                    task.accept(thread);
                    return null;
                }));
            }
            startGate.countDown();

            for (Future<?> future : futures) {
                future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
        } finally {
            executorService.shutdownNow();
        }
    }
}
