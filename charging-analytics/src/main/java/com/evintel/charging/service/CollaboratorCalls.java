package com.evintel.charging.service;

import com.evintel.charging.config.ChargingAnalyticsProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounds every blocking call to a collector or to storage with an exponential-backoff
 * retry budget.
 *
 * Reads ({@link #call}) also get a per-attempt timeout. A timed-out attempt is interrupted and
 * has stopped before the next attempt starts or the call returns, so attempts never overlap.
 * Transactional writes ({@link #write}) run on the caller's thread without a timer and are
 * bounded by the store's transaction timeout instead.
 *
 * A call that still fails once the budget is spent surfaces as
 * {@link CollaboratorUnavailableException}.
 */
@Component
@Slf4j
public class CollaboratorCalls {

    private final RetryConfig retryConfig;
    private final TimeLimiter timeLimiter;
    private final int maxAttempts;
    private final ExecutorService ioExecutor;

    public CollaboratorCalls(ChargingAnalyticsProperties properties) {
        ChargingAnalyticsProperties.Collection cfg = properties.getCollection();
        this.maxAttempts = Math.max(1, cfg.getMaxAttempts());

        this.retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(Math.max(1, cfg.getInitialBackoffMs())), cfg.getBackoffMultiplier()))
                .build();

        this.timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(cfg.getTimeoutMs()))
                .cancelRunningFuture(true)
                .build());

        AtomicInteger threads = new AtomicInteger();
        this.ioExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "collaborator-io-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run {@code call} with timeout and retries.
     *
     * @param collaborator name used in logs and errors, e.g. "collector:S1"
     */
    public <T> T call(String collaborator, Supplier<T> call) {
        return execute(collaborator, () -> timed(call));
    }

    /** Void variant of {@link #call}. */
    public void run(String collaborator, Runnable call) {
        call(collaborator, () -> {
            call.run();
            return null;
        });
    }

    /**
     * Retry {@code call} on the caller's thread with no timer. For writes that carry their
     * own transaction timeout, where abandoning a running attempt would let a retry overlap it.
     */
    public void write(String collaborator, Runnable call) {
        execute(collaborator, () -> {
            call.run();
            return null;
        });
    }

    @PreDestroy
    public void shutdown() {
        ioExecutor.shutdownNow();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> T execute(String collaborator, Callable<T> attempt) {
        Retry retry = Retry.of(collaborator, retryConfig);
        retry.getEventPublisher().onRetry(e -> log.warn("{} attempt {} failed, retrying in {} ms: {}",
                collaborator, e.getNumberOfRetryAttempts(), e.getWaitInterval().toMillis(),
                e.getLastThrowable() == null ? "?" : e.getLastThrowable().getMessage()));
        try {
            return Retry.decorateCallable(retry, attempt).call();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorUnavailableException(collaborator, maxAttempts, e);
        } catch (Exception e) {
            throw new CollaboratorUnavailableException(collaborator, maxAttempts, unwrap(e));
        }
    }

    private <T> T timed(Supplier<T> call) throws Exception {
        Attempt<T> attempt = new Attempt<>(call);
        attempt.future = ioExecutor.submit(attempt);
        try {
            return timeLimiter.executeFutureSupplier(() -> attempt.future);
        } catch (Exception e) {
            attempt.abandon();
            throw e;
        }
    }

    private Throwable unwrap(Throwable e) {
        Throwable t = e;
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /** One attempt on the io pool. {@link #abandon()} returns once the body cannot be running. */
    private static final class Attempt<T> implements Callable<T> {

        private static final int PENDING = 0;
        private static final int RUNNING = 1;
        private static final int DONE = 2;

        private final Supplier<T> body;
        private final AtomicInteger phase = new AtomicInteger(PENDING);
        private final CountDownLatch finished = new CountDownLatch(1);
        private volatile Future<T> future;

        private Attempt(Supplier<T> body) {
            this.body = body;
        }

        @Override
        public T call() {
            if (!phase.compareAndSet(PENDING, RUNNING)) {
                throw new CancellationException("attempt abandoned before it started");
            }
            try {
                return body.get();
            } finally {
                phase.set(DONE);
                finished.countDown();
            }
        }

        void abandon() {
            if (phase.compareAndSet(PENDING, DONE)) {
                future.cancel(false);
                return;
            }
            future.cancel(true);
            boolean interrupted = Thread.interrupted();
            while (true) {
                try {
                    finished.await();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
