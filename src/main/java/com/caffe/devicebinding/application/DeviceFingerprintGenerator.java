package com.caffe.devicebinding.application;

import com.caffe.devicebinding.domain.fingerprint.FingerprintHasher;
import com.caffe.devicebinding.domain.fingerprint.FingerprintResult;
import com.caffe.devicebinding.domain.fingerprint.GenerationError;
import com.caffe.devicebinding.domain.fingerprint.SignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Client-side fingerprint generation: collect signals, hash them, and give up after a
 * bounded time. The returned future always completes normally.
 *
 * <p>A timeout only completes the returned future; a task stuck in
 * {@link SignalSource#collect()} keeps its executor thread until it returns. Give this
 * class an executor of its own, bounded, and not a shared pool.
 */
public class DeviceFingerprintGenerator {

    private static final Logger log = LoggerFactory.getLogger(DeviceFingerprintGenerator.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3);

    private final SignalSource signalSource;
    private final FingerprintHasher hasher;
    private final Duration timeout;
    private final Executor executor;

    public DeviceFingerprintGenerator(SignalSource signalSource, FingerprintHasher hasher) {
        this(signalSource, hasher, DEFAULT_TIMEOUT, ForkJoinPool.commonPool());
    }

    public DeviceFingerprintGenerator(SignalSource signalSource, FingerprintHasher hasher,
                                      Duration timeout, Executor executor) {
        this.signalSource = signalSource;
        this.hasher = hasher;
        this.timeout = timeout;
        this.executor = executor;
    }

    public CompletableFuture<FingerprintResult> generateAsync() {
        CompletableFuture<FingerprintResult> task;
        try {
            task = CompletableFuture.supplyAsync(() -> hasher.hash(signalSource.collect()), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Fingerprint executor saturated, skipping signal collection");
            return CompletableFuture.completedFuture(FingerprintResult.failure(GenerationError.SIGNALS_UNAVAILABLE, e));
        }
        return task
                .exceptionally(e -> FingerprintResult.failure(GenerationError.SIGNALS_UNAVAILABLE, e))
                .completeOnTimeout(FingerprintResult.failure(GenerationError.TIMED_OUT, null),
                        timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Blocks for at most the configured timeout and returns the digest, or a fallback
     * digest if generation failed.
     */
    public String generate() {
        FingerprintResult result = generateAsync().join();
        if (!result.isSuccess()) {
            log.warn("Device fingerprint unavailable ({}), using fallback identifier", result.getError(),
                    result.getCause());
        }
        return result.digestOrFallback();
    }

    public Duration getTimeout() {
        return timeout;
    }
}
