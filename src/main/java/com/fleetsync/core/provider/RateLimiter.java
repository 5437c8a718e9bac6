package com.fleetsync.core.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Глобальный лимитер вызовов провайдера: не больше maxCalls за скользящее окно,
 * минимальный интервал между вызовами и общий backoff после ответа "rate limited".
 *
 * Допуск идёт по очереди прихода (fair lock). Backoff пишется в обход замка и
 * перечитывается после каждого сна, поэтому действует и на уже стоящих в очереди.
 */
public final class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public static final long WINDOW_MS = 1000L;

    private final int maxCalls;
    private final long windowMs;
    private final long minSpacingMs;
    private final ProviderStateStore store;
    private final TimeSource time;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Deque<Long> window = new ArrayDeque<>();
    private long lastCallMs = Long.MIN_VALUE;
    private final AtomicLong localBackoffUntil = new AtomicLong();

    public RateLimiter(int maxCalls, long windowMs, long minSpacingMs, ProviderStateStore store, TimeSource time) {
        if (maxCalls < 1) throw new IllegalArgumentException("maxCalls must be >= 1");
        if (windowMs <= 0) throw new IllegalArgumentException("windowMs must be > 0");
        this.maxCalls = maxCalls;
        this.windowMs = windowMs;
        this.minSpacingMs = Math.max(0, minSpacingMs);
        this.store = Objects.requireNonNull(store, "store");
        this.time = Objects.requireNonNull(time, "time");
    }

    public RateLimiter(int maxCalls, long minSpacingMs, ProviderStateStore store, TimeSource time) {
        this(maxCalls, WINDOW_MS, minSpacingMs, store, time);
    }

    /**
     * Блокирует до допуска вызова.
     *
     * @param deadlineMs epoch ms; если допуск позже, сразу {@link ProviderTimeoutException} без ожидания
     */
    public void acquire(long deadlineMs) throws InterruptedException, ProviderTimeoutException {
        lock.lockInterruptibly();
        try {
            while (true) {
                long now = time.millis();
                long wait = waitMs(now);
                if (wait <= 0) {
                    window.addLast(now);
                    lastCallMs = now;
                    return;
                }
                if (now + wait > deadlineMs) {
                    throw new ProviderTimeoutException("rate limiter admission at +" + wait + "ms is past the call deadline");
                }
                if (wait > minSpacingMs + windowMs) {
                    log.info("provider backoff: waiting {} ms", wait);
                } else {
                    log.debug("rate limit: waiting {} ms", wait);
                }
                time.sleep(wait);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Общий backoff для всех вызывающих (и для других процессов через store). */
    public void backoffUntil(long untilMs) {
        localBackoffUntil.accumulateAndGet(untilMs, Math::max);
        store.extendBackoff(untilMs);
    }

    public RateLimiterState snapshot() {
        lock.lock();
        try {
            long now = time.millis();
            evict(now);
            long start = window.isEmpty() ? now : window.peekFirst();
            long backoff = Math.max(localBackoffUntil.get(), store.backoffUntil());
            return new RateLimiterState(window.size(), start, backoff > now ? backoff : 0L, null, null);
        } finally {
            lock.unlock();
        }
    }

    private long waitMs(long now) {
        long backoff = Math.max(localBackoffUntil.get(), store.backoffUntil());
        if (backoff > now) {
            return backoff - now;
        }
        evict(now);
        long wait = 0;
        if (window.size() >= maxCalls) {
            wait = window.peekFirst() + windowMs - now;
        }
        if (lastCallMs != Long.MIN_VALUE) {
            wait = Math.max(wait, lastCallMs + minSpacingMs - now);
        }
        return wait;
    }

    private void evict(long now) {
        while (!window.isEmpty() && window.peekFirst() + windowMs <= now) {
            window.pollFirst();
        }
    }
}
