package com.ogt.jobs.client;

import lombok.Getter;

import java.time.Duration;

/**
 * Intervalo de polling: arranca en {@code base}, crece x{@code multiplier} cada vez
 * que el estado no cambia, con techo en {@code max}, y vuelve a {@code base}
 * apenas hay un cambio.
 */
@Getter
public class BackoffPolicy {

    public static final Duration DEFAULT_BASE = Duration.ofSeconds(2);
    public static final double DEFAULT_MULTIPLIER = 1.5;
    public static final Duration DEFAULT_MAX = Duration.ofSeconds(30);

    private final Duration base;
    private final double multiplier;
    private final Duration max;

    public BackoffPolicy(Duration base, double multiplier, Duration max) {
        if (base.isNegative() || base.isZero()) throw new IllegalArgumentException("base must be positive");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1");
        if (max.compareTo(base) < 0) throw new IllegalArgumentException("max must be >= base");
        this.base = base;
        this.multiplier = multiplier;
        this.max = max;
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_BASE, DEFAULT_MULTIPLIER, DEFAULT_MAX);
    }

    public Duration next(Duration current, boolean changed) {
        if (changed || current == null) return base;
        long nextMillis = Math.round(current.toMillis() * multiplier);
        return nextMillis >= max.toMillis() ? max : Duration.ofMillis(nextMillis);
    }
}
