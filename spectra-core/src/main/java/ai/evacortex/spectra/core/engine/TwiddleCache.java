/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.engine;

import ai.evacortex.spectra.core.math.PowerOfTwo;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

/**
 * Bounded cache of forward twiddle factors per transform length.
 * Entry for length n holds cos and sin of -2πk/n for k in [0, n/2).
 * Tables are shared between transforms and never leave this package.
 */
public class TwiddleCache {

    record Twiddles(double[] cos, double[] sin) {}

    private final LoadingCache<Integer, Twiddles> cache;

    public TwiddleCache(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1: " + maxEntries);
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .executor(Runnable::run)
                .build(TwiddleCache::compute);
    }

    Twiddles get(int n) {
        if (!PowerOfTwo.isPowerOfTwo(n)) {
            throw new IllegalArgumentException("Twiddles requested for non power-of-two length " + n);
        }
        return cache.get(n);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static Twiddles compute(int n) {
        int half = Math.max(1, n >>> 1);
        double[] cos = new double[half];
        double[] sin = new double[half];
        for (int k = 0; k < half; k++) {
            double theta = -2.0 * Math.PI * k / n;
            cos[k] = Math.cos(theta);
            sin[k] = Math.sin(theta);
        }
        return new Twiddles(cos, sin);
    }
}
