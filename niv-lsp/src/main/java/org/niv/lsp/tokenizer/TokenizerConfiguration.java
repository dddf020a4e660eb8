/*
 * Copyright (c) 2025-2026, The niv editor authors
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *
 * 1. Redistributions of source code must retain the above copyright notice,
 * this list of conditions and the following disclaimer.
 *
 * 2. Redistributions in binary form must reproduce the above copyright notice,
 * this list of conditions and the following disclaimer in the documentation
 * and/or other materials provided with the distribution.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
 * POSSIBILITY OF SUCH DAMAGE.
 */
package org.niv.lsp.tokenizer;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tuning of the parallel tokenizer. Read from system properties by the server,
 * constructed directly by tests.
 */
public final class TokenizerConfiguration {
    private static final Logger logger = LogManager.getLogger(TokenizerConfiguration.class);

    public static final String THRESHOLD_PROPERTY = "niv.lsp.parallel.threshold";
    public static final String MAX_THREADS_PROPERTY = "niv.lsp.parallel.maxThreads";

    public static final int DEFAULT_PARALLEL_LINE_THRESHOLD = 4000;
    public static final int DEFAULT_MAX_THREADS = 4;

    public static final TokenizerConfiguration DEFAULT =
        new TokenizerConfiguration(DEFAULT_PARALLEL_LINE_THRESHOLD, DEFAULT_MAX_THREADS);

    private final int parallelLineThreshold;
    private final int maxThreads;

    public TokenizerConfiguration(int parallelLineThreshold, int maxThreads) {
        if (parallelLineThreshold < 1 || maxThreads < 1) {
            throw new IllegalArgumentException("Threshold and thread count must be positive");
        }
        this.parallelLineThreshold = parallelLineThreshold;
        this.maxThreads = maxThreads;
    }

    public static TokenizerConfiguration fromSystemProperties() {
        return new TokenizerConfiguration(
            positiveProperty(THRESHOLD_PROPERTY, DEFAULT_PARALLEL_LINE_THRESHOLD),
            positiveProperty(MAX_THREADS_PROPERTY, DEFAULT_MAX_THREADS));
    }

    private static int positiveProperty(String key, int defaultValue) {
        String raw = System.getProperty(key);
        if (StringUtils.isBlank(raw)) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value >= 1) {
                return value;
            }
        }
        catch (NumberFormatException e) {
            logger.debug("Cannot parse {}", key, e);
        }
        logger.warn("Ignoring invalid value {} for {}, using {}", raw, key, defaultValue);
        return defaultValue;
    }

    /**
     * Documents with fewer lines than this are always scanned on the calling thread.
     */
    public int getParallelLineThreshold() {
        return parallelLineThreshold;
    }

    public int getMaxThreads() {
        return maxThreads;
    }

    /**
     * @return the number of sections a large document is split into on this machine
     */
    public int workerCount() {
        return Math.min(Runtime.getRuntime().availableProcessors(), maxThreads);
    }

    public TokenizerConfiguration withParallelLineThreshold(int threshold) {
        return new TokenizerConfiguration(threshold, maxThreads);
    }

    public TokenizerConfiguration withMaxThreads(int threads) {
        return new TokenizerConfiguration(parallelLineThreshold, threads);
    }

    @Override
    public String toString() {
        return "TokenizerConfiguration[threshold=" + parallelLineThreshold + ", maxThreads=" + maxThreads + "]";
    }
}
