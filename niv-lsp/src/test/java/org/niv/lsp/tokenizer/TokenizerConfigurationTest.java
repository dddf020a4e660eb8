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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

public class TokenizerConfigurationTest {

    @After
    public void clearProperties() {
        System.clearProperty(TokenizerConfiguration.THRESHOLD_PROPERTY);
        System.clearProperty(TokenizerConfiguration.MAX_THREADS_PROPERTY);
    }

    @Test
    public void defaults() {
        TokenizerConfiguration config = TokenizerConfiguration.fromSystemProperties();
        assertEquals(4000, config.getParallelLineThreshold());
        assertEquals(4, config.getMaxThreads());
    }

    @Test
    public void readsSystemProperties() {
        System.setProperty(TokenizerConfiguration.THRESHOLD_PROPERTY, " 250 ");
        System.setProperty(TokenizerConfiguration.MAX_THREADS_PROPERTY, "2");
        TokenizerConfiguration config = TokenizerConfiguration.fromSystemProperties();
        assertEquals(250, config.getParallelLineThreshold());
        assertEquals(2, config.getMaxThreads());
    }

    @Test
    public void invalidPropertiesFallBackToDefaults() {
        System.setProperty(TokenizerConfiguration.THRESHOLD_PROPERTY, "lots");
        System.setProperty(TokenizerConfiguration.MAX_THREADS_PROPERTY, "0");
        TokenizerConfiguration config = TokenizerConfiguration.fromSystemProperties();
        assertEquals(TokenizerConfiguration.DEFAULT_PARALLEL_LINE_THRESHOLD, config.getParallelLineThreshold());
        assertEquals(TokenizerConfiguration.DEFAULT_MAX_THREADS, config.getMaxThreads());
    }

    @Test
    public void workerCountIsCappedByMaxThreads() {
        TokenizerConfiguration config = TokenizerConfiguration.DEFAULT.withMaxThreads(1);
        assertEquals(1, config.workerCount());
        int workers = TokenizerConfiguration.DEFAULT.workerCount();
        assertTrue(workers >= 1 && workers <= TokenizerConfiguration.DEFAULT_MAX_THREADS);
    }

    @Test
    public void withersKeepTheOtherValue() {
        TokenizerConfiguration config = TokenizerConfiguration.DEFAULT.withParallelLineThreshold(10).withMaxThreads(8);
        assertEquals(10, config.getParallelLineThreshold());
        assertEquals(8, config.getMaxThreads());
        assertEquals(4000, TokenizerConfiguration.DEFAULT.getParallelLineThreshold());
    }

    @Test(expected = IllegalArgumentException.class)
    public void thresholdMustBePositive() {
        new TokenizerConfiguration(0, 4);
    }

    @Test(expected = IllegalArgumentException.class)
    public void threadCountMustBePositive() {
        TokenizerConfiguration.DEFAULT.withMaxThreads(0);
    }
}
