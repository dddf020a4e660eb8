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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.niv.lsp.util.concurrent.CompletableFutureUtils;

/**
 * Tokenizes whole documents for one language, splitting large documents over
 * several worker threads.
 *
 * <p>Small documents (fewer lines than the configured threshold) are scanned
 * on the calling thread. Large documents are cut into line aligned
 * {@link Section}s; the {@link Prescanner} computes the state at every
 * boundary, after which each section is scanned by its own worker and the
 * results are concatenated in section order. The output is identical to a
 * sequential scan, except that diagnostics are only reported by the
 * sequential path.</p>
 */
public class ParallelTokenizer<S extends LexState> {
    private static final Logger logger = LogManager.getLogger(ParallelTokenizer.class);

    private final Language<S> language;
    private final TokenizerConfiguration configuration;

    public ParallelTokenizer(Language<S> language, TokenizerConfiguration configuration) {
        this.language = language;
        this.configuration = configuration;
    }

    public static <S extends LexState> ParallelTokenizer<S> forLanguage(Language<S> language, TokenizerConfiguration configuration) {
        return new ParallelTokenizer<>(language, configuration);
    }

    public Language<S> getLanguage() {
        return language;
    }

    /**
     * Tokenizes with as many workers as this machine and the configuration allow.
     */
    public Tokenization tokenize(String text) {
        return tokenizeParallel(text, configuration.workerCount());
    }

    /**
     * Scans the whole document on the calling thread, including diagnostics.
     */
    public Tokenization tokenizeSequential(String text) {
        try {
            ScanResult<S> result = language.lexer().scan(text, 0, text.length(), 0, language.initialState());
            return new Tokenization(result.getTokens(), result.getDiagnostics(), 1);
        }
        catch (RuntimeException e) {
            logger.error("The {} lexer failed on a document of {} characters", language.getId(), text.length(), e);
            return Tokenization.empty();
        }
    }

    /**
     * Tokenizes with at most {@code workerCount} sections. Falls back to
     * {@link #tokenizeSequential(String)} for documents below the line
     * threshold, for languages that cannot be partitioned, and when only one
     * worker would be used.
     */
    public Tokenization tokenizeParallel(String text, int workerCount) {
        int lineCount = LineIndex.countLines(text);
        int workers = Math.min(workerCount, lineCount);
        if (!language.isPartitionable() || lineCount < configuration.getParallelLineThreshold() || workers <= 1) {
            logger.trace("Scanning {} lines of {} sequentially", lineCount, language.getId());
            return tokenizeSequential(text);
        }

        List<Section<S>> sections;
        try {
            sections = Partitioner.partition(text, LineIndex.of(text), workers, language.prescanner(), language.initialState());
        }
        catch (RuntimeException e) {
            logger.error("Prescan of {} lines of {} failed, scanning sequentially", lineCount, language.getId(), e);
            return tokenizeSequential(text);
        }
        logger.trace("Scanning {} lines of {} in sections {}", lineCount, language.getId(), sections);

        ExecutorService pool = Executors.newFixedThreadPool(sections.size(), WORKER_THREADS);
        try {
            List<CompletableFuture<List<Token>>> perSection = new ArrayList<>(sections.size());
            for (Section<S> section : sections) {
                perSection.add(CompletableFuture
                    .supplyAsync(() -> scanSection(text, section), pool)
                    .exceptionally(e -> {
                        logger.warn("Section {} of {} produced no tokens", section.getIndex(), language.getId(), e);
                        return Collections.emptyList();
                    }));
            }
            return new Tokenization(CompletableFutureUtils.flattenInOrder(perSection).join(), Collections.emptyList(), sections.size());
        }
        finally {
            pool.shutdown();
        }
    }

    private List<Token> scanSection(String text, Section<S> section) {
        return language.lexer()
            .scan(text, section.getStartOffset(), section.getEndOffset(), section.getStartLine(), section.getInitialState())
            .getTokens();
    }

    private static final ThreadFactory WORKER_THREADS = new ThreadFactory() {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "niv-tokenizer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    };
}
