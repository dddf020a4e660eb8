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

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Serves viewport sized requests, using the {@link RangeStrategy} of the language.
 */
public class RangeTokenizer<S extends LexState> {
    private static final Logger logger = LogManager.getLogger(RangeTokenizer.class);

    private final ParallelTokenizer<S> full;

    public RangeTokenizer(ParallelTokenizer<S> full) {
        this.full = full;
    }

    public RangeStrategy getStrategy() {
        return full.getLanguage().rangeStrategy();
    }

    /**
     * @param startLine first requested line
     * @param endLine last requested line, inclusive
     */
    public List<Token> tokenizeRange(String text, int startLine, int endLine) {
        if (startLine < 0 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range [" + startLine + ", " + endLine + "]");
        }
        if (getStrategy() == RangeStrategy.LOCAL_LOOKAHEAD) {
            @Nullable RangeLexer local = full.getLanguage().rangeLexer();
            if (local != null) {
                try {
                    return local.tokenizeRange(text, startLine, endLine);
                }
                catch (RuntimeException e) {
                    logger.error("Range lexer of {} failed, falling back to a full scan", full.getLanguage().getId(), e);
                }
            }
            else {
                logger.warn("{} asks for local range scans but has no range lexer", full.getLanguage().getId());
            }
        }
        return linesBetween(full.tokenize(text).getTokens(), startLine, endLine);
    }

    /**
     * Keeps the tokens on lines {@code [startLine, endLine]} of a list ordered by position.
     */
    static List<Token> linesBetween(List<Token> tokens, int startLine, int endLine) {
        int from = firstOnOrAfter(tokens, startLine);
        int to = firstOnOrAfter(tokens, endLine + 1);
        return tokens.subList(from, to);
    }

    private static int firstOnOrAfter(List<Token> tokens, int line) {
        int low = 0;
        int high = tokens.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (tokens.get(mid).getLine() < line) {
                low = mid + 1;
            }
            else {
                high = mid;
            }
        }
        return low;
    }
}
