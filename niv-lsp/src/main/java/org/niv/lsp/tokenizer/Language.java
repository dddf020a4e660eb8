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
import java.util.stream.Collectors;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Everything the generic engine needs to know about one language: its token
 * legend, its {@link Lexer} and {@link Prescanner} pair, and how it answers
 * range requests.
 */
public interface Language<S extends LexState> {
    /**
     * @return the identifier used on the command line and in diagnostics, e.g. {@code bash}
     */
    String getId();

    /**
     * @return all token kinds, in legend order
     */
    List<? extends TokenKind> getTokenKinds();

    /**
     * @return the state at the very start of a document
     */
    S initialState();

    Lexer<S> lexer();

    Prescanner<S> prescanner();

    /**
     * @return false if the lexer keeps context that is not captured by its
     *         {@link LexState}, in which case documents are never split
     */
    default boolean isPartitionable() {
        return true;
    }

    default RangeStrategy rangeStrategy() {
        return RangeStrategy.FILTER_FULL;
    }

    /**
     * @return the local range lexer, only used with {@link RangeStrategy#LOCAL_LOOKAHEAD}
     */
    default @Nullable RangeLexer rangeLexer() {
        return null;
    }

    default List<String> legend() {
        return getTokenKinds().stream()
            .map(TokenKind::legendName)
            .collect(Collectors.toUnmodifiableList());
    }

    default TokenKind kindAt(int legendIndex) {
        var kinds = getTokenKinds();
        if (legendIndex < 0 || legendIndex >= kinds.size()) {
            throw new IllegalArgumentException("No token type " + legendIndex + " in the " + getId() + " legend");
        }
        return kinds.get(legendIndex);
    }
}
