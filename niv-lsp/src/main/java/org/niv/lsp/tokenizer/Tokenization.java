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

import java.util.Collections;
import java.util.List;

/**
 * Result of tokenizing a whole document.
 */
public final class Tokenization {
    private static final Tokenization EMPTY = new Tokenization(Collections.emptyList(), Collections.emptyList(), 1);

    private final List<Token> tokens;
    private final List<LexDiagnostic> diagnostics;
    private final int sectionCount;

    public Tokenization(List<Token> tokens, List<LexDiagnostic> diagnostics, int sectionCount) {
        this.tokens = Collections.unmodifiableList(tokens);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.sectionCount = sectionCount;
    }

    public static Tokenization empty() {
        return EMPTY;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * Only the sequential path reports diagnostics; a parallel run leaves this empty.
     */
    public List<LexDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public int getSectionCount() {
        return sectionCount;
    }

    public boolean isParallel() {
        return sectionCount > 1;
    }
}
