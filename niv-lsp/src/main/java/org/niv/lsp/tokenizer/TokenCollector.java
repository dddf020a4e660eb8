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

import org.eclipse.lsp4j.DiagnosticSeverity;

/**
 * Private output buffer of one scan. Zero-length spans are dropped on the way
 * in, so everything collected here can be encoded as is.
 */
public final class TokenCollector {
    private final List<Token> tokens;
    private List<LexDiagnostic> diagnostics = Collections.emptyList();

    // where the most recent multi-line construct was opened, used for the unterminated diagnostic
    private int openingLine = -1;
    private int openingColumn;
    private int openingEndColumn;

    public TokenCollector() {
        this(256);
    }

    public TokenCollector(int expectedTokens) {
        this.tokens = new ArrayList<>(expectedTokens);
    }

    public void add(TokenKind kind, int line, int column, int length) {
        if (length > 0) {
            tokens.add(new Token(kind, line, column, length));
        }
    }

    public void error(LexDiagnostic.Kind kind, int line, int startColumn, int endColumn, String message) {
        if (diagnostics.isEmpty()) {
            diagnostics = new ArrayList<>(4);
        }
        diagnostics.add(new LexDiagnostic(kind, line, startColumn, endColumn, DiagnosticSeverity.Error, message));
    }

    /**
     * Remembers the opening delimiter of a construct that continues on the next line.
     */
    public void markOpening(int line, int startColumn, int endColumn) {
        this.openingLine = line;
        this.openingColumn = startColumn;
        this.openingEndColumn = endColumn;
    }

    public boolean hasOpening() {
        return openingLine >= 0;
    }

    public int getOpeningLine() {
        return openingLine;
    }

    public int getOpeningColumn() {
        return openingColumn;
    }

    public int getOpeningEndColumn() {
        return openingEndColumn;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public List<LexDiagnostic> getDiagnostics() {
        return diagnostics;
    }
}
