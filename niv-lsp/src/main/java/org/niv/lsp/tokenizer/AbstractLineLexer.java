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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Base class for lexers that tokenize a document one physical line at a time.
 *
 * <p>The only thing that flows from one line into the next is the
 * {@link LexState}; every other piece of context is reset at the newline and
 * no lookahead crosses it. That makes the lexer local by construction.</p>
 *
 * <p>The same line scanner doubles as the {@link Prescanner}: it is then
 * called without a {@link TokenCollector}, and implementations skip
 * everything that only matters for classification. Lexer and prescanner
 * therefore recognize the boundary constructs with the very same code.</p>
 */
public abstract class AbstractLineLexer<S extends LexState> implements Lexer<S>, Prescanner<S> {

    @Override
    public ScanResult<S> scan(String text, int startOffset, int endOffset, int startLine, S initialState) {
        var out = new TokenCollector(Math.max(16, (endOffset - startOffset) / 8));
        S state = initialState;
        int line = startLine;
        int lineStart = startOffset;
        while (true) {
            int lineEnd = Lines.lineEnd(text, lineStart, endOffset);
            state = scanLine(text, lineStart, Lines.contentEnd(text, lineStart, lineEnd), line, state, out);
            if (lineEnd >= endOffset || !Lines.continuesAt(text, lineEnd + 1, endOffset)) {
                break;
            }
            lineStart = lineEnd + 1;
            line++;
        }

        if (state.isUnterminated() && out.hasOpening()) {
            out.error(LexDiagnostic.Kind.UNTERMINATED_LITERAL, out.getOpeningLine(),
                out.getOpeningColumn(), out.getOpeningEndColumn(), unterminatedMessage(state));
        }
        return new ScanResult<>(out.getTokens(), state, out.getDiagnostics());
    }

    @Override
    public S scanState(String text, int startOffset, int endOffset, S initialState) {
        S state = initialState;
        int lineStart = startOffset;
        while (true) {
            int lineEnd = Lines.lineEnd(text, lineStart, endOffset);
            state = scanLine(text, lineStart, Lines.contentEnd(text, lineStart, lineEnd), UNKNOWN_LINE, state, null);
            if (lineEnd >= endOffset || !Lines.continuesAt(text, lineEnd + 1, endOffset)) {
                return state;
            }
            lineStart = lineEnd + 1;
        }
    }

    /**
     * Line number passed to {@link #scanLine} during a prescan.
     */
    protected static final int UNKNOWN_LINE = -1;

    /**
     * Scan a single line.
     *
     * @param start offset of the first character of the line
     * @param end offset of the end of the line content, newline and carriage return excluded
     * @param line the absolute line number, or {@link #UNKNOWN_LINE} when prescanning
     * @param state the state at {@code start}
     * @param out where tokens and diagnostics go; null when only the state is needed
     * @return the state at the start of the next line
     */
    protected abstract S scanLine(String text, int start, int end, int line, S state, @Nullable TokenCollector out);

    /**
     * @return the message reported when the input ends in the given unterminated state
     */
    protected abstract String unterminatedMessage(S state);
}
