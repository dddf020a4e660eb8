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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.eclipse.lsp4j.SemanticTokens;
import org.eclipse.lsp4j.SemanticTokensLegend;
import org.eclipse.lsp4j.SemanticTokensWithRegistrationOptions;

/**
 * Converts ordered tokens to the relative integer encoding of
 * {@code textDocument/semanticTokens}: five integers per token (line delta,
 * column delta or absolute column, length, token type, modifiers).
 */
public final class SemanticTokenEncoder {
    private SemanticTokenEncoder() {/* hidden */ }

    private enum TokenField {
        // order is significant, it is the order of the integers on the wire
        LINE, START, LENGTH, TYPE, MODIFIER
    }

    private static final int FIELDS = TokenField.values().length;

    /**
     * @param tokens tokens sorted by line and column
     */
    public static int[] encode(List<Token> tokens) {
        int[] data = new int[tokens.size() * FIELDS];
        int previousLine = 0;
        int previousStart = 0;
        int i = 0;
        for (Token token : tokens) {
            int line = token.getLine();
            int start = token.getColumn();
            data[i + TokenField.LINE.ordinal()] = line - previousLine;
            data[i + TokenField.START.ordinal()] = line == previousLine ? start - previousStart : start;
            data[i + TokenField.LENGTH.ordinal()] = token.getLength();
            data[i + TokenField.TYPE.ordinal()] = token.getKind().legendIndex();
            data[i + TokenField.MODIFIER.ordinal()] = 0; // no modifiers
            previousLine = line;
            previousStart = start;
            i += FIELDS;
        }
        return data;
    }

    /**
     * Reconstructs absolute positions with a running cursor starting at (0, 0).
     */
    public static List<Token> decode(int[] data, Language<?> language) {
        if (data.length % FIELDS != 0) {
            throw new IllegalArgumentException("Encoded tokens must come in groups of " + FIELDS + ", got " + data.length + " integers");
        }
        List<Token> result = new ArrayList<>(data.length / FIELDS);
        int line = 0;
        int start = 0;
        for (int i = 0; i < data.length; i += FIELDS) {
            int lineDelta = data[i + TokenField.LINE.ordinal()];
            line += lineDelta;
            start = lineDelta == 0 ? start + data[i + TokenField.START.ordinal()] : data[i + TokenField.START.ordinal()];
            result.add(new Token(language.kindAt(data[i + TokenField.TYPE.ordinal()]), line, start,
                data[i + TokenField.LENGTH.ordinal()]));
        }
        return result;
    }

    public static SemanticTokens toSemanticTokens(int[] data) {
        return new SemanticTokens(Arrays.stream(data).boxed().collect(Collectors.toList()));
    }

    public static SemanticTokens toSemanticTokens(List<Token> tokens) {
        return toSemanticTokens(encode(tokens));
    }

    /**
     * The provider options announced in {@code initialize}; the legend is fixed for the whole session.
     */
    public static SemanticTokensWithRegistrationOptions options(Language<?> language) {
        SemanticTokensWithRegistrationOptions result = new SemanticTokensWithRegistrationOptions();
        result.setLegend(new SemanticTokensLegend(language.legend(), Collections.emptyList()));
        result.setFull(true);
        result.setRange(true);
        return result;
    }
}
