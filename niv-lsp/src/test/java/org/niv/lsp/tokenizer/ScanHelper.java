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

/**
 * Shortcuts for lexer tests: scan a complete document and render tokens in
 * their compact {@code kind@line:column+length} form.
 */
public final class ScanHelper {
    private ScanHelper() {}

    public static <S extends LexState> ScanResult<S> scan(Language<S> language, String text) {
        return language.lexer().scan(text, 0, text.length(), 0, language.initialState());
    }

    public static List<String> tokens(Language<?> language, String text) {
        return describe(scan(language, text).getTokens());
    }

    public static List<String> describe(List<Token> tokens) {
        return tokens.stream().map(Token::toString).collect(Collectors.toList());
    }

    public static List<Token> onLines(List<Token> tokens, int firstLine, int lastLine) {
        return tokens.stream()
            .filter(t -> t.getLine() >= firstLine && t.getLine() <= lastLine)
            .collect(Collectors.toList());
    }

    /**
     * @return {@code snippet} repeated until the text has at least {@code minLines} lines
     */
    public static String repeat(String snippet, int minLines) {
        var result = new StringBuilder();
        while (LineIndex.countLines(result.toString()) < minLines) {
            result.append(snippet);
        }
        return result.toString();
    }
}
