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
package org.niv.lsp.tokenizer.json;

import static org.niv.lsp.tokenizer.json.JsonTokenKind.KEYWORD;
import static org.niv.lsp.tokenizer.json.JsonTokenKind.NUMBER;
import static org.niv.lsp.tokenizer.json.JsonTokenKind.PROPERTY;
import static org.niv.lsp.tokenizer.json.JsonTokenKind.STRING;

import java.util.Collections;
import java.util.List;

import org.niv.lsp.tokenizer.LineIndex;
import org.niv.lsp.tokenizer.Lines;
import org.niv.lsp.tokenizer.RangeLexer;
import org.niv.lsp.tokenizer.Token;
import org.niv.lsp.tokenizer.TokenCollector;

/**
 * Tokenizes a line range of a JSON document without looking at what comes
 * before it. Without the container stack a string is classified by what
 * follows it: it is a property when the next non-whitespace character, on
 * this line or a later one, is a colon. On well-formed documents this agrees
 * with {@link JsonLexer}; on malformed ones it may not.
 */
public class JsonRangeLexer implements RangeLexer {

    @Override
    public List<Token> tokenizeRange(String text, int startLine, int endLine) {
        var index = LineIndex.of(text);
        if (startLine >= index.lineCount()) {
            return Collections.emptyList();
        }
        var out = new TokenCollector();
        int lastLine = Math.min(endLine, index.lineCount() - 1);
        int end = index.endAfter(lastLine);
        int line = startLine;
        int lineStart = index.startOf(startLine);
        int p = lineStart;

        while (p < end) {
            char c = text.charAt(p);
            int column = p - lineStart;
            if (c == '\n') {
                line++;
                lineStart = p + 1;
                p++;
            }
            else if (c == '"') {
                int stringEnd = JsonLexer.string(text, p, end, line, column, null);
                out.add(colonFollows(text, stringEnd) ? PROPERTY : STRING, line, column, stringEnd - p);
                p = stringEnd;
            }
            else if (c == '-' || Lines.isDigit(c)) {
                int numberEnd = JsonLexer.numberEnd(text, p, end);
                out.add(NUMBER, line, column, numberEnd - p);
                p = numberEnd;
            }
            else {
                int keywordEnd = JsonLexer.keywordEnd(text, p, end);
                if (keywordEnd > 0) {
                    out.add(KEYWORD, line, column, keywordEnd - p);
                    p = keywordEnd;
                }
                else {
                    p++;
                }
            }
        }
        return out.getTokens();
    }

    private static boolean colonFollows(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ':') {
                return true;
            }
            if (c != ' ' && c != '\t' && c != '\r' && c != '\n') {
                return false;
            }
        }
        return false;
    }
}
