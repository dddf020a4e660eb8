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

import java.util.ArrayDeque;
import java.util.Deque;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.niv.lsp.tokenizer.LexDiagnostic;
import org.niv.lsp.tokenizer.Lexer;
import org.niv.lsp.tokenizer.Lines;
import org.niv.lsp.tokenizer.ScanResult;
import org.niv.lsp.tokenizer.TokenCollector;

/**
 * Scans a JSON document while keeping a stack of the enclosing containers. A
 * string is a property when it is in key position of an object. Besides
 * unterminated strings and bad escapes it reports brackets that do not match,
 * containers left open at the end, and more than one root value.
 */
public class JsonLexer implements Lexer<JsonState> {

    private enum Container { OBJECT, ARRAY }

    private static final String ESCAPES = "\"\\/bfnrtu";

    private static final String[] KEYWORDS = { "true", "false", "null" };

    @Override
    public ScanResult<JsonState> scan(String text, int startOffset, int endOffset, int startLine, JsonState initialState) {
        var out = new TokenCollector(Math.max(16, (endOffset - startOffset) / 6));
        Deque<Container> containers = new ArrayDeque<>();
        boolean expectKey = false;
        int rootValues = 0;
        int line = startLine;
        int lineStart = startOffset;
        int p = startOffset;

        while (p < endOffset) {
            char c = text.charAt(p);
            int column = p - lineStart;
            switch (c) {
                case '\n':
                    line++;
                    lineStart = p + 1;
                    p++;
                    break;
                case ' ': case '\t': case '\r':
                    p++;
                    break;
                case '{':
                case '[':
                    if (containers.isEmpty()) {
                        rootValues++;
                    }
                    containers.push(c == '{' ? Container.OBJECT : Container.ARRAY);
                    expectKey = c == '{';
                    p++;
                    break;
                case '}':
                case ']':
                    if (containers.peek() == (c == '}' ? Container.OBJECT : Container.ARRAY)) {
                        containers.pop();
                    }
                    else {
                        out.error(LexDiagnostic.Kind.STRUCTURAL_MISMATCH, line, column, column + 1, "Unexpected '" + c + "'");
                    }
                    if (containers.peek() == Container.OBJECT) {
                        expectKey = false;
                    }
                    p++;
                    break;
                case '"': {
                    boolean key = expectKey && containers.peek() == Container.OBJECT;
                    if (containers.isEmpty()) {
                        rootValues++;
                    }
                    int stringEnd = string(text, p, endOffset, line, column, out);
                    out.add(key ? PROPERTY : STRING, line, column, stringEnd - p);
                    if (key) {
                        expectKey = false;
                    }
                    p = stringEnd;
                    break;
                }
                case ':':
                    expectKey = false;
                    p++;
                    break;
                case ',':
                    if (containers.peek() == Container.OBJECT) {
                        expectKey = true;
                    }
                    p++;
                    break;
                default: {
                    int valueEnd = c == '-' || Lines.isDigit(c) ? numberEnd(text, p, endOffset) : keywordEnd(text, p, endOffset);
                    if (valueEnd < 0) {
                        out.error(LexDiagnostic.Kind.UNEXPECTED_CHARACTER, line, column, column + 1, "Unexpected character: " + c);
                        p++;
                        break;
                    }
                    if (containers.isEmpty()) {
                        rootValues++;
                    }
                    out.add(c == '-' || Lines.isDigit(c) ? NUMBER : KEYWORD, line, column, valueEnd - p);
                    p = valueEnd;
                    break;
                }
            }
        }

        if (!containers.isEmpty()) {
            int column = p - lineStart;
            out.error(LexDiagnostic.Kind.STRUCTURAL_MISMATCH, line, column, column + 1, "Unexpected end of input");
        }
        if (rootValues > 1) {
            out.error(LexDiagnostic.Kind.STRUCTURAL_MISMATCH, startLine, 0, 1, "Multiple root values in JSON");
        }
        return new ScanResult<>(out.getTokens(), initialState, out.getDiagnostics());
    }

    /**
     * Scan the string starting at {@code from}. Strings end at the line break
     * at the latest.
     *
     * @param out receives escape and unterminated diagnostics, may be null
     * @return the offset after the closing quote, or the end of the line when there is none
     */
    static int string(String text, int from, int end, int line, int column, @Nullable TokenCollector out) {
        int i = from + 1;
        while (i < end) {
            char c = text.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\n' || c == '\r') {
                break;
            }
            if (c == '\\') {
                char escape = Lines.charAt(text, i + 1, end);
                if (escape == '\0' || escape == '\n' || escape == '\r') {
                    i++;
                    break;
                }
                if (out != null && ESCAPES.indexOf(escape) < 0) {
                    int at = column + (i + 1 - from);
                    out.error(LexDiagnostic.Kind.INVALID_ESCAPE, line, at, at + 1, "Invalid escape sequence: \\" + escape);
                }
                i += 2;
                continue;
            }
            i++;
        }
        if (out != null) {
            out.error(LexDiagnostic.Kind.UNTERMINATED_LITERAL, line, column, column + (i - from), "Unterminated string");
        }
        return i;
    }

    /**
     * @return the offset after the number at {@code from}
     */
    static int numberEnd(String text, int from, int end) {
        int i = from;
        if (text.charAt(i) == '-') {
            i++;
        }
        i = digitsEnd(text, i, end);
        if (Lines.charAt(text, i, end) == '.') {
            i = digitsEnd(text, i + 1, end);
        }
        char e = Lines.charAt(text, i, end);
        if (e == 'e' || e == 'E') {
            i++;
            char sign = Lines.charAt(text, i, end);
            if (sign == '+' || sign == '-') {
                i++;
            }
            i = digitsEnd(text, i, end);
        }
        return i;
    }

    /**
     * @return the offset after {@code true}, {@code false} or {@code null} at {@code from}, or -1
     */
    static int keywordEnd(String text, int from, int end) {
        for (String keyword : KEYWORDS) {
            if (Lines.startsWith(text, from, end, keyword)) {
                return from + keyword.length();
            }
        }
        return -1;
    }

    private static int digitsEnd(String text, int from, int end) {
        int i = from;
        while (i < end && Lines.isDigit(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
