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
package org.niv.lsp.tokenizer.yaml;

import static org.niv.lsp.tokenizer.yaml.YamlTokenKind.ANCHOR;
import static org.niv.lsp.tokenizer.yaml.YamlTokenKind.COMMENT;
import static org.niv.lsp.tokenizer.yaml.YamlTokenKind.KEYWORD;
import static org.niv.lsp.tokenizer.yaml.YamlTokenKind.NAMESPACE;
import static org.niv.lsp.tokenizer.yaml.YamlTokenKind.NUMBER;
import static org.niv.lsp.tokenizer.yaml.YamlTokenKind.OPERATOR;
import static org.niv.lsp.tokenizer.yaml.YamlTokenKind.PROPERTY;
import static org.niv.lsp.tokenizer.yaml.YamlTokenKind.STRING;
import static org.niv.lsp.tokenizer.yaml.YamlTokenKind.TYPE;

import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.niv.lsp.tokenizer.AbstractLineLexer;
import org.niv.lsp.tokenizer.Lines;
import org.niv.lsp.tokenizer.TokenCollector;

/**
 * YAML lexer. Every line is read as an optional sequence dash, an optional
 * key with its colon, and a value; a value that is a block scalar indicator
 * turns the deeper indented lines that follow into string content.
 */
public class YamlLexer extends AbstractLineLexer<YamlState> {

    private static final Set<String> KEYWORDS = Set.of(
        "null", "~", "Null", "NULL",
        "true", "false", "True", "False", "TRUE", "FALSE",
        "yes", "no", "Yes", "No", "YES", "NO",
        "on", "off", "On", "Off", "ON", "OFF",
        ".inf", "-.inf", "+.inf", ".Inf", "-.Inf", "+.Inf",
        ".INF", "-.INF", "+.INF", ".nan", ".NaN", ".NAN");

    @Override
    protected YamlState scanLine(String text, int start, int end, int line, YamlState state, @Nullable TokenCollector out) {
        if (end == start) {
            // an empty line ends a block scalar
            return YamlState.NORMAL;
        }
        int p = skipSpaces(text, start, end);
        int indent = p - start;

        if (state instanceof YamlState.InBlockScalar && indent > ((YamlState.InBlockScalar) state).getIndent()) {
            add(out, STRING, line, p - start, end - p);
            return state;
        }
        if (p >= end) {
            return YamlState.NORMAL;
        }

        if (indent == 0 && isMarker(text, p, end, "---")) {
            add(out, TYPE, line, 0, 3);
            p = skipSpaces(text, p + 3, end);
            if (p >= end) {
                return YamlState.NORMAL;
            }
        }
        else if (indent == 0 && isMarker(text, p, end, "...")) {
            add(out, TYPE, line, 0, 3);
            return YamlState.NORMAL;
        }

        char c = text.charAt(p);
        if ((indent == 0 && c == '%') || c == '#') {
            add(out, c == '%' ? NAMESPACE : COMMENT, line, p - start, end - p);
            return YamlState.NORMAL;
        }
        if (c == '-' && Lines.charAt(text, p + 1, end) == ' ') {
            add(out, OPERATOR, line, p - start, 1);
            p = skipSpaces(text, p + 2, end);
            if (p >= end) {
                return YamlState.NORMAL;
            }
            c = text.charAt(p);
        }

        int colon;
        if (c == '"' || c == '\'') {
            int keyEnd = quotedEnd(text, p, end);
            colon = skipSpaces(text, keyEnd, end);
            if (isValueIndicator(text, colon, end)) {
                add(out, PROPERTY, line, p - start, keyEnd - p);
            }
            else {
                colon = -1;
            }
        }
        else {
            colon = bareKeyColon(text, start, p, end);
            if (colon > p) {
                add(out, PROPERTY, line, p - start, trimEnd(text, p, colon) - p);
            }
        }

        if (colon >= 0) {
            add(out, OPERATOR, line, colon - start, 1);
            p = skipSpaces(text, colon + 1, end);
            if (p >= end) {
                return YamlState.NORMAL;
            }
            if (text.charAt(p) == '#') {
                add(out, COMMENT, line, p - start, end - p);
                return YamlState.NORMAL;
            }
        }
        return value(text, start, p, end, line, indent, out);
    }

    /**
     * Tag, anchor and alias prefixes, then either a block scalar indicator or
     * a scalar with an optional trailing comment.
     */
    private static YamlState value(String text, int start, int from, int end, int line, int indent, @Nullable TokenCollector out) {
        int p = from;
        if (text.charAt(p) == '!') {
            int tagEnd = until(text, p + 1, end, " \t");
            add(out, TYPE, line, p - start, tagEnd - p);
            p = skipSpaces(text, tagEnd, end);
        }
        if (Lines.charAt(text, p, end) == '&') {
            int anchorEnd = until(text, p + 1, end, " \t,]}");
            add(out, ANCHOR, line, p - start, anchorEnd - p);
            p = skipSpaces(text, anchorEnd, end);
        }
        if (Lines.charAt(text, p, end) == '*') {
            int aliasEnd = until(text, p + 1, end, " \t,]}");
            add(out, ANCHOR, line, p - start, aliasEnd - p);
            p = skipSpaces(text, aliasEnd, end);
            if (Lines.charAt(text, p, end) == '#') {
                add(out, COMMENT, line, p - start, end - p);
            }
            return YamlState.NORMAL;
        }
        if (p >= end) {
            return YamlState.NORMAL;
        }

        char c = text.charAt(p);
        if (c == '|' || c == '>') {
            int headerEnd = p + 1;
            while (headerEnd < end && (text.charAt(headerEnd) == '+' || text.charAt(headerEnd) == '-' || Lines.isDigit(text.charAt(headerEnd)))) {
                headerEnd++;
            }
            int after = skipSpaces(text, headerEnd, end);
            if (after == end || (after > headerEnd && text.charAt(after) == '#')) {
                add(out, OPERATOR, line, p - start, 1);
                add(out, COMMENT, line, after - start, end - after);
                return YamlState.inBlockScalar(indent, YamlState.Style.of(c));
            }
        }

        int valueEnd = end;
        int comment = commentStart(text, start, p, end);
        if (comment >= 0) {
            valueEnd = trimEnd(text, p, comment);
        }
        if (out != null && p < valueEnd) {
            scalar(text, start, p, valueEnd, line, out);
        }
        if (comment >= 0) {
            add(out, COMMENT, line, comment - start, end - comment);
        }
        return YamlState.NORMAL;
    }

    private static void scalar(String text, int start, int from, int end, int line, TokenCollector out) {
        char c = text.charAt(from);
        if (c == '"' || c == '\'') {
            out.add(STRING, line, from - start, quotedEnd(text, from, end) - from);
        }
        else if (c == '[' || c == '{') {
            flow(text, start, from, end, line, out);
        }
        else {
            plain(text, start, from, trimEnd(text, from, end), line, out);
        }
    }

    /**
     * Inline collections: {@code [a, b]} and {@code {k: v}}.
     */
    private static void flow(String text, int start, int from, int end, int line, TokenCollector out) {
        int p = from;
        while (p < end) {
            char c = text.charAt(p);
            switch (c) {
                case ' ': case '\t': case ',': case '[': case ']': case '{': case '}':
                    p++;
                    break;
                case ':':
                    if (p + 1 >= end || " ,}]".indexOf(text.charAt(p + 1)) >= 0) {
                        out.add(OPERATOR, line, p - start, 1);
                    }
                    p++;
                    break;
                case '#':
                    out.add(COMMENT, line, p - start, end - p);
                    return;
                case '"': case '\'': {
                    int stringEnd = quotedEnd(text, p, end);
                    boolean key = Lines.charAt(text, skipSpaces(text, stringEnd, end), end) == ':';
                    out.add(key ? PROPERTY : STRING, line, p - start, stringEnd - p);
                    p = stringEnd;
                    break;
                }
                case '&': case '*': case '!': {
                    int nameEnd = until(text, p + 1, end, " ,]}");
                    out.add(c == '!' ? TYPE : ANCHOR, line, p - start, nameEnd - p);
                    p = nameEnd;
                    break;
                }
                default: {
                    int valueStart = p;
                    while (p < end && ",]}#".indexOf(text.charAt(p)) < 0) {
                        if (text.charAt(p) == ':' && p + 1 < end && " ,]}".indexOf(text.charAt(p + 1)) >= 0) {
                            break;
                        }
                        p++;
                    }
                    int valueEnd = trimEnd(text, valueStart, p);
                    if (valueEnd > valueStart) {
                        if (Lines.charAt(text, skipSpaces(text, p, end), end) == ':') {
                            out.add(PROPERTY, line, valueStart - start, valueEnd - valueStart);
                        }
                        else {
                            plain(text, start, valueStart, valueEnd, line, out);
                        }
                    }
                    break;
                }
            }
        }
    }

    private static void plain(String text, int start, int from, int to, int line, TokenCollector out) {
        if (to <= from) {
            return;
        }
        String value = text.substring(from, to);
        if (KEYWORDS.contains(value)) {
            out.add(KEYWORD, line, from - start, to - from);
        }
        else if (isNumber(value)) {
            out.add(NUMBER, line, from - start, to - from);
        }
    }

    /**
     * Decimal, hexadecimal ({@code 0x}), octal ({@code 0o}) and binary
     * ({@code 0b}) integers, and decimal floats with an optional exponent.
     * Underscores are allowed between digits.
     */
    static boolean isNumber(String value) {
        int n = value.length();
        int i = 0;
        if (i < n && (value.charAt(i) == '+' || value.charAt(i) == '-')) {
            i++;
        }
        if (i >= n) {
            return false;
        }
        if (i + 1 < n && value.charAt(i) == '0') {
            char radix = Character.toLowerCase(value.charAt(i + 1));
            String digits = radix == 'x' ? "0123456789abcdefABCDEF_"
                : radix == 'o' ? "01234567_"
                : radix == 'b' ? "01_"
                : null;
            if (digits != null) {
                i += 2;
                if (i >= n) {
                    return false;
                }
                for (; i < n; i++) {
                    if (digits.indexOf(value.charAt(i)) < 0) {
                        return false;
                    }
                }
                return true;
            }
        }

        boolean hasDigit = false;
        for (; i < n && (Lines.isDigit(value.charAt(i)) || value.charAt(i) == '_'); i++) {
            hasDigit |= value.charAt(i) != '_';
        }
        if (i < n && value.charAt(i) == '.') {
            for (i++; i < n && (Lines.isDigit(value.charAt(i)) || value.charAt(i) == '_'); i++) {
                hasDigit |= value.charAt(i) != '_';
            }
        }
        if (i < n && (value.charAt(i) == 'e' || value.charAt(i) == 'E')) {
            i++;
            if (i < n && (value.charAt(i) == '+' || value.charAt(i) == '-')) {
                i++;
            }
            boolean hasExponent = false;
            for (; i < n && (Lines.isDigit(value.charAt(i)) || value.charAt(i) == '_'); i++) {
                hasExponent |= value.charAt(i) != '_';
            }
            if (!hasExponent) {
                return false;
            }
        }
        return i == n && hasDigit;
    }

    private static boolean isMarker(String text, int at, int end, String marker) {
        return Lines.startsWith(text, at, end, marker) && (at + 3 == end || Lines.isBlank(text.charAt(at + 3)));
    }

    /**
     * A colon separates key and value only when followed by whitespace or the end of the line.
     */
    private static boolean isValueIndicator(String text, int at, int end) {
        return at < end && text.charAt(at) == ':' && (at + 1 >= end || Lines.isBlank(text.charAt(at + 1)));
    }

    private static int bareKeyColon(String text, int start, int from, int end) {
        for (int i = from; i < end; i++) {
            if (isValueIndicator(text, i, end)) {
                return i;
            }
            if (text.charAt(i) == '#' && i > start && Lines.isBlank(text.charAt(i - 1))) {
                return -1;
            }
        }
        return -1;
    }

    /**
     * @return offset of a {@code #} that starts a comment, skipping quoted parts, or -1
     */
    private static int commentStart(String text, int start, int from, int end) {
        char quote = 0;
        for (int i = from; i < end; i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\' && quote == '"') {
                    i++;
                }
                else if (c == quote) {
                    quote = 0;
                }
            }
            else if (c == '"' || c == '\'') {
                quote = c;
            }
            else if (c == '#' && i > start && Lines.isBlank(text.charAt(i - 1))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return offset right after the closing quote of the string at {@code from}, or {@code end}
     */
    private static int quotedEnd(String text, int from, int end) {
        char quote = text.charAt(from);
        for (int i = from + 1; i < end; i++) {
            char c = text.charAt(i);
            if (c == '\\' && quote == '"') {
                i++;
            }
            else if (c == quote) {
                return i + 1;
            }
        }
        return end;
    }

    private static int until(String text, int from, int end, String stops) {
        int i = from;
        while (i < end && stops.indexOf(text.charAt(i)) < 0) {
            i++;
        }
        return i;
    }

    private static int skipSpaces(String text, int from, int end) {
        int i = from;
        while (i < end && text.charAt(i) == ' ') {
            i++;
        }
        return i;
    }

    private static int trimEnd(String text, int from, int to) {
        int i = to;
        while (i > from && Lines.isBlank(text.charAt(i - 1))) {
            i--;
        }
        return i;
    }

    private static void add(@Nullable TokenCollector out, YamlTokenKind kind, int line, int column, int length) {
        if (out != null) {
            out.add(kind, line, column, length);
        }
    }

    @Override
    protected String unterminatedMessage(YamlState state) {
        return "Unterminated block scalar";
    }
}
