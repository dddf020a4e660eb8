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

/**
 * Line walking helpers shared by every line lexer and prescanner, so that both
 * agree on where lines start and end inside a slice.
 */
public final class Lines {
    private Lines() {/* hidden */ }

    /**
     * @return the offset of the next {@code '\n'} at or after {@code from}, or {@code end} if the slice has none
     */
    public static int lineEnd(String text, int from, int end) {
        for (int i = from; i < end; i++) {
            if (text.charAt(i) == '\n') {
                return i;
            }
        }
        return end;
    }

    /**
     * @return {@code lineEnd} without a trailing carriage return
     */
    public static int contentEnd(String text, int lineStart, int lineEnd) {
        if (lineEnd > lineStart && text.charAt(lineEnd - 1) == '\r') {
            return lineEnd - 1;
        }
        return lineEnd;
    }

    /**
     * A slice that stops right behind a newline does not own the (possibly
     * empty) line after it, unless that line is the last line of the document.
     *
     * @param next the offset right after a newline
     */
    public static boolean continuesAt(String text, int next, int end) {
        return next < end || next == text.length();
    }

    /**
     * @return offset of the first character at or after {@code from} that is not a space or tab, bounded by {@code end}
     */
    public static int skipBlanks(String text, int from, int end) {
        int i = from;
        while (i < end && isBlank(text.charAt(i))) {
            i++;
        }
        return i;
    }

    public static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    public static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    /**
     * @return the end of the identifier starting at {@code from}
     */
    public static int identifierEnd(String text, int from, int end) {
        int i = from;
        while (i < end && isIdentifierPart(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Bounded {@link String#startsWith(String, int)}: the prefix must fit before {@code end}.
     */
    public static boolean startsWith(String text, int at, int end, String prefix) {
        return at + prefix.length() <= end && text.startsWith(prefix, at);
    }

    /**
     * @return the char at {@code at}, or {@code '\0'} when {@code at} lies outside {@code [0, end)}
     */
    public static char charAt(String text, int at, int end) {
        return at >= 0 && at < end ? text.charAt(at) : '\0';
    }

    /**
     * @return offset of the first {@code c} in {@code [from, end)}, or -1
     */
    public static int indexOf(String text, char c, int from, int end) {
        for (int i = from; i < end; i++) {
            if (text.charAt(i) == c) {
                return i;
            }
        }
        return -1;
    }
}
