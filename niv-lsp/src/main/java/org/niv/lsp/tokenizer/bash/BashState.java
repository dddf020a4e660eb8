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
package org.niv.lsp.tokenizer.bash;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.niv.lsp.tokenizer.LexState;

/**
 * Line boundary state of a shell script: either nothing is open, or a
 * here-document body is being read, or a quoted string continues on the next
 * line.
 */
public abstract class BashState implements LexState {

    public enum Kind { NORMAL, IN_HEREDOC, IN_QUOTE }

    public enum Quote {
        SINGLE('\'', false),
        DOUBLE('"', true),
        /** {@code $'...'} */
        ANSI_C('\'', true);

        private final char closing;
        private final boolean escapes;

        Quote(char closing, boolean escapes) {
            this.closing = closing;
            this.escapes = escapes;
        }

        public char getClosing() {
            return closing;
        }

        /**
         * @return whether a backslash protects the next character
         */
        public boolean hasEscapes() {
            return escapes;
        }
    }

    public static final BashState NORMAL = new Normal();

    private static final Map<Quote, InQuote> QUOTES = new EnumMap<>(Quote.class);

    static {
        for (Quote q : Quote.values()) {
            QUOTES.put(q, new InQuote(q));
        }
    }

    private BashState() {}

    public abstract Kind getKind();

    public static BashState inHeredoc(String delimiter, boolean stripTabs) {
        return new InHeredoc(delimiter, stripTabs);
    }

    public static BashState inQuote(Quote quote) {
        return QUOTES.get(quote);
    }

    public static final class Normal extends BashState {
        private Normal() {}

        @Override
        public Kind getKind() {
            return Kind.NORMAL;
        }

        @Override
        public boolean isUnterminated() {
            return false;
        }

        @Override
        public String toString() {
            return "Normal";
        }
    }

    public static final class InHeredoc extends BashState {
        private final String delimiter;
        private final boolean stripTabs;

        private InHeredoc(String delimiter, boolean stripTabs) {
            this.delimiter = delimiter;
            this.stripTabs = stripTabs;
        }

        @Override
        public Kind getKind() {
            return Kind.IN_HEREDOC;
        }

        @Override
        public boolean isUnterminated() {
            return true;
        }

        public String getDelimiter() {
            return delimiter;
        }

        /**
         * @return true for {@code <<-}, which ignores leading tabs on body and terminator lines
         */
        public boolean isStripTabs() {
            return stripTabs;
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof InHeredoc)) {
                return false;
            }
            InHeredoc other = (InHeredoc) obj;
            return stripTabs == other.stripTabs && delimiter.equals(other.delimiter);
        }

        @Override
        public int hashCode() {
            return Objects.hash(delimiter, stripTabs);
        }

        @Override
        public String toString() {
            return "InHeredoc(" + delimiter + (stripTabs ? ", stripTabs)" : ")");
        }
    }

    public static final class InQuote extends BashState {
        private final Quote quote;

        private InQuote(Quote quote) {
            this.quote = quote;
        }

        @Override
        public Kind getKind() {
            return Kind.IN_QUOTE;
        }

        @Override
        public boolean isUnterminated() {
            return true;
        }

        public Quote getQuote() {
            return quote;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof InQuote && ((InQuote) obj).quote == quote;
        }

        @Override
        public int hashCode() {
            return quote.hashCode();
        }

        @Override
        public String toString() {
            return "InQuote(" + quote + ")";
        }
    }
}
