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

import java.util.Objects;

import org.niv.lsp.tokenizer.LexState;

/**
 * Line boundary state of a YAML document. Block scalars ({@code |} and
 * {@code >}) are the only construct whose lines need to be known in advance.
 */
public abstract class YamlState implements LexState {

    public enum Kind { NORMAL, IN_BLOCK_SCALAR }

    public enum Style {
        LITERAL('|'),
        FOLDED('>');

        private final char indicator;

        Style(char indicator) {
            this.indicator = indicator;
        }

        public char getIndicator() {
            return indicator;
        }

        public static Style of(char indicator) {
            return indicator == '|' ? LITERAL : FOLDED;
        }
    }

    public static final YamlState NORMAL = new Normal();

    private YamlState() {}

    public abstract Kind getKind();

    /**
     * A block scalar never needs closing: the input may end inside one.
     */
    @Override
    public boolean isUnterminated() {
        return false;
    }

    public static YamlState inBlockScalar(int indent, Style style) {
        return new InBlockScalar(indent, style);
    }

    public static final class Normal extends YamlState {
        private Normal() {}

        @Override
        public Kind getKind() {
            return Kind.NORMAL;
        }

        @Override
        public String toString() {
            return "Normal";
        }
    }

    public static final class InBlockScalar extends YamlState {
        private final int indent;
        private final Style style;

        private InBlockScalar(int indent, Style style) {
            this.indent = indent;
            this.style = style;
        }

        @Override
        public Kind getKind() {
            return Kind.IN_BLOCK_SCALAR;
        }

        /**
         * @return indentation of the line that holds the indicator; content lines are indented deeper
         */
        public int getIndent() {
            return indent;
        }

        public Style getStyle() {
            return style;
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof InBlockScalar)) {
                return false;
            }
            InBlockScalar other = (InBlockScalar) obj;
            return indent == other.indent && style == other.style;
        }

        @Override
        public int hashCode() {
            return Objects.hash(indent, style);
        }

        @Override
        public String toString() {
            return "InBlockScalar(" + indent + ", " + style.getIndicator() + ")";
        }
    }
}
