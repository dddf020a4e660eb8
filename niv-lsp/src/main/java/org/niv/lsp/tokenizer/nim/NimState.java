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
package org.niv.lsp.tokenizer.nim;

import org.niv.lsp.tokenizer.LexState;

/**
 * Line boundary state of a Nim module.
 *
 * <p>Besides the constructs that really span lines (nested block comments
 * and triple-quoted strings) the state remembers whether the next line is
 * part of an {@code enum} body, so that its members can be recognized no
 * matter where the document was split.</p>
 */
public abstract class NimState implements LexState {

    public enum Kind { NORMAL, IN_BLOCK_COMMENT, IN_MULTILINE_STRING, IN_ENUM_BODY }

    public static final NimState NORMAL = new Normal();

    private static final InMultilineString STRING = new InMultilineString(false);
    private static final InMultilineString RAW_STRING = new InMultilineString(true);

    private NimState() {}

    public abstract Kind getKind();

    public static NimState inBlockComment(int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("Block comment depth must be positive: " + depth);
        }
        return new InBlockComment(depth);
    }

    public static NimState inMultilineString(boolean raw) {
        return raw ? RAW_STRING : STRING;
    }

    public static NimState inEnumBody(int memberIndent) {
        return new InEnumBody(memberIndent);
    }

    public static final class Normal extends NimState {
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

    public static final class InBlockComment extends NimState {
        private final int depth;

        private InBlockComment(int depth) {
            this.depth = depth;
        }

        @Override
        public Kind getKind() {
            return Kind.IN_BLOCK_COMMENT;
        }

        @Override
        public boolean isUnterminated() {
            return true;
        }

        /**
         * @return the number of {@code #[} still waiting for their {@code ]#}
         */
        public int getDepth() {
            return depth;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof InBlockComment && ((InBlockComment) obj).depth == depth;
        }

        @Override
        public int hashCode() {
            return depth;
        }

        @Override
        public String toString() {
            return "InBlockComment(" + depth + ")";
        }
    }

    public static final class InMultilineString extends NimState {
        private final boolean raw;

        private InMultilineString(boolean raw) {
            this.raw = raw;
        }

        @Override
        public Kind getKind() {
            return Kind.IN_MULTILINE_STRING;
        }

        @Override
        public boolean isUnterminated() {
            return true;
        }

        public boolean isRaw() {
            return raw;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof InMultilineString && ((InMultilineString) obj).raw == raw;
        }

        @Override
        public int hashCode() {
            return raw ? 1 : 0;
        }

        @Override
        public String toString() {
            return raw ? "InMultilineString(raw)" : "InMultilineString";
        }
    }

    public static final class InEnumBody extends NimState {
        private final int memberIndent;

        private InEnumBody(int memberIndent) {
            this.memberIndent = memberIndent;
        }

        @Override
        public Kind getKind() {
            return Kind.IN_ENUM_BODY;
        }

        @Override
        public boolean isUnterminated() {
            return false;
        }

        /**
         * @return the smallest indentation of a line that still belongs to the body
         */
        public int getMemberIndent() {
            return memberIndent;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof InEnumBody && ((InEnumBody) obj).memberIndent == memberIndent;
        }

        @Override
        public int hashCode() {
            return memberIndent;
        }

        @Override
        public String toString() {
            return "InEnumBody(" + memberIndent + ")";
        }
    }
}
