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
package org.niv.lsp.tokenizer.css;

import java.util.List;
import java.util.Objects;

import org.niv.lsp.tokenizer.LexState;

/**
 * Line boundary state of a style sheet.
 *
 * <p>Whether a word is a selector, a property or a value depends on the
 * blocks that are open around it, so the state carries the whole block
 * stack: every <code>{</code> pushes a {@link Block} that tells whether its body
 * holds rules (the body of {@code @media} and friends) or declarations.
 * On top of that it remembers whether a declaration value has started and
 * whether a nesting at-rule is waiting for its block. Comments are the only
 * construct that span lines.</p>
 */
public abstract class CssState implements LexState {

    public enum Kind { NORMAL, IN_COMMENT }

    public enum Block { RULES, DECLARATIONS }

    public static final CssState NORMAL = new Normal(List.of(), false, false);

    private final List<Block> blocks;
    private final boolean inValue;
    private final boolean afterAtRule;

    private CssState(List<Block> blocks, boolean inValue, boolean afterAtRule) {
        this.blocks = blocks;
        this.inValue = inValue;
        this.afterAtRule = afterAtRule;
    }

    public abstract Kind getKind();

    /**
     * @return the open blocks, outermost first
     */
    public List<Block> getBlocks() {
        return blocks;
    }

    public int getBraceDepth() {
        return blocks.size();
    }

    /**
     * @return whether a {@code :} has been seen in the current declaration
     */
    public boolean isInValue() {
        return inValue;
    }

    /**
     * @return whether the next <code>{</code> opens the rule block of an at-rule
     */
    public boolean isAfterAtRule() {
        return afterAtRule;
    }

    /**
     * Selectors appear at the top level and directly inside at-rule blocks.
     */
    public static boolean isSelectorContext(List<Block> blocks) {
        return blocks.isEmpty() || blocks.get(blocks.size() - 1) == Block.RULES;
    }

    public static CssState normal(List<Block> blocks, boolean inValue, boolean afterAtRule) {
        if (blocks.isEmpty() && !inValue && !afterAtRule) {
            return NORMAL;
        }
        return new Normal(List.copyOf(blocks), inValue, afterAtRule);
    }

    public static CssState inComment(List<Block> blocks, boolean inValue, boolean afterAtRule) {
        return new InComment(List.copyOf(blocks), inValue, afterAtRule);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        CssState other = (CssState) obj;
        return inValue == other.inValue && afterAtRule == other.afterAtRule && blocks.equals(other.blocks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), blocks, inValue, afterAtRule);
    }

    String describe() {
        return blocks + (inValue ? ", value" : "") + (afterAtRule ? ", at-rule" : "");
    }

    public static final class Normal extends CssState {
        private Normal(List<Block> blocks, boolean inValue, boolean afterAtRule) {
            super(blocks, inValue, afterAtRule);
        }

        @Override
        public Kind getKind() {
            return Kind.NORMAL;
        }

        /**
         * Blocks still open at the end of the input are not reported.
         */
        @Override
        public boolean isUnterminated() {
            return false;
        }

        @Override
        public String toString() {
            return "Normal(" + describe() + ")";
        }
    }

    public static final class InComment extends CssState {
        private InComment(List<Block> blocks, boolean inValue, boolean afterAtRule) {
            super(blocks, inValue, afterAtRule);
        }

        @Override
        public Kind getKind() {
            return Kind.IN_COMMENT;
        }

        @Override
        public boolean isUnterminated() {
            return true;
        }

        @Override
        public String toString() {
            return "InComment(" + describe() + ")";
        }
    }
}
