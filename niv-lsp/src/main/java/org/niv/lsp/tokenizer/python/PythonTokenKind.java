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
package org.niv.lsp.tokenizer.python;

import org.niv.lsp.tokenizer.TokenKind;

public enum PythonTokenKind implements TokenKind {
    KEYWORD("keyword"),
    STRING("string"),
    NUMBER("number"),
    COMMENT("comment"),
    FUNCTION("function"),
    METHOD("method"),
    CLASS("class"),
    DECORATOR("macro"),
    BUILTIN_FUNCTION("builtinFunction"),
    OPERATOR("operator"),
    TYPE("type"),
    PARAMETER("parameter"),
    SELF_PARAMETER("selfParameter"),
    CLS_PARAMETER("clsParameter"),
    PROPERTY("property"),
    NAMESPACE("namespace"),
    BUILTIN_CONSTANT("builtinConstant");

    private final String legendName;

    PythonTokenKind(String legendName) {
        this.legendName = legendName;
    }

    @Override
    public String legendName() {
        return legendName;
    }

    @Override
    public int legendIndex() {
        return ordinal();
    }
}
