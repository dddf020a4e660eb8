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

import java.util.Arrays;
import java.util.List;

import org.niv.lsp.tokenizer.Language;
import org.niv.lsp.tokenizer.Lexer;
import org.niv.lsp.tokenizer.Prescanner;
import org.niv.lsp.tokenizer.RangeLexer;
import org.niv.lsp.tokenizer.RangeStrategy;

public final class JsonLanguage implements Language<JsonState> {
    public static final JsonLanguage INSTANCE = new JsonLanguage();

    private static final List<JsonTokenKind> KINDS = List.copyOf(Arrays.asList(JsonTokenKind.values()));

    private final JsonLexer lexer = new JsonLexer();
    private final JsonRangeLexer rangeLexer = new JsonRangeLexer();

    private JsonLanguage() {}

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public List<JsonTokenKind> getTokenKinds() {
        return KINDS;
    }

    @Override
    public JsonState initialState() {
        return JsonState.NORMAL;
    }

    @Override
    public Lexer<JsonState> lexer() {
        return lexer;
    }

    /**
     * JSON carries no line boundary state, so the prescan is the identity.
     */
    @Override
    public Prescanner<JsonState> prescanner() {
        return (text, startOffset, endOffset, initialState) -> initialState;
    }

    @Override
    public boolean isPartitionable() {
        return false;
    }

    @Override
    public RangeStrategy rangeStrategy() {
        return RangeStrategy.LOCAL_LOOKAHEAD;
    }

    @Override
    public RangeLexer rangeLexer() {
        return rangeLexer;
    }
}
