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

import java.util.Arrays;
import java.util.List;

import org.niv.lsp.tokenizer.Language;
import org.niv.lsp.tokenizer.Lexer;
import org.niv.lsp.tokenizer.Prescanner;

public final class PythonLanguage implements Language<PythonState> {
    public static final PythonLanguage INSTANCE = new PythonLanguage();

    private static final List<PythonTokenKind> KINDS = List.copyOf(Arrays.asList(PythonTokenKind.values()));

    private final PythonLexer lexer = new PythonLexer();

    private PythonLanguage() {}

    @Override
    public String getId() {
        return "python";
    }

    @Override
    public List<PythonTokenKind> getTokenKinds() {
        return KINDS;
    }

    @Override
    public PythonState initialState() {
        return PythonState.NORMAL;
    }

    @Override
    public Lexer<PythonState> lexer() {
        return lexer;
    }

    @Override
    public Prescanner<PythonState> prescanner() {
        return lexer;
    }
}
