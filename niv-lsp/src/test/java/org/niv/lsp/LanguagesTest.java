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
package org.niv.lsp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;

import java.util.List;

import org.junit.After;
import org.junit.Test;
import org.niv.lsp.tokenizer.Language;
import org.niv.lsp.tokenizer.LexState;
import org.niv.lsp.tokenizer.Lexer;
import org.niv.lsp.tokenizer.Prescanner;
import org.niv.lsp.tokenizer.TokenKind;
import org.niv.lsp.tokenizer.css.CssLanguage;
import org.niv.lsp.tokenizer.json.JsonLanguage;
import org.niv.lsp.tokenizer.python.PythonLanguage;

public class LanguagesTest {

    @After
    public void clearPort() {
        System.clearProperty(BaseLanguageServer.PORT_PROPERTY);
    }

    @Test
    public void lookupById() {
        assertEquals(List.of("bash", "yaml", "python", "nim", "json", "css"), Languages.ids());
        assertSame(PythonLanguage.INSTANCE, Languages.byId("python").get());
        assertFalse(Languages.byId("cobol").isPresent());
    }

    @Test
    public void defaultPortsFollowRegistrationOrder() {
        assertEquals(9990, NivLanguageServer.portFor(Languages.byId("bash").get()));
        assertEquals(9994, NivLanguageServer.portFor(JsonLanguage.INSTANCE));
        assertEquals(9995, NivLanguageServer.portFor(CssLanguage.INSTANCE));
    }

    @Test
    public void portCanBeOverridden() {
        System.setProperty(BaseLanguageServer.PORT_PROPERTY, "12345");
        assertEquals(12345, NivLanguageServer.portFor(PythonLanguage.INSTANCE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unregisteredLanguageHasNoOrdinal() {
        Languages.ordinal(new Language<LexState>() {
            @Override
            public String getId() {
                return "other";
            }

            @Override
            public List<? extends TokenKind> getTokenKinds() {
                return List.of();
            }

            @Override
            public LexState initialState() {
                return PythonLanguage.INSTANCE.initialState();
            }

            @Override
            public Lexer<LexState> lexer() {
                throw new UnsupportedOperationException();
            }

            @Override
            public Prescanner<LexState> prescanner() {
                throw new UnsupportedOperationException();
            }
        });
    }
}
