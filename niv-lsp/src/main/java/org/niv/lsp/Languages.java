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

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.niv.lsp.tokenizer.Language;
import org.niv.lsp.tokenizer.bash.BashLanguage;
import org.niv.lsp.tokenizer.css.CssLanguage;
import org.niv.lsp.tokenizer.json.JsonLanguage;
import org.niv.lsp.tokenizer.nim.NimLanguage;
import org.niv.lsp.tokenizer.python.PythonLanguage;
import org.niv.lsp.tokenizer.yaml.YamlLanguage;

/**
 * The languages a server can be started for. The position in {@link #all()}
 * determines the default development port.
 */
public final class Languages {
    private Languages() {/* hidden */ }

    private static final List<Language<?>> ALL = List.of(
        BashLanguage.INSTANCE,
        YamlLanguage.INSTANCE,
        PythonLanguage.INSTANCE,
        NimLanguage.INSTANCE,
        JsonLanguage.INSTANCE,
        CssLanguage.INSTANCE
    );

    public static List<Language<?>> all() {
        return ALL;
    }

    public static Optional<Language<?>> byId(String id) {
        return ALL.stream()
            .filter(l -> l.getId().equals(id))
            .findFirst();
    }

    /**
     * @return the position of the language in {@link #all()}
     */
    public static int ordinal(Language<?> language) {
        int index = ALL.indexOf(language);
        if (index < 0) {
            throw new IllegalArgumentException("Not a registered language: " + language.getId());
        }
        return index;
    }

    public static List<String> ids() {
        return ALL.stream().map(Language::getId).collect(Collectors.toList());
    }
}
