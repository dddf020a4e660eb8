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

import java.util.concurrent.Executors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.niv.lsp.tokenizer.Language;
import org.niv.lsp.tokenizer.TokenizerConfiguration;

/**
 * Starts the semantic token server for the language named by the first argument.
 */
public class NivLanguageServer extends BaseLanguageServer {
    private static final Logger logger = LogManager.getLogger(NivLanguageServer.class);

    public static final int BASE_PORT = 9990;

    private NivLanguageServer() {}

    public static void main(String[] args) {
        if (args.length < 1 || Languages.byId(args[0]).isEmpty()) {
            logger.error("Unknown language {}, expected one of {}", args.length < 1 ? "(none)" : args[0], Languages.ids());
            System.exit(2);
            return;
        }
        Language<?> language = Languages.byId(args[0]).get();
        var configuration = TokenizerConfiguration.fromSystemProperties();
        logger.debug("Tokenizer settings for {}: {}", language.getId(), configuration);

        startLanguageServer("niv " + language.getId() + " language server",
            Executors.newCachedThreadPool(),
            exec -> new TokenizerTextDocumentService(exec, language, configuration),
            portFor(language));
    }

    /**
     * @return the development port, {@value #BASE_PORT} plus the position of the language unless overridden
     */
    static int portFor(Language<?> language) {
        return Integer.getInteger(PORT_PROPERTY, BASE_PORT + Languages.ordinal(language));
    }
}
