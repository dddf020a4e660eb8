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

import java.util.concurrent.atomic.AtomicReference;

import org.niv.lsp.util.Versioned;

/**
 * The current contents of one open editor. Updates that arrive out of order
 * never replace a newer version.
 */
public class TextDocumentState {
    private final String uri;
    private final AtomicReference<Versioned<String>> current;

    public TextDocumentState(String uri, int initialVersion, String initialContent, long initialTimestamp) {
        this.uri = uri;
        this.current = new AtomicReference<>(new Versioned<>(initialVersion, initialContent, initialTimestamp));
    }

    public String getUri() {
        return uri;
    }

    /**
     * @return false if the state already held {@code version} or a later one
     */
    public boolean update(int version, String content, long timestamp) {
        return Versioned.replaceIfNewer(current, new Versioned<>(version, content, timestamp));
    }

    public Versioned<String> getCurrentContent() {
        return current.get();
    }
}
