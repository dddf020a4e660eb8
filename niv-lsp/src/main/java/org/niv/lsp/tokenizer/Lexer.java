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
package org.niv.lsp.tokenizer;

/**
 * Single threaded scanner for one language.
 *
 * <p>Implementations must be pure functions of the slice text and the initial
 * state: the same slice scanned from the same state yields the same result no
 * matter where it sits in a document. Nothing outside
 * {@code [startOffset, endOffset)} may be read. This is what allows the
 * {@link ParallelTokenizer} to cut a document into sections.</p>
 */
@FunctionalInterface
public interface Lexer<S extends LexState> {
    /**
     * @param text the complete document, shared read-only
     * @param startOffset offset of the first character of the slice, always at the start of a line
     * @param endOffset exclusive end of the slice
     * @param startLine the absolute line number of {@code startOffset}
     * @param initialState the state at {@code startOffset}
     */
    ScanResult<S> scan(String text, int startOffset, int endOffset, int startLine, S initialState);
}
