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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a document into contiguous, line aligned sections and runs the
 * prescanner over the section boundaries, left to right.
 */
public final class Partitioner {
    private Partitioner() {/* hidden */ }

    /**
     * Divides the lines of {@code text} over {@code sectionCount} sections. Every
     * section gets {@code lineCount / sectionCount} lines, the last one also
     * takes the remainder. The prescan chain covers the first
     * {@code sectionCount - 1} sections; each call starts from the state the
     * previous one produced.
     */
    public static <S extends LexState> List<Section<S>> partition(String text, LineIndex lines, int sectionCount,
            Prescanner<S> prescanner, S initialState) {
        if (sectionCount < 1 || sectionCount > lines.lineCount()) {
            throw new IllegalArgumentException("Cannot split " + lines.lineCount() + " lines into " + sectionCount + " sections");
        }
        int linesPerSection = lines.lineCount() / sectionCount;
        List<Section<S>> sections = new ArrayList<>(sectionCount);
        S state = initialState;
        for (int t = 0; t < sectionCount; t++) {
            boolean last = t == sectionCount - 1;
            int firstLine = t * linesPerSection;
            int lastLine = last ? lines.lineCount() - 1 : (t + 1) * linesPerSection - 1;
            int start = lines.startOf(firstLine);
            int end = lines.endAfter(lastLine);
            sections.add(new Section<>(t, start, end, firstLine, state));
            if (!last) {
                state = prescanner.scanState(text, start, end, state);
            }
        }
        return sections;
    }
}
