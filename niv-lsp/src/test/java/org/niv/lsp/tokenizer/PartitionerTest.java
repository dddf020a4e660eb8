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

import static org.junit.Assert.assertEquals;

import java.util.List;

import org.junit.Test;
import org.niv.lsp.tokenizer.bash.BashLanguage;
import org.niv.lsp.tokenizer.bash.BashState;

public class PartitionerTest {
    private static final BashLanguage BASH = BashLanguage.INSTANCE;

    private static final String TEXT = String.join("\n",
        "a", "cat <<EOF", "b", "c", "d", "e", "f", "EOF", "g", "h");

    private static List<Section<BashState>> split(int count) {
        return Partitioner.partition(TEXT, LineIndex.of(TEXT), count, BASH.prescanner(), BASH.initialState());
    }

    @Test
    public void remainderGoesToLastSection() {
        LineIndex lines = LineIndex.of(TEXT);
        List<Section<BashState>> sections = split(3);
        assertEquals(3, sections.size());
        assertEquals(0, sections.get(0).getStartLine());
        assertEquals(3, sections.get(1).getStartLine());
        assertEquals(6, sections.get(2).getStartLine());
        assertEquals(0, sections.get(0).getStartOffset());
        assertEquals(lines.startOf(3), sections.get(0).getEndOffset());
        assertEquals(lines.startOf(3), sections.get(1).getStartOffset());
        assertEquals(lines.startOf(6), sections.get(1).getEndOffset());
        assertEquals(TEXT.length(), sections.get(2).getEndOffset());
        for (int i = 0; i < sections.size(); i++) {
            assertEquals(i, sections.get(i).getIndex());
        }
    }

    @Test
    public void boundaryStatesComeFromThePrescan() {
        List<Section<BashState>> sections = split(3);
        assertEquals(BashState.NORMAL, sections.get(0).getInitialState());
        assertEquals(BashState.inHeredoc("EOF", false), sections.get(1).getInitialState());
        assertEquals(BashState.inHeredoc("EOF", false), sections.get(2).getInitialState());

        List<Section<BashState>> halves = split(2);
        assertEquals(5, halves.get(1).getStartLine());
        assertEquals(BashState.inHeredoc("EOF", false), halves.get(1).getInitialState());
    }

    @Test
    public void singleSectionCoversEverything() {
        List<Section<BashState>> sections = split(1);
        assertEquals(1, sections.size());
        assertEquals(0, sections.get(0).getStartOffset());
        assertEquals(TEXT.length(), sections.get(0).getEndOffset());
        assertEquals(BashState.NORMAL, sections.get(0).getInitialState());
    }

    @Test
    public void oneSectionPerLine() {
        List<Section<BashState>> sections = split(10);
        assertEquals(10, sections.size());
        assertEquals(9, sections.get(9).getStartLine());
        assertEquals(BashState.NORMAL, sections.get(8).getInitialState());
        assertEquals(BashState.inHeredoc("EOF", false), sections.get(7).getInitialState());
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroSections() {
        split(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void moreSectionsThanLines() {
        split(11);
    }
}
