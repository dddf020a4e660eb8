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
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;
import org.niv.lsp.tokenizer.json.JsonLanguage;
import org.niv.lsp.tokenizer.json.JsonTokenKind;
import org.niv.lsp.tokenizer.python.PythonLanguage;

public class RangeTokenizerTest {
    private static final TokenizerConfiguration SMALL_THRESHOLD = TokenizerConfiguration.DEFAULT.withParallelLineThreshold(1);

    @Test
    public void filteredRangeIsSubsetOfFullTokens() {
        for (Language<?> language : SampleDocuments.languages()) {
            if (!language.rangeStrategy().isExact()) {
                continue;
            }
            String text = ScanHelper.repeat(SampleDocuments.sampleFor(language), 80);
            var full = ParallelTokenizer.forLanguage(language, SMALL_THRESHOLD);
            var range = new RangeTokenizer<>(full);
            List<Token> all = full.tokenizeSequential(text).getTokens();
            int lines = LineIndex.countLines(text);
            for (int start = 0; start < lines; start += 13) {
                int end = Math.min(lines - 1, start + 20);
                List<Token> inRange = range.tokenizeRange(text, start, end);
                assertEquals(language.getId() + " [" + start + ", " + end + "]", ScanHelper.onLines(all, start, end), inRange);
                assertTrue(all.containsAll(inRange));
            }
        }
    }

    @Test
    public void rangeBeyondTheDocumentIsEmpty() {
        var range = new RangeTokenizer<>(ParallelTokenizer.forLanguage(PythonLanguage.INSTANCE, TokenizerConfiguration.DEFAULT));
        assertTrue(range.tokenizeRange("x = 1\n", 5, 9).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void invertedRangeIsRejected() {
        var range = new RangeTokenizer<>(ParallelTokenizer.forLanguage(PythonLanguage.INSTANCE, TokenizerConfiguration.DEFAULT));
        range.tokenizeRange("x = 1\n", 3, 2);
    }

    @Test
    public void jsonRangeMatchesFullScanOnWellFormedInput() {
        var full = ParallelTokenizer.forLanguage(JsonLanguage.INSTANCE, TokenizerConfiguration.DEFAULT);
        var range = new RangeTokenizer<>(full);
        assertEquals(RangeStrategy.LOCAL_LOOKAHEAD, range.getStrategy());

        String text = SampleDocuments.JSON;
        List<Token> all = full.tokenize(text).getTokens();
        assertEquals(all, range.tokenizeRange(text, 0, 10));
        assertEquals(ScanHelper.onLines(all, 2, 3), range.tokenizeRange(text, 2, 3));
    }

    @Test
    public void jsonRangeLooksForTheColonOnLaterLines() {
        var range = new RangeTokenizer<>(ParallelTokenizer.forLanguage(JsonLanguage.INSTANCE, TokenizerConfiguration.DEFAULT));
        String text = "{\n  \"key\"\n    : 1\n}";
        assertEquals(List.of("property@1:2+5"), ScanHelper.describe(range.tokenizeRange(text, 1, 1)));
    }

    @Test
    public void jsonRangeDivergesOnMalformedInput() {
        // a string followed by a colon inside an array is a value to the full scan
        String text = "[\n  \"a\": 1\n]";
        var full = ParallelTokenizer.forLanguage(JsonLanguage.INSTANCE, TokenizerConfiguration.DEFAULT);
        var range = new RangeTokenizer<>(full);

        List<Token> fromFull = ScanHelper.onLines(full.tokenize(text).getTokens(), 1, 1);
        List<Token> fromRange = range.tokenizeRange(text, 1, 1);

        assertEquals(List.of("string@1:2+3", "number@1:7+1"), ScanHelper.describe(fromFull));
        assertEquals(List.of("property@1:2+3", "number@1:7+1"), ScanHelper.describe(fromRange));
        assertNotEquals(fromFull, fromRange);
        assertEquals(JsonTokenKind.PROPERTY, fromRange.get(0).getKind());
    }
}
