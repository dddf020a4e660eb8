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
package org.niv.lsp.tokenizer.yaml;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.niv.lsp.tokenizer.ScanHelper.tokens;

import java.util.List;

import org.junit.Test;
import org.niv.lsp.tokenizer.ScanHelper;
import org.niv.lsp.tokenizer.ScanResult;

public class YamlLexerTest {
    private static final YamlLanguage YAML = YamlLanguage.INSTANCE;

    @Test
    public void keysAndScalarValues() {
        assertEquals(List.of(
                "property@0:0+4", "operator@0:4+1",
                "property@1:0+7", "operator@1:7+1", "number@1:9+3",
                "property@2:0+7", "operator@2:7+1", "keyword@2:9+4"),
            tokens(YAML, "name: demo\nversion: 1.5\nenabled: true"));
    }

    @Test
    public void colonInsideValueIsNotAKey() {
        assertEquals(List.of("property@0:0+3", "operator@0:3+1"), tokens(YAML, "url: http://x"));
    }

    @Test
    public void quotedKey() {
        assertEquals(List.of("property@0:0+5", "operator@0:5+1", "number@0:7+1"), tokens(YAML, "\"a b\": 1"));
    }

    @Test
    public void sequencesAnchorsAndAliases() {
        assertEquals(List.of(
                "property@0:0+5", "operator@0:5+1",
                "operator@1:2+1", "macro@1:4+6",
                "operator@2:2+1", "macro@2:4+6",
                "operator@3:2+1", "string@3:4+8", "comment@3:13+3"),
            tokens(YAML, "items:\n  - &first one\n  - *first\n  - \"quoted\" # c"));
    }

    @Test
    public void commentsComeAfterTheValueTheyFollow() {
        assertEquals(List.of("comment@0:0+5", "property@1:0+3", "operator@1:3+1", "comment@1:11+10"),
            tokens(YAML, "# top\nkey: value # trailing"));
    }

    @Test
    public void blockScalarContentIsString() {
        ScanResult<YamlState> result = ScanHelper.scan(YAML, "script: |\n  echo hi\n  echo bye\nnext: 2");
        assertEquals(List.of(
                "property@0:0+6", "operator@0:6+1", "operator@0:8+1",
                "string@1:2+7", "string@2:2+8",
                "property@3:0+4", "operator@3:4+1", "number@3:6+1"),
            ScanHelper.describe(result.getTokens()));
        assertEquals(YamlState.NORMAL, result.getEndState());
    }

    @Test
    public void blockScalarHeaderWithComment() {
        assertEquals(List.of("property@0:0+1", "operator@0:1+1", "operator@0:3+1", "comment@0:5+6", "string@1:2+1"),
            tokens(YAML, "s: | # note\n  x"));
    }

    @Test
    public void emptyLineEndsBlockScalar() {
        ScanResult<YamlState> result = ScanHelper.scan(YAML, "text: >-\n  folded\n\n  after");
        assertEquals(List.of("property@0:0+4", "operator@0:4+1", "operator@0:6+1", "string@1:2+6"),
            ScanHelper.describe(result.getTokens()));
        assertEquals(YamlState.NORMAL, result.getEndState());
    }

    @Test
    public void documentEndingInsideBlockScalarIsFine() {
        ScanResult<YamlState> result = ScanHelper.scan(YAML, "key: |\n  body");
        assertEquals(YamlState.inBlockScalar(0, YamlState.Style.LITERAL), result.getEndState());
        assertEquals('|', ((YamlState.InBlockScalar) result.getEndState()).getStyle().getIndicator());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    public void directivesMarkersAndFlowSequence() {
        assertEquals(List.of(
                "namespace@0:0+9",
                "type@1:0+3",
                "property@2:0+1", "operator@2:1+1", "number@2:4+1", "string@2:7+3", "keyword@2:12+4",
                "type@3:0+3"),
            tokens(YAML, "%YAML 1.2\n---\na: [1, \"x\", true]\n..."));
    }

    @Test
    public void flowMapping() {
        assertEquals(List.of("property@0:0+1", "operator@0:1+1", "property@0:4+1", "operator@0:5+1", "number@0:7+1"),
            tokens(YAML, "m: {k: 1}"));
    }

    @Test
    public void tags() {
        assertEquals(List.of("property@0:0+4", "operator@0:4+1", "type@0:6+11"),
            tokens(YAML, "date: !!timestamp 2001-12-14"));
    }

    @Test
    public void numbers() {
        for (String number : List.of("0x1F", "0o17", "0b101", "1_000", "-3.5e+2", ".5", "42")) {
            assertTrue(number, YamlLexer.isNumber(number));
        }
        for (String notANumber : List.of("1e", "abc", "_", "0x", "1.2.3", "", "-")) {
            assertFalse(notANumber, YamlLexer.isNumber(notANumber));
        }
    }
}
