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
package org.niv.lsp.tokenizer.json;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.niv.lsp.tokenizer.ScanHelper.tokens;

import java.util.List;
import java.util.stream.Collectors;

import org.eclipse.lsp4j.DiagnosticSeverity;
import org.junit.Test;
import org.niv.lsp.tokenizer.LexDiagnostic;
import org.niv.lsp.tokenizer.ScanHelper;
import org.niv.lsp.tokenizer.ScanResult;

public class JsonLexerTest {
    private static final JsonLanguage JSON = JsonLanguage.INSTANCE;

    private static List<String> messages(String text) {
        return ScanHelper.scan(JSON, text).getDiagnostics().stream()
            .map(LexDiagnostic::getMessage)
            .collect(Collectors.toList());
    }

    @Test
    public void propertiesAndValues() {
        ScanResult<JsonState> result = ScanHelper.scan(JSON, "{\"name\": \"x\", \"n\": -1.5e3, \"ok\": true, \"z\": null}");
        assertEquals(List.of(
                "property@0:1+6", "string@0:9+3",
                "property@0:14+3", "number@0:19+6",
                "property@0:27+4", "keyword@0:33+4",
                "property@0:39+3", "keyword@0:44+4"),
            ScanHelper.describe(result.getTokens()));
        assertTrue(result.getDiagnostics().isEmpty());
        assertEquals(JsonState.NORMAL, result.getEndState());
    }

    @Test
    public void keyPositionFollowsNesting() {
        assertEquals(List.of("property@0:2+3", "number@0:8+1", "property@0:12+3", "number@0:17+1", "string@0:23+3"),
            tokens(JSON, "[{\"k\": [1, {\"j\": 2}]}, \"v\"]"));
    }

    @Test
    public void multipleLines() {
        assertEquals(List.of("property@1:2+3", "number@1:7+1", "property@2:2+3", "keyword@2:8+4"),
            tokens(JSON, "{\n  \"a\": 1,\n  \"b\": [true]\n}"));
    }

    @Test
    public void mismatchedBracketAndOpenContainer() {
        ScanResult<JsonState> result = ScanHelper.scan(JSON, "{\"a\": 1]");
        assertEquals(List.of(
                new LexDiagnostic(LexDiagnostic.Kind.STRUCTURAL_MISMATCH, 0, 7, 8, DiagnosticSeverity.Error, "Unexpected ']'"),
                new LexDiagnostic(LexDiagnostic.Kind.STRUCTURAL_MISMATCH, 0, 8, 9, DiagnosticSeverity.Error, "Unexpected end of input")),
            result.getDiagnostics());
    }

    @Test
    public void multipleRoots() {
        assertEquals(List.of("Multiple root values in JSON"), messages("{} []"));
        assertTrue(messages("{}\n").isEmpty());
    }

    @Test
    public void unexpectedCharacter() {
        ScanResult<JsonState> result = ScanHelper.scan(JSON, "{\"a\": @}");
        assertEquals(List.of(
                new LexDiagnostic(LexDiagnostic.Kind.UNEXPECTED_CHARACTER, 0, 6, 7, DiagnosticSeverity.Error, "Unexpected character: @")),
            result.getDiagnostics());
    }

    @Test
    public void partialKeywordIsRejected() {
        ScanResult<JsonState> result = ScanHelper.scan(JSON, "[tru]");
        assertTrue(result.getTokens().isEmpty());
        assertEquals("Unexpected character: t", result.getDiagnostics().get(0).getMessage());
        assertEquals(1, result.getDiagnostics().get(0).getStartColumn());
    }

    @Test
    public void invalidEscape() {
        ScanResult<JsonState> result = ScanHelper.scan(JSON, "{\"a\": \"b\\q\"}");
        assertEquals(List.of("property@0:1+3", "string@0:6+5"), ScanHelper.describe(result.getTokens()));
        assertEquals(List.of(
                new LexDiagnostic(LexDiagnostic.Kind.INVALID_ESCAPE, 0, 9, 10, DiagnosticSeverity.Error, "Invalid escape sequence: \\q")),
            result.getDiagnostics());
    }

    @Test
    public void stringEndsAtLineBreak() {
        ScanResult<JsonState> result = ScanHelper.scan(JSON, "{\"a\": \"open\n}");
        assertEquals(List.of("property@0:1+3", "string@0:6+5"), ScanHelper.describe(result.getTokens()));
        assertEquals(List.of(
                new LexDiagnostic(LexDiagnostic.Kind.UNTERMINATED_LITERAL, 0, 6, 11, DiagnosticSeverity.Error, "Unterminated string")),
            result.getDiagnostics());
    }

    @Test
    public void backslashBeforeLineBreakLeavesStringOpen() {
        ScanResult<JsonState> result = ScanHelper.scan(JSON, "[\"ab\\\n]");
        assertEquals(List.of("string@0:1+4"), ScanHelper.describe(result.getTokens()));
        assertEquals(List.of("Unterminated string"), result.getDiagnostics().stream()
            .map(LexDiagnostic::getMessage).collect(Collectors.toList()));
    }
}
