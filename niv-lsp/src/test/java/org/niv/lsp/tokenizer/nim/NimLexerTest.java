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
package org.niv.lsp.tokenizer.nim;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.niv.lsp.tokenizer.ScanHelper.tokens;

import java.util.List;

import org.junit.Test;
import org.niv.lsp.tokenizer.LexDiagnostic;
import org.niv.lsp.tokenizer.ScanHelper;
import org.niv.lsp.tokenizer.ScanResult;

public class NimLexerTest {
    private static final NimLanguage NIM = NimLanguage.INSTANCE;

    @Test
    public void enumBodyAndRoutine() {
        String source = "type\n"
            + "  Color = enum\n"
            + "    red, green\n"
            + "    blue\n"
            + "proc paint(c: Color): string =\n"
            + "  result = \"x\"";
        assertEquals(List.of(
                "keyword@0:0+4",
                "type@1:2+5", "operator@1:8+1", "keyword@1:10+4",
                "enumMember@2:4+3", "enumMember@2:9+5",
                "enumMember@3:4+4",
                "keyword@4:0+4", "function@4:5+5", "parameter@4:11+1", "type@4:14+5", "type@4:22+6", "operator@4:29+1",
                "operator@5:9+1", "string@5:11+3"),
            tokens(NIM, source));
    }

    @Test
    public void enumBodyEndsAtShallowerLine() {
        ScanResult<NimState> result = ScanHelper.scan(NIM, "type E = enum\n  a\nlet x = 1");
        assertEquals(List.of(
                "keyword@0:0+4", "type@0:5+1", "operator@0:7+1", "keyword@0:9+4",
                "enumMember@1:2+1",
                "keyword@2:0+3", "operator@2:6+1", "number@2:8+1"),
            ScanHelper.describe(result.getTokens()));
        assertEquals(NimState.NORMAL, result.getEndState());
    }

    @Test
    public void nestedBlockComments() {
        assertEquals(List.of("comment@0:0+20", "comment@1:0+8", "builtinFunction@1:9+4", "number@1:14+1"),
            tokens(NIM, "#[ outer #[ inner ]#\nstill ]# echo 1"));
    }

    @Test
    public void unterminatedBlockComment() {
        ScanResult<NimState> result = ScanHelper.scan(NIM, "#[ open");
        assertEquals(NimState.inBlockComment(1), result.getEndState());
        assertEquals(1, result.getDiagnostics().size());
        LexDiagnostic diagnostic = result.getDiagnostics().get(0);
        assertEquals(0, diagnostic.getStartColumn());
        assertEquals(2, diagnostic.getEndColumn());
        assertEquals("Unterminated multi-line comment", diagnostic.getMessage());
    }

    @Test
    public void multilineString() {
        ScanResult<NimState> result = ScanHelper.scan(NIM, "let s = \"\"\"abc\ndef\"\"\" & x");
        assertEquals(List.of("keyword@0:0+3", "operator@0:6+1", "string@0:8+6", "string@1:0+6", "operator@1:7+1"),
            ScanHelper.describe(result.getTokens()));
        assertEquals(NimState.NORMAL, result.getEndState());
    }

    @Test
    public void charactersAndTypedNumbers() {
        assertEquals(List.of(
                "keyword@0:0+3", "operator@0:6+1", "string@0:8+3",
                "keyword@0:13+3", "operator@0:19+1", "number@0:21+6"),
            tokens(NIM, "let c = 'a'; let n = 10'i32"));
    }

    @Test
    public void pragmas() {
        assertEquals(List.of("keyword@0:0+4", "function@0:5+1", "decorator@0:9+10", "operator@0:20+1", "keyword@0:22+7"),
            tokens(NIM, "proc f() {.inline.} = discard"));
    }

    @Test
    public void exportMarkerIsSkipped() {
        assertEquals(List.of("keyword@0:0+4", "function@0:5+3", "parameter@0:10+1", "type@0:13+3",
                "operator@0:18+1", "keyword@0:20+7"),
            tokens(NIM, "proc pub*(x: int) = discard"));
    }

    @Test
    public void routineKinds() {
        assertEquals(List.of("keyword@0:0+6", "method@0:7+4", "parameter@0:12+1", "type@0:15+5", "type@0:23+5"),
            tokens(NIM, "method area(s: Shape): float"));
        assertEquals(List.of("keyword@0:0+8", "macro@0:9+1", "operator@0:13+1", "keyword@0:15+7"),
            tokens(NIM, "template t() = discard"));
    }

    @Test
    public void imports() {
        assertEquals(List.of("keyword@0:0+6", "namespace@0:7+3", "operator@0:10+1", "namespace@0:11+8", "namespace@0:21+2"),
            tokens(NIM, "import std/strutils, os"));
    }

    @Test
    public void callsAfterDotAndBackticks() {
        assertEquals(List.of("function@0:2+3", "number@0:6+1"), tokens(NIM, "s.add(1)"));
        assertEquals(List.of("function@0:0+5"), tokens(NIM, "`foo`"));
    }

    @Test
    public void unterminatedString() {
        ScanResult<NimState> result = ScanHelper.scan(NIM, "echo \"abc");
        assertEquals(List.of("builtinFunction@0:0+4", "string@0:5+4"), ScanHelper.describe(result.getTokens()));
        assertEquals(NimState.NORMAL, result.getEndState());
        LexDiagnostic diagnostic = result.getDiagnostics().get(0);
        assertEquals(LexDiagnostic.Kind.UNTERMINATED_LITERAL, diagnostic.getKind());
        assertEquals(5, diagnostic.getStartColumn());
        assertEquals(9, diagnostic.getEndColumn());
    }

    @Test
    public void commentLineKeepsEnumBodyOpen() {
        ScanResult<NimState> result = ScanHelper.scan(NIM, "type E = enum\n  a\n# note\n  b");
        assertTrue(ScanHelper.describe(result.getTokens()).contains("enumMember@3:2+1"));
        assertEquals(NimState.inEnumBody(2), result.getEndState());
    }
}
