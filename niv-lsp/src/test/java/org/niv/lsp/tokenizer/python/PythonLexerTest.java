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
package org.niv.lsp.tokenizer.python;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.niv.lsp.tokenizer.ScanHelper.tokens;

import java.util.List;

import org.eclipse.lsp4j.DiagnosticSeverity;
import org.junit.Test;
import org.niv.lsp.tokenizer.LexDiagnostic;
import org.niv.lsp.tokenizer.ScanHelper;
import org.niv.lsp.tokenizer.ScanResult;

public class PythonLexerTest {
    private static final PythonLanguage PYTHON = PythonLanguage.INSTANCE;

    @Test
    public void imports() {
        assertEquals(List.of(
                "keyword@0:0+6", "namespace@0:7+2", "namespace@0:10+4", "keyword@0:15+2", "namespace@0:18+1",
                "keyword@1:0+4", "namespace@1:5+6", "keyword@1:12+6", "namespace@1:19+4"),
            tokens(PYTHON, "import os.path as p\nfrom typing import List"));
    }

    @Test
    public void classWithMethod() {
        assertEquals(List.of(
                "keyword@0:0+5", "class@0:6+3",
                "keyword@1:4+3", "method@1:8+3", "selfParameter@1:12+4", "parameter@1:18+1", "type@1:21+3",
                "number@1:27+1", "operator@1:30+2", "builtinConstant@1:33+4",
                "keyword@2:8+6", "property@2:20+1"),
            tokens(PYTHON, "class Foo(Base):\n    def bar(self, x: int = 3) -> None:\n        return self.x"));
    }

    @Test
    public void topLevelDefIsAFunctionEvenWithSelf() {
        assertEquals(List.of("keyword@0:0+3", "function@0:4+1", "selfParameter@0:6+4", "keyword@0:13+4"),
            tokens(PYTHON, "def f(self): pass"));
    }

    @Test
    public void classmethodReceiver() {
        assertEquals(List.of("keyword@0:0+5", "class@0:6+1", "keyword@1:4+3", "method@1:8+4", "clsParameter@1:13+3"),
            tokens(PYTHON, "class C:\n    def make(cls):"));
    }

    @Test
    public void indentedDefOutsideAClassIsAFunction() {
        assertEquals(List.of("keyword@0:4+3", "function@0:8+4", "selfParameter@0:13+4"),
            tokens(PYTHON, "    def make(self):"));
    }

    @Test
    public void staticmethodInsideAClassIsAMethod() {
        assertEquals(List.of("keyword@0:0+5", "class@0:6+1", "macro@1:4+13", "keyword@2:4+3", "method@2:8+4", "parameter@2:13+1"),
            tokens(PYTHON, "class A:\n    @staticmethod\n    def make(x):"));
    }

    @Test
    public void dedentEndsTheClass() {
        assertEquals(List.of(
                "keyword@0:0+5", "class@0:6+1",
                "keyword@1:4+3", "method@1:8+1", "selfParameter@1:10+4", "keyword@1:17+4",
                "keyword@2:0+3", "function@2:4+1", "keyword@2:9+4"),
            tokens(PYTHON, "class A:\n    def m(self): pass\ndef f(): pass"));
    }

    @Test
    public void nestedDefIsAFunction() {
        assertEquals(List.of(
                "keyword@0:0+5", "class@0:6+1",
                "keyword@1:4+3", "method@1:8+1", "selfParameter@1:10+4",
                "keyword@2:8+3", "function@2:12+5", "keyword@2:21+4",
                "keyword@3:4+3", "method@3:8+1", "selfParameter@3:10+4"),
            tokens(PYTHON, "class A:\n    def m(self):\n        def inner(): pass\n    def n(self):"));
    }

    @Test
    public void commentsAndBlankLinesKeepTheClassOpen() {
        assertEquals(List.of("keyword@0:0+5", "class@0:6+1", "comment@1:0+6", "keyword@3:4+3", "method@3:8+1", "selfParameter@3:10+4"),
            tokens(PYTHON, "class A:\n# note\n\n    def m(self):"));
    }

    @Test
    public void classScopeIsCarriedInTheState() {
        ScanResult<PythonState> result = ScanHelper.scan(PYTHON, "class A:\n    def m(self):\n        pass");
        assertEquals(PythonState.normal(List.of(
                new PythonState.Scope(PythonState.Scope.Type.CLASS, 0),
                new PythonState.Scope(PythonState.Scope.Type.FUNCTION, 4))),
            result.getEndState());
    }

    @Test
    public void starredParameters() {
        assertEquals(List.of("keyword@0:0+3", "function@0:4+1", "parameter@0:7+4", "parameter@0:15+2"),
            tokens(PYTHON, "def f(*args, **kw):"));
    }

    @Test
    public void parameterListSpansLines() {
        assertEquals(List.of("keyword@0:0+3", "function@0:4+1", "parameter@0:6+1", "parameter@1:6+1"),
            tokens(PYTHON, "def f(a,\n      b):"));
    }

    @Test
    public void methodSignatureSplitOverSeveralLines() {
        assertEquals(List.of(
                "keyword@0:0+5", "class@0:6+1",
                "keyword@1:4+3", "method@1:8+3",
                "selfParameter@2:8+4",
                "parameter@3:8+5", "type@3:15+3"),
            tokens(PYTHON, "class A:\n    def run(\n        self,\n        count: int,\n    ):"));
    }

    @Test
    public void openParameterListIsCarriedInTheState() {
        ScanResult<PythonState> result = ScanHelper.scan(PYTHON, "def f(a: int,");
        assertEquals(PythonState.inParameters(
                List.of(new PythonState.Scope(PythonState.Scope.Type.FUNCTION, 0)),
                new PythonState.Parameters(1, false, false)),
            result.getEndState());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    public void lessIndentedParameterLineDoesNotEndTheClass() {
        assertEquals(List.of(
                "keyword@0:0+5", "class@0:6+1",
                "keyword@1:4+3", "method@1:8+1", "parameter@2:0+1",
                "keyword@3:4+3", "method@3:8+1"),
            tokens(PYTHON, "class A:\n    def m(\nx):\n    def n():"));
    }

    @Test
    public void decoratorsAndCalls() {
        assertEquals(List.of("macro@0:0+10", "string@0:11+4"), tokens(PYTHON, "@app.route('/x')"));
        assertEquals(List.of("builtinFunction@0:0+5", "builtinFunction@0:6+3"), tokens(PYTHON, "print(len(xs))"));
        assertEquals(List.of("function@0:4+3"), tokens(PYTHON, "obj.run()"));
        assertEquals(List.of("function@0:0+3", "number@0:4+1"), tokens(PYTHON, "foo(1)"));
    }

    @Test
    public void prefixedStrings() {
        assertEquals(List.of("operator@0:2+1", "string@0:4+7", "operator@0:12+1", "string@0:14+8"),
            tokens(PYTHON, "s = f\"v{x}\" + rb'\\x00'"));
    }

    @Test
    public void tripleQuotedStringSpansLines() {
        ScanResult<PythonState> result = ScanHelper.scan(PYTHON, "doc = \"\"\"first\nsecond\"\"\" + x");
        assertEquals(List.of("operator@0:4+1", "string@0:6+8", "string@1:0+9", "operator@1:10+1"),
            ScanHelper.describe(result.getTokens()));
        assertEquals(PythonState.NORMAL, result.getEndState());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    public void unterminatedTripleQuotedString() {
        ScanResult<PythonState> result = ScanHelper.scan(PYTHON, "x = '''abc");
        assertEquals(PythonState.inTripleString('\'', false), result.getEndState());
        assertEquals(List.of(new LexDiagnostic(LexDiagnostic.Kind.UNTERMINATED_LITERAL, 0, 4, 7,
                DiagnosticSeverity.Error, "Unterminated triple-quoted string")),
            result.getDiagnostics());
    }

    @Test
    public void unterminatedSingleLineString() {
        ScanResult<PythonState> result = ScanHelper.scan(PYTHON, "x = \"abc");
        assertEquals(List.of("operator@0:2+1", "string@0:4+4"), ScanHelper.describe(result.getTokens()));
        assertEquals(PythonState.NORMAL, result.getEndState());
        assertEquals(1, result.getDiagnostics().size());
        LexDiagnostic diagnostic = result.getDiagnostics().get(0);
        assertEquals(LexDiagnostic.Kind.UNTERMINATED_LITERAL, diagnostic.getKind());
        assertEquals(4, diagnostic.getStartColumn());
        assertEquals(8, diagnostic.getEndColumn());
        assertEquals("Unterminated string", diagnostic.getMessage());
    }

    @Test
    public void numbers() {
        assertEquals(List.of(
                "operator@0:2+1", "number@0:4+4", "operator@0:9+1", "number@0:11+5", "operator@0:17+1",
                "number@0:19+6", "operator@0:26+1", "number@0:28+2", "operator@0:31+1", "number@0:33+2"),
            tokens(PYTHON, "n = 0x1F + 1_000 + 3.5e-2 + .5 + 2j"));
    }

    @Test
    public void keywordOperatorsAndConstants() {
        assertEquals(List.of("keyword@0:0+2", "operator@0:5+2", "operator@0:8+3", "builtinConstant@0:12+4", "operator@0:17+3"),
            tokens(PYTHON, "if a is not None and b:"));
    }

    @Test
    public void commentRunsToEndOfLine() {
        assertEquals(List.of("operator@0:2+1", "number@0:4+1", "comment@0:6+8"), tokens(PYTHON, "x = 1 # \"\"\" no"));
    }
}
