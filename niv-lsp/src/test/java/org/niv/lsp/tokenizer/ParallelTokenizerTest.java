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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;
import org.niv.lsp.tokenizer.bash.BashLanguage;
import org.niv.lsp.tokenizer.bash.BashState;
import org.niv.lsp.tokenizer.bash.BashTokenKind;
import org.niv.lsp.tokenizer.json.JsonLanguage;
import org.niv.lsp.tokenizer.python.PythonLanguage;

public class ParallelTokenizerTest {
    private static final TokenizerConfiguration SMALL_THRESHOLD = TokenizerConfiguration.DEFAULT.withParallelLineThreshold(1);

    @Test
    public void parallelOutputEqualsSequentialOutput() {
        for (Language<?> language : SampleDocuments.languages()) {
            String text = ScanHelper.repeat(SampleDocuments.sampleFor(language), 120);
            var tokenizer = ParallelTokenizer.forLanguage(language, SMALL_THRESHOLD);
            List<Token> expected = tokenizer.tokenizeSequential(text).getTokens();
            assertFalse(expected.isEmpty());
            for (int workers = 1; workers <= 4; workers++) {
                assertEquals(language.getId() + " with " + workers + " workers",
                    expected, tokenizer.tokenizeParallel(text, workers).getTokens());
            }
        }
    }

    @Test
    public void everySplitPointGivesTheSameTokens() {
        // small documents, so that sections start on every kind of line
        for (Language<?> language : SampleDocuments.languages()) {
            String text = SampleDocuments.sampleFor(language) + SampleDocuments.sampleFor(language);
            var tokenizer = ParallelTokenizer.forLanguage(language, SMALL_THRESHOLD);
            List<Token> expected = tokenizer.tokenizeSequential(text).getTokens();
            int lines = LineIndex.countLines(text);
            for (int workers = 2; workers <= lines; workers++) {
                assertEquals(language.getId() + " with " + workers + " workers",
                    expected, tokenizer.tokenizeParallel(text, workers).getTokens());
            }
        }
    }

    @Test
    public void repeatedCallsGiveIdenticalResults() {
        String text = ScanHelper.repeat(SampleDocuments.BASH, 200);
        var tokenizer = ParallelTokenizer.forLanguage(BashLanguage.INSTANCE, SMALL_THRESHOLD);
        var first = tokenizer.tokenizeParallel(text, 3).getTokens();
        var second = tokenizer.tokenizeParallel(text, 3).getTokens();
        assertEquals(first, second);
    }

    @Test
    public void heredocBodyAcrossSectionBoundaries() {
        String snippet = "run <<EOF\nline one\nline two\nEOF\n";
        String text = ScanHelper.repeat(snippet, 4001);
        var tokenizer = ParallelTokenizer.forLanguage(BashLanguage.INSTANCE, TokenizerConfiguration.DEFAULT);

        Tokenization parallel = tokenizer.tokenizeParallel(text, 3);
        assertEquals(3, parallel.getSectionCount());
        assertEquals(tokenizer.tokenizeSequential(text).getTokens(), parallel.getTokens());

        // 4001 lines: sections start at line 1333, the first body line, and line 2666, the second one
        int lineCount = LineIndex.countLines(text);
        assertEquals(4001, lineCount);
        assertEquals(1, 1333 % 4);
        assertEquals(2, 2666 % 4);

        int repetitions = lineCount / 4;
        List<Token> strings = ofKind(parallel.getTokens(), BashTokenKind.STRING);
        assertEquals(2 * repetitions, strings.size());
        for (Token t : strings) {
            int inSnippet = t.getLine() % 4;
            assertTrue(inSnippet == 1 || inSnippet == 2);
            assertEquals(0, t.getColumn());
            assertEquals("line one".length(), t.getLength());
        }

        List<Token> operators = ofKind(parallel.getTokens(), BashTokenKind.OPERATOR);
        assertEquals(repetitions, operators.size());
        for (Token t : operators) {
            assertEquals(0, t.getLine() % 4);
            assertEquals(4, t.getColumn());
            assertEquals(2, t.getLength());
        }

        List<Token> keywords = ofKind(parallel.getTokens(), BashTokenKind.KEYWORD);
        assertEquals(2 * repetitions, keywords.size());
        assertTrue(strings.contains(new Token(BashTokenKind.STRING, 1333, 0, 8)));
        assertTrue(strings.contains(new Token(BashTokenKind.STRING, 2666, 0, 8)));
        assertTrue(keywords.contains(new Token(BashTokenKind.KEYWORD, 1335, 0, 3)));
    }

    @Test
    public void pythonScopesSurviveSectionBoundaries() {
        String text = "class A:\n    def run(\n        self,\n        count,\n    ):\n        pass";
        var tokenizer = ParallelTokenizer.forLanguage(PythonLanguage.INSTANCE, SMALL_THRESHOLD);

        // two lines per section; the second one starts inside the parameter list
        Tokenization parallel = tokenizer.tokenizeParallel(text, 3);
        assertEquals(3, parallel.getSectionCount());
        assertEquals(tokenizer.tokenizeSequential(text).getTokens(), parallel.getTokens());
        List<String> described = ScanHelper.describe(parallel.getTokens());
        assertTrue(described.contains("method@1:8+3"));
        assertTrue(described.contains("selfParameter@2:8+4"));
        assertTrue(described.contains("parameter@3:8+5"));
    }

    @Test
    public void thresholdDecidesBetweenSequentialAndParallel() {
        var tokenizer = ParallelTokenizer.forLanguage(PythonLanguage.INSTANCE, TokenizerConfiguration.DEFAULT);
        String below = String.join("\n", Collections.nCopies(3999, "x = f(1) # c"));
        String above = below + "\n\"\"\"pad\n\"\"\"";

        Tokenization sequential = tokenizer.tokenizeParallel(below, 4);
        Tokenization parallel = tokenizer.tokenizeParallel(above, 4);

        assertEquals(3999, LineIndex.countLines(below));
        assertEquals(4001, LineIndex.countLines(above));
        assertEquals(1, sequential.getSectionCount());
        assertFalse(sequential.isParallel());
        assertEquals(4, parallel.getSectionCount());
        assertEquals(sequential.getTokens(), ScanHelper.onLines(parallel.getTokens(), 0, 3998));
    }

    @Test
    public void singleWorkerScansSequentially() {
        String text = ScanHelper.repeat(SampleDocuments.PYTHON, 100);
        var tokenizer = ParallelTokenizer.forLanguage(PythonLanguage.INSTANCE, SMALL_THRESHOLD);
        assertEquals(1, tokenizer.tokenizeParallel(text, 1).getSectionCount());
        assertEquals(1, tokenizer.tokenizeParallel(text, 0).getSectionCount());
    }

    @Test
    public void workersAreLimitedByLineCount() {
        var tokenizer = ParallelTokenizer.forLanguage(PythonLanguage.INSTANCE, SMALL_THRESHOLD);
        assertEquals(3, tokenizer.tokenizeParallel("a = 1\nb = 2\nc = 3", 8).getSectionCount());
    }

    @Test
    public void jsonIsNeverSplit() {
        String text = ScanHelper.repeat(SampleDocuments.JSON, 500);
        var tokenizer = ParallelTokenizer.forLanguage(JsonLanguage.INSTANCE, SMALL_THRESHOLD);
        Tokenization result = tokenizer.tokenizeParallel(text, 4);
        assertEquals(1, result.getSectionCount());
        assertFalse(result.getDiagnostics().isEmpty());
    }

    @Test
    public void diagnosticsOnlyComeFromTheSequentialPath() {
        String text = String.join("\n", Collections.nCopies(40, "x = \"open"));
        var tokenizer = ParallelTokenizer.forLanguage(PythonLanguage.INSTANCE, SMALL_THRESHOLD);
        assertEquals(40, tokenizer.tokenizeSequential(text).getDiagnostics().size());
        Tokenization parallel = tokenizer.tokenizeParallel(text, 2);
        assertTrue(parallel.isParallel());
        assertTrue(parallel.getDiagnostics().isEmpty());
    }

    @Test
    public void failedSectionContributesNoTokens() {
        String text = ScanHelper.repeat("echo \"$x\" 42\n", 30);
        var failing = new FailingLanguage(10);
        var tokenizer = ParallelTokenizer.forLanguage(failing, SMALL_THRESHOLD);

        Tokenization result = tokenizer.tokenizeParallel(text, 3);

        List<Token> all = ParallelTokenizer.forLanguage(BashLanguage.INSTANCE, SMALL_THRESHOLD).tokenizeSequential(text).getTokens();
        List<Token> expected = all.stream()
            .filter(t -> t.getLine() < 10 || t.getLine() >= 20)
            .collect(Collectors.toList());
        assertEquals(3, result.getSectionCount());
        assertEquals(expected, result.getTokens());
    }

    @Test
    public void failingSequentialScanGivesEmptyResult() {
        var tokenizer = ParallelTokenizer.forLanguage(new FailingLanguage(0), TokenizerConfiguration.DEFAULT);
        Tokenization result = tokenizer.tokenize("echo hi");
        assertTrue(result.getTokens().isEmpty());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    private static List<Token> ofKind(List<Token> tokens, TokenKind kind) {
        return tokens.stream().filter(t -> t.getKind() == kind).collect(Collectors.toList());
    }

    /**
     * Bash, except that scanning a slice that starts at one given line throws.
     */
    private static final class FailingLanguage implements Language<BashState> {
        private final int failingLine;

        FailingLanguage(int failingLine) {
            this.failingLine = failingLine;
        }

        @Override
        public String getId() {
            return "failing";
        }

        @Override
        public List<? extends TokenKind> getTokenKinds() {
            return BashLanguage.INSTANCE.getTokenKinds();
        }

        @Override
        public BashState initialState() {
            return BashLanguage.INSTANCE.initialState();
        }

        @Override
        public Lexer<BashState> lexer() {
            return (text, startOffset, endOffset, startLine, initialState) -> {
                if (startLine == failingLine) {
                    throw new IllegalStateException("lexer failure at line " + startLine);
                }
                return BashLanguage.INSTANCE.lexer().scan(text, startOffset, endOffset, startLine, initialState);
            };
        }

        @Override
        public Prescanner<BashState> prescanner() {
            return BashLanguage.INSTANCE.prescanner();
        }
    }
}
