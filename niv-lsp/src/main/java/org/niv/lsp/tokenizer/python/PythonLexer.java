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

import static org.niv.lsp.tokenizer.python.PythonTokenKind.BUILTIN_CONSTANT;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.BUILTIN_FUNCTION;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.CLASS;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.CLS_PARAMETER;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.COMMENT;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.DECORATOR;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.FUNCTION;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.KEYWORD;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.METHOD;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.NAMESPACE;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.NUMBER;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.OPERATOR;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.PARAMETER;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.PROPERTY;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.SELF_PARAMETER;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.STRING;
import static org.niv.lsp.tokenizer.python.PythonTokenKind.TYPE;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.niv.lsp.tokenizer.AbstractLineLexer;
import org.niv.lsp.tokenizer.LexDiagnostic;
import org.niv.lsp.tokenizer.Lines;
import org.niv.lsp.tokenizer.TokenCollector;

/**
 * Python lexer.
 *
 * <p>Triple-quoted strings, open {@code def} parameter lists and the stack
 * of enclosing {@code class} and {@code def} headers are carried across
 * lines in the {@link PythonState}. A {@code def} is a method when its
 * innermost enclosing header is a {@code class}. A header's scope ends at the
 * first later line indented as far or less; blank lines, comment lines,
 * lines that start inside a string and lines inside a parameter list never
 * end a scope.</p>
 */
public class PythonLexer extends AbstractLineLexer<PythonState> {

    private static final Set<String> KEYWORDS = Set.of(
        "as", "assert", "async", "await", "break", "class", "continue",
        "def", "del", "elif", "else", "except", "finally", "for", "from",
        "global", "if", "import", "lambda", "nonlocal", "pass", "raise",
        "return", "try", "while", "with", "yield");

    private static final Set<String> KEYWORD_OPERATORS = Set.of("and", "or", "not", "in", "is");

    private static final Set<String> BUILTIN_CONSTANTS = Set.of("True", "False", "None");

    private static final Set<String> BUILTIN_TYPES = Set.of(
        "int", "str", "float", "list", "dict", "set", "tuple", "bool",
        "bytes", "bytearray", "memoryview", "complex", "frozenset", "object");

    private static final Set<String> BUILTIN_FUNCTIONS = Set.of(
        "print", "len", "range", "type", "isinstance", "issubclass",
        "abs", "all", "any", "ascii", "bin", "breakpoint", "callable",
        "chr", "classmethod", "compile", "delattr", "dir", "divmod",
        "enumerate", "eval", "exec", "filter", "format", "getattr",
        "globals", "hasattr", "hash", "help", "hex", "id", "input",
        "iter", "locals", "map", "max", "min", "next",
        "oct", "open", "ord", "pow", "property", "repr", "reversed",
        "round", "setattr", "slice", "sorted", "staticmethod", "sum",
        "super", "vars", "zip", "__import__");

    /**
     * Classification context of the line being scanned.
     */
    private static final class LineContext {
        final PythonState initial;
        List<PythonState.Scope> scopes;
        int indent;
        @Nullable String lastKeyword;
        boolean afterDot;
        boolean inImport;
        boolean inFrom;
        boolean expectParameters;
        boolean inParameters;
        int parameterDepth;
        boolean firstParameter;
        boolean afterParameterColon;

        LineContext(PythonState initial) {
            this.initial = initial;
            this.scopes = initial.getScopes();
            PythonState.Parameters open = initial.getParameters();
            if (open != null) {
                inParameters = true;
                parameterDepth = open.getDepth();
                firstParameter = open.isFirst();
                afterParameterColon = open.isInAnnotation();
            }
        }

        /**
         * Close every scope whose header is indented at least as far as this line.
         */
        void dedent() {
            int keep = scopes.size();
            while (keep > 0 && scopes.get(keep - 1).getIndent() >= indent) {
                keep--;
            }
            if (keep < scopes.size()) {
                scopes = scopes.subList(0, keep);
            }
        }

        void open(PythonState.Scope.Type type) {
            var grown = new ArrayList<PythonState.Scope>(scopes.size() + 1);
            grown.addAll(scopes);
            grown.add(new PythonState.Scope(type, indent));
            scopes = grown;
        }

        PythonState.@Nullable Parameters openParameters() {
            return inParameters ? new PythonState.Parameters(parameterDepth, firstParameter, afterParameterColon) : null;
        }

        PythonState endState() {
            PythonState.Parameters open = openParameters();
            if (open != null) {
                return PythonState.inParameters(scopes, open);
            }
            if (initial instanceof PythonState.Normal && scopes == initial.getScopes()) {
                return initial;
            }
            return PythonState.normal(scopes);
        }

        void punctuation() {
            lastKeyword = null;
            afterDot = false;
        }

        boolean atParameterLevel() {
            return inParameters && parameterDepth == 1;
        }
    }

    @Override
    protected PythonState scanLine(String text, int start, int end, int line, PythonState state, @Nullable TokenCollector out) {
        int p = start;
        boolean dedentPending = state.getKind() == PythonState.Kind.NORMAL;
        if (state instanceof PythonState.InTripleString) {
            var open = (PythonState.InTripleString) state;
            int close = tripleStringEnd(text, start, end, open.getQuote(), open.isRaw());
            if (close < 0) {
                add(out, STRING, line, 0, end - start);
                return state;
            }
            add(out, STRING, line, 0, close - start);
            p = close;
        }

        var context = new LineContext(state);
        context.indent = indentation(text, start, end);
        while (p < end) {
            char c = text.charAt(p);
            if (Lines.isBlank(c)) {
                p++;
                continue;
            }
            if (c == '#') {
                add(out, COMMENT, line, p - start, end - p);
                break;
            }
            if (dedentPending) {
                context.dedent();
                dedentPending = false;
            }

            if (Lines.isIdentifierStart(c)) {
                int quote = stringPrefixEnd(text, p, end);
                if (quote >= 0) {
                    boolean raw = text.substring(p, quote).toLowerCase().indexOf('r') >= 0;
                    int next = string(text, start, p, quote, end, line, raw, out);
                    if (next < 0) {
                        return PythonState.inTripleString(text.charAt(quote), raw, context.scopes, context.openParameters());
                    }
                    context.punctuation();
                    p = next;
                    continue;
                }
                int wordEnd = Lines.identifierEnd(text, p, end);
                identifier(text, start, p, wordEnd, end, line, context, out);
                p = wordEnd;
                continue;
            }

            if (c == '"' || c == '\'') {
                int next = string(text, start, p, p, end, line, false, out);
                if (next < 0) {
                    return PythonState.inTripleString(c, false, context.scopes, context.openParameters());
                }
                context.punctuation();
                p = next;
                continue;
            }

            if (Lines.isDigit(c) || (c == '.' && Lines.isDigit(Lines.charAt(text, p + 1, end)))) {
                int numberEnd = numberEnd(text, p, end);
                add(out, NUMBER, line, p - start, numberEnd - p);
                context.punctuation();
                p = numberEnd;
                continue;
            }

            if (c == '@') {
                int nameEnd = p + 1;
                while (nameEnd < end && (Lines.isIdentifierPart(text.charAt(nameEnd)) || text.charAt(nameEnd) == '.')) {
                    nameEnd++;
                }
                if (nameEnd > p + 1) {
                    add(out, DECORATOR, line, p - start, nameEnd - p);
                }
                context.punctuation();
                p = nameEnd;
                continue;
            }

            p = punctuation(text, start, p, end, line, context, out);
        }
        return context.endState();
    }

    /**
     * @return the width of the line's leading blanks, a tab counting as four
     */
    private static int indentation(String text, int start, int end) {
        int width = 0;
        for (int i = start; i < end; i++) {
            char c = text.charAt(i);
            if (c == ' ') {
                width++;
            }
            else if (c == '\t') {
                width += 4;
            }
            else {
                break;
            }
        }
        return width;
    }

    /**
     * @return the offset after {@code from}'s punctuation or operator
     */
    private static int punctuation(String text, int start, int from, int end, int line, LineContext context, @Nullable TokenCollector out) {
        char c = text.charAt(from);
        char next = Lines.charAt(text, from + 1, end);
        context.punctuation();
        int length = 1;
        switch (c) {
            case '.':
                context.afterDot = true;
                return from + 1;
            case '(':
                if (context.inParameters) {
                    context.parameterDepth++;
                }
                else if (context.expectParameters) {
                    context.inParameters = true;
                    context.parameterDepth = 1;
                    context.firstParameter = true;
                    context.afterParameterColon = false;
                }
                context.expectParameters = false;
                return from + 1;
            case ')':
                if (context.inParameters && --context.parameterDepth <= 0) {
                    context.inParameters = false;
                    context.parameterDepth = 0;
                }
                return from + 1;
            case ',':
                if (context.inParameters) {
                    context.afterParameterColon = false;
                }
                return from + 1;
            case ':':
                if (context.atParameterLevel()) {
                    context.afterParameterColon = true;
                }
                return from + 1;
            case '*':
                if (next == '*') {
                    length = Lines.charAt(text, from + 2, end) == '=' ? 3 : 2;
                }
                else if (next == '=') {
                    length = 2;
                }
                if (!context.atParameterLevel()) {
                    add(out, OPERATOR, line, from - start, length);
                }
                return from + length;
            case '=':
                length = next == '=' ? 2 : 1;
                if (context.atParameterLevel() && length == 1) {
                    // a default value follows
                    context.afterParameterColon = true;
                }
                else {
                    add(out, OPERATOR, line, from - start, length);
                }
                return from + length;
            case '<':
            case '>':
                length = next == '=' || next == c ? 2 : 1;
                break;
            case '-':
                length = next == '>' || next == '=' ? 2 : 1;
                break;
            case '/':
                if (next == '/') {
                    length = Lines.charAt(text, from + 2, end) == '=' ? 3 : 2;
                }
                else if (next == '=') {
                    length = 2;
                }
                break;
            case '!': case '+': case '%': case '&': case '|': case '^': case '~':
                length = next == '=' ? 2 : 1;
                break;
            default:
                return from + 1;
        }
        add(out, OPERATOR, line, from - start, length);
        return from + length;
    }

    private static void identifier(String text, int start, int from, int to, int end, int line, LineContext context, @Nullable TokenCollector out) {
        String word = text.substring(from, to);
        int column = from - start;
        int length = to - from;
        boolean wasDot = context.afterDot;
        String lastKeyword = context.lastKeyword;
        context.afterDot = false;
        context.lastKeyword = null;

        switch (word) {
            case "def":
            case "class":
                add(out, KEYWORD, line, column, length);
                context.lastKeyword = word;
                return;
            case "import":
                add(out, KEYWORD, line, column, length);
                context.inFrom = false;
                context.inImport = true;
                return;
            case "from":
                add(out, KEYWORD, line, column, length);
                context.inFrom = true;
                return;
            default:
                break;
        }

        if ("def".equals(lastKeyword)) {
            add(out, PythonState.isClassScope(context.scopes) ? METHOD : FUNCTION, line, column, length);
            context.open(PythonState.Scope.Type.FUNCTION);
            context.expectParameters = true;
            context.inParameters = false;
            context.parameterDepth = 0;
        }
        else if ("class".equals(lastKeyword)) {
            add(out, CLASS, line, column, length);
            context.open(PythonState.Scope.Type.CLASS);
        }
        else if (context.inParameters && !context.afterParameterColon) {
            var kind = PARAMETER;
            if (context.firstParameter && word.equals("self")) {
                kind = SELF_PARAMETER;
            }
            else if (context.firstParameter && word.equals("cls")) {
                kind = CLS_PARAMETER;
            }
            add(out, kind, line, column, length);
            context.firstParameter = false;
        }
        else if ((context.inImport || context.inFrom) && !word.equals("as")) {
            add(out, NAMESPACE, line, column, length);
        }
        else if (wasDot) {
            add(out, isCall(text, to, end) ? FUNCTION : PROPERTY, line, column, length);
        }
        else if (BUILTIN_CONSTANTS.contains(word)) {
            add(out, BUILTIN_CONSTANT, line, column, length);
        }
        else if (KEYWORD_OPERATORS.contains(word)) {
            add(out, OPERATOR, line, column, length);
        }
        else if (KEYWORDS.contains(word)) {
            add(out, KEYWORD, line, column, length);
        }
        else if (BUILTIN_TYPES.contains(word)) {
            add(out, TYPE, line, column, length);
        }
        else if (BUILTIN_FUNCTIONS.contains(word)) {
            add(out, BUILTIN_FUNCTION, line, column, length);
        }
        else if (isCall(text, to, end)) {
            add(out, FUNCTION, line, column, length);
        }
    }

    private static boolean isCall(String text, int wordEnd, int end) {
        return Lines.charAt(text, Lines.skipBlanks(text, wordEnd, end), end) == '(';
    }

    /**
     * @return the offset of the opening quote when {@code from} starts a
     *         prefixed string literal such as {@code f"} or {@code rb'}, or -1
     */
    private static int stringPrefixEnd(String text, int from, int end) {
        char first = Character.toLowerCase(text.charAt(from));
        if ("frbu".indexOf(first) < 0) {
            return -1;
        }
        int quote = from + 1;
        char second = Character.toLowerCase(Lines.charAt(text, quote, end));
        if ((first == 'r' && (second == 'f' || second == 'b')) || ((first == 'f' || first == 'b') && second == 'r')) {
            quote++;
        }
        char c = Lines.charAt(text, quote, end);
        return c == '"' || c == '\'' ? quote : -1;
    }

    /**
     * Scan a string literal starting at {@code from} (prefix included) with its opening quote at {@code quote}.
     *
     * @return the offset after the literal, or -1 when a triple-quoted string continues on the next line
     */
    private static int string(String text, int start, int from, int quote, int end, int line, boolean raw, @Nullable TokenCollector out) {
        char q = text.charAt(quote);
        if (Lines.charAt(text, quote + 1, end) == q && Lines.charAt(text, quote + 2, end) == q) {
            int close = tripleStringEnd(text, quote + 3, end, q, raw);
            if (close < 0) {
                add(out, STRING, line, from - start, end - from);
                if (out != null) {
                    out.markOpening(line, quote - start, quote + 3 - start);
                }
                return -1;
            }
            add(out, STRING, line, from - start, close - from);
            return close;
        }

        for (int i = quote + 1; i < end; i++) {
            char c = text.charAt(i);
            if (c == '\\' && !raw) {
                i++;
            }
            else if (c == q) {
                add(out, STRING, line, from - start, i + 1 - from);
                return i + 1;
            }
        }
        add(out, STRING, line, from - start, end - from);
        if (out != null) {
            out.error(LexDiagnostic.Kind.UNTERMINATED_LITERAL, line, from - start, end - start, "Unterminated string");
        }
        return end;
    }

    /**
     * @return the offset after the closing triple quote, or -1 when it is not on this line
     */
    private static int tripleStringEnd(String text, int from, int end, char quote, boolean raw) {
        for (int i = from; i < end; i++) {
            char c = text.charAt(i);
            if (c == '\\' && !raw) {
                i++;
            }
            else if (c == quote && Lines.charAt(text, i + 1, end) == quote && Lines.charAt(text, i + 2, end) == quote) {
                return i + 3;
            }
        }
        return -1;
    }

    /**
     * Integer, hex, octal and binary literals, floats like {@code .5} or
     * {@code 1e-3}, with an optional imaginary suffix.
     */
    private static int numberEnd(String text, int from, int end) {
        int i = from;
        char radix = Character.toLowerCase(Lines.charAt(text, from + 1, end));
        if (text.charAt(from) == '0' && (radix == 'x' || radix == 'o' || radix == 'b')) {
            i += 2;
            while (i < end && (Lines.isHexDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                i++;
            }
        }
        else {
            i = digitsEnd(text, i, end);
            if (Lines.charAt(text, i, end) == '.') {
                i = digitsEnd(text, i + 1, end);
            }
            if (Character.toLowerCase(Lines.charAt(text, i, end)) == 'e') {
                i++;
                if (Lines.charAt(text, i, end) == '+' || Lines.charAt(text, i, end) == '-') {
                    i++;
                }
                i = digitsEnd(text, i, end);
            }
        }
        if (Character.toLowerCase(Lines.charAt(text, i, end)) == 'j') {
            i++;
        }
        return i;
    }

    private static int digitsEnd(String text, int from, int end) {
        int i = from;
        while (i < end && (Lines.isDigit(text.charAt(i)) || text.charAt(i) == '_')) {
            i++;
        }
        return i;
    }

    private static void add(@Nullable TokenCollector out, PythonTokenKind kind, int line, int column, int length) {
        if (out != null) {
            out.add(kind, line, column, length);
        }
    }

    @Override
    protected String unterminatedMessage(PythonState state) {
        return "Unterminated triple-quoted string";
    }
}
