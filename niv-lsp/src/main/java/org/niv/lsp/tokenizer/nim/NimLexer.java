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

import static org.niv.lsp.tokenizer.nim.NimTokenKind.BUILTIN_CONSTANT;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.BUILTIN_FUNCTION;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.COMMENT;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.DECORATOR;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.ENUM_MEMBER;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.FUNCTION;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.KEYWORD;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.MACRO;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.METHOD;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.NAMESPACE;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.NUMBER;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.OPERATOR;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.PARAMETER;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.PROPERTY;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.STRING;
import static org.niv.lsp.tokenizer.nim.NimTokenKind.TYPE;

import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.niv.lsp.tokenizer.AbstractLineLexer;
import org.niv.lsp.tokenizer.LexDiagnostic;
import org.niv.lsp.tokenizer.Lines;
import org.niv.lsp.tokenizer.TokenCollector;

/**
 * Nim lexer.
 *
 * <p>Nested {@code #[ ]#} comments and {@code """} strings continue over
 * line breaks. An {@code = enum} opens an enum body whose members are
 * indented at least two columns deeper than the line holding the
 * {@code enum}; the body ends at the first line indented less. Routine
 * parameters are only recognized on the line of the routine name.</p>
 */
public class NimLexer extends AbstractLineLexer<NimState> {

    private static final Set<String> KEYWORDS = Set.of(
        "addr", "asm", "bind", "block", "break", "case", "concept",
        "const", "continue", "defer", "discard", "distinct", "do",
        "elif", "else", "end", "enum", "except", "export", "finally",
        "for", "from", "if", "import", "include", "interface", "let",
        "mixin", "object", "of", "out", "ptr", "raise", "ref", "return",
        "static", "try", "tuple", "type", "unsafeAddr", "using", "var",
        "when", "while", "yield");

    /** Keywords whose next identifier is the name being declared. */
    private static final Set<String> DECLARATION_KEYWORDS = Set.of(
        "converter", "func", "iterator", "macro", "method", "proc", "template");

    private static final Set<String> KEYWORD_OPERATORS = Set.of(
        "and", "as", "cast", "div", "in", "is", "isnot",
        "mod", "not", "notin", "or", "shl", "shr", "xor");

    private static final Set<String> BUILTIN_CONSTANTS = Set.of("false", "nil", "true");

    private static final Set<String> BUILTIN_TYPES = Set.of(
        "BiggestFloat", "BiggestInt", "BiggestUInt",
        "Natural", "Ordinal", "Positive",
        "SomeFloat", "SomeInteger", "SomeNumber",
        "any", "array", "auto", "bool", "byte",
        "cdouble", "cfloat", "char", "cint", "clong",
        "csize_t", "cstring", "cuint",
        "float", "float32", "float64",
        "int", "int8", "int16", "int32", "int64",
        "openArray", "pointer", "range",
        "seq", "set", "string",
        "typed", "typedesc", "uint",
        "uint8", "uint16", "uint32", "uint64",
        "untyped", "varargs", "void");

    private static final Set<String> BUILTIN_FUNCTIONS = Set.of(
        "GC_ref", "GC_unref",
        "abs", "add", "alloc", "allocShared", "assert",
        "chr", "clamp", "close", "compiles", "contains",
        "debugEcho", "dec", "declared", "deepCopy", "default", "defined",
        "del", "dealloc", "doAssert",
        "echo", "find",
        "gorge",
        "high",
        "inc", "insert", "items",
        "len", "low",
        "max", "min", "mitems", "move", "mpairs",
        "new", "newSeq", "newString",
        "open", "ord",
        "pairs", "pred",
        "quit",
        "readAll", "readFile", "readLine", "realloc", "repr", "reset",
        "sizeof", "staticExec", "staticRead", "succ", "swap",
        "typeof",
        "wasMoved", "write", "writeFile", "writeLine");

    private static final String OPERATOR_CHARS = "=+-*/<>!~%&|^@$?";

    private static final class LineContext {
        @Nullable String lastKeyword;
        boolean afterDot;
        boolean afterEquals;
        boolean inImport;
        boolean inFrom;
        boolean expectParameters;
        boolean inParameters;
        int parameterDepth;
        boolean afterParameterColon;
        /** member indentation of the enum body this line is part of, or -1 */
        int enumIndent = -1;
        boolean memberExpected;
    }

    @Override
    protected NimState scanLine(String text, int start, int end, int line, NimState state, @Nullable TokenCollector out) {
        var context = new LineContext();
        int p = start;
        switch (state.getKind()) {
            case IN_BLOCK_COMMENT: {
                int close = blockCommentEnd(text, start, end, ((NimState.InBlockComment) state).getDepth());
                if (close < 0) {
                    add(out, COMMENT, line, 0, end - start);
                    return NimState.inBlockComment(-close);
                }
                add(out, COMMENT, line, 0, close - start);
                p = close;
                break;
            }
            case IN_MULTILINE_STRING: {
                int close = tripleStringEnd(text, start, end);
                if (close < 0) {
                    add(out, STRING, line, 0, end - start);
                    return state;
                }
                add(out, STRING, line, 0, close - start);
                p = close;
                break;
            }
            case IN_ENUM_BODY: {
                int memberIndent = ((NimState.InEnumBody) state).getMemberIndent();
                int content = Lines.skipBlanks(text, start, end);
                if (content == end) {
                    return state;
                }
                boolean lineComment = text.charAt(content) == '#' && Lines.charAt(text, content + 1, end) != '[';
                if (lineComment || indentation(text, start, content) >= memberIndent) {
                    context.enumIndent = memberIndent;
                    context.memberExpected = true;
                }
                break;
            }
            default:
                break;
        }
        return code(text, start, p, end, line, context, out);
    }

    private static NimState code(String text, int start, int from, int end, int line, LineContext context, @Nullable TokenCollector out) {
        int p = from;
        while (p < end) {
            char c = text.charAt(p);
            char next = Lines.charAt(text, p + 1, end);

            if (Lines.isBlank(c)) {
                p++;
            }
            else if (c == '#') {
                if (next != '[') {
                    add(out, COMMENT, line, p - start, end - p);
                    break;
                }
                int close = blockCommentEnd(text, p + 2, end, 1);
                if (close < 0) {
                    add(out, COMMENT, line, p - start, end - p);
                    if (out != null) {
                        out.markOpening(line, p - start, p + 2 - start);
                    }
                    return NimState.inBlockComment(-close);
                }
                add(out, COMMENT, line, p - start, close - p);
                p = close;
            }
            else if (c == '"' || ((c == 'r' || c == 'R') && next == '"')) {
                boolean raw = c != '"';
                int quote = raw ? p + 1 : p;
                if (Lines.startsWith(text, quote, end, "\"\"\"")) {
                    int close = tripleStringEnd(text, quote + 3, end);
                    if (close < 0) {
                        add(out, STRING, line, p - start, end - p);
                        if (out != null) {
                            out.markOpening(line, p - start, quote + 3 - start);
                        }
                        return NimState.inMultilineString(raw);
                    }
                    add(out, STRING, line, p - start, close - p);
                    p = close;
                }
                else {
                    p = string(text, start, p, quote, end, line, raw, out);
                }
                context.lastKeyword = null;
                context.afterDot = false;
            }
            else if (c == '\'') {
                if (p > start && Lines.isIdentifierPart(text.charAt(p - 1))) {
                    // type suffix such as 'i32
                    p = Lines.identifierEnd(text, p + 1, end);
                    continue;
                }
                int literalEnd = p + 1;
                if (literalEnd < end) {
                    literalEnd += text.charAt(literalEnd) == '\\' ? 2 : 1;
                }
                if (Lines.charAt(text, literalEnd, end) == '\'') {
                    literalEnd++;
                }
                literalEnd = Math.min(literalEnd, end);
                add(out, STRING, line, p - start, literalEnd - p);
                context.lastKeyword = null;
                context.afterDot = false;
                p = literalEnd;
            }
            else if (Lines.isDigit(c)) {
                int numberEnd = numberEnd(text, p, end);
                add(out, NUMBER, line, p - start, numberEnd - p);
                context.lastKeyword = null;
                context.afterDot = false;
                p = numberEnd;
            }
            else if (Lines.isIdentifierStart(c)) {
                int wordEnd = Lines.identifierEnd(text, p, end);
                if (wordEnd - p == 4 && text.startsWith("enum", p) && context.afterEquals) {
                    add(out, KEYWORD, line, p - start, 4);
                    context.enumIndent = indentation(text, start, Lines.skipBlanks(text, start, end)) + 2;
                    context.memberExpected = true;
                    context.lastKeyword = null;
                }
                else if (out != null) {
                    identifier(text, start, p, wordEnd, end, line, context, out);
                }
                p = wordEnd;
                if (Lines.charAt(text, p, end) == '*' && OPERATOR_CHARS.indexOf(Lines.charAt(text, p + 1, end)) < 0) {
                    // export marker
                    p++;
                }
            }
            else if (c == '`') {
                int close = Lines.indexOf(text, '`', p + 1, end);
                int stop = close < 0 ? end : close + 1;
                add(out, FUNCTION, line, p - start, stop - p);
                context.lastKeyword = null;
                p = stop;
            }
            else if (c == '{' && next == '.') {
                int close = p + 2;
                while (close < end && !(text.charAt(close) == '.' && Lines.charAt(text, close + 1, end) == '}')) {
                    close++;
                }
                int stop = Math.min(close + 2, end);
                add(out, DECORATOR, line, p - start, stop - p);
                p = stop;
            }
            else if (c == '.') {
                if (next == '.') {
                    add(out, OPERATOR, line, p - start, 2);
                    p += 2;
                }
                else {
                    context.afterDot = true;
                    p++;
                }
            }
            else if (c == '=' && OPERATOR_CHARS.indexOf(next) < 0) {
                add(out, OPERATOR, line, p - start, 1);
                context.afterEquals = true;
                context.expectParameters = false;
                context.lastKeyword = null;
                p++;
            }
            else if (OPERATOR_CHARS.indexOf(c) >= 0) {
                int operatorEnd = p + 1;
                while (operatorEnd < end && OPERATOR_CHARS.indexOf(text.charAt(operatorEnd)) >= 0) {
                    operatorEnd++;
                }
                add(out, OPERATOR, line, p - start, operatorEnd - p);
                context.lastKeyword = null;
                context.afterDot = false;
                p = operatorEnd;
            }
            else {
                punctuation(c, context);
                p++;
            }
        }
        return context.enumIndent >= 0 ? NimState.inEnumBody(context.enumIndent) : NimState.NORMAL;
    }

    private static void punctuation(char c, LineContext context) {
        switch (c) {
            case '(':
                if (context.inParameters) {
                    context.parameterDepth++;
                }
                else if (context.expectParameters) {
                    context.inParameters = true;
                    context.parameterDepth = 1;
                    context.afterParameterColon = false;
                    context.expectParameters = false;
                }
                break;
            case ')':
                if (context.inParameters && --context.parameterDepth <= 0) {
                    context.inParameters = false;
                    context.parameterDepth = 0;
                }
                break;
            case ',':
                context.afterParameterColon = false;
                context.memberExpected = context.enumIndent >= 0 && !context.inParameters;
                break;
            case ';':
                context.afterParameterColon = false;
                break;
            case ':':
                if (context.inParameters) {
                    context.afterParameterColon = true;
                }
                break;
            default:
                break;
        }
    }

    private static void identifier(String text, int start, int from, int to, int end, int line, LineContext context, TokenCollector out) {
        String word = text.substring(from, to);
        int column = from - start;
        int length = to - from;
        boolean wasDot = context.afterDot;
        boolean member = context.memberExpected;
        String lastKeyword = context.lastKeyword;
        context.afterDot = false;
        context.memberExpected = false;
        context.lastKeyword = null;

        if (lastKeyword != null && !lastKeyword.equals("type")) {
            out.add(routineKind(lastKeyword), line, column, length);
            context.expectParameters = true;
        }
        else if (lastKeyword != null) {
            out.add(TYPE, line, column, length);
        }
        else if (context.inParameters && !context.afterParameterColon) {
            out.add(PARAMETER, line, column, length);
        }
        else if (context.inImport || context.inFrom) {
            out.add(NAMESPACE, line, column, length);
        }
        else if (wasDot) {
            out.add(isCall(text, to, end) ? FUNCTION : PROPERTY, line, column, length);
        }
        else if (member && !KEYWORDS.contains(word) && !DECLARATION_KEYWORDS.contains(word)) {
            out.add(ENUM_MEMBER, line, column, length);
        }
        else if (BUILTIN_CONSTANTS.contains(word)) {
            out.add(BUILTIN_CONSTANT, line, column, length);
        }
        else if (KEYWORD_OPERATORS.contains(word)) {
            out.add(OPERATOR, line, column, length);
        }
        else if (DECLARATION_KEYWORDS.contains(word)) {
            out.add(KEYWORD, line, column, length);
            context.lastKeyword = word;
        }
        else if (KEYWORDS.contains(word)) {
            out.add(KEYWORD, line, column, length);
            switch (word) {
                case "import":
                case "include":
                case "export":
                    context.inImport = true;
                    context.inFrom = false;
                    break;
                case "from":
                    context.inFrom = true;
                    break;
                case "type":
                    context.lastKeyword = word;
                    break;
                default:
                    break;
            }
        }
        else if (BUILTIN_TYPES.contains(word)) {
            out.add(TYPE, line, column, length);
        }
        else if (BUILTIN_FUNCTIONS.contains(word)) {
            out.add(BUILTIN_FUNCTION, line, column, length);
        }
        else if (Character.isUpperCase(word.charAt(0))) {
            out.add(TYPE, line, column, length);
        }
        else if (isCall(text, to, end)) {
            out.add(FUNCTION, line, column, length);
        }
    }

    private static NimTokenKind routineKind(String declarationKeyword) {
        switch (declarationKeyword) {
            case "method":
                return METHOD;
            case "template":
            case "macro":
                return MACRO;
            default:
                return FUNCTION;
        }
    }

    private static boolean isCall(String text, int wordEnd, int end) {
        return Lines.charAt(text, Lines.skipBlanks(text, wordEnd, end), end) == '(';
    }

    /**
     * A single line string; raw strings have no escapes.
     *
     * @return the offset after the literal
     */
    private static int string(String text, int start, int from, int quote, int end, int line, boolean raw, @Nullable TokenCollector out) {
        for (int i = quote + 1; i < end; i++) {
            char c = text.charAt(i);
            if (c == '\\' && !raw) {
                i++;
            }
            else if (c == '"') {
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
     * @param depth the number of open block comments at {@code from}
     * @return the offset after the outermost {@code ]#}, or the negated depth still open at {@code end}
     */
    private static int blockCommentEnd(String text, int from, int end, int depth) {
        int open = depth;
        int i = from;
        while (i < end) {
            if (text.charAt(i) == '#' && Lines.charAt(text, i + 1, end) == '[') {
                open++;
                i += 2;
            }
            else if (text.charAt(i) == ']' && Lines.charAt(text, i + 1, end) == '#') {
                i += 2;
                if (--open == 0) {
                    return i;
                }
            }
            else {
                i++;
            }
        }
        return -open;
    }

    /**
     * @return the offset after the closing {@code """}, or -1 when it is not on this line
     */
    private static int tripleStringEnd(String text, int from, int end) {
        for (int i = from; i + 3 <= end; i++) {
            if (Lines.startsWith(text, i, end, "\"\"\"")) {
                // a longer run of quotes closes at its end
                int stop = i + 3;
                while (stop < end && text.charAt(stop) == '"') {
                    stop++;
                }
                return stop;
            }
        }
        return -1;
    }

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
            if (Lines.charAt(text, i, end) == '.' && Lines.isDigit(Lines.charAt(text, i + 1, end))) {
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
        if (Lines.charAt(text, i, end) == '\'') {
            i = Lines.identifierEnd(text, i + 1, end);
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

    /**
     * @return the width of the leading whitespace, a tab counting as four columns
     */
    private static int indentation(String text, int start, int content) {
        int width = 0;
        for (int i = start; i < content; i++) {
            width += text.charAt(i) == '\t' ? 4 : 1;
        }
        return width;
    }

    private static void add(@Nullable TokenCollector out, NimTokenKind kind, int line, int column, int length) {
        if (out != null) {
            out.add(kind, line, column, length);
        }
    }

    @Override
    protected String unterminatedMessage(NimState state) {
        if (state instanceof NimState.InBlockComment) {
            return "Unterminated multi-line comment";
        }
        return "Unterminated string";
    }
}
