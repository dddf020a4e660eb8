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
package org.niv.lsp.tokenizer.bash;

import static org.niv.lsp.tokenizer.bash.BashTokenKind.COMMENT;
import static org.niv.lsp.tokenizer.bash.BashTokenKind.FUNCTION;
import static org.niv.lsp.tokenizer.bash.BashTokenKind.KEYWORD;
import static org.niv.lsp.tokenizer.bash.BashTokenKind.MACRO;
import static org.niv.lsp.tokenizer.bash.BashTokenKind.NAMESPACE;
import static org.niv.lsp.tokenizer.bash.BashTokenKind.NUMBER;
import static org.niv.lsp.tokenizer.bash.BashTokenKind.OPERATOR;
import static org.niv.lsp.tokenizer.bash.BashTokenKind.PARAMETER;
import static org.niv.lsp.tokenizer.bash.BashTokenKind.STRING;

import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.niv.lsp.tokenizer.AbstractLineLexer;
import org.niv.lsp.tokenizer.Lines;
import org.niv.lsp.tokenizer.TokenCollector;

/**
 * Shell script lexer.
 *
 * <p>Here-documents, and quoted strings that run past the end of a line, are
 * the only constructs that span lines; {@link BashState} carries them.
 * Command substitutions are closed on the line they start on, otherwise only
 * their opening characters are marked.</p>
 */
public class BashLexer extends AbstractLineLexer<BashState> {

    private static final Set<String> KEYWORDS = Set.of(
        "if", "then", "else", "elif", "fi",
        "for", "do", "done", "while", "until",
        "case", "esac", "in", "select",
        "function", "return", "exit",
        "local", "export", "readonly", "declare", "typeset",
        "unset", "unsetenv",
        "source", "eval", "exec",
        "set", "shift", "trap",
        "break", "continue",
        "true", "false");

    @Override
    protected BashState scanLine(String text, int start, int end, int line, BashState state, @Nullable TokenCollector out) {
        switch (state.getKind()) {
            case IN_HEREDOC:
                return heredocLine(text, start, end, line, (BashState.InHeredoc) state, out);
            case IN_QUOTE:
                int close = quoteEnd(text, start, end, ((BashState.InQuote) state).getQuote());
                if (close < 0) {
                    add(out, STRING, line, 0, end - start);
                    return state;
                }
                add(out, STRING, line, 0, close + 1 - start);
                return commands(text, start, close + 1, end, line, out);
            default:
                return commands(text, start, start, end, line, out);
        }
    }

    private static BashState heredocLine(String text, int start, int end, int line, BashState.InHeredoc heredoc, @Nullable TokenCollector out) {
        int from = heredoc.isStripTabs() ? skipTabs(text, start, end) : start;
        int first = Lines.skipBlanks(text, from, end);
        int last = end;
        while (last > first && Lines.isBlank(text.charAt(last - 1))) {
            last--;
        }
        String delimiter = heredoc.getDelimiter();
        if (last - first == delimiter.length() && text.startsWith(delimiter, first)) {
            add(out, KEYWORD, line, first - start, delimiter.length());
            return BashState.NORMAL;
        }
        add(out, STRING, line, 0, end - start);
        return heredoc;
    }

    private static BashState commands(String text, int start, int from, int end, int line, @Nullable TokenCollector out) {
        BashState pendingHeredoc = BashState.NORMAL;
        int p = from;
        while (p < end) {
            char c = text.charAt(p);
            char next = Lines.charAt(text, p + 1, end);

            if (Lines.isBlank(c)) {
                p++;
            }
            else if (c == '#') {
                boolean shebang = line == 0 && p == start && next == '!';
                add(out, shebang ? NAMESPACE : COMMENT, line, p - start, end - p);
                break;
            }
            else if (c == '<' && next == '<') {
                if (Lines.charAt(text, p + 2, end) == '<') {
                    // here-string
                    add(out, OPERATOR, line, p - start, 3);
                    p += 3;
                    continue;
                }
                int opStart = p;
                boolean stripTabs = Lines.charAt(text, p + 2, end) == '-';
                p += stripTabs ? 3 : 2;
                add(out, OPERATOR, line, opStart - start, p - opStart);
                int delimStart = Lines.skipBlanks(text, p, end);
                int delimEnd = delimiterEnd(text, delimStart, end);
                if (delimEnd > delimStart) {
                    add(out, KEYWORD, line, delimStart - start, delimEnd - delimStart);
                    String delimiter = delimiterText(text, delimStart, delimEnd);
                    // only the first here-document of a line is read
                    if (!delimiter.isEmpty() && pendingHeredoc == BashState.NORMAL) {
                        pendingHeredoc = BashState.inHeredoc(delimiter, stripTabs);
                        if (out != null) {
                            out.markOpening(line, opStart - start, delimEnd - start);
                        }
                    }
                }
                p = delimEnd;
            }
            else if (c == '"' || c == '\'' || (c == '$' && next == '\'')) {
                var quote = c == '"' ? BashState.Quote.DOUBLE
                    : c == '\'' ? BashState.Quote.SINGLE
                    : BashState.Quote.ANSI_C;
                int bodyStart = quote == BashState.Quote.ANSI_C ? p + 2 : p + 1;
                int close = quoteEnd(text, bodyStart, end, quote);
                if (close < 0) {
                    add(out, STRING, line, p - start, end - p);
                    if (out != null) {
                        out.markOpening(line, p - start, bodyStart - start);
                    }
                    // an open quote hides any here-document started earlier on the line
                    return BashState.inQuote(quote);
                }
                add(out, STRING, line, p - start, close + 1 - p);
                p = close + 1;
            }
            else if (c == '$' && next == '(') {
                int close = substitutionEnd(text, p + 2, end);
                int length = close < 0 ? 2 : close + 1 - p;
                add(out, MACRO, line, p - start, length);
                p += length;
            }
            else if (c == '$' && next == '{') {
                int close = Lines.indexOf(text, '}', p + 2, end);
                int stop = close < 0 ? end : close + 1;
                add(out, PARAMETER, line, p - start, stop - p);
                p = stop;
            }
            else if (c == '$') {
                int stop = p + 1;
                if ("@*#?-$!".indexOf(next) >= 0 || Lines.isDigit(next)) {
                    stop++;
                }
                else {
                    while (stop < end && Lines.isIdentifierPart(text.charAt(stop))) {
                        stop++;
                    }
                }
                add(out, PARAMETER, line, p - start, stop - p);
                p = stop;
            }
            else if (c == '`') {
                int close = backtickEnd(text, p + 1, end);
                int length = close < 0 ? 1 : close + 1 - p;
                add(out, MACRO, line, p - start, length);
                p += length;
            }
            else if (c == '|' || c == '&' || c == ';' || c == '>' || c == '<') {
                int length = next == c && c != '<' ? 2 : 1;
                add(out, OPERATOR, line, p - start, length);
                p += length;
            }
            else if (c == '=') {
                add(out, OPERATOR, line, p - start, 1);
                p++;
            }
            else if (Lines.isIdentifierPart(c) || c == '/' || c == '.' || c == '-') {
                p = word(text, start, p, end, line, out);
            }
            else {
                p++;
            }
        }
        return pendingHeredoc;
    }

    private static int word(String text, int start, int from, int end, int line, @Nullable TokenCollector out) {
        int wordEnd = from;
        while (wordEnd < end && isWordPart(text.charAt(wordEnd))) {
            wordEnd++;
        }
        if (out == null) {
            return wordEnd;
        }

        int after = Lines.skipBlanks(text, wordEnd, end);
        if (Lines.charAt(text, after, end) == '(' && Lines.charAt(text, after + 1, end) == ')') {
            out.add(FUNCTION, line, from - start, wordEnd - from);
            return after + 2;
        }
        String word = text.substring(from, wordEnd);
        if (KEYWORDS.contains(word)) {
            out.add(KEYWORD, line, from - start, wordEnd - from);
            if (word.equals("function")) {
                int nameEnd = Lines.identifierEnd(text, after, end);
                if (nameEnd > after) {
                    out.add(FUNCTION, line, after - start, nameEnd - after);
                    return nameEnd;
                }
            }
        }
        else if (StringUtils.isNumeric(word)) {
            out.add(NUMBER, line, from - start, wordEnd - from);
        }
        return wordEnd;
    }

    private static boolean isWordPart(char c) {
        return Lines.isIdentifierPart(c) || "/.-:+@".indexOf(c) >= 0;
    }

    /**
     * @return offset of the closing quote, or -1 if the string does not close on this line
     */
    private static int quoteEnd(String text, int from, int end, BashState.Quote quote) {
        for (int i = from; i < end; i++) {
            char c = text.charAt(i);
            if (c == '\\' && quote.hasEscapes()) {
                i++;
            }
            else if (c == quote.getClosing()) {
                return i;
            }
        }
        return -1;
    }

    private static int substitutionEnd(String text, int from, int end) {
        int depth = 1;
        for (int i = from; i < end; i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            }
            else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static int backtickEnd(String text, int from, int end) {
        for (int i = from; i < end; i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            }
            else if (c == '`') {
                return i;
            }
        }
        return -1;
    }

    private static int delimiterEnd(String text, int from, int end) {
        char c = Lines.charAt(text, from, end);
        if (c == '"' || c == '\'') {
            int close = Lines.indexOf(text, c, from + 1, end);
            return close < 0 ? end : close + 1;
        }
        int i = from;
        while (i < end && " \t;|&<>()".indexOf(text.charAt(i)) < 0) {
            i++;
        }
        return i;
    }

    /**
     * @return the word a here-document body has to end with: quotes and backslashes removed
     */
    private static String delimiterText(String text, int from, int to) {
        char c = text.charAt(from);
        if (c == '"' || c == '\'') {
            int stop = to > from + 1 && text.charAt(to - 1) == c ? to - 1 : to;
            return text.substring(from + 1, stop);
        }
        return StringUtils.remove(text.substring(from, to), '\\');
    }

    private static int skipTabs(String text, int from, int end) {
        int i = from;
        while (i < end && text.charAt(i) == '\t') {
            i++;
        }
        return i;
    }

    private static void add(@Nullable TokenCollector out, BashTokenKind kind, int line, int column, int length) {
        if (out != null) {
            out.add(kind, line, column, length);
        }
    }

    @Override
    protected String unterminatedMessage(BashState state) {
        if (state instanceof BashState.InHeredoc) {
            return "Unterminated here-document, expected '" + ((BashState.InHeredoc) state).getDelimiter() + "'";
        }
        return "Unterminated string";
    }
}
