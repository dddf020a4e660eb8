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
package org.niv.lsp.tokenizer.css;

import static org.niv.lsp.tokenizer.css.CssTokenKind.CLASS;
import static org.niv.lsp.tokenizer.css.CssTokenKind.COMMENT;
import static org.niv.lsp.tokenizer.css.CssTokenKind.FUNCTION;
import static org.niv.lsp.tokenizer.css.CssTokenKind.KEYWORD;
import static org.niv.lsp.tokenizer.css.CssTokenKind.NUMBER;
import static org.niv.lsp.tokenizer.css.CssTokenKind.OPERATOR;
import static org.niv.lsp.tokenizer.css.CssTokenKind.PARAMETER;
import static org.niv.lsp.tokenizer.css.CssTokenKind.PROPERTY;
import static org.niv.lsp.tokenizer.css.CssTokenKind.STRING;
import static org.niv.lsp.tokenizer.css.CssTokenKind.TYPE;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.niv.lsp.tokenizer.AbstractLineLexer;
import org.niv.lsp.tokenizer.LexDiagnostic;
import org.niv.lsp.tokenizer.Lines;
import org.niv.lsp.tokenizer.TokenCollector;

/**
 * CSS lexer.
 *
 * <p>Words are classified by the block they appear in: at the top level and
 * inside the block of a nesting at-rule such as {@code @media} they are
 * selectors, inside a rule they are property names until the {@code :} and
 * values after it. Strings end at the line break, as in CSS itself; an
 * attribute selector that is not closed on its line ends there too.</p>
 */
public class CssLexer extends AbstractLineLexer<CssState> {

    /** At-rules whose block holds rules rather than declarations. */
    private static final Set<String> NESTING_AT_RULES = Set.of(
        "container", "keyframes", "layer", "media", "scope", "starting-style", "supports");

    private static final Set<String> MEDIA_QUERY_KEYWORDS = Set.of("and", "not", "only", "or");

    private static final Set<String> TAG_NAMES = Set.of(
        "a", "abbr", "address", "area", "article", "aside", "audio",
        "b", "base", "bdi", "bdo", "blockquote", "body", "br", "button",
        "canvas", "caption", "cite", "code", "col", "colgroup",
        "data", "datalist", "dd", "del", "details", "dfn", "dialog", "div", "dl", "dt",
        "em", "embed",
        "fieldset", "figcaption", "figure", "footer", "form",
        "h1", "h2", "h3", "h4", "h5", "h6", "head", "header", "hgroup", "hr", "html",
        "i", "iframe", "img", "input", "ins",
        "kbd",
        "label", "legend", "li", "link",
        "main", "map", "mark", "math", "menu", "menuitem", "meta", "meter",
        "nav", "noscript",
        "object", "ol", "optgroup", "option", "output",
        "p", "param", "picture", "pre", "progress",
        "q",
        "rb", "rp", "rt", "rtc", "ruby",
        "s", "samp", "script", "section", "select", "slot", "small", "source",
        "span", "strong", "style", "sub", "summary", "sup", "svg",
        "table", "tbody", "td", "template", "textarea", "tfoot", "th", "thead",
        "time", "title", "tr", "track",
        "u", "ul",
        "var", "video",
        "wbr");

    private static final class LineContext {
        final CssState initial;
        List<CssState.Block> blocks;
        boolean inValue;
        boolean afterAtRule;

        LineContext(CssState initial) {
            this.initial = initial;
            this.blocks = initial.getBlocks();
            this.inValue = initial.isInValue();
            this.afterAtRule = initial.isAfterAtRule();
        }

        boolean selectorContext() {
            return CssState.isSelectorContext(blocks);
        }

        void openBlock() {
            var grown = new ArrayList<CssState.Block>(blocks.size() + 1);
            grown.addAll(blocks);
            grown.add(afterAtRule ? CssState.Block.RULES : CssState.Block.DECLARATIONS);
            blocks = grown;
            afterAtRule = false;
            inValue = false;
        }

        /**
         * @return false when there was no block to close
         */
        boolean closeBlock() {
            inValue = false;
            if (blocks.isEmpty()) {
                return false;
            }
            blocks = blocks.subList(0, blocks.size() - 1);
            return true;
        }

        CssState inComment() {
            return CssState.inComment(blocks, inValue, afterAtRule);
        }

        CssState endState() {
            if (initial instanceof CssState.Normal && blocks == initial.getBlocks()
                && inValue == initial.isInValue() && afterAtRule == initial.isAfterAtRule()) {
                return initial;
            }
            return CssState.normal(blocks, inValue, afterAtRule);
        }
    }

    @Override
    protected CssState scanLine(String text, int start, int end, int line, CssState state, @Nullable TokenCollector out) {
        int p = start;
        if (state.getKind() == CssState.Kind.IN_COMMENT) {
            int close = commentEnd(text, start, end);
            if (close < 0) {
                add(out, COMMENT, line, 0, end - start);
                return state;
            }
            add(out, COMMENT, line, 0, close - start);
            p = close;
        }

        var context = new LineContext(state);
        while (p < end) {
            char c = text.charAt(p);
            char next = Lines.charAt(text, p + 1, end);
            int column = p - start;

            if (Lines.isBlank(c)) {
                p++;
            }
            else if (c == '/' && next == '*') {
                int close = commentEnd(text, p + 2, end);
                if (close < 0) {
                    add(out, COMMENT, line, column, end - p);
                    if (out != null) {
                        out.markOpening(line, column, column + 2);
                    }
                    return context.inComment();
                }
                add(out, COMMENT, line, column, close - p);
                p = close;
            }
            else if (c == '"' || c == '\'') {
                p = string(text, start, p, end, line, out);
            }
            else if (c == '@') {
                int wordEnd = wordEnd(text, p + 1, end);
                add(out, KEYWORD, line, column, wordEnd - p);
                if (NESTING_AT_RULES.contains(text.substring(p + 1, wordEnd))) {
                    context.afterAtRule = true;
                }
                p = wordEnd;
            }
            else {
                p = code(text, start, p, end, line, context, out);
            }
        }
        return context.endState();
    }

    /**
     * Everything but comments, strings and at-keywords.
     *
     * @return the offset after the construct at {@code from}
     */
    private static int code(String text, int start, int from, int end, int line, LineContext context, @Nullable TokenCollector out) {
        char c = text.charAt(from);
        char next = Lines.charAt(text, from + 1, end);
        int column = from - start;
        boolean selector = context.selectorContext();

        if (c == '#' && !selector && context.inValue) {
            int hexEnd = from + 1;
            while (hexEnd < end && Lines.isHexDigit(text.charAt(hexEnd))) {
                hexEnd++;
            }
            if (hexEnd > from + 1) {
                add(out, NUMBER, line, column, hexEnd - from);
            }
            return hexEnd;
        }
        if ((c == '.' || c == '#') && selector) {
            int nameEnd = wordEnd(text, from + 1, end);
            if (nameEnd > from + 1) {
                add(out, CLASS, line, column, nameEnd - from);
            }
            return nameEnd;
        }
        if (c == ':') {
            if (!selector) {
                add(out, OPERATOR, line, column, 1);
                context.inValue = true;
                return from + 1;
            }
            int nameStart = next == ':' ? from + 2 : from + 1;
            if (Lines.isIdentifierStart(Lines.charAt(text, nameStart, end))) {
                int nameEnd = wordEnd(text, nameStart, end);
                add(out, CLASS, line, column, nameEnd - from);
                return nameEnd;
            }
            add(out, OPERATOR, line, column, 1);
            return nameStart;
        }

        switch (c) {
            case ';':
                add(out, OPERATOR, line, column, 1);
                context.inValue = false;
                return from + 1;
            case '{':
                add(out, OPERATOR, line, column, 1);
                context.openBlock();
                return from + 1;
            case '}':
                add(out, OPERATOR, line, column, 1);
                if (!context.closeBlock() && out != null) {
                    out.error(LexDiagnostic.Kind.STRUCTURAL_MISMATCH, line, column, column + 1, "Unexpected '}'");
                }
                return from + 1;
            case ',':
                add(out, OPERATOR, line, column, 1);
                return from + 1;
            case '>':
            case '+':
            case '~':
                if (selector) {
                    add(out, OPERATOR, line, column, 1);
                }
                return from + 1;
            case '!':
                return important(text, start, from, end, line, context, out);
            case '*':
                if (selector) {
                    add(out, TYPE, line, column, 1);
                }
                return from + 1;
            case '[':
                return attributeSelectorEnd(text, from + 1, end);
            default:
                break;
        }

        if (Lines.isDigit(c) || (c == '.' && Lines.isDigit(next))) {
            int numberEnd = numberEnd(text, from, end);
            add(out, NUMBER, line, column, numberEnd - from);
            return numberEnd;
        }
        if (Lines.isIdentifierStart(c) || c == '-') {
            return word(text, start, from, end, line, context, out);
        }
        return from + 1;
    }

    private static int word(String text, int start, int from, int end, int line, LineContext context, @Nullable TokenCollector out) {
        int column = from - start;
        if (text.charAt(from) == '-' && Lines.charAt(text, from + 1, end) == '-') {
            int nameEnd = wordEnd(text, from + 2, end);
            add(out, PARAMETER, line, column, nameEnd - from);
            return nameEnd;
        }
        int wordEnd = wordEnd(text, from, end);
        if (wordEnd == from + 1 && text.charAt(from) == '-') {
            return wordEnd;
        }
        if (out == null) {
            return wordEnd;
        }

        String word = text.substring(from, wordEnd);
        if (Lines.charAt(text, wordEnd, end) == '(') {
            out.add(FUNCTION, line, column, word.length());
        }
        else if (MEDIA_QUERY_KEYWORDS.contains(word)) {
            out.add(KEYWORD, line, column, word.length());
        }
        else if (context.selectorContext()) {
            if (TAG_NAMES.contains(word)) {
                out.add(TYPE, line, column, word.length());
            }
        }
        else if (!context.inValue) {
            out.add(PROPERTY, line, column, word.length());
        }
        return wordEnd;
    }

    /**
     * {@code !important}, blanks allowed after the {@code !}. Only recognized inside a block.
     */
    private static int important(String text, int start, int from, int end, int line, LineContext context, @Nullable TokenCollector out) {
        if (context.blocks.isEmpty()) {
            return from + 1;
        }
        int wordStart = Lines.skipBlanks(text, from + 1, end);
        int wordEnd = wordStart;
        while (wordEnd < end && isLetter(text.charAt(wordEnd))) {
            wordEnd++;
        }
        if (text.substring(wordStart, wordEnd).equals("important")) {
            add(out, KEYWORD, line, from - start, wordEnd - from);
        }
        return wordEnd;
    }

    /**
     * Digits with an optional fraction, followed by {@code %} or a unit.
     */
    private static int numberEnd(String text, int from, int end) {
        int i = from;
        while (i < end && Lines.isDigit(text.charAt(i))) {
            i++;
        }
        if (Lines.charAt(text, i, end) == '.' && Lines.isDigit(Lines.charAt(text, i + 1, end))) {
            i++;
            while (i < end && Lines.isDigit(text.charAt(i))) {
                i++;
            }
        }
        if (Lines.charAt(text, i, end) == '%') {
            return i + 1;
        }
        while (i < end && isLetter(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int string(String text, int start, int from, int end, int line, @Nullable TokenCollector out) {
        char quote = text.charAt(from);
        for (int i = from + 1; i < end; i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            }
            else if (c == quote) {
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
     * @return the offset after the {@code ]}, skipping quoted values, or the end of the line
     */
    private static int attributeSelectorEnd(String text, int from, int end) {
        for (int i = from; i < end; i++) {
            char c = text.charAt(i);
            if (c == ']') {
                return i + 1;
            }
            if (c == '"' || c == '\'') {
                int j = i + 1;
                while (j < end && text.charAt(j) != c) {
                    if (text.charAt(j) == '\\') {
                        j++;
                    }
                    j++;
                }
                i = j;
            }
        }
        return end;
    }

    /**
     * @return the offset after the closing {@code *}{@code /}, or -1 when it is not on this line
     */
    private static int commentEnd(String text, int from, int end) {
        for (int i = from; i + 1 < end; i++) {
            if (text.charAt(i) == '*' && text.charAt(i + 1) == '/') {
                return i + 2;
            }
        }
        return -1;
    }

    private static int wordEnd(String text, int from, int end) {
        int i = from;
        while (i < end && (Lines.isIdentifierPart(text.charAt(i)) || text.charAt(i) == '-')) {
            i++;
        }
        return i;
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static void add(@Nullable TokenCollector out, CssTokenKind kind, int line, int column, int length) {
        if (out != null) {
            out.add(kind, line, column, length);
        }
    }

    @Override
    protected String unterminatedMessage(CssState state) {
        return "Unterminated comment";
    }
}
