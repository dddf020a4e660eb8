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

import java.util.List;
import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.niv.lsp.tokenizer.LexState;

/**
 * Line boundary state of a Python module.
 *
 * <p>Three things outlive a line break: a triple-quoted string, the
 * parameter list of a {@code def} that is not closed yet, and the stack of
 * enclosing {@code class} and {@code def} headers with their indentation.
 * The scope stack is what tells a method from a function.</p>
 */
public abstract class PythonState implements LexState {

    public enum Kind { NORMAL, IN_PARAMETERS, IN_TRIPLE_STRING }

    public static final PythonState NORMAL = new Normal(List.of());

    private final List<Scope> scopes;

    private PythonState(List<Scope> scopes) {
        this.scopes = scopes;
    }

    public abstract Kind getKind();

    /**
     * @return enclosing headers, outermost first
     */
    public List<Scope> getScopes() {
        return scopes;
    }

    /**
     * @return the open parameter list, or null outside one
     */
    public abstract @Nullable Parameters getParameters();

    /**
     * A {@code def} is a method when the innermost enclosing header is a class.
     */
    public static boolean isClassScope(List<Scope> scopes) {
        return !scopes.isEmpty() && scopes.get(scopes.size() - 1).getType() == Scope.Type.CLASS;
    }

    public static PythonState normal(List<Scope> scopes) {
        return scopes.isEmpty() ? NORMAL : new Normal(List.copyOf(scopes));
    }

    public static PythonState inParameters(List<Scope> scopes, Parameters parameters) {
        return new InParameters(List.copyOf(scopes), parameters);
    }

    /**
     * A triple-quoted string at module level, outside any parameter list.
     *
     * @param quote either {@code "} or {@code '}
     * @param raw whether backslashes are literal
     */
    public static PythonState inTripleString(char quote, boolean raw) {
        return inTripleString(quote, raw, List.of(), null);
    }

    public static PythonState inTripleString(char quote, boolean raw, List<Scope> scopes, @Nullable Parameters parameters) {
        if (quote != '"' && quote != '\'') {
            throw new IllegalArgumentException("Not a quote: " + quote);
        }
        return new InTripleString(quote, raw, List.copyOf(scopes), parameters);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        PythonState other = (PythonState) obj;
        return scopes.equals(other.scopes) && Objects.equals(getParameters(), other.getParameters());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), scopes, getParameters());
    }

    /**
     * A {@code class} or {@code def} header and the indentation of its line.
     * The scope ends at the first later line that is indented as far or less.
     */
    public static final class Scope {
        public enum Type { CLASS, FUNCTION }

        private final Type type;
        private final int indent;

        public Scope(Type type, int indent) {
            this.type = type;
            this.indent = indent;
        }

        public Type getType() {
            return type;
        }

        public int getIndent() {
            return indent;
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Scope)) {
                return false;
            }
            Scope other = (Scope) obj;
            return type == other.type && indent == other.indent;
        }

        @Override
        public int hashCode() {
            return 31 * type.hashCode() + indent;
        }

        @Override
        public String toString() {
            return type + "@" + indent;
        }
    }

    /**
     * Where a {@code def} parameter list stands at a line break.
     */
    public static final class Parameters {
        private final int depth;
        private final boolean first;
        private final boolean inAnnotation;

        /**
         * @param depth open parentheses, the list's own included
         * @param first whether no parameter name has been seen yet
         * @param inAnnotation whether the current parameter is past its {@code :} or {@code =}
         */
        public Parameters(int depth, boolean first, boolean inAnnotation) {
            if (depth < 1) {
                throw new IllegalArgumentException("Parameter list depth must be positive: " + depth);
            }
            this.depth = depth;
            this.first = first;
            this.inAnnotation = inAnnotation;
        }

        public int getDepth() {
            return depth;
        }

        public boolean isFirst() {
            return first;
        }

        public boolean isInAnnotation() {
            return inAnnotation;
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Parameters)) {
                return false;
            }
            Parameters other = (Parameters) obj;
            return depth == other.depth && first == other.first && inAnnotation == other.inAnnotation;
        }

        @Override
        public int hashCode() {
            return Objects.hash(depth, first, inAnnotation);
        }

        @Override
        public String toString() {
            return "Parameters(" + depth + (first ? ", first" : "") + (inAnnotation ? ", annotation" : "") + ")";
        }
    }

    public static final class Normal extends PythonState {
        private Normal(List<Scope> scopes) {
            super(scopes);
        }

        @Override
        public Kind getKind() {
            return Kind.NORMAL;
        }

        @Override
        public @Nullable Parameters getParameters() {
            return null;
        }

        @Override
        public boolean isUnterminated() {
            return false;
        }

        @Override
        public String toString() {
            return getScopes().isEmpty() ? "Normal" : "Normal" + getScopes();
        }
    }

    public static final class InParameters extends PythonState {
        private final Parameters parameters;

        private InParameters(List<Scope> scopes, Parameters parameters) {
            super(scopes);
            this.parameters = parameters;
        }

        @Override
        public Kind getKind() {
            return Kind.IN_PARAMETERS;
        }

        @Override
        public Parameters getParameters() {
            return parameters;
        }

        /**
         * An open parameter list at the end of the input is left to the parser.
         */
        @Override
        public boolean isUnterminated() {
            return false;
        }

        @Override
        public String toString() {
            return "InParameters(" + parameters + ", " + getScopes() + ")";
        }
    }

    public static final class InTripleString extends PythonState {
        private final char quote;
        private final boolean raw;
        private final @Nullable Parameters parameters;

        private InTripleString(char quote, boolean raw, List<Scope> scopes, @Nullable Parameters parameters) {
            super(scopes);
            this.quote = quote;
            this.raw = raw;
            this.parameters = parameters;
        }

        @Override
        public Kind getKind() {
            return Kind.IN_TRIPLE_STRING;
        }

        /**
         * @return the parameter list the string sits in, as a default value
         */
        @Override
        public @Nullable Parameters getParameters() {
            return parameters;
        }

        @Override
        public boolean isUnterminated() {
            return true;
        }

        public char getQuote() {
            return quote;
        }

        public boolean isRaw() {
            return raw;
        }

        @Override
        public boolean equals(Object obj) {
            if (!super.equals(obj)) {
                return false;
            }
            InTripleString other = (InTripleString) obj;
            return quote == other.quote && raw == other.raw;
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + 2 * quote + (raw ? 1 : 0);
        }

        @Override
        public String toString() {
            return "InTripleString(" + quote + quote + quote + (raw ? ", raw" : "") + ")";
        }
    }
}
