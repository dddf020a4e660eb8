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

import java.util.Objects;

import org.eclipse.lsp4j.DiagnosticSeverity;

/**
 * A problem found while scanning. Positions are line based, the end column is
 * exclusive.
 */
public final class LexDiagnostic {

    public enum Kind {
        /** A string, comment or here-document that was not closed. */
        UNTERMINATED_LITERAL,
        /** A character that cannot start any token. */
        UNEXPECTED_CHARACTER,
        /** Brackets that do not match up, or a document with several roots. */
        STRUCTURAL_MISMATCH,
        INVALID_ESCAPE
    }

    private final Kind kind;
    private final int line;
    private final int startColumn;
    private final int endColumn;
    private final DiagnosticSeverity severity;
    private final String message;

    public LexDiagnostic(Kind kind, int line, int startColumn, int endColumn, DiagnosticSeverity severity, String message) {
        this.kind = kind;
        this.line = line;
        this.startColumn = startColumn;
        this.endColumn = Math.max(endColumn, startColumn);
        this.severity = severity;
        this.message = message;
    }

    public Kind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public DiagnosticSeverity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof LexDiagnostic)) {
            return false;
        }
        LexDiagnostic other = (LexDiagnostic) obj;
        return kind == other.kind && line == other.line && startColumn == other.startColumn
            && endColumn == other.endColumn && severity == other.severity && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, line, startColumn, endColumn, message);
    }

    @Override
    public String toString() {
        return kind + "@" + line + ":" + startColumn + "-" + endColumn + " " + message;
    }
}
