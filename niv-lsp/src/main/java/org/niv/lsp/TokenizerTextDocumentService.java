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
package org.niv.lsp;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.SemanticTokens;
import org.eclipse.lsp4j.SemanticTokensDelta;
import org.eclipse.lsp4j.SemanticTokensDeltaParams;
import org.eclipse.lsp4j.SemanticTokensParams;
import org.eclipse.lsp4j.SemanticTokensRangeParams;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.niv.lsp.tokenizer.Language;
import org.niv.lsp.tokenizer.ParallelTokenizer;
import org.niv.lsp.tokenizer.RangeTokenizer;
import org.niv.lsp.tokenizer.SemanticTokenEncoder;
import org.niv.lsp.tokenizer.Token;
import org.niv.lsp.tokenizer.TokenizerConfiguration;
import org.niv.lsp.util.Diagnostics;
import org.niv.lsp.util.Versioned;

/**
 * Keeps the open documents of one language and answers semantic token
 * requests for them. Every request tokenizes the current contents from
 * scratch.
 */
public class TokenizerTextDocumentService implements TextDocumentService, LanguageClientAware {
    private static final Logger logger = LogManager.getLogger(TokenizerTextDocumentService.class);

    /**
     * Documents of this many characters or more get no diagnostics.
     */
    static final int DIAGNOSTICS_SIZE_LIMIT = 1_000_000;

    private final ExecutorService ownExecuter;
    private final Language<?> language;
    private final ParallelTokenizer<?> tokenizer;
    private final RangeTokenizer<?> rangeTokenizer;
    private final Map<String, TextDocumentState> files = new ConcurrentHashMap<>();

    private @MonotonicNonNull LanguageClient client;

    public TokenizerTextDocumentService(ExecutorService exec, Language<?> language, TokenizerConfiguration configuration) {
        this.ownExecuter = exec;
        this.language = language;
        this.tokenizer = ParallelTokenizer.forLanguage(language, configuration);
        this.rangeTokenizer = new RangeTokenizer<>(tokenizer);
    }

    public Language<?> getLanguage() {
        return language;
    }

    public void initializeServerCapabilities(ServerCapabilities result) {
        result.setTextDocumentSync(TextDocumentSyncKind.Full);
        result.setSemanticTokensProvider(SemanticTokenEncoder.options(language));
    }

    private LanguageClient availableClient() {
        if (client == null) {
            throw new IllegalStateException("Language Client has not been connected yet");
        }
        return client;
    }

    @Override
    public void connect(LanguageClient client) {
        this.client = client;
    }

    // LSP interface methods

    @Override
    public void didOpen(DidOpenTextDocumentParams params) {
        var timestamp = System.currentTimeMillis();
        var doc = params.getTextDocument();
        logger.debug("Did Open file: {}", doc.getUri());
        var file = new TextDocumentState(doc.getUri(), doc.getVersion(), doc.getText(), timestamp);
        files.put(doc.getUri(), file);
        publishDiagnostics(file);
    }

    @Override
    public void didChange(DidChangeTextDocumentParams params) {
        var timestamp = System.currentTimeMillis();
        var doc = params.getTextDocument();
        logger.debug("Did Change file: {}", doc.getUri());
        List<TextDocumentContentChangeEvent> changes = params.getContentChanges();
        if (changes.isEmpty()) {
            return;
        }
        var file = getFile(doc.getUri());
        // full sync: the last change holds the complete text
        if (file.update(doc.getVersion(), changes.get(changes.size() - 1).getText(), timestamp)) {
            publishDiagnostics(file);
        }
        else {
            logger.debug("Ignoring version {} of {}, already at {}", doc.getVersion(), doc.getUri(),
                file.getCurrentContent().version());
        }
    }

    @Override
    public void didSave(DidSaveTextDocumentParams params) {
        // contents already came in via didChange
        logger.debug("Did Save file: {}", params.getTextDocument().getUri());
    }

    @Override
    public void didClose(DidCloseTextDocumentParams params) {
        var uri = params.getTextDocument().getUri();
        logger.debug("Did Close file: {}", uri);
        if (files.remove(uri) == null) {
            throw new ResponseErrorException(unknownFileError(uri, params));
        }
        runOnClient(c -> c.publishDiagnostics(new PublishDiagnosticsParams(uri, Collections.emptyList())));
    }

    @Override
    public CompletableFuture<SemanticTokens> semanticTokensFull(SemanticTokensParams params) {
        logger.debug("semanticTokensFull: {}", params.getTextDocument().getUri());
        return getSemanticTokens(params.getTextDocument().getUri());
    }

    @Override
    public CompletableFuture<Either<SemanticTokens, SemanticTokensDelta>> semanticTokensFullDelta(
            SemanticTokensDeltaParams params) {
        logger.debug("semanticTokensFullDelta: {}", params.getTextDocument().getUri());
        return getSemanticTokens(params.getTextDocument().getUri()).thenApply(Either::forLeft);
    }

    @Override
    public CompletableFuture<SemanticTokens> semanticTokensRange(SemanticTokensRangeParams params) {
        var uri = params.getTextDocument().getUri();
        int startLine = params.getRange().getStart().getLine();
        int endLine = Math.max(startLine, params.getRange().getEnd().getLine());
        logger.debug("semanticTokensRange: {} [{}, {}]", uri, startLine, endLine);
        var content = getFile(uri).getCurrentContent();
        return encode(() -> rangeTokenizer.tokenizeRange(content.get(), startLine, endLine));
    }

    /**
     * @return the latest text of an open document
     */
    public String getContents(String uri) {
        return getFile(uri).getCurrentContent().get();
    }

    public void shutdown() {
        logger.debug("Dropping {} open {} documents", files.size(), language.getId());
        files.clear();
    }

    private CompletableFuture<SemanticTokens> getSemanticTokens(String uri) {
        var content = getFile(uri).getCurrentContent();
        return encode(() -> tokenizer.tokenize(content.get()).getTokens());
    }

    private CompletableFuture<SemanticTokens> encode(Supplier<List<Token>> tokens) {
        return recoverExceptions(CompletableFuture.supplyAsync(tokens, ownExecuter)
                .thenApply(SemanticTokenEncoder::toSemanticTokens)
                .whenComplete((r, e) ->
                    logger.debug("Semantic tokens success, reporting {} tokens back", r == null ? 0 : r.getData().size() / 5)
                )
            , () -> new SemanticTokens(Collections.emptyList()));
    }

    private void publishDiagnostics(TextDocumentState file) {
        Versioned<String> content = file.getCurrentContent();
        if (content.get().length() >= DIAGNOSTICS_SIZE_LIMIT) {
            logger.debug("Skipping diagnostics for {}, {} characters", file.getUri(), content.get().length());
            return;
        }
        recoverExceptions(CompletableFuture.supplyAsync(() -> tokenizer.tokenizeSequential(content.get()), ownExecuter)
                .thenAccept(result -> publishIfCurrent(file, content,
                    Diagnostics.translate(result.getDiagnostics(), language))),
            () -> null);
    }

    /**
     * Diagnostics of a version that has been replaced or closed in the meantime are dropped, so a
     * slow scan of an old version never overwrites the diagnostics of a newer one.
     */
    private void publishIfCurrent(TextDocumentState file, Versioned<String> content, List<Diagnostic> diagnostics) {
        synchronized (file) {
            int current = file.getCurrentContent().version();
            if (files.get(file.getUri()) != file || current != content.version()) {
                logger.debug("Dropping diagnostics of version {} of {}, now at {}", content.version(), file.getUri(), current);
                return;
            }
            availableClient().publishDiagnostics(new PublishDiagnosticsParams(file.getUri(), diagnostics, content.version()));
        }
    }

    private void runOnClient(Consumer<LanguageClient> action) {
        recoverExceptions(CompletableFuture.runAsync(() -> action.accept(availableClient()), ownExecuter), () -> null);
    }

    private static <T> CompletableFuture<T> recoverExceptions(CompletableFuture<T> future, Supplier<T> defaultValue) {
        return future
            .exceptionally(e -> {
                logger.error("Operation failed with", e);
                return defaultValue.get();
            });
    }

    private TextDocumentState getFile(String uri) {
        TextDocumentState file = files.get(uri);
        if (file == null) {
            throw new ResponseErrorException(unknownFileError(uri, uri));
        }
        return file;
    }

    private static ResponseError unknownFileError(String uri, Object data) {
        return new ResponseError(ResponseErrorCode.InvalidParams, "Unknown file: " + uri, data);
    }
}
