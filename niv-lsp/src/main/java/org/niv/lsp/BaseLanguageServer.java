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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.SetTraceParams;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.niv.lsp.log.LogRedirectConfiguration;

/**
 * Connects a {@link TokenizerTextDocumentService} to a client, over stdio in
 * deploy mode and over a local TCP socket otherwise.
 */
@SuppressWarnings("java:S106") // we are using system.in/system.out correctly in this class
public abstract class BaseLanguageServer {
    private static final PrintStream capturedOut;
    private static final InputStream capturedIn;
    private static final boolean DEPLOY_MODE;
    private static final String LOG_CONFIGURATION_KEY = "log4j2.configurationFactory";

    public static final String DEPLOY_PROPERTY = "niv.lsp.deploy";
    public static final String PORT_PROPERTY = "niv.lsp.port";

    static {
        DEPLOY_MODE = System.getProperty(DEPLOY_PROPERTY, "false").equalsIgnoreCase("true");
        if (DEPLOY_MODE){
            // stdin and stdout are reserved for the protocol
            capturedIn = System.in;
            capturedOut = System.out;
            System.setIn(new ByteArrayInputStream(new byte[0]));
            System.setOut(new PrintStream(System.err, false));
        }
        else {
            capturedIn = InputStream.nullInputStream();
            capturedOut = new PrintStream(OutputStream.nullOutputStream());
        }
        System.setProperty("java.util.logging.manager", "org.apache.logging.log4j.jul.LogManager");
        // keep a factory that was passed on the command line
        System.setProperty(LOG_CONFIGURATION_KEY, System.getProperty(LOG_CONFIGURATION_KEY, LogRedirectConfiguration.class.getName()));
    }

    // hide implicit constructor
    protected BaseLanguageServer() {}

    private static final Logger logger = LogManager.getLogger(BaseLanguageServer.class);

    protected static boolean isDeployMode() {
        return DEPLOY_MODE;
    }

    private static Launcher<LanguageClient> constructLSPClient(Socket client, ActualLanguageServer server, ExecutorService threadPool)
        throws IOException {
        client.setTcpNoDelay(true);
        return constructLSPClient(client.getInputStream(), client.getOutputStream(), server, threadPool);
    }

    private static Launcher<LanguageClient> constructLSPClient(InputStream in, OutputStream out, ActualLanguageServer server, ExecutorService threadPool) {
        Launcher<LanguageClient> clientLauncher = new Launcher.Builder<LanguageClient>()
            .setLocalService(server)
            .setRemoteInterface(LanguageClient.class)
            .setInput(in)
            .setOutput(out)
            .setExecutorService(threadPool)
            .create();

        server.connect(clientLauncher.getRemoteProxy());

        return clientLauncher;
    }

    @SuppressWarnings({"java:S2189", "java:S106"})
    public static void startLanguageServer(String name, ExecutorService threadPool,
            Function<ExecutorService, TokenizerTextDocumentService> docServiceProvider, int portNumber) {
        logger.info("Starting {}: {}", name, getVersion());
        logger.trace("Started with classpath: {}", () -> System.getProperty("java.class.path"));

        if (DEPLOY_MODE) {
            var server = new ActualLanguageServer(name, () -> System.exit(0), threadPool, docServiceProvider.apply(threadPool));
            startLSP(constructLSPClient(capturedIn, capturedOut, server, threadPool));
        }
        else {
            try (ServerSocket serverSocket = new ServerSocket(portNumber, 0, InetAddress.getByName("127.0.0.1"))) {
                logger.info("{} listens on port number: {}", name, portNumber);
                while (true) {
                    var server = new ActualLanguageServer(name, () -> {}, threadPool, docServiceProvider.apply(threadPool));
                    startLSP(constructLSPClient(serverSocket.accept(), server, threadPool));
                }
            } catch (IOException e) {
                logger.fatal("Failure to start TCP server on port {}", portNumber, e);
            }
        }
    }

    private static final String DEFAULT_VERSION = "unknown";

    static String getVersion() {
        try (InputStream prop = BaseLanguageServer.class.getClassLoader().getResourceAsStream("project.properties")) {
            if (prop == null) {
                logger.error("Could not find project.properties file");
                return DEFAULT_VERSION;
            }
            Properties properties = new Properties();
            properties.load(prop);
            return properties.getProperty("niv.lsp.version", DEFAULT_VERSION) + " at "
                + properties.getProperty("niv.lsp.build.timestamp", DEFAULT_VERSION);
        }
        catch (IOException e) {
            logger.debug("Cannot find lsp version", e);
            return DEFAULT_VERSION;
        }
    }

    private static void startLSP(Launcher<LanguageClient> server) {
        try {
            server.startListening().get();
        } catch (InterruptedException e) {
            logger.trace("Interrupted server", e);
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            logger.fatal("Unexpected exception", e.getCause());
            if (DEPLOY_MODE) {
                System.exit(1);
            }
        } catch (Throwable e) {
            logger.fatal("Unexpected exception", e);
            if (DEPLOY_MODE) {
                System.exit(1);
            }
        }
    }

    static class ActualLanguageServer implements LanguageServer, LanguageClientAware {
        static final Logger logger = LogManager.getLogger(ActualLanguageServer.class);
        private final String name;
        private final TokenizerTextDocumentService lspDocumentService;
        private final TokenizerWorkspaceService lspWorkspaceService = new TokenizerWorkspaceService();
        private final Runnable onExit;
        private final ExecutorService executor;

        ActualLanguageServer(String name, Runnable onExit, ExecutorService executor, TokenizerTextDocumentService lspDocumentService) {
            this.name = name;
            this.onExit = onExit;
            this.executor = executor;
            this.lspDocumentService = lspDocumentService;
        }

        @Override
        public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
            return CompletableFuture.supplyAsync(() -> {
                var clientInfo = params.getClientInfo();
                if (clientInfo != null) {
                    logger.info("LSP connection started (connected to {} version {})", clientInfo.getName(), clientInfo.getVersion());
                }
                else {
                    logger.info("LSP connection started");
                }
                logger.debug("LSP client capabilities: {}", params.getCapabilities());
                final InitializeResult initializeResult = new InitializeResult(new ServerCapabilities(), new ServerInfo(name, getVersion()));
                lspDocumentService.initializeServerCapabilities(initializeResult.getCapabilities());
                lspWorkspaceService.initialize(params.getWorkspaceFolders());
                logger.debug("Initialized LSP connection with capabilities: {}", initializeResult);
                return initializeResult;
            }, executor);
        }

        @Override
        @SuppressWarnings("unused") // InitializedParams is an empty interface
        public void initialized(InitializedParams params) {
            logger.debug("LSP connection initialized");
        }

        @Override
        public CompletableFuture<Object> shutdown() {
            return CompletableFuture.supplyAsync(() -> {
                lspDocumentService.shutdown();
                return true;
            }, executor);
        }

        @Override
        public void exit() {
            onExit.run();
        }

        @Override
        public TokenizerTextDocumentService getTextDocumentService() {
            return lspDocumentService;
        }

        @Override
        public TokenizerWorkspaceService getWorkspaceService() {
            return lspWorkspaceService;
        }

        @Override
        public void setTrace(SetTraceParams params) {
            logger.trace("Got trace request: {}", params);
        }

        @Override
        public void connect(LanguageClient client) {
            lspDocumentService.connect(client);
        }
    }
}
