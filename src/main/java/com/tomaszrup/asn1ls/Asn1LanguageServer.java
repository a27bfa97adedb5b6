////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.asn1ls;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.logging.Level;

import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.SemanticTokensWithRegistrationOptions;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.jsonrpc.services.JsonRequest;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.asn1ls.format.FormatterConfig;
import com.tomaszrup.asn1ls.providers.SemanticTokensProvider;

public class Asn1LanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = LoggerFactory.getLogger(Asn1LanguageServer.class);

    static final int DEFAULT_TCP_PORT = 5007;
    private static final String LOG_LEVEL_OPTION = "logLevel";

    public static void main(String[] args) throws IOException {
        // Log uncaught exceptions on any thread instead of dying silently,
        // which the client would only see as a broken pipe.
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
            System.err.println("[FATAL] Uncaught exception on thread " + thread.getName());
            throwable.printStackTrace(System.err);
            logger.error("Uncaught exception on thread {}: {}",
                    thread.getName(), throwable.getMessage(), throwable);
        });

        // "Unmatched cancel notification" warnings are normal for requests
        // that completed before the client cancelled them.
        java.util.logging.Logger.getLogger("org.eclipse.lsp4j.jsonrpc.RemoteEndpoint")
                .setLevel(Level.SEVERE);
        if (args.length > 0 && "--tcp".equals(args[0])) {
            int port = DEFAULT_TCP_PORT;
            if (args.length > 1) {
                try {
                    port = Integer.parseInt(args[1]);
                } catch (NumberFormatException e) {
                    logger.error("Invalid port number: {}", args[1]);
                    System.exit(1);
                }
            }

            try (ServerSocket serverSocket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress())) {
                logger.info("ASN.1 Language Server listening on port {} (localhost only)", port);
                try (Socket socket = serverSocket.accept()) {
                    logger.info("Client connected.");
                    startServer(socket.getInputStream(), socket.getOutputStream());
                }
            }
        } else {
            logger.info("ASN.1 Language Server starting in stdio mode.");
            startServer(System.in, System.out);
        }
    }

    private static void startServer(InputStream in, OutputStream out) {
        // stdout may be the protocol channel
        System.setOut(new PrintStream(System.err));

        Asn1LanguageServer server = new Asn1LanguageServer();
        Launcher<LanguageClient> launcher = Launcher.createLauncher(server, LanguageClient.class, in, out);
        server.connect(launcher.getRemoteProxy());

        // The listener runs on its own thread; keep main alive until it ends.
        Future<Void> future = launcher.startListening();
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Language server listener interrupted");
        } catch (ExecutionException e) {
            logger.error("Language server listener terminated with error: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
    }

    private final Asn1Services asn1Services;

    public Asn1LanguageServer() {
        this.asn1Services = new Asn1Services();
        this.asn1Services.setSettingsChangeListener(this::onSettingsChanged);
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        Object initOptions = params.getInitializationOptions();
        if (initOptions instanceof JsonObject) {
            JsonObject opts = (JsonObject) initOptions;
            // before anything else, so later messages respect the level
            if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
                applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
            }
            asn1Services.getSettings().update(opts);
        }

        ServerCapabilities serverCapabilities = new ServerCapabilities();
        serverCapabilities.setTextDocumentSync(TextDocumentSyncKind.Incremental);
        serverCapabilities.setDocumentFormattingProvider(true);
        serverCapabilities.setDocumentSymbolProvider(true);

        SemanticTokensWithRegistrationOptions semanticTokensOptions = new SemanticTokensWithRegistrationOptions();
        semanticTokensOptions.setLegend(SemanticTokensProvider.getLegend());
        semanticTokensOptions.setFull(true);
        semanticTokensOptions.setRange(false);
        serverCapabilities.setSemanticTokensProvider(semanticTokensOptions);

        logger.info("Initialized for client {}", params.getClientInfo() != null
                ? params.getClientInfo().getName() : "<unknown>");
        InitializeResult initializeResult = new InitializeResult(serverCapabilities);
        initializeResult.setServerInfo(new ServerInfo("asn1-language-server"));
        return CompletableFuture.completedFuture(initializeResult);
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        logger.info("Shutdown requested");
        return CompletableFuture.completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(0);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return asn1Services;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return asn1Services;
    }

    @Override
    public void connect(LanguageClient client) {
        asn1Services.connect(client);
    }

    /**
     * Custom LSP request: format the ASN.1 fenced block of a Markdown
     * document that encloses a line.
     *
     * @param params a JSON object with a {@code uri} string, a zero-based
     *               {@code line} and an optional {@code tabSize}
     * @return the edits, empty when the line is not inside an ASN.1 block
     */
    @JsonRequest(Protocol.REQUEST_FORMAT_CODE_BLOCK)
    public CompletableFuture<List<TextEdit>> formatCodeBlock(JsonObject params) {
        if (params == null || !isPrimitive(params, "uri") || !isPrimitive(params, "line")) {
            logger.warn("{} called without uri and line: {}", Protocol.REQUEST_FORMAT_CODE_BLOCK, params);
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        URI uri;
        int line;
        try {
            uri = URI.create(params.get("uri").getAsString());
            line = params.get("line").getAsInt();
        } catch (IllegalArgumentException e) {
            logger.warn("{} called with invalid params {}: {}", Protocol.REQUEST_FORMAT_CODE_BLOCK, params,
                    e.getMessage());
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        int tabSize = FormatterConfig.DEFAULT_INDENT_WIDTH;
        if (isPrimitive(params, "tabSize")) {
            try {
                tabSize = params.get("tabSize").getAsInt();
            } catch (NumberFormatException e) {
                logger.debug("Ignoring non-numeric tabSize {}", params.get("tabSize"));
            }
        }
        return asn1Services.formatCodeBlock(uri, line, tabSize);
    }

    private void onSettingsChanged(JsonObject settings) {
        if (!settings.has(Protocol.SETTINGS_SECTION) || !settings.get(Protocol.SETTINGS_SECTION).isJsonObject()) {
            return;
        }
        JsonObject asn1 = settings.getAsJsonObject(Protocol.SETTINGS_SECTION);
        if (isPrimitive(asn1, LOG_LEVEL_OPTION)) {
            applyLogLevel(asn1.get(LOG_LEVEL_OPTION).getAsString());
        }
    }

    private static boolean isPrimitive(JsonObject object, String key) {
        JsonElement element = object.get(key);
        return element != null && element.isJsonPrimitive();
    }

    /**
     * Sets the level of the Logback root logger. Unknown level names keep
     * the current level.
     */
    static void applyLogLevel(String levelName) {
        try {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level previous = root.getLevel();
            root.setLevel(level);
            logger.info("Log level changed from {} to {}", previous, level);
        } catch (Exception e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
        }
    }
}
