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

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.DocumentSymbolParams;
import org.eclipse.lsp4j.FileEvent;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.SemanticTokens;
import org.eclipse.lsp4j.SemanticTokensParams;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.asn1ls.config.Asn1Settings;
import com.tomaszrup.asn1ls.providers.DocumentSymbolProvider;
import com.tomaszrup.asn1ls.providers.FormattingProvider;
import com.tomaszrup.asn1ls.providers.SemanticTokensProvider;
import com.tomaszrup.asn1ls.util.FileContentsTracker;

/**
 * Text document and workspace services of the server. Each request is
 * delegated to a handler or provider; this class only tracks documents and
 * keeps failures from reaching the LSP connection.
 */
public class Asn1Services implements TextDocumentService, WorkspaceService, LanguageClientAware {
	private static final Logger logger = LoggerFactory.getLogger(Asn1Services.class);

	private final AtomicReference<LanguageClient> languageClient = new AtomicReference<>();
	private final FileContentsTracker fileContentsTracker = new FileContentsTracker();
	private final Asn1Settings settings = new Asn1Settings();
	private final LspRequestGuard requestGuard = new LspRequestGuard(fileContentsTracker);
	private final FormattingHandler formattingHandler = new FormattingHandler(new FormattingProvider(),
			fileContentsTracker, settings);
	private final SemanticTokensHandler semanticTokensHandler = new SemanticTokensHandler(
			new SemanticTokensProvider(fileContentsTracker), settings);
	private final DocumentSymbolProvider documentSymbolProvider = new DocumentSymbolProvider(fileContentsTracker);
	private final ConfigurationChangeHandler configChangeHandler = new ConfigurationChangeHandler(settings);

	@Override
	public void connect(LanguageClient client) {
		this.languageClient.set(client);
	}

	public Asn1Settings getSettings() {
		return settings;
	}

	void setSettingsChangeListener(ConfigurationChangeHandler.SettingsChangeListener listener) {
		configChangeHandler.setSettingsChangeListener(listener);
	}

	// --- TextDocumentService notifications ---

	@Override
	public void didOpen(DidOpenTextDocumentParams params) {
		try {
			fileContentsTracker.didOpen(params);
			logger.debug("didOpen uri={} languageId={}", params.getTextDocument().getUri(),
					params.getTextDocument().getLanguageId());
		} catch (VirtualMachineError e) {
			logger.error("VirtualMachineError during didOpen for {}: {}", params.getTextDocument().getUri(),
					e.toString());
		} catch (Exception e) {
			logger.warn("Unexpected exception during didOpen for {}: {}", params.getTextDocument().getUri(),
					e.getMessage());
			logger.debug("didOpen exception details", e);
		}
	}

	@Override
	public void didChange(DidChangeTextDocumentParams params) {
		try {
			fileContentsTracker.didChange(params);
		} catch (VirtualMachineError e) {
			logger.error("VirtualMachineError during didChange for {}: {}", params.getTextDocument().getUri(),
					e.toString());
		} catch (Exception e) {
			logger.warn("Unexpected exception during didChange for {}: {}", params.getTextDocument().getUri(),
					e.getMessage());
			logger.debug("didChange exception details", e);
		}
	}

	@Override
	public void didClose(DidCloseTextDocumentParams params) {
		fileContentsTracker.didClose(params);
		semanticTokensHandler.clearCache(URI.create(params.getTextDocument().getUri()));
	}

	@Override
	public void didSave(DidSaveTextDocumentParams params) {
		// contents are tracked through didChange, nothing to do on save
	}

	// --- WorkspaceService notifications ---

	@Override
	public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		List<URI> uris = new ArrayList<>();
		for (FileEvent event : params.getChanges()) {
			uris.add(URI.create(event.getUri()));
		}
		fileContentsTracker.invalidateClosedFileCache(uris);
	}

	@Override
	public void didChangeConfiguration(DidChangeConfigurationParams params) {
		configChangeHandler.handleConfigurationChange(params.getSettings());
	}

	// --- requests ---

	@Override
	public CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return requestGuard.failSoftRequest("formatting", uri, () -> formattingHandler.formatting(params),
				Collections.emptyList());
	}

	@Override
	public CompletableFuture<SemanticTokens> semanticTokensFull(SemanticTokensParams params) {
		return semanticTokensHandler.semanticTokensFull(params);
	}

	@Override
	public CompletableFuture<List<Either<SymbolInformation, DocumentSymbol>>> documentSymbol(
			DocumentSymbolParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return requestGuard.failSoftRequest("documentSymbol", uri,
				() -> documentSymbolProvider.provideDocumentSymbols(params.getTextDocument()),
				Collections.emptyList());
	}

	/**
	 * Formats the ASN.1 fenced block enclosing {@code line} in a Markdown
	 * document. The client is told when the line is not inside such a block.
	 */
	public CompletableFuture<List<TextEdit>> formatCodeBlock(URI uri, int line, int tabSize) {
		return requestGuard.failSoftRequest(Protocol.REQUEST_FORMAT_CODE_BLOCK, uri,
				() -> formattingHandler.formatCodeBlock(uri, line, tabSize).thenApply(edits -> {
					if (edits.isEmpty()) {
						notifyClient(MessageType.Info, "No ASN.1 code block changes at line " + (line + 1));
					}
					return edits;
				}), Collections.emptyList());
	}

	private void notifyClient(MessageType type, String message) {
		LanguageClient client = languageClient.get();
		if (client != null) {
			client.logMessage(new MessageParams(type, message));
		}
	}
}
