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
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.lsp4j.SemanticTokens;
import org.eclipse.lsp4j.SemanticTokensParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.asn1ls.config.Asn1Settings;
import com.tomaszrup.asn1ls.providers.SemanticTokensProvider;

/**
 * Handles {@code textDocument/semanticTokens/full}, keeping the last
 * non-empty result per URI to serve when a later tokenization fails.
 */
class SemanticTokensHandler {
	private static final Logger logger = LoggerFactory.getLogger(SemanticTokensHandler.class);

	private final Map<URI, SemanticTokens> lastSemanticTokensByUri = new ConcurrentHashMap<>();
	private final SemanticTokensProvider provider;
	private final Asn1Settings settings;

	SemanticTokensHandler(SemanticTokensProvider provider, Asn1Settings settings) {
		this.provider = provider;
		this.settings = settings;
	}

	void clearCache(URI uri) {
		lastSemanticTokensByUri.remove(uri);
	}

	CompletableFuture<SemanticTokens> semanticTokensFull(SemanticTokensParams params) {
		if (!settings.isSemanticHighlightingEnabled()) {
			return CompletableFuture.completedFuture(emptySemanticTokens());
		}
		URI uri = URI.create(params.getTextDocument().getUri());
		CompletableFuture<SemanticTokens> future;
		try {
			future = provider.provideSemanticTokensFull(params.getTextDocument());
		} catch (RuntimeException e) {
			return CompletableFuture.completedFuture(handleResult(uri, null, e));
		}
		return future.handle((tokens, throwable) -> handleResult(uri, tokens, throwable));
	}

	private SemanticTokens handleResult(URI uri, SemanticTokens tokens, Throwable throwable) {
		if (throwable != null) {
			logger.warn("semanticTokensFull failed uri={} error={}", uri, throwable.toString());
			logger.debug("semanticTokensFull failure details", throwable);
			SemanticTokens fallback = lastSemanticTokensByUri.get(uri);
			return fallback != null ? fallback : emptySemanticTokens();
		}
		if (tokens != null && tokens.getData() != null && !tokens.getData().isEmpty()) {
			lastSemanticTokensByUri.put(uri, tokens);
			return tokens;
		}
		return tokens != null ? tokens : emptySemanticTokens();
	}

	private SemanticTokens emptySemanticTokens() {
		return new SemanticTokens(Collections.emptyList());
	}
}
