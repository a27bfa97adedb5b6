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
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.FormattingOptions;
import org.eclipse.lsp4j.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.asn1ls.config.Asn1Settings;
import com.tomaszrup.asn1ls.format.FormatterConfig;
import com.tomaszrup.asn1ls.providers.FormattingProvider;
import com.tomaszrup.asn1ls.util.FencedBlockLocator;
import com.tomaszrup.asn1ls.util.FileContentsTracker;

/**
 * Handles {@code textDocument/formatting} and the
 * {@value Protocol#REQUEST_FORMAT_CODE_BLOCK} request.
 */
class FormattingHandler {
	private static final Logger logger = LoggerFactory.getLogger(FormattingHandler.class);

	private final FormattingProvider provider;
	private final FileContentsTracker fileContentsTracker;
	private final Asn1Settings settings;

	FormattingHandler(FormattingProvider provider, FileContentsTracker fileContentsTracker, Asn1Settings settings) {
		this.provider = provider;
		this.fileContentsTracker = fileContentsTracker;
		this.settings = settings;
	}

	CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params) {
		if (!settings.isFormattingEnabled()) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		URI uri = URI.create(params.getTextDocument().getUri());
		String sourceText = fileContentsTracker.getContents(uri);
		if (sourceText == null || sourceText.isEmpty()) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		boolean markdown = FencedBlockLocator.isMarkdown(uri, fileContentsTracker.getLanguageId(uri));
		FormatterConfig config = settings.toFormatterConfig(tabSize(params.getOptions()));
		logger.debug("formatting uri={} markdown={} config={}", uri, markdown, config);
		return provider.provideFormatting(normalizeLineEndings(sourceText), markdown, config)
				.thenApply(edits -> edits);
	}

	CompletableFuture<List<TextEdit>> formatCodeBlock(URI uri, int line, int tabSize) {
		if (!settings.isFormattingEnabled()) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		String sourceText = fileContentsTracker.getContents(uri);
		if (sourceText == null || sourceText.isEmpty()) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		FormatterConfig config = settings.toFormatterConfig(tabSize);
		logger.debug("formatCodeBlock uri={} line={} config={}", uri, line, config);
		return provider.provideCodeBlockFormatting(normalizeLineEndings(sourceText), line, config);
	}

	private static int tabSize(FormattingOptions options) {
		return options != null ? options.getTabSize() : FormatterConfig.DEFAULT_INDENT_WIDTH;
	}

	static String normalizeLineEndings(String text) {
		return text.replace("\r\n", "\n").replace("\r", "\n");
	}
}
