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
package com.tomaszrup.asn1ls.util;

import java.io.IOException;
import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Positions;

/**
 * Thread-safe store of open document contents and their language ids.
 *
 * <p>Documents that are not open are read from disk. The last text of a
 * closed document is kept for {@value #CLOSED_FILE_CACHE_TTL_MS} ms so that
 * requests arriving right after {@code didClose} do not hit the disk.</p>
 */
public class FileContentsTracker {
	private static final Logger logger = LoggerFactory.getLogger(FileContentsTracker.class);

	static final long CLOSED_FILE_CACHE_TTL_MS = 5_000;

	private final ConcurrentHashMap<URI, String> openFiles = new ConcurrentHashMap<>();
	private final ConcurrentHashMap<URI, String> languageIds = new ConcurrentHashMap<>();
	private final ConcurrentHashMap<URI, CachedContent> closedFileCache = new ConcurrentHashMap<>();

	private static final class CachedContent {
		final String content;
		final long readTimeMillis;

		CachedContent(String content) {
			this.content = content;
			this.readTimeMillis = System.currentTimeMillis();
		}

		boolean isExpired() {
			return System.currentTimeMillis() - readTimeMillis > CLOSED_FILE_CACHE_TTL_MS;
		}
	}

	public Set<URI> getOpenURIs() {
		return Collections.unmodifiableSet(openFiles.keySet());
	}

	public boolean isOpen(URI uri) {
		return openFiles.containsKey(uri);
	}

	/**
	 * Language id the client sent with {@code didOpen}, or {@code null} for a
	 * document that is not open.
	 */
	public String getLanguageId(URI uri) {
		return languageIds.get(uri);
	}

	public void didOpen(DidOpenTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openFiles.put(uri, params.getTextDocument().getText());
		String languageId = params.getTextDocument().getLanguageId();
		if (languageId != null) {
			languageIds.put(uri, languageId);
		}
		closedFileCache.remove(uri);
	}

	/**
	 * Applies full and incremental changes in order. An incremental change
	 * whose range does not fit the current text replaces the whole text.
	 */
	public void didChange(DidChangeTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openFiles.compute(uri, (key, currentText) -> {
			String text = currentText;
			for (TextDocumentContentChangeEvent change : params.getContentChanges()) {
				text = applyChange(uri, text, change);
			}
			return text;
		});
	}

	private static String applyChange(URI uri, String text, TextDocumentContentChangeEvent change) {
		Range range = change.getRange();
		if (text == null || range == null) {
			return change.getText();
		}
		int offsetStart = Positions.getOffset(text, range.getStart());
		int offsetEnd = Positions.getOffset(text, range.getEnd());
		if (offsetStart < 0 || offsetEnd < 0 || offsetStart > offsetEnd) {
			logger.debug("Change range {} does not fit document {}, replacing the whole text", range, uri);
			return change.getText();
		}
		return text.substring(0, offsetStart) + change.getText() + text.substring(offsetEnd);
	}

	public void didClose(DidCloseTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		String lastContent = openFiles.remove(uri);
		languageIds.remove(uri);
		if (lastContent != null) {
			closedFileCache.put(uri, new CachedContent(lastContent));
		}
	}

	/**
	 * Returns the in-memory text of an open document, otherwise the cached or
	 * freshly read disk contents, or {@code null} if the file cannot be read.
	 */
	public String getContents(URI uri) {
		String contents = openFiles.get(uri);
		if (contents != null) {
			return contents;
		}
		CachedContent cached = closedFileCache.get(uri);
		if (cached != null && !cached.isExpired()) {
			return cached.content;
		}
		try {
			String diskContent = Files.readString(Paths.get(uri));
			closedFileCache.put(uri, new CachedContent(diskContent));
			return diskContent;
		} catch (IOException | IllegalArgumentException | FileSystemNotFoundException e) {
			logger.debug("Could not read {}: {}", uri, e.toString());
			closedFileCache.remove(uri);
			return null;
		}
	}

	public void setContents(URI uri, String contents) {
		openFiles.put(uri, contents);
	}

	/**
	 * Drops cached disk contents, called when the client reports external
	 * file changes.
	 */
	public void invalidateClosedFileCache(Collection<URI> uris) {
		for (URI uri : uris) {
			closedFileCache.remove(uri);
		}
	}
}
