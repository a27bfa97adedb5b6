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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.asn1ls.util.FileContentsTracker;

/**
 * Completes the formatting and outline requests with an empty result when
 * their handler fails, so a document the server cannot cope with shows up
 * as a warning in the log and never as an error response in the editor.
 * Errors of the virtual machine itself still propagate.
 */
class LspRequestGuard {
	private static final Logger logger = LoggerFactory.getLogger(LspRequestGuard.class);

	private final FileContentsTracker fileContentsTracker;

	LspRequestGuard(FileContentsTracker fileContentsTracker) {
		this.fileContentsTracker = fileContentsTracker;
	}

	<T> CompletableFuture<T> failSoftRequest(String requestName, URI uri,
			Supplier<CompletableFuture<T>> requestCall, T fallbackValue) {
		CompletableFuture<T> future;
		try {
			future = requestCall.get();
		} catch (RuntimeException e) {
			logFailure(requestName, uri, e);
			return CompletableFuture.completedFuture(fallbackValue);
		}
		if (future == null) {
			return CompletableFuture.completedFuture(fallbackValue);
		}
		return future.exceptionally(throwable -> {
			Throwable cause = unwrap(throwable);
			if (cause instanceof VirtualMachineError) {
				throw (VirtualMachineError) cause;
			}
			logFailure(requestName, uri, cause);
			return fallbackValue;
		});
	}

	private void logFailure(String requestName, URI uri, Throwable failure) {
		logger.warn("{} failed for {} ({}): {}", requestName, uri, describeDocument(uri), failure.toString());
		logger.debug("{} failure details", requestName, failure);
	}

	/**
	 * Short description of the document a request was about: its language
	 * id and length when it is open in the editor.
	 */
	String describeDocument(URI uri) {
		if (uri == null) {
			return "no document";
		}
		if (!fileContentsTracker.isOpen(uri)) {
			return "not open";
		}
		String languageId = fileContentsTracker.getLanguageId(uri);
		String contents = fileContentsTracker.getContents(uri);
		return (languageId == null ? "unknown language" : languageId) + ", "
				+ (contents == null ? 0 : contents.length()) + " chars";
	}

	static Throwable unwrap(Throwable throwable) {
		Throwable current = throwable;
		while (current instanceof CompletionException && current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}
}
