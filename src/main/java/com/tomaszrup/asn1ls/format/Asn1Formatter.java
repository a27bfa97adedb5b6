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
package com.tomaszrup.asn1ls.format;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the formatter.
 *
 * <p>{@link #format(String, FormatterConfig)} is total: it returns a string
 * for every input and never throws. When the structural pass cannot handle
 * the input, the result is a brace-depth re-indentation of it produced by
 * {@link FallbackIndenter}. The class holds no state, so concurrent calls are
 * safe.</p>
 */
public final class Asn1Formatter {
	private static final Logger logger = LoggerFactory.getLogger(Asn1Formatter.class);

	private Asn1Formatter() {
	}

	public static String format(String source) {
		return format(source, FormatterConfig.defaults());
	}

	public static String format(String source, FormatterConfig config) {
		FormatterConfig effective = config == null ? FormatterConfig.defaults() : config;
		if (source == null) {
			return "";
		}
		String text = normalizeInput(source, effective.getIndentWidth());
		if (text.isBlank()) {
			return "";
		}
		try {
			DefinitionNode root = new StructuralParser(effective).parse(text);
			return new DefinitionPrinter(effective).render(root);
		} catch (StructuralFault e) {
			logger.debug("Structural formatting failed at line {}: {}; re-indenting instead", e.getLine(),
					e.getMessage());
		} catch (RuntimeException e) {
			logger.warn("Unexpected formatter failure: {}", e.toString());
			logger.debug("Formatter failure details", e);
		}
		return fallback(text, effective);
	}

	/**
	 * Converts {@code \r\n} and {@code \r} line endings to {@code \n} and
	 * expands tabs to {@code indentWidth} spaces.
	 */
	static String normalizeInput(String source, int indentWidth) {
		return source.replace("\r\n", "\n").replace("\r", "\n").replace("\t", Lexical.spaces(indentWidth));
	}

	private static String fallback(String text, FormatterConfig config) {
		try {
			return FallbackIndenter.reindent(text, config.getIndentWidth());
		} catch (RuntimeException e) {
			logger.warn("Fallback re-indentation failed: {}", e.toString());
			logger.debug("Fallback failure details", e);
			return text;
		}
	}
}
