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
package com.tomaszrup.asn1ls.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.asn1ls.Protocol;
import com.tomaszrup.asn1ls.format.FormatterConfig;

/**
 * Live server settings, updated from {@code workspace/didChangeConfiguration}.
 *
 * <p>Fields are {@code volatile}: they are written on the LSP listener thread
 * and read by request handlers. A setting absent from an update keeps its
 * previous value.</p>
 */
public class Asn1Settings {
	private static final Logger logger = LoggerFactory.getLogger(Asn1Settings.class);

	private static final String KEY_FORMATTING = "formatting";
	private static final String KEY_SEMANTIC_HIGHLIGHTING = "semanticHighlighting";
	private static final String KEY_ENABLED = "enabled";
	private static final String KEY_MAX_LINE_LENGTH = "maxLineLength";
	private static final String KEY_WRAP_LONG_LINES = "wrapLongLines";

	private volatile boolean formattingEnabled = true;
	private volatile boolean semanticHighlightingEnabled = true;
	private volatile int maxLineLength = FormatterConfig.DEFAULT_MAX_LINE_LENGTH;
	private volatile boolean wrapLongLines = false;

	public boolean isFormattingEnabled() {
		return formattingEnabled;
	}

	public boolean isSemanticHighlightingEnabled() {
		return semanticHighlightingEnabled;
	}

	public int getMaxLineLength() {
		return maxLineLength;
	}

	public boolean isWrapLongLines() {
		return wrapLongLines;
	}

	/**
	 * Reads the {@code asn1} section of a settings object. Values of the
	 * wrong JSON type are ignored.
	 */
	public void update(JsonObject settings) {
		if (settings == null || !settings.has(Protocol.SETTINGS_SECTION)
				|| !settings.get(Protocol.SETTINGS_SECTION).isJsonObject()) {
			return;
		}
		JsonObject asn1 = settings.get(Protocol.SETTINGS_SECTION).getAsJsonObject();
		if (asn1.has(KEY_SEMANTIC_HIGHLIGHTING) && asn1.get(KEY_SEMANTIC_HIGHLIGHTING).isJsonObject()) {
			JsonObject sh = asn1.get(KEY_SEMANTIC_HIGHLIGHTING).getAsJsonObject();
			if (isPrimitive(sh, KEY_ENABLED)) {
				this.semanticHighlightingEnabled = sh.get(KEY_ENABLED).getAsBoolean();
			}
		}
		if (asn1.has(KEY_FORMATTING) && asn1.get(KEY_FORMATTING).isJsonObject()) {
			JsonObject fmt = asn1.get(KEY_FORMATTING).getAsJsonObject();
			if (isPrimitive(fmt, KEY_ENABLED)) {
				this.formattingEnabled = fmt.get(KEY_ENABLED).getAsBoolean();
			}
			if (isPrimitive(fmt, KEY_WRAP_LONG_LINES)) {
				this.wrapLongLines = fmt.get(KEY_WRAP_LONG_LINES).getAsBoolean();
			}
			if (isPrimitive(fmt, KEY_MAX_LINE_LENGTH)) {
				try {
					this.maxLineLength = fmt.get(KEY_MAX_LINE_LENGTH).getAsInt();
				} catch (NumberFormatException e) {
					logger.warn("Ignoring non-numeric {}.{}.{}: {}", Protocol.SETTINGS_SECTION, KEY_FORMATTING,
							KEY_MAX_LINE_LENGTH, fmt.get(KEY_MAX_LINE_LENGTH));
				}
			}
		}
		logger.debug("Settings updated: formatting={}, semanticHighlighting={}, maxLineLength={}, wrapLongLines={}",
				formattingEnabled, semanticHighlightingEnabled, maxLineLength, wrapLongLines);
	}

	/**
	 * Builds the formatter configuration for one request. {@code tabSize}
	 * comes from the request's formatting options; invalid values fall back
	 * to the formatter defaults.
	 */
	public FormatterConfig toFormatterConfig(int tabSize) {
		return new FormatterConfig(tabSize, maxLineLength, wrapLongLines);
	}

	private static boolean isPrimitive(JsonObject object, String key) {
		JsonElement element = object.get(key);
		return element != null && element.isJsonPrimitive();
	}
}
