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
 * Immutable per-call formatter configuration.
 *
 * <p>Non-positive values are never rejected. They are replaced by the
 * documented defaults ({@value #DEFAULT_INDENT_WIDTH} for the indent width,
 * {@value #DEFAULT_MAX_LINE_LENGTH} for the maximum line length) so that
 * formatting always proceeds. Values above {@value #MAX_INDENT_WIDTH} and
 * {@value #MAX_LINE_LENGTH_LIMIT} respectively are clamped to those limits.</p>
 */
public final class FormatterConfig {
	private static final Logger logger = LoggerFactory.getLogger(FormatterConfig.class);

	public static final int DEFAULT_INDENT_WIDTH = 2;
	public static final int DEFAULT_MAX_LINE_LENGTH = 100;
	public static final int DEFAULT_ITERATION_CEILING_FACTOR = 4;
	public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

	public static final int MAX_INDENT_WIDTH = 8;
	public static final int MAX_LINE_LENGTH_LIMIT = 1000;

	private final int indentWidth;
	private final int maxLineLength;
	private final boolean wrapLongLines;
	private final int iterationCeilingFactor;
	private final int maxNestingDepth;

	public FormatterConfig(int indentWidth, int maxLineLength, boolean wrapLongLines) {
		this(indentWidth, maxLineLength, wrapLongLines, DEFAULT_ITERATION_CEILING_FACTOR, DEFAULT_MAX_NESTING_DEPTH);
	}

	public FormatterConfig(int indentWidth, int maxLineLength, boolean wrapLongLines,
			int iterationCeilingFactor, int maxNestingDepth) {
		this.indentWidth = sanitizeIndentWidth(indentWidth);
		this.maxLineLength = clamp("maxLineLength",
				positiveOrDefault("maxLineLength", maxLineLength, DEFAULT_MAX_LINE_LENGTH), MAX_LINE_LENGTH_LIMIT);
		this.wrapLongLines = wrapLongLines;
		this.iterationCeilingFactor = positiveOrDefault("iterationCeilingFactor", iterationCeilingFactor,
				DEFAULT_ITERATION_CEILING_FACTOR);
		this.maxNestingDepth = positiveOrDefault("maxNestingDepth", maxNestingDepth, DEFAULT_MAX_NESTING_DEPTH);
	}

	public static FormatterConfig defaults() {
		return new FormatterConfig(DEFAULT_INDENT_WIDTH, DEFAULT_MAX_LINE_LENGTH, false);
	}

	public static FormatterConfig withIndent(int indentWidth) {
		return new FormatterConfig(indentWidth, DEFAULT_MAX_LINE_LENGTH, false);
	}

	/**
	 * Maps an indent width from any source, such as an editor's tab size, to
	 * the range {@code 1..}{@value #MAX_INDENT_WIDTH}.
	 */
	public static int sanitizeIndentWidth(int indentWidth) {
		return clamp("indentWidth", positiveOrDefault("indentWidth", indentWidth, DEFAULT_INDENT_WIDTH),
				MAX_INDENT_WIDTH);
	}

	private static int clamp(String name, int value, int max) {
		if (value <= max) {
			return value;
		}
		logger.debug("Formatter setting {}={} is too large, using {}", name, value, max);
		return max;
	}

	private static int positiveOrDefault(String name, int value, int defaultValue) {
		if (value > 0) {
			return value;
		}
		logger.debug("Invalid formatter setting {}={}, using default {}", name, value, defaultValue);
		return defaultValue;
	}

	public int getIndentWidth() {
		return indentWidth;
	}

	public int getMaxLineLength() {
		return maxLineLength;
	}

	public boolean isWrapLongLines() {
		return wrapLongLines;
	}

	public int getIterationCeilingFactor() {
		return iterationCeilingFactor;
	}

	public int getMaxNestingDepth() {
		return maxNestingDepth;
	}

	@Override
	public String toString() {
		return "FormatterConfig{indentWidth=" + indentWidth
				+ ", maxLineLength=" + maxLineLength
				+ ", wrapLongLines=" + wrapLongLines + "}";
	}
}
