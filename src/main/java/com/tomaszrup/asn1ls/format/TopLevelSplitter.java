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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a span of text on commas that sit at nesting depth zero (braces,
 * parentheses and square brackets) and outside string literals and
 * comments. Each segment is passed through {@link FieldNormalizer}; empty
 * segments and segments consisting only of a lone brace are dropped.
 *
 * <p>The underlying {@link #walk} is shared with {@link BodyScanner}, which
 * needs the same lexing but builds nodes instead of strings.</p>
 */
public final class TopLevelSplitter {

	/**
	 * Receives what {@link #walk} finds, in source order.
	 */
	interface SpanListener {

		/**
		 * Any character outside strings and comments that is not a
		 * depth-zero comma, brackets included.
		 */
		void onCode(char c);

		void onString(String literal);

		void onComment(String comment);

		/**
		 * A comma at depth zero.
		 */
		void onSeparator();

		/**
		 * Called for every opening brace. Returns the index just past what
		 * the listener consumed itself, or {@code index} to have the brace
		 * counted as ordinary nesting.
		 */
		default int onOpenBrace(int index, int depth) {
			return index;
		}
	}

	private TopLevelSplitter() {
	}

	public static List<String> splitTopLevel(String text) {
		if (text == null || text.isBlank()) {
			return Collections.emptyList();
		}
		List<String> segments = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		walk(text, 0, text.length(), new SpanListener() {
			@Override
			public void onCode(char c) {
				current.append(c);
			}

			@Override
			public void onString(String literal) {
				current.append(literal);
			}

			@Override
			public void onComment(String comment) {
				current.append(comment);
			}

			@Override
			public void onSeparator() {
				addSegment(segments, current);
				current.setLength(0);
			}
		});
		addSegment(segments, current);
		return segments;
	}

	/**
	 * Lexes {@code text} from {@code start} up to {@code end} (exclusive),
	 * tracking string literals, comments and bracket depth, and reports
	 * everything to {@code listener}. Strings and comments are cut off at
	 * {@code end}.
	 */
	static void walk(String text, int start, int end, SpanListener listener) {
		int depth = 0;
		int i = start;
		while (i < end) {
			char c = text.charAt(i);
			if (c == '"') {
				int close = Math.min(Lexical.skipString(text, i), end);
				listener.onString(text.substring(i, close));
				i = close;
				continue;
			}
			if (Lexical.startsComment(text, i)) {
				int close = Math.min(Lexical.skipComment(text, i), end);
				listener.onComment(text.substring(i, close));
				i = close;
				continue;
			}
			switch (c) {
				case '{':
					int resume = listener.onOpenBrace(i, depth);
					if (resume > i) {
						i = resume;
						continue;
					}
					depth++;
					listener.onCode(c);
					break;
				case '(':
				case '[':
					depth++;
					listener.onCode(c);
					break;
				case '}':
				case ')':
				case ']':
					depth = Math.max(0, depth - 1);
					listener.onCode(c);
					break;
				case ',':
					if (depth == 0) {
						listener.onSeparator();
					} else {
						listener.onCode(c);
					}
					break;
				default:
					listener.onCode(c);
			}
			i++;
		}
	}

	/**
	 * Returns {@code true} if the text contains a comma at depth zero.
	 */
	public static boolean hasTopLevelComma(String text) {
		return splitTopLevel(text).size() > 1;
	}

	private static void addSegment(List<String> segments, CharSequence raw) {
		String segment = FieldNormalizer.normalize(raw.toString());
		if (isDroppable(segment)) {
			return;
		}
		segments.add(segment);
	}

	static boolean isDroppable(String segment) {
		return segment.isEmpty() || "{".equals(segment) || "}".equals(segment);
	}
}
