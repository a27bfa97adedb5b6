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

/**
 * Locates the closing brace that balances a given opening brace.
 *
 * <p>The scan is iterative with a single depth counter, so arbitrarily deep
 * or malformed nesting never grows the stack. Braces inside string literals
 * and comments do not count.</p>
 */
public final class BracketMatcher {

	public static final int NOT_FOUND = -1;

	private BracketMatcher() {
	}

	/**
	 * Returns the index of the {@code '}'} balancing the {@code '{'} at
	 * {@code openIndex}, or {@link #NOT_FOUND} if the text ends first or
	 * {@code openIndex} does not point at an opening brace.
	 */
	public static int findMatchingClose(String text, int openIndex) {
		if (text == null || openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != '{') {
			return NOT_FOUND;
		}
		int depth = 1;
		boolean inString = false;
		int i = openIndex + 1;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (inString) {
				if (Lexical.isUnescapedQuote(text, i)) {
					inString = false;
				}
				i++;
				continue;
			}
			if (c == '"') {
				inString = true;
				i++;
				continue;
			}
			if (Lexical.startsComment(text, i)) {
				i = Lexical.skipComment(text, i);
				continue;
			}
			if (c == '{') {
				depth++;
			} else if (c == '}') {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
			i++;
		}
		return NOT_FOUND;
	}

	/**
	 * Returns the index of the first {@code '{'} at or after {@code from} and
	 * before {@code to} that is outside strings and comments, or
	 * {@link #NOT_FOUND}.
	 */
	public static int findOpen(String text, int from, int to) {
		int limit = Math.min(to, text.length());
		int i = Math.max(0, from);
		while (i < limit) {
			char c = text.charAt(i);
			if (c == '"') {
				i = Lexical.skipString(text, i);
			} else if (Lexical.startsComment(text, i)) {
				i = Lexical.skipComment(text, i);
			} else if (c == '{') {
				return i;
			} else {
				i++;
			}
		}
		return NOT_FOUND;
	}
}
