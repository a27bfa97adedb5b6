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
import java.util.Arrays;
import java.util.List;

/**
 * Non-structural re-indenter used when the structural parser gives up.
 *
 * <p>Each line is trimmed and indented by the number of braces open before
 * it; a line starting with a closing brace is dedented first. Nothing is
 * split, joined, reordered or inserted, so the line count and the order of
 * everything in the input are preserved. Lines that start inside a block
 * comment or a string literal are kept as they are.</p>
 */
public final class FallbackIndenter {

	private FallbackIndenter() {
	}

	public static String reindent(String text, int indentWidth) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		return String.join("\n", reindentLines(Arrays.asList(text.split("\n", -1)), indentWidth));
	}

	public static List<String> reindentLines(List<String> lines, int indentWidth) {
		int width = FormatterConfig.sanitizeIndentWidth(indentWidth);
		List<String> result = new ArrayList<>(lines.size());
		ScanState state = new ScanState();
		int depth = 0;
		for (String line : lines) {
			if (state.inBlockComment || state.inString) {
				result.add(line);
				depth = Math.max(0, depth + state.netBraces(line));
				continue;
			}
			String trimmed = line.trim();
			if (trimmed.isEmpty()) {
				result.add("");
				continue;
			}
			int lineDepth = Math.max(0, depth - leadingClosers(trimmed));
			result.add(Lexical.spaces(lineDepth * width) + trimmed);
			depth = Math.max(0, depth + state.netBraces(trimmed));
		}
		return result;
	}

	private static int leadingClosers(String trimmed) {
		int count = 0;
		for (int i = 0; i < trimmed.length(); i++) {
			char c = trimmed.charAt(i);
			if (c == '}') {
				count++;
			} else if (!Character.isWhitespace(c)) {
				break;
			}
		}
		return count;
	}

	/**
	 * String and block-comment state carried from one line to the next.
	 */
	private static final class ScanState {
		private boolean inBlockComment;
		private boolean inString;

		int netBraces(String line) {
			int net = 0;
			int i = 0;
			while (i < line.length()) {
				if (inBlockComment) {
					int close = line.indexOf(Lexical.BLOCK_COMMENT_END, i);
					if (close < 0) {
						return net;
					}
					inBlockComment = false;
					i = close + 2;
					continue;
				}
				if (inString) {
					int quote = nextQuote(line, i);
					if (quote < 0) {
						return net;
					}
					inString = false;
					i = quote + 1;
					continue;
				}
				char c = line.charAt(i);
				if (c == '"') {
					inString = true;
				} else if (Lexical.startsLineComment(line, i)) {
					return net;
				} else if (Lexical.startsBlockComment(line, i)) {
					inBlockComment = true;
					i += 2;
					continue;
				} else if (c == '{') {
					net++;
				} else if (c == '}') {
					net--;
				}
				i++;
			}
			return net;
		}

		private static int nextQuote(String line, int from) {
			for (int i = from; i < line.length(); i++) {
				if (Lexical.isUnescapedQuote(line, i)) {
					return i;
				}
			}
			return -1;
		}
	}
}
