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
 * Low-level helpers for recognizing ASN.1 string literals and comments,
 * shared by the formatter and the highlighter.
 *
 * <p>Comments are either {@code --} to the end of the line, or a block
 * delimited by {@code -*} and {@code *-}. String literals are delimited by
 * unescaped double quotes and may span lines.</p>
 */
public final class Lexical {

	static final String LINE_COMMENT = "--";
	static final String BLOCK_COMMENT_START = "-*";
	static final String BLOCK_COMMENT_END = "*-";

	private Lexical() {
	}

	public static boolean startsLineComment(String text, int index) {
		return index + 1 < text.length() && text.charAt(index) == '-' && text.charAt(index + 1) == '-';
	}

	public static boolean startsBlockComment(String text, int index) {
		return index + 1 < text.length() && text.charAt(index) == '-' && text.charAt(index + 1) == '*';
	}

	public static boolean startsComment(String text, int index) {
		return startsLineComment(text, index) || startsBlockComment(text, index);
	}

	/**
	 * Returns the index just past the comment starting at {@code index}.
	 * A line comment stops before its terminating newline; an unterminated
	 * block comment runs to the end of the text.
	 */
	static int skipComment(String text, int index) {
		if (startsLineComment(text, index)) {
			int end = text.indexOf('\n', index);
			return end < 0 ? text.length() : end;
		}
		int end = findBlockCommentEnd(text, index + 2);
		return end < 0 ? text.length() : end;
	}

	/**
	 * Returns the index just past the first {@code *-} at or after
	 * {@code from}, or -1 when the block comment does not end in the text.
	 */
	public static int findBlockCommentEnd(String text, int from) {
		int end = text.indexOf(BLOCK_COMMENT_END, from);
		return end < 0 ? -1 : end + BLOCK_COMMENT_END.length();
	}

	static boolean isUnescapedQuote(String text, int index) {
		return text.charAt(index) == '"' && (index == 0 || text.charAt(index - 1) != '\\');
	}

	/**
	 * Returns the index just past the string literal whose opening quote is
	 * at {@code index}, or the text length when the literal is unterminated.
	 */
	static int skipString(String text, int index) {
		int end = findStringEnd(text, index + 1);
		return end < 0 ? text.length() : end;
	}

	/**
	 * Returns the index just past the first unescaped quote at or after
	 * {@code from}, or -1 when the literal does not end in the text.
	 */
	public static int findStringEnd(String text, int from) {
		for (int i = Math.max(0, from); i < text.length(); i++) {
			if (isUnescapedQuote(text, i)) {
				return i + 1;
			}
		}
		return -1;
	}

	/**
	 * Returns the index of the first comment start outside a string literal,
	 * or -1 if the text contains no comment.
	 */
	static int indexOfComment(String text) {
		int i = 0;
		while (i < text.length()) {
			if (text.charAt(i) == '"') {
				i = skipString(text, i);
			} else if (startsComment(text, i)) {
				return i;
			} else {
				i++;
			}
		}
		return -1;
	}

	static int countNewlines(String text, int from, int to) {
		int count = 0;
		for (int i = from; i < to && i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				count++;
			}
		}
		return count;
	}

	static String spaces(int count) {
		return count <= 0 ? "" : " ".repeat(count);
	}
}
