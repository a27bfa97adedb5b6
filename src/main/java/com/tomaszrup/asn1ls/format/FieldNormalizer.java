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

import java.util.regex.Pattern;

/**
 * Canonicalizes the whitespace and trailing punctuation of a single field
 * or header segment. Every method is pure and idempotent.
 */
public final class FieldNormalizer {

	private static final Pattern ASSIGNMENT = Pattern.compile("\\s*::=\\s*");

	private FieldNormalizer() {
	}

	/**
	 * Trims, strips trailing commas and collapses internal whitespace runs
	 * (including newlines) to a single space. Whitespace inside string
	 * literals is kept as is.
	 */
	public static String normalize(String field) {
		if (field == null) {
			return "";
		}
		String trimmed = field.trim();
		while (trimmed.endsWith(",")) {
			trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
		}
		return collapseWhitespace(trimmed);
	}

	/**
	 * Trims and collapses whitespace runs without touching punctuation.
	 */
	public static String collapse(String text) {
		return text == null ? "" : collapseWhitespace(text.trim());
	}

	/**
	 * Canonicalizes the code part of a whole source line and re-attaches its
	 * comment, if any, after a single space. The comment text is kept as is.
	 */
	public static String normalizeLine(String line) {
		int commentAt = Lexical.indexOfComment(line);
		if (commentAt < 0) {
			return normalizeOperator(collapse(line));
		}
		String code = normalizeOperator(collapse(line.substring(0, commentAt)));
		String comment = line.substring(commentAt);
		return code.isEmpty() ? comment : code + " " + comment;
	}

	/**
	 * Rewrites every {@code ::=} outside string literals and comments so it
	 * has exactly one space on each side.
	 */
	public static String normalizeOperator(String text) {
		if (text == null || !text.contains("::=")) {
			return text;
		}
		StringBuilder sb = new StringBuilder(text.length() + 2);
		int codeStart = 0;
		int i = 0;
		while (i < text.length()) {
			int skipTo;
			if (text.charAt(i) == '"') {
				skipTo = Lexical.skipString(text, i);
			} else if (Lexical.startsComment(text, i)) {
				skipTo = Lexical.skipComment(text, i);
			} else {
				i++;
				continue;
			}
			sb.append(ASSIGNMENT.matcher(text.substring(codeStart, i)).replaceAll(" ::= "));
			sb.append(text, i, skipTo);
			codeStart = skipTo;
			i = skipTo;
		}
		sb.append(ASSIGNMENT.matcher(text.substring(codeStart)).replaceAll(" ::= "));
		return sb.toString().trim();
	}

	private static String collapseWhitespace(String text) {
		StringBuilder sb = new StringBuilder(text.length());
		boolean pendingSpace = false;
		int i = 0;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '"') {
				if (pendingSpace) {
					sb.append(' ');
					pendingSpace = false;
				}
				int end = Lexical.skipString(text, i);
				sb.append(text, i, end);
				i = end;
				continue;
			}
			if (Character.isWhitespace(c)) {
				pendingSpace = sb.length() > 0;
			} else {
				if (pendingSpace) {
					sb.append(' ');
					pendingSpace = false;
				}
				sb.append(c);
			}
			i++;
		}
		return sb.toString();
	}
}
