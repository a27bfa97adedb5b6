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
 * Categorizes source lines one at a time.
 *
 * <p>The classifier is stateful: once a line opens a {@code -*} block comment
 * that it does not close, every following line is a {@link LineKind#COMMENT}
 * until one contains the closing {@code *-}. A new instance is needed per
 * document.</p>
 */
public class LineClassifier {

	private static final Pattern MODULE = Pattern
			.compile("^[A-Za-z][\\w-]*(\\s*\\{[^}]*\\})?\\s+DEFINITIONS(?![\\w-]).*$");
	private static final Pattern BEGIN = Pattern.compile("^(.*[\\s=])?BEGIN$");
	private static final Pattern END = Pattern.compile("^END(?![\\w-]).*$");
	private static final Pattern DEFINITIONS = Pattern.compile("(?<![\\w-])DEFINITIONS(?![\\w-])");

	private boolean inBlockComment;

	public LineKind classify(String line) {
		String trimmed = line == null ? "" : line.trim();
		if (inBlockComment) {
			if (trimmed.contains(Lexical.BLOCK_COMMENT_END)) {
				inBlockComment = false;
			}
			return LineKind.COMMENT;
		}
		if (trimmed.isEmpty()) {
			return LineKind.BLANK;
		}
		if (trimmed.startsWith(Lexical.LINE_COMMENT)) {
			return LineKind.COMMENT;
		}
		if (trimmed.startsWith(Lexical.BLOCK_COMMENT_START)) {
			inBlockComment = trimmed.indexOf(Lexical.BLOCK_COMMENT_END, 2) < 0;
			return LineKind.COMMENT;
		}

		int commentAt = Lexical.indexOfComment(trimmed);
		String code = commentAt < 0 ? trimmed : trimmed.substring(0, commentAt).trim();
		if (commentAt >= 0) {
			inBlockComment = opensBlockComment(trimmed.substring(commentAt));
		}

		if (MODULE.matcher(code).matches()) {
			return LineKind.MODULE;
		}
		if (BEGIN.matcher(code).matches()) {
			return LineKind.BEGIN;
		}
		if (END.matcher(code).matches()) {
			return LineKind.END;
		}
		if (code.contains("::=")) {
			return LineKind.TYPE_DEFINITION;
		}
		if (code.split("\\s+").length >= 2 && !DEFINITIONS.matcher(code).find()) {
			return LineKind.FIELD;
		}
		return LineKind.OTHER;
	}

	public boolean isInBlockComment() {
		return inBlockComment;
	}

	/**
	 * Overrides the block-comment state after a caller consumed lines without
	 * classifying them.
	 */
	public void setInBlockComment(boolean inBlockComment) {
		this.inBlockComment = inBlockComment;
	}

	/**
	 * Returns {@code true} if {@code comment} starts a block comment that is
	 * still open at its end.
	 */
	static boolean opensBlockComment(String comment) {
		return comment.startsWith(Lexical.BLOCK_COMMENT_START)
				&& comment.indexOf(Lexical.BLOCK_COMMENT_END, 2) < 0;
	}
}
