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
import java.util.List;

/**
 * Turns the text between a structured body's braces into member nodes.
 *
 * <p>Members are separated by commas at parenthesis depth zero, as found by
 * {@link TopLevelSplitter#walk}. A brace that follows a SEQUENCE, SET, CHOICE
 * or ENUMERATED keyword opens a nested structured component, which is
 * scanned recursively; any other brace group ({@code INTEGER { a(1) }},
 * {@code DEFAULT { 1 2 }}) stays part of the member's text. Comments are
 * attached to the member on the same line, or kept as standalone comment
 * members when they sit on their own line.</p>
 */
final class BodyScanner implements TopLevelSplitter.SpanListener {

	private final String text;
	private final int start;
	private final int end;
	private final int level;
	private final FormatterConfig config;

	private final List<DefinitionNode> members = new ArrayList<>();
	private final List<DefinitionNode> deferred = new ArrayList<>();
	private final StringBuilder current = new StringBuilder();
	private boolean currentHasCode;
	private boolean lineHasCode;
	private boolean newlineSinceEmit;
	private int line;
	private int memberStartLine;
	private DefinitionNode lastMember;
	private DefinitionNode pendingNested;
	private String pendingTrailing;
	private String leadingComment;

	/**
	 * @param start     index just past the opening brace
	 * @param end       index of the closing brace (exclusive bound)
	 * @param level     nesting level of the members
	 * @param startLine zero-based source line of {@code start}
	 */
	BodyScanner(String text, int start, int end, int level, int startLine, FormatterConfig config) {
		this.text = text;
		this.start = start;
		this.end = end;
		this.level = level;
		this.line = startLine;
		this.memberStartLine = startLine;
		this.config = config;
	}

	List<DefinitionNode> scan() {
		if (level > config.getMaxNestingDepth()) {
			throw new StructuralFault("Nesting deeper than " + config.getMaxNestingDepth() + " levels", line);
		}
		TopLevelSplitter.walk(text, start, end, this);
		emitMember();
		return members;
	}

	@Override
	public void onCode(char c) {
		if (c == '\n') {
			line++;
			newlineSinceEmit = true;
			lineHasCode = false;
			current.append(c);
		} else if (Character.isWhitespace(c)) {
			current.append(c);
		} else {
			appendCode(String.valueOf(c));
		}
	}

	@Override
	public void onString(String literal) {
		appendCode(literal);
		line += Lexical.countNewlines(literal, 0, literal.length());
	}

	@Override
	public void onSeparator() {
		emitMember();
	}

	/**
	 * Comment found on the opening brace's line before any member, or
	 * {@code null}.
	 */
	String getLeadingComment() {
		return leadingComment;
	}

	int getLine() {
		return line;
	}

	private void appendCode(String code) {
		if (!currentHasCode) {
			currentHasCode = true;
			memberStartLine = line;
		}
		current.append(code);
		lineHasCode = true;
	}

	@Override
	public void onComment(String comment) {
		int commentLine = line;
		int newlines = Lexical.countNewlines(comment, 0, comment.length());
		line += newlines;
		boolean pending = currentHasCode || pendingNested != null;
		if (pending) {
			if (lineHasCode) {
				pendingTrailing = join(pendingTrailing, comment);
			} else {
				deferred.add(DefinitionNode.comment(comment, level, commentLine, line, false));
			}
		} else if (lastMember != null && !newlineSinceEmit) {
			lastMember.setTrailingComment(join(lastMember.getTrailingComment(), comment));
		} else if (lastMember == null && !newlineSinceEmit) {
			leadingComment = join(leadingComment, comment);
		} else {
			members.add(DefinitionNode.comment(comment, level, commentLine, line, false));
		}
		if (newlines > 0) {
			newlineSinceEmit = true;
			lineHasCode = false;
		}
	}

	@Override
	public int onOpenBrace(int openIndex, int depth) {
		int close = BracketMatcher.findMatchingClose(text, openIndex);
		if (close == BracketMatcher.NOT_FOUND || close >= end) {
			throw new StructuralFault("Unmatched opening brace", line);
		}
		String header = FieldNormalizer.collapse(current.toString());
		StructureKind kind = depth == 0 && pendingNested == null ? StructureKind.fromHeader(header) : null;
		if (kind == null) {
			String group = text.substring(openIndex, close + 1);
			if (Lexical.indexOfComment(group) >= 0) {
				throw new StructuralFault("Comment inside an inline brace group", line);
			}
			appendCode(group);
			line += Lexical.countNewlines(group, 0, group.length());
			return close + 1;
		}

		int headerLine = currentHasCode ? memberStartLine : line;
		DefinitionNode nested = DefinitionNode.multiLine(DefinitionNode.firstToken(header), header, kind, level,
				headerLine);
		BodyScanner inner = new BodyScanner(text, openIndex + 1, close, level + 1, line, config);
		for (DefinitionNode child : inner.scan()) {
			nested.addChild(child);
		}
		nested.setHeaderComment(join(pendingTrailing, inner.getLeadingComment()));
		if (inner.getLine() > line) {
			newlineSinceEmit = true;
		}
		line = inner.getLine();
		nested.setEndLine(line);

		pendingTrailing = null;
		current.setLength(0);
		currentHasCode = false;
		pendingNested = nested;
		lineHasCode = true;
		return close + 1;
	}

	private void emitMember() {
		String code = FieldNormalizer.normalize(current.toString());
		DefinitionNode node = null;
		if (pendingNested != null) {
			node = pendingNested;
			node.setTrailer(code);
		} else if (!TopLevelSplitter.isDroppable(code)) {
			node = DefinitionNode.field(code, level, memberStartLine, line);
		}
		if (node != null) {
			if (pendingTrailing != null) {
				node.setTrailingComment(join(node.getTrailingComment(), pendingTrailing));
			}
			members.add(node);
			lastMember = node;
			newlineSinceEmit = false;
		} else if (pendingTrailing != null) {
			members.add(DefinitionNode.comment(pendingTrailing, level, line, line, false));
		}
		members.addAll(deferred);
		deferred.clear();
		current.setLength(0);
		currentHasCode = false;
		pendingNested = null;
		pendingTrailing = null;
	}

	private static String join(String first, String second) {
		if (first == null) {
			return second;
		}
		if (second == null) {
			return first;
		}
		return first + " " + second;
	}
}
