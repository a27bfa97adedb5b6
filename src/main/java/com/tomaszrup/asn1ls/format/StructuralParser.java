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

import java.util.Arrays;
import java.util.List;

/**
 * Builds a {@link DefinitionNode} tree from normalized source text.
 *
 * <p>Top-level lines are consumed one at a time through a
 * {@link LineClassifier}. A type definition with a brace-delimited body
 * consumes every line up to the brace that balances its opener.</p>
 *
 * <p>Every step of the main loop consumes at least one line and every body
 * scan moves strictly forward, so the parse always terminates. The bound of
 * {@code iterationCeilingFactor * lines + 16} steps is a backstop on top of
 * that: it only trips if a change to one of the steps stops consuming
 * input.</p>
 *
 * <p>Instances are not thread-safe; use one per call.</p>
 */
public class StructuralParser {

	private static final int CEILING_SLACK = 16;

	private final FormatterConfig config;
	private String text;
	private String[] lines;
	private int[] lineStarts;
	private LineClassifier classifier;
	private DefinitionNode root;

	public StructuralParser(FormatterConfig config) {
		this.config = config == null ? FormatterConfig.defaults() : config;
	}

	/**
	 * Parses {@code source}, which must already use {@code \n} line endings.
	 *
	 * @throws StructuralFault if a brace never balances, a type definition
	 *                         has no name, nesting is too deep or the
	 *                         iteration ceiling is exceeded
	 */
	public DefinitionNode parse(String source) {
		text = source == null ? "" : source;
		lines = text.split("\n", -1);
		lineStarts = new int[lines.length];
		int offset = 0;
		for (int i = 0; i < lines.length; i++) {
			lineStarts[i] = offset;
			offset += lines[i].length() + 1;
		}
		classifier = new LineClassifier();
		root = DefinitionNode.root();

		long ceiling = (long) config.getIterationCeilingFactor() * lines.length + CEILING_SLACK;
		long steps = 0;
		int index = 0;
		while (index < lines.length) {
			if (++steps > ceiling) {
				throw new StructuralFault("Iteration ceiling of " + ceiling + " exceeded", index);
			}
			int next = parseSiblings(index);
			if (next <= index) {
				throw new StructuralFault("No progress at line " + index, index);
			}
			index = next;
		}
		root.setEndLine(Math.max(0, lines.length - 1));
		return root;
	}

	/**
	 * Consumes the construct starting at line {@code index}, appends it to
	 * the root and returns the index of the first line not consumed.
	 */
	private int parseSiblings(int index) {
		String line = lines[index];
		boolean continuation = classifier.isInBlockComment();
		LineKind kind = classifier.classify(line);
		switch (kind) {
			case BLANK:
				root.addChild(DefinitionNode.blank(index));
				return index + 1;
			case COMMENT:
				if (continuation) {
					root.addChild(DefinitionNode.comment(line, 0, index, index, true));
				} else {
					root.addChild(DefinitionNode.comment(line.stripLeading(), 0, index, index, false));
				}
				return index + 1;
			case MODULE:
				root.addChild(DefinitionNode.leaf(NodeKind.MODULE, DefinitionNode.firstToken(line),
						FieldNormalizer.normalizeLine(line), index));
				return index + 1;
			case BEGIN:
				root.addChild(DefinitionNode.leaf(NodeKind.BEGIN, "BEGIN", FieldNormalizer.normalizeLine(line),
						index));
				return index + 1;
			case END:
				root.addChild(DefinitionNode.leaf(NodeKind.END, "END", FieldNormalizer.normalizeLine(line), index));
				return index + 1;
			case TYPE_DEFINITION:
				return parseTypeDefinition(index);
			default:
				root.addChild(DefinitionNode.leaf(NodeKind.OTHER, "", line.trim(), index));
				return index + 1;
		}
	}

	private int parseTypeDefinition(int index) {
		String line = lines[index];
		int lineStart = lineStarts[index];
		int commentAt = Lexical.indexOfComment(line);
		String code = commentAt < 0 ? line : line.substring(0, commentAt);
		String lineComment = commentAt < 0 ? null : line.substring(commentAt);
		int assign = code.indexOf("::=");
		String lhs = code.substring(0, assign).trim();
		if (lhs.isEmpty()) {
			throw new StructuralFault("Type definition without a name", index);
		}
		String name = DefinitionNode.firstToken(lhs);
		String rhs = code.substring(assign + 3);

		int open = BracketMatcher.findOpen(text, lineStart + assign + 3, lineStart + code.length());
		boolean openOnHeaderLine = open != BracketMatcher.NOT_FOUND;
		if (!openOnHeaderLine && !classifier.isInBlockComment()
				&& StructureKind.fromHeader(FieldNormalizer.collapse(rhs)) != null) {
			open = findOpenOnNextLine(index);
		}
		if (open == BracketMatcher.NOT_FOUND) {
			DefinitionNode node = DefinitionNode.primitive(name, joinAssignment(lhs, rhs), 0, index);
			node.setTrailingComment(lineComment);
			root.addChild(node);
			return index + 1;
		}

		int close = BracketMatcher.findMatchingClose(text, open);
		if (close == BracketMatcher.NOT_FOUND) {
			throw new StructuralFault("Unmatched opening brace in definition of " + name, lineOf(open));
		}
		int openLine = lineOf(open);
		int closeLine = lineOf(close);
		String headerText = openOnHeaderLine ? text.substring(lineStart + assign + 3, open) : rhs;
		StructureKind structureKind = StructureKind.fromHeader(FieldNormalizer.collapse(headerText));

		if (structureKind == null) {
			return parseBracedPrimitive(index, name, lhs, rhs, lineComment, closeLine);
		}

		String tail = lines[closeLine].substring(close + 1 - lineStarts[closeLine]);
		int tailCommentAt = Lexical.indexOfComment(tail);
		String trailer = FieldNormalizer.collapse(tailCommentAt < 0 ? tail : tail.substring(0, tailCommentAt));
		String trailerComment = tailCommentAt < 0 ? null : tail.substring(tailCommentAt);

		String header = joinAssignment(lhs, headerText);
		String body = text.substring(open + 1, close);
		DefinitionNode node;
		if (closeLine == openLine && Lexical.indexOfComment(body) < 0) {
			node = DefinitionNode.singleLine(name, header, structureKind, TopLevelSplitter.splitTopLevel(body), 0,
					index);
			if (!openOnHeaderLine) {
				node.setHeaderComment(lineComment);
			}
		} else {
			node = DefinitionNode.multiLine(name, header, structureKind, 0, index);
			BodyScanner scanner = new BodyScanner(text, open + 1, close, 1, openLine, config);
			for (DefinitionNode child : scanner.scan()) {
				node.addChild(child);
			}
			String headerComment = scanner.getLeadingComment();
			if (!openOnHeaderLine && lineComment != null) {
				headerComment = headerComment == null ? lineComment : lineComment + " " + headerComment;
			}
			node.setHeaderComment(headerComment);
		}
		node.setTrailer(trailer);
		node.setTrailingComment(trailerComment);
		node.setEndLine(closeLine);
		root.addChild(node);
		classifier.setInBlockComment(trailerComment != null && LineClassifier.opensBlockComment(trailerComment));
		return closeLine + 1;
	}

	/**
	 * Definition whose right-hand side carries braces that are not a
	 * structured body: {@code OBJECT IDENTIFIER ::= { iso 2 }},
	 * {@code INTEGER { low(0), high(1) }}, information object classes.
	 */
	private int parseBracedPrimitive(int index, String name, String lhs, String rhs, String lineComment,
			int closeLine) {
		if (closeLine == index) {
			DefinitionNode node = DefinitionNode.primitive(name, joinAssignment(lhs, rhs), 0, index);
			node.setTrailingComment(lineComment);
			root.addChild(node);
			return index + 1;
		}
		List<String> block = Arrays.asList(Arrays.copyOfRange(lines, index, closeLine + 1));
		root.addChild(DefinitionNode.primitiveBlock(name, block, 0, index, closeLine));
		String last = lines[closeLine];
		int lastCommentAt = Lexical.indexOfComment(last);
		classifier.setInBlockComment(lastCommentAt >= 0
				&& LineClassifier.opensBlockComment(last.substring(lastCommentAt)));
		return closeLine + 1;
	}

	/**
	 * Returns the offset of a {@code {} that opens the next non-blank line
	 * after {@code index}, or {@link BracketMatcher#NOT_FOUND}.
	 */
	private int findOpenOnNextLine(int index) {
		for (int i = index + 1; i < lines.length; i++) {
			String candidate = lines[i];
			if (candidate.isBlank()) {
				continue;
			}
			String trimmed = candidate.stripLeading();
			if (trimmed.startsWith("{")) {
				return lineStarts[i] + (candidate.length() - trimmed.length());
			}
			return BracketMatcher.NOT_FOUND;
		}
		return BracketMatcher.NOT_FOUND;
	}

	private static String joinAssignment(String lhs, String rhs) {
		return FieldNormalizer.normalizeOperator(FieldNormalizer.collapse(lhs) + " ::= " + FieldNormalizer.collapse(rhs));
	}

	private int lineOf(int offset) {
		int index = Arrays.binarySearch(lineStarts, offset);
		return index >= 0 ? index : -index - 2;
	}
}
