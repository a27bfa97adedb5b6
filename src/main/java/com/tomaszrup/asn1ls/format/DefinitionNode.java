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
 * One node of the definition tree built by {@link StructuralParser}.
 *
 * <p>Only {@link NodeKind#TYPE_DEFINITION} nodes carry a structure kind, a
 * single-line flag and inline fields. Children are populated for the root and
 * for multi-line type definitions; a single-line type definition keeps its
 * fields in {@link #getInlineFields()} instead. A source blank line is an
 * {@link NodeKind#OTHER} node with empty content.</p>
 */
public final class DefinitionNode {

	private final NodeKind kind;
	private final String name;
	private final String rawContent;
	private final int nestingLevel;
	private final List<DefinitionNode> children = new ArrayList<>();
	private final StructureKind structureKind;
	private final boolean singleLine;
	private final List<String> inlineFields;
	private final List<String> rawLines;
	private final boolean verbatim;
	private final String header;
	private String trailer = "";
	private String trailingComment;
	private String headerComment;
	private final int startLine;
	private int endLine;

	private DefinitionNode(NodeKind kind, String name, String rawContent, int nestingLevel,
			StructureKind structureKind, boolean singleLine, List<String> inlineFields, List<String> rawLines,
			boolean verbatim, String header, int startLine, int endLine) {
		this.kind = kind;
		this.name = name == null ? "" : name;
		this.rawContent = rawContent == null ? "" : rawContent;
		this.nestingLevel = nestingLevel;
		this.structureKind = structureKind;
		this.singleLine = singleLine;
		this.inlineFields = inlineFields;
		this.rawLines = rawLines;
		this.verbatim = verbatim;
		this.header = header;
		this.startLine = startLine;
		this.endLine = endLine;
	}

	public static DefinitionNode root() {
		return new DefinitionNode(NodeKind.ROOT, "", "", 0, null, false, null, null, false, null, 0, 0);
	}

	/**
	 * Leaf for a module header, BEGIN, END or any other line kept as is.
	 */
	public static DefinitionNode leaf(NodeKind kind, String name, String rawContent, int line) {
		if (kind == NodeKind.TYPE_DEFINITION || kind == NodeKind.ROOT) {
			throw new IllegalArgumentException("Not a leaf kind: " + kind);
		}
		return new DefinitionNode(kind, name, rawContent, 0, null, false, null, null, false, null, line, line);
	}

	public static DefinitionNode blank(int line) {
		return leaf(NodeKind.OTHER, "", "", line);
	}

	/**
	 * @param verbatim {@code true} for a continuation line of a block comment,
	 *                 which is printed exactly as it appeared in the source
	 */
	public static DefinitionNode comment(String text, int nestingLevel, int startLine, int endLine,
			boolean verbatim) {
		return new DefinitionNode(NodeKind.COMMENT, "", text, nestingLevel, null, false, null, null, verbatim, null,
				startLine, endLine);
	}

	public static DefinitionNode field(String text, int nestingLevel, int startLine, int endLine) {
		return new DefinitionNode(NodeKind.FIELD, firstToken(text), text, nestingLevel, null, false, null, null,
				false, null, startLine, endLine);
	}

	/**
	 * Primitive alias or value assignment that fits on one line.
	 */
	public static DefinitionNode primitive(String name, String text, int nestingLevel, int line) {
		return new DefinitionNode(NodeKind.TYPE_DEFINITION, name, text, nestingLevel, StructureKind.PRIMITIVE,
				true, Collections.emptyList(), null, false, null, line, line);
	}

	/**
	 * Primitive definition whose non-structured braces span several lines.
	 */
	public static DefinitionNode primitiveBlock(String name, List<String> lines, int nestingLevel, int startLine,
			int endLine) {
		List<String> copy = Collections.unmodifiableList(new ArrayList<>(lines));
		return new DefinitionNode(NodeKind.TYPE_DEFINITION, name, String.join("\n", copy), nestingLevel,
				StructureKind.PRIMITIVE, false, Collections.emptyList(), copy, false, null, startLine, endLine);
	}

	public static DefinitionNode singleLine(String name, String header, StructureKind structureKind,
			List<String> inlineFields, int nestingLevel, int line) {
		return new DefinitionNode(NodeKind.TYPE_DEFINITION, name, header, nestingLevel, structureKind, true,
				Collections.unmodifiableList(new ArrayList<>(inlineFields)), null, false, header, line, line);
	}

	public static DefinitionNode multiLine(String name, String header, StructureKind structureKind,
			int nestingLevel, int startLine) {
		return new DefinitionNode(NodeKind.TYPE_DEFINITION, name, header, nestingLevel, structureKind, false,
				Collections.emptyList(), null, false, header, startLine, startLine);
	}

	static String firstToken(String text) {
		if (text == null) {
			return "";
		}
		String trimmed = text.trim();
		int end = 0;
		while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))
				&& trimmed.charAt(end) != '{') {
			end++;
		}
		return trimmed.substring(0, end);
	}

	public NodeKind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}

	public String getRawContent() {
		return rawContent;
	}

	public int getNestingLevel() {
		return nestingLevel;
	}

	public List<DefinitionNode> getChildren() {
		return Collections.unmodifiableList(children);
	}

	void addChild(DefinitionNode child) {
		children.add(child);
	}

	public StructureKind getStructureKind() {
		return structureKind;
	}

	public boolean isSingleLine() {
		return singleLine;
	}

	public List<String> getInlineFields() {
		return inlineFields;
	}

	/**
	 * Source lines of a multi-line primitive, otherwise {@code null}.
	 */
	public List<String> getRawLines() {
		return rawLines;
	}

	public boolean isVerbatim() {
		return verbatim;
	}

	public boolean isBlank() {
		return kind == NodeKind.OTHER && rawContent.isEmpty();
	}

	public boolean isStructured() {
		return structureKind != null && structureKind != StructureKind.PRIMITIVE;
	}

	/**
	 * Normalized text before the body's opening brace, e.g.
	 * {@code "Person ::= SEQUENCE"} or {@code "address [0] SEQUENCE"}.
	 */
	public String getHeader() {
		return header;
	}

	/**
	 * Normalized text after the body's closing brace, empty when none.
	 */
	public String getTrailer() {
		return trailer;
	}

	void setTrailer(String trailer) {
		this.trailer = trailer == null ? "" : trailer;
	}

	public String getTrailingComment() {
		return trailingComment;
	}

	void setTrailingComment(String trailingComment) {
		this.trailingComment = trailingComment;
	}

	/**
	 * Comment that follows the opening brace on the header line.
	 */
	public String getHeaderComment() {
		return headerComment;
	}

	void setHeaderComment(String headerComment) {
		this.headerComment = headerComment;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	void setEndLine(int endLine) {
		this.endLine = endLine;
	}

	@Override
	public String toString() {
		return "DefinitionNode{" + kind + " " + name + " lines " + startLine + "-" + endLine + "}";
	}
}
