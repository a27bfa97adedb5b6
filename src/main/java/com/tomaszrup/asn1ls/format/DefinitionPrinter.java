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
import java.util.regex.Pattern;

/**
 * Renders a definition tree to canonical text.
 *
 * <p>Blank-line policy: no leading blank lines, never more than two in a row,
 * exactly one after {@code BEGIN} and one before {@code END}, one after every
 * top-level structured definition, and exactly one trailing newline.</p>
 */
public class DefinitionPrinter {

	private static final int MAX_BLANK_LINES = 2;
	private static final Pattern ENDS_WITH_BEGIN = Pattern.compile("^(.*[\\s=])?BEGIN$");

	private final FormatterConfig config;

	public DefinitionPrinter(FormatterConfig config) {
		this.config = config == null ? FormatterConfig.defaults() : config;
	}

	public String render(DefinitionNode root) {
		OutputLines out = new OutputLines();
		boolean afterBegin = false;
		int blankRun = 0;
		for (DefinitionNode node : root.getChildren()) {
			if (node.isBlank()) {
				blankRun++;
				continue;
			}
			if (node.getKind() == NodeKind.COMMENT && node.isVerbatim()) {
				// continuation of a block comment, nothing may be inserted before it
				blankRun = 0;
				out.dropBlanks();
				out.add(node.getRawContent());
				continue;
			}
			if (blankRun > 0) {
				out.requestBlanks(blankRun);
				blankRun = 0;
			}
			if (afterBegin || node.getKind() == NodeKind.END) {
				out.exactBlanks(1);
			}
			afterBegin = false;
			switch (node.getKind()) {
				case MODULE:
					out.add(node.getRawContent());
					afterBegin = ENDS_WITH_BEGIN.matcher(codeOf(node.getRawContent())).matches();
					break;
				case BEGIN:
					out.add(node.getRawContent());
					afterBegin = true;
					break;
				case TYPE_DEFINITION:
					renderDefinition(node, 0, out, false, true);
					if (node.isStructured()) {
						out.requestBlanks(1);
					}
					break;
				case COMMENT:
					renderComment(node, 0, out);
					break;
				default:
					out.add(node.getRawContent());
			}
		}
		return out.toText();
	}

	private void renderDefinition(DefinitionNode node, int level, OutputLines out, boolean nested, boolean last) {
		checkDepth(level, node);
		if (!node.isStructured()) {
			renderPrimitive(node, level, out);
			return;
		}
		String indent = indent(level);
		addWithComment(out, indent + node.getHeader() + " {", node.getHeaderComment());
		List<DefinitionNode> members = node.isSingleLine()
				? membersOf(node.getInlineFields(), level + 1, node.getStartLine())
				: node.getChildren();
		renderMembers(members, level + 1, out);

		StringBuilder close = new StringBuilder(indent).append('}');
		if (!node.getTrailer().isEmpty()) {
			close.append(' ').append(node.getTrailer());
		}
		if (nested && !last) {
			close.append(',');
		}
		addWithComment(out, close.toString(), node.getTrailingComment());
	}

	private void renderMembers(List<DefinitionNode> members, int level, OutputLines out) {
		int lastCode = -1;
		for (int i = 0; i < members.size(); i++) {
			if (members.get(i).getKind() != NodeKind.COMMENT) {
				lastCode = i;
			}
		}
		for (int i = 0; i < members.size(); i++) {
			DefinitionNode member = members.get(i);
			switch (member.getKind()) {
				case COMMENT:
					renderComment(member, level, out);
					break;
				case TYPE_DEFINITION:
					renderDefinition(member, level, out, true, i == lastCode);
					break;
				default:
					renderField(member, level, out, i == lastCode);
			}
		}
	}

	private void renderField(DefinitionNode field, int level, OutputLines out, boolean last) {
		checkDepth(level, field);
		List<String> segments = TopLevelSplitter.splitTopLevel(field.getRawContent());
		for (int i = 0; i < segments.size(); i++) {
			boolean lastSegment = i == segments.size() - 1;
			String code = segments.get(i) + (lastSegment && last ? "" : ",");
			List<String> wrapped = wrap(code, level);
			for (int j = 0; j < wrapped.size() - 1; j++) {
				out.add(wrapped.get(j));
			}
			addWithComment(out, wrapped.get(wrapped.size() - 1), lastSegment ? field.getTrailingComment() : null);
		}
	}

	private void renderPrimitive(DefinitionNode node, int level, OutputLines out) {
		String indent = indent(level);
		List<String> rawLines = node.getRawLines();
		if (rawLines == null || rawLines.isEmpty()) {
			addWithComment(out, indent + node.getRawContent(), node.getTrailingComment());
			return;
		}
		List<String> reindented = FallbackIndenter.reindentLines(rawLines, config.getIndentWidth());
		out.add(indent + FieldNormalizer.normalizeLine(rawLines.get(0)));
		for (int i = 1; i < reindented.size(); i++) {
			String line = reindented.get(i);
			out.add(line.isEmpty() ? "" : indent + line);
		}
	}

	private void renderComment(DefinitionNode node, int level, OutputLines out) {
		String[] parts = node.getRawContent().split("\n", -1);
		out.add(indent(level) + parts[0]);
		for (int i = 1; i < parts.length; i++) {
			out.add(parts[i]);
		}
	}

	private List<DefinitionNode> membersOf(List<String> inlineFields, int level, int line) {
		if (inlineFields == null || inlineFields.isEmpty()) {
			return Collections.emptyList();
		}
		List<DefinitionNode> members = new ArrayList<>();
		for (String field : inlineFields) {
			members.addAll(new BodyScanner(field, 0, field.length(), level, line, config).scan());
		}
		return members;
	}

	/**
	 * Breaks a field line that exceeds the maximum line length at spaces
	 * outside brackets and strings. Continuation lines sit two levels deeper.
	 */
	List<String> wrap(String code, int level) {
		String prefix = indent(level);
		int max = config.getMaxLineLength();
		if (!config.isWrapLongLines() || prefix.length() + code.length() <= max) {
			return Collections.singletonList(prefix + code);
		}
		List<String> lines = new ArrayList<>();
		String continuation = indent(level + 2);
		String rest = code;
		while (prefix.length() + rest.length() > max) {
			int breakAt = breakPoint(rest, max - prefix.length());
			if (breakAt <= 0) {
				break;
			}
			lines.add(prefix + rest.substring(0, breakAt));
			rest = rest.substring(breakAt + 1);
			prefix = continuation;
		}
		lines.add(prefix + rest);
		return lines;
	}

	private static int breakPoint(String text, int room) {
		int best = -1;
		int depth = 0;
		int i = 0;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '"') {
				i = Lexical.skipString(text, i);
				continue;
			}
			if (c == '(' || c == '[' || c == '{') {
				depth++;
			} else if (c == ')' || c == ']' || c == '}') {
				depth = Math.max(0, depth - 1);
			} else if (c == ' ' && depth == 0 && i > 0) {
				if (i <= room) {
					best = i;
				} else {
					return best > 0 ? best : i;
				}
			}
			i++;
		}
		return best;
	}

	private void checkDepth(int level, DefinitionNode node) {
		if (level > config.getMaxNestingDepth()) {
			throw new StructuralFault("Nesting deeper than " + config.getMaxNestingDepth() + " levels",
					node.getStartLine());
		}
	}

	private String indent(int level) {
		return Lexical.spaces(level * config.getIndentWidth());
	}

	private static void addWithComment(OutputLines out, String code, String comment) {
		if (comment == null || comment.isEmpty()) {
			out.add(code);
			return;
		}
		String[] parts = comment.split("\n", -1);
		out.add(code.isBlank() ? code + parts[0] : code + " " + parts[0]);
		for (int i = 1; i < parts.length; i++) {
			out.add(parts[i]);
		}
	}

	private static String codeOf(String line) {
		int commentAt = Lexical.indexOfComment(line);
		return (commentAt < 0 ? line : line.substring(0, commentAt)).trim();
	}

	/**
	 * Output buffer that tracks how many blank lines were appended by the
	 * blank-line policy at its end.
	 */
	private static final class OutputLines {
		private final List<String> lines = new ArrayList<>();
		private int trailingBlanks;

		void add(String line) {
			lines.add(line);
			trailingBlanks = 0;
		}

		void requestBlanks(int count) {
			if (lines.isEmpty()) {
				return;
			}
			int target = Math.min(count, MAX_BLANK_LINES);
			while (trailingBlanks < target) {
				lines.add("");
				trailingBlanks++;
			}
		}

		void exactBlanks(int count) {
			if (lines.isEmpty()) {
				return;
			}
			dropBlanks();
			requestBlanks(count);
		}

		void dropBlanks() {
			while (trailingBlanks > 0) {
				lines.remove(lines.size() - 1);
				trailingBlanks--;
			}
		}

		String toText() {
			dropBlanks();
			while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
				lines.remove(lines.size() - 1);
			}
			if (lines.isEmpty()) {
				return "";
			}
			return String.join("\n", lines) + "\n";
		}
	}
}
