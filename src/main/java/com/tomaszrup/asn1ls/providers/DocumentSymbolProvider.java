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
package com.tomaszrup.asn1ls.providers;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.SymbolKind;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.asn1ls.format.DefinitionNode;
import com.tomaszrup.asn1ls.format.FieldNormalizer;
import com.tomaszrup.asn1ls.format.FormatterConfig;
import com.tomaszrup.asn1ls.format.NodeKind;
import com.tomaszrup.asn1ls.format.StructuralFault;
import com.tomaszrup.asn1ls.format.StructuralParser;
import com.tomaszrup.asn1ls.format.StructureKind;
import com.tomaszrup.asn1ls.util.FileContentsTracker;

/**
 * Builds the document outline from the definition tree. Type definitions
 * between a module header and its {@code END} are nested under the module.
 */
public class DocumentSymbolProvider {
	private static final Logger logger = LoggerFactory.getLogger(DocumentSymbolProvider.class);

	private final FileContentsTracker fileContentsTracker;

	public DocumentSymbolProvider(FileContentsTracker fileContentsTracker) {
		this.fileContentsTracker = fileContentsTracker;
	}

	public CompletableFuture<List<Either<SymbolInformation, DocumentSymbol>>> provideDocumentSymbols(
			TextDocumentIdentifier textDocument) {
		URI uri = URI.create(textDocument.getUri());
		String source = fileContentsTracker.getContents(uri);
		if (source == null || source.isBlank()) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		List<Either<SymbolInformation, DocumentSymbol>> symbols = new ArrayList<>();
		for (DocumentSymbol symbol : buildSymbols(source)) {
			symbols.add(Either.forRight(symbol));
		}
		return CompletableFuture.completedFuture(symbols);
	}

	/**
	 * Returns the outline of {@code source}, or an empty list if the text
	 * cannot be parsed structurally.
	 */
	public static List<DocumentSymbol> buildSymbols(String source) {
		String text = source.replace("\r\n", "\n").replace("\r", "\n");
		String[] lines = text.split("\n", -1);
		DefinitionNode root;
		try {
			root = new StructuralParser(FormatterConfig.defaults()).parse(text);
		} catch (StructuralFault e) {
			logger.debug("No outline, structural parse failed at line {}: {}", e.getLine(), e.getMessage());
			return Collections.emptyList();
		}

		List<DocumentSymbol> result = new ArrayList<>();
		DocumentSymbol module = null;
		for (DefinitionNode node : root.getChildren()) {
			if (node.getKind() == NodeKind.MODULE) {
				module = new DocumentSymbol(node.getName(), SymbolKind.Module, lineRange(lines, node.getStartLine(),
						node.getStartLine()), nameRange(lines, node.getStartLine(), node.getName()));
				module.setChildren(new ArrayList<>());
				result.add(module);
			} else if (node.getKind() == NodeKind.END && module != null) {
				module.setRange(lineRange(lines, module.getRange().getStart().getLine(), node.getStartLine()));
				module = null;
			} else if (node.getKind() == NodeKind.TYPE_DEFINITION) {
				DocumentSymbol symbol = toSymbol(node, lines, false);
				if (module != null) {
					module.getChildren().add(symbol);
					module.setRange(lineRange(lines, module.getRange().getStart().getLine(), node.getEndLine()));
				} else {
					result.add(symbol);
				}
			}
		}
		return result;
	}

	private static DocumentSymbol toSymbol(DefinitionNode node, String[] lines, boolean nested) {
		Range range = lineRange(lines, node.getStartLine(), node.getEndLine());
		SymbolKind kind = nested ? SymbolKind.Field : symbolKind(node.getStructureKind());
		DocumentSymbol symbol = new DocumentSymbol(node.getName(), kind, range,
				nameRange(lines, node.getStartLine(), node.getName()));
		StructureKind structureKind = node.getStructureKind();
		if (structureKind != null) {
			symbol.setDetail(structureKind.name());
		}
		if (!node.isStructured()) {
			return symbol;
		}
		List<DocumentSymbol> children = new ArrayList<>();
		boolean enumerated = structureKind == StructureKind.ENUMERATED;
		if (node.isSingleLine()) {
			for (String field : node.getInlineFields()) {
				children.add(memberSymbol(memberName(field), field, enumerated, range, range));
			}
		} else {
			for (DefinitionNode child : node.getChildren()) {
				if (child.getKind() == NodeKind.TYPE_DEFINITION) {
					children.add(toSymbol(child, lines, true));
				} else if (child.getKind() == NodeKind.FIELD && !child.getName().isEmpty()) {
					Range childRange = lineRange(lines, child.getStartLine(), child.getEndLine());
					children.add(memberSymbol(memberName(child.getRawContent()), child.getRawContent(), enumerated,
							childRange, nameRange(lines, child.getStartLine(), memberName(child.getRawContent()))));
				}
			}
		}
		symbol.setChildren(children);
		return symbol;
	}

	private static DocumentSymbol memberSymbol(String name, String text, boolean enumerated, Range range,
			Range selectionRange) {
		DocumentSymbol symbol = new DocumentSymbol(name, enumerated ? SymbolKind.EnumMember : SymbolKind.Field,
				range, selectionRange);
		symbol.setDetail(FieldNormalizer.normalize(text));
		return symbol;
	}

	static SymbolKind symbolKind(StructureKind structureKind) {
		if (structureKind == null) {
			return SymbolKind.TypeParameter;
		}
		switch (structureKind) {
			case SEQUENCE:
			case SET:
				return SymbolKind.Struct;
			case ENUMERATED:
				return SymbolKind.Enum;
			case CHOICE:
				return SymbolKind.Class;
			default:
				return SymbolKind.TypeParameter;
		}
	}

	/**
	 * Name of a member: its first token, with the parenthesized value of an
	 * enumeration item such as {@code red(0)} removed.
	 */
	private static String memberName(String field) {
		String text = FieldNormalizer.normalize(field);
		int end = 0;
		while (end < text.length() && !Character.isWhitespace(text.charAt(end)) && text.charAt(end) != '('
				&& text.charAt(end) != '{') {
			end++;
		}
		return end == 0 ? text : text.substring(0, end);
	}

	private static Range lineRange(String[] lines, int startLine, int endLine) {
		int start = clampLine(lines, startLine);
		int end = Math.max(start, clampLine(lines, endLine));
		return new Range(new Position(start, 0), new Position(end, lines[end].length()));
	}

	private static Range nameRange(String[] lines, int line, String name) {
		int index = clampLine(lines, line);
		int column = name.isEmpty() ? -1 : lines[index].indexOf(name);
		if (column < 0) {
			return new Range(new Position(index, 0), new Position(index, 0));
		}
		return new Range(new Position(index, column), new Position(index, column + name.length()));
	}

	private static int clampLine(String[] lines, int line) {
		return Math.max(0, Math.min(line, lines.length - 1));
	}
}
