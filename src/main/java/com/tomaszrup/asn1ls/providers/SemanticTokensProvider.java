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
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.SemanticTokens;
import org.eclipse.lsp4j.SemanticTokensLegend;
import org.eclipse.lsp4j.TextDocumentIdentifier;

import com.tomaszrup.asn1ls.format.Asn1Keywords;
import com.tomaszrup.asn1ls.format.Lexical;
import com.tomaszrup.asn1ls.util.FencedBlockLocator;
import com.tomaszrup.asn1ls.util.FileContentsTracker;

/**
 * Lexical highlighter for ASN.1 text. Works line by line and carries only
 * an open block comment or string literal from one line to the next, so it
 * never needs a successful parse.
 */
public class SemanticTokensProvider {

	// Token types, order matters, indices are used in the encoding
	public static final List<String> TOKEN_TYPES = Collections.unmodifiableList(Arrays.asList(
			"keyword",   // 0
			"comment",   // 1
			"string",    // 2
			"number",    // 3
			"operator",  // 4
			"type",      // 5
			"variable"   // 6
	));

	// Token modifiers, bit flags
	public static final List<String> TOKEN_MODIFIERS = Collections.unmodifiableList(Arrays.asList(
			"declaration"  // bit 0
	));

	static final int TYPE_KEYWORD = 0;
	static final int TYPE_COMMENT = 1;
	static final int TYPE_STRING = 2;
	static final int TYPE_NUMBER = 3;
	static final int TYPE_OPERATOR = 4;
	static final int TYPE_TYPE = 5;
	static final int TYPE_VARIABLE = 6;

	static final int MOD_DECLARATION = 1;

	private static final String ASSIGNMENT = "::=";
	private static final String ELLIPSIS = "...";

	private final FileContentsTracker fileContentsTracker;

	public SemanticTokensProvider(FileContentsTracker fileContentsTracker) {
		this.fileContentsTracker = fileContentsTracker;
	}

	public static SemanticTokensLegend getLegend() {
		return new SemanticTokensLegend(TOKEN_TYPES, TOKEN_MODIFIERS);
	}

	public CompletableFuture<SemanticTokens> provideSemanticTokensFull(TextDocumentIdentifier textDocument) {
		URI uri = URI.create(textDocument.getUri());
		String source = fileContentsTracker.getContents(uri);
		if (source == null || source.isEmpty()) {
			return CompletableFuture.completedFuture(new SemanticTokens(Collections.emptyList()));
		}
		boolean markdown = FencedBlockLocator.isMarkdown(uri, fileContentsTracker.getLanguageId(uri));
		return CompletableFuture.completedFuture(new SemanticTokens(encode(source, markdown)));
	}

	/**
	 * Tokenizes {@code source} and returns the LSP relative encoding. In a
	 * Markdown document only the content of ASN.1 fenced blocks is tokenized.
	 */
	public static List<Integer> encode(String source, boolean markdown) {
		String[] lines = source.replace("\r\n", "\n").replace("\r", "\n").split("\n", -1);
		List<SemanticToken> tokens = new ArrayList<>();
		if (markdown) {
			for (FencedBlockLocator.Block block : FencedBlockLocator.findBlocks(String.join("\n", lines))) {
				tokenizeLines(lines, block.getFirstContentLine(), block.getCloseLine(), tokens);
			}
		} else {
			tokenizeLines(lines, 0, lines.length, tokens);
		}
		tokens.sort(Comparator.comparingInt((SemanticToken t) -> t.line)
				.thenComparingInt(t -> t.column));
		return encodeTokens(tokens);
	}

	/**
	 * What is still open at the end of a line.
	 */
	private enum Carry {
		NONE, BLOCK_COMMENT, STRING
	}

	private static void tokenizeLines(String[] lines, int from, int to, List<SemanticToken> tokens) {
		Carry carry = Carry.NONE;
		for (int i = from; i < to; i++) {
			carry = tokenizeLine(lines[i], i, carry, tokens);
		}
	}

	/**
	 * Emits the tokens of one line and returns what is still open at its end.
	 */
	private static Carry tokenizeLine(String line, int lineNumber, Carry carry, List<SemanticToken> tokens) {
		int i = 0;
		if (carry != Carry.NONE) {
			boolean string = carry == Carry.STRING;
			int end = string ? Lexical.findStringEnd(line, 0) : Lexical.findBlockCommentEnd(line, 0);
			int type = string ? TYPE_STRING : TYPE_COMMENT;
			if (end < 0) {
				add(tokens, lineNumber, 0, line.length(), type, 0);
				return carry;
			}
			add(tokens, lineNumber, 0, end, type, 0);
			i = end;
		}
		int assignAt = indexOfAssignment(line, i);
		boolean declared = false;
		while (i < line.length()) {
			char c = line.charAt(i);
			if (Lexical.startsLineComment(line, i)) {
				add(tokens, lineNumber, i, line.length() - i, TYPE_COMMENT, 0);
				return Carry.NONE;
			}
			if (Lexical.startsBlockComment(line, i)) {
				int end = Lexical.findBlockCommentEnd(line, i + 2);
				if (end < 0) {
					add(tokens, lineNumber, i, line.length() - i, TYPE_COMMENT, 0);
					return Carry.BLOCK_COMMENT;
				}
				add(tokens, lineNumber, i, end - i, TYPE_COMMENT, 0);
				i = end;
				continue;
			}
			if (c == '"') {
				int end = Lexical.findStringEnd(line, i + 1);
				if (end < 0) {
					add(tokens, lineNumber, i, line.length() - i, TYPE_STRING, 0);
					return Carry.STRING;
				}
				add(tokens, lineNumber, i, end - i, TYPE_STRING, 0);
				i = end;
				continue;
			}
			if (isLetter(c)) {
				int end = scanWord(line, i);
				String word = line.substring(i, end);
				int modifiers = 0;
				if (!declared && assignAt > i) {
					modifiers = MOD_DECLARATION;
					declared = true;
				}
				add(tokens, lineNumber, i, end - i, classifyWord(word), modifiers);
				i = end;
				continue;
			}
			if (Character.isDigit(c)) {
				int end = scanNumber(line, i);
				add(tokens, lineNumber, i, end - i, TYPE_NUMBER, 0);
				i = end;
				continue;
			}
			if (line.startsWith(ASSIGNMENT, i)) {
				add(tokens, lineNumber, i, ASSIGNMENT.length(), TYPE_OPERATOR, 0);
				i += ASSIGNMENT.length();
				continue;
			}
			if (line.startsWith(ELLIPSIS, i)) {
				add(tokens, lineNumber, i, ELLIPSIS.length(), TYPE_OPERATOR, 0);
				i += ELLIPSIS.length();
				continue;
			}
			i++;
		}
		return Carry.NONE;
	}

	static int classifyWord(String word) {
		if (Asn1Keywords.isKeywordIgnoreCase(word)) {
			return TYPE_KEYWORD;
		}
		return Character.isUpperCase(word.charAt(0)) ? TYPE_TYPE : TYPE_VARIABLE;
	}

	private static boolean isLetter(char c) {
		return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
	}

	private static int scanWord(String line, int start) {
		int i = start + 1;
		while (i < line.length()) {
			char c = line.charAt(i);
			if (c == '-') {
				// a hyphen that starts a comment ends the word
				if (Lexical.startsComment(line, i)) {
					break;
				}
			} else if (!isLetter(c) && !Character.isDigit(c)) {
				break;
			}
			i++;
		}
		while (i > start + 1 && line.charAt(i - 1) == '-') {
			i--;
		}
		return i;
	}

	private static int scanNumber(String line, int start) {
		int i = start;
		while (i < line.length() && Character.isDigit(line.charAt(i))) {
			i++;
		}
		if (i + 1 < line.length() && line.charAt(i) == '.' && Character.isDigit(line.charAt(i + 1))) {
			i++;
			while (i < line.length() && Character.isDigit(line.charAt(i))) {
				i++;
			}
		}
		return i;
	}

	/**
	 * Offset of a {@code ::=} in the code part of the line, or -1.
	 */
	private static int indexOfAssignment(String line, int from) {
		int i = from;
		while (i < line.length()) {
			char c = line.charAt(i);
			if (c == '"') {
				int end = Lexical.findStringEnd(line, i + 1);
				if (end < 0) {
					return -1;
				}
				i = end;
			} else if (Lexical.startsComment(line, i)) {
				return -1;
			} else if (line.startsWith(ASSIGNMENT, i)) {
				return i;
			} else {
				i++;
			}
		}
		return -1;
	}

	private static void add(List<SemanticToken> tokens, int line, int column, int length, int tokenType,
			int tokenModifiers) {
		if (length <= 0) {
			return;
		}
		SemanticToken token = new SemanticToken();
		token.line = line;
		token.column = column;
		token.length = length;
		token.tokenType = tokenType;
		token.tokenModifiers = tokenModifiers;
		tokens.add(token);
	}

	private static List<Integer> encodeTokens(List<SemanticToken> tokens) {
		List<Integer> data = new ArrayList<>(tokens.size() * 5);
		int prevLine = 0;
		int prevColumn = 0;

		for (SemanticToken token : tokens) {
			int deltaLine = token.line - prevLine;
			int deltaColumn = (deltaLine == 0) ? token.column - prevColumn : token.column;

			data.add(deltaLine);
			data.add(deltaColumn);
			data.add(token.length);
			data.add(token.tokenType);
			data.add(token.tokenModifiers);

			prevLine = token.line;
			prevColumn = token.column;
		}

		return data;
	}

	private static class SemanticToken {
		int line;
		int column;
		int length;
		int tokenType;
		int tokenModifiers;
	}
}
