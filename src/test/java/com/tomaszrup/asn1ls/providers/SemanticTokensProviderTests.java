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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SemanticTokensProviderTests {

	/**
	 * Decodes the relative encoding into absolute
	 * {@code [line, column, length, type, modifiers]} tuples.
	 */
	private static List<List<Integer>> decode(List<Integer> data) {
		List<List<Integer>> tokens = new ArrayList<>();
		int line = 0;
		int column = 0;
		for (int i = 0; i + 4 < data.size(); i += 5) {
			int deltaLine = data.get(i);
			line += deltaLine;
			column = deltaLine == 0 ? column + data.get(i + 1) : data.get(i + 1);
			tokens.add(Arrays.asList(line, column, data.get(i + 2), data.get(i + 3), data.get(i + 4)));
		}
		return tokens;
	}

	private static List<Integer> token(int line, int column, int length, int type, int modifiers) {
		return Arrays.asList(line, column, length, type, modifiers);
	}

	@Test
	void testLegend() {
		Assertions.assertEquals(Arrays.asList("keyword", "comment", "string", "number", "operator", "type",
				"variable"), SemanticTokensProvider.getLegend().getTokenTypes());
		Assertions.assertEquals(Arrays.asList("declaration"), SemanticTokensProvider.getLegend().getTokenModifiers());
	}

	@Test
	void testDefinitionTokens() {
		String source = "Person ::= SEQUENCE {\n"
				+ "  name UTF8String, -- the name\n"
				+ "  age INTEGER (0..120)\n"
				+ "}";
		List<List<Integer>> tokens = decode(SemanticTokensProvider.encode(source, false));
		Assertions.assertEquals(Arrays.asList(
				token(0, 0, 6, SemanticTokensProvider.TYPE_TYPE, SemanticTokensProvider.MOD_DECLARATION),
				token(0, 7, 3, SemanticTokensProvider.TYPE_OPERATOR, 0),
				token(0, 11, 8, SemanticTokensProvider.TYPE_KEYWORD, 0),
				token(1, 2, 4, SemanticTokensProvider.TYPE_VARIABLE, 0),
				token(1, 7, 10, SemanticTokensProvider.TYPE_KEYWORD, 0),
				token(1, 19, 11, SemanticTokensProvider.TYPE_COMMENT, 0),
				token(2, 2, 3, SemanticTokensProvider.TYPE_VARIABLE, 0),
				token(2, 6, 7, SemanticTokensProvider.TYPE_KEYWORD, 0),
				token(2, 15, 1, SemanticTokensProvider.TYPE_NUMBER, 0),
				token(2, 18, 3, SemanticTokensProvider.TYPE_NUMBER, 0)), tokens);
	}

	@Test
	void testRelativeEncoding() {
		Assertions.assertEquals(Arrays.asList(
				0, 0, 1, SemanticTokensProvider.TYPE_TYPE, SemanticTokensProvider.MOD_DECLARATION,
				0, 2, 3, SemanticTokensProvider.TYPE_OPERATOR, 0,
				0, 4, 1, SemanticTokensProvider.TYPE_TYPE, 0,
				1, 0, 1, SemanticTokensProvider.TYPE_TYPE, 0),
				SemanticTokensProvider.encode("A ::= B\nC", false));
	}

	@Test
	void testBlockCommentAcrossLines() {
		List<List<Integer>> tokens = decode(SemanticTokensProvider.encode("-* a\nb *- x", false));
		Assertions.assertEquals(Arrays.asList(
				token(0, 0, 4, SemanticTokensProvider.TYPE_COMMENT, 0),
				token(1, 0, 4, SemanticTokensProvider.TYPE_COMMENT, 0),
				token(1, 5, 1, SemanticTokensProvider.TYPE_VARIABLE, 0)), tokens);
	}

	@Test
	void testHyphenatedIdentifiersAndComments() {
		List<List<Integer>> tokens = decode(SemanticTokensProvider.encode("id-ce--note", false));
		Assertions.assertEquals(Arrays.asList(
				token(0, 0, 5, SemanticTokensProvider.TYPE_VARIABLE, 0),
				token(0, 5, 6, SemanticTokensProvider.TYPE_COMMENT, 0)), tokens);
	}

	@Test
	void testStringHidesCommentMarker() {
		List<List<Integer>> tokens = decode(SemanticTokensProvider.encode("v Str ::= \"a -- b\"", false));
		Assertions.assertEquals(Arrays.asList(
				token(0, 0, 1, SemanticTokensProvider.TYPE_VARIABLE, SemanticTokensProvider.MOD_DECLARATION),
				token(0, 2, 3, SemanticTokensProvider.TYPE_TYPE, 0),
				token(0, 6, 3, SemanticTokensProvider.TYPE_OPERATOR, 0),
				token(0, 10, 8, SemanticTokensProvider.TYPE_STRING, 0)), tokens);
	}

	@Test
	void testStringAcrossLines() {
		List<List<Integer>> tokens = decode(SemanticTokensProvider.encode("A ::= \"first\nsecond\" -- c", false));
		Assertions.assertEquals(Arrays.asList(
				token(0, 0, 1, SemanticTokensProvider.TYPE_TYPE, SemanticTokensProvider.MOD_DECLARATION),
				token(0, 2, 3, SemanticTokensProvider.TYPE_OPERATOR, 0),
				token(0, 6, 6, SemanticTokensProvider.TYPE_STRING, 0),
				token(1, 0, 7, SemanticTokensProvider.TYPE_STRING, 0),
				token(1, 8, 4, SemanticTokensProvider.TYPE_COMMENT, 0)), tokens);
	}

	@Test
	void testExtensionMarkerAndLowerCaseKeyword() {
		List<List<Integer>> tokens = decode(SemanticTokensProvider.encode("  ...,\n  x sequence", false));
		Assertions.assertEquals(Arrays.asList(
				token(0, 2, 3, SemanticTokensProvider.TYPE_OPERATOR, 0),
				token(1, 2, 1, SemanticTokensProvider.TYPE_VARIABLE, 0),
				token(1, 4, 8, SemanticTokensProvider.TYPE_KEYWORD, 0)), tokens);
	}

	@Test
	void testMarkdownOnlyTokenizesAsn1Blocks() {
		String source = "# Types\n```asn1\nA ::= INTEGER\n```\ntext INTEGER\n```asn1\n-* open\n```\nB\n";
		List<List<Integer>> tokens = decode(SemanticTokensProvider.encode(source, true));
		Assertions.assertEquals(Arrays.asList(
				token(2, 0, 1, SemanticTokensProvider.TYPE_TYPE, SemanticTokensProvider.MOD_DECLARATION),
				token(2, 2, 3, SemanticTokensProvider.TYPE_OPERATOR, 0),
				token(2, 6, 7, SemanticTokensProvider.TYPE_KEYWORD, 0),
				token(6, 0, 7, SemanticTokensProvider.TYPE_COMMENT, 0)), tokens);
	}

	@Test
	void testEmptySource() {
		Assertions.assertTrue(SemanticTokensProvider.encode("", false).isEmpty());
	}
}
