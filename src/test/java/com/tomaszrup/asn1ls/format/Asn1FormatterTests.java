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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class Asn1FormatterTests {

	private static String lines(String... lines) {
		return String.join("\n", lines) + "\n";
	}

	private static final List<String> SAMPLES = Arrays.asList(
			"Person ::= SEQUENCE {\nname UTF8String,\nage INTEGER\n}\n",
			"Color ::= ENUMERATED { red(0), green(1), blue(2) }",
			"Outer::=SEQUENCE{inner SEQUENCE{a INTEGER,b BOOLEAN},flag BOOLEAN}",
			"-- header\nPerson ::= SEQUENCE { -- record\n  name UTF8String, -- the name\n  -- standalone\n"
					+ "  age INTEGER -- years\n}\n",
			"Test DEFINITIONS AUTOMATIC TAGS ::= BEGIN\nA ::= INTEGER\nB ::= SET { x INTEGER }\nEND\n",
			"-* block\n   comment *-\nA ::= INTEGER\n",
			"id-ce OBJECT IDENTIFIER ::= {\njoint-iso-ccitt ds(5) 29\n}\n",
			"Msg ::= CHOICE {\n  [0] req SEQUENCE { id INTEGER, ... },\n  [1] rsp NULL\n}\n",
			"Broken ::= SEQUENCE {\nname INTEGER\n",
			"A ::= INTEGER\n\n\n\n\nB ::= BOOLEAN\n",
			"Text ::= SEQUENCE { label UTF8String DEFAULT \"a, {b}\" }");

	// --- canonical layout ---

	@Test
	void testMultiLineSequence() {
		String input = "Person ::= SEQUENCE {\nname UTF8String,\n      age INTEGER\n}";
		Assertions.assertEquals(lines(
				"Person ::= SEQUENCE {",
				"  name UTF8String,",
				"  age INTEGER",
				"}"), Asn1Formatter.format(input));
	}

	@Test
	void testSingleLineEnumeratedIsExpanded() {
		Assertions.assertEquals(lines(
				"Color ::= ENUMERATED {",
				"  red(0),",
				"  green(1),",
				"  blue(2)",
				"}"), Asn1Formatter.format("Color ::= ENUMERATED { red(0), green(1), blue(2) }"));
	}

	@Test
	void testNestedStructuresIndentOneLevelEach() {
		String input = "A ::= SEQUENCE { b SEQUENCE { c CHOICE { d INTEGER, e BOOLEAN } }, f NULL }";
		Assertions.assertEquals(lines(
				"A ::= SEQUENCE {",
				"  b SEQUENCE {",
				"    c CHOICE {",
				"      d INTEGER,",
				"      e BOOLEAN",
				"    }",
				"  },",
				"  f NULL",
				"}"), Asn1Formatter.format(input));
	}

	@Test
	void testOperatorSpacing() {
		Assertions.assertEquals("Age ::= INTEGER\n", Asn1Formatter.format("Age::=INTEGER"));
		Assertions.assertEquals("Age ::= INTEGER (0..120)\n", Asn1Formatter.format("  Age   ::=    INTEGER   (0..120)"));
	}

	@Test
	void testIndentScaling() {
		String input = "P ::= SEQUENCE { a SEQUENCE { b INTEGER } }";
		Assertions.assertEquals(lines(
				"P ::= SEQUENCE {",
				"    a SEQUENCE {",
				"        b INTEGER",
				"    }",
				"}"), Asn1Formatter.format(input, FormatterConfig.withIndent(4)));
	}

	@Test
	void testOpeningBraceOnNextLine() {
		Assertions.assertEquals(lines(
				"P ::= SEQUENCE {",
				"  a INTEGER",
				"}"), Asn1Formatter.format("P ::= SEQUENCE\n{\n  a INTEGER\n}\n"));
	}

	@Test
	void testCommasInsideConstraintsAreKept() {
		Assertions.assertEquals(lines(
				"S ::= SEQUENCE {",
				"  v INTEGER (0..255, ...),",
				"  w SEQUENCE SIZE (1..4) OF INTEGER",
				"}"), Asn1Formatter.format("S ::= SEQUENCE { v INTEGER (0..255, ...), w SEQUENCE SIZE (1..4) OF INTEGER }"));
	}

	@Test
	void testExtensionMarkerIsAField() {
		Assertions.assertEquals(lines(
				"Msg ::= SEQUENCE {",
				"  id INTEGER,",
				"  ...,",
				"  extra BOOLEAN OPTIONAL",
				"}"), Asn1Formatter.format("Msg ::= SEQUENCE { id INTEGER, ..., extra BOOLEAN OPTIONAL }"));
	}

	@Test
	void testTrailingCommaBeforeCloseIsDropped() {
		Assertions.assertEquals(lines(
				"P ::= SET {",
				"  a INTEGER,",
				"  b BOOLEAN",
				"}"), Asn1Formatter.format("P ::= SET {\n  a INTEGER,\n  b BOOLEAN,\n}"));
	}

	@Test
	void testStringLiteralContentIsUntouched() {
		Assertions.assertEquals(lines(
				"Text ::= SEQUENCE {",
				"  label UTF8String DEFAULT \"a,  {b}\"",
				"}"), Asn1Formatter.format("Text ::= SEQUENCE { label UTF8String DEFAULT \"a,  {b}\" }"));
	}

	@Test
	void testAssignmentInsideStringLiteralIsUntouched() {
		Assertions.assertEquals("greeting UTF8String ::= \"a::=b\"\n",
				Asn1Formatter.format("greeting UTF8String::=\"a::=b\"\n"));
		Assertions.assertEquals(lines(
				"Text ::= SEQUENCE {",
				"  label UTF8String DEFAULT \"x::=y\"",
				"}"), Asn1Formatter.format("Text::=SEQUENCE { label UTF8String DEFAULT \"x::=y\" }"));
	}

	// --- primitives ---

	@Test
	void testPrimitiveWithNamedNumbersStaysOnOneLine() {
		Assertions.assertEquals("Priority ::= INTEGER { low(0), high(1) }\n",
				Asn1Formatter.format("Priority ::=   INTEGER   { low(0), high(1) }"));
	}

	@Test
	void testMultiLineObjectIdentifierIsReindented() {
		Assertions.assertEquals(lines(
				"id-ce OBJECT IDENTIFIER ::= {",
				"  joint-iso-ccitt ds(5) 29",
				"}"), Asn1Formatter.format("id-ce OBJECT IDENTIFIER ::= {\njoint-iso-ccitt ds(5) 29\n}\n"));
	}

	// --- comments ---

	@Test
	void testCommentsArePreservedInPlace() {
		String input = lines(
				"-- header",
				"Person ::= SEQUENCE { -- record",
				"name UTF8String, -- the name",
				"        -- standalone",
				"age INTEGER -- years",
				"}");
		Assertions.assertEquals(lines(
				"-- header",
				"Person ::= SEQUENCE { -- record",
				"  name UTF8String, -- the name",
				"  -- standalone",
				"  age INTEGER -- years",
				"}"), Asn1Formatter.format(input));
	}

	@Test
	void testBlockCommentContinuationIsVerbatim() {
		String input = lines(
				"-* block",
				"   comment *-",
				"A ::= INTEGER");
		Assertions.assertEquals(input, Asn1Formatter.format(input));
	}

	@Test
	void testTrailingCommentOnClosingBrace() {
		Assertions.assertEquals(lines(
				"P ::= SEQUENCE {",
				"  a INTEGER",
				"} -- end of P"), Asn1Formatter.format("P ::= SEQUENCE {\na INTEGER\n}   -- end of P"));
	}

	// --- modules and blank lines ---

	@Test
	void testModuleLayout() {
		String input = lines(
				"Test DEFINITIONS AUTOMATIC TAGS ::= BEGIN",
				"A ::= INTEGER",
				"B ::= SET { x INTEGER }",
				"END");
		Assertions.assertEquals(lines(
				"Test DEFINITIONS AUTOMATIC TAGS ::= BEGIN",
				"",
				"A ::= INTEGER",
				"B ::= SET {",
				"  x INTEGER",
				"}",
				"",
				"END"), Asn1Formatter.format(input));
	}

	@Test
	void testModuleWithBeginOnItsOwnLine() {
		String input = lines(
				"Test DEFINITIONS ::=",
				"BEGIN",
				"",
				"",
				"",
				"A ::= INTEGER",
				"END");
		Assertions.assertEquals(lines(
				"Test DEFINITIONS ::=",
				"BEGIN",
				"",
				"A ::= INTEGER",
				"",
				"END"), Asn1Formatter.format(input));
	}

	@Test
	void testBlankLinesAreCappedAtTwo() {
		Assertions.assertEquals("A ::= INTEGER\n\n\nB ::= BOOLEAN\n",
				Asn1Formatter.format("\n\nA ::= INTEGER\n\n\n\n\nB ::= BOOLEAN\n\n\n"));
	}

	@Test
	void testStructuredDefinitionsAreSeparatedByABlankLine() {
		Assertions.assertEquals(lines(
				"A ::= SEQUENCE {",
				"  x INTEGER",
				"}",
				"",
				"B ::= INTEGER"), Asn1Formatter.format("A ::= SEQUENCE { x INTEGER }\nB ::= INTEGER"));
	}

	// --- input normalization ---

	@Test
	void testLineEndingsAndTabsAreNormalized() {
		Assertions.assertEquals(lines(
				"P ::= SEQUENCE {",
				"  name UTF8String",
				"}",
				"",
				"B ::= BOOLEAN"), Asn1Formatter.format("P ::= SEQUENCE {\r\n\tname\tUTF8String\r\n}\rB ::=\tBOOLEAN\r\n"));
	}

	// --- totality ---

	@Test
	void testNullAndBlankInputs() {
		Assertions.assertEquals("", Asn1Formatter.format(null));
		Assertions.assertEquals("", Asn1Formatter.format(""));
		Assertions.assertEquals("", Asn1Formatter.format("  \n\t \n"));
	}

	@Test
	void testUnbalancedBraceFallsBackToReindent() {
		Assertions.assertEquals(lines(
				"Broken ::= SEQUENCE {",
				"  name INTEGER",
				"  inner SEQUENCE {",
				"    x NULL",
				"  }"), Asn1Formatter.format("Broken ::= SEQUENCE {\nname INTEGER\n   inner SEQUENCE {\nx NULL\n}\n"));
	}

	@Test
	void testStrayClosingBracesDoNotThrow() {
		String formatted = Asn1Formatter.format("}\n}}\nA ::= INTEGER\n{");
		Assertions.assertNotNull(formatted);
		Assertions.assertTrue(formatted.contains("A ::= INTEGER"));
	}

	@Test
	void testNestingCeilingFallsBack() {
		FormatterConfig shallow = new FormatterConfig(2, 100, false, 4, 2);
		String input = "A ::= SEQUENCE { b SEQUENCE { c SEQUENCE { d INTEGER } } }";
		String formatted = Asn1Formatter.format(input, shallow);
		// re-indented line by line, nothing is expanded
		Assertions.assertEquals(input, formatted);
	}

	@Test
	void testHugeIndentWidthIsClamped() {
		String formatted = Asn1Formatter.format("A ::= SEQUENCE {\n a INTEGER\n}",
				new FormatterConfig(Integer.MAX_VALUE, 100, false));
		Assertions.assertEquals(lines(
				"A ::= SEQUENCE {",
				"        a INTEGER",
				"}"), formatted);
	}

	@Test
	void testHugeIndentWidthInFallbackIsClamped() {
		String formatted = Asn1Formatter.format("A ::= SEQUENCE {\na INTEGER",
				new FormatterConfig(1 << 30, Integer.MAX_VALUE, true));
		Assertions.assertEquals("A ::= SEQUENCE {\n        a INTEGER", formatted);
	}

	// --- properties over samples ---

	@Test
	void testIdempotence() {
		for (String sample : SAMPLES) {
			String once = Asn1Formatter.format(sample);
			Assertions.assertEquals(once, Asn1Formatter.format(once), "not idempotent for: " + sample);
		}
	}

	@Test
	void testIdempotenceWithWrapping() {
		FormatterConfig config = new FormatterConfig(2, 30, true);
		for (String sample : SAMPLES) {
			String once = Asn1Formatter.format(sample, config);
			Assertions.assertEquals(once, Asn1Formatter.format(once, config), "not idempotent for: " + sample);
		}
	}

	@Test
	void testBraceBalanceIsPreserved() {
		for (String sample : SAMPLES) {
			Assertions.assertEquals(braceBalance(sample), braceBalance(Asn1Formatter.format(sample)),
					"brace balance changed for: " + sample);
		}
	}

	@Test
	void testCommentsSurvive() {
		for (String sample : SAMPLES) {
			String formatted = Asn1Formatter.format(sample);
			for (String comment : Arrays.asList("-- header", "-- record", "-- the name", "-- standalone",
					"-- years", "-* block", "comment *-")) {
				if (sample.contains(comment)) {
					Assertions.assertTrue(formatted.contains(comment), comment + " lost in: " + sample);
				}
			}
		}
	}

	@Test
	void testFieldCountIsPreserved() {
		String input = "R ::= SEQUENCE { a INTEGER, b BOOLEAN,\n c NULL, d SEQUENCE { e INTEGER, f INTEGER } }";
		String formatted = Asn1Formatter.format(input);
		for (String field : Arrays.asList("a INTEGER", "b BOOLEAN", "c NULL", "e INTEGER", "f INTEGER")) {
			Assertions.assertEquals(1, count(formatted, field), field);
		}
	}

	private static int braceBalance(String text) {
		int open = count(text, "{");
		int close = count(text, "}");
		return open - close;
	}

	private static int count(String text, String needle) {
		int count = 0;
		int index = text.indexOf(needle);
		while (index >= 0) {
			count++;
			index = text.indexOf(needle, index + needle.length());
		}
		return count;
	}
}
