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

class StructuralParserTests {

	private static DefinitionNode parse(String text) {
		return new StructuralParser(FormatterConfig.defaults()).parse(text);
	}

	@Test
	void testModuleTree() {
		DefinitionNode root = parse(String.join("\n",
				"MyModule DEFINITIONS ::= BEGIN",
				"",
				"Person ::= SEQUENCE {",
				"  name UTF8String, -- n",
				"  age INTEGER",
				"}",
				"Age ::= INTEGER",
				"END"));
		List<DefinitionNode> children = root.getChildren();
		Assertions.assertEquals(5, children.size());
		Assertions.assertEquals(NodeKind.MODULE, children.get(0).getKind());
		Assertions.assertEquals("MyModule", children.get(0).getName());
		Assertions.assertTrue(children.get(1).isBlank());
		Assertions.assertEquals(NodeKind.END, children.get(4).getKind());
		Assertions.assertEquals(7, children.get(4).getStartLine());

		DefinitionNode person = children.get(2);
		Assertions.assertEquals(NodeKind.TYPE_DEFINITION, person.getKind());
		Assertions.assertEquals("Person", person.getName());
		Assertions.assertEquals(StructureKind.SEQUENCE, person.getStructureKind());
		Assertions.assertEquals("Person ::= SEQUENCE", person.getHeader());
		Assertions.assertFalse(person.isSingleLine());
		Assertions.assertEquals(2, person.getStartLine());
		Assertions.assertEquals(5, person.getEndLine());
		Assertions.assertEquals(2, person.getChildren().size());
		DefinitionNode name = person.getChildren().get(0);
		Assertions.assertEquals(NodeKind.FIELD, name.getKind());
		Assertions.assertEquals("name", name.getName());
		Assertions.assertEquals("name UTF8String", name.getRawContent());
		Assertions.assertEquals("-- n", name.getTrailingComment());
		Assertions.assertEquals(4, person.getChildren().get(1).getStartLine());

		DefinitionNode age = children.get(3);
		Assertions.assertEquals(StructureKind.PRIMITIVE, age.getStructureKind());
		Assertions.assertFalse(age.isStructured());
		Assertions.assertEquals("Age ::= INTEGER", age.getRawContent());
		Assertions.assertEquals(6, age.getStartLine());
	}

	@Test
	void testSingleLineDefinition() {
		DefinitionNode color = parse("Color ::= ENUMERATED { red, green }").getChildren().get(0);
		Assertions.assertTrue(color.isSingleLine());
		Assertions.assertEquals(StructureKind.ENUMERATED, color.getStructureKind());
		Assertions.assertEquals("Color ::= ENUMERATED", color.getHeader());
		Assertions.assertEquals(Arrays.asList("red", "green"), color.getInlineFields());
	}

	@Test
	void testNestedComponent() {
		DefinitionNode a = parse(String.join("\n",
				"A ::= SEQUENCE {",
				"  b [0] CHOICE {",
				"    c NULL",
				"  } OPTIONAL,",
				"  d INTEGER",
				"}")).getChildren().get(0);
		Assertions.assertEquals(2, a.getChildren().size());
		DefinitionNode b = a.getChildren().get(0);
		Assertions.assertEquals(NodeKind.TYPE_DEFINITION, b.getKind());
		Assertions.assertEquals("b", b.getName());
		Assertions.assertEquals(StructureKind.CHOICE, b.getStructureKind());
		Assertions.assertEquals("b [0] CHOICE", b.getHeader());
		Assertions.assertEquals("OPTIONAL", b.getTrailer());
		Assertions.assertEquals(1, b.getStartLine());
		Assertions.assertEquals(3, b.getEndLine());
		Assertions.assertEquals("c NULL", b.getChildren().get(0).getRawContent());
		Assertions.assertEquals("d INTEGER", a.getChildren().get(1).getRawContent());
	}

	@Test
	void testMultiLineBracedPrimitive() {
		DefinitionNode oid = parse("id-ce OBJECT IDENTIFIER ::= {\n  iso 2\n}").getChildren().get(0);
		Assertions.assertEquals("id-ce", oid.getName());
		Assertions.assertEquals(StructureKind.PRIMITIVE, oid.getStructureKind());
		Assertions.assertEquals(3, oid.getRawLines().size());
		Assertions.assertEquals(2, oid.getEndLine());
	}

	@Test
	void testHeaderCommentWithBraceOnNextLine() {
		DefinitionNode p = parse("P ::= SEQUENCE -- note\n{\n a INTEGER\n}").getChildren().get(0);
		Assertions.assertEquals(StructureKind.SEQUENCE, p.getStructureKind());
		Assertions.assertEquals("-- note", p.getHeaderComment());
		Assertions.assertEquals(3, p.getEndLine());
	}

	@Test
	void testBlockCommentContinuationIsVerbatim() {
		List<DefinitionNode> children = parse("-* first\n   second *-\nA ::= INTEGER").getChildren();
		Assertions.assertEquals(NodeKind.COMMENT, children.get(0).getKind());
		Assertions.assertFalse(children.get(0).isVerbatim());
		Assertions.assertTrue(children.get(1).isVerbatim());
		Assertions.assertEquals("   second *-", children.get(1).getRawContent());
		Assertions.assertEquals(NodeKind.TYPE_DEFINITION, children.get(2).getKind());
	}

	@Test
	void testUnmatchedBraceIsAFault() {
		StructuralFault fault = Assertions.assertThrows(StructuralFault.class,
				() -> parse("A ::= SEQUENCE {\n  a INTEGER"));
		Assertions.assertEquals(0, fault.getLine());
	}

	@Test
	void testMissingNameIsAFault() {
		Assertions.assertThrows(StructuralFault.class, () -> parse("  ::= INTEGER"));
	}

	@Test
	void testNestingDepthIsBounded() {
		FormatterConfig shallow = new FormatterConfig(2, 100, false, 4, 1);
		StructuralParser parser = new StructuralParser(shallow);
		Assertions.assertThrows(StructuralFault.class,
				() -> parser.parse("A ::= SEQUENCE {\n b SEQUENCE {\n  c NULL\n }\n}"));
	}

	@Test
	void testTightestIterationCeilingStillParsesEveryLine() {
		FormatterConfig tight = new FormatterConfig(2, 100, false, 1, 64);
		StringBuilder source = new StringBuilder();
		for (int i = 0; i < 300; i++) {
			source.append("A").append(i).append(" ::= INTEGER\n");
		}
		source.append("B ::= SEQUENCE {\n  x INTEGER,\n  y BOOLEAN\n}");
		DefinitionNode root = new StructuralParser(tight).parse(source.toString());
		Assertions.assertEquals(301, root.getChildren().size());
	}

	@Test
	void testCommentInsideInlineBraceGroupIsAFault() {
		Assertions.assertThrows(StructuralFault.class,
				() -> parse("A ::= SEQUENCE {\n  x INTEGER { low(0), -- l\n high(1) }\n}"));
	}
}
