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

import java.util.List;

import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SymbolKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.asn1ls.format.StructureKind;

class DocumentSymbolProviderTests {

	private static final String MODULE = String.join("\n",
			"MyModule DEFINITIONS ::= BEGIN",
			"",
			"Person ::= SEQUENCE {",
			"  name UTF8String,",
			"  address SEQUENCE {",
			"    street UTF8String",
			"  }",
			"}",
			"Color ::= ENUMERATED { red(0), green(1) }",
			"Age ::= INTEGER",
			"",
			"END");

	@Test
	void testModuleContainsDefinitions() {
		List<DocumentSymbol> symbols = DocumentSymbolProvider.buildSymbols(MODULE);
		Assertions.assertEquals(1, symbols.size());
		DocumentSymbol module = symbols.get(0);
		Assertions.assertEquals("MyModule", module.getName());
		Assertions.assertEquals(SymbolKind.Module, module.getKind());
		Assertions.assertEquals(new Range(new Position(0, 0), new Position(11, 3)), module.getRange());
		Assertions.assertEquals(3, module.getChildren().size());
	}

	@Test
	void testStructuredDefinition() {
		DocumentSymbol person = DocumentSymbolProvider.buildSymbols(MODULE).get(0).getChildren().get(0);
		Assertions.assertEquals("Person", person.getName());
		Assertions.assertEquals(SymbolKind.Struct, person.getKind());
		Assertions.assertEquals("SEQUENCE", person.getDetail());
		Assertions.assertEquals(new Range(new Position(2, 0), new Position(7, 1)), person.getRange());
		Assertions.assertEquals(new Range(new Position(2, 0), new Position(2, 6)), person.getSelectionRange());

		Assertions.assertEquals(2, person.getChildren().size());
		DocumentSymbol name = person.getChildren().get(0);
		Assertions.assertEquals("name", name.getName());
		Assertions.assertEquals(SymbolKind.Field, name.getKind());
		Assertions.assertEquals("name UTF8String", name.getDetail());
		Assertions.assertEquals(new Range(new Position(3, 2), new Position(3, 6)), name.getSelectionRange());

		DocumentSymbol address = person.getChildren().get(1);
		Assertions.assertEquals("address", address.getName());
		Assertions.assertEquals(SymbolKind.Field, address.getKind());
		Assertions.assertEquals(1, address.getChildren().size());
		Assertions.assertEquals("street", address.getChildren().get(0).getName());
	}

	@Test
	void testEnumeratedAndPrimitiveDefinitions() {
		List<DocumentSymbol> children = DocumentSymbolProvider.buildSymbols(MODULE).get(0).getChildren();
		DocumentSymbol color = children.get(1);
		Assertions.assertEquals(SymbolKind.Enum, color.getKind());
		Assertions.assertEquals(2, color.getChildren().size());
		Assertions.assertEquals("red", color.getChildren().get(0).getName());
		Assertions.assertEquals(SymbolKind.EnumMember, color.getChildren().get(0).getKind());
		Assertions.assertEquals("green", color.getChildren().get(1).getName());

		DocumentSymbol age = children.get(2);
		Assertions.assertEquals("Age", age.getName());
		Assertions.assertEquals(SymbolKind.TypeParameter, age.getKind());
		Assertions.assertEquals("PRIMITIVE", age.getDetail());
	}

	@Test
	void testDefinitionsOutsideAModule() {
		List<DocumentSymbol> symbols = DocumentSymbolProvider.buildSymbols("A ::= INTEGER\nB ::= CHOICE { x NULL }");
		Assertions.assertEquals(2, symbols.size());
		Assertions.assertEquals(SymbolKind.TypeParameter, symbols.get(0).getKind());
		Assertions.assertEquals(SymbolKind.Class, symbols.get(1).getKind());
		Assertions.assertEquals("x", symbols.get(1).getChildren().get(0).getName());
	}

	@Test
	void testUnparseableSourceHasNoOutline() {
		Assertions.assertTrue(DocumentSymbolProvider.buildSymbols("A ::= SEQUENCE {\n  a INTEGER").isEmpty());
	}

	@Test
	void testSymbolKindMapping() {
		Assertions.assertEquals(SymbolKind.Struct, DocumentSymbolProvider.symbolKind(StructureKind.SET));
		Assertions.assertEquals(SymbolKind.TypeParameter, DocumentSymbolProvider.symbolKind(null));
	}
}
