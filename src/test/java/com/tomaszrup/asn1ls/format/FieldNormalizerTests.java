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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class FieldNormalizerTests {

	@Test
	void testNormalizeCollapsesAndStripsTrailingCommas() {
		Assertions.assertEquals("name UTF8String", FieldNormalizer.normalize("  name    UTF8String ,, "));
		Assertions.assertEquals("a INTEGER", FieldNormalizer.normalize("a\n   INTEGER"));
		Assertions.assertEquals("", FieldNormalizer.normalize(null));
		Assertions.assertEquals("", FieldNormalizer.normalize(" , "));
	}

	@Test
	void testNormalizeKeepsStringContent() {
		Assertions.assertEquals("label UTF8String DEFAULT \"a   b\"",
				FieldNormalizer.normalize("label   UTF8String DEFAULT   \"a   b\","));
	}

	@Test
	void testNormalizeIsIdempotent() {
		String once = FieldNormalizer.normalize("  x [0]   IMPLICIT  SEQUENCE  OF  INTEGER ,");
		Assertions.assertEquals(once, FieldNormalizer.normalize(once));
	}

	@Test
	void testCollapseKeepsPunctuation() {
		Assertions.assertEquals("a ,", FieldNormalizer.collapse(" a   , "));
		Assertions.assertEquals("", FieldNormalizer.collapse(null));
	}

	@Test
	void testNormalizeOperator() {
		Assertions.assertEquals("A ::= B", FieldNormalizer.normalizeOperator("A::=B"));
		Assertions.assertEquals("A ::= B", FieldNormalizer.normalizeOperator("A    ::=   B"));
		Assertions.assertEquals("no operator", FieldNormalizer.normalizeOperator("no operator"));
		Assertions.assertNull(FieldNormalizer.normalizeOperator(null));
	}

	@Test
	void testNormalizeOperatorSkipsStringsAndComments() {
		Assertions.assertEquals("greeting UTF8String ::= \"a::=b\"",
				FieldNormalizer.normalizeOperator("greeting UTF8String::=\"a::=b\""));
		Assertions.assertEquals("A ::= \"x  ::=  y\" -- b::=c",
				FieldNormalizer.normalizeOperator("A::=\"x  ::=  y\" -- b::=c"));
		Assertions.assertEquals("T ::= INTEGER -* a::=b *- ::= 1",
				FieldNormalizer.normalizeOperator("T::=INTEGER -* a::=b *-::=1"));
	}

	@Test
	void testNormalizeLineKeepsCommentText() {
		Assertions.assertEquals("Foo ::= INTEGER -- keep  this",
				FieldNormalizer.normalizeLine("Foo   ::=INTEGER     -- keep  this"));
		Assertions.assertEquals("-- only", FieldNormalizer.normalizeLine("   -- only"));
		Assertions.assertEquals("END", FieldNormalizer.normalizeLine("  END  "));
	}
}
