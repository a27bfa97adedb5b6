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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reserved words of the notation, shared by the formatter and the semantic
 * token highlighter.
 */
public final class Asn1Keywords {

	private static final List<String> KEYWORDS = Collections.unmodifiableList(Arrays.asList(
			// basic types
			"BOOLEAN", "INTEGER", "BIT", "OCTET", "NULL", "OBJECT", "REAL",
			"ENUMERATED", "EMBEDDED", "UTF8String", "RELATIVE-OID",
			// character string types
			"NumericString", "PrintableString", "TeletexString", "T61String",
			"VideotexString", "IA5String", "GraphicString", "VisibleString",
			"GeneralString", "UniversalString", "BMPString",
			// time types
			"UTCTime", "GeneralizedTime",
			// constructed types
			"SEQUENCE", "SET", "CHOICE", "STRING",
			// tagging
			"UNIVERSAL", "APPLICATION", "PRIVATE", "CONTEXT",
			"EXPLICIT", "IMPLICIT", "AUTOMATIC", "TAGS",
			// module definition
			"DEFINITIONS", "BEGIN", "END", "EXPORTS", "IMPORTS", "FROM",
			// constraints
			"SIZE", "WITH", "COMPONENT", "COMPONENTS", "PRESENT", "ABSENT",
			"OPTIONAL", "DEFAULT", "INCLUDES", "PATTERN",
			// set operations
			"UNION", "INTERSECTION", "EXCEPT", "ALL",
			// values
			"TRUE", "FALSE", "PLUS-INFINITY", "MINUS-INFINITY",
			"MIN", "MAX",
			// information objects
			"CLASS", "TYPE-IDENTIFIER", "ABSTRACT-SYNTAX", "INSTANCE",
			"SYNTAX", "UNIQUE", "CONSTRAINED", "CHARACTER",
			"PDV", "EXTERNAL", "BY", "OF", "IDENTIFIER"));

	private static final Set<String> EXACT = Collections.unmodifiableSet(new LinkedHashSet<>(KEYWORDS));

	private static final Set<String> UPPER = Collections.unmodifiableSet(KEYWORDS.stream()
			.map(k -> k.toUpperCase(Locale.ROOT))
			.collect(Collectors.<String, LinkedHashSet<String>>toCollection(LinkedHashSet::new)));

	private static final Set<String> STRUCTURE_KEYWORDS = Collections.unmodifiableSet(
			new LinkedHashSet<>(Arrays.asList("SEQUENCE", "SET", "CHOICE", "ENUMERATED")));

	private Asn1Keywords() {
	}

	public static List<String> all() {
		return KEYWORDS;
	}

	/**
	 * Exact, case-sensitive lookup.
	 */
	public static boolean isKeyword(String word) {
		return word != null && EXACT.contains(word);
	}

	/**
	 * Case-insensitive lookup, as used by the highlighter.
	 */
	public static boolean isKeywordIgnoreCase(String word) {
		return word != null && UPPER.contains(word.toUpperCase(Locale.ROOT));
	}

	public static boolean isStructureKeyword(String word) {
		return word != null && STRUCTURE_KEYWORDS.contains(word);
	}
}
