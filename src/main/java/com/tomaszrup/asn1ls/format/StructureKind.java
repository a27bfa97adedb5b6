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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Body kind of a type definition. Everything that is not one of the four
 * brace-delimited constructs is {@link #PRIMITIVE}.
 */
public enum StructureKind {
	SEQUENCE,
	SET,
	CHOICE,
	ENUMERATED,
	PRIMITIVE;

	private static final Pattern TRAILING_KEYWORD = Pattern
			.compile("(?<![\\w-])(SEQUENCE|SET|CHOICE|ENUMERATED)\\s*$");

	/**
	 * Returns the structure kind named by the last word of a header such as
	 * {@code "SEQUENCE"}, {@code "[0] IMPLICIT SET"} or
	 * {@code "SEQUENCE SIZE (1..4) OF CHOICE"}, or {@code null} when the
	 * header does not end with a structure keyword.
	 */
	public static StructureKind fromHeader(String header) {
		if (header == null) {
			return null;
		}
		Matcher matcher = TRAILING_KEYWORD.matcher(header);
		if (!matcher.find()) {
			return null;
		}
		return valueOf(matcher.group(1));
	}
}
