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

/**
 * Raised when the structural parser or printer cannot make sense of the
 * input: an unmatched brace, a malformed type-definition header, or an
 * exceeded iteration or nesting ceiling. {@link Asn1Formatter} recovers from
 * it by re-indenting the input instead.
 */
public class StructuralFault extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int line;

	public StructuralFault(String message, int line) {
		super(message);
		this.line = line;
	}

	/**
	 * Zero-based source line the fault was detected at, or -1 if unknown.
	 */
	public int getLine() {
		return line;
	}
}
