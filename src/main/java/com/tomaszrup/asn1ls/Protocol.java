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
package com.tomaszrup.asn1ls;

/**
 * Method names of the custom JSON-RPC messages this server understands in
 * addition to the standard protocol.
 */
public final class Protocol {

	private Protocol() {
	}

	/** Formats the ASN.1 fenced block of a Markdown document that encloses a line. */
	public static final String REQUEST_FORMAT_CODE_BLOCK = "asn1/formatCodeBlock";

	/** Section name of the server settings in {@code workspace/didChangeConfiguration}. */
	public static final String SETTINGS_SECTION = "asn1";
}
