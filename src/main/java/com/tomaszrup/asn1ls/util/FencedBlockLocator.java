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
package com.tomaszrup.asn1ls.util;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Finds ASN.1 fenced code blocks in Markdown text.
 *
 * <p>A block opens on a line that, trimmed, starts with {@value #ASN1_FENCE}
 * and closes on the next line that, trimmed, is exactly {@value #FENCE}.
 * Fenced blocks in other languages are skipped as a whole. A block that is
 * never closed is not reported.</p>
 */
public final class FencedBlockLocator {

	public static final String FENCE = "```";
	public static final String ASN1_FENCE = "```asn1";

	private FencedBlockLocator() {
	}

	/** Line numbers of one fenced block. Content lines lie strictly between the fences. */
	public static final class Block {
		private final int openLine;
		private final int closeLine;

		public Block(int openLine, int closeLine) {
			this.openLine = openLine;
			this.closeLine = closeLine;
		}

		public int getOpenLine() {
			return openLine;
		}

		public int getCloseLine() {
			return closeLine;
		}

		public int getFirstContentLine() {
			return openLine + 1;
		}

		public boolean containsContentLine(int line) {
			return line > openLine && line < closeLine;
		}

		/**
		 * Returns the content lines joined with {@code \n}, each followed by a
		 * newline.
		 */
		public String content(String[] lines) {
			StringBuilder sb = new StringBuilder();
			for (int i = openLine + 1; i < closeLine; i++) {
				sb.append(lines[i]).append('\n');
			}
			return sb.toString();
		}

		@Override
		public String toString() {
			return "Block[" + openLine + ".." + closeLine + "]";
		}
	}

	public static boolean isMarkdown(URI uri, String languageId) {
		if (languageId != null && "markdown".equalsIgnoreCase(languageId)) {
			return true;
		}
		if (uri == null || uri.getPath() == null) {
			return false;
		}
		String path = uri.getPath().toLowerCase(Locale.ROOT);
		return path.endsWith(".md") || path.endsWith(".markdown");
	}

	public static List<Block> findBlocks(String text) {
		if (text == null || text.isEmpty()) {
			return Collections.emptyList();
		}
		String[] lines = text.split("\n", -1);
		List<Block> blocks = new ArrayList<>();
		int i = 0;
		while (i < lines.length) {
			String trimmed = lines[i].trim();
			if (!trimmed.startsWith(FENCE)) {
				i++;
				continue;
			}
			int close = findClosingFence(lines, i + 1);
			if (close < 0) {
				break;
			}
			if (trimmed.startsWith(ASN1_FENCE)) {
				blocks.add(new Block(i, close));
			}
			i = close + 1;
		}
		return blocks;
	}

	/**
	 * Returns the ASN.1 block whose content contains {@code line}, or
	 * {@code null} when the line is a fence, lies outside every block or
	 * sits in a block of another language.
	 */
	public static Block findEnclosing(String text, int line) {
		for (Block block : findBlocks(text)) {
			if (block.containsContentLine(line)) {
				return block;
			}
			if (block.getOpenLine() > line) {
				break;
			}
		}
		return null;
	}

	private static int findClosingFence(String[] lines, int from) {
		for (int i = from; i < lines.length; i++) {
			if (FENCE.equals(lines[i].trim())) {
				return i;
			}
		}
		return -1;
	}
}
