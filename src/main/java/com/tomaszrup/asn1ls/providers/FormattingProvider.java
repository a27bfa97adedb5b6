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
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;

import com.tomaszrup.asn1ls.format.Asn1Formatter;
import com.tomaszrup.asn1ls.format.FormatterConfig;
import com.tomaszrup.asn1ls.util.FencedBlockLocator;

/**
 * Turns formatter output into {@code TextEdit}s.
 *
 * <p>An ASN.1 document is formatted as a whole. In a Markdown document each
 * ASN.1 fenced block is formatted on its own and only the lines between its
 * fences are edited. Text that is already in canonical form produces no
 * edit. All input is expected to use {@code \n} line endings.</p>
 */
public class FormattingProvider {

	public CompletableFuture<List<TextEdit>> provideFormatting(String sourceText, boolean markdown,
			FormatterConfig config) {
		if (sourceText == null || sourceText.isEmpty()) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}
		if (markdown) {
			List<TextEdit> edits = new ArrayList<>();
			String[] lines = sourceText.split("\n", -1);
			for (FencedBlockLocator.Block block : FencedBlockLocator.findBlocks(sourceText)) {
				edits.addAll(formatBlock(lines, block, config));
			}
			return CompletableFuture.completedFuture(edits);
		}
		String formatted = Asn1Formatter.format(sourceText, config);
		if (formatted.equals(sourceText)) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}
		return CompletableFuture.completedFuture(computeMinimalEdits(sourceText, formatted));
	}

	/**
	 * Formats the ASN.1 fenced block whose content contains {@code line}.
	 * Returns no edits when the line is outside every such block.
	 */
	public CompletableFuture<List<TextEdit>> provideCodeBlockFormatting(String sourceText, int line,
			FormatterConfig config) {
		if (sourceText == null || sourceText.isEmpty()) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}
		FencedBlockLocator.Block block = FencedBlockLocator.findEnclosing(sourceText, line);
		if (block == null) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}
		return CompletableFuture.completedFuture(formatBlock(sourceText.split("\n", -1), block, config));
	}

	private static List<TextEdit> formatBlock(String[] lines, FencedBlockLocator.Block block,
			FormatterConfig config) {
		String content = block.content(lines);
		if (content.isBlank()) {
			return Collections.emptyList();
		}
		String formatted = Asn1Formatter.format(content, config);
		if (formatted.equals(content)) {
			return Collections.emptyList();
		}
		List<TextEdit> edits = computeMinimalEdits(content, formatted);
		for (TextEdit edit : edits) {
			edit.setRange(shift(edit.getRange(), block.getFirstContentLine()));
		}
		return edits;
	}

	private static Range shift(Range range, int lines) {
		return new Range(
				new Position(range.getStart().getLine() + lines, range.getStart().getCharacter()),
				new Position(range.getEnd().getLine() + lines, range.getEnd().getCharacter()));
	}

	/**
	 * Compute minimal line-level TextEdits between the original and formatted text.
	 */
	public static List<TextEdit> computeMinimalEdits(String original, String formatted) {
		String[] origLines = original.split("\\n", -1);
		String[] fmtLines = formatted.split("\\n", -1);
		List<TextEdit> edits = new ArrayList<>();

		int top = findFirstDifferentLine(origLines, fmtLines);
		if (top == origLines.length && top == fmtLines.length) {
			return edits;
		}
		int[] bottoms = findLastDifferentLine(origLines, fmtLines, top);
		String replacement = buildReplacementText(fmtLines, top, bottoms[1]);
		edits.add(createMinimalEdit(origLines, top, bottoms[0], bottoms[1], replacement));
		return edits;
	}

	private static int findFirstDifferentLine(String[] origLines, String[] fmtLines) {
		int top = 0;
		int minLen = Math.min(origLines.length, fmtLines.length);
		while (top < minLen && origLines[top].equals(fmtLines[top])) {
			top++;
		}
		return top;
	}

	private static int[] findLastDifferentLine(String[] origLines, String[] fmtLines, int top) {
		int origBottom = origLines.length - 1;
		int fmtBottom = fmtLines.length - 1;
		while (origBottom >= top && fmtBottom >= top && origLines[origBottom].equals(fmtLines[fmtBottom])) {
			origBottom--;
			fmtBottom--;
		}
		return new int[] {origBottom, fmtBottom};
	}

	private static String buildReplacementText(String[] fmtLines, int top, int fmtBottom) {
		StringBuilder replacement = new StringBuilder();
		for (int j = top; j <= fmtBottom; j++) {
			if (j > top) {
				replacement.append("\n");
			}
			replacement.append(fmtLines[j]);
		}
		return replacement.toString();
	}

	/**
	 * A range with {@code top > origBottom} is a pure insertion (or, when
	 * {@code fmtBottom < top}, a pure deletion of line breaks) anchored at
	 * the end of the previous line.
	 */
	private static TextEdit createMinimalEdit(String[] origLines, int top, int origBottom, int fmtBottom,
			String replacementText) {
		String adjustedReplacement = replacementText;
		Position start;
		Position end;
		if (top > origBottom) {
			if (top == 0) {
				start = new Position(0, 0);
				end = new Position(0, 0);
				if (fmtBottom >= top) {
					adjustedReplacement = adjustedReplacement + "\n";
				}
			} else {
				start = new Position(top - 1, origLines[top - 1].length());
				end = start;
				if (fmtBottom >= top) {
					adjustedReplacement = "\n" + adjustedReplacement;
				}
			}
		} else if (fmtBottom < top) {
			// lines removed without replacement, including their line breaks
			if (top == 0) {
				start = new Position(0, 0);
				end = new Position(origBottom + 1, 0);
			} else {
				start = new Position(top - 1, origLines[top - 1].length());
				end = new Position(origBottom, origLines[origBottom].length());
			}
			adjustedReplacement = "";
		} else {
			start = new Position(top, 0);
			end = new Position(origBottom, origLines[origBottom].length());
		}
		return new TextEdit(new Range(start, end), adjustedReplacement);
	}
}
