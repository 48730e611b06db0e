/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.tableconv.goConverter.converter.errors;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Keep track of the contents of one source file: its text, and where its lines start.
 * Used to convert character offsets into line and column positions,
 * and to display source fragments in error messages. */
public class SourceFileContents {
    public final String sourceFileName;
    public final String text;
    final List<String> lines;
    /** Offset of the first character of each line. */
    final int[] lineStarts;

    public SourceFileContents(String sourceFileName, String text) {
        this.sourceFileName = sourceFileName;
        this.text = text;
        this.lines = new ArrayList<>();
        List<Integer> starts = new ArrayList<>();
        int lineStart = 0;
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                this.lines.add(stripCarriageReturn(text.substring(lineStart, i)));
                lineStart = i + 1;
                starts.add(lineStart);
            }
        }
        this.lines.add(stripCarriageReturn(text.substring(lineStart)));
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    static String stripCarriageReturn(String line) {
        if (line.endsWith("\r"))
            return line.substring(0, line.length() - 1);
        return line;
    }

    public static String newline() {
        return System.lineSeparator();
    }

    public int getLineCount() {
        return this.lines.size();
    }

    /** Position of the character at the specified offset. */
    public SourcePosition positionOf(int offset) {
        if (offset < 0 || offset > this.text.length())
            return SourcePosition.INVALID;
        int index = Arrays.binarySearch(this.lineStarts, offset);
        if (index < 0)
            index = -index - 2;
        return new SourcePosition(index + 1, offset - this.lineStarts[index] + 1, offset);
    }

    /** The range covering the characters between start (inclusive) and end (exclusive). */
    public SourcePositionRange rangeOf(int start, int end) {
        SourcePosition startPosition = this.positionOf(start);
        SourcePosition endPosition = this.positionOf(Math.max(start, end - 1));
        return new SourcePositionRange(startPosition, endPosition);
    }

    String lineNo(int no) {
        return String.format("%5d|", no + 1);
    }

    /** Get the source code fragment at the specified position,
     * decorated with line numbers and a ^^^ underline for single-line ranges. */
    public String getFragment(SourcePositionRange range) {
        if (!range.isValid())
            return "";
        int startLine = range.start.line - 1;
        int endLine = range.end.line - 1;
        if (startLine >= this.lines.size() || endLine >= this.lines.size())
            return "";
        StringBuilder result = new StringBuilder();
        if (range.isSingleLine()) {
            int startCol = range.start.column - 1;
            int endCol = range.end.column;
            result.append(this.lineNo(startLine))
                    .append(this.lines.get(startLine))
                    .append(newline())
                    .append(" ".repeat(startCol + 6))
                    .append("^".repeat(Math.max(1, endCol - startCol)))
                    .append(newline());
        } else if (endLine - startLine < 5) {
            for (int i = startLine; i <= endLine; i++) {
                result.append(this.lineNo(i))
                        .append(this.lines.get(i))
                        .append(newline());
            }
        } else {
            result.append(this.lineNo(startLine))
                    .append(this.lines.get(startLine))
                    .append(newline())
                    .append(this.lineNo(startLine + 1))
                    .append(this.lines.get(startLine + 1))
                    .append(newline())
                    .append("      ...")
                    .append(newline())
                    .append(this.lineNo(endLine))
                    .append(this.lines.get(endLine))
                    .append(newline());
        }
        return result.toString();
    }
}
