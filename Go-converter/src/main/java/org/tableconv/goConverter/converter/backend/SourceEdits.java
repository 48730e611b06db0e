/*
 * Copyright 2026 The go-table-converter Authors
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

package org.tableconv.goConverter.converter.backend;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStreamRewriter;
import org.tableconv.goConverter.converter.errors.InternalConverterError;
import org.tableconv.goConverter.converter.frontend.GoSourceTokens;
import org.tableconv.goConverter.ir.IGoNode;
import org.tableconv.util.Utilities;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Text edits recorded against the original contents of a source file.
 * Edits never overlap; they are applied all at once when the file is printed,
 * so the offsets of the syntax tree remain valid until then.
 * Edits are expressed as character ranges and applied to the file's token stream
 * with a {@link TokenStreamRewriter}. */
public class SourceEdits {
    final GoSourceTokens tokens;
    final String original;
    final List<SourceEdit> edits;

    public SourceEdits(GoSourceTokens tokens) {
        this.tokens = tokens;
        this.original = tokens.contents.text;
        this.edits = new ArrayList<>();
    }

    void add(SourceEdit edit) {
        Utilities.enforce(0 <= edit.start() && edit.start() <= edit.end()
                && edit.end() <= this.original.length(), "Edit out of bounds " + edit);
        this.edits.add(edit);
    }

    public void replace(int start, int end, String text) {
        this.add(new SourceEdit(start, end, text));
    }

    public void replace(IGoNode node, String text) {
        this.replace(node.getStart(), node.getEnd(), text);
    }

    public void insert(int position, String text) {
        this.add(new SourceEdit(position, position, text));
    }

    public void delete(int start, int end) {
        this.add(new SourceEdit(start, end, ""));
    }

    public boolean isEmpty() {
        return this.edits.isEmpty();
    }

    public int size() {
        return this.edits.size();
    }

    public List<SourceEdit> getEdits() {
        return this.edits;
    }

    int skipBlanks(int position) {
        int i = position;
        while (i < this.original.length() && isBlank(this.original.charAt(i)))
            i++;
        return i;
    }

    /** Offset of the start of the line containing position. */
    int lineStart(int position) {
        return this.original.lastIndexOf('\n', position - 1) + 1;
    }

    static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r';
    }

    /** If the text after 'end' up to the line end holds only an optional separator,
     * blanks and an optional line comment, return the offset just past the line end;
     * otherwise return -1. */
    int restOfLineIsTrivia(int end) {
        int i = end;
        int length = this.original.length();
        while (i < length && isBlank(this.original.charAt(i)))
            i++;
        if (i < length && (this.original.charAt(i) == ',' || this.original.charAt(i) == ';'))
            i++;
        while (i < length && isBlank(this.original.charAt(i)))
            i++;
        if (this.original.startsWith("//", i)) {
            int newline = this.original.indexOf('\n', i);
            return newline < 0 ? length : newline + 1;
        }
        if (i == length)
            return length;
        if (this.original.charAt(i) == '\n')
            return i + 1;
        return -1;
    }

    /** True if only blanks precede position on its line. */
    boolean startsLine(int position) {
        for (int i = this.lineStart(position); i < position; i++)
            if (!isBlank(this.original.charAt(i)))
                return false;
        return true;
    }

    /**
     * Delete one element of a list of siblings: composite literal elements,
     * struct fields, or names in an identifier list.
     * @param siblings    All elements of the list, in source order.
     * @param index       Index of the element to delete.
     * @param wholeLines  If true and the element is alone on its line, the line is
     *                    deleted, including a trailing comment.  Otherwise
     *                    the element is deleted with the separator which links
     *                    it to its neighbor.
     */
    public void deleteElement(List<? extends IGoNode> siblings, int index, boolean wholeLines) {
        IGoNode node = siblings.get(index);
        if (wholeLines && this.startsLine(node.getStart())) {
            int lineEnd = this.restOfLineIsTrivia(node.getEnd());
            if (lineEnd >= 0) {
                this.delete(this.lineStart(node.getStart()), lineEnd);
                return;
            }
        }
        if (index + 1 < siblings.size()) {
            this.delete(node.getStart(), siblings.get(index + 1).getStart());
        } else if (index > 0) {
            this.delete(siblings.get(index - 1).getEnd(), node.getEnd());
        } else {
            // The list becomes empty: 'struct{ a int; }' prints as 'struct{}'
            int start = node.getStart();
            while (start > 0 && isBlank(this.original.charAt(start - 1)))
                start--;
            int end = this.skipBlanks(node.getEnd());
            if (end < this.original.length() && (this.original.charAt(end) == ',' || this.original.charAt(end) == ';'))
                end = this.skipBlanks(end + 1);
            this.delete(start, end);
        }
    }

    List<SourceEdit> sorted() {
        List<SourceEdit> sorted = new ArrayList<>(this.edits);
        // Stable: insertions at the same position keep the order in which they were made
        sorted.sort(Comparator.comparingInt(SourceEdit::start)
                .thenComparing(e -> !e.isInsertion()));
        int copied = 0;
        for (SourceEdit edit: sorted) {
            if (edit.start() < copied)
                throw new InternalConverterError("Overlapping edits at offset " + edit.start() + ": " + edit);
            copied = edit.end();
        }
        return sorted;
    }

    /** A run of tokens and the edits which fall inside it. */
    static final class TokenRange {
        final int first;
        int last;
        final List<SourceEdit> edits;

        TokenRange(int first, int last) {
            this.first = first;
            this.last = last;
            this.edits = new ArrayList<>();
        }
    }

    /** Group the edits by the tokens they touch.  An insertion belongs to
     * the token which starts at its position; a deletion spans the tokens
     * which contain its first and last character.  Ranges which share a token
     * are merged, since the rewriter does not allow overlapping replacements. */
    List<TokenRange> tokenRanges(List<SourceEdit> sorted) {
        List<TokenRange> result = new ArrayList<>();
        for (SourceEdit edit: sorted) {
            int first = this.tokens.tokenAt(edit.start());
            int last = edit.isInsertion() ? first : this.tokens.tokenAt(edit.end() - 1);
            TokenRange current = result.isEmpty() ? null : Utilities.last(result);
            if (current == null || first > current.last) {
                current = new TokenRange(first, last);
                result.add(current);
            } else {
                current.last = Math.max(current.last, last);
            }
            current.edits.add(edit);
        }
        return result;
    }

    /** The text of the tokens in a range, with the range's edits applied. */
    String rewrite(TokenRange range) {
        int start = this.tokens.startOf(this.tokens.get(range.first));
        int end = this.tokens.endOf(this.tokens.get(range.last));
        StringBuilder builder = new StringBuilder();
        int copied = start;
        for (SourceEdit edit: range.edits) {
            builder.append(this.original, copied, edit.start());
            builder.append(edit.text());
            copied = edit.end();
        }
        builder.append(this.original, copied, end);
        return builder.toString();
    }

    /** The original text with all edits applied. */
    public String apply() {
        TokenStreamRewriter rewriter = new TokenStreamRewriter(this.tokens.stream);
        for (TokenRange range: this.tokenRanges(this.sorted())) {
            String text = this.rewrite(range);
            if (this.tokens.get(range.first).getType() == Token.EOF)
                rewriter.insertBefore(range.first, text);
            else
                rewriter.replace(range.first, range.last, text);
        }
        return rewriter.getText();
    }

    @Override
    public String toString() {
        return this.edits.toString();
    }
}
