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

package org.tableconv.goConverter.converter.frontend;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.tableconv.goConverter.converter.errors.SourceFileContents;
import org.tableconv.goConverter.converter.errors.SyntaxError;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/**
 * The tokens of a Go source file, including whitespace and comments.
 * ANTLR numbers characters by code point; the syntax tree and the edits use
 * offsets into the Java string, which differ after a character outside
 * the Basic Multilingual Plane.  This class translates between the two.
 */
public class GoSourceTokens {
    public final SourceFileContents contents;
    public final CommonTokenStream stream;
    /** Offset in the text of each code point, and of the end of the text.
     * Null if every code point is a single char. */
    @Nullable
    final int[] offsets;
    /** Offset of the first character of each token. */
    final int[] starts;

    /** Tokenize a source file.
     * @throws SyntaxError if the text contains a character sequence which is not a Go token. */
    public GoSourceTokens(SourceFileContents contents) {
        this.contents = contents;
        this.offsets = codePointOffsets(contents.text);
        GoLexer lexer = new GoLexer(CharStreams.fromString(contents.text, contents.sourceFileName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(this.errorListener());
        this.stream = new CommonTokenStream(lexer);
        this.stream.fill();
        List<Token> tokens = this.stream.getTokens();
        this.starts = new int[tokens.size()];
        for (int i = 0; i < tokens.size(); i++)
            this.starts[i] = this.startOf(tokens.get(i));
    }

    @Nullable
    static int[] codePointOffsets(String text) {
        int count = text.codePointCount(0, text.length());
        if (count == text.length())
            return null;
        int[] result = new int[count + 1];
        int offset = 0;
        for (int i = 0; i < count; i++) {
            result[i] = offset;
            offset += Character.charCount(text.codePointAt(offset));
        }
        result[count] = text.length();
        return result;
    }

    /** Offset in the text of the code point with the specified index. */
    public int offsetOf(int codePointIndex) {
        if (this.offsets == null)
            return codePointIndex;
        return this.offsets[Math.min(codePointIndex, this.offsets.length - 1)];
    }

    public int startOf(Token token) {
        return this.offsetOf(token.getStartIndex());
    }

    /** Offset just past the token. */
    public int endOf(Token token) {
        if (token.getType() == Token.EOF)
            return this.startOf(token);
        return this.offsetOf(token.getStopIndex() + 1);
    }

    public List<Token> getTokens() {
        return this.stream.getTokens();
    }

    public Token get(int index) {
        return this.stream.get(index);
    }

    /** Index of the token containing the character at offset.
     * The offset just past the text belongs to the EOF token. */
    public int tokenAt(int offset) {
        int index = Arrays.binarySearch(this.starts, offset);
        if (index < 0)
            index = -index - 2;
        return Math.max(index, 0);
    }

    /** Reports the first lexical or syntax error as a {@link SyntaxError}. */
    public BaseErrorListener errorListener() {
        return new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, @Nullable Object offendingSymbol,
                                    int line, int charPositionInLine, String msg,
                                    @Nullable RecognitionException e) {
                int start;
                int end;
                if (offendingSymbol instanceof Token) {
                    Token token = (Token) offendingSymbol;
                    start = GoSourceTokens.this.startOf(token);
                    end = GoSourceTokens.this.endOf(token);
                } else if (recognizer instanceof Lexer) {
                    start = GoSourceTokens.this.offsetOf(((Lexer) recognizer)._tokenStartCharIndex);
                    end = start + 1;
                } else {
                    start = 0;
                    end = 0;
                }
                SourceFileContents contents = GoSourceTokens.this.contents;
                throw new SyntaxError(msg, contents.rangeOf(start, Math.max(end, start + 1)));
            }
        };
    }
}
