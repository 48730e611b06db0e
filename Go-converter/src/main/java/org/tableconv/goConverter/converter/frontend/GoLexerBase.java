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

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.WritableToken;

/**
 * Base class of the generated {@link GoLexer}: implements automatic semicolon insertion.
 * A newline which follows a token that may end a statement is moved to the
 * default channel and retyped as {@link GoLexer#EOS}.  A block comment spanning
 * several lines acts as a newline.  The token keeps its text, so the token
 * stream still reproduces the source.
 */
public abstract class GoLexerBase extends Lexer {
    /** Type of the last token emitted on the default channel. */
    int lastType = Token.INVALID_TYPE;

    protected GoLexerBase(CharStream input) {
        super(input);
    }

    @Override
    public Token nextToken() {
        Token next = super.nextToken();
        if (next.getChannel() == Token.DEFAULT_CHANNEL) {
            this.lastType = next.getType();
        } else if (breaksLine(next) && endsStatement(this.lastType)) {
            WritableToken semicolon = (WritableToken) next;
            semicolon.setType(GoLexer.EOS);
            semicolon.setChannel(Token.DEFAULT_CHANNEL);
            this.lastType = GoLexer.EOS;
        }
        return next;
    }

    @Override
    public void reset() {
        super.reset();
        this.lastType = Token.INVALID_TYPE;
    }

    static boolean breaksLine(Token token) {
        switch (token.getType()) {
            case GoLexer.TERMINATOR:
                return true;
            case GoLexer.COMMENT:
                return token.getText().indexOf('\n') >= 0;
            default:
                return false;
        }
    }

    /** True if a line ending after a token of this type ends the statement. */
    static boolean endsStatement(int type) {
        switch (type) {
            case GoLexer.IDENTIFIER:
            case GoLexer.DECIMAL_LIT:
            case GoLexer.BINARY_LIT:
            case GoLexer.OCTAL_LIT:
            case GoLexer.HEX_LIT:
            case GoLexer.FLOAT_LIT:
            case GoLexer.IMAGINARY_LIT:
            case GoLexer.RUNE_LIT:
            case GoLexer.RAW_STRING_LIT:
            case GoLexer.INTERPRETED_STRING_LIT:
            case GoLexer.BREAK:
            case GoLexer.CONTINUE:
            case GoLexer.FALLTHROUGH:
            case GoLexer.RETURN:
            case GoLexer.PLUS_PLUS:
            case GoLexer.MINUS_MINUS:
            case GoLexer.R_PAREN:
            case GoLexer.R_BRACKET:
            case GoLexer.R_CURLY:
                return true;
            default:
                return false;
        }
    }
}
