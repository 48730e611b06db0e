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

import org.antlr.v4.runtime.Token;
import org.junit.Assert;
import org.junit.Test;
import org.tableconv.goConverter.converter.errors.SourceFileContents;
import org.tableconv.goConverter.converter.errors.SyntaxError;
import org.tableconv.util.Linq;

import java.util.List;

public class GoLexerTests {
    static GoSourceTokens lex(String source) {
        return new GoSourceTokens(new SourceFileContents("lexer.go", source));
    }

    /** The tokens seen by the parser, without the final EOF. */
    static List<Token> tokenize(String source) {
        return Linq.where(lex(source).getTokens(),
                t -> t.getChannel() == Token.DEFAULT_CHANNEL && t.getType() != Token.EOF);
    }

    /** Token texts, with statement-ending newlines shown as 'NL'. */
    static String texts(String source) {
        List<String> texts = Linq.map(tokenize(source), t -> t.getType() == GoLexer.EOS ? "NL" : t.getText());
        return String.join(" ", texts);
    }

    @Test
    public void semicolonInsertion() {
        Assert.assertEquals("x := f ( ) NL return NL",
                texts("x := f()\nreturn\n"));
        // No semicolon after an operator or an opening brace
        Assert.assertEquals("if a && b {", texts("if a &&\nb {\n"));
        Assert.assertEquals("{ } NL", texts("{\n}\n"));
        // The end of the input ends the statement without a token
        Assert.assertEquals("a", texts("a"));
    }

    @Test
    public void commentsAreHidden() {
        Assert.assertEquals("a NL b NL", texts("a // first\nb /* second */\n"));
        // A comment spanning lines acts as a newline
        Assert.assertEquals("a NL b", texts("a /* one\ntwo */ b"));
        Assert.assertEquals("a b", texts("a /* inline */ b"));
    }

    @Test
    public void tokensCoverTheSource() {
        String source = "package p // c\r\n\r\n/* doc */\nvar x = `a\nb`\t\n";
        StringBuilder builder = new StringBuilder();
        for (Token token: lex(source).getTokens())
            if (token.getType() != Token.EOF)
                builder.append(token.getText());
        Assert.assertEquals(source, builder.toString());
    }

    @Test
    public void literals() {
        List<Token> tokens = tokenize("42 0x1F 1_000 3.14 .5 1e9 0x1p-2 2i 'a' '\\n' \"s\\\"q\" `raw\nstring`");
        List<Integer> types = Linq.map(tokens, Token::getType);
        Assert.assertEquals(List.of(
                GoLexer.DECIMAL_LIT, GoLexer.HEX_LIT, GoLexer.DECIMAL_LIT,
                GoLexer.FLOAT_LIT, GoLexer.FLOAT_LIT, GoLexer.FLOAT_LIT, GoLexer.FLOAT_LIT,
                GoLexer.IMAGINARY_LIT, GoLexer.RUNE_LIT, GoLexer.RUNE_LIT,
                GoLexer.INTERPRETED_STRING_LIT, GoLexer.RAW_STRING_LIT), types);
        Assert.assertEquals("\"s\\\"q\"", tokens.get(10).getText());
        Assert.assertEquals("`raw\nstring`", tokens.get(11).getText());
    }

    @Test
    public void malformedNumbersAreSeveralTokens() {
        // Neither is a number; the parser rejects the sequence
        Assert.assertEquals(List.of(GoLexer.DECIMAL_LIT, GoLexer.IDENTIFIER),
                Linq.map(tokenize("0x"), Token::getType));
        Assert.assertEquals(List.of(GoLexer.DECIMAL_LIT, GoLexer.DECIMAL_LIT),
                Linq.map(tokenize("08"), Token::getType));
        Assert.assertEquals(List.of(GoLexer.FLOAT_LIT), Linq.map(tokenize("08.5"), Token::getType));
        Assert.assertEquals(List.of(GoLexer.OCTAL_LIT), Linq.map(tokenize("0o17"), Token::getType));
    }

    @Test
    public void invalidEscape() {
        Assert.assertThrows(SyntaxError.class, () -> lex("r := '\\u'\n"));
        Assert.assertThrows(SyntaxError.class, () -> lex("s := \"\\q\"\n"));
    }

    @Test
    public void operatorsUseLongestMatch() {
        Assert.assertEquals("a &^= b <<= c ...", texts("a &^= b <<= c ..."));
        Assert.assertEquals("x <- ch", texts("x <- ch"));
        Assert.assertEquals("i ++ NL", texts("i++\n"));
    }

    @Test
    public void keywordsAndIdentifiers() {
        List<Token> tokens = tokenize("range rangeX _ func");
        Assert.assertEquals(List.of(GoLexer.RANGE, GoLexer.IDENTIFIER, GoLexer.IDENTIFIER, GoLexer.FUNC),
                Linq.map(tokens, Token::getType));
    }

    @Test
    public void positions() {
        GoSourceTokens lexed = lex("ab  \"cd\"");
        List<Token> tokens = tokenize("ab  \"cd\"");
        Assert.assertEquals(0, lexed.startOf(tokens.get(0)));
        Assert.assertEquals(2, lexed.endOf(tokens.get(0)));
        Assert.assertEquals(4, lexed.startOf(tokens.get(1)));
        Assert.assertEquals(8, lexed.endOf(tokens.get(1)));
    }

    @Test
    public void positionsAfterSupplementaryCharacters() {
        String source = "\"\uD83D\uDE00\" x";
        GoSourceTokens lexed = lex(source);
        Token x = tokenize(source).get(1);
        Assert.assertEquals(5, lexed.startOf(x));
        Assert.assertEquals(6, lexed.endOf(x));
        Assert.assertEquals(lexed.getTokens().indexOf(x), lexed.tokenAt(5));
    }

    @Test
    public void unterminatedString() {
        try {
            lex("x := \"abc\ny := 1\n");
            Assert.fail("Expected a syntax error");
        } catch (SyntaxError e) {
            Assert.assertEquals(1, e.getPositionRange().start.line);
            Assert.assertEquals(6, e.getPositionRange().start.column);
        }
    }

    @Test
    public void invalidCharacter() {
        Assert.assertThrows(SyntaxError.class, () -> lex("a @ b"));
    }
}
