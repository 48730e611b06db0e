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

import org.tableconv.goConverter.converter.errors.SourceFileContents;
import org.tableconv.goConverter.converter.errors.SyntaxError;
import org.tableconv.goConverter.ir.GoFile;
import org.tableconv.util.IWritesLogs;
import org.tableconv.util.Logger;

/** Parses Go source files into syntax trees. */
public class GoSourceParser implements IWritesLogs {
    private GoSourceParser() {}

    /** Parse a complete Go source file.
     * @param fileName  Name used in error messages.
     * @param source    Contents of the file.
     * @throws SyntaxError if the source is not a syntactically valid Go file. */
    public static GoFile parse(String fileName, String source) {
        return parse(new SourceFileContents(fileName, source));
    }

    public static GoFile parse(SourceFileContents contents) {
        GoSourceTokens tokens = new GoSourceTokens(contents);
        GoParser parser = new GoParser(tokens.stream);
        parser.removeErrorListeners();
        parser.addErrorListener(tokens.errorListener());
        GoFile result = new GoTreeBuilder(tokens).build(parser.sourceFile());
        Logger.INSTANCE.belowLevel(GoSourceParser.class, 2)
                .append("Parsed ")
                .append(contents.sourceFileName)
                .append(": ")
                .append(result.declarations.size())
                .append(" declarations")
                .newline();
        return result;
    }
}
