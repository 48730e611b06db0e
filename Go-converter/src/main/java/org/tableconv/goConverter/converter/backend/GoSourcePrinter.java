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

import org.tableconv.goConverter.ir.GoFile;
import org.tableconv.util.IWritesLogs;
import org.tableconv.util.Logger;

import java.nio.charset.StandardCharsets;

/** Serializes a Go file: the original text, with the recorded edits applied.
 * Everything outside the edited ranges, including comments and
 * formatting, is reproduced byte for byte. */
public class GoSourcePrinter implements IWritesLogs {
    public String toText(GoFile file) {
        if (file.edits.isEmpty())
            return file.contents.text;
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Applying ")
                .append(file.edits.size())
                .append(" edits to ")
                .append(file.getFileName())
                .newline();
        Logger.INSTANCE.belowLevel(this, 3)
                .append(file.edits.toString())
                .newline();
        return file.edits.apply();
    }

    public byte[] print(GoFile file) {
        return this.toText(file).getBytes(StandardCharsets.UTF_8);
    }
}
