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

package org.tableconv.goConverter.converter;

import org.tableconv.goConverter.converter.errors.ConverterMessages;

import java.nio.file.Path;

/** Outcome of converting one file.
 * @param path            File converted.
 * @param processed       True if the file was read, parsed and (if needed) written without errors.
 * @param modified        True if the file was rewritten on disk.
 * @param tablesConverted Tables converted in this file; 0 unless modified.
 * @param messages        Errors and warnings for this file. */
public record FileResult(Path path, boolean processed, boolean modified,
                         int tablesConverted, ConverterMessages messages) {
    public static FileResult failed(Path path, ConverterMessages messages) {
        return new FileResult(path, false, false, 0, messages);
    }
}
