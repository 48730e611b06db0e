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

package org.tableconv.goConverter.converter.tables;

import org.tableconv.goConverter.ir.expression.GoIdent;
import org.tableconv.goConverter.ir.type.GoField;

import javax.annotation.Nullable;

/** One field of an inline struct type.
 * @param name        Declaring identifier; null for embedded fields.
 * @param fieldName   Name of the field; for embedded fields the name of the type.
 * @param declaration Field group containing the field.
 * @param groupIndex  Index of the group within the struct.
 * @param nameIndex   Index of the field's name within its group.
 * @param typeText    Source text of the field's type. */
public record RecordField(@Nullable GoIdent name, String fieldName, GoField declaration,
                          int groupIndex, int nameIndex, String typeText) {
    public boolean isEmbedded() {
        return this.name == null;
    }

    @Override
    public String toString() {
        return this.fieldName + " " + this.typeText;
    }
}
