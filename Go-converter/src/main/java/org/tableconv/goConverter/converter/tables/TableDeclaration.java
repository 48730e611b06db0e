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

import org.tableconv.goConverter.ir.GoNode;
import org.tableconv.goConverter.ir.expression.GoCompositeLit;
import org.tableconv.goConverter.ir.expression.GoIdent;
import org.tableconv.goConverter.ir.type.GoArrayType;
import org.tableconv.goConverter.ir.type.GoStructType;
import org.tableconv.util.Linq;

import javax.annotation.Nullable;
import java.util.List;

/** A variable bound to a slice literal of anonymous structs which has a name field. */
public final class TableDeclaration {
    /** The declaring identifier. */
    public final GoIdent variable;
    /** The var spec or short variable declaration. */
    public final GoNode binding;
    public final GoCompositeLit value;
    /** Type of the literal, []struct{...}. */
    public final GoArrayType literalType;
    public final GoStructType recordType;
    /** Type written in the var spec, if any. */
    @Nullable
    public final GoArrayType declaredType;
    @Nullable
    public final GoStructType declaredRecordType;
    public final List<RecordField> fields;
    public final int nameFieldIndex;
    public final List<TableRow> rows;

    public TableDeclaration(GoIdent variable, GoNode binding, GoCompositeLit value,
                            GoArrayType literalType, GoStructType recordType,
                            @Nullable GoArrayType declaredType, @Nullable GoStructType declaredRecordType,
                            List<RecordField> fields, int nameFieldIndex, List<TableRow> rows) {
        this.variable = variable;
        this.binding = binding;
        this.value = value;
        this.literalType = literalType;
        this.recordType = recordType;
        this.declaredType = declaredType;
        this.declaredRecordType = declaredRecordType;
        this.fields = fields;
        this.nameFieldIndex = nameFieldIndex;
        this.rows = rows;
    }

    public RecordField getNameField() {
        return this.fields.get(this.nameFieldIndex);
    }

    public String getName() {
        return this.variable.name;
    }

    public KeyedTableType getKeyedType() {
        RecordField nameField = this.getNameField();
        return new KeyedTableType(nameField.typeText(), Linq.where(this.fields, f -> f != nameField));
    }

    @Override
    public String toString() {
        return this.getName() + ": []struct{" + this.fields.size() + " fields}, " +
                this.rows.size() + " rows, keyed by " + this.getNameField().fieldName();
    }
}
