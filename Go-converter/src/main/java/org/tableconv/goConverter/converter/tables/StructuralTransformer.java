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

import org.tableconv.goConverter.converter.IErrorReporter;
import org.tableconv.goConverter.converter.backend.SourceEdits;
import org.tableconv.goConverter.converter.errors.InternalConverterError;
import org.tableconv.goConverter.ir.GoFile;
import org.tableconv.goConverter.ir.type.GoArrayType;
import org.tableconv.goConverter.ir.type.GoField;
import org.tableconv.goConverter.ir.type.GoStructType;
import org.tableconv.util.IWritesLogs;
import org.tableconv.util.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Rewrites a table declaration into its keyed form:
 * <pre>
 * []struct{ name string; a int }{ {"x", 1} }  becomes  map[string]struct{ a int }{ "x": {1} }
 * </pre>
 * The name field is removed from the struct type (both the literal's and the declared one),
 * and each row becomes a key-value pair whose key is the row's name literal, spelled exactly
 * as in the source.
 */
public class StructuralTransformer implements IWritesLogs {
    static final String DUPLICATE_KEY = "Duplicate key";

    final GoFile file;
    final IErrorReporter reporter;
    int tablesConverted;

    public StructuralTransformer(GoFile file, IErrorReporter reporter) {
        this.file = file;
        this.reporter = reporter;
        this.tablesConverted = 0;
    }

    public int getTablesConverted() {
        return this.tablesConverted;
    }

    /** Replace the '[]' in front of the struct type with 'map[K]'. */
    void convertType(GoArrayType type, GoStructType struct, KeyedTableType keyed) {
        this.file.edits.replace(type.start, struct.start, keyed.prefix());
    }

    void removeNameField(GoStructType struct, RecordField nameField) {
        SourceEdits edits = this.file.edits;
        GoField group = struct.fields.get(nameField.groupIndex());
        if (group.names.size() > 1)
            // Only the name goes, the group keeps the remaining names
            edits.deleteElement(group.names, nameField.nameIndex(), false);
        else
            edits.deleteElement(struct.fields, nameField.groupIndex(), true);
    }

    public KeyedTableType transform(TableDeclaration table) {
        KeyedTableType keyed = table.getKeyedType();
        RecordField nameField = table.getNameField();
        this.convertType(table.literalType, table.recordType, keyed);
        this.removeNameField(table.recordType, nameField);
        if (table.declaredType != null) {
            GoStructType declared = Objects.requireNonNull(table.declaredRecordType);
            this.convertType(table.declaredType, declared, keyed);
            this.removeNameField(declared, declared == table.recordType ? nameField :
                    declaredNameField(declared, nameField));
        }

        Map<String, TableRow> keys = new HashMap<>();
        for (TableRow row: table.rows) {
            String key = this.file.getText(row.key());
            TableRow previous = keys.put(key, row);
            if (previous != null) {
                this.reporter.reportWarning(this.file.rangeOf(row.key()), DUPLICATE_KEY,
                        "Key " + key + " of table " + table.getName() +
                                " already used at line " + this.file.rangeOf(previous.key()).start.line +
                                "; the converted map literal will not compile");
            }
            this.file.edits.insert(row.literal().start, key + ": ");
            this.file.edits.deleteElement(row.literal().elements, row.elementIndex(), true);
        }
        this.tablesConverted++;
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Converted ")
                .append(table.getName())
                .append(" to ")
                .append(keyed.toString())
                .newline();
        return keyed;
    }

    /** The field of the declared struct which corresponds to the literal's name field. */
    static RecordField declaredNameField(GoStructType declared, RecordField nameField) {
        int groupIndex = 0;
        for (GoField field: declared.fields) {
            for (int j = 0; j < field.names.size(); j++) {
                if (field.names.get(j).name.equals(nameField.fieldName()))
                    return new RecordField(field.names.get(j), nameField.fieldName(), field,
                            groupIndex, j, nameField.typeText());
            }
            groupIndex++;
        }
        throw new InternalConverterError("Declared type has no field " + nameField.fieldName());
    }
}
