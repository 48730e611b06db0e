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

import org.tableconv.goConverter.converter.visitors.GoVisitor;
import org.tableconv.goConverter.converter.visitors.ReferenceMap;
import org.tableconv.goConverter.converter.visitors.VisitDecision;
import org.tableconv.goConverter.ir.GoExpression;
import org.tableconv.goConverter.ir.GoFile;
import org.tableconv.goConverter.ir.GoNode;
import org.tableconv.goConverter.ir.declaration.GoValueSpec;
import org.tableconv.goConverter.ir.expression.GoBasicLit;
import org.tableconv.goConverter.ir.expression.GoCompositeLit;
import org.tableconv.goConverter.ir.expression.GoIdent;
import org.tableconv.goConverter.ir.expression.GoKeyValueExpr;
import org.tableconv.goConverter.ir.expression.GoSelectorExpr;
import org.tableconv.goConverter.ir.expression.GoStarExpr;
import org.tableconv.goConverter.ir.statement.GoAssignStmt;
import org.tableconv.goConverter.ir.type.GoArrayType;
import org.tableconv.goConverter.ir.type.GoField;
import org.tableconv.goConverter.ir.type.GoStructType;
import org.tableconv.util.Linq;
import org.tableconv.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds the table declarations of a file: variables bound to a literal of type
 * []struct{...} where the struct has a name field and every row stores a
 * literal constant in that field.
 * Bindings are var specs, at any level, and short variable declarations
 * which introduce a new variable.
 * Detection never changes the tree; declarations which do not have the
 * expected shape are skipped, and the reason is logged.
 */
public class RecordShapeDetector extends GoVisitor {
    final GoFile file;
    final ReferenceMap reference;
    public final List<TableDeclaration> tables;

    public RecordShapeDetector(GoFile file, ReferenceMap reference) {
        this.file = file;
        this.reference = reference;
        this.tables = new ArrayList<>();
    }

    @Nullable
    TableDeclaration reject(GoIdent variable, String reason) {
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Not a table: ")
                .append(variable.name)
                .append(" at ")
                .append(this.file.rangeOf(variable).toString())
                .append(": ")
                .append(reason)
                .newline();
        return null;
    }

    @Override
    public VisitDecision preorder(GoValueSpec spec) {
        TableDeclaration table = this.detect(spec);
        if (table != null)
            this.tables.add(table);
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(GoAssignStmt statement) {
        TableDeclaration table = this.detect(statement);
        if (table != null)
            this.tables.add(table);
        return VisitDecision.CONTINUE;
    }

    /** Check a var spec; null if it is not a table declaration. */
    @Nullable
    public TableDeclaration detect(GoValueSpec spec) {
        if (spec.isConstant() || spec.names.size() != 1 || spec.values.size() != 1)
            return null;
        GoIdent variable = spec.names.get(0);
        GoArrayType declaredType = null;
        if (spec.type != null) {
            declaredType = spec.type.as(GoArrayType.class);
            if (declaredType == null)
                return this.reject(variable, "declared type is not a slice");
        }
        return this.detect(variable, spec, declaredType, spec.values.get(0));
    }

    /** Check a short variable declaration; null if it is not a table declaration. */
    @Nullable
    public TableDeclaration detect(GoAssignStmt statement) {
        if (!statement.isDefinition() || statement.left.size() != 1 || statement.right.size() != 1)
            return null;
        GoIdent variable = statement.left.get(0).as(GoIdent.class);
        if (variable == null || variable.isBlank())
            return null;
        if (!this.reference.isDeclaration(variable))
            return this.reject(variable, "assignment to an existing variable");
        return this.detect(variable, statement, null, statement.right.get(0));
    }

    /** If the type is []struct{...} return the struct, otherwise null. */
    @Nullable
    static GoStructType sliceOfStruct(GoArrayType type) {
        if (!type.isSlice())
            return null;
        return type.elementType.as(GoStructType.class);
    }

    /** The name of an embedded field: the type name, without package or pointer. */
    static String embeddedName(GoExpression type) {
        GoStarExpr star = type.as(GoStarExpr.class);
        if (star != null)
            return embeddedName(star.expression);
        GoSelectorExpr selector = type.as(GoSelectorExpr.class);
        if (selector != null)
            return selector.selector.name;
        GoIdent ident = type.as(GoIdent.class);
        return ident != null ? ident.name : "";
    }

    List<RecordField> fieldsOf(GoStructType struct) {
        List<RecordField> result = new ArrayList<>();
        for (int i = 0; i < struct.fields.size(); i++) {
            GoField field = struct.fields.get(i);
            String typeText = this.file.getText(field.type);
            if (field.isEmbedded()) {
                result.add(new RecordField(null, embeddedName(field.type), field, i, 0, typeText));
                continue;
            }
            for (int j = 0; j < field.names.size(); j++) {
                GoIdent name = field.names.get(j);
                result.add(new RecordField(name, name.name, field, i, j, typeText));
            }
        }
        return result;
    }

    static boolean sameFieldNames(List<RecordField> left, List<RecordField> right) {
        if (left.size() != right.size())
            return false;
        for (int i = 0; i < left.size(); i++)
            if (!left.get(i).fieldName().equals(right.get(i).fieldName()))
                return false;
        return true;
    }

    @Nullable
    TableDeclaration detect(GoIdent variable, GoNode binding,
                            @Nullable GoArrayType declaredType, GoExpression value) {
        GoCompositeLit literal = value.as(GoCompositeLit.class);
        if (literal == null || literal.type == null)
            return this.reject(variable, "value is not a composite literal");
        GoArrayType literalType = literal.type.as(GoArrayType.class);
        if (literalType == null)
            return this.reject(variable, "value is not a slice literal");
        GoStructType struct = sliceOfStruct(literalType);
        if (struct == null)
            return this.reject(variable, "value is not a slice of an inline struct");
        List<RecordField> fields = this.fieldsOf(struct);
        if (fields.isEmpty())
            return this.reject(variable, "struct has no fields");

        GoStructType declaredStruct = null;
        if (declaredType != null) {
            declaredStruct = sliceOfStruct(declaredType);
            if (declaredStruct == null)
                return this.reject(variable, "declared type is not a slice of an inline struct");
            if (!sameFieldNames(fields, this.fieldsOf(declaredStruct)))
                return this.reject(variable, "declared type and literal type have different fields");
        }

        int nameFieldIndex = -1;
        for (int i = 0; i < fields.size(); i++) {
            RecordField field = fields.get(i);
            if (!field.isEmbedded() && TableShape.isNameField(field.fieldName())) {
                nameFieldIndex = i;
                break;
            }
        }
        if (nameFieldIndex < 0)
            return this.reject(variable, "struct has no name field");
        RecordField nameField = fields.get(nameFieldIndex);

        List<TableRow> rows = new ArrayList<>();
        for (GoExpression element: literal.elements) {
            GoCompositeLit row = element.as(GoCompositeLit.class);
            if (row == null || row.type != null)
                return this.reject(variable, "row is not an untyped composite literal");
            TableRow tableRow = this.rowOf(row, fields, nameFieldIndex, nameField);
            if (tableRow == null)
                return this.reject(variable, "row at " + this.file.rangeOf(row).start +
                        " does not hold a literal in field " + nameField.fieldName());
            rows.add(tableRow);
        }
        TableDeclaration result = new TableDeclaration(variable, binding, literal, literalType, struct,
                declaredType, declaredStruct, fields, nameFieldIndex, rows);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Found table ")
                .append(result.toString())
                .newline();
        return result;
    }

    @Nullable
    TableRow rowOf(GoCompositeLit row, List<RecordField> fields, int nameFieldIndex, RecordField nameField) {
        if (row.isKeyed()) {
            boolean allKeyed = Linq.all(row.elements, e -> e.is(GoKeyValueExpr.class));
            if (!allKeyed)
                return null;
            for (int i = 0; i < row.elements.size(); i++) {
                GoKeyValueExpr pair = row.elements.get(i).to(GoKeyValueExpr.class);
                GoIdent key = pair.key.as(GoIdent.class);
                if (key == null || !key.name.equals(nameField.fieldName()))
                    continue;
                GoBasicLit literal = pair.value.as(GoBasicLit.class);
                if (literal == null)
                    return null;
                return new TableRow(row, pair, i, literal);
            }
            return null;
        }
        if (row.elements.size() != fields.size())
            return null;
        GoExpression element = row.elements.get(nameFieldIndex);
        GoBasicLit literal = element.as(GoBasicLit.class);
        if (literal == null)
            return null;
        return new TableRow(row, element, nameFieldIndex, literal);
    }
}
