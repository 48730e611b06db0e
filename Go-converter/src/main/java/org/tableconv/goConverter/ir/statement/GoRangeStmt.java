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

package org.tableconv.goConverter.ir.statement;

import org.tableconv.goConverter.converter.visitors.GoVisitor;
import org.tableconv.goConverter.converter.visitors.VisitDecision;
import org.tableconv.goConverter.ir.GoExpression;
import org.tableconv.goConverter.ir.GoStatement;
import org.tableconv.util.IIndentStream;

import javax.annotation.Nullable;

/** for key, value := range expression { body }.
 * Key and value are null when absent; the operator is null when neither is present. */
public final class GoRangeStmt extends GoStatement {
    @Nullable
    public final GoExpression key;
    @Nullable
    public final GoExpression value;
    /** ":=", "=", or null. */
    @Nullable
    public final String operator;
    public final GoExpression expression;
    public final GoBlockStmt body;

    public GoRangeStmt(int start, int end, @Nullable GoExpression key, @Nullable GoExpression value,
                       @Nullable String operator, GoExpression expression, GoBlockStmt body) {
        super(start, end);
        this.key = key;
        this.value = value;
        this.operator = operator;
        this.expression = expression;
        this.body = body;
    }

    public boolean isDefinition() {
        return GoAssignStmt.DEFINE.equals(this.operator);
    }

    @Override
    public void accept(GoVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.key != null)
            this.key.accept(visitor);
        if (this.value != null)
            this.value.accept(visitor);
        this.expression.accept(visitor);
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("for ");
        if (this.key != null) {
            builder.append(this.key);
            if (this.value != null)
                builder.append(", ").append(this.value);
            builder.append(" ").append(this.operator).append(" ");
        }
        return builder.append("range ")
                .append(this.expression)
                .append(" ")
                .append(this.body);
    }
}
