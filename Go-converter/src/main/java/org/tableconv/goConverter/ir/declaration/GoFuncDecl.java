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

package org.tableconv.goConverter.ir.declaration;

import org.tableconv.goConverter.converter.visitors.GoVisitor;
import org.tableconv.goConverter.converter.visitors.VisitDecision;
import org.tableconv.goConverter.ir.GoDeclaration;
import org.tableconv.goConverter.ir.expression.GoIdent;
import org.tableconv.goConverter.ir.statement.GoBlockStmt;
import org.tableconv.goConverter.ir.type.GoField;
import org.tableconv.goConverter.ir.type.GoFuncType;
import org.tableconv.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.List;

/** A function or method declaration.  The receiver list is empty for functions. */
public final class GoFuncDecl extends GoDeclaration {
    public final List<GoField> receiver;
    public final GoIdent name;
    public final GoFuncType type;
    /** Null for functions implemented outside Go. */
    @Nullable
    public final GoBlockStmt body;

    public GoFuncDecl(int start, int end, List<GoField> receiver, GoIdent name,
                      GoFuncType type, @Nullable GoBlockStmt body) {
        super(start, end);
        this.receiver = receiver;
        this.name = name;
        this.type = type;
        this.body = body;
    }

    public boolean isMethod() {
        return !this.receiver.isEmpty();
    }

    @Override
    public void accept(GoVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (GoField field: this.receiver)
            field.accept(visitor);
        this.name.accept(visitor);
        this.type.accept(visitor);
        if (this.body != null)
            this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("func ");
        if (this.isMethod())
            builder.append("(").join(", ", this.receiver).append(") ");
        builder.append(this.name)
                .append(" ")
                .append(this.type);
        if (this.body != null)
            builder.append(" ").append(this.body);
        return builder;
    }
}
