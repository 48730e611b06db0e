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

public final class GoIfStmt extends GoStatement {
    @Nullable
    public final GoStatement init;
    public final GoExpression condition;
    public final GoBlockStmt body;
    /** Either a block or another if statement. */
    @Nullable
    public final GoStatement elseBranch;

    public GoIfStmt(int start, int end, @Nullable GoStatement init, GoExpression condition,
                    GoBlockStmt body, @Nullable GoStatement elseBranch) {
        super(start, end);
        this.init = init;
        this.condition = condition;
        this.body = body;
        this.elseBranch = elseBranch;
    }

    @Override
    public void accept(GoVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.init != null)
            this.init.accept(visitor);
        this.condition.accept(visitor);
        this.body.accept(visitor);
        if (this.elseBranch != null)
            this.elseBranch.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("if ");
        if (this.init != null)
            builder.append(this.init).append("; ");
        builder.append(this.condition)
                .append(" ")
                .append(this.body);
        if (this.elseBranch != null)
            builder.append(" else ").append(this.elseBranch);
        return builder;
    }
}
