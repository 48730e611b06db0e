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
import org.tableconv.goConverter.ir.GoStatement;
import org.tableconv.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.List;

/** switch [init;] [v :=] x.(type) { ... } */
public final class GoTypeSwitchStmt extends GoStatement {
    @Nullable
    public final GoStatement init;
    /** Either an expression statement x.(type) or an assignment v := x.(type). */
    public final GoStatement assign;
    public final List<GoCaseClause> clauses;

    public GoTypeSwitchStmt(int start, int end, @Nullable GoStatement init,
                            GoStatement assign, List<GoCaseClause> clauses) {
        super(start, end);
        this.init = init;
        this.assign = assign;
        this.clauses = clauses;
    }

    @Override
    public void accept(GoVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.init != null)
            this.init.accept(visitor);
        this.assign.accept(visitor);
        for (GoCaseClause clause: this.clauses)
            clause.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("switch ");
        if (this.init != null)
            builder.append(this.init).append("; ");
        return builder.append(this.assign)
                .append(" {")
                .newline()
                .join("\n", this.clauses)
                .append("}");
    }
}
