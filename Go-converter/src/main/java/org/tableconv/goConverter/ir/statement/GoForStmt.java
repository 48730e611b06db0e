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

/** for [init]; [condition]; [post] { body }, including the forms with only a condition. */
public final class GoForStmt extends GoStatement {
    @Nullable
    public final GoStatement init;
    @Nullable
    public final GoExpression condition;
    @Nullable
    public final GoStatement post;
    public final GoBlockStmt body;

    public GoForStmt(int start, int end, @Nullable GoStatement init, @Nullable GoExpression condition,
                     @Nullable GoStatement post, GoBlockStmt body) {
        super(start, end);
        this.init = init;
        this.condition = condition;
        this.post = post;
        this.body = body;
    }

    @Override
    public void accept(GoVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.init != null)
            this.init.accept(visitor);
        if (this.condition != null)
            this.condition.accept(visitor);
        if (this.post != null)
            this.post.accept(visitor);
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("for ");
        if (this.init != null || this.post != null) {
            if (this.init != null)
                builder.append(this.init);
            builder.append("; ");
            if (this.condition != null)
                builder.append(this.condition);
            builder.append("; ");
            if (this.post != null)
                builder.append(this.post);
            builder.append(" ");
        } else if (this.condition != null) {
            builder.append(this.condition).append(" ");
        }
        return builder.append(this.body);
    }
}
