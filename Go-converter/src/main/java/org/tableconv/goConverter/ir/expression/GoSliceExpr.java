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

package org.tableconv.goConverter.ir.expression;

import org.tableconv.goConverter.converter.visitors.GoVisitor;
import org.tableconv.goConverter.converter.visitors.VisitDecision;
import org.tableconv.goConverter.ir.GoExpression;
import org.tableconv.util.IIndentStream;

import javax.annotation.Nullable;

/** expression[low:high] or expression[low:high:max]. */
public final class GoSliceExpr extends GoExpression {
    public final GoExpression expression;
    @Nullable
    public final GoExpression low;
    @Nullable
    public final GoExpression high;
    @Nullable
    public final GoExpression max;
    public final boolean slice3;

    public GoSliceExpr(int start, int end, GoExpression expression,
                       @Nullable GoExpression low, @Nullable GoExpression high,
                       @Nullable GoExpression max, boolean slice3) {
        super(start, end);
        this.expression = expression;
        this.low = low;
        this.high = high;
        this.max = max;
        this.slice3 = slice3;
    }

    @Override
    public void accept(GoVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.expression.accept(visitor);
        if (this.low != null)
            this.low.accept(visitor);
        if (this.high != null)
            this.high.accept(visitor);
        if (this.max != null)
            this.max.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.expression).append("[");
        if (this.low != null)
            builder.append(this.low);
        builder.append(":");
        if (this.high != null)
            builder.append(this.high);
        if (this.slice3) {
            builder.append(":");
            if (this.max != null)
                builder.append(this.max);
        }
        return builder.append("]");
    }
}
