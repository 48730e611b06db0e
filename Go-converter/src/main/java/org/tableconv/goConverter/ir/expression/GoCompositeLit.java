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
import java.util.List;

/** A composite literal: T{e0, e1, k: v}.  The type is null when it is elided,
 * as for the rows of a slice literal. */
public final class GoCompositeLit extends GoExpression {
    @Nullable
    public final GoExpression type;
    public final List<GoExpression> elements;
    /** Offset of the opening brace. */
    public final int lbrace;

    public GoCompositeLit(int start, int end, @Nullable GoExpression type,
                          int lbrace, List<GoExpression> elements) {
        super(start, end);
        this.type = type;
        this.lbrace = lbrace;
        this.elements = elements;
    }

    /** True if the elements are key-value pairs. */
    public boolean isKeyed() {
        return !this.elements.isEmpty() && this.elements.get(0).is(GoKeyValueExpr.class);
    }

    @Override
    public void accept(GoVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.type != null)
            this.type.accept(visitor);
        for (GoExpression element: this.elements)
            element.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.type != null)
            builder.append(this.type);
        return builder.append("{")
                .join(", ", this.elements)
                .append("}");
    }
}
