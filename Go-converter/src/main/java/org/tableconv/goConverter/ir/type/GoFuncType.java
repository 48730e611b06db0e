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

package org.tableconv.goConverter.ir.type;

import org.tableconv.goConverter.converter.visitors.GoVisitor;
import org.tableconv.goConverter.converter.visitors.VisitDecision;
import org.tableconv.util.IIndentStream;

import java.util.List;

/** A function signature. */
public final class GoFuncType extends GoTypeExpression {
    public final List<GoField> typeParameters;
    public final List<GoField> parameters;
    public final List<GoField> results;

    public GoFuncType(int start, int end, List<GoField> typeParameters,
                      List<GoField> parameters, List<GoField> results) {
        super(start, end);
        this.typeParameters = typeParameters;
        this.parameters = parameters;
        this.results = results;
    }

    @Override
    public void accept(GoVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (GoField field: this.typeParameters)
            field.accept(visitor);
        for (GoField field: this.parameters)
            field.accept(visitor);
        for (GoField field: this.results)
            field.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("func");
        if (!this.typeParameters.isEmpty())
            builder.append("[").join(", ", this.typeParameters).append("]");
        builder.append("(").join(", ", this.parameters).append(")");
        if (!this.results.isEmpty())
            builder.append(" (").join(", ", this.results).append(")");
        return builder;
    }
}
