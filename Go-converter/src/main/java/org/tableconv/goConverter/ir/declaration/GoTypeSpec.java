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
import org.tableconv.goConverter.ir.GoExpression;
import org.tableconv.goConverter.ir.GoSpec;
import org.tableconv.goConverter.ir.expression.GoIdent;
import org.tableconv.goConverter.ir.type.GoField;
import org.tableconv.util.IIndentStream;

import java.util.List;

/** A type definition, or an alias when isAlias is set. */
public final class GoTypeSpec extends GoSpec {
    public final GoIdent name;
    public final List<GoField> typeParameters;
    public final boolean isAlias;
    public final GoExpression type;

    public GoTypeSpec(int start, int end, GoIdent name, List<GoField> typeParameters,
                      boolean isAlias, GoExpression type) {
        super(start, end);
        this.name = name;
        this.typeParameters = typeParameters;
        this.isAlias = isAlias;
        this.type = type;
    }

    @Override
    public void accept(GoVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.name.accept(visitor);
        for (GoField field: this.typeParameters)
            field.accept(visitor);
        this.type.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.name);
        if (!this.typeParameters.isEmpty())
            builder.append("[").join(", ", this.typeParameters).append("]");
        builder.append(this.isAlias ? " = " : " ");
        return builder.append(this.type);
    }
}
