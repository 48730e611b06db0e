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
import org.tableconv.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.List;

/** names [type] [= values], inside a var or const declaration. */
public final class GoValueSpec extends GoSpec {
    /** "var" or "const". */
    public final String keyword;
    public final List<GoIdent> names;
    @Nullable
    public final GoExpression type;
    public final List<GoExpression> values;

    public GoValueSpec(int start, int end, String keyword, List<GoIdent> names,
                       @Nullable GoExpression type, List<GoExpression> values) {
        super(start, end);
        this.keyword = keyword;
        this.names = names;
        this.type = type;
        this.values = values;
    }

    public boolean isConstant() {
        return this.keyword.equals("const");
    }

    @Override
    public void accept(GoVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (GoIdent name: this.names)
            name.accept(visitor);
        if (this.type != null)
            this.type.accept(visitor);
        for (GoExpression value: this.values)
            value.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.join(", ", this.names);
        if (this.type != null)
            builder.append(" ").append(this.type);
        if (!this.values.isEmpty())
            builder.append(" = ").join(", ", this.values);
        return builder;
    }
}
