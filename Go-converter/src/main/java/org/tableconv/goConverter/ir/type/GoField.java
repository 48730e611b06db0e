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
import org.tableconv.goConverter.ir.GoExpression;
import org.tableconv.goConverter.ir.GoNode;
import org.tableconv.goConverter.ir.expression.GoBasicLit;
import org.tableconv.goConverter.ir.expression.GoIdent;
import org.tableconv.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.List;

/** One entry of a field list: a struct field group, a parameter group,
 * a type parameter group, or an interface element.
 * The names are empty for embedded fields and for unnamed parameters.
 * For interface methods the type is the method's signature. */
public final class GoField extends GoNode {
    public final List<GoIdent> names;
    public final GoExpression type;
    @Nullable
    public final GoBasicLit tag;

    public GoField(int start, int end, List<GoIdent> names, GoExpression type, @Nullable GoBasicLit tag) {
        super(start, end);
        this.names = names;
        this.type = type;
        this.tag = tag;
    }

    public boolean isEmbedded() {
        return this.names.isEmpty();
    }

    @Override
    public void accept(GoVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (GoIdent name: this.names)
            name.accept(visitor);
        this.type.accept(visitor);
        if (this.tag != null)
            this.tag.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (!this.names.isEmpty())
            builder.join(", ", this.names).append(" ");
        builder.append(this.type);
        if (this.tag != null)
            builder.append(" ").append(this.tag);
        return builder;
    }
}
