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
import org.tableconv.goConverter.ir.GoSpec;
import org.tableconv.util.IIndentStream;

import java.util.List;

/** An import, const, type or var declaration, possibly parenthesized. */
public final class GoGenDecl extends GoDeclaration {
    public final String keyword;
    public final boolean grouped;
    public final List<GoSpec> specs;

    public GoGenDecl(int start, int end, String keyword, boolean grouped, List<GoSpec> specs) {
        super(start, end);
        this.keyword = keyword;
        this.grouped = grouped;
        this.specs = specs;
    }

    @Override
    public void accept(GoVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (GoSpec spec: this.specs)
            spec.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.keyword).append(" ");
        if (!this.grouped)
            return builder.join("", this.specs);
        builder.append("(").increase();
        for (GoSpec spec: this.specs)
            builder.append(spec).newline();
        return builder.decrease().append(")");
    }
}
