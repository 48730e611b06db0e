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

package org.tableconv.goConverter.ir;

import org.tableconv.goConverter.converter.backend.SourceEdits;
import org.tableconv.goConverter.converter.errors.SourceFileContents;
import org.tableconv.goConverter.converter.frontend.GoSourceTokens;
import org.tableconv.goConverter.converter.errors.SourcePositionRange;
import org.tableconv.goConverter.converter.visitors.GoVisitor;
import org.tableconv.goConverter.converter.visitors.VisitDecision;
import org.tableconv.goConverter.ir.expression.GoIdent;
import org.tableconv.util.IIndentStream;

import java.util.List;

/** A parsed Go source file.
 * The tree is an exact snapshot of the source text; rewrites are not applied
 * to the nodes, they are recorded as edits against the text and materialized
 * when the file is printed. */
public final class GoFile extends GoNode {
    public final GoIdent packageName;
    public final List<GoDeclaration> declarations;
    public final SourceFileContents contents;
    public final SourceEdits edits;

    public GoFile(int start, int end, GoIdent packageName,
                  List<GoDeclaration> declarations, GoSourceTokens tokens) {
        super(start, end);
        this.packageName = packageName;
        this.declarations = declarations;
        this.contents = tokens.contents;
        this.edits = new SourceEdits(tokens);
    }

    public String getFileName() {
        return this.contents.sourceFileName;
    }

    /** The source text of a node. */
    public String getText(IGoNode node) {
        return this.contents.text.substring(node.getStart(), node.getEnd());
    }

    public SourcePositionRange rangeOf(IGoNode node) {
        return this.contents.rangeOf(node.getStart(), node.getEnd());
    }

    public boolean isModified() {
        return !this.edits.isEmpty();
    }

    @Override
    public void accept(GoVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.packageName.accept(visitor);
        for (GoDeclaration declaration: this.declarations)
            declaration.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("package ")
                .append(this.packageName)
                .newline();
        for (GoDeclaration declaration: this.declarations)
            builder.append(declaration).newline();
        return builder;
    }
}
