/*
 * Copyright 2022 VMware, Inc.
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

package org.tableconv.goConverter.converter.visitors;

import org.tableconv.goConverter.converter.errors.InternalConverterError;
import org.tableconv.goConverter.ir.GoDeclaration;
import org.tableconv.goConverter.ir.GoExpression;
import org.tableconv.goConverter.ir.GoFile;
import org.tableconv.goConverter.ir.GoSpec;
import org.tableconv.goConverter.ir.GoStatement;
import org.tableconv.goConverter.ir.IGoNode;
import org.tableconv.goConverter.ir.declaration.GoFuncDecl;
import org.tableconv.goConverter.ir.declaration.GoGenDecl;
import org.tableconv.goConverter.ir.declaration.GoImportSpec;
import org.tableconv.goConverter.ir.declaration.GoTypeSpec;
import org.tableconv.goConverter.ir.declaration.GoValueSpec;
import org.tableconv.goConverter.ir.expression.GoBasicLit;
import org.tableconv.goConverter.ir.expression.GoBinaryExpr;
import org.tableconv.goConverter.ir.expression.GoCallExpr;
import org.tableconv.goConverter.ir.expression.GoCompositeLit;
import org.tableconv.goConverter.ir.expression.GoEllipsis;
import org.tableconv.goConverter.ir.expression.GoFuncLit;
import org.tableconv.goConverter.ir.expression.GoIdent;
import org.tableconv.goConverter.ir.expression.GoIndexExpr;
import org.tableconv.goConverter.ir.expression.GoKeyValueExpr;
import org.tableconv.goConverter.ir.expression.GoParenExpr;
import org.tableconv.goConverter.ir.expression.GoSelectorExpr;
import org.tableconv.goConverter.ir.expression.GoSliceExpr;
import org.tableconv.goConverter.ir.expression.GoStarExpr;
import org.tableconv.goConverter.ir.expression.GoTypeAssertExpr;
import org.tableconv.goConverter.ir.expression.GoUnaryExpr;
import org.tableconv.goConverter.ir.statement.GoAssignStmt;
import org.tableconv.goConverter.ir.statement.GoBlockStmt;
import org.tableconv.goConverter.ir.statement.GoBranchStmt;
import org.tableconv.goConverter.ir.statement.GoCaseClause;
import org.tableconv.goConverter.ir.statement.GoCommClause;
import org.tableconv.goConverter.ir.statement.GoDeclStmt;
import org.tableconv.goConverter.ir.statement.GoDeferStmt;
import org.tableconv.goConverter.ir.statement.GoEmptyStmt;
import org.tableconv.goConverter.ir.statement.GoExprStmt;
import org.tableconv.goConverter.ir.statement.GoForStmt;
import org.tableconv.goConverter.ir.statement.GoGoStmt;
import org.tableconv.goConverter.ir.statement.GoIfStmt;
import org.tableconv.goConverter.ir.statement.GoIncDecStmt;
import org.tableconv.goConverter.ir.statement.GoLabeledStmt;
import org.tableconv.goConverter.ir.statement.GoRangeStmt;
import org.tableconv.goConverter.ir.statement.GoReturnStmt;
import org.tableconv.goConverter.ir.statement.GoSelectStmt;
import org.tableconv.goConverter.ir.statement.GoSendStmt;
import org.tableconv.goConverter.ir.statement.GoSwitchStmt;
import org.tableconv.goConverter.ir.statement.GoTypeSwitchStmt;
import org.tableconv.goConverter.ir.type.GoArrayType;
import org.tableconv.goConverter.ir.type.GoChanType;
import org.tableconv.goConverter.ir.type.GoField;
import org.tableconv.goConverter.ir.type.GoFuncType;
import org.tableconv.goConverter.ir.type.GoInterfaceType;
import org.tableconv.goConverter.ir.type.GoMapType;
import org.tableconv.goConverter.ir.type.GoStructType;
import org.tableconv.goConverter.ir.type.GoTypeExpression;
import org.tableconv.util.IHasId;
import org.tableconv.util.IWritesLogs;
import org.tableconv.util.Logger;
import org.tableconv.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Depth-first traversal of a Go syntax tree.
 * Each preorder method defaults to the preorder method of the node's superclass,
 * so a visitor can intercept a whole family of nodes by overriding one method. */
@SuppressWarnings({"SameReturnValue", "unused"})
public abstract class GoVisitor implements IWritesLogs, IHasId {
    final long id;
    static long crtId = 0;
    protected final List<IGoNode> context;

    protected GoVisitor() {
        this.id = crtId++;
        this.context = new ArrayList<>();
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(IGoNode node) {
        this.context.add(node);
    }

    public void pop(IGoNode node) {
        IGoNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalConverterError("Corrupted visitor context: popping " + node
                    + " instead of " + last);
    }

    @Nullable
    public IGoNode getParent() {
        if (this.context.isEmpty())
            return null;
        return Utilities.last(this.context);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(IGoNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .append(this.getClassName())
                .append(" at node ")
                .append(node.getId())
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /************************* PREORDER *****************************/

    // preorder methods return CONTINUE when normal traversal is desired,
    // and STOP when the children of the current node should be skipped.
    public VisitDecision preorder(IGoNode ignored) {
        return VisitDecision.CONTINUE;
    }

    // base classes
    public VisitDecision preorder(GoFile node) {
        return this.preorder((IGoNode) node);
    }

    public VisitDecision preorder(GoField node) {
        return this.preorder((IGoNode) node);
    }

    public VisitDecision preorder(GoExpression node) {
        return this.preorder((IGoNode) node);
    }

    public VisitDecision preorder(GoStatement node) {
        return this.preorder((IGoNode) node);
    }

    public VisitDecision preorder(GoDeclaration node) {
        return this.preorder((IGoNode) node);
    }

    public VisitDecision preorder(GoSpec node) {
        return this.preorder((IGoNode) node);
    }

    public VisitDecision preorder(GoTypeExpression node) {
        return this.preorder((GoExpression) node);
    }

    // expressions
    public VisitDecision preorder(GoIdent node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoBasicLit node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoCompositeLit node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoKeyValueExpr node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoFuncLit node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoParenExpr node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoSelectorExpr node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoIndexExpr node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoSliceExpr node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoTypeAssertExpr node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoCallExpr node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoStarExpr node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoUnaryExpr node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoBinaryExpr node) {
        return this.preorder((GoExpression) node);
    }

    public VisitDecision preorder(GoEllipsis node) {
        return this.preorder((GoExpression) node);
    }

    // types
    public VisitDecision preorder(GoArrayType node) {
        return this.preorder((GoTypeExpression) node);
    }

    public VisitDecision preorder(GoStructType node) {
        return this.preorder((GoTypeExpression) node);
    }

    public VisitDecision preorder(GoFuncType node) {
        return this.preorder((GoTypeExpression) node);
    }

    public VisitDecision preorder(GoInterfaceType node) {
        return this.preorder((GoTypeExpression) node);
    }

    public VisitDecision preorder(GoMapType node) {
        return this.preorder((GoTypeExpression) node);
    }

    public VisitDecision preorder(GoChanType node) {
        return this.preorder((GoTypeExpression) node);
    }

    // statements
    public VisitDecision preorder(GoDeclStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoEmptyStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoLabeledStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoExprStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoSendStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoIncDecStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoAssignStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoGoStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoDeferStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoReturnStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoBranchStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoBlockStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoIfStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoCaseClause node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoSwitchStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoTypeSwitchStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoCommClause node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoSelectStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoForStmt node) {
        return this.preorder((GoStatement) node);
    }

    public VisitDecision preorder(GoRangeStmt node) {
        return this.preorder((GoStatement) node);
    }

    // declarations
    public VisitDecision preorder(GoGenDecl node) {
        return this.preorder((GoDeclaration) node);
    }

    public VisitDecision preorder(GoFuncDecl node) {
        return this.preorder((GoDeclaration) node);
    }

    public VisitDecision preorder(GoImportSpec node) {
        return this.preorder((GoSpec) node);
    }

    public VisitDecision preorder(GoValueSpec node) {
        return this.preorder((GoSpec) node);
    }

    public VisitDecision preorder(GoTypeSpec node) {
        return this.preorder((GoSpec) node);
    }

    /************************* POSTORDER *****************************/

    public void postorder(IGoNode ignored) {}

    // base classes
    public void postorder(GoFile node) {
        this.postorder((IGoNode) node);
    }

    public void postorder(GoField node) {
        this.postorder((IGoNode) node);
    }

    public void postorder(GoExpression node) {
        this.postorder((IGoNode) node);
    }

    public void postorder(GoStatement node) {
        this.postorder((IGoNode) node);
    }

    public void postorder(GoDeclaration node) {
        this.postorder((IGoNode) node);
    }

    public void postorder(GoSpec node) {
        this.postorder((IGoNode) node);
    }

    public void postorder(GoTypeExpression node) {
        this.postorder((GoExpression) node);
    }

    // expressions
    public void postorder(GoIdent node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoBasicLit node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoCompositeLit node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoKeyValueExpr node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoFuncLit node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoParenExpr node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoSelectorExpr node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoIndexExpr node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoSliceExpr node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoTypeAssertExpr node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoCallExpr node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoStarExpr node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoUnaryExpr node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoBinaryExpr node) {
        this.postorder((GoExpression) node);
    }

    public void postorder(GoEllipsis node) {
        this.postorder((GoExpression) node);
    }

    // types
    public void postorder(GoArrayType node) {
        this.postorder((GoTypeExpression) node);
    }

    public void postorder(GoStructType node) {
        this.postorder((GoTypeExpression) node);
    }

    public void postorder(GoFuncType node) {
        this.postorder((GoTypeExpression) node);
    }

    public void postorder(GoInterfaceType node) {
        this.postorder((GoTypeExpression) node);
    }

    public void postorder(GoMapType node) {
        this.postorder((GoTypeExpression) node);
    }

    public void postorder(GoChanType node) {
        this.postorder((GoTypeExpression) node);
    }

    // statements
    public void postorder(GoDeclStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoEmptyStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoLabeledStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoExprStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoSendStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoIncDecStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoAssignStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoGoStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoDeferStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoReturnStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoBranchStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoBlockStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoIfStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoCaseClause node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoSwitchStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoTypeSwitchStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoCommClause node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoSelectStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoForStmt node) {
        this.postorder((GoStatement) node);
    }

    public void postorder(GoRangeStmt node) {
        this.postorder((GoStatement) node);
    }

    // declarations
    public void postorder(GoGenDecl node) {
        this.postorder((GoDeclaration) node);
    }

    public void postorder(GoFuncDecl node) {
        this.postorder((GoDeclaration) node);
    }

    public void postorder(GoImportSpec node) {
        this.postorder((GoSpec) node);
    }

    public void postorder(GoValueSpec node) {
        this.postorder((GoSpec) node);
    }

    public void postorder(GoTypeSpec node) {
        this.postorder((GoSpec) node);
    }

    /** Visit a tree from the root. */
    public <T extends IGoNode> T traverse(T node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }
}
