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

import org.tableconv.goConverter.ir.GoDeclaration;
import org.tableconv.goConverter.ir.GoExpression;
import org.tableconv.goConverter.ir.GoSpec;
import org.tableconv.goConverter.ir.IGoNode;
import org.tableconv.goConverter.ir.declaration.GoFuncDecl;
import org.tableconv.goConverter.ir.declaration.GoGenDecl;
import org.tableconv.goConverter.ir.declaration.GoImportSpec;
import org.tableconv.goConverter.ir.declaration.GoTypeSpec;
import org.tableconv.goConverter.ir.declaration.GoValueSpec;
import org.tableconv.goConverter.ir.expression.GoFuncLit;
import org.tableconv.goConverter.ir.expression.GoIdent;
import org.tableconv.goConverter.ir.expression.GoKeyValueExpr;
import org.tableconv.goConverter.ir.expression.GoSelectorExpr;
import org.tableconv.goConverter.ir.GoFile;
import org.tableconv.goConverter.ir.statement.GoAssignStmt;
import org.tableconv.goConverter.ir.statement.GoBlockStmt;
import org.tableconv.goConverter.ir.statement.GoBranchStmt;
import org.tableconv.goConverter.ir.statement.GoCaseClause;
import org.tableconv.goConverter.ir.statement.GoCommClause;
import org.tableconv.goConverter.ir.statement.GoForStmt;
import org.tableconv.goConverter.ir.statement.GoIfStmt;
import org.tableconv.goConverter.ir.statement.GoLabeledStmt;
import org.tableconv.goConverter.ir.statement.GoRangeStmt;
import org.tableconv.goConverter.ir.statement.GoSwitchStmt;
import org.tableconv.goConverter.ir.statement.GoTypeSwitchStmt;
import org.tableconv.goConverter.ir.type.GoField;
import org.tableconv.goConverter.ir.type.GoFuncType;
import org.tableconv.util.Logger;

import javax.annotation.Nullable;
import java.util.List;

/** Finds the declaration of each identifier use in a file, following Go's block scoping.
 * Names which are not declared in the file (predeclared identifiers, imported
 * packages, declarations in other files of the package) are left unresolved.
 * Field and method names after a selector and field names in composite
 * literal keys are not variable references and are not resolved. */
public class ResolveReferences extends GoVisitor {
    final Scopes<String, GoIdent> scopes;
    public final ReferenceMap reference;

    public ResolveReferences() {
        this.scopes = new Scopes<>();
        this.reference = new ReferenceMap();
    }

    void declare(@Nullable GoExpression expression) {
        if (expression == null)
            return;
        GoIdent ident = expression.as(GoIdent.class);
        if (ident == null || ident.isBlank())
            return;
        this.reference.declaration(ident);
        this.scopes.substitute(ident.name, ident);
    }

    void declareFields(List<GoField> fields) {
        for (GoField field: fields)
            for (GoIdent name: field.names)
                this.declare(name);
    }

    void declareSignature(GoFuncType type) {
        this.declareFields(type.typeParameters);
        this.declareFields(type.parameters);
        this.declareFields(type.results);
    }

    void visit(@Nullable IGoNode node) {
        if (node != null)
            node.accept(this);
    }

    void visit(List<? extends IGoNode> nodes) {
        for (IGoNode node: nodes)
            node.accept(this);
    }

    @Override
    public VisitDecision preorder(GoIdent ident) {
        if (this.reference.isDeclaration(ident) || ident.isBlank())
            return VisitDecision.STOP;
        GoIdent declaration = this.scopes.get(ident.name);
        if (declaration == null) {
            Logger.INSTANCE.belowLevel(this, 3)
                    .append("Unresolved ")
                    .append(ident.name)
                    .append(" at ")
                    .append(ident.start)
                    .newline();
            return VisitDecision.STOP;
        }
        this.reference.declare(ident, declaration);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GoFile file) {
        // Package-level names are visible in the whole file, regardless of order
        for (GoDeclaration declaration: file.declarations) {
            GoFuncDecl function = declaration.as(GoFuncDecl.class);
            if (function != null) {
                if (!function.isMethod())
                    this.declare(function.name);
                else
                    this.reference.declaration(function.name);
                continue;
            }
            GoGenDecl decl = declaration.to(GoGenDecl.class);
            for (GoSpec spec: decl.specs) {
                if (spec.is(GoValueSpec.class)) {
                    for (GoIdent name: spec.to(GoValueSpec.class).names)
                        this.declare(name);
                } else if (spec.is(GoTypeSpec.class)) {
                    this.declare(spec.to(GoTypeSpec.class).name);
                }
            }
        }
        this.reference.declaration(file.packageName);
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(GoImportSpec spec) {
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GoFuncDecl function) {
        this.push(function);
        this.scopes.newContext();
        this.declareFields(function.receiver);
        this.declareSignature(function.type);
        this.visit(function.receiver);
        this.visit(function.type);
        this.visit(function.body);
        this.scopes.popContext();
        this.pop(function);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GoFuncLit function) {
        this.push(function);
        this.scopes.newContext();
        this.declareSignature(function.type);
        this.visit(function.type);
        this.visit(function.body);
        this.scopes.popContext();
        this.pop(function);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GoField field) {
        // Field, parameter and method names are declarations, not uses
        for (GoIdent name: field.names)
            this.reference.declaration(name);
        this.push(field);
        this.visit(field.type);
        this.pop(field);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GoValueSpec spec) {
        this.push(spec);
        this.visit(spec.type);
        this.visit(spec.values);
        this.pop(spec);
        // The scope of a local constant or variable starts after its spec
        for (GoIdent name: spec.names)
            this.declare(name);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GoTypeSpec spec) {
        // The scope of a type starts at its name, so it may be recursive
        this.declare(spec.name);
        this.push(spec);
        this.visit(spec.type);
        this.pop(spec);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GoSelectorExpr expression) {
        this.push(expression);
        this.visit(expression.expression);
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GoKeyValueExpr expression) {
        this.push(expression);
        if (!expression.key.is(GoIdent.class))
            this.visit(expression.key);
        this.visit(expression.value);
        this.pop(expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GoLabeledStmt statement) {
        this.push(statement);
        this.visit(statement.statement);
        this.pop(statement);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GoBranchStmt statement) {
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GoAssignStmt statement) {
        if (!statement.isDefinition())
            return VisitDecision.CONTINUE;
        this.push(statement);
        this.visit(statement.right);
        for (GoExpression left: statement.left) {
            GoIdent ident = left.as(GoIdent.class);
            if (ident == null)
                continue;
            if (this.scopes.definedInInnermost(ident.name))
                // Redeclaration: this is an assignment to the existing variable
                this.visit(ident);
            else
                this.declare(ident);
        }
        this.pop(statement);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GoRangeStmt statement) {
        this.push(statement);
        this.visit(statement.expression);
        this.scopes.newContext();
        if (statement.isDefinition()) {
            this.declare(statement.key);
            this.declare(statement.value);
        } else {
            this.visit(statement.key);
            this.visit(statement.value);
        }
        this.visit(statement.body);
        this.scopes.popContext();
        this.pop(statement);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GoTypeSwitchStmt statement) {
        this.push(statement);
        this.scopes.newContext();
        this.visit(statement.init);
        GoIdent symbol = null;
        GoAssignStmt assign = statement.assign.as(GoAssignStmt.class);
        if (assign != null) {
            this.visit(assign.right);
            symbol = assign.left.get(0).as(GoIdent.class);
            if (symbol != null)
                this.reference.declaration(symbol);
        } else {
            this.visit(statement.assign);
        }
        for (GoCaseClause clause: statement.clauses) {
            this.scopes.newContext();
            // Each clause gets its own copy of the symbol
            if (symbol != null && !symbol.isBlank())
                this.scopes.substitute(symbol.name, symbol);
            this.visit(clause);
            this.scopes.popContext();
        }
        this.scopes.popContext();
        this.pop(statement);
        return VisitDecision.STOP;
    }

    VisitDecision openScope() {
        this.scopes.newContext();
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(GoBlockStmt statement) {
        return this.openScope();
    }

    @Override
    public void postorder(GoBlockStmt statement) {
        this.scopes.popContext();
    }

    @Override
    public VisitDecision preorder(GoIfStmt statement) {
        return this.openScope();
    }

    @Override
    public void postorder(GoIfStmt statement) {
        this.scopes.popContext();
    }

    @Override
    public VisitDecision preorder(GoForStmt statement) {
        return this.openScope();
    }

    @Override
    public void postorder(GoForStmt statement) {
        this.scopes.popContext();
    }

    @Override
    public VisitDecision preorder(GoSwitchStmt statement) {
        return this.openScope();
    }

    @Override
    public void postorder(GoSwitchStmt statement) {
        this.scopes.popContext();
    }

    @Override
    public VisitDecision preorder(GoCaseClause clause) {
        return this.openScope();
    }

    @Override
    public void postorder(GoCaseClause clause) {
        this.scopes.popContext();
    }

    @Override
    public VisitDecision preorder(GoCommClause clause) {
        return this.openScope();
    }

    @Override
    public void postorder(GoCommClause clause) {
        this.scopes.popContext();
    }

    @Override
    public void startVisit(IGoNode node) {
        this.scopes.clear();
        this.scopes.newContext();
        this.reference.clear();
        super.startVisit(node);
    }

    @Override
    public void endVisit() {
        this.scopes.popContext();
        this.scopes.mustBeEmpty();
        super.endVisit();
    }
}
