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

package org.tableconv.goConverter.converter.tables;

import org.tableconv.goConverter.converter.IErrorReporter;
import org.tableconv.goConverter.converter.visitors.GoVisitor;
import org.tableconv.goConverter.converter.visitors.ReferenceMap;
import org.tableconv.goConverter.converter.visitors.VisitDecision;
import org.tableconv.goConverter.ir.GoExpression;
import org.tableconv.goConverter.ir.GoFile;
import org.tableconv.goConverter.ir.IGoNode;
import org.tableconv.goConverter.ir.declaration.GoValueSpec;
import org.tableconv.goConverter.ir.expression.GoCallExpr;
import org.tableconv.goConverter.ir.expression.GoIdent;
import org.tableconv.goConverter.ir.expression.GoKeyValueExpr;
import org.tableconv.goConverter.ir.expression.GoSelectorExpr;
import org.tableconv.goConverter.ir.statement.GoAssignStmt;
import org.tableconv.goConverter.ir.statement.GoBlockStmt;
import org.tableconv.goConverter.ir.statement.GoRangeStmt;
import org.tableconv.goConverter.ir.type.GoInterfaceType;
import org.tableconv.goConverter.ir.type.GoStructType;
import org.tableconv.util.Logger;
import org.tableconv.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Updates the consumers of converted tables.
 * <ul>
 *     <li>'for _, tc := range table' becomes 'for name, tc := range table';
 *     a loop which already binds a key keeps it.</li>
 *     <li>Inside such a loop 't.Run(tc.name, ...)', and any other read of the
 *     removed field through the row variable or through a copy of it, is
 *     replaced by the key.</li>
 *     <li>A row variable which was only used to read the name is dropped:
 *     the loop becomes 'for name := range table'.</li>
 * </ul>
 * When 'name' is already taken inside the loop the key is named after the
 * row variable instead, e.g. 'tcName'.
 * Tables and row variables are matched through their declarations, not by name,
 * so a same-named variable in another scope is left alone.
 * Uses which cannot be rewritten produce warnings.
 */
public class ReferenceRewriter extends GoVisitor {
    static final String NOT_REWRITTEN = "Not rewritten";
    static final String SHADOWING = "Shadowing";

    /** A range statement over a converted table whose name reads are being rewritten. */
    record ActiveLoop(GoRangeStmt statement, TableDeclaration table, String keyName, Set<GoSelectorExpr> nameReads) {}

    final GoFile file;
    final ReferenceMap reference;
    final List<TableDeclaration> tables;
    final IErrorReporter reporter;
    final List<ActiveLoop> loops;
    /** Nodes already replaced; each node is rewritten at most once. */
    final Set<IGoNode> rewritten;
    public final List<ConsumerSite> sites;

    public ReferenceRewriter(GoFile file, ReferenceMap reference,
                             List<TableDeclaration> tables, IErrorReporter reporter) {
        this.file = file;
        this.reference = reference;
        this.tables = tables;
        this.reporter = reporter;
        this.loops = new ArrayList<>();
        this.rewritten = Collections.newSetFromMap(new IdentityHashMap<>());
        this.sites = new ArrayList<>();
    }

    /** The converted table this expression refers to, if any. */
    @Nullable
    TableDeclaration tableOf(GoExpression expression) {
        GoIdent ident = expression.as(GoIdent.class);
        if (ident == null)
            return null;
        for (TableDeclaration table: this.tables)
            if (this.reference.sameEntity(ident, table.variable))
                return table;
        return null;
    }

    void warn(IGoNode node, String kind, String message) {
        this.reporter.reportWarning(this.file.rangeOf(node), kind, message);
    }

    void replace(ConsumerSite.Kind kind, IGoNode node, TableDeclaration table, String replacement) {
        if (!this.rewritten.add(node))
            return;
        this.file.edits.replace(node, replacement);
        this.sites.add(new ConsumerSite(kind, node, table, replacement));
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Rewrote ")
                .append(kind.toString())
                .append(" ")
                .append(this.file.getText(node))
                .append(" -> ")
                .append(replacement)
                .newline();
    }

    @Override
    public VisitDecision preorder(GoRangeStmt statement) {
        TableDeclaration table = this.tableOf(statement.expression);
        if (table == null)
            return VisitDecision.CONTINUE;
        if (statement.key == null)
            // for range table { ... }
            return VisitDecision.CONTINUE;
        if (!statement.isDefinition()) {
            this.warn(statement.key, NOT_REWRITTEN, "range over converted table " + table.getName() +
                    " assigns to existing variables; the key is now the test name");
            return VisitDecision.CONTINUE;
        }
        GoIdent key = statement.key.as(GoIdent.class);
        GoIdent row = statement.value == null ? null : statement.value.as(GoIdent.class);
        if (key == null || row == null) {
            this.warn(statement.key, NOT_REWRITTEN, "range over converted table " + table.getName() +
                    " binds only the key, which is now the test name instead of an index");
            return VisitDecision.CONTINUE;
        }
        if (row.isBlank())
            return VisitDecision.CONTINUE;

        RowScanner scanner = new RowScanner(this.reference, row, table.getNameField().fieldName());
        scanner.traverse(statement.body);
        if (scanner.nameReads.isEmpty())
            // A key nobody reads would not compile
            return VisitDecision.CONTINUE;
        String keyName = key.name;
        if (key.isBlank()) {
            keyName = this.chooseKeyName(statement, row, scanner);
            if (keyName == null)
                return VisitDecision.CONTINUE;
            this.replace(ConsumerSite.Kind.RANGE, key, table, keyName);
        } else {
            GoIdent redeclared = this.declarationIn(statement.body, keyName);
            if (redeclared != null) {
                this.warn(redeclared, SHADOWING, "declaration of " + keyName +
                        " in the loop body shadows the loop key; reads of " +
                        row.name + "." + scanner.fieldName + " are not rewritten");
                return VisitDecision.CONTINUE;
            }
        }
        this.loops.add(new ActiveLoop(statement, table, keyName, scanner.nameReads));
        this.dropUnusedCopies(statement, key, scanner);
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(GoRangeStmt statement) {
        if (!this.loops.isEmpty() && Utilities.last(this.loops).statement() == statement)
            Utilities.removeLast(this.loops);
    }

    /** The name of the key bound in place of '_': 'name', or the row variable's
     * name followed by 'Name' when 'name' is taken inside the loop.
     * Returns null, after a warning, when neither can be used. */
    @Nullable
    String chooseKeyName(GoRangeStmt statement, GoIdent row, RowScanner scanner) {
        String conflict = this.conflict(statement, scanner, TableShape.KEY_NAME);
        if (conflict == null)
            return TableShape.KEY_NAME;
        String fallback = row.name + "Name";
        if (this.conflict(statement, scanner, fallback) != null) {
            this.warn(statement.key, NOT_REWRITTEN, conflict);
            return null;
        }
        this.warn(statement.key, SHADOWING, conflict + "; the key is named " + fallback);
        return fallback;
    }

    /** Describes why a key named keyName would change the meaning of the loop; null if it would not. */
    @Nullable
    String conflict(GoRangeStmt statement, RowScanner scanner, String keyName) {
        for (GoIdent ident: identifiersIn(statement.body)) {
            if (!ident.name.equals(keyName))
                continue;
            if (this.reference.isDeclaration(ident))
                return "declaration of " + keyName + " in the loop body would shadow the loop key";
            GoIdent declaration = this.reference.get(ident);
            if (declaration == null || declaration.start < statement.start || declaration.start >= statement.end)
                return "loop key " + keyName + " would shadow an outer declaration used in the loop body";
        }
        for (ActiveLoop enclosing: this.loops) {
            if (!enclosing.keyName().equals(keyName))
                continue;
            for (GoSelectorExpr read: enclosing.nameReads()) {
                if (read.start >= statement.body.start && read.end <= statement.body.end)
                    return "range over converted table is nested in a loop whose key " + keyName +
                            " is read in the loop body";
            }
        }
        if (keyName.equals(scanner.row.name))
            return "loop key " + keyName + " would have the name of the row variable";
        return null;
    }

    @Nullable
    GoIdent declarationIn(IGoNode node, String name) {
        for (GoIdent ident: identifiersIn(node)) {
            if (ident.name.equals(name) && this.reference.isDeclaration(ident))
                return ident;
        }
        return null;
    }

    /** Remove the row variable and its copies when all their uses are name reads,
     * which are all replaced by the key. */
    void dropUnusedCopies(GoRangeStmt statement, GoIdent key, RowScanner scanner) {
        Set<GoIdent> readBases = Collections.newSetFromMap(new IdentityHashMap<>());
        for (GoSelectorExpr read: scanner.nameReads)
            readBases.add(read.expression.to(GoIdent.class));
        Map<GoIdent, RowVariable> copiedBy = new IdentityHashMap<>();
        for (RowVariable variable: scanner.variables)
            if (variable.source() != null)
                copiedBy.put(variable.source(), variable);

        Set<RowVariable> unused = Collections.newSetFromMap(new IdentityHashMap<>());
        // A copy is always declared after its source
        for (int i = scanner.variables.size() - 1; i >= 0; i--) {
            RowVariable variable = scanner.variables.get(i);
            if (i > 0 && !(variable.isRemovable() && scanner.blocks.containsKey(variable.definition())))
                continue;
            List<GoIdent> uses = this.reference.usesOf(variable.declaration());
            if (uses.isEmpty())
                continue;
            boolean onlyNames = true;
            for (GoIdent use: uses) {
                RowVariable copy = copiedBy.get(use);
                if (!readBases.contains(use) && (copy == null || !unused.contains(copy))) {
                    onlyNames = false;
                    break;
                }
            }
            if (onlyNames)
                unused.add(variable);
        }

        for (RowVariable variable: scanner.variables) {
            if (!unused.contains(variable))
                continue;
            if (variable.definition() == null) {
                // for key, row := range table
                this.file.edits.delete(key.getEnd(), variable.declaration().getEnd());
            } else {
                GoBlockStmt block = Utilities.getExists(scanner.blocks, variable.definition());
                this.file.edits.deleteElement(block.statements, block.statements.indexOf(variable.definition()), true);
            }
            Logger.INSTANCE.belowLevel(this, 2)
                    .append("Dropped ")
                    .append(variable.declaration().name)
                    .append(" in loop at ")
                    .append(this.file.rangeOf(statement).start.line)
                    .newline();
        }
    }

    /** If this expression reads the removed name field through a tracked variable,
     * return the loop which tracks it. */
    @Nullable
    ActiveLoop nameFieldAccess(GoExpression expression) {
        GoSelectorExpr selector = expression.as(GoSelectorExpr.class);
        if (selector == null)
            return null;
        for (int i = this.loops.size() - 1; i >= 0; i--) {
            ActiveLoop loop = this.loops.get(i);
            if (loop.nameReads().contains(selector))
                return loop;
        }
        return null;
    }

    static boolean isRunCall(GoCallExpr call) {
        if (call.arguments.size() != 2)
            return false;
        GoSelectorExpr function = call.function.as(GoSelectorExpr.class);
        if (function == null || !function.selector.name.equals(TableShape.RUN_METHOD))
            return false;
        GoIdent receiver = function.expression.as(GoIdent.class);
        return receiver != null && receiver.name.equals(TableShape.RUN_RECEIVER);
    }

    @Override
    public VisitDecision preorder(GoCallExpr call) {
        if (!this.loops.isEmpty() && isRunCall(call)) {
            GoExpression argument = call.arguments.get(0);
            ActiveLoop loop = this.nameFieldAccess(argument);
            if (loop != null)
                this.replace(ConsumerSite.Kind.RUN_CALL, argument, loop.table(), loop.keyName());
        }
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(GoSelectorExpr expression) {
        ActiveLoop loop = this.nameFieldAccess(expression);
        if (loop != null) {
            this.replace(ConsumerSite.Kind.FIELD_ACCESS, expression, loop.table(), loop.keyName());
            return VisitDecision.STOP;
        }
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(GoIdent ident) {
        if (this.reference.isDeclaration(ident))
            return VisitDecision.STOP;
        TableDeclaration table = this.tableOf(ident);
        if (table == null)
            return VisitDecision.STOP;
        IGoNode parent = this.getParent();
        if (parent != null && parent.is(GoRangeStmt.class)
                && parent.to(GoRangeStmt.class).expression == ident)
            return VisitDecision.STOP;
        this.warn(ident, NOT_REWRITTEN, "use of converted table " + table.getName() +
                " outside a range statement; it is now a map");
        return VisitDecision.STOP;
    }

    /**
     * A variable holding a table row: the row variable of a range statement,
     * or a copy made in the loop body by 'v := row', 'v = row' or 'var v = row'.
     * @param declaration  Identifier which declares the variable.
     * @param from         Offset after which the variable holds the row.
     * @param definition   The 'v := row' statement, if the copy is made by one.
     * @param source       The use of the copied variable.
     */
    record RowVariable(GoIdent declaration, int from, @Nullable GoAssignStmt definition, @Nullable GoIdent source) {
        /** A copy which can be deleted together with its definition. */
        boolean isRemovable() {
            return this.definition != null
                    && this.definition.left.size() == 1
                    && this.definition.left.get(0) == this.declaration;
        }
    }

    /** Collects, in a loop body, the variables holding the row and their reads of the name field. */
    static final class RowScanner extends GoVisitor {
        final ReferenceMap reference;
        final GoIdent row;
        final String fieldName;
        /** The row variable first, then its copies in source order. */
        final List<RowVariable> variables;
        final Set<GoSelectorExpr> nameReads;
        /** Blocks holding the statements which define copies. */
        final Map<GoAssignStmt, GoBlockStmt> blocks;

        RowScanner(ReferenceMap reference, GoIdent row, String fieldName) {
            this.reference = reference;
            this.row = row;
            this.fieldName = fieldName;
            this.variables = new ArrayList<>();
            this.variables.add(new RowVariable(row, row.end, null, null));
            this.nameReads = Collections.newSetFromMap(new IdentityHashMap<>());
            this.blocks = new IdentityHashMap<>();
        }

        /** The variable holding the row which this identifier denotes at its position. */
        @Nullable
        RowVariable holding(GoIdent ident) {
            for (RowVariable variable: this.variables)
                if (ident.start >= variable.from() && this.reference.sameEntity(ident, variable.declaration()))
                    return variable;
            return null;
        }

        /** Record left as a copy of the row if right denotes a variable holding it. */
        void copy(GoExpression left, GoExpression right, int from, @Nullable GoAssignStmt definition) {
            GoIdent target = left.as(GoIdent.class);
            GoIdent source = right.as(GoIdent.class);
            if (target == null || source == null || target.isBlank() || this.holding(source) == null)
                return;
            GoIdent declaration = this.reference.isDeclaration(target) ? target : this.reference.get(target);
            if (declaration == null)
                return;
            this.variables.add(new RowVariable(declaration, from, definition, source));
        }

        @Override
        public VisitDecision preorder(GoAssignStmt statement) {
            if (statement.left.size() != statement.right.size())
                return VisitDecision.CONTINUE;
            if (!statement.isDefinition() && !statement.operator.equals("="))
                return VisitDecision.CONTINUE;
            GoAssignStmt defining = statement.isDefinition() ? statement : null;
            for (int i = 0; i < statement.left.size(); i++)
                this.copy(statement.left.get(i), statement.right.get(i), statement.end, defining);
            IGoNode parent = this.getParent();
            if (defining != null && parent != null && parent.is(GoBlockStmt.class))
                this.blocks.put(statement, parent.to(GoBlockStmt.class));
            return VisitDecision.CONTINUE;
        }

        @Override
        public VisitDecision preorder(GoValueSpec spec) {
            if (spec.names.size() == spec.values.size())
                for (int i = 0; i < spec.names.size(); i++)
                    this.copy(spec.names.get(i), spec.values.get(i), spec.end, null);
            return VisitDecision.CONTINUE;
        }

        @Override
        public VisitDecision preorder(GoSelectorExpr expression) {
            GoIdent base = expression.expression.as(GoIdent.class);
            if (base != null && expression.selector.name.equals(this.fieldName) && this.holding(base) != null)
                this.nameReads.add(expression);
            return VisitDecision.CONTINUE;
        }
    }

    /** Identifiers in a subtree which can denote variables, in source order.
     * Field names in selectors, in keyed literals and in struct types are skipped. */
    static List<GoIdent> identifiersIn(IGoNode node) {
        List<GoIdent> result = new ArrayList<>();
        GoVisitor collector = new GoVisitor() {
            @Override
            public VisitDecision preorder(GoIdent ident) {
                result.add(ident);
                return VisitDecision.STOP;
            }

            @Override
            public VisitDecision preorder(GoSelectorExpr expression) {
                expression.expression.accept(this);
                return VisitDecision.STOP;
            }

            @Override
            public VisitDecision preorder(GoKeyValueExpr expression) {
                if (!expression.key.is(GoIdent.class))
                    expression.key.accept(this);
                expression.value.accept(this);
                return VisitDecision.STOP;
            }

            @Override
            public VisitDecision preorder(GoStructType type) {
                return VisitDecision.STOP;
            }

            @Override
            public VisitDecision preorder(GoInterfaceType type) {
                return VisitDecision.STOP;
            }
        };
        node.accept(collector);
        return result;
    }

    @Override
    public void endVisit() {
        Logger.INSTANCE.belowLevel(this, 1)
                .append(this.file.getFileName())
                .append(": rewrote ")
                .append(this.sites.size())
                .append(" consumer sites")
                .newline();
        super.endVisit();
    }
}
