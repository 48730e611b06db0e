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
import org.tableconv.goConverter.ir.expression.GoIdent;
import org.tableconv.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Maps each identifier use to the identifier which declares it.
 * Identifiers are compared by identity: two occurrences of the same name
 * are distinct nodes. */
public class ReferenceMap {
    final Map<GoIdent, GoIdent> declarations;
    /** Identifiers which introduce a name. */
    final Set<GoIdent> declared;

    public ReferenceMap() {
        this.declarations = new HashMap<>();
        this.declared = Collections.newSetFromMap(new IdentityHashMap<>());
    }

    /** Record an identifier which declares a name. */
    public void declaration(GoIdent ident) {
        this.declared.add(ident);
    }

    public boolean isDeclaration(GoIdent ident) {
        return this.declared.contains(ident);
    }

    /** Record that 'use' refers to the entity declared by 'declaration'. */
    public void declare(GoIdent use, GoIdent declaration) {
        if (this.declarations.containsKey(use)) {
            GoIdent decl = this.declarations.get(use);
            if (decl != declaration)
                throw new InternalConverterError("Changing declaration of " + use + " from " +
                        decl.start + " to " + declaration.start);
            return;
        }
        Utilities.putNew(this.declarations, use, declaration);
    }

    public GoIdent getDeclaration(GoIdent use) {
        return Utilities.getExists(this.declarations, use);
    }

    /** The declaration of this use; null if the name is not declared in the file,
     * e.g., it is predeclared or belongs to another file of the package. */
    @Nullable
    public GoIdent get(GoIdent use) {
        return this.declarations.get(use);
    }

    /** True if both identifiers denote the same declared entity. */
    public boolean sameEntity(GoIdent left, GoIdent right) {
        GoIdent l = this.isDeclaration(left) ? left : this.get(left);
        GoIdent r = this.isDeclaration(right) ? right : this.get(right);
        return l != null && l == r;
    }

    /** All uses of the entity introduced by a declaring identifier, in source order. */
    public List<GoIdent> usesOf(GoIdent declaration) {
        List<GoIdent> result = new ArrayList<>();
        for (var kv: this.declarations.entrySet()) {
            if (kv.getValue() == declaration)
                result.add(kv.getKey());
        }
        result.sort((l, r) -> Integer.compare(l.start, r.start));
        return result;
    }

    public void clear() {
        this.declarations.clear();
        this.declared.clear();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (var kv: this.declarations.entrySet()) {
            builder.append(kv.getKey().name)
                    .append("@")
                    .append(kv.getKey().start)
                    .append("=>")
                    .append(kv.getValue().name)
                    .append("@")
                    .append(kv.getValue().start)
                    .append(System.lineSeparator());
        }
        return builder.toString();
    }
}
