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
import org.tableconv.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A set of nested scopes.
 * Each scope is a namespace which can define new names, which may
 * shadow names defined in the outer scopes. */
public class Scopes<K, V> {
    /** Innermost scope last. */
    protected final List<Map<K, V>> stack;

    public Scopes() {
        this.stack = new ArrayList<>();
    }

    public void newContext() {
        this.stack.add(new HashMap<>());
    }

    public void popContext() {
        if (this.stack.isEmpty())
            throw new InternalConverterError("Popping an empty context");
        Utilities.removeLast(this.stack);
    }

    public void substitute(K key, V value) {
        if (this.stack.isEmpty())
            throw new InternalConverterError("Empty context");
        Utilities.last(this.stack).put(key, value);
    }

    public void mustBeEmpty() {
        if (!this.stack.isEmpty())
            throw new InternalConverterError("Non-empty context");
    }

    /**
     * The value bound to this key in the innermost scope which defines it.
     * null if there isn't any. */
    @Nullable
    public V get(K name) {
        for (int i = 0; i < this.stack.size(); i++) {
            int index = this.stack.size() - i - 1;
            Map<K, V> scope = this.stack.get(index);
            if (scope.containsKey(name))
                return scope.get(name);
        }
        return null;
    }

    /** True if the innermost scope defines this key. */
    public boolean definedInInnermost(K name) {
        if (this.stack.isEmpty())
            return false;
        return Utilities.last(this.stack).containsKey(name);
    }

    public int depth() {
        return this.stack.size();
    }

    void clear() {
        this.stack.clear();
    }

    @Override
    public String toString() {
        return this.stack.toString();
    }
}
