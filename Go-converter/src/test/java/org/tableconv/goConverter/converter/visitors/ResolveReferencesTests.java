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

package org.tableconv.goConverter.converter.visitors;

import org.junit.Assert;
import org.junit.Test;
import org.tableconv.goConverter.ConverterTestBase;
import org.tableconv.goConverter.ir.GoFile;
import org.tableconv.goConverter.ir.expression.GoIdent;

import java.util.List;

public class ResolveReferencesTests extends ConverterTestBase {
    static ReferenceMap resolve(GoFile file) {
        ResolveReferences resolve = new ResolveReferences();
        resolve.traverse(file);
        return resolve.reference;
    }

    @Test
    public void blockScopes() {
        String source = """
                package p

                var x = 1

                func f() int {
                    y := x
                    {
                        x := 2
                        y = x
                    }
                    return y + x
                }
                """;
        GoFile file = parse(source);
        ReferenceMap reference = resolve(file);
        List<GoIdent> x = identifiers(file, "x");
        Assert.assertEquals(5, x.size());
        Assert.assertTrue(reference.isDeclaration(x.get(0)));
        Assert.assertSame(x.get(0), reference.get(x.get(1)));
        Assert.assertTrue(reference.isDeclaration(x.get(2)));
        Assert.assertSame(x.get(2), reference.get(x.get(3)));
        Assert.assertSame(x.get(0), reference.get(x.get(4)));
        Assert.assertEquals(List.of(x.get(1), x.get(4)), reference.usesOf(x.get(0)));

        List<GoIdent> y = identifiers(file, "y");
        Assert.assertEquals(3, y.size());
        Assert.assertTrue(reference.sameEntity(y.get(0), y.get(1)));
        Assert.assertTrue(reference.sameEntity(y.get(1), y.get(2)));
    }

    @Test
    public void packageNamesAreVisibleBeforeDeclaration() {
        String source = """
                package p

                func f() int {
                    return g() + limit
                }

                func g() int { return 0 }

                const limit = 3
                """;
        GoFile file = parse(source);
        ReferenceMap reference = resolve(file);
        List<GoIdent> g = identifiers(file, "g");
        Assert.assertTrue(reference.sameEntity(g.get(0), g.get(1)));
        List<GoIdent> limit = identifiers(file, "limit");
        Assert.assertSame(limit.get(1), reference.get(limit.get(0)));
    }

    @Test
    public void rangeAndClosures() {
        String source = """
                package p

                func f(tests []int) {
                    for _, tc := range tests {
                        go func(tc int) {
                            _ = tc
                        }(tc)
                        _ = tc
                    }
                }
                """;
        GoFile file = parse(source);
        ReferenceMap reference = resolve(file);
        List<GoIdent> tc = identifiers(file, "tc");
        // range binding, parameter, use of the parameter, argument, use of the binding
        Assert.assertEquals(5, tc.size());
        Assert.assertTrue(reference.isDeclaration(tc.get(0)));
        Assert.assertTrue(reference.isDeclaration(tc.get(1)));
        Assert.assertSame(tc.get(1), reference.get(tc.get(2)));
        Assert.assertSame(tc.get(0), reference.get(tc.get(3)));
        Assert.assertSame(tc.get(0), reference.get(tc.get(4)));
        List<GoIdent> tests = identifiers(file, "tests");
        Assert.assertSame(tests.get(0), reference.get(tests.get(1)));
    }

    @Test
    public void selectorsAndKeysAreNotUses() {
        String source = """
                package p

                type T struct{ name string }

                func f(name string) T {
                    t := T{name: name}
                    return T{name: t.name}
                }
                """;
        GoFile file = parse(source);
        ReferenceMap reference = resolve(file);
        List<GoIdent> name = identifiers(file, "name");
        // field, parameter, key, value, key, selector
        Assert.assertEquals(6, name.size());
        Assert.assertSame(name.get(1), reference.get(name.get(3)));
        Assert.assertNull(reference.get(name.get(2)));
        Assert.assertNull(reference.get(name.get(4)));
        Assert.assertNull(reference.get(name.get(5)));
    }

    @Test
    public void redeclarationInSameScope() {
        String source = """
                package p

                func f() {
                    a, err := 1, error(nil)
                    b, err := 2, error(nil)
                    _, _, _ = a, b, err
                }
                """;
        GoFile file = parse(source);
        ReferenceMap reference = resolve(file);
        List<GoIdent> err = identifiers(file, "err");
        Assert.assertEquals(3, err.size());
        Assert.assertTrue(reference.isDeclaration(err.get(0)));
        Assert.assertSame(err.get(0), reference.get(err.get(1)));
        Assert.assertSame(err.get(0), reference.get(err.get(2)));
    }
}
