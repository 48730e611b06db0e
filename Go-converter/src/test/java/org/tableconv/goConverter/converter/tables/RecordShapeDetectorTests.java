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

import org.junit.Assert;
import org.junit.Test;
import org.tableconv.goConverter.ConverterTestBase;
import org.tableconv.goConverter.converter.visitors.ResolveReferences;
import org.tableconv.goConverter.ir.GoFile;

import java.util.List;

public class RecordShapeDetectorTests extends ConverterTestBase {
    static List<TableDeclaration> detect(String source) {
        GoFile file = parse(source);
        ResolveReferences resolve = new ResolveReferences();
        resolve.traverse(file);
        RecordShapeDetector detector = new RecordShapeDetector(file, resolve.reference);
        detector.traverse(file);
        Assert.assertFalse(file.isModified());
        return detector.tables;
    }

    @Test
    public void detectsTables() {
        String source = """
                package p

                var top = []struct {
                    name     string
                    in, want int
                }{
                    {"a", 1, 2},
                    {name: "b", want: 3},
                }

                func f() {
                    local := []struct{ description string }{{`x`}}
                    var inner = []struct{ desc rune; v int }{{'c', 1}}
                    _, _ = local, inner
                }
                """;
        List<TableDeclaration> tables = detect(source);
        Assert.assertEquals(3, tables.size());

        TableDeclaration top = tables.get(0);
        Assert.assertEquals("top", top.getName());
        Assert.assertEquals(3, top.fields.size());
        Assert.assertEquals(0, top.nameFieldIndex);
        Assert.assertEquals(2, top.rows.size());
        Assert.assertFalse(top.rows.get(0).isKeyed());
        Assert.assertTrue(top.rows.get(1).isKeyed());
        Assert.assertEquals("\"b\"", top.rows.get(1).key().value);
        Assert.assertEquals("map[string]struct{in int; want int}", top.getKeyedType().toString());

        Assert.assertEquals("local", tables.get(1).getName());
        Assert.assertEquals("description", tables.get(1).getNameField().fieldName());
        Assert.assertEquals("inner", tables.get(2).getName());
        Assert.assertEquals("rune", tables.get(2).getKeyedType().keyType());
    }

    @Test
    public void rejectsOtherShapes() {
        String source = """
                package p

                type row struct{ name string }

                var (
                    sized    = [2]struct{ name string }{{"a"}, {"b"}}
                    dots     = [...]struct{ name string }{{"a"}}
                    named    = []row{{"a"}}
                    noName   = []struct{ id int }{{1}}
                    computed = []struct{ name string }{{"a" + "b"}}
                    short    = []struct{ name string; v int }{{"a"}}
                    typed    = []struct{ name string }{struct{ name string }{"a"}}
                    missing  = []struct{ name string; v int }{{v: 1}}
                    pair, other = []struct{ name string }{{"a"}}, 1
                    empty    = []struct{}{}
                )

                const c = 1

                func f(existing []struct{ name string }) {
                    existing = []struct{ name string }{{"a"}}
                    existing, fresh := []struct{ name string }{{"a"}}, 1
                    _ = fresh
                }
                """;
        Assert.assertTrue(detect(source).isEmpty());
    }

    @Test
    public void embeddedFieldIsNotAName() {
        String source = """
                package p

                type name string

                var tests = []struct {
                    name
                    desc string
                }{
                    {"x", "y"},
                }
                """;
        List<TableDeclaration> tables = detect(source);
        Assert.assertEquals(1, tables.size());
        Assert.assertEquals(1, tables.get(0).nameFieldIndex);
        Assert.assertTrue(tables.get(0).fields.get(0).isEmbedded());
    }

    @Test
    public void zeroRowsAccepted() {
        List<TableDeclaration> tables = detect("package p\n\nvar t = []struct{ name string }{}\n");
        Assert.assertEquals(1, tables.size());
        Assert.assertTrue(tables.get(0).rows.isEmpty());
    }
}
