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

package org.tableconv.goConverter.converter.backend;

import org.junit.Assert;
import org.junit.Test;
import org.tableconv.goConverter.ConverterTestBase;
import org.tableconv.goConverter.converter.errors.InternalConverterError;
import org.tableconv.goConverter.converter.errors.SourceFileContents;
import org.tableconv.goConverter.converter.frontend.GoSourceTokens;
import org.tableconv.goConverter.ir.GoFile;
import org.tableconv.goConverter.ir.declaration.GoGenDecl;
import org.tableconv.goConverter.ir.declaration.GoValueSpec;
import org.tableconv.goConverter.ir.expression.GoCompositeLit;
import org.tableconv.goConverter.ir.type.GoArrayType;
import org.tableconv.goConverter.ir.type.GoStructType;

import java.nio.charset.StandardCharsets;

public class SourceEditsTests extends ConverterTestBase {
    static SourceEdits edits(String text) {
        return new SourceEdits(new GoSourceTokens(new SourceFileContents("edits.go", text)));
    }

    @Test
    public void editsAreAppliedInOrder() {
        SourceEdits edits = edits("abcdef");
        edits.replace(4, 5, "E");
        edits.delete(1, 2);
        edits.insert(0, ">");
        Assert.assertEquals(">acdEf", edits.apply());
        Assert.assertEquals(3, edits.size());
    }

    @Test
    public void insertionPrecedesReplacementAtSameOffset() {
        SourceEdits edits = edits("{\"a\", 1}");
        edits.replace(1, 6, "");
        edits.insert(0, "\"a\": ");
        edits.insert(1, "");
        Assert.assertEquals("\"a\": {1}", edits.apply());
    }

    @Test
    public void overlappingEditsAreRejected() {
        SourceEdits edits = edits("abcdef");
        edits.replace(1, 4, "x");
        edits.replace(2, 5, "y");
        Assert.assertThrows(InternalConverterError.class, edits::apply);
    }

    @Test
    public void noEditsIsIdentity() {
        String source = """
                package p

                // comment
                var x = 1
                """;
        GoFile file = parse(source);
        Assert.assertFalse(file.isModified());
        GoSourcePrinter printer = new GoSourcePrinter();
        Assert.assertEquals(source, printer.toText(file));
        Assert.assertArrayEquals(source.getBytes(StandardCharsets.UTF_8), printer.print(file));
    }

    static GoStructType structOf(GoFile file) {
        GoValueSpec spec = file.declarations.get(0).to(GoGenDecl.class).specs.get(0).to(GoValueSpec.class);
        GoCompositeLit literal = spec.values.get(0).to(GoCompositeLit.class);
        return literal.type.to(GoArrayType.class).elementType.to(GoStructType.class);
    }

    @Test
    public void deleteFieldOnItsOwnLine() {
        String source = """
                package p

                var x = []struct {
                    a int // first
                    b int
                }{}
                """;
        GoFile file = parse(source);
        file.edits.deleteElement(structOf(file).fields, 0, true);
        Assert.assertEquals("""
                package p

                var x = []struct {
                    b int
                }{}
                """, new GoSourcePrinter().toText(file));
    }

    @Test
    public void deleteInlineFields() {
        String source = """
                package p

                var x = []struct{ a int; b int; c int }{}
                """;
        GoFile file = parse(source);
        file.edits.deleteElement(structOf(file).fields, 0, true);
        Assert.assertEquals("""
                package p

                var x = []struct{ b int; c int }{}
                """, new GoSourcePrinter().toText(file));

        file = parse(source);
        file.edits.deleteElement(structOf(file).fields, 2, true);
        Assert.assertEquals("""
                package p

                var x = []struct{ a int; b int }{}
                """, new GoSourcePrinter().toText(file));
    }

    @Test
    public void deleteOnlyElement() {
        String source = """
                package p

                var x = []struct{ a int; }{}
                """;
        GoFile file = parse(source);
        file.edits.deleteElement(structOf(file).fields, 0, false);
        Assert.assertEquals("""
                package p

                var x = []struct{}{}
                """, new GoSourcePrinter().toText(file));

        file = parse("""
                package p

                var x = []struct{ a int }{}
                """);
        file.edits.deleteElement(structOf(file).fields, 0, true);
        Assert.assertEquals("""
                package p

                var x = []struct{}{}
                """, new GoSourcePrinter().toText(file));
    }

    @Test
    public void editsSpanningSeveralTokens() {
        SourceEdits edits = edits("a + b\n\n\nc");
        // The three newlines form a single token, of which two are deleted
        edits.delete(6, 8);
        edits.replace(0, 5, "x");
        edits.insert(9, " // end");
        Assert.assertEquals("x\nc // end", edits.apply());
    }

    @Test
    public void offsetsAfterSupplementaryCharacters() {
        String source = """
                package p

                var s = "\uD83D\uDE00"
                var x = 1
                """;
        GoFile file = parse(source);
        GoValueSpec spec = file.declarations.get(1).to(GoGenDecl.class).specs.get(0).to(GoValueSpec.class);
        Assert.assertEquals("x", file.getText(spec.names.get(0)));
        file.edits.replace(spec.names.get(0), "y");
        Assert.assertEquals(source.replace("var x", "var y"), new GoSourcePrinter().toText(file));
    }
}
