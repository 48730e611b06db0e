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
import org.tableconv.goConverter.converter.FileConversion;
import org.tableconv.goConverter.converter.errors.ConverterMessages;

import java.util.List;

public class ReferenceRewriterTests extends ConverterTestBase {
    @Test
    public void nestedLoops() {
        String source = """
                package p

                import "testing"

                func TestNested(t *testing.T) {
                    outer := []struct{ name string; n int }{{"o", 1}}
                    inner := []struct{ desc string; m int }{{"i", 2}}
                    for _, o := range outer {
                        for _, i := range inner {
                            t.Run(o.name+i.desc, func(t *testing.T) {})
                        }
                    }
                }
                """;
        String expected = """
                package p

                import "testing"

                func TestNested(t *testing.T) {
                    outer := map[string]struct{ n int }{"o": {1}}
                    inner := map[string]struct{ m int }{"i": {2}}
                    for name := range outer {
                        for iName := range inner {
                            t.Run(name+iName, func(t *testing.T) {})
                        }
                    }
                }
                """;
        FileConversion conversion = convert(source);
        Assert.assertEquals(expected, conversion.getOutput());
        Assert.assertEquals(2, conversion.getTablesConverted());
        List<ConverterMessages.Message> warnings = conversion.messages.getWarnings();
        Assert.assertEquals(1, warnings.size());
        Assert.assertEquals(ReferenceRewriter.SHADOWING, warnings.get(0).errorType);
        Assert.assertEquals(9, warnings.get(0).range.start.line);
    }

    @Test
    public void nestedLoopsBothNamed() {
        String source = """
                package p

                import "testing"

                func TestNested(t *testing.T) {
                    outer := []struct{ name string; n int }{{"o", 1}}
                    inner := []struct{ desc string; m int }{{"i", 2}}
                    for _, o := range outer {
                        t.Run(o.name, func(t *testing.T) {
                            for _, i := range inner {
                                t.Run(i.desc, func(t *testing.T) { _ = o.n + i.m })
                            }
                        })
                    }
                }
                """;
        String expected = """
                package p

                import "testing"

                func TestNested(t *testing.T) {
                    outer := map[string]struct{ n int }{"o": {1}}
                    inner := map[string]struct{ m int }{"i": {2}}
                    for name, o := range outer {
                        t.Run(name, func(t *testing.T) {
                            for name, i := range inner {
                                t.Run(name, func(t *testing.T) { _ = o.n + i.m })
                            }
                        })
                    }
                }
                """;
        FileConversion conversion = convert(source);
        Assert.assertEquals(expected, conversion.getOutput());
        Assert.assertTrue(conversion.messages.isEmpty());
        Assert.assertEquals(4, conversion.getSites().size());
    }

    @Test
    public void assignedCopy() {
        String source = """
                package p

                import "testing"

                func TestCopy(t *testing.T) {
                    tests := []struct{ name string; n int }{{"a", 1}}
                    for _, tc := range tests {
                        c := tc
                        c.n++
                        c = tc
                        t.Run(c.name, func(t *testing.T) { _ = c.n })
                    }
                }
                """;
        FileConversion conversion = convert(source);
        String output = conversion.getOutput();
        Assert.assertNotNull(output);
        Assert.assertTrue(output, output.contains("for name, tc := range tests {"));
        Assert.assertTrue(output, output.contains("t.Run(name, func(t *testing.T) { _ = c.n })"));
        Assert.assertTrue(output, output.contains("c = tc\n"));
    }

    @Test
    public void otherReceiversAreFieldAccesses() {
        String source = """
                package p

                import "testing"

                func BenchmarkX(b *testing.B) {
                    cases := []struct{ name string }{{"x"}}
                    for _, c := range cases {
                        b.Run(c.name, func(b *testing.B) {})
                    }
                }
                """;
        FileConversion conversion = convert(source);
        Assert.assertTrue(conversion.isModified());
        List<ConsumerSite> sites = conversion.getSites();
        Assert.assertEquals(2, sites.size());
        Assert.assertEquals(ConsumerSite.Kind.RANGE, sites.get(0).kind());
        Assert.assertEquals(ConsumerSite.Kind.FIELD_ACCESS, sites.get(1).kind());
        String output = conversion.getOutput();
        Assert.assertNotNull(output);
        Assert.assertTrue(output.contains("b.Run(name, func(b *testing.B) {})"));
    }

    @Test
    public void rangeWithoutBindingsIsLeftAlone() {
        String source = """
                package p

                func f() int {
                    tests := []struct{ name string }{{"x"}}
                    count := 0
                    for range tests {
                        count++
                    }
                    return count
                }
                """;
        FileConversion conversion = convert(source);
        Assert.assertTrue(conversion.isModified());
        Assert.assertTrue(conversion.getSites().isEmpty());
        Assert.assertTrue(conversion.messages.isEmpty());
    }

    @Test
    public void assignmentRangeWarns() {
        String source = """
                package p

                func f() {
                    tests := []struct{ name string }{{"x"}}
                    var i int
                    var tc struct{ name string }
                    for i, tc = range tests {
                    }
                    _, _ = i, tc
                }
                """;
        FileConversion conversion = convert(source);
        Assert.assertTrue(conversion.getSites().isEmpty());
        List<ConverterMessages.Message> warnings = conversion.messages.getWarnings();
        Assert.assertEquals(1, warnings.size());
        Assert.assertEquals(7, warnings.get(0).range.start.line);
    }

    @Test
    public void rowVariableShadowedInClosure() {
        String source = """
                package p

                import "testing"

                func TestX(t *testing.T) {
                    tests := []struct{ name string }{{"x"}}
                    for _, tc := range tests {
                        func(tc struct{ name string }) {
                            t.Log(tc.name)
                        }(tc)
                    }
                }
                """;
        FileConversion conversion = convert(source);
        String output = conversion.getOutput();
        Assert.assertNotNull(output);
        // The parameter is another variable: its field is not rewritten,
        // and a key nobody reads is not introduced
        Assert.assertTrue(output.contains("t.Log(tc.name)"));
        Assert.assertTrue(output.contains("for _, tc := range tests {"));
        Assert.assertTrue(conversion.getSites().isEmpty());
    }
}
