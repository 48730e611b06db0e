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

package org.tableconv.goConverter.converter;

import org.junit.Assert;
import org.junit.Test;
import org.tableconv.goConverter.ConverterTestBase;
import org.tableconv.goConverter.converter.errors.ConverterMessages;
import org.tableconv.goConverter.converter.errors.SyntaxError;
import org.tableconv.goConverter.converter.tables.ConsumerSite;

import java.util.List;

/** End-to-end conversion of single files held in memory. */
public class ConversionTests extends ConverterTestBase {
    static final String SIMPLE = """
            package calc

            import "testing"

            func TestAdd(t *testing.T) {
                tests := []struct {
                    name string
                    a    int
                    b    int
                }{
                    {"one", 1, 2},
                    {"two", 3, 4},
                    {"three", 5, 6},
                }
                for _, tc := range tests {
                    t.Run(tc.name, func(t *testing.T) {
                        if tc.a+tc.b == 0 {
                            t.Fatal("zero")
                        }
                    })
                }
            }
            """;

    static final String SIMPLE_CONVERTED = """
            package calc

            import "testing"

            func TestAdd(t *testing.T) {
                tests := map[string]struct {
                    a    int
                    b    int
                }{
                    "one": {1, 2},
                    "two": {3, 4},
                    "three": {5, 6},
                }
                for name, tc := range tests {
                    t.Run(name, func(t *testing.T) {
                        if tc.a+tc.b == 0 {
                            t.Fatal("zero")
                        }
                    })
                }
            }
            """;

    @Test
    public void convertSimpleTable() {
        FileConversion conversion = assertConverted(SIMPLE, SIMPLE_CONVERTED);
        Assert.assertEquals(1, conversion.getTablesConverted());
        Assert.assertTrue(conversion.messages.isEmpty());
        List<ConsumerSite> sites = conversion.getSites();
        Assert.assertEquals(2, sites.size());
        Assert.assertEquals(ConsumerSite.Kind.RANGE, sites.get(0).kind());
        Assert.assertEquals(ConsumerSite.Kind.RUN_CALL, sites.get(1).kind());
    }

    @Test
    public void conversionIsIdempotent() {
        FileConversion first = convert(SIMPLE);
        String output = first.getOutput();
        Assert.assertNotNull(output);
        assertUnchanged(output);
    }

    @Test
    public void computedNameIsSkipped() {
        String source = """
                package calc

                import (
                    "fmt"
                    "testing"
                )

                func TestAdd(t *testing.T) {
                    tests := []struct {
                        name string
                        a    int
                    }{
                        {"one", 1},
                        {fmt.Sprint("two"), 2},
                    }
                    for _, tc := range tests {
                        t.Run(tc.name, func(t *testing.T) {})
                    }
                }
                """;
        FileConversion conversion = assertUnchanged(source);
        Assert.assertTrue(conversion.messages.isEmpty());
    }

    @Test
    public void descField() {
        String source = """
                package calc

                import "testing"

                func TestParse(t *testing.T) {
                    cases := []struct {
                        desc  string
                        input string
                        want  int
                    }{
                        {"empty", "", 0},
                        {"digit", "7", 7},
                    }
                    for _, c := range cases {
                        t.Run(c.desc, func(t *testing.T) {
                            if got := parse(c.input); got != c.want {
                                t.Errorf("%s: got %d, want %d", c.desc, got, c.want)
                            }
                        })
                    }
                }
                """;
        String expected = """
                package calc

                import "testing"

                func TestParse(t *testing.T) {
                    cases := map[string]struct {
                        input string
                        want  int
                    }{
                        "empty": {"", 0},
                        "digit": {"7", 7},
                    }
                    for name, c := range cases {
                        t.Run(name, func(t *testing.T) {
                            if got := parse(c.input); got != c.want {
                                t.Errorf("%s: got %d, want %d", name, got, c.want)
                            }
                        })
                    }
                }
                """;
        FileConversion conversion = assertConverted(source, expected);
        Assert.assertEquals(3, conversion.getSites().size());
        Assert.assertEquals(ConsumerSite.Kind.FIELD_ACCESS, conversion.getSites().get(2).kind());
    }

    @Test
    public void alreadyConvertedIsUnchanged() {
        String source = """
                package calc

                import "testing"

                func TestAdd(t *testing.T) {
                    tests := map[string]struct {
                        a int
                    }{
                        "one": {1},
                    }
                    for name, tc := range tests {
                        t.Run(name, func(t *testing.T) {
                            _ = tc.a
                        })
                    }
                }
                """;
        assertUnchanged(source);
    }

    @Test
    public void existingKeyIsKept() {
        String source = """
                package calc

                import "testing"

                func TestAdd(t *testing.T) {
                    tests := []struct {
                        name string
                        a    int
                    }{
                        {"one", 1},
                    }
                    for name, tc := range tests {
                        t.Run(tc.name, func(t *testing.T) {
                            t.Log(name, tc.a)
                        })
                    }
                }
                """;
        String expected = """
                package calc

                import "testing"

                func TestAdd(t *testing.T) {
                    tests := map[string]struct {
                        a    int
                    }{
                        "one": {1},
                    }
                    for name, tc := range tests {
                        t.Run(name, func(t *testing.T) {
                            t.Log(name, tc.a)
                        })
                    }
                }
                """;
        FileConversion conversion = assertConverted(source, expected);
        Assert.assertEquals(1, conversion.getSites().size());
        Assert.assertEquals(ConsumerSite.Kind.RUN_CALL, conversion.getSites().get(0).kind());
    }

    @Test
    public void existingKeyWithAnotherName() {
        String source = """
                package calc

                import "testing"

                func TestAdd(t *testing.T) {
                    tests := []struct{ name string; a int }{{"one", 1}}
                    for label, tc := range tests {
                        t.Run(tc.name, func(t *testing.T) { _ = label })
                    }
                }
                """;
        String expected = """
                package calc

                import "testing"

                func TestAdd(t *testing.T) {
                    tests := map[string]struct{ a int }{"one": {1}}
                    for label := range tests {
                        t.Run(label, func(t *testing.T) { _ = label })
                    }
                }
                """;
        assertConverted(source, expected);
    }

    @Test
    public void keyedRows() {
        String source = """
                package calc

                import "testing"

                func TestKeyed(t *testing.T) {
                    tests := []struct {
                        name string
                        in   int
                    }{
                        {name: "first", in: 1},
                        {in: 2, name: "second"},
                        {
                            name: "third",
                            in:   3,
                        },
                    }
                    for _, tt := range tests {
                        t.Run(tt.name, func(t *testing.T) {})
                    }
                }
                """;
        String expected = """
                package calc

                import "testing"

                func TestKeyed(t *testing.T) {
                    tests := map[string]struct {
                        in   int
                    }{
                        "first": {in: 1},
                        "second": {in: 2},
                        "third": {
                            in:   3,
                        },
                    }
                    for name := range tests {
                        t.Run(name, func(t *testing.T) {})
                    }
                }
                """;
        assertConverted(source, expected);
    }

    @Test
    public void commentsArePreserved() {
        String source = """
                package calc

                import "testing"

                // TestAdd checks addition.
                func TestAdd(t *testing.T) {
                    // The cases.
                    tests := []struct {
                        name string // the case name
                        a    int    /* the operand */
                    }{
                        {"one", 1}, // first
                        /* second */ {"two", 2},
                    }
                    for _, tc := range tests { // all of them
                        t.Run(tc.name, func(t *testing.T) {})
                    }
                }
                """;
        String expected = """
                package calc

                import "testing"

                // TestAdd checks addition.
                func TestAdd(t *testing.T) {
                    // The cases.
                    tests := map[string]struct {
                        a    int    /* the operand */
                    }{
                        "one": {1}, // first
                        /* second */ "two": {2},
                    }
                    for name := range tests { // all of them
                        t.Run(name, func(t *testing.T) {})
                    }
                }
                """;
        assertConverted(source, expected);
    }

    @Test
    public void unrelatedDeclarationsAreUntouched() {
        String source = """
                package calc

                var sizes = []struct {
                    width  int
                    height int
                }{
                    {1, 2},
                }

                var fixed = [2]struct {
                    name string
                }{
                    {"a"}, {"b"},
                }

                var named = []entry{
                    {"a"},
                }

                type entry struct {
                    name string
                }
                """;
        assertUnchanged(source);
    }

    @Test
    public void sameNameInAnotherScope() {
        String source = """
                package calc

                import "testing"

                var prefix = "p"

                func TestA(t *testing.T) {
                    tests := []struct {
                        name string
                        in   int
                    }{
                        {"a", 1},
                    }
                    for _, tc := range tests {
                        t.Run(tc.name, func(t *testing.T) {})
                    }
                }

                func TestB(t *testing.T) {
                    tests := []struct {
                        name string
                        in   int
                    }{
                        {prefix + "b", 2},
                    }
                    for _, tc := range tests {
                        t.Run(tc.name, func(t *testing.T) {})
                    }
                }
                """;
        String expected = """
                package calc

                import "testing"

                var prefix = "p"

                func TestA(t *testing.T) {
                    tests := map[string]struct {
                        in   int
                    }{
                        "a": {1},
                    }
                    for name := range tests {
                        t.Run(name, func(t *testing.T) {})
                    }
                }

                func TestB(t *testing.T) {
                    tests := []struct {
                        name string
                        in   int
                    }{
                        {prefix + "b", 2},
                    }
                    for _, tc := range tests {
                        t.Run(tc.name, func(t *testing.T) {})
                    }
                }
                """;
        FileConversion conversion = assertConverted(source, expected);
        Assert.assertEquals(1, conversion.getTablesConverted());
    }

    @Test
    public void packageLevelTable() {
        String source = """
                package calc

                import "testing"

                var cases = []struct {
                    description string
                    want        bool
                }{
                    {"yes", true},
                    {`raw`, false},
                }

                func TestCases(t *testing.T) {
                    for _, c := range cases {
                        t.Run(c.description, func(t *testing.T) {
                            if !c.want {
                                t.Skip()
                            }
                        })
                    }
                }
                """;
        String expected = """
                package calc

                import "testing"

                var cases = map[string]struct {
                    want        bool
                }{
                    "yes": {true},
                    `raw`: {false},
                }

                func TestCases(t *testing.T) {
                    for name, c := range cases {
                        t.Run(name, func(t *testing.T) {
                            if !c.want {
                                t.Skip()
                            }
                        })
                    }
                }
                """;
        assertConverted(source, expected);
    }

    @Test
    public void declaredTypeIsConvertedToo() {
        String source = """
                package calc

                var tests []struct{ name string; in int } = []struct{ name string; in int }{{"a", 1}}
                """;
        String expected = """
                package calc

                var tests map[string]struct{ in int } = map[string]struct{ in int }{"a": {1}}
                """;
        assertConverted(source, expected);
    }

    @Test
    public void groupedNameField() {
        String source = """
                package calc

                var tests = []struct {
                    name, input string
                }{
                    {"a", "x"},
                }
                """;
        String expected = """
                package calc

                var tests = map[string]struct {
                    input string
                }{
                    "a": {"x"},
                }
                """;
        assertConverted(source, expected);
    }

    @Test
    public void keyTypeIsTheNameFieldType() {
        String source = """
                package calc

                var tests = []struct {
                    in   string
                    name int
                }{
                    {"x", 1},
                    {"y", 2},
                }
                """;
        String expected = """
                package calc

                var tests = map[int]struct {
                    in   string
                }{
                    1: {"x"},
                    2: {"y"},
                }
                """;
        assertConverted(source, expected);
    }

    @Test
    public void firstNameFieldWins() {
        String source = """
                package calc

                var tests = []struct {
                    desc string
                    name string
                }{
                    {"d", "n"},
                }
                """;
        String expected = """
                package calc

                var tests = map[string]struct {
                    name string
                }{
                    "d": {"n"},
                }
                """;
        assertConverted(source, expected);
    }

    @Test
    public void emptyTable() {
        String source = """
                package calc

                var tests = []struct{ name string; in int }{}
                """;
        String expected = """
                package calc

                var tests = map[string]struct{ in int }{}
                """;
        assertConverted(source, expected);
    }

    @Test
    public void onlyNameField() {
        String source = """
                package calc

                var tests = []struct{ name string }{{"a"}, {"b"}}
                """;
        String expected = """
                package calc

                var tests = map[string]struct{}{"a": {}, "b": {}}
                """;
        assertConverted(source, expected);
    }

    @Test
    public void duplicateKeysWarn() {
        String source = """
                package calc

                var tests = []struct {
                    name string
                    in   int
                }{
                    {"a", 1},
                    {"a", 2},
                }
                """;
        FileConversion conversion = convert(source);
        Assert.assertFalse(conversion.hasErrors());
        Assert.assertTrue(conversion.isModified());
        List<ConverterMessages.Message> warnings = conversion.messages.getWarnings();
        Assert.assertEquals(1, warnings.size());
        Assert.assertEquals("Duplicate key", warnings.get(0).errorType);
        Assert.assertEquals(8, warnings.get(0).range.start.line);
    }

    @Test
    public void otherUsesWarn() {
        String source = """
                package calc

                import "testing"

                func TestAdd(t *testing.T) {
                    tests := []struct{ name string; a int }{{"one", 1}}
                    if len(tests) == 0 {
                        t.Fatal("no tests")
                    }
                    for i := range tests {
                        _ = i
                    }
                }
                """;
        FileConversion conversion = convert(source);
        Assert.assertFalse(conversion.hasErrors());
        Assert.assertEquals(1, conversion.getTablesConverted());
        List<ConverterMessages.Message> warnings = conversion.messages.getWarnings();
        Assert.assertEquals(2, warnings.size());
        for (ConverterMessages.Message warning: warnings)
            Assert.assertEquals("Not rewritten", warning.errorType);
        Assert.assertEquals(7, warnings.get(0).range.start.line);
        Assert.assertEquals(10, warnings.get(1).range.start.line);
    }

    @Test
    public void shadowingWarns() {
        String source = """
                package calc

                import "testing"

                func TestAdd(t *testing.T) {
                    name := "outer"
                    tests := []struct{ name string; a int }{{"one", 1}}
                    for _, tc := range tests {
                        t.Run(tc.name, func(t *testing.T) {
                            t.Log(name)
                        })
                    }
                }
                """;
        FileConversion conversion = convert(source);
        Assert.assertTrue(conversion.isModified());
        List<ConverterMessages.Message> warnings = conversion.messages.getWarnings();
        Assert.assertEquals(1, warnings.size());
        Assert.assertEquals("Shadowing", warnings.get(0).errorType);
        Assert.assertEquals(8, warnings.get(0).range.start.line);
        String output = conversion.getOutput();
        Assert.assertNotNull(output);
        Assert.assertTrue(output, output.contains("for tcName := range tests {"));
        Assert.assertTrue(output, output.contains("t.Run(tcName, func(t *testing.T) {"));
        Assert.assertTrue(output, output.contains("t.Log(name)"));
    }

    @Test
    public void rowCopiesAreFollowed() {
        String source = """
                package calc

                import "testing"

                func TestAdd(t *testing.T) {
                    tests := []struct {
                        name string
                        a    int
                    }{
                        {"one", 1},
                    }
                    for _, tc := range tests {
                        tc := tc
                        t.Run(tc.name, func(t *testing.T) {
                            t.Parallel()
                            var c = tc
                            t.Log(c.name, c.a)
                        })
                    }
                }
                """;
        String expected = """
                package calc

                import "testing"

                func TestAdd(t *testing.T) {
                    tests := map[string]struct {
                        a    int
                    }{
                        "one": {1},
                    }
                    for name, tc := range tests {
                        tc := tc
                        t.Run(name, func(t *testing.T) {
                            t.Parallel()
                            var c = tc
                            t.Log(name, c.a)
                        })
                    }
                }
                """;
        FileConversion conversion = assertConverted(source, expected);
        Assert.assertTrue(conversion.messages.isEmpty());
        List<ConsumerSite> sites = conversion.getSites();
        Assert.assertEquals(3, sites.size());
        Assert.assertEquals(ConsumerSite.Kind.RUN_CALL, sites.get(1).kind());
        Assert.assertEquals(ConsumerSite.Kind.FIELD_ACCESS, sites.get(2).kind());
    }

    @Test
    public void rowOnlyUsedForTheName() {
        String source = """
                package calc

                import "testing"

                func TestNames(t *testing.T) {
                    tests := []struct {
                        name string
                        in   int
                    }{
                        {"one", 1},
                    }
                    for _, tc := range tests {
                        tc := tc
                        t.Run(tc.name, func(t *testing.T) {
                            t.Log(tc.name)
                        })
                    }
                }
                """;
        String expected = """
                package calc

                import "testing"

                func TestNames(t *testing.T) {
                    tests := map[string]struct {
                        in   int
                    }{
                        "one": {1},
                    }
                    for name := range tests {
                        t.Run(name, func(t *testing.T) {
                            t.Log(name)
                        })
                    }
                }
                """;
        assertConverted(source, expected);
    }

    @Test
    public void nameDeclaredInLoopBody() {
        String source = """
                package calc

                import (
                    "strings"
                    "testing"
                )

                func TestUpper(t *testing.T) {
                    tests := []struct{ name string; a int }{{"one", 1}}
                    for _, tc := range tests {
                        name := strings.ToUpper(tc.name)
                        t.Run(name, func(t *testing.T) { _ = tc.a })
                    }
                }
                """;
        String expected = """
                package calc

                import (
                    "strings"
                    "testing"
                )

                func TestUpper(t *testing.T) {
                    tests := map[string]struct{ a int }{"one": {1}}
                    for tcName, tc := range tests {
                        name := strings.ToUpper(tcName)
                        t.Run(name, func(t *testing.T) { _ = tc.a })
                    }
                }
                """;
        FileConversion conversion = assertConverted(source, expected);
        List<ConverterMessages.Message> warnings = conversion.messages.getWarnings();
        Assert.assertEquals(1, warnings.size());
        Assert.assertEquals("Shadowing", warnings.get(0).errorType);
        Assert.assertEquals(10, warnings.get(0).range.start.line);
    }

    @Test
    public void noFreeKeyName() {
        String source = """
                package calc

                import "testing"

                func TestTaken(t *testing.T) {
                    tests := []struct{ name string; a int }{{"one", 1}}
                    for _, tc := range tests {
                        name, tcName := tc.name, tc.a
                        t.Run(name, func(t *testing.T) { _ = tcName })
                    }
                }
                """;
        FileConversion conversion = convert(source);
        Assert.assertEquals(1, conversion.getTablesConverted());
        Assert.assertTrue(conversion.getSites().isEmpty());
        List<ConverterMessages.Message> warnings = conversion.messages.getWarnings();
        Assert.assertEquals(1, warnings.size());
        Assert.assertEquals("Not rewritten", warnings.get(0).errorType);
        Assert.assertEquals(7, warnings.get(0).range.start.line);
        String output = conversion.getOutput();
        Assert.assertNotNull(output);
        Assert.assertTrue(output, output.contains("for _, tc := range tests {"));
        Assert.assertTrue(output, output.contains("name, tcName := tc.name, tc.a"));
    }

    @Test
    public void syntaxErrorIsReported() {
        String source = """
                package calc

                func broken( {
                }
                """;
        FileConversion conversion = convert(source);
        Assert.assertTrue(conversion.hasErrors());
        Assert.assertNull(conversion.getOutput());
        Assert.assertFalse(conversion.isModified());
        Assert.assertEquals(1, conversion.messages.errorCount());
        ConverterMessages.Message error = conversion.messages.getErrors().get(0);
        Assert.assertEquals(SyntaxError.KIND, error.errorType);
        Assert.assertEquals(FILE_NAME, error.fileName);
        Assert.assertEquals(3, error.range.start.line);
    }

    @Test
    public void noTablesNoEdits() {
        String source = """
                package calc

                func Add(a, b int) int {
                    return a + b
                }
                """;
        assertUnchanged(source);
    }
}
