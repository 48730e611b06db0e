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

package org.tableconv.goConverter.converter.frontend;

import org.junit.Assert;
import org.junit.Test;
import org.tableconv.goConverter.ConverterTestBase;
import org.tableconv.goConverter.converter.errors.SyntaxError;
import org.tableconv.goConverter.ir.GoFile;
import org.tableconv.goConverter.ir.GoStatement;
import org.tableconv.goConverter.ir.declaration.GoFuncDecl;
import org.tableconv.goConverter.ir.declaration.GoGenDecl;
import org.tableconv.goConverter.ir.declaration.GoTypeSpec;
import org.tableconv.goConverter.ir.declaration.GoValueSpec;
import org.tableconv.goConverter.ir.expression.GoCompositeLit;
import org.tableconv.goConverter.ir.expression.GoIdent;
import org.tableconv.goConverter.ir.expression.GoIndexExpr;
import org.tableconv.goConverter.ir.statement.GoIfStmt;
import org.tableconv.goConverter.ir.statement.GoLabeledStmt;
import org.tableconv.goConverter.ir.statement.GoRangeStmt;
import org.tableconv.goConverter.ir.statement.GoSwitchStmt;
import org.tableconv.goConverter.ir.statement.GoTypeSwitchStmt;
import org.tableconv.goConverter.ir.type.GoArrayType;
import org.tableconv.goConverter.ir.type.GoStructType;

import java.util.List;

public class GoParserTests extends ConverterTestBase {
    static final String KITCHEN_SINK = """
            package kitchen

            import (
                "fmt"
                str "strings"
            )

            const (
                A = iota
                B
            )

            type Number interface {
                ~int | ~float64
            }

            type Pair[K comparable, V any] struct {
                Key   K `json:"key"`
                Value V
                fmt.Stringer
                *Base
            }

            type Base struct{}

            type Alias = Base

            func (p *Pair[K, V]) String() string {
                return fmt.Sprint(p.Key)
            }

            func Sum[T Number](values ...T) (total T) {
                for _, v := range values {
                    total += v
                }
                return
            }

            func control(ch chan int, done <-chan struct{}) {
                defer close(ch)
                go func() { ch <- 1 }()
                x := []int{1, 2, 3}[1:2:3]
                var i interface{} = x
                switch v := i.(type) {
                case []int:
                    fmt.Println(len(v))
                case nil:
                default:
                    fmt.Println("other")
                }
                switch {
                case len(x) > 0 && x[0] == 2:
                }
                select {
                case n := <-ch:
                    _ = n
                case <-done:
                    return
                default:
                }
            outer:
                for i := 0; i < 10; i++ {
                    if i%2 == 0 {
                        continue outer
                    } else if i > 5 {
                        break outer
                    }
                }
                for {
                    break
                }
                if p := (Pair[string, int]{Key: "a"}); p.Key != "" {
                    _ = str.ToUpper(p.Key)
                }
                m := map[string][]int{"a": {1}}
                _ = m
            }
            """;

    @Test
    public void kitchenSink() {
        GoFile file = parse(KITCHEN_SINK);
        Assert.assertEquals("kitchen", file.packageName.name);
        Assert.assertEquals(9, file.declarations.size());

        GoTypeSpec pair = file.declarations.get(3).to(GoGenDecl.class).specs.get(0).to(GoTypeSpec.class);
        Assert.assertEquals("Pair", pair.name.name);
        Assert.assertEquals(2, pair.typeParameters.size());
        GoStructType struct = pair.type.to(GoStructType.class);
        Assert.assertEquals(4, struct.fields.size());
        Assert.assertNotNull(struct.fields.get(0).tag);
        Assert.assertTrue(struct.fields.get(2).isEmbedded());
        Assert.assertTrue(struct.fields.get(3).isEmbedded());

        GoTypeSpec alias = file.declarations.get(5).to(GoGenDecl.class).specs.get(0).to(GoTypeSpec.class);
        Assert.assertTrue(alias.isAlias);

        GoFuncDecl method = file.declarations.get(6).to(GoFuncDecl.class);
        Assert.assertTrue(method.isMethod());
        Assert.assertEquals("String", method.name.name);

        GoFuncDecl sum = file.declarations.get(7).to(GoFuncDecl.class);
        Assert.assertFalse(sum.isMethod());
        Assert.assertEquals(1, sum.type.typeParameters.size());
        Assert.assertEquals(1, sum.type.results.size());

        GoFuncDecl control = file.declarations.get(8).to(GoFuncDecl.class);
        Assert.assertNotNull(control.body);
        List<GoStatement> statements = control.body.statements;
        Assert.assertTrue(statements.get(4).is(GoTypeSwitchStmt.class));
        Assert.assertTrue(statements.get(7).is(GoLabeledStmt.class));
        GoIfStmt ifStatement = statements.get(9).to(GoIfStmt.class);
        Assert.assertNotNull(ifStatement.init);
    }

    @Test
    public void positionsAreExact() {
        String source = """
                package p

                var tests = []struct{ name string }{{"a"}}
                """;
        GoFile file = parse(source);
        GoValueSpec spec = file.declarations.get(0).to(GoGenDecl.class).specs.get(0).to(GoValueSpec.class);
        GoCompositeLit literal = spec.values.get(0).to(GoCompositeLit.class);
        Assert.assertEquals("[]struct{ name string }{{\"a\"}}", file.getText(literal));
        GoArrayType type = literal.type.to(GoArrayType.class);
        Assert.assertTrue(type.isSlice());
        Assert.assertEquals("struct{ name string }", file.getText(type.elementType));
        Assert.assertEquals(3, file.rangeOf(literal).start.line);
        Assert.assertEquals(13, file.rangeOf(literal).start.column);
    }

    @Test
    public void compositeLiteralInControlClause() {
        String source = """
                package p

                func f(list []int) {
                    for _, x := range list {
                        _ = x
                    }
                    if v := (T{}); v == nil {
                    }
                }
                """;
        GoFile file = parse(source);
        GoFuncDecl function = file.declarations.get(0).to(GoFuncDecl.class);
        GoRangeStmt range = function.body.statements.get(0).to(GoRangeStmt.class);
        Assert.assertTrue(range.expression.is(GoIdent.class));
        Assert.assertTrue(range.isDefinition());
        Assert.assertEquals("list", file.getText(range.expression));
    }

    @Test
    public void genericInstantiation() {
        String source = """
                package p

                var x = List[int]{1, 2}
                """;
        GoFile file = parse(source);
        GoValueSpec spec = file.declarations.get(0).to(GoGenDecl.class).specs.get(0).to(GoValueSpec.class);
        GoCompositeLit literal = spec.values.get(0).to(GoCompositeLit.class);
        Assert.assertTrue(literal.type.is(GoIndexExpr.class));
        Assert.assertEquals(2, literal.elements.size());
    }

    @Test
    public void missingPackageClause() {
        try {
            parse("func f() {}\n");
            Assert.fail("Expected a syntax error");
        } catch (SyntaxError e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("'package'"));
            Assert.assertEquals(1, e.getPositionRange().start.line);
        }
    }

    @Test
    public void unbalancedBraces() {
        String source = """
                package p

                func f() {
                    if true {
                }
                """;
        Assert.assertThrows(SyntaxError.class, () -> parse(source));
    }

    @Test
    public void missingParameterType() {
        Assert.assertThrows(SyntaxError.class, () -> parse("package p\nfunc f(a, b int, c) {}\n"));
    }

    @Test
    public void malformedNumbers() {
        Assert.assertThrows(SyntaxError.class, () -> parse("package p\nvar x = 0x\n"));
        Assert.assertThrows(SyntaxError.class, () -> parse("package p\nvar x = 08\n"));
        Assert.assertThrows(SyntaxError.class, () -> parse("package p\nvar r = '\\u'\n"));
        GoFile file = parse("package p\nvar x, y, z = 0o17, 017, 08.5\n");
        GoValueSpec spec = file.declarations.get(0).to(GoGenDecl.class).specs.get(0).to(GoValueSpec.class);
        Assert.assertEquals(3, spec.values.size());
    }

    @Test
    public void tooManyRangeVariables() {
        String source = """
                package p

                func f(list []int) {
                    for a, b, c := range list {
                    }
                }
                """;
        try {
            parse(source);
            Assert.fail("Expected a syntax error");
        } catch (SyntaxError e) {
            Assert.assertEquals(4, e.getPositionRange().start.line);
        }
    }

    @Test
    public void statementsEndAtTheirLastToken() {
        String source = """
                package p

                func f() {
                    x := 1 // one
                    switch x {
                    case 1:
                        x++

                    default:
                    }
                }""";
        GoFile file = parse(source);
        GoFuncDecl function = file.declarations.get(0).to(GoFuncDecl.class);
        Assert.assertEquals("x := 1", file.getText(function.body.statements.get(0)));
        GoSwitchStmt statement = function.body.statements.get(1).to(GoSwitchStmt.class);
        Assert.assertEquals("case 1:\n        x++", file.getText(statement.clauses.get(0)));
        Assert.assertTrue(file.getText(function).endsWith("}"));
    }
}
