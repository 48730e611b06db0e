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

package org.tableconv.goConverter;

import org.junit.Assert;
import org.tableconv.goConverter.converter.FileConversion;
import org.tableconv.goConverter.converter.TableConverter;
import org.tableconv.goConverter.converter.frontend.GoSourceParser;
import org.tableconv.goConverter.converter.visitors.GoVisitor;
import org.tableconv.goConverter.converter.visitors.VisitDecision;
import org.tableconv.goConverter.ir.GoFile;
import org.tableconv.goConverter.ir.IGoNode;
import org.tableconv.goConverter.ir.expression.GoIdent;

import java.util.ArrayList;
import java.util.List;

/** Helpers shared by the converter tests. */
public abstract class ConverterTestBase {
    public static final String FILE_NAME = "example_test.go";

    public static GoFile parse(String source) {
        return GoSourceParser.parse(FILE_NAME, source);
    }

    public static FileConversion convert(String source) {
        return new TableConverter().convertSource(FILE_NAME, source);
    }

    /** Convert the source and check the result; returns the conversion for further checks. */
    public static FileConversion assertConverted(String source, String expected) {
        FileConversion conversion = convert(source);
        Assert.assertFalse(conversion.messages.toString(), conversion.hasErrors());
        Assert.assertEquals(expected, conversion.getOutput());
        Assert.assertTrue(conversion.isModified());
        return conversion;
    }

    public static FileConversion assertUnchanged(String source) {
        FileConversion conversion = convert(source);
        Assert.assertFalse(conversion.messages.toString(), conversion.hasErrors());
        Assert.assertFalse(conversion.isModified());
        Assert.assertEquals(0, conversion.getTablesConverted());
        Assert.assertEquals(source, conversion.getOutput());
        return conversion;
    }

    /** All identifiers with the specified name below node, in source order. */
    public static List<GoIdent> identifiers(IGoNode node, String name) {
        List<GoIdent> result = new ArrayList<>();
        GoVisitor collector = new GoVisitor() {
            @Override
            public VisitDecision preorder(GoIdent ident) {
                if (ident.name.equals(name))
                    result.add(ident);
                return VisitDecision.STOP;
            }
        };
        collector.traverse(node);
        result.sort((l, r) -> Integer.compare(l.start, r.start));
        return result;
    }
}
