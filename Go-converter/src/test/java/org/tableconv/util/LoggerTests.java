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

package org.tableconv.util;

import org.junit.Assert;
import org.junit.Test;
import org.tableconv.goConverter.converter.errors.ConversionException;
import org.tableconv.goConverter.converter.frontend.GoSourceParser;
import org.tableconv.goConverter.converter.visitors.ResolveReferences;
import org.tableconv.goConverter.ir.GoFile;

public class LoggerTests {
    @Test
    public void loggingIsPerClass() {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        int previous = Logger.INSTANCE.setLoggingLevel("GoSourceParser", 2);
        try {
            GoSourceParser.parse("log.go", "package p\n\nvar x = 1\n");
            Assert.assertTrue(builder.toString(), builder.toString().contains("Parsed log.go: 1 declarations"));

            Logger.INSTANCE.setLoggingLevel(GoSourceParser.class, 1);
            builder.setLength(0);
            GoSourceParser.parse("log.go", "package p\n");
            Assert.assertEquals("", builder.toString());
        } finally {
            Logger.INSTANCE.setLoggingLevel(GoSourceParser.class, previous);
            Logger.INSTANCE.setDebugStream(save);
        }
    }

    @Test
    public void traversalStartIsLogged() {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        int previous = Logger.INSTANCE.setLoggingLevel(ResolveReferences.class, 4);
        try {
            GoFile file = GoSourceParser.parse("log.go", "package p\n");
            new ResolveReferences().traverse(file);
            Assert.assertTrue(builder.toString(),
                    builder.toString().contains("Starting ResolveReferences at node " + file.getId()));
        } finally {
            Logger.INSTANCE.setLoggingLevel(ResolveReferences.class, previous);
            Logger.INSTANCE.setDebugStream(save);
        }
    }

    @Test
    public void longValues() {
        StringBuilder builder = new StringBuilder();
        new IndentStream(builder).append(1L << 40).append(" ").append(7);
        Assert.assertEquals("1099511627776 7", builder.toString());
    }

    @Test
    public void unknownClass() {
        Assert.assertThrows(ConversionException.class,
                () -> Logger.INSTANCE.setLoggingLevel("NoSuchClass", 1));
    }
}
