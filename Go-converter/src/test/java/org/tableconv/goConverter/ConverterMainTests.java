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

package org.tableconv.goConverter;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.tableconv.goConverter.converter.ConversionResult;
import org.tableconv.util.Utilities;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Tests for the command-line entry point. */
public class ConverterMainTests {
    static final String SOURCE = """
            package p

            import "testing"

            func TestX(t *testing.T) {
                tests := []struct{ name string; in int }{{"a", 1}, {"b", 2}}
                for _, tc := range tests {
                    t.Run(tc.name, func(t *testing.T) { _ = tc.in })
                }
            }
            """;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    PrintStream savedOut;
    PrintStream savedErr;
    ByteArrayOutputStream out;
    ByteArrayOutputStream err;

    @Before
    public void captureOutput() {
        this.savedOut = System.out;
        this.savedErr = System.err;
        this.out = new ByteArrayOutputStream();
        this.err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(this.out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(this.err, true, StandardCharsets.UTF_8));
    }

    @After
    public void restoreOutput() {
        System.setOut(this.savedOut);
        System.setErr(this.savedErr);
    }

    String stdout() {
        return this.out.toString(StandardCharsets.UTF_8);
    }

    String stderr() {
        return this.err.toString(StandardCharsets.UTF_8);
    }

    Path root() throws IOException {
        Path root = this.folder.getRoot().toPath();
        Files.writeString(root.resolve("x_test.go"), SOURCE, StandardCharsets.UTF_8);
        return root;
    }

    @Test
    public void summary() throws IOException {
        Path root = this.root();
        ConversionResult result = ConverterMain.execute(root.toString());
        Assert.assertEquals(0, result.exitCode());
        String output = this.stdout();
        Assert.assertTrue(output, output.contains("Conversion complete:"));
        Assert.assertTrue(output, output.contains("Files processed: 1"));
        Assert.assertTrue(output, output.contains("Files modified: 1"));
        Assert.assertTrue(output, output.contains("Tables converted: 1"));
        String converted = Files.readString(root.resolve("x_test.go"), StandardCharsets.UTF_8);
        Assert.assertTrue(converted, converted.contains("map[string]struct{ in int }{\"a\": {1}, \"b\": {2}}"));
        Assert.assertTrue(converted, converted.contains("t.Run(name, "));
    }

    @Test
    public void verboseListsModifiedFiles() throws IOException {
        Path root = this.root();
        ConversionResult result = ConverterMain.execute("-v", "1", "--threads", "2", root.toString());
        Assert.assertEquals(0, result.exitCode());
        String output = this.stdout();
        Assert.assertTrue(output, output.contains("Modified: " + root.resolve("x_test.go")));
    }

    @Test
    public void json() throws IOException {
        Path root = this.root();
        ConversionResult result = ConverterMain.execute("--je", root.toString());
        Assert.assertEquals(0, result.exitCode());
        JsonNode json = Utilities.deterministicObjectMapper().readTree(this.stdout());
        Assert.assertEquals(1, json.get("files_processed").asInt());
        Assert.assertEquals(1, json.get("tables_converted").asInt());
        Assert.assertEquals(0, json.get("errors").size());
    }

    @Test
    public void missingDirectory() {
        Path missing = this.folder.getRoot().toPath().resolve("nothere");
        ConversionResult result = ConverterMain.execute(missing.toString());
        Assert.assertTrue(result.fatal);
        Assert.assertEquals(1, result.exitCode());
        Assert.assertFalse(this.stdout().contains("Conversion complete"));
        Assert.assertTrue(this.stderr(), this.stderr().contains("no such file or directory"));
    }

    @Test
    public void invalidThreads() throws IOException {
        Path root = this.root();
        ConversionResult result = ConverterMain.execute("--threads", "0", root.toString());
        Assert.assertEquals(1, result.exitCode());
        Assert.assertTrue(this.stderr(), this.stderr().contains("--threads must be at least 1"));
        Assert.assertEquals(SOURCE, Files.readString(root.resolve("x_test.go"), StandardCharsets.UTF_8));
    }

    @Test
    public void missingArgument() {
        ConversionResult result = ConverterMain.execute();
        Assert.assertEquals(1, result.exitCode());
    }

    @Test
    public void unknownLoggingClass() throws IOException {
        Path root = this.root();
        ConversionResult result = ConverterMain.execute("-TNoSuchClass=2", root.toString());
        Assert.assertEquals(1, result.exitCode());
        Assert.assertTrue(this.stderr(), this.stderr().contains("NoSuchClass"));
    }
}
