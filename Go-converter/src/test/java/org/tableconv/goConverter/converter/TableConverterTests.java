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
import org.junit.Assume;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.tableconv.goConverter.converter.errors.ConversionException;
import org.tableconv.goConverter.converter.errors.ConverterMessages;
import org.tableconv.goConverter.converter.errors.SyntaxError;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;

public class TableConverterTests {
    static final String TABLE_TEST = """
            package p

            import "testing"

            func TestAdd(t *testing.T) {
                tests := []struct {
                    name string
                    a, b int
                }{
                    {"zero", 0, 0},
                    {"one", 1, 0},
                }
                for _, tc := range tests {
                    t.Run(tc.name, func(t *testing.T) {
                        _ = tc.a + tc.b
                    })
                }
            }
            """;
    static final String CONVERTED = """
            package p

            import "testing"

            func TestAdd(t *testing.T) {
                tests := map[string]struct {
                    a, b int
                }{
                    "zero": {0, 0},
                    "one": {1, 0},
                }
                for name, tc := range tests {
                    t.Run(name, func(t *testing.T) {
                        _ = tc.a + tc.b
                    })
                }
            }
            """;
    static final String PLAIN = """
            package p

            func Add(a, b int) int {
                return a + b
            }
            """;
    static final String BROKEN = """
            package p

            func f( {
            """;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    Path write(String relative, String contents) throws IOException {
        Path path = this.folder.getRoot().toPath().resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, contents, StandardCharsets.UTF_8);
        return path;
    }

    static String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    static TableConverter converter(int threads, boolean testsOnly) {
        ConverterOptions options = new ConverterOptions();
        options.conversionOptions.threads = threads;
        options.conversionOptions.testsOnly = testsOnly;
        return new TableConverter(options);
    }

    @Test
    public void convertDirectory() throws IOException {
        Path table = this.write("add_test.go", TABLE_TEST);
        Path plain = this.write("sub/add.go", PLAIN);
        this.write("notes.txt", TABLE_TEST);

        ConversionResult result = new TableConverter().convert(this.folder.getRoot().toPath());
        Assert.assertEquals(2, result.filesProcessed);
        Assert.assertEquals(1, result.filesModified);
        Assert.assertEquals(1, result.tablesConverted);
        Assert.assertEquals(List.of(table), result.modifiedFiles);
        Assert.assertFalse(result.hasErrors());
        Assert.assertEquals(0, result.exitCode());
        Assert.assertEquals(CONVERTED, read(table));
        Assert.assertEquals(PLAIN, read(plain));
    }

    @Test
    public void untouchedFileIsNotRewritten() throws IOException {
        Path plain = this.write("add.go", PLAIN);
        FileTime past = FileTime.fromMillis(1_000_000_000_000L);
        Files.setLastModifiedTime(plain, past);

        FileResult result = new TableConverter().convertFile(plain);
        Assert.assertTrue(result.processed());
        Assert.assertFalse(result.modified());
        Assert.assertEquals(past, Files.getLastModifiedTime(plain));
        Assert.assertEquals(PLAIN, read(plain));
    }

    @Test
    public void syntaxErrorDoesNotStopTheBatch() throws IOException {
        Path broken = this.write("a_test.go", BROKEN);
        Path table = this.write("b_test.go", TABLE_TEST);

        ConversionResult result = new TableConverter().convert(this.folder.getRoot().toPath());
        Assert.assertEquals(1, result.filesProcessed);
        Assert.assertEquals(1, result.filesModified);
        Assert.assertTrue(result.hasErrors());
        Assert.assertEquals(0, result.exitCode());
        Assert.assertEquals(BROKEN, read(broken));
        Assert.assertEquals(CONVERTED, read(table));

        List<ConverterMessages.Message> errors = result.messages.getErrors();
        Assert.assertEquals(1, errors.size());
        Assert.assertEquals(SyntaxError.KIND, errors.get(0).errorType);
        Assert.assertEquals(broken.toString(), errors.get(0).fileName);
    }

    @Test
    public void onlyErrorsFails() throws IOException {
        this.write("a_test.go", BROKEN);
        ConversionResult result = new TableConverter().convert(this.folder.getRoot().toPath());
        Assert.assertEquals(0, result.filesProcessed);
        Assert.assertEquals(1, result.exitCode());
    }

    @Test
    public void readErrorIsRecorded() throws IOException {
        File directory = this.folder.newFolder("dir.go");
        FileResult result = new TableConverter().convertFile(directory.toPath());
        Assert.assertFalse(result.processed());
        Assert.assertFalse(result.modified());
        List<ConverterMessages.Message> errors = result.messages().getErrors();
        Assert.assertEquals(1, errors.size());
        Assert.assertEquals(TableConverter.READ_ERROR, errors.get(0).errorType);
    }

    @Test
    public void failedReplacementLeavesNoFile() {
        Path target = this.folder.getRoot().toPath().resolve("missing").resolve("x_test.go");
        Assert.assertThrows(IOException.class, () -> TableConverter.replaceContents(target, CONVERTED));
        Assert.assertFalse(Files.exists(target));
    }

    @Test
    public void replacementKeepsPermissions() throws IOException {
        Path table = this.write("add_test.go", TABLE_TEST);
        Assume.assumeNotNull(Files.getFileAttributeView(table, PosixFileAttributeView.class));
        Set<PosixFilePermission> permissions = PosixFilePermissions.fromString("rw-r-----");
        Files.setPosixFilePermissions(table, permissions);
        FileResult result = new TableConverter().convertFile(table);
        Assert.assertTrue(result.modified());
        Assert.assertEquals(permissions, Files.getPosixFilePermissions(table));
        try (var entries = Files.list(this.folder.getRoot().toPath())) {
            Assert.assertEquals(1, entries.count());
        }
    }

    @Test
    public void missingRoot() {
        Path missing = this.folder.getRoot().toPath().resolve("missing");
        ConversionException e = Assert.assertThrows(ConversionException.class,
                () -> new TableConverter().convert(missing));
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("no such file or directory"));
    }

    @Test
    public void emptyDirectory() throws IOException {
        File empty = this.folder.newFolder("empty");
        ConversionResult result = new TableConverter().convert(empty.toPath());
        Assert.assertEquals(0, result.filesProcessed);
        Assert.assertEquals(0, result.exitCode());
    }

    @Test
    public void testsOnly() throws IOException {
        Path test = this.write("x_test.go", TABLE_TEST);
        Path other = this.write("x.go", TABLE_TEST);
        ConversionResult result = converter(1, true).convert(this.folder.getRoot().toPath());
        Assert.assertEquals(1, result.filesProcessed);
        Assert.assertEquals(CONVERTED, read(test));
        Assert.assertEquals(TABLE_TEST, read(other));
    }

    @Test
    public void parallelMatchesSequential() throws IOException {
        for (int i = 0; i < 8; i++) {
            this.write("seq/f" + i + "_test.go", i % 2 == 0 ? TABLE_TEST : PLAIN);
            this.write("par/f" + i + "_test.go", i % 2 == 0 ? TABLE_TEST : PLAIN);
        }
        this.write("seq/z_test.go", BROKEN);
        this.write("par/z_test.go", BROKEN);
        Path root = this.folder.getRoot().toPath();

        ConversionResult sequential = converter(1, false).convert(root.resolve("seq"));
        ConversionResult parallel = converter(4, false).convert(root.resolve("par"));
        Assert.assertEquals(sequential.filesProcessed, parallel.filesProcessed);
        Assert.assertEquals(sequential.filesModified, parallel.filesModified);
        Assert.assertEquals(sequential.tablesConverted, parallel.tablesConverted);
        Assert.assertEquals(sequential.messages.errorCount(), parallel.messages.errorCount());
        Assert.assertEquals(4, parallel.filesModified);
        for (int i = 0; i < 8; i++) {
            String name = "f" + i + "_test.go";
            Assert.assertEquals(read(root.resolve("seq").resolve(name)), read(root.resolve("par").resolve(name)));
        }
        for (int i = 0; i < parallel.modifiedFiles.size(); i++)
            Assert.assertEquals(sequential.modifiedFiles.get(i).getFileName(),
                    parallel.modifiedFiles.get(i).getFileName());
    }

    @Test
    public void conversionResultJson() throws IOException {
        this.write("add_test.go", TABLE_TEST);
        ConversionResult result = new TableConverter().convert(this.folder.getRoot().toPath());
        String json = result.toJson().toString();
        Assert.assertTrue(json, json.contains("\"files_modified\":1"));
        Assert.assertTrue(json, json.contains("\"tables_converted\":1"));
        Assert.assertTrue(json, json.contains("\"errors\":[]"));
    }

    @Test
    public void optionValidation() {
        ConverterOptions options = new ConverterOptions();
        ConverterMessages messages = new ConverterMessages();
        Assert.assertTrue(options.validate(messages));
        options.conversionOptions.threads = 0;
        options.conversionOptions.extension = "";
        Assert.assertFalse(options.validate(messages));
        Assert.assertEquals(2, messages.errorCount());
        Assert.assertTrue(options.same(options));
        Assert.assertFalse(options.same(ConverterOptions.getDefault()));
    }

    @Test
    public void fileSelection() {
        ConverterOptions.Conversion conversion = new ConverterOptions.Conversion();
        Assert.assertTrue(conversion.selects("a.go"));
        Assert.assertTrue(conversion.selects("a_test.go"));
        Assert.assertFalse(conversion.selects("a.go.orig"));
        conversion.testsOnly = true;
        Assert.assertFalse(conversion.selects("a.go"));
        Assert.assertTrue(conversion.selects("a_test.go"));
    }
}
