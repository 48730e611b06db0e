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

import org.tableconv.goConverter.converter.errors.ConversionException;
import org.tableconv.goConverter.converter.errors.ConverterMessages;
import org.tableconv.util.IWritesLogs;
import org.tableconv.util.Logger;
import org.tableconv.util.Utilities;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Converts the table tests of all the Go files under a directory.
 * Failures for a single file are recorded in the result and the batch continues;
 * only a root which cannot be enumerated aborts the conversion.
 * Files are rewritten only when something was converted.
 */
public class TableConverter implements IWritesLogs {
    public static final String WALK_ERROR = "Error accessing file";
    public static final String READ_ERROR = "Error reading file";
    public static final String WRITE_ERROR = "Error writing file";

    final ConverterOptions options;

    public TableConverter(ConverterOptions options) {
        this.options = options;
    }

    public TableConverter() {
        this(ConverterOptions.getDefault());
    }

    /** Run the conversion pipeline on a file held in memory.  Nothing is written. */
    public FileConversion convertSource(String fileName, String source) {
        return new FileConversion(fileName, source).run();
    }

    /** Collect the files to convert, in sorted order.
     * Problems with individual entries are added to messages. */
    List<Path> collectFiles(Path root, ConverterMessages messages) {
        if (!Files.exists(root))
            throw new ConversionException("Cannot access " + Utilities.singleQuote(root.toString()) +
                    ": no such file or directory");
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() &&
                            TableConverter.this.options.conversionOptions.selects(file.getFileName().toString()))
                        files.add(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    if (file.equals(root))
                        throw exc;
                    messages.reportFileError(file.toString(), WALK_ERROR, String.valueOf(exc.getMessage()));
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new ConversionException("Cannot enumerate " + Utilities.singleQuote(root.toString()) +
                    ": " + e.getMessage(), e);
        }
        Collections.sort(files);
        return files;
    }

    /** Replace the contents of a file; the file is unchanged if this fails. */
    static void replaceContents(Path path, String text) throws IOException {
        Path directory = path.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(directory, "." + path.getFileName(), ".tmp");
        try {
            Files.writeString(temp, text, StandardCharsets.UTF_8);
            PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class);
            if (view != null) {
                Set<PosixFilePermission> permissions = view.readAttributes().permissions();
                Files.setPosixFilePermissions(temp, permissions);
            }
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /** Convert one file on disk. */
    public FileResult convertFile(Path path) {
        String name = path.toString();
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            ConverterMessages messages = new ConverterMessages();
            messages.reportFileError(name, READ_ERROR, String.valueOf(e.getMessage()));
            return FileResult.failed(path, messages);
        }

        FileConversion conversion = this.convertSource(name, source);
        if (conversion.hasErrors())
            return FileResult.failed(path, conversion.messages);
        String output = conversion.getOutput();
        if (!conversion.isModified() || output == null || output.equals(source))
            return new FileResult(path, true, false, 0, conversion.messages);

        try {
            replaceContents(path, output);
        } catch (IOException e) {
            conversion.messages.reportFileError(name, WRITE_ERROR, String.valueOf(e.getMessage()));
            return FileResult.failed(path, conversion.messages);
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Wrote ")
                .append(name)
                .newline();
        return new FileResult(path, true, true, conversion.getTablesConverted(), conversion.messages);
    }

    List<FileResult> convertInParallel(List<Path> files, int threads) {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<FileResult>> tasks = new ArrayList<>();
            for (Path file: files)
                tasks.add(() -> this.convertFile(file));
            List<FileResult> results = new ArrayList<>();
            // invokeAll preserves the order of the tasks
            for (Future<FileResult> future: executor.invokeAll(tasks))
                results.add(future.get());
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversionException("Conversion interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime)
                throw runtime;
            throw new ConversionException("Conversion failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Convert all selected files under root.
     * @throws ConversionException if root does not exist or cannot be enumerated.
     */
    public ConversionResult convert(Path root) {
        ConversionResult result = new ConversionResult();
        List<Path> files = this.collectFiles(root, result.messages);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Converting ")
                .append(files.size())
                .append(" files under ")
                .append(root.toString())
                .newline();

        int threads = this.options.conversionOptions.threads;
        List<FileResult> results;
        if (threads > 1 && files.size() > 1) {
            results = this.convertInParallel(files, threads);
        } else {
            results = new ArrayList<>();
            for (Path file: files)
                results.add(this.convertFile(file));
        }
        for (FileResult fileResult: results)
            result.add(fileResult);
        return result;
    }
}
