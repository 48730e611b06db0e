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

package org.tableconv.goConverter.converter;

import org.tableconv.goConverter.converter.backend.GoSourcePrinter;
import org.tableconv.goConverter.converter.errors.ConverterMessages;
import org.tableconv.goConverter.converter.errors.InternalConverterError;
import org.tableconv.goConverter.converter.errors.SourceFileContents;
import org.tableconv.goConverter.converter.errors.SourcePositionRange;
import org.tableconv.goConverter.converter.errors.SyntaxError;
import org.tableconv.goConverter.converter.frontend.GoSourceParser;
import org.tableconv.goConverter.converter.tables.ConsumerSite;
import org.tableconv.goConverter.converter.tables.RecordShapeDetector;
import org.tableconv.goConverter.converter.tables.ReferenceRewriter;
import org.tableconv.goConverter.converter.tables.StructuralTransformer;
import org.tableconv.goConverter.converter.tables.TableDeclaration;
import org.tableconv.goConverter.converter.visitors.ResolveReferences;
import org.tableconv.goConverter.ir.GoFile;
import org.tableconv.util.IWritesLogs;
import org.tableconv.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts the tables of a single Go source file.
 * The passes run in a fixed order on one thread:
 * parse, resolve references, detect, transform every table, rewrite consumers.
 * Problems are reported to {@link #messages}; only the output of a conversion
 * without errors should be persisted.
 */
public class FileConversion implements IErrorReporter, IWritesLogs {
    public final SourceFileContents contents;
    public final ConverterMessages messages;
    /** Null if the file could not be parsed. */
    @Nullable
    GoFile file;
    final List<TableDeclaration> tables;
    final List<ConsumerSite> sites;
    int tablesConverted;
    @Nullable
    String output;

    public FileConversion(String fileName, String source) {
        this.contents = new SourceFileContents(fileName, source);
        this.messages = new ConverterMessages(this.contents);
        this.file = null;
        this.tables = new ArrayList<>();
        this.sites = new ArrayList<>();
        this.tablesConverted = 0;
        this.output = null;
    }

    @Override
    public void reportProblem(SourcePositionRange range, boolean warning, boolean continuation,
                              String errorType, String message) {
        this.messages.reportProblem(range, warning, continuation, errorType, message);
    }

    @Override
    public boolean hasErrors() {
        return this.messages.hasErrors();
    }

    /** Run all the passes.  Returns this object. */
    public FileConversion run() {
        try {
            this.file = GoSourceParser.parse(this.contents);
        } catch (SyntaxError e) {
            this.messages.reportError(e);
            return this;
        }

        GoFile file = this.file;
        try {
            ResolveReferences resolve = new ResolveReferences();
            resolve.traverse(file);
            RecordShapeDetector detector = new RecordShapeDetector(file, resolve.reference);
            detector.traverse(file);

            StructuralTransformer transformer = new StructuralTransformer(file, this);
            for (TableDeclaration table: detector.tables) {
                transformer.transform(table);
                this.tables.add(table);
            }
            this.tablesConverted = transformer.getTablesConverted();

            if (!this.tables.isEmpty()) {
                ReferenceRewriter rewriter = new ReferenceRewriter(
                        file, resolve.reference, this.tables, this);
                rewriter.traverse(file);
                this.sites.addAll(rewriter.sites);
            }
            this.output = new GoSourcePrinter().toText(file);
        } catch (InternalConverterError e) {
            this.messages.reportError(e);
            this.output = null;
        }

        Logger.INSTANCE.belowLevel(this, 1)
                .append(this.contents.sourceFileName)
                .append(": ")
                .append(this.tablesConverted)
                .append(" tables converted, ")
                .append(this.sites.size())
                .append(" consumers rewritten")
                .newline();
        return this;
    }

    public int getTablesConverted() {
        return this.tablesConverted;
    }

    public List<ConsumerSite> getSites() {
        return this.sites;
    }

    /** True if the conversion succeeded and changed the file. */
    public boolean isModified() {
        return this.output != null && !this.hasErrors() &&
                this.file != null && this.file.isModified();
    }

    /** The converted text; the original text when nothing was converted.
     * Null if the conversion failed. */
    @Nullable
    public String getOutput() {
        if (this.hasErrors())
            return null;
        return this.output;
    }
}
