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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.tableconv.goConverter.converter.errors.ConverterMessages;
import org.tableconv.util.Utilities;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Statistics and messages accumulated over a conversion batch. */
public class ConversionResult {
    public int filesProcessed;
    public int filesModified;
    public int tablesConverted;
    public final List<Path> modifiedFiles;
    public final ConverterMessages messages;
    /** Set when the batch could not run at all, e.g., the root is missing
     * or the options are invalid. */
    public boolean fatal;

    public ConversionResult() {
        this.filesProcessed = 0;
        this.filesModified = 0;
        this.tablesConverted = 0;
        this.modifiedFiles = new ArrayList<>();
        this.messages = new ConverterMessages();
        this.fatal = false;
    }

    public void add(FileResult result) {
        if (result.processed())
            this.filesProcessed++;
        if (result.modified()) {
            this.filesModified++;
            this.modifiedFiles.add(result.path());
            this.tablesConverted += result.tablesConverted();
        }
        this.messages.append(result.messages());
    }

    public boolean hasErrors() {
        return this.messages.hasErrors();
    }

    /** Exit code for the command line. */
    public int exitCode() {
        if (this.fatal)
            return 1;
        if (this.hasErrors() && this.filesProcessed == 0)
            return 1;
        return 0;
    }

    public String getSummary() {
        return String.format("Conversion complete:%n" +
                "  Files processed: %d%n" +
                "  Files modified: %d%n" +
                "  Tables converted: %d%n",
                this.filesProcessed, this.filesModified, this.tablesConverted);
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode result = mapper.createObjectNode();
        result.put("files_processed", this.filesProcessed);
        result.put("files_modified", this.filesModified);
        result.put("tables_converted", this.tablesConverted);
        ArrayNode modified = result.putArray("modified_files");
        for (Path path: this.modifiedFiles)
            modified.add(path.toString());
        ConverterMessages errors = new ConverterMessages();
        ConverterMessages warnings = new ConverterMessages();
        for (ConverterMessages.Message message: this.messages.messages) {
            if (message.warning)
                warnings.messages.add(message);
            else
                errors.messages.add(message);
        }
        result.set("errors", errors.toJson(mapper));
        result.set("warnings", warnings.toJson(mapper));
        return result;
    }

    public ObjectNode toJson() {
        return this.toJson(Utilities.deterministicObjectMapper());
    }

    @Override
    public String toString() {
        return this.getSummary();
    }
}
