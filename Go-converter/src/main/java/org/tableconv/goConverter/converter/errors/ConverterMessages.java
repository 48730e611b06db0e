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

package org.tableconv.goConverter.converter.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.tableconv.goConverter.converter.IErrorReporter;
import org.tableconv.util.Utilities;

import javax.annotation.Nullable;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/** Errors and warnings produced while converting one file or a whole batch.
 * Messages about a file carry the file's name and a snippet of its source,
 * so they can be displayed after the file's contents have been discarded. */
public class ConverterMessages implements IErrorReporter {
    public static class Message {
        /** File the message refers to; null for messages which are not about a file. */
        @Nullable
        public final String fileName;
        public final SourcePositionRange range;
        public final boolean warning;
        public final boolean continuation;
        public final String errorType;
        public final String message;
        /** Decorated source fragment; may be empty. */
        public final String snippet;

        public Message(@Nullable String fileName, SourcePositionRange range,
                       boolean warning, boolean continuation,
                       String errorType, String message, String snippet) {
            this.fileName = fileName;
            this.range = range;
            this.warning = warning;
            this.continuation = continuation;
            this.errorType = errorType;
            this.message = message;
            this.snippet = snippet;
        }

        public void format(StringBuilder output) {
            String file = this.fileName == null ? "" : this.fileName;
            if (this.range.isValid()) {
                if (!this.continuation) {
                    output.append(file)
                            .append(": ")
                            .append(this.errorType)
                            .append(SourceFileContents.newline());
                }
                output.append(file)
                        .append(":")
                        .append(this.range.start)
                        .append(": ");
            } else if (!file.isEmpty()) {
                output.append(file)
                        .append(": ");
            }
            if (!this.continuation) {
                if (this.warning)
                    output.append("warning:");
                else
                    output.append("error:");
                output.append(" ")
                        .append(this.errorType)
                        .append(": ");
            }
            output.append(this.message)
                    .append(SourceFileContents.newline());
            output.append(this.snippet);
        }

        /** A one-line rendering, without the source fragment. */
        public String toShortString() {
            StringBuilder builder = new StringBuilder();
            if (this.fileName != null) {
                builder.append(this.fileName);
                if (this.range.isValid())
                    builder.append(":").append(this.range.start);
                builder.append(": ");
            }
            builder.append(this.errorType)
                    .append(": ")
                    .append(this.message);
            return builder.toString();
        }

        public JsonNode toJson(ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            if (this.fileName != null)
                result.put("file", this.fileName);
            this.range.appendAsJson(result);
            result.put("warning", this.warning);
            result.put("error_type", this.errorType);
            result.put("message", this.message);
            result.put("snippet", this.snippet);
            return result;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(builder);
            return builder.toString();
        }
    }

    /** Contents of the file the messages refer to; null for batch-level messages. */
    @Nullable
    final SourceFileContents sources;
    public final List<Message> messages;

    public ConverterMessages(@Nullable SourceFileContents sources) {
        this.sources = sources;
        this.messages = new ArrayList<>();
    }

    public ConverterMessages() {
        this(null);
    }

    @Override
    public void reportProblem(SourcePositionRange range, boolean warning, boolean continuation,
                              String errorType, String message) {
        String fileName = this.sources == null ? null : this.sources.sourceFileName;
        String snippet = this.sources == null ? "" : this.sources.getFragment(range);
        this.messages.add(new Message(fileName, range, warning, continuation, errorType, message, snippet));
    }

    public void reportError(BaseConverterException e) {
        this.reportError(e.getPositionRange(), e.getErrorKind(),
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    /** Report a problem with a file which has no source position, such as an I/O error. */
    public void reportFileError(String fileName, String errorType, String message) {
        this.messages.add(new Message(fileName, SourcePositionRange.INVALID,
                false, false, errorType, message, ""));
    }

    public void append(ConverterMessages other) {
        this.messages.addAll(other.messages);
    }

    @Override
    public boolean hasErrors() {
        return this.errorCount() > 0;
    }

    public int errorCount() {
        return (int)this.messages.stream().filter(m -> !m.warning).count();
    }

    public int warningCount() {
        return (int)this.messages.stream().filter(m -> m.warning).count();
    }

    public List<Message> getErrors() {
        return this.messages.stream().filter(m -> !m.warning).toList();
    }

    public List<Message> getWarnings() {
        return this.messages.stream().filter(m -> m.warning).toList();
    }

    public boolean isEmpty() {
        return this.messages.isEmpty();
    }

    /** Print the messages, skipping warnings if quiet is true. */
    public void show(PrintStream stream, boolean quiet) {
        String text = this.format(quiet);
        if (!text.isEmpty())
            stream.print(text);
    }

    public String format(boolean quiet) {
        StringBuilder builder = new StringBuilder();
        for (Message message: this.messages) {
            if (quiet && message.warning)
                continue;
            message.format(builder);
        }
        return builder.toString();
    }

    public ArrayNode toJson(ObjectMapper mapper) {
        ArrayNode result = mapper.createArrayNode();
        for (Message message: this.messages) {
            JsonNode node = message.toJson(mapper);
            result.add(node);
        }
        return result;
    }

    public JsonNode toJson() {
        return this.toJson(Utilities.deterministicObjectMapper());
    }

    @Override
    public String toString() {
        return this.format(false);
    }
}
