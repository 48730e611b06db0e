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

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.tableconv.goConverter.converter.ConversionResult;
import org.tableconv.goConverter.converter.ConverterOptions;
import org.tableconv.goConverter.converter.TableConverter;
import org.tableconv.goConverter.converter.errors.ConversionException;
import org.tableconv.util.Logger;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/** Main entry point of the Go table-test converter. */
public class ConverterMain {
    final ConverterOptions options;

    ConverterMain() {
        this.options = new ConverterOptions();
    }

    void usage(JCommander commander) {
        commander.usage();
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("go-table-converter");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            System.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            this.usage(commander);
            return 1;
        }

        for (Map.Entry<String, String> entry: this.options.ioOptions.loggingLevel.entrySet()) {
            try {
                int level = Integer.parseInt(entry.getValue());
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            } catch (NumberFormatException ex) {
                System.err.println("-T option must be followed by 'class=number'; could not parse " + entry);
                return 1;
            } catch (ConversionException ex) {
                System.err.println(ex.getMessage());
                return 1;
            }
        }
        return 0;
    }

    /** Run the converter on the directory named by the options. */
    ConversionResult run() {
        ConversionResult result = new ConversionResult();
        if (!this.options.validate(result.messages)) {
            result.fatal = true;
            return result;
        }
        if (this.options.ioOptions.verbosity >= 1)
            System.out.println(this.options);

        Path root = Paths.get(this.options.ioOptions.rootDirectory);
        TableConverter converter = new TableConverter(this.options);
        try {
            return converter.convert(root);
        } catch (ConversionException e) {
            result.messages.reportError(e);
            result.fatal = true;
            return result;
        }
    }

    /** Parse the options, run the converter and print the report. */
    public static ConversionResult execute(String... argv) {
        ConverterMain main = new ConverterMain();
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0) {
            ConversionResult result = new ConversionResult();
            result.fatal = true;
            return result;
        }
        ConversionResult result = main.run();
        main.report(result, System.out, System.err);
        return result;
    }

    void report(ConversionResult result, PrintStream out, PrintStream err) {
        boolean quiet = this.options.ioOptions.quiet;
        if (this.options.ioOptions.emitJson) {
            out.println(result.toJson().toPrettyString());
            return;
        }
        if (!result.fatal)
            out.print(result.getSummary());
        if (this.options.ioOptions.verbosity >= 1) {
            for (Path path: result.modifiedFiles)
                out.println("  Modified: " + path);
        }
        if (result.hasErrors())
            err.println("Errors:");
        result.messages.show(err, quiet);
    }

    public static void main(String[] argv) {
        ConversionResult result = execute(argv);
        System.exit(result.exitCode());
    }
}
