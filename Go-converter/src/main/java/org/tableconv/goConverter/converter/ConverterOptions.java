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

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import org.tableconv.goConverter.converter.errors.SourcePositionRange;
import org.tableconv.util.IValidate;

import java.util.HashMap;
import java.util.Map;

/** Packages options for the table converter. */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class ConverterOptions implements IValidate {
    /** Options that control which files are converted and how. */
    public static class Conversion implements IValidate {
        /** Only files whose name ends with this suffix are converted. */
        @Parameter(names = "--ext", description = "Extension of the files to convert")
        public String extension = ".go";
        @Parameter(names = "--testsOnly", description = "Only convert Go test files (*_test.go)")
        public boolean testsOnly = false;
        @Parameter(names = "--threads", description = "Number of files converted in parallel")
        public int threads = 1;

        public boolean same(Conversion other) {
            return this.extension.equals(other.extension) &&
                    this.testsOnly == other.testsOnly &&
                    this.threads == other.threads;
        }

        /** True if a file with this name should be converted. */
        public boolean selects(String fileName) {
            if (!fileName.endsWith(this.extension))
                return false;
            return !this.testsOnly || fileName.endsWith("_test.go");
        }

        @Override
        public boolean validate(IErrorReporter reporter) {
            boolean valid = true;
            if (this.threads < 1) {
                reporter.reportError(SourcePositionRange.INVALID, "Invalid options",
                        "--threads must be at least 1, got " + this.threads);
                valid = false;
            }
            if (this.extension.isEmpty()) {
                reporter.reportError(SourcePositionRange.INVALID, "Invalid options",
                        "--ext cannot be empty");
                valid = false;
            }
            return valid;
        }

        @Override
        public String toString() {
            return "Conversion{" +
                    "extension=" + this.extension +
                    ", testsOnly=" + this.testsOnly +
                    ", threads=" + this.threads +
                    '}';
        }
    }

    /** Options related to input and output. */
    public static class IO implements IValidate {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "--je", description = "Emit the conversion result as JSON on stdout")
        public boolean emitJson = false;
        @Parameter(names = "-q", description = "Quiet: do not print warnings")
        public boolean quiet = false;
        @Parameter(names = "-v", description = "Output verbosity")
        public int verbosity = 0;
        @Parameter(description = "Directory to convert", required = true)
        public String rootDirectory = "";

        public boolean same(IO other) {
            return this.loggingLevel.equals(other.loggingLevel) &&
                    this.emitJson == other.emitJson &&
                    this.quiet == other.quiet &&
                    this.verbosity == other.verbosity &&
                    this.rootDirectory.equals(other.rootDirectory);
        }

        @Override
        public boolean validate(IErrorReporter reporter) {
            if (this.verbosity < 0) {
                reporter.reportError(SourcePositionRange.INVALID, "Invalid options",
                        "-v must not be negative");
                return false;
            }
            return true;
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\tloggingLevel=" + this.loggingLevel +
                    ",\n\temitJson=" + this.emitJson +
                    ",\n\tquiet=" + this.quiet +
                    ",\n\tverbosity=" + this.verbosity +
                    ",\n\trootDirectory=" + this.rootDirectory +
                    "\n}";
        }
    }

    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Conversion conversionOptions = new Conversion();

    public static ConverterOptions getDefault() {
        return new ConverterOptions();
    }

    public boolean same(ConverterOptions other) {
        return this.help == other.help &&
                this.ioOptions.same(other.ioOptions) &&
                this.conversionOptions.same(other.conversionOptions);
    }

    @Override
    public boolean validate(IErrorReporter reporter) {
        boolean io = this.ioOptions.validate(reporter);
        boolean conversion = this.conversionOptions.validate(reporter);
        return io && conversion;
    }

    @Override
    public String toString() {
        return "ConverterOptions{" +
                "help=" + this.help +
                ", ioOptions=" + this.ioOptions +
                ", conversionOptions=" + this.conversionOptions +
                '}';
    }
}
