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

import org.tableconv.goConverter.converter.errors.SourcePositionRange;

/** Interface for reporting errors. */
public interface IErrorReporter {
    /** Report a problem (error or warning).
     *
     * @param range     Source position where the problem occurred.
     * @param warning   If true, this is a warning.
     * @param continuation If true, this is the continuation of a multi-line message.
     * @param errorType Type of error.
     * @param message   Message to report.
     */
    void reportProblem(SourcePositionRange range, boolean warning, boolean continuation,
                       String errorType, String message);

    default void reportError(SourcePositionRange range, String errorType, String message) {
        this.reportError(range, errorType, message, false);
    }

    default void reportError(SourcePositionRange range, String errorType, String message, boolean continuation) {
        this.reportProblem(range, false, continuation, errorType, message);
    }

    default void reportWarning(SourcePositionRange range, String errorType, String message) {
        this.reportWarning(range, errorType, message, false);
    }

    default void reportWarning(SourcePositionRange range, String errorType, String message, boolean continuation) {
        this.reportProblem(range, true, continuation, errorType, message);
    }

    /** True if any error (but not a warning) has been reported. */
    boolean hasErrors();
}
