/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.shell;

/** Code run by an {@link Interpreter} failed to compile or threw. */
public class EvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String sourceName;
    private final int lineNumber;

    public EvaluationException(String message, String sourceName, int lineNumber, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
    }

    public String getSourceName() {
        return sourceName;
    }

    /** One-based line of the failure, or 0 if unknown. */
    public int getLineNumber() {
        return lineNumber;
    }
}
