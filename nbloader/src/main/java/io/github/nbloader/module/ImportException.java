/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.module;

/** Base class for failures surfaced to the caller of an import. */
public class ImportException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String moduleName;

    public ImportException(String moduleName, String message) {
        super(message);
        this.moduleName = moduleName;
    }

    public ImportException(String moduleName, String message, Throwable cause) {
        super(message, cause);
        this.moduleName = moduleName;
    }

    /** Name of the module being imported, or null if the failure is not tied to one. */
    public String getModuleName() {
        return moduleName;
    }
}
