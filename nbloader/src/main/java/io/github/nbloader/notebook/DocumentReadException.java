/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.notebook;

import io.github.nbloader.module.ImportException;

/** A notebook exists but could not be read or parsed into cells. */
public class DocumentReadException extends ImportException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public DocumentReadException(String path, String message) {
        super(null, message + " (" + path + ")");
        this.path = path;
    }

    public DocumentReadException(String path, String message, Throwable cause) {
        super(null, message + " (" + path + ")", cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
