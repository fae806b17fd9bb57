/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.notebook;

import io.github.nbloader.module.ImportException;
import io.github.nbloader.module.ModuleName;

/**
 * A code cell failed while a notebook was being imported. The partially populated module stays
 * registered.
 */
public class CellExecutionException extends ImportException {

    private static final long serialVersionUID = 1L;

    private final String path;
    private final int cellIndex;

    public CellExecutionException(ModuleName name, String path, int cellIndex, Throwable cause) {
        super(
                name.getFullName(),
                "Cell " + cellIndex + " of notebook '" + path + "' failed: " + cause.getMessage(),
                cause);
        this.path = path;
        this.cellIndex = cellIndex;
    }

    public String getPath() {
        return path;
    }

    /** Zero-based position of the failing cell among all cells of the document. */
    public int getCellIndex() {
        return cellIndex;
    }
}
