/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.notebook;

import java.util.List;

/** Parses the on-disk form of a notebook into its ordered cells. */
@FunctionalInterface
public interface DocumentReader {

    /**
     * @param content the document text
     * @param path where the text came from, for error messages
     * @return cells in document order
     * @throws DocumentReadException if the text is not a well-formed notebook
     */
    List<CellRecord> read(String content, String path) throws DocumentReadException;
}
