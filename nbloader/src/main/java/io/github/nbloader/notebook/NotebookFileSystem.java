/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.notebook;

import java.io.IOException;

/** Filesystem abstraction for notebook lookup and reading. */
public interface NotebookFileSystem {

    /** True if {@code path} names an existing regular file. */
    boolean isFile(String path);

    String readFile(String path) throws IOException;

    /** Join a search directory and a file name. An empty directory means the current one. */
    String resolve(String directory, String fileName);
}
