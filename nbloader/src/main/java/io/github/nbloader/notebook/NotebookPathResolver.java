/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.notebook;

import io.github.nbloader.module.ModuleName;
import io.github.nbloader.module.SearchPath;
import java.util.Objects;

/**
 * Maps a module name to a notebook file. Only the last segment of the name is used: {@code
 * reports.Sales_Summary} looks for {@code Sales_Summary.ipynb} in each search directory, then for
 * {@code Sales Summary.ipynb} in the same directory before moving to the next one. The first
 * match wins.
 *
 * <p>Stateless beyond the injected filesystem and safe to share.
 */
public class NotebookPathResolver {

    public static final String DEFAULT_EXTENSION = "ipynb";

    private final NotebookFileSystem fs;
    private final String extension;
    private final boolean underscoreFallback;

    public NotebookPathResolver(NotebookFileSystem fs) {
        this(fs, DEFAULT_EXTENSION, true);
    }

    public NotebookPathResolver(NotebookFileSystem fs, String extension, boolean underscoreFallback) {
        this.fs = Objects.requireNonNull(fs, "fs");
        this.extension = stripDot(Objects.requireNonNull(extension, "extension"));
        this.underscoreFallback = underscoreFallback;
    }

    /**
     * Finds the notebook for {@code name}.
     *
     * @return the path of the first matching file, or null if no directory holds one
     */
    public String resolve(ModuleName name, SearchPath searchPath) {
        String segment = name.lastSegment();
        String fileName = segment + "." + extension;
        boolean trySpaces = underscoreFallback && segment.indexOf('_') != -1;
        String spacedName = trySpaces ? segment.replace('_', ' ') + "." + extension : null;

        for (String dir : searchPath.effectiveDirectories()) {
            String candidate = fs.resolve(dir, fileName);
            if (fs.isFile(candidate)) {
                return candidate;
            }
            // let Notebook_Name find "Notebook Name.ipynb"
            if (trySpaces) {
                candidate = fs.resolve(dir, spacedName);
                if (fs.isFile(candidate)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    public String getExtension() {
        return extension;
    }

    private static String stripDot(String ext) {
        String e = ext.startsWith(".") ? ext.substring(1) : ext;
        if (e.isEmpty()) {
            throw new IllegalArgumentException("Document extension must not be empty");
        }
        return e;
    }
}
