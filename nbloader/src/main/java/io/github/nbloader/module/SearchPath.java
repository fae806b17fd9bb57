/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.module;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered list of directories searched for documents. An empty path means "current directory
 * only".
 *
 * <p>Instances are immutable. {@link #key()} gives the scalar form used for cache lookups, so two
 * paths built independently from the same directories land on the same cache entry.
 */
public final class SearchPath {

    /** Cannot occur in a file name on any supported platform. */
    private static final String KEY_SEPARATOR = "\u0000";

    private static final SearchPath EMPTY = new SearchPath(List.of());

    private final List<String> directories;

    private SearchPath(List<String> directories) {
        this.directories = directories;
    }

    public static SearchPath empty() {
        return EMPTY;
    }

    public static SearchPath of(String... directories) {
        return of(Arrays.asList(directories));
    }

    public static SearchPath of(List<String> directories) {
        if (directories == null || directories.isEmpty()) {
            return EMPTY;
        }
        return new SearchPath(List.copyOf(directories));
    }

    public List<String> getDirectories() {
        return directories;
    }

    public boolean isEmpty() {
        return directories.isEmpty();
    }

    /** Directories to search, substituting the current directory for an empty path. */
    public List<String> effectiveDirectories() {
        return directories.isEmpty() ? List.of("") : directories;
    }

    public String key() {
        return String.join(KEY_SEPARATOR, directories);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SearchPath)) {
            return false;
        }
        return directories.equals(((SearchPath) o).directories);
    }

    @Override
    public int hashCode() {
        return directories.hashCode();
    }

    @Override
    public String toString() {
        return "SearchPath" + directories;
    }
}
