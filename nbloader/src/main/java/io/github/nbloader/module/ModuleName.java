/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.module;

import java.util.Objects;

/**
 * A dotted module name such as {@code analysis.plots.histogram}. The full name is the registry
 * key; only {@link #lastSegment()} takes part in locating a document on disk.
 */
public final class ModuleName {

    private final String fullName;

    private ModuleName(String fullName) {
        this.fullName = fullName;
    }

    public static ModuleName of(String fullName) {
        Objects.requireNonNull(fullName, "fullName");
        if (fullName.isEmpty()) {
            throw new IllegalArgumentException("Module name must not be empty");
        }
        for (String segment : fullName.split("\\.", -1)) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("Empty segment in module name '" + fullName + "'");
            }
        }
        return new ModuleName(fullName);
    }

    public String getFullName() {
        return fullName;
    }

    /** The part after the last dot, or the whole name for a top-level module. */
    public String lastSegment() {
        int dot = fullName.lastIndexOf('.');
        return dot == -1 ? fullName : fullName.substring(dot + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ModuleName)) {
            return false;
        }
        return fullName.equals(((ModuleName) o).fullName);
    }

    @Override
    public int hashCode() {
        return fullName.hashCode();
    }

    @Override
    public String toString() {
        return fullName;
    }
}
