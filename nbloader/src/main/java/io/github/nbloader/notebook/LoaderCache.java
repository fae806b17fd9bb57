/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.notebook;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Loaders keyed by {@link io.github.nbloader.module.SearchPath#key()}. At most one loader exists
 * per key; entries are never removed.
 */
public class LoaderCache {

    private final ConcurrentHashMap<String, NotebookLoader> loaders = new ConcurrentHashMap<>();

    /** Returns the loader cached under {@code key}, creating it with {@code factory} on a miss. */
    public NotebookLoader getOrCreate(String key, Supplier<NotebookLoader> factory) {
        return loaders.computeIfAbsent(key, k -> factory.get());
    }

    public int size() {
        return loaders.size();
    }
}
