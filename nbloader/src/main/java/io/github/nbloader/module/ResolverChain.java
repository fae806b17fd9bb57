/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.module;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/** Ordered list of finders consulted for every import. First finder to claim a name wins. */
public final class ResolverChain {

    private final List<ModuleFinder> chain = new CopyOnWriteArrayList<>();

    /**
     * Appends a finder to the end of the chain.
     *
     * @return false if this exact finder instance is already in the chain
     */
    public boolean append(ModuleFinder finder) {
        Objects.requireNonNull(finder, "finder");
        if (contains(finder)) {
            return false;
        }
        chain.add(finder);
        return true;
    }

    public boolean remove(ModuleFinder finder) {
        return chain.removeIf(f -> f == finder);
    }

    public boolean contains(ModuleFinder finder) {
        for (ModuleFinder f : chain) {
            if (f == finder) {
                return true;
            }
        }
        return false;
    }

    /** Snapshot of the chain in consultation order. */
    public List<ModuleFinder> finders() {
        return List.copyOf(chain);
    }

    public int size() {
        return chain.size();
    }
}
