/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.module;

/**
 * Entry consulted by the {@link ResolverChain} for every import.
 *
 * <p>Declining is not an error: returning null lets the chain try the next finder.
 */
@FunctionalInterface
public interface ModuleFinder {

    /**
     * @param name the module being imported
     * @param searchPath directories to search
     * @return a loader able to produce the module, or null if this finder does not claim it
     */
    ModuleLoader find(ModuleName name, SearchPath searchPath);
}
