/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.module;

/**
 * Produces a populated module for a name its finder has claimed.
 *
 * <p>Implementations register the module with the host registry themselves, before running any
 * of its code, so that a module importing itself sees the partially populated object.
 */
@FunctionalInterface
public interface ModuleLoader {

    /**
     * Loads the module.
     *
     * @param name the module to load
     * @return the loaded module
     * @throws ImportException if the source vanished, could not be read, or failed to run
     */
    ModuleObject load(ModuleName name) throws ImportException;
}
