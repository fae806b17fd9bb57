/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.module;

/** No finder in the resolver chain claimed the requested name. */
public class ModuleNotFoundException extends ImportException {

    private static final long serialVersionUID = 1L;

    public ModuleNotFoundException(ModuleName name, SearchPath searchPath) {
        super(
                name.getFullName(),
                "No module named '" + name + "' (searched " + searchPath.getDirectories() + ")");
    }
}
