/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.module;

/** A claimed module's source could no longer be located when its loader ran. */
public class ModuleResolutionException extends ImportException {

    private static final long serialVersionUID = 1L;

    public ModuleResolutionException(ModuleName name, SearchPath searchPath) {
        super(
                name.getFullName(),
                "Cannot locate source for module '"
                        + name
                        + "' in "
                        + searchPath.effectiveDirectories());
    }
}
