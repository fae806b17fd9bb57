/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.shell;

/** A {@code %name args} command run by the shell. */
@FunctionalInterface
public interface LineMagic {

    /**
     * @param shell the shell whose ambient namespace the magic acts on
     * @param args the text after the magic name, trimmed
     * @return value handed back to the calling code, may be null
     */
    Object apply(InteractiveShell shell, String args);
}
