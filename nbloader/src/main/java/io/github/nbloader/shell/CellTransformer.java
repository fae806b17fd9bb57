/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.shell;

/** Turns the raw text of a cell into statements the {@link Interpreter} can execute. */
@FunctionalInterface
public interface CellTransformer {

    String transform(String cellSource);

    /** For documents whose cells are already plain script. */
    static CellTransformer identity() {
        return source -> source;
    }
}
