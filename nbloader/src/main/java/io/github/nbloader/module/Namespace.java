/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.module;

import java.util.Set;

/**
 * Mutable identifier-to-value bindings of a module. Implementations are supplied by the
 * interpreter that executes code against them.
 */
public interface Namespace {

    /** Name used for diagnostics, usually the owning module's name. */
    String getName();

    /** Value of an own binding, or null if the name is unbound. */
    Object get(String name);

    void put(String name, Object value);

    boolean has(String name);

    /** Removes an own binding. Returns false if nothing was removed. */
    boolean remove(String name);

    /** Own binding names in definition order. */
    Set<String> names();
}
