/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.shell;

import io.github.nbloader.module.Namespace;

/**
 * Host execution engine. Runs statements with a namespace acting as both the read and the write
 * scope, so bindings made by one call are visible to the next call on the same namespace.
 */
public interface Interpreter {

    /** Creates an empty namespace that only sees the engine's standard globals. */
    Namespace createNamespace(String name);

    /**
     * Executes {@code code} against {@code namespace}.
     *
     * @param code executable statements
     * @param sourceName name reported in error locations
     * @param namespace a namespace created by this interpreter
     * @return the completion value of the code, unwrapped to a Java value where possible
     * @throws EvaluationException if the code fails to compile or throws
     */
    Object execute(String code, String sourceName, Namespace namespace);
}
