/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.module;

import java.util.Objects;

/**
 * A loaded module: a namespace plus the file it came from and the loader that created it. Once
 * registered, the {@link ModuleRegistry} owns it.
 */
public final class ModuleObject {

    private final ModuleName name;
    private final Namespace namespace;
    private final String file;
    private final ModuleLoader loader;

    public ModuleObject(ModuleName name, Namespace namespace, String file, ModuleLoader loader) {
        this.name = Objects.requireNonNull(name, "name");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.file = file;
        this.loader = loader;
    }

    public ModuleName getName() {
        return name;
    }

    public Namespace getNamespace() {
        return namespace;
    }

    /** Originating document path. */
    public String getFile() {
        return file;
    }

    public ModuleLoader getLoader() {
        return loader;
    }

    /** Shortcut for {@code getNamespace().get(binding)}. */
    public Object get(String binding) {
        return namespace.get(binding);
    }

    @Override
    public String toString() {
        return "ModuleObject{name='" + name + "', file='" + file + "'}";
    }
}
