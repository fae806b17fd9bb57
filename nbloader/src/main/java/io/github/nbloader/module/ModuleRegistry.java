/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.module;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Full-name keyed store of loaded modules. Entries live until explicitly unregistered. */
public class ModuleRegistry {

    private final Map<String, ModuleObject> modules = new ConcurrentHashMap<>();

    /** Binds the module under its full name, replacing any previous binding. */
    public void register(ModuleObject module) {
        modules.put(module.getName().getFullName(), module);
    }

    /** Returns the bound module, or null if absent. */
    public ModuleObject lookup(ModuleName name) {
        return modules.get(name.getFullName());
    }

    public ModuleObject lookup(String fullName) {
        return modules.get(fullName);
    }

    public boolean contains(ModuleName name) {
        return modules.containsKey(name.getFullName());
    }

    public ModuleObject unregister(ModuleName name) {
        return modules.remove(name.getFullName());
    }

    public int size() {
        return modules.size();
    }
}
