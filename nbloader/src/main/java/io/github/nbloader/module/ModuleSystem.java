/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.module;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide import context: the module registry, the resolver chain and the default search
 * path. Tests create their own instance; nothing here is global.
 *
 * <p>Imports run synchronously on the caller's thread and may nest when a module imports another
 * while its code runs.
 */
public class ModuleSystem {

    private static final Logger log = LoggerFactory.getLogger(ModuleSystem.class);

    private final ModuleRegistry registry;
    private final ResolverChain resolverChain;
    private volatile SearchPath searchPath;

    public ModuleSystem() {
        this(new ModuleRegistry(), new ResolverChain(), SearchPath.empty());
    }

    public ModuleSystem(SearchPath searchPath) {
        this(new ModuleRegistry(), new ResolverChain(), searchPath);
    }

    public ModuleSystem(ModuleRegistry registry, ResolverChain resolverChain, SearchPath searchPath) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.resolverChain = Objects.requireNonNull(resolverChain, "resolverChain");
        this.searchPath = Objects.requireNonNull(searchPath, "searchPath");
    }

    public ModuleRegistry getRegistry() {
        return registry;
    }

    public ResolverChain getResolverChain() {
        return resolverChain;
    }

    public SearchPath getSearchPath() {
        return searchPath;
    }

    public void setSearchPath(SearchPath searchPath) {
        this.searchPath = Objects.requireNonNull(searchPath, "searchPath");
    }

    /** Imports {@code name} using the default search path. */
    public ModuleObject importModule(String name) throws ImportException {
        return importModule(ModuleName.of(name), searchPath);
    }

    /**
     * Returns the registered module for {@code name}, loading it through the first finder that
     * claims it if it is not registered yet. An already registered module is returned as is; its
     * code is never run twice.
     *
     * @throws ModuleNotFoundException if every finder declines
     */
    public ModuleObject importModule(ModuleName name, SearchPath path) throws ImportException {
        ModuleObject existing = registry.lookup(name);
        if (existing != null) {
            return existing;
        }

        for (ModuleFinder finder : resolverChain.finders()) {
            ModuleLoader loader = finder.find(name, path);
            if (loader == null) {
                continue;
            }
            log.debug("Module {} claimed by {}", name, finder);
            ModuleObject loaded = loader.load(name);
            // A module may rebind its own name while it runs; the registry has the final word.
            ModuleObject bound = registry.lookup(name);
            return bound != null ? bound : loaded;
        }
        throw new ModuleNotFoundException(name, path);
    }
}
