/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.notebook;

import io.github.nbloader.module.ModuleFinder;
import io.github.nbloader.module.ModuleLoader;
import io.github.nbloader.module.ModuleName;
import io.github.nbloader.module.SearchPath;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ModuleFinder} that claims names for which a notebook exists on the search path. Loaders
 * are shared between all imports using an equal search path.
 */
public class NotebookFinder implements ModuleFinder {

    private static final Logger log = LoggerFactory.getLogger(NotebookFinder.class);

    /** Creates the loader bound to a search path on a cache miss. */
    @FunctionalInterface
    public interface LoaderFactory {
        NotebookLoader create(SearchPath searchPath);
    }

    private final NotebookPathResolver resolver;
    private final LoaderCache cache;
    private final LoaderFactory loaderFactory;

    public NotebookFinder(NotebookPathResolver resolver, LoaderFactory loaderFactory) {
        this(resolver, new LoaderCache(), loaderFactory);
    }

    public NotebookFinder(
            NotebookPathResolver resolver, LoaderCache cache, LoaderFactory loaderFactory) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.loaderFactory = Objects.requireNonNull(loaderFactory, "loaderFactory");
    }

    @Override
    public ModuleLoader find(ModuleName name, SearchPath searchPath) {
        if (resolver.resolve(name, searchPath) == null) {
            return null;
        }
        return cache.getOrCreate(
                searchPath.key(),
                () -> {
                    log.debug("Creating notebook loader for {}", searchPath);
                    return loaderFactory.create(searchPath);
                });
    }

    public LoaderCache getCache() {
        return cache;
    }

    @Override
    public String toString() {
        return "NotebookFinder{extension=" + resolver.getExtension() + "}";
    }
}
