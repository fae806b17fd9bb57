/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.notebook;

import io.github.nbloader.module.ModuleFinder;
import io.github.nbloader.module.ModuleSystem;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds a notebook finder to, and removes it from, a module system's resolver chain.
 *
 * <p>Installing is idempotent: while installed, {@link #install()} returns the existing handle
 * and the chain keeps a single entry, so there is only ever one loader cache per hook.
 */
public class NotebookImportHook {

    private static final Logger log = LoggerFactory.getLogger(NotebookImportHook.class);

    private final ModuleSystem system;
    private final ModuleFinder finder;
    private Handle handle;

    public NotebookImportHook(ModuleSystem system, ModuleFinder finder) {
        this.system = Objects.requireNonNull(system, "system");
        this.finder = Objects.requireNonNull(finder, "finder");
    }

    /** Appends the finder to the end of the resolver chain unless it is already there. */
    public synchronized Handle install() {
        if (handle != null && system.getResolverChain().contains(finder)) {
            return handle;
        }
        system.getResolverChain().append(finder);
        handle = new Handle();
        log.info("Installed {} at position {}", finder, system.getResolverChain().size() - 1);
        return handle;
    }

    /**
     * Removes the finder from the resolver chain.
     *
     * @throws IllegalArgumentException if {@code h} is not the handle of the current installation
     */
    public synchronized void uninstall(Handle h) {
        if (h == null || h != handle) {
            throw new IllegalArgumentException("Handle does not belong to the current installation");
        }
        system.getResolverChain().remove(finder);
        handle = null;
        log.info("Uninstalled {}", finder);
    }

    public synchronized boolean isInstalled() {
        return handle != null;
    }

    /** The handle of the current installation, or null when not installed. */
    public synchronized Handle getHandle() {
        return handle;
    }

    public ModuleFinder getFinder() {
        return finder;
    }

    /** Token for one installation. Closing it uninstalls the hook if still installed. */
    public final class Handle implements AutoCloseable {

        private Handle() {}

        public boolean isActive() {
            synchronized (NotebookImportHook.this) {
                return handle == this;
            }
        }

        @Override
        public void close() {
            synchronized (NotebookImportHook.this) {
                if (handle == this) {
                    uninstall(this);
                }
            }
        }
    }
}
