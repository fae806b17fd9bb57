/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.notebook;

import io.github.nbloader.module.ImportException;
import io.github.nbloader.module.ModuleLoader;
import io.github.nbloader.module.ModuleName;
import io.github.nbloader.module.ModuleObject;
import io.github.nbloader.module.ModuleRegistry;
import io.github.nbloader.module.ModuleResolutionException;
import io.github.nbloader.module.Namespace;
import io.github.nbloader.module.SearchPath;
import io.github.nbloader.shell.AmbientScope;
import io.github.nbloader.shell.InteractiveShell;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a notebook as a module: reads its cells, creates and registers an empty module, then
 * runs every code cell in order with the module's namespace as both read and write scope.
 *
 * <p>While the cells run, the shell's ambient namespace is the module's namespace, so line
 * magics act on the module. The previous ambient namespace comes back however execution ends.
 *
 * <p>A loader is bound to one search path and re-resolves the notebook on every load.
 */
public class NotebookLoader implements ModuleLoader {

    private static final Logger log = LoggerFactory.getLogger(NotebookLoader.class);

    private final SearchPath searchPath;
    private final NotebookPathResolver resolver;
    private final NotebookFileSystem fs;
    private final DocumentReader reader;
    private final InteractiveShell shell;
    private final ModuleRegistry registry;

    public NotebookLoader(
            SearchPath searchPath,
            NotebookPathResolver resolver,
            NotebookFileSystem fs,
            DocumentReader reader,
            InteractiveShell shell,
            ModuleRegistry registry) {
        this.searchPath = Objects.requireNonNull(searchPath, "searchPath");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.fs = Objects.requireNonNull(fs, "fs");
        this.reader = Objects.requireNonNull(reader, "reader");
        this.shell = Objects.requireNonNull(shell, "shell");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public SearchPath getSearchPath() {
        return searchPath;
    }

    public InteractiveShell getShell() {
        return shell;
    }

    /**
     * @throws ModuleResolutionException if the notebook is no longer on the search path
     * @throws DocumentReadException if it cannot be read or parsed
     * @throws CellExecutionException if a code cell fails; the module stays registered with the
     *     bindings made so far
     */
    @Override
    public ModuleObject load(ModuleName name) throws ImportException {
        String path = resolver.resolve(name, searchPath);
        if (path == null) {
            throw new ModuleResolutionException(name, searchPath);
        }
        log.info("Importing notebook {} from {}", name, path);

        List<CellRecord> cells = readCells(path);

        Namespace ns = shell.getInterpreter().createNamespace(name.getFullName());
        ns.put("__name__", name.getFullName());
        ns.put("__file__", path);
        ns.put(InteractiveShell.SHELL_BINDING, shell);
        ModuleObject module = new ModuleObject(name, ns, path, this);

        // visible before any cell runs, so self-imports see the partial module
        registry.register(module);

        try (AmbientScope ignored = shell.enterAmbient(ns)) {
            for (int i = 0; i < cells.size(); i++) {
                CellRecord cell = cells.get(i);
                if (cell.isCode()) {
                    runCell(module, cell, i);
                }
            }
        }
        return module;
    }

    private List<CellRecord> readCells(String path) throws DocumentReadException {
        String content;
        try {
            content = fs.readFile(path);
        } catch (IOException e) {
            throw new DocumentReadException(path, "Cannot read notebook: " + e.getMessage(), e);
        }
        return reader.read(content, path);
    }

    private void runCell(ModuleObject module, CellRecord cell, int index)
            throws CellExecutionException {
        try {
            String code = shell.getTransformer().transform(cell.getSource());
            shell.getInterpreter()
                    .execute(code, module.getFile() + "#cell" + index, module.getNamespace());
        } catch (RuntimeException e) {
            throw new CellExecutionException(module.getName(), module.getFile(), index, e);
        }
    }

    @Override
    public String toString() {
        return "NotebookLoader{searchPath=" + searchPath + "}";
    }
}
