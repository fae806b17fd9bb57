/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader;

import io.github.nbloader.config.NotebookImportConfig;
import io.github.nbloader.module.ImportException;
import io.github.nbloader.module.ModuleName;
import io.github.nbloader.module.ModuleObject;
import io.github.nbloader.module.ModuleSystem;
import io.github.nbloader.module.SearchPath;
import io.github.nbloader.notebook.DefaultNotebookFileSystem;
import io.github.nbloader.notebook.DocumentReader;
import io.github.nbloader.notebook.IpynbReader;
import io.github.nbloader.notebook.NotebookFileSystem;
import io.github.nbloader.notebook.NotebookFinder;
import io.github.nbloader.notebook.NotebookImportHook;
import io.github.nbloader.notebook.NotebookLoader;
import io.github.nbloader.notebook.NotebookPathResolver;
import io.github.nbloader.script.ImportFunction;
import io.github.nbloader.script.RhinoInterpreter;
import io.github.nbloader.shell.InteractiveShell;

/**
 * Ready-made notebook importing for a Rhino host. Wires the interpreter, the shell, the module
 * system and the notebook hook from one configuration.
 *
 * <pre>
 * NotebookImporter importer = NotebookImporter.create();
 * importer.install();
 * ModuleObject m = importer.importModule("analysis");
 * </pre>
 */
public final class NotebookImporter {

    private final NotebookImportConfig config;
    private final RhinoInterpreter interpreter;
    private final InteractiveShell shell;
    private final ModuleSystem moduleSystem;
    private final NotebookFinder finder;
    private final NotebookImportHook hook;

    private NotebookImporter(
            NotebookImportConfig config, NotebookFileSystem fs, DocumentReader reader) {
        this.config = config;
        this.interpreter = new RhinoInterpreter(config.getLanguageVersion());
        this.shell = new InteractiveShell(interpreter);
        this.moduleSystem = new ModuleSystem(config.getSearchPath());
        NotebookPathResolver resolver =
                new NotebookPathResolver(
                        fs, config.getDocumentExtension(), config.isUnderscoreFallback());
        this.finder =
                new NotebookFinder(
                        resolver,
                        searchPath ->
                                new NotebookLoader(
                                        searchPath,
                                        resolver,
                                        fs,
                                        reader,
                                        shell,
                                        moduleSystem.getRegistry()));
        this.hook = new NotebookImportHook(moduleSystem, finder);
        ImportFunction.install(interpreter, moduleSystem, config.getImportFunction());
    }

    public static NotebookImporter create() {
        return create(NotebookImportConfig.load());
    }

    public static NotebookImporter create(NotebookImportConfig config) {
        return create(config, new DefaultNotebookFileSystem(config.getEncoding()), new IpynbReader());
    }

    public static NotebookImporter create(
            NotebookImportConfig config, NotebookFileSystem fs, DocumentReader reader) {
        return new NotebookImporter(config, fs, reader);
    }

    /** Makes notebooks importable. Calling it again while installed has no effect. */
    public NotebookImportHook.Handle install() {
        return hook.install();
    }

    /** Removes the notebook finder if it is installed. */
    public void uninstall() {
        NotebookImportHook.Handle h = hook.getHandle();
        if (h != null) {
            h.close();
        }
    }

    public ModuleObject importModule(String name) throws ImportException {
        return moduleSystem.importModule(name);
    }

    public ModuleObject importModule(String name, SearchPath searchPath) throws ImportException {
        return moduleSystem.importModule(ModuleName.of(name), searchPath);
    }

    public NotebookImportConfig getConfig() {
        return config;
    }

    public RhinoInterpreter getInterpreter() {
        return interpreter;
    }

    public InteractiveShell getShell() {
        return shell;
    }

    public ModuleSystem getModuleSystem() {
        return moduleSystem;
    }

    public NotebookFinder getFinder() {
        return finder;
    }

    public NotebookImportHook getHook() {
        return hook;
    }
}
