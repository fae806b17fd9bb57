/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.shell;

import io.github.nbloader.module.Namespace;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Execution-context provider. Holds the ambient namespace that top-level code and line magics
 * act on, and lets a loader point it at a module's namespace for the duration of that module's
 * execution.
 *
 * <p>Not thread-safe. The ambient namespace is a single process-wide slot; nested
 * {@link #enterAmbient(Namespace)} calls must be released last-in, first-out.
 */
public class InteractiveShell {

    private static final Logger log = LoggerFactory.getLogger(InteractiveShell.class);

    /** Binding under which every namespace managed by the shell can reach it. */
    public static final String SHELL_BINDING = "__shell__";

    private final Interpreter interpreter;
    private final CellTransformer transformer;
    private final Namespace userNamespace;
    private final Deque<AmbientScope> scopes = new ArrayDeque<>();
    private final Map<String, LineMagic> magics = new ConcurrentHashMap<>();

    private Namespace ambient;
    private int executionCount;

    public InteractiveShell(Interpreter interpreter) {
        this(interpreter, new LineMagicTransformer());
    }

    public InteractiveShell(Interpreter interpreter, CellTransformer transformer) {
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
        this.userNamespace = interpreter.createNamespace("__main__");
        this.userNamespace.put("__name__", "__main__");
        this.userNamespace.put(SHELL_BINDING, this);
        this.ambient = userNamespace;
        BuiltinMagics.registerAll(this);
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }

    public CellTransformer getTransformer() {
        return transformer;
    }

    /** The namespace the shell started with. */
    public Namespace getUserNamespace() {
        return userNamespace;
    }

    public Namespace getAmbientNamespace() {
        return ambient;
    }

    public void setAmbientNamespace(Namespace namespace) {
        this.ambient = Objects.requireNonNull(namespace, "namespace");
    }

    /**
     * Makes {@code namespace} ambient until the returned scope is closed. Use with
     * try-with-resources so the previous namespace comes back on every exit path.
     */
    public AmbientScope enterAmbient(Namespace namespace) {
        Objects.requireNonNull(namespace, "namespace");
        AmbientScope scope = new AmbientScope(this, ambient, namespace);
        scopes.push(scope);
        ambient = namespace;
        return scope;
    }

    /**
     * Restores the namespace that was ambient when {@code scope} was entered. Scopes entered
     * after it and never closed are closed with it, so a leaked inner scope cannot keep a
     * foreign namespace ambient.
     *
     * @throws IllegalStateException if {@code scope} is not open on this shell
     */
    void release(AmbientScope scope) {
        if (!scopes.contains(scope)) {
            throw new IllegalStateException(
                    "Ambient scope for '" + scope.getActive().getName() + "' is not open");
        }
        AmbientScope top = scopes.pop();
        while (top != scope) {
            log.warn(
                    "Ambient scope for '{}' was not closed; closing it with '{}'",
                    top.getActive().getName(),
                    scope.getActive().getName());
            top.markClosed();
            top = scopes.pop();
        }
        ambient = scope.getPrevious();
    }

    /** Number of ambient scopes currently entered. */
    public int depth() {
        return scopes.size();
    }

    /** Transforms and runs {@code source} in the ambient namespace. */
    public Object runCell(String source) {
        String code = transformer.transform(source);
        executionCount++;
        return interpreter.execute(code, "<cell-" + executionCount + ">", ambient);
    }

    public int getExecutionCount() {
        return executionCount;
    }

    public void registerMagic(String name, LineMagic magic) {
        magics.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(magic, "magic"));
    }

    public Set<String> magicNames() {
        return new TreeSet<>(magics.keySet());
    }

    /**
     * Runs a line magic against the ambient namespace. Called from transformed cell code.
     *
     * @throws IllegalArgumentException if no magic with that name is registered
     */
    public Object runLineMagic(String name, String args) {
        LineMagic magic = magics.get(name);
        if (magic == null) {
            throw new IllegalArgumentException("Line magic function `%" + name + "` not found.");
        }
        log.debug("Running %{} in namespace {}", name, ambient.getName());
        return magic.apply(this, args == null ? "" : args.trim());
    }
}
