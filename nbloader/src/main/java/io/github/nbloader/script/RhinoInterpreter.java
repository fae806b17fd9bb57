/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.script;

import io.github.nbloader.module.Namespace;
import io.github.nbloader.shell.EvaluationException;
import io.github.nbloader.shell.Interpreter;
import java.util.Objects;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;

/**
 * {@link Interpreter} backed by Rhino.
 *
 * <p>All namespaces share one top-level scope holding the standard objects. A namespace is an
 * object whose prototype is that shared scope and whose parent scope is null, so names declared
 * or assigned at the top level of executed code become its own properties, while lookups of
 * standard globals fall through to the shared scope. Functions defined in one namespace keep it
 * as their scope when called from another.
 */
public class RhinoInterpreter implements Interpreter {

    private final ContextFactory contextFactory;
    private final int languageVersion;
    private final ScriptableObject sharedScope;

    public RhinoInterpreter() {
        this(new ContextFactory(), Context.VERSION_ES6);
    }

    public RhinoInterpreter(int languageVersion) {
        this(new ContextFactory(), languageVersion);
    }

    public RhinoInterpreter(ContextFactory contextFactory, int languageVersion) {
        this.contextFactory = Objects.requireNonNull(contextFactory, "contextFactory");
        this.languageVersion = languageVersion;
        try (Context cx = enter()) {
            this.sharedScope = cx.initStandardObjects();
        }
    }

    /**
     * Enters a Rhino context on the current thread. Nested calls reuse the active context; every
     * call must be matched by {@link Context#close()}.
     */
    Context enter() {
        Context cx = contextFactory.enterContext();
        cx.setLanguageVersion(languageVersion);
        return cx;
    }

    /** The top-level scope every namespace inherits from. */
    public ScriptableObject getSharedScope() {
        return sharedScope;
    }

    @Override
    public Namespace createNamespace(String name) {
        try (Context cx = enter()) {
            Scriptable scope = cx.newObject(sharedScope);
            scope.setPrototype(sharedScope);
            scope.setParentScope(null);
            return new ScopeNamespace(this, name, (ScriptableObject) scope);
        }
    }

    @Override
    public Object execute(String code, String sourceName, Namespace namespace) {
        ScopeNamespace ns = scopeOf(namespace);
        try (Context cx = enter()) {
            Object result = cx.evaluateString(ns.getScope(), code, sourceName, 1, null);
            return ScopeNamespace.toJava(result);
        } catch (RhinoException e) {
            throw new EvaluationException(
                    sourceName + ":" + e.lineNumber() + ": " + e.details(),
                    sourceName,
                    e.lineNumber(),
                    e);
        }
    }

    private ScopeNamespace scopeOf(Namespace namespace) {
        if (!(namespace instanceof ScopeNamespace)
                || ((ScopeNamespace) namespace).getInterpreter() != this) {
            throw new IllegalArgumentException(
                    "Namespace '" + namespace.getName() + "' was not created by this interpreter");
        }
        return (ScopeNamespace) namespace;
    }
}
