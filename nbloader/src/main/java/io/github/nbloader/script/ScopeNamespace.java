/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.script;

import io.github.nbloader.module.Namespace;
import java.util.LinkedHashSet;
import java.util.Set;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;
import org.mozilla.javascript.Wrapper;

/** {@link Namespace} view of a Rhino scope object. Only own properties count as bindings. */
public final class ScopeNamespace implements Namespace {

    private final RhinoInterpreter interpreter;
    private final String name;
    private final ScriptableObject scope;

    ScopeNamespace(RhinoInterpreter interpreter, String name, ScriptableObject scope) {
        this.interpreter = interpreter;
        this.name = name;
        this.scope = scope;
    }

    RhinoInterpreter getInterpreter() {
        return interpreter;
    }

    /** The scope object code runs against. */
    public ScriptableObject getScope() {
        return scope;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Object get(String key) {
        if (!scope.has(key, scope)) {
            return null;
        }
        return toJava(scope.get(key, scope));
    }

    @Override
    public void put(String key, Object value) {
        try (Context cx = interpreter.enter()) {
            ScriptableObject.putProperty(scope, key, Context.javaToJS(value, scope));
        }
    }

    @Override
    public boolean has(String key) {
        return scope.has(key, scope);
    }

    @Override
    public boolean remove(String key) {
        if (!scope.has(key, scope)) {
            return false;
        }
        try (Context cx = interpreter.enter()) {
            int attributes = scope.getAttributes(key);
            // top-level var and function bindings are permanent; constants stay
            if ((attributes & ScriptableObject.READONLY) == 0
                    && (attributes & ScriptableObject.PERMANENT) != 0) {
                scope.setAttributes(key, attributes & ~ScriptableObject.PERMANENT);
            }
            scope.delete(key);
        }
        return !scope.has(key, scope);
    }

    @Override
    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        for (Object id : scope.getIds()) {
            if (id instanceof String) {
                names.add((String) id);
            }
        }
        return names;
    }

    /** Unwraps Java objects and maps {@code undefined} and not-found markers to null. */
    static Object toJava(Object value) {
        if (value == null || value == Scriptable.NOT_FOUND || value instanceof Undefined) {
            return null;
        }
        if (value instanceof Wrapper) {
            return ((Wrapper) value).unwrap();
        }
        return value;
    }

    @Override
    public String toString() {
        return "ScopeNamespace{" + name + "}";
    }
}
