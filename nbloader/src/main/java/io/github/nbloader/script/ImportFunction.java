/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.script;

import io.github.nbloader.module.ImportException;
import io.github.nbloader.module.ModuleObject;
import io.github.nbloader.module.ModuleSystem;
import io.github.nbloader.module.Namespace;
import org.mozilla.javascript.BaseFunction;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ScriptRuntime;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;

/**
 * Script-side entry to {@link ModuleSystem#importModule(String)}. Returns the module's namespace
 * object so callers can read its bindings and call its functions. Import failures become script
 * errors in the calling code.
 */
public class ImportFunction extends BaseFunction {

    private static final long serialVersionUID = 1L;

    private final transient ModuleSystem system;
    private final String functionName;

    public ImportFunction(ModuleSystem system, String functionName) {
        this.system = system;
        this.functionName = functionName;
    }

    /** Installs the function in the shared scope of {@code interpreter}. */
    public static ImportFunction install(
            RhinoInterpreter interpreter, ModuleSystem system, String functionName) {
        ScriptableObject scope = interpreter.getSharedScope();
        ImportFunction fn = new ImportFunction(system, functionName);
        fn.setParentScope(scope);
        fn.setPrototype(ScriptableObject.getFunctionPrototype(scope));
        ScriptableObject.putProperty(scope, functionName, fn);
        return fn;
    }

    @Override
    public Object call(Context cx, Scriptable scope, Scriptable thisObj, Object[] args) {
        if (args == null || args.length < 1) {
            throw ScriptRuntime.throwError(cx, scope, functionName + "() needs one argument");
        }
        String id = Context.toString(args[0]);
        ModuleObject module;
        try {
            module = system.importModule(id);
        } catch (ImportException e) {
            throw Context.throwAsScriptRuntimeEx(e);
        }
        Namespace ns = module.getNamespace();
        if (ns instanceof ScopeNamespace) {
            return ((ScopeNamespace) ns).getScope();
        }
        return Context.javaToJS(module, scope);
    }

    @Override
    public String getFunctionName() {
        return functionName;
    }

    @Override
    public int getArity() {
        return 1;
    }

    @Override
    public int getLength() {
        return 1;
    }
}
