/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.shell;

import io.github.nbloader.module.Namespace;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

/** Line magics every shell starts with. All of them act on the ambient namespace. */
final class BuiltinMagics {

    private BuiltinMagics() {}

    static void registerAll(InteractiveShell shell) {
        shell.registerMagic("who_ls", (sh, args) -> userNames(sh.getAmbientNamespace()));
        shell.registerMagic(
                "who", (sh, args) -> String.join("\t", userNames(sh.getAmbientNamespace())));
        shell.registerMagic(
                "xdel",
                (sh, args) -> {
                    if (args.isEmpty()) {
                        throw new IllegalArgumentException("%xdel needs a variable name");
                    }
                    return sh.getAmbientNamespace().remove(args);
                });
        shell.registerMagic(
                "env",
                (sh, args) -> args.isEmpty() ? new TreeMap<>(System.getenv()) : System.getenv(args));
    }

    /** Sorted binding names, hiding the double-underscore metadata entries. */
    static List<String> userNames(Namespace ns) {
        List<String> names = new ArrayList<>();
        for (String name : ns.names()) {
            if (!name.startsWith("__")) {
                names.add(name);
            }
        }
        Collections.sort(names);
        return names;
    }
}
