/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.module;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ModuleSystemTest {

    private ModuleSystem system;

    @BeforeEach
    void setUp() {
        system = new ModuleSystem(SearchPath.of("/lib"));
    }

    private ModuleLoader registeringLoader(List<String> calls) {
        return new ModuleLoader() {
            @Override
            public ModuleObject load(ModuleName name) {
                calls.add(name.getFullName());
                ModuleObject module =
                        new ModuleObject(name, new MapNamespace(name.getFullName()), "/lib/x", this);
                system.getRegistry().register(module);
                return module;
            }
        };
    }

    @Nested
    class ImportModule {

        @Test
        void firstClaimingFinderWins() throws Exception {
            List<String> first = new ArrayList<>();
            List<String> second = new ArrayList<>();
            system.getResolverChain().append((name, path) -> null);
            system.getResolverChain().append((name, path) -> registeringLoader(first));
            system.getResolverChain().append((name, path) -> registeringLoader(second));

            ModuleObject m = system.importModule("alpha");

            assertEquals(ModuleName.of("alpha"), m.getName());
            assertEquals(List.of("alpha"), first);
            assertTrue(second.isEmpty());
        }

        @Test
        void registeredModuleIsReturnedWithoutConsultingFinders() throws Exception {
            ModuleObject existing =
                    new ModuleObject(ModuleName.of("alpha"), new MapNamespace("alpha"), null, null);
            system.getRegistry().register(existing);
            system.getResolverChain()
                    .append(
                            (name, path) -> {
                                throw new AssertionError("finder consulted");
                            });

            assertSame(existing, system.importModule("alpha"));
        }

        @Test
        void secondImportDoesNotLoadAgain() throws Exception {
            List<String> calls = new ArrayList<>();
            system.getResolverChain().append((name, path) -> registeringLoader(calls));

            ModuleObject a = system.importModule("alpha");
            ModuleObject b = system.importModule("alpha");

            assertSame(a, b);
            assertEquals(1, calls.size());
        }

        @Test
        void registryBindingWinsOverLoaderResult() throws Exception {
            ModuleObject replacement =
                    new ModuleObject(ModuleName.of("alpha"), new MapNamespace("other"), null, null);
            system.getResolverChain()
                    .append(
                            (name, path) ->
                                    n -> {
                                        system.getRegistry().register(replacement);
                                        return new ModuleObject(n, new MapNamespace("orig"), null, null);
                                    });

            assertSame(replacement, system.importModule("alpha"));
        }

        @Test
        void finderSeesRequestedSearchPath() throws Exception {
            List<SearchPath> seen = new ArrayList<>();
            system.getResolverChain()
                    .append(
                            (name, path) -> {
                                seen.add(path);
                                return null;
                            });

            assertThrows(ModuleNotFoundException.class, () -> system.importModule("alpha"));
            assertThrows(
                    ModuleNotFoundException.class,
                    () -> system.importModule(ModuleName.of("beta"), SearchPath.of("/other")));

            assertEquals(List.of(SearchPath.of("/lib"), SearchPath.of("/other")), seen);
        }

        @Test
        void notFoundWhenEveryFinderDeclines() {
            system.getResolverChain().append((name, path) -> null);
            ModuleNotFoundException e =
                    assertThrows(ModuleNotFoundException.class, () -> system.importModule("missing"));
            assertEquals("missing", e.getModuleName());
            assertTrue(e.getMessage().contains("missing"));
        }

        @Test
        void loaderFailurePropagates() {
            system.getResolverChain()
                    .append(
                            (name, path) ->
                                    n -> {
                                        throw new ImportException(n.getFullName(), "broken");
                                    });
            ImportException e =
                    assertThrows(ImportException.class, () -> system.importModule("alpha"));
            assertEquals("broken", e.getMessage());
        }
    }

    @Nested
    class Chain {

        @Test
        void appendRefusesSameInstanceTwice() {
            ModuleFinder finder = (name, path) -> null;
            assertTrue(system.getResolverChain().append(finder));
            assertFalse(system.getResolverChain().append(finder));
            assertEquals(1, system.getResolverChain().size());
        }

        @Test
        void removeByIdentity() {
            ModuleFinder a = (name, path) -> null;
            system.getResolverChain().append(a);
            assertTrue(system.getResolverChain().remove(a));
            assertFalse(system.getResolverChain().remove(a));
            assertFalse(system.getResolverChain().contains(a));
        }
    }

    @Nested
    class Registry {

        @Test
        void lookupByNameOrString() {
            ModuleObject m = new ModuleObject(ModuleName.of("a.b"), new MapNamespace("a.b"), null, null);
            system.getRegistry().register(m);
            assertSame(m, system.getRegistry().lookup(ModuleName.of("a.b")));
            assertSame(m, system.getRegistry().lookup("a.b"));
            assertNull(system.getRegistry().lookup("a"));
        }

        @Test
        void unregisterRemovesBinding() {
            ModuleObject m = new ModuleObject(ModuleName.of("a"), new MapNamespace("a"), null, null);
            system.getRegistry().register(m);
            assertSame(m, system.getRegistry().unregister(ModuleName.of("a")));
            assertFalse(system.getRegistry().contains(ModuleName.of("a")));
            assertEquals(0, system.getRegistry().size());
        }
    }
}
