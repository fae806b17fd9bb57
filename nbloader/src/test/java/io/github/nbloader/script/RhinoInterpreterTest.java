/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.script;

import static org.junit.jupiter.api.Assertions.*;

import io.github.nbloader.module.Namespace;
import io.github.nbloader.shell.EvaluationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RhinoInterpreterTest {

    private RhinoInterpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = new RhinoInterpreter();
    }

    private static double num(Object value) {
        assertTrue(value instanceof Number, "expected a number, got " + value);
        return ((Number) value).doubleValue();
    }

    @Nested
    class Execute {

        @Test
        void topLevelBindingsLandInNamespace() {
            Namespace ns = interpreter.createNamespace("m");
            interpreter.execute("var a = 1; b = a + 1; function twice(v) { return v * 2; }", "t", ns);

            assertEquals(1.0, num(ns.get("a")));
            assertEquals(2.0, num(ns.get("b")));
            assertTrue(ns.has("twice"));
            assertTrue(ns.names().containsAll(java.util.List.of("a", "b", "twice")));
        }

        @Test
        void standardGlobalsAreReadableButNotBindings() {
            Namespace ns = interpreter.createNamespace("m");
            assertEquals(3.0, num(interpreter.execute("Math.max(1, 3)", "t", ns)));
            assertFalse(ns.has("Math"));
            assertNull(ns.get("Math"));
        }

        @Test
        void namespacesAreIsolated() {
            Namespace a = interpreter.createNamespace("a");
            Namespace b = interpreter.createNamespace("b");
            interpreter.execute("x = 1", "t", a);
            interpreter.execute("x = 2", "t", b);

            assertEquals(1.0, num(a.get("x")));
            assertEquals(2.0, num(b.get("x")));
            assertFalse(interpreter.getSharedScope().has("x", interpreter.getSharedScope()));
        }

        @Test
        void functionsKeepTheirDefiningNamespace() {
            Namespace a = interpreter.createNamespace("a");
            Namespace b = interpreter.createNamespace("b");
            interpreter.execute("var k = 5; function getK() { return k; }", "t", a);
            b.put("getK", a.get("getK"));
            interpreter.execute("var k = 7;", "t", b);

            assertEquals(5.0, num(interpreter.execute("getK()", "t", b)));
        }

        @Test
        void javaValuesRoundTrip() {
            Namespace ns = interpreter.createNamespace("m");
            StringBuilder sb = new StringBuilder();
            ns.put("sb", sb);
            interpreter.execute("sb.append('hi')", "t", ns);

            assertEquals("hi", sb.toString());
            assertSame(sb, ns.get("sb"));
        }

        @Test
        void undefinedBindingReadsAsNull() {
            Namespace ns = interpreter.createNamespace("m");
            interpreter.execute("var u;", "t", ns);
            assertTrue(ns.has("u"));
            assertNull(ns.get("u"));
        }

        @Test
        void scriptErrorCarriesLocation() {
            Namespace ns = interpreter.createNamespace("m");
            EvaluationException e =
                    assertThrows(
                            EvaluationException.class,
                            () -> interpreter.execute("var ok = 1;\nthrow new Error('boom');", "nb#cell3", ns));

            assertEquals("nb#cell3", e.getSourceName());
            assertEquals(2, e.getLineNumber());
            assertTrue(e.getMessage().contains("boom"), e.getMessage());
            assertEquals(1.0, num(ns.get("ok")));
        }

        @Test
        void syntaxErrorIsEvaluationException() {
            Namespace ns = interpreter.createNamespace("m");
            assertThrows(EvaluationException.class, () -> interpreter.execute("var = ;", "t", ns));
        }

        @Test
        void rejectsForeignNamespace() {
            Namespace other = new RhinoInterpreter().createNamespace("other");
            assertThrows(IllegalArgumentException.class, () -> interpreter.execute("1", "t", other));
        }
    }

    @Nested
    class Remove {

        @Test
        void removesAssignedBinding() {
            Namespace ns = interpreter.createNamespace("m");
            interpreter.execute("x = 1", "t", ns);
            assertTrue(ns.remove("x"));
            assertFalse(ns.has("x"));
        }

        @Test
        void removesVarDeclaredBinding() {
            Namespace ns = interpreter.createNamespace("m");
            interpreter.execute("var y = 1", "t", ns);
            assertTrue(ns.remove("y"));
            assertFalse(ns.has("y"));
        }

        @Test
        void missingBindingIsNotRemoved() {
            Namespace ns = interpreter.createNamespace("m");
            assertFalse(ns.remove("nothing"));
        }
    }
}
