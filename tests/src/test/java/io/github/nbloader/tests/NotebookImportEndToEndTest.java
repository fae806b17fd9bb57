/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.tests;

import static org.junit.jupiter.api.Assertions.*;

import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import io.github.nbloader.NotebookImporter;
import io.github.nbloader.config.NotebookImportConfig;
import io.github.nbloader.module.ModuleLoader;
import io.github.nbloader.module.ModuleName;
import io.github.nbloader.module.ModuleNotFoundException;
import io.github.nbloader.module.ModuleObject;
import io.github.nbloader.module.ModuleResolutionException;
import io.github.nbloader.module.SearchPath;
import io.github.nbloader.notebook.CellExecutionException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NotebookImportEndToEndTest {

    private static final String NOTEBOOKS_DIR =
            Path.of("src/test/resources/notebooks").toAbsolutePath().toString();

    private NotebookImporter importer;

    @BeforeEach
    void setUp() {
        importer = NotebookImporter.create(configWithSearchPath(List.of(NOTEBOOKS_DIR)));
        importer.install();
    }

    private static NotebookImportConfig configWithSearchPath(List<String> dirs) {
        return NotebookImportConfig.fromConfig(
                ConfigFactory.empty()
                        .withValue("nbloader.search-path", ConfigValueFactory.fromIterable(dirs)));
    }

    private static String notebook(String source) {
        return "{\"cells\": [{\"cell_type\": \"code\", \"metadata\": {}, \"source\": [\""
                + source.replace("\\", "\\\\").replace("\"", "\\\"")
                + "\"]}], \"metadata\": {}, \"nbformat\": 4, \"nbformat_minor\": 5}";
    }

    @Nested
    class FromFixtures {

        @Test
        void importsNotebookThatImportsAnother() throws Exception {
            ModuleObject analysis = importer.importModule("analysis");

            assertEquals(4.0, ((Number) analysis.get("avg")).doubleValue());
            assertFalse(analysis.getNamespace().has("scratch"));
            assertEquals(List.of("avg", "helpers"), analysis.get("report"));
            assertEquals(
                    Path.of(NOTEBOOKS_DIR, "analysis.ipynb").toString(), analysis.get("__file__"));

            ModuleObject helpers = importer.getModuleSystem().getRegistry().lookup("helpers");
            assertNotNull(helpers);
            assertEquals(Boolean.TRUE, helpers.get("helpersLoaded"));
            assertSame(
                    importer.getShell().getUserNamespace(),
                    importer.getShell().getAmbientNamespace());
        }

        @Test
        void underscoreNameFindsSpacedFile() throws Exception {
            ModuleObject m = importer.importModule("Foo_Bar");

            assertEquals("from Foo Bar", String.valueOf(m.get("greeting")));
            assertTrue(m.getFile().endsWith("Foo Bar.ipynb"), m.getFile());
        }

        @Test
        void dottedNameUsesLastSegment() throws Exception {
            ModuleObject m = importer.importModule("shared.helpers");

            assertEquals("shared.helpers", m.get("__name__"));
            assertTrue(m.getNamespace().has("mean"));
        }

        @Test
        void readsWorksheetLayout() throws Exception {
            ModuleObject m = importer.importModule("legacy");
            assertEquals("nbformat 3", String.valueOf(m.get("label")));
        }

        @Test
        void failureKeepsEarlierCells() {
            CellExecutionException e =
                    assertThrows(CellExecutionException.class, () -> importer.importModule("failing"));
            assertEquals(1, e.getCellIndex());
            assertTrue(e.getMessage().contains("planned failure"), e.getMessage());

            ModuleObject partial = importer.getModuleSystem().getRegistry().lookup("failing");
            assertTrue(partial.getNamespace().has("before"));
            assertFalse(partial.getNamespace().has("after"));
        }

        @Test
        void unknownNameNotFound() {
            assertThrows(ModuleNotFoundException.class, () -> importer.importModule("nothing_here"));
        }
    }

    @Nested
    class SearchOrder {

        @TempDir Path first;
        @TempDir Path second;

        @Test
        void earlierDirectoryWins() throws Exception {
            Files.writeString(first.resolve("Dup.ipynb"), notebook("origin = 'first'"), StandardCharsets.UTF_8);
            Files.writeString(second.resolve("Dup.ipynb"), notebook("origin = 'second'"), StandardCharsets.UTF_8);

            NotebookImporter a =
                    NotebookImporter.create(
                            configWithSearchPath(List.of(first.toString(), second.toString())));
            a.install();
            NotebookImporter b =
                    NotebookImporter.create(
                            configWithSearchPath(List.of(second.toString(), first.toString())));
            b.install();

            assertEquals("first", String.valueOf(a.importModule("Dup").get("origin")));
            assertEquals("second", String.valueOf(b.importModule("Dup").get("origin")));
        }

        @Test
        void spacedFileInEarlierDirectoryBeatsExactInLater() throws Exception {
            Files.writeString(first.resolve("My Data.ipynb"), notebook("origin = 'spaced'"), StandardCharsets.UTF_8);
            Files.writeString(second.resolve("My_Data.ipynb"), notebook("origin = 'exact'"), StandardCharsets.UTF_8);

            ModuleObject m =
                    importer.importModule(
                            "My_Data", SearchPath.of(first.toString(), second.toString()));

            assertEquals("spaced", String.valueOf(m.get("origin")));
        }

        @Test
        void moduleRemovedAfterClaimIsResolutionFailure() throws Exception {
            Path file = first.resolve("Late.ipynb");
            Files.writeString(file, notebook("x = 1"), StandardCharsets.UTF_8);
            SearchPath path = SearchPath.of(first.toString());

            ModuleLoader loader = importer.getFinder().find(ModuleName.of("Late"), path);
            assertNotNull(loader);
            Files.delete(file);

            assertThrows(ModuleResolutionException.class, () -> loader.load(ModuleName.of("Late")));
        }
    }
}
