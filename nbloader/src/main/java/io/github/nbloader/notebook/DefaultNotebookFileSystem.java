/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.notebook;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/** Default {@link NotebookFileSystem} implementation backed by {@code java.nio.file}. */
public class DefaultNotebookFileSystem implements NotebookFileSystem {

    private final Charset charset;

    public DefaultNotebookFileSystem() {
        this(StandardCharsets.UTF_8);
    }

    public DefaultNotebookFileSystem(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    @Override
    public boolean isFile(String path) {
        return Files.isRegularFile(Paths.get(path));
    }

    @Override
    public String readFile(String path) throws IOException {
        return Files.readString(Paths.get(path), charset);
    }

    @Override
    public String resolve(String directory, String fileName) {
        Path dir = directory == null || directory.isEmpty() ? Paths.get("") : Paths.get(directory);
        return dir.resolve(fileName).normalize().toString();
    }
}
