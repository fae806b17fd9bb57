/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.github.nbloader.module.SearchPath;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;

/**
 * Settings under the {@code nbloader} path. Defaults come from the {@code reference.conf} shipped
 * with the library.
 */
public final class NotebookImportConfig {

    public static final String ROOT_PATH = "nbloader";

    private final String documentExtension;
    private final boolean underscoreFallback;
    private final Charset encoding;
    private final SearchPath searchPath;
    private final int languageVersion;
    private final String importFunction;

    private NotebookImportConfig(Config c) {
        String ext = c.getString("document-extension");
        if (ext.startsWith(".")) {
            ext = ext.substring(1);
        }
        if (ext.isEmpty()) {
            throw new ConfigException.BadValue(
                    c.origin(), "document-extension", "must not be empty");
        }
        this.documentExtension = ext;
        this.underscoreFallback = c.getBoolean("underscore-fallback");
        this.encoding = charset(c);
        this.searchPath = SearchPath.of(c.getStringList("search-path"));
        this.languageVersion = c.getInt("language-version");
        this.importFunction = c.getString("import-function");
        if (importFunction.isEmpty()) {
            throw new ConfigException.BadValue(c.origin(), "import-function", "must not be empty");
        }
    }

    /** Loads from the application configuration (system properties, application.conf, ...). */
    public static NotebookImportConfig load() {
        return fromConfig(ConfigFactory.load());
    }

    /** Library defaults only. */
    public static NotebookImportConfig defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    public static NotebookImportConfig fromConfig(Config config) {
        Config merged = config.withFallback(ConfigFactory.defaultReference()).resolve();
        return new NotebookImportConfig(merged.getConfig(ROOT_PATH));
    }

    private static Charset charset(Config c) {
        String name = c.getString("encoding");
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ConfigException.BadValue(
                    c.getValue("encoding").origin(), "encoding", "unknown charset " + name, e);
        }
    }

    public String getDocumentExtension() {
        return documentExtension;
    }

    public boolean isUnderscoreFallback() {
        return underscoreFallback;
    }

    public Charset getEncoding() {
        return encoding;
    }

    public SearchPath getSearchPath() {
        return searchPath;
    }

    public int getLanguageVersion() {
        return languageVersion;
    }

    public String getImportFunction() {
        return importFunction;
    }

    @Override
    public String toString() {
        return "NotebookImportConfig{extension="
                + documentExtension
                + ", underscoreFallback="
                + underscoreFallback
                + ", encoding="
                + encoding
                + ", searchPath="
                + searchPath
                + ", languageVersion="
                + languageVersion
                + ", importFunction="
                + importFunction
                + "}";
    }
}
