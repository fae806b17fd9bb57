/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.notebook;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.json.JsonParser;

/**
 * Reads Jupyter notebook JSON. Understands the current layout (top-level {@code cells}) and the
 * older one where cells sit under {@code worksheets} and code is stored in {@code input}.
 *
 * <p>The format version is not checked.
 */
public class IpynbReader implements DocumentReader {

    private final ContextFactory contextFactory;
    private final Scriptable scope;

    public IpynbReader() {
        this(new ContextFactory());
    }

    public IpynbReader(ContextFactory contextFactory) {
        this.contextFactory = Objects.requireNonNull(contextFactory, "contextFactory");
        try (Context cx = contextFactory.enterContext()) {
            this.scope = cx.initSafeStandardObjects();
        }
    }

    @Override
    public List<CellRecord> read(String content, String path) throws DocumentReadException {
        Object root;
        try (Context cx = contextFactory.enterContext()) {
            root = new JsonParser(cx, scope).parseValue(content);
        } catch (JsonParser.ParseException e) {
            throw new DocumentReadException(path, "Malformed notebook JSON: " + e.getMessage(), e);
        }
        if (!(root instanceof Map)) {
            throw new DocumentReadException(path, "Notebook root is not a JSON object");
        }
        Map<?, ?> notebook = (Map<?, ?>) root;

        List<CellRecord> cells = new ArrayList<>();
        Object topLevel = notebook.get("cells");
        if (topLevel instanceof List) {
            addCells(cells, (List<?>) topLevel, path);
            return cells;
        }
        Object worksheets = notebook.get("worksheets");
        if (worksheets instanceof List) {
            for (Object worksheet : (List<?>) worksheets) {
                if (!(worksheet instanceof Map)) {
                    throw new DocumentReadException(path, "Worksheet is not a JSON object");
                }
                Object sheetCells = ((Map<?, ?>) worksheet).get("cells");
                if (sheetCells instanceof List) {
                    addCells(cells, (List<?>) sheetCells, path);
                }
            }
            return cells;
        }
        throw new DocumentReadException(path, "Notebook has no cells");
    }

    private static void addCells(List<CellRecord> out, List<?> cells, String path)
            throws DocumentReadException {
        for (Object c : cells) {
            if (!(c instanceof Map)) {
                throw new DocumentReadException(path, "Cell " + out.size() + " is not a JSON object");
            }
            Map<?, ?> cell = (Map<?, ?>) c;
            CellKind kind = kindOf(cell.get("cell_type"));
            Object source = cell.get("source");
            if (source == null && kind == CellKind.CODE) {
                source = cell.get("input");
            }
            out.add(new CellRecord(kind, joinSource(source, path, out.size())));
        }
    }

    static CellKind kindOf(Object type) {
        if ("code".equals(type)) {
            return CellKind.CODE;
        }
        if ("markdown".equals(type) || "heading".equals(type)) {
            return CellKind.MARKDOWN;
        }
        return CellKind.RAW;
    }

    private static String joinSource(Object source, String path, int index)
            throws DocumentReadException {
        if (source == null) {
            return "";
        }
        if (source instanceof CharSequence) {
            return source.toString();
        }
        if (source instanceof List) {
            // lines already carry their own newlines
            StringBuilder sb = new StringBuilder();
            for (Object line : (List<?>) source) {
                if (line != null) {
                    sb.append(line);
                }
            }
            return sb.toString();
        }
        throw new DocumentReadException(path, "Cell " + index + " has an unreadable source");
    }
}
