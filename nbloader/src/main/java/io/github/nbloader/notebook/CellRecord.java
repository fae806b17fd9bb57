/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.notebook;

import java.util.Objects;

/** One cell of a notebook: its kind and raw source text. */
public final class CellRecord {

    private final CellKind kind;
    private final String source;

    public CellRecord(CellKind kind, String source) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.source = source == null ? "" : source;
    }

    public static CellRecord code(String source) {
        return new CellRecord(CellKind.CODE, source);
    }

    public static CellRecord markdown(String source) {
        return new CellRecord(CellKind.MARKDOWN, source);
    }

    public CellKind getKind() {
        return kind;
    }

    public String getSource() {
        return source;
    }

    public boolean isCode() {
        return kind == CellKind.CODE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRecord)) {
            return false;
        }
        CellRecord that = (CellRecord) o;
        return kind == that.kind && source.equals(that.source);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + source.hashCode();
    }

    @Override
    public String toString() {
        return "CellRecord{kind=" + kind + ", source='" + source + "'}";
    }
}
