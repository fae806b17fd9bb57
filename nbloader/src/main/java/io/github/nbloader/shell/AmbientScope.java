/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package io.github.nbloader.shell;

import io.github.nbloader.module.Namespace;

/**
 * Release token returned by {@link InteractiveShell#enterAmbient(Namespace)}. Closing it puts back
 * the namespace that was ambient when the scope was entered. Scopes should be closed in reverse
 * order of entry; closing an outer scope also closes any inner scope still open. Closing twice
 * does nothing.
 */
public final class AmbientScope implements AutoCloseable {

    private final InteractiveShell shell;
    private final Namespace previous;
    private final Namespace active;
    private boolean closed;

    AmbientScope(InteractiveShell shell, Namespace previous, Namespace active) {
        this.shell = shell;
        this.previous = previous;
        this.active = active;
    }

    Namespace getPrevious() {
        return previous;
    }

    public Namespace getActive() {
        return active;
    }

    public boolean isClosed() {
        return closed;
    }

    void markClosed() {
        closed = true;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        shell.release(this);
        closed = true;
    }
}
