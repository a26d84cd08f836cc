/*
 * PDF-Toolkit - Command-line PDF page assembly and extraction
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.toolkit.engine;

/** Kind of navigation attached to an outline entry. */
public enum ActionKind {
    GOTO("GOTO"),
    REMOTE_GOTO("REMOTEGOTO"),
    URI("URI"),
    LAUNCH("LAUNCH"),
    EMBEDDED_GOTO("EMBEDDEDGOTO"),
    /** No action; the entry carries its own destination. */
    PAGE("Page"),
    UNSUPPORTED("UNSUPPORTED");

    private final String label;

    ActionKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Whether the action's destination identifies a page. */
    public boolean resolvesToPage() {
        return this == GOTO || this == REMOTE_GOTO;
    }
}
