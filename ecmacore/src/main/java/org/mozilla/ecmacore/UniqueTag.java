/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/** Class instances represent tags to mark special Object values. */
public final class UniqueTag {
    private static final int ID_NOT_FOUND = 1;
    private static final int ID_EMPTY = 2;

    /**
     * Tag to mark non-existing values, and absent fields of a property descriptor used as a
     * definition request.
     */
    public static final UniqueTag NOT_FOUND = new UniqueTag(ID_NOT_FOUND);

    /** Tag to mark the value of a completion that carries no value. */
    public static final UniqueTag EMPTY = new UniqueTag(ID_EMPTY);

    private final int tagId;

    private UniqueTag(int tagId) {
        this.tagId = tagId;
    }

    @Override
    public String toString() {
        String name;
        switch (tagId) {
            case ID_NOT_FOUND:
                name = "NOT_FOUND";
                break;
            case ID_EMPTY:
                name = "EMPTY";
                break;
            default:
                throw Kit.codeBug();
        }
        return super.toString() + ": " + name;
    }
}
