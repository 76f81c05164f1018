/*

Copyright (C) SYSTAP, LLC 2006-2008.  All rights reserved.

Contact:
     SYSTAP, LLC
     4501 Tower Road
     Greensboro, NC 27410
     licenses@bigdata.com

This program is free software; you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation; version 2 of the License.

This program is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with this program; if not, write to the Free Software
Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA

*/
/*
 * Created on Oct 12, 2026
 */

package com.systap.trie;

/**
 * An exception thrown when a key is inserted into a {@link Trie} which already
 * has an entry for that key. The {@link Trie} is not modified.
 * 
 * @version $Id$
 */
public class DuplicateKeyException extends IllegalArgumentException {

    /**
     * 
     */
    private static final long serialVersionUID = -5790154836208431266L;

    private final Object key;

    /**
     * @param key
     *            The key which is already present.
     */
    public DuplicateKeyException(final Object key) {

        super("Key already exists: " + key);

        this.key = key;

    }

    /**
     * The rejected key.
     */
    public Object getKey() {

        return key;

    }

}
