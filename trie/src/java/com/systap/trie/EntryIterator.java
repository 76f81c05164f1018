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

import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Visits the entries of a {@link Trie} in ascending key order using a
 * {@link TrieCursor}.
 *
 * @version $Id$
 */
class EntryIterator<S, U, V> implements Iterator<Map.Entry<S, V>> {

    private final Trie<S, U, V> trie;

    /**
     * Rests on the next entry to visit (or on the end).
     */
    private final TrieCursor<S, U, V> cursor;

    /**
     * The last visited entry (<code>null</code> until {@link #next()} and
     * after {@link #remove()}).
     */
    private TrieCursor<S, U, V> lastVisited = null;

    public EntryIterator(final Trie<S, U, V> trie) {

        assert trie != null;

        this.trie = trie;

        this.cursor = trie.begin();

    }

    public boolean hasNext() {

        return !cursor.isEnd();

    }

    public Map.Entry<S, V> next() {

        if (!hasNext())
            throw new NoSuchElementException();

        final Map.Entry<S, V> e = cursor.entry();

        lastVisited = cursor.copy();

        cursor.next();

        return e;

    }

    /**
     * Erases the last visited entry. The next entry is not affected since it
     * is neither on the pruned chain nor an ancestor of the erased entry.
     */
    public void remove() {

        if (lastVisited == null)
            throw new IllegalStateException();

        trie.erase(lastVisited);

        lastVisited = null;

    }

}
