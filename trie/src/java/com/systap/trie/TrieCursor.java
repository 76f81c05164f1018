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

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * A position in a {@link Trie}. A cursor rests either on an entry or on the
 * sentinel which follows the last entry (the end cursor). It supports moving to
 * the next and the prior entry in key order, reading and writing the value of
 * the entry and reconstructing its key.
 * <p>
 * A cursor does not own anything. It stays usable until the node on which it
 * rests is removed from the trie, after which every operation throws a
 * {@link StaleCursorException}. Two cursors are equal iff they rest on the same
 * node.
 * <p>
 * Note: Unlike the other methods, {@link #advance(Object)} modifies the trie.
 *
 * @version $Id$
 * @param <S>
 *            The generic type of the key.
 * @param <U>
 *            The generic type of the key unit.
 * @param <V>
 *            The generic type of the value.
 */
public class TrieCursor<S, U, V> {

    protected static final Logger log = Logger.getLogger(TrieCursor.class);

    protected static final boolean DEBUG = log.isDebugEnabled();

    /*
     * Some frequently used messages.
     */

    private static transient final String MSG_NO_SUCCESSOR = "Cursor at end can not be incremented";

    private static transient final String MSG_NO_PREDECESSOR = "Cursor at begin can not be decremented";

    /** From the ctor. */
    private final IKeyCoder<S, U> coder;

    /**
     * The node on which the cursor rests.
     */
    private Node<U, V> node;

    /**
     * @param coder
     *            The key coder of the trie.
     * @param node
     *            A leaf or the sentinel.
     */
    TrieCursor(final IKeyCoder<S, U> coder, final Node<U, V> node) {

        assert coder != null;

        assert node != null;

        this.coder = coder;

        this.node = node;

    }

    /**
     * The node on which the cursor rests.
     */
    final Node<U, V> node() {

        return node;

    }

    /**
     * A new cursor at the same position.
     */
    public TrieCursor<S, U, V> copy() {

        return new TrieCursor<S, U, V>(coder, node);

    }

    /**
     * <code>true</code> iff the cursor rests on the sentinel.
     */
    public boolean isEnd() {

        assertNotStale();

        return node.sentinel;

    }

    /**
     * Reconstruct the key of the entry by walking from the cursor position up
     * to the root.
     *
     * @throws IllegalStateException
     *             if the cursor is the end cursor.
     */
    public S key() {

        assertNotStale();

        if (node.sentinel)
            throw new IllegalStateException("The end cursor has no key");

        final ArrayList<U> units = new ArrayList<U>(16);

        Node<U, V> t = node;

        while (t.parent != null) {

            units.add(t.unit);

            t = t.parent;

        }

        Collections.reverse(units);

        return coder.decode(units);

    }

    /**
     * The value of the entry.
     *
     * @throws IllegalStateException
     *             if the cursor does not rest on an entry.
     */
    public V value() {

        assertEntry();

        return node.value;

    }

    /**
     * Replace the value of the entry.
     *
     * @param value
     *            The new value.
     *
     * @return The old value.
     *
     * @throws IllegalStateException
     *             if the cursor does not rest on an entry.
     */
    public V setValue(final V value) {

        assertEntry();

        final V old = node.value;

        node.value = value;

        return old;

    }

    /**
     * The key and value of the entry.
     *
     * @throws IllegalStateException
     *             if the cursor does not rest on an entry.
     */
    public Map.Entry<S, V> entry() {

        assertEntry();

        return new AbstractMap.SimpleImmutableEntry<S, V>(key(), node.value);

    }

    /**
     * Relabel the entry. The cursor descends from its current position along
     * the key units of the sub-key. The entry at the current position stops
     * being an entry and the node at the destination becomes one, after which
     * the cursor rests on the destination. The key of the entry is therefore
     * extended by the sub-key.
     * <p>
     * If the destination was not an entry then it receives the value of the
     * current entry. If the destination was already an entry then it keeps its
     * own value and the current entry is dropped, which reduces the size of the
     * trie by one.
     * <p>
     * The destination must already exist as a node, i.e., the extended key must
     * be a prefix of some stored key. No node is created.
     *
     * @param subKey
     *            The sub-key (required).
     *
     * @throws EmptyAdvanceException
     *             if the sub-key is empty.
     * @throws NoSuchPrefixException
     *             if there is no path for the sub-key below the current
     *             position, which is always the case for the end cursor.
     *             Neither the cursor nor the trie is changed.
     * @throws IllegalStateException
     *             if the cursor rests on a node which is no longer an entry.
     */
    public void advance(final S subKey) {

        assertNotStale();

        if (subKey == null)
            throw new IllegalArgumentException();

        final int len = coder.length(subKey);

        if (len == 0)
            throw new EmptyAdvanceException();

        if (node.sentinel)
            throw new NoSuchPrefixException("No such prefix: end cursor, subKey="
                    + subKey);

        assertEntry();

        // locate the destination without side effects.
        Node<U, V> dest = node;

        for (int i = 0; i < len; i++) {

            final U unit = coder.unitAt(subKey, i);

            if (unit == null)
                throw new IllegalArgumentException("null key unit at index="
                        + i);

            final Node<U, V> child = dest.getChild(unit, coder);

            if (child == null)
                throw new NoSuchPrefixException("No such prefix: key=" + key()
                        + ", subKey=" + subKey);

            dest = child;

        }

        // relabel.
        if (dest.leaf) {

            node.root().owner.entryDropped();

        } else {

            dest.leaf = true;

            dest.value = node.value;

        }

        // the origin is an ancestor of dest, so it remains a shared prefix.
        node.leaf = false;

        node.value = null;

        if (DEBUG)
            log.debug("advanced: subKey=" + subKey + ", to=" + dest);

        node = dest;

    }

    /**
     * <code>true</code> unless the cursor is the end cursor.
     */
    public boolean hasNext() {

        return !isEnd();

    }

    /**
     * Move to the next entry in key order (or to the end).
     *
     * @return this cursor.
     *
     * @throws CursorOutOfRangeException
     *             if the cursor is the end cursor.
     */
    public TrieCursor<S, U, V> next() {

        assertNotStale();

        if (node.sentinel)
            throw new CursorOutOfRangeException(MSG_NO_SUCCESSOR);

        Node<U, V> t = node;

        if (t.getChildCount() > 0) {

            // a key sorts before the keys which extend it.
            t = t.firstChild();

        } else {

            /*
             * Ascend to the nearest ancestor (or self) having a next sibling.
             * This always terminates below the root since every real child of
             * the root is followed by the sentinel.
             */

            while (true) {

                final Node<U, V> p = t.parent;

                final int index = p.indexOf(t, coder);

                if (index + 1 < p.getChildCount()) {

                    t = p.getChild(index + 1);

                    break;

                }

                t = p;

            }

        }

        // descend through first children to the first entry.
        while (!t.leaf) {

            t = t.firstChild();

        }

        node = t;

        return this;

    }

    /**
     * <code>true</code> iff there is an entry before the cursor position.
     */
    public boolean hasPrior() {

        assertNotStale();

        return priorNode() != null;

    }

    /**
     * Move to the prior entry in key order.
     *
     * @return this cursor.
     *
     * @throws CursorOutOfRangeException
     *             if there is no entry before the cursor position (the cursor
     *             position is not changed).
     */
    public TrieCursor<S, U, V> prior() {

        assertNotStale();

        final Node<U, V> t = priorNode();

        if (t == null)
            throw new CursorOutOfRangeException(MSG_NO_PREDECESSOR);

        node = t;

        return this;

    }

    /**
     * The predecessor of the cursor position: the deepest last entry of the
     * previous sibling subtree, or else the nearest ancestor which is an entry.
     *
     * @return The predecessor -or- <code>null</code> if there is none.
     */
    private Node<U, V> priorNode() {

        Node<U, V> t = node;

        while (true) {

            final Node<U, V> p = t.parent;

            final int index = p.indexOf(t, coder);

            if (index > 0) {

                t = p.getChild(index - 1);

                while (t.getChildCount() > 0) {

                    t = t.lastChild();

                }

                return t;

            }

            if (p.leaf) {

                return p;

            }

            if (p.isRoot()) {

                return null;

            }

            t = p;

        }

    }

    private void assertNotStale() {

        if (node.released)
            throw new StaleCursorException();

    }

    private void assertEntry() {

        assertNotStale();

        if (node.sentinel)
            throw new IllegalStateException("The end cursor has no entry");

        if (!node.leaf)
            throw new IllegalStateException("Cursor does not rest on an entry");

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof TrieCursor))
            return false;

        return node == ((TrieCursor<?, ?, ?>) o).node;

    }

    public int hashCode() {

        return System.identityHashCode(node);

    }

    public String toString() {

        if (node.released)
            return "Cursor{stale}";

        if (node.sentinel)
            return "Cursor{end}";

        return "Cursor{key=" + key() + (node.leaf ? ", value=" + node.value : "")
                + "}";

    }

}
