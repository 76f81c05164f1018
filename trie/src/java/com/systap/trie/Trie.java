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

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

/**
 * An ordered associative container mapping keys to values using a prefix tree.
 * A key is a sequence of key units (see {@link IKeyCoder}) and each node of the
 * tree holds one key unit. Keys sharing a prefix share the nodes for that
 * prefix.
 * <p>
 * The entries are visited in ascending lexicographic order of their key units
 * using a {@link TrieCursor}. A key which is a strict prefix of another key is
 * visited first. The end of the trie is a reserved sentinel position which is
 * reported by {@link #end()} and is never removed.
 * <p>
 * Note: This class is NOT thread-safe. Concurrent mutation, or mutation
 * concurrent with traversal, MUST be serialized by the caller.
 * <p>
 * Note: A {@link TrieCursor} becomes stale when the node on which it rests is
 * removed by {@link #erase(TrieCursor)}, {@link #clear()} or
 * {@link #assign(Trie)}. Any use of a stale cursor throws a
 * {@link StaleCursorException}.
 *
 * @version $Id$
 * @param <S>
 *            The generic type of the key.
 * @param <U>
 *            The generic type of the key unit.
 * @param <V>
 *            The generic type of the value.
 */
public class Trie<S, U, V> implements Iterable<Map.Entry<S, V>> {

    protected static final Logger log = Logger.getLogger(Trie.class);

    protected static final boolean INFO = log.isInfoEnabled();

    protected static final boolean DEBUG = log.isDebugEnabled();

    /**
     * Log for {@link #dump(PrintStream)}. Its effective level determines how
     * much detail is written.
     */
    public static final Logger dumpLog = Logger.getLogger(Trie.class.getName()
            + "#dump");

    /**
     * Imposes the order on the key units (exchanged by {@link #swap(Trie)}).
     */
    private IKeyCoder<S, U> coder;

    /**
     * The root of the tree (exchanged by {@link #swap(Trie)}).
     */
    private Node<U, V> root;

    /**
     * The #of entries (exchanged by {@link #swap(Trie)}).
     */
    private int size;

    /**
     * Return a new trie whose keys are {@link String}s.
     */
    public static <V> Trie<String, Character, V> newStringTrie() {

        return new Trie<String, Character, V>(StringKeyCoder.INSTANCE);

    }

    /**
     * Return a new trie whose keys are {@link List}s of key units.
     *
     * @param comparator
     *            The order imposed on the key units -or- <code>null</code> for
     *            their natural order.
     */
    public static <U, V> Trie<List<U>, U, V> newListTrie(
            final Comparator<? super U> comparator) {

        return new Trie<List<U>, U, V>(new ListKeyCoder<U>(comparator));

    }

    /**
     * An empty trie.
     *
     * @param coder
     *            Decomposes the keys into key units and orders those units
     *            (required).
     */
    public Trie(final IKeyCoder<S, U> coder) {

        if (coder == null)
            throw new IllegalArgumentException();

        this.coder = coder;

        this.root = Node.newRoot(this);

        this.size = 0;

    }

    /**
     * A deep copy of another trie. Changes to the copy are not visible in the
     * source and vice versa.
     *
     * @param src
     *            The source (required).
     */
    public Trie(final Trie<S, U, V> src) {

        if (src == null)
            throw new IllegalArgumentException();

        this.coder = src.coder;

        this.root = src.root.copy();

        this.root.owner = this;

        this.size = src.size;

    }

    /**
     * Return a deep copy of this trie.
     */
    public Trie<S, U, V> copy() {

        return new Trie<S, U, V>(this);

    }

    /**
     * The object used to decompose the keys into key units.
     */
    public IKeyCoder<S, U> getKeyCoder() {

        return coder;

    }

    /**
     * The #of entries.
     */
    public int size() {

        return size;

    }

    /**
     * <code>true</code> iff there are no entries (the sentinel is the only
     * child of the root).
     */
    public boolean isEmpty() {

        return root.getChildCount() == 1;

    }

    /**
     * Insert an entry.
     * <p>
     * If the key is a strict prefix of keys which are already stored then the
     * existing node for that prefix is promoted to an entry. Otherwise the nodes
     * for the unmatched suffix of the key are created and linked into the tree
     * in a single step once all checks have passed, so a failed insert never
     * leaves a partial chain behind.
     *
     * @param key
     *            The key (required).
     * @param value
     *            The value (may be <code>null</code>).
     *
     * @return A cursor positioned on the new entry.
     *
     * @throws IllegalArgumentException
     *             if the key is <code>null</code> or has a <code>null</code>
     *             key unit.
     * @throws EmptyKeyException
     *             if the key is empty.
     * @throws DuplicateKeyException
     *             if there is already an entry for that key.
     */
    public TrieCursor<S, U, V> insert(final S key, final V value) {

        final int len = checkKey(key);

        if (len == 0)
            throw new EmptyKeyException();

        // descend along the existing prefix of the key.
        Node<U, V> node = root;

        int i = 0;

        while (i < len) {

            final Node<U, V> child = node.getChild(coder.unitAt(key, i), coder);

            if (child == null)
                break;

            node = child;

            i++;

        }

        if (i == len) {

            if (node.leaf)
                throw new DuplicateKeyException(key);

            /*
             * The key was only a shared prefix of longer keys. Promote the
             * node to an entry.
             */

            node.leaf = true;

            node.value = value;

            size++;

            if (DEBUG)
                log.debug("promoted: key=" + key + ", size=" + size);

            return new TrieCursor<S, U, V>(coder, node);

        }

        // build the chain for the unmatched suffix while it is detached.
        final Node<U, V> head = new Node<U, V>(coder.unitAt(key, i), null);

        Node<U, V> tail = head;

        for (int j = i + 1; j < len; j++) {

            final Node<U, V> t = new Node<U, V>(coder.unitAt(key, j), tail);

            tail.children.add(t);

            tail = t;

        }

        tail.leaf = true;

        tail.value = value;

        // link the chain into the tree.
        node.insertChild(head, coder);

        size++;

        if (DEBUG)
            log.debug("inserted: key=" + key + ", newNodes=" + (len - i)
                    + ", size=" + size);

        return new TrieCursor<S, U, V>(coder, tail);

    }

    /**
     * Remove the entry on which the cursor rests.
     * <p>
     * If the entry is a strict prefix of other keys then its node remains as a
     * shared prefix and only stops being an entry. Otherwise its node is removed
     * together with every ancestor which would be left without children and is
     * not itself an entry. Removed nodes are released, so any cursor resting on
     * one of them becomes stale.
     *
     * @param cursor
     *            A cursor positioned on an entry of this trie (required).
     *
     * @throws IllegalArgumentException
     *             if the cursor is <code>null</code>, is the end cursor, does
     *             not belong to this trie or does not rest on an entry.
     * @throws StaleCursorException
     *             if the cursor position was already removed.
     */
    public void erase(final TrieCursor<S, U, V> cursor) {

        if (cursor == null)
            throw new IllegalArgumentException();

        final Node<U, V> node = cursor.node();

        if (node.released)
            throw new StaleCursorException();

        if (node.sentinel)
            throw new IllegalArgumentException("Can not erase the end cursor");

        if (node.root() != root)
            throw new IllegalArgumentException("Cursor belongs to another trie");

        if (!node.leaf)
            throw new IllegalArgumentException("Cursor does not rest on an entry");

        if (node.getChildCount() > 0) {

            // keep the node as the shared prefix of its descendants.
            node.leaf = false;

            node.value = null;

            size--;

            if (DEBUG)
                log.debug("demoted: node=" + node + ", size=" + size);

            return;

        }

        /*
         * Find the top of the chain which is only kept alive by this entry. The
         * root is never part of that chain since its sentinel child keeps it at
         * two or more children whenever it has a real child.
         */

        Node<U, V> top = node;

        while (top.parent != root && !top.parent.leaf
                && top.parent.getChildCount() == 1) {

            top = top.parent;

        }

        final int pruned = node.depth() - top.depth() + 1;

        top.parent.removeChild(top, coder);

        size--;

        if (DEBUG)
            log.debug("erased: pruned=" + pruned + ", size=" + size);

    }

    /**
     * Remove all entries. Every node other than the root and the sentinel is
     * released, so the {@link #end()} cursor remains valid while every other
     * cursor becomes stale.
     */
    public void clear() {

        final Node<U, V> sentinel = root.lastChild();

        for (Node<U, V> child : root.children) {

            if (!child.sentinel) {

                child.release();

            }

        }

        root.children.clear();

        root.children.add(sentinel);

        final int n = size;

        size = 0;

        if (INFO)
            log.info("cleared: removed=" + n);

    }

    /**
     * Find the entry for the key.
     *
     * @param key
     *            The key (required).
     *
     * @return A cursor positioned on the entry for that key -or-
     *         {@link #end()} if there is no such entry.
     *
     * @throws IllegalArgumentException
     *             if the key is <code>null</code> or has a <code>null</code>
     *             key unit.
     */
    public TrieCursor<S, U, V> find(final S key) {

        final Node<U, V> node = lookupNode(key);

        if (node == null) {

            return end();

        }

        return new TrieCursor<S, U, V>(coder, node);

    }

    /**
     * Copy the value for the key into <code>out[0]</code>.
     *
     * @param key
     *            The key (required).
     * @param out
     *            An array having at least one element (required). It is not
     *            modified unless there is an entry for the key.
     *
     * @return <code>true</code> iff there is an entry for the key.
     */
    public boolean getValue(final S key, final V[] out) {

        if (out == null || out.length == 0)
            throw new IllegalArgumentException();

        final Node<U, V> node = lookupNode(key);

        if (node == null)
            return false;

        out[0] = node.value;

        return true;

    }

    /**
     * Return the value for the key.
     *
     * @param key
     *            The key (required).
     *
     * @return The value -or- <code>null</code> if there is no entry for that
     *         key (or if <code>null</code> was stored under that key).
     */
    public V lookup(final S key) {

        final Node<U, V> node = lookupNode(key);

        return node == null ? null : node.value;

    }

    /**
     * <code>true</code> iff there is an entry for the key.
     */
    public boolean containsKey(final S key) {

        return lookupNode(key) != null;

    }

    /**
     * Return a cursor positioned on the longest stored key. When several keys
     * share the greatest length the first one in key order is chosen.
     * <p>
     * Note: This is a scan of all entries. It does not match a prefix of a
     * caller's key.
     *
     * @return The cursor -or- {@link #end()} if the trie is empty.
     */
    public TrieCursor<S, U, V> findLongestPrefix() {

        final TrieCursor<S, U, V> end = end();

        final TrieCursor<S, U, V> itr = begin();

        Node<U, V> longest = null;

        int maxLength = 0;

        while (!itr.equals(end)) {

            final int length = itr.node().depth();

            if (length > maxLength) {

                maxLength = length;

                longest = itr.node();

            }

            itr.next();

        }

        if (longest == null)
            return end;

        return new TrieCursor<S, U, V>(coder, longest);

    }

    /**
     * A cursor positioned on the first entry in key order -or- {@link #end()}
     * if the trie is empty.
     */
    public TrieCursor<S, U, V> begin() {

        if (isEmpty()) {

            return end();

        }

        Node<U, V> node = root.firstChild();

        while (!node.leaf) {

            node = node.firstChild();

        }

        return new TrieCursor<S, U, V>(coder, node);

    }

    /**
     * A cursor positioned on the sentinel which follows the last entry.
     */
    public TrieCursor<S, U, V> end() {

        return new TrieCursor<S, U, V>(coder, root.lastChild());

    }

    /**
     * Exchange the contents of this trie with another trie in constant time.
     * Cursors move with the nodes on which they rest, so a cursor obtained from
     * this trie rests on an entry of the other trie afterwards.
     *
     * @param other
     *            The other trie (required).
     */
    public void swap(final Trie<S, U, V> other) {

        if (other == null)
            throw new IllegalArgumentException();

        if (other == this)
            return;

        final IKeyCoder<S, U> c = coder;
        coder = other.coder;
        other.coder = c;

        final Node<U, V> r = root;
        root = other.root;
        other.root = r;

        final int n = size;
        size = other.size;
        other.size = n;

        root.owner = this;
        other.root.owner = other;

        if (DEBUG)
            log.debug("swapped: size=" + size + ", other.size=" + other.size);

    }

    /**
     * Exchange the contents of two tries.
     *
     * @see #swap(Trie)
     */
    public static <S, U, V> void swap(final Trie<S, U, V> a,
            final Trie<S, U, V> b) {

        a.swap(b);

    }

    /**
     * Replace the contents of this trie with a deep copy of the source. The
     * previous tree is released, so every cursor obtained from this trie
     * becomes stale.
     *
     * @param src
     *            The source (required).
     *
     * @return this trie.
     */
    public Trie<S, U, V> assign(final Trie<S, U, V> src) {

        if (src == null)
            throw new IllegalArgumentException();

        if (src == this)
            return this;

        final Trie<S, U, V> tmp = new Trie<S, U, V>(src);

        swap(tmp);

        // the old tree is now owned by tmp.
        tmp.root.release();

        return this;

    }

    /**
     * Visits the entries in ascending key order. {@link Iterator#remove()} is
     * supported and erases the last visited entry.
     */
    public Iterator<Map.Entry<S, V>> iterator() {

        return new EntryIterator<S, U, V>(this);

    }

    public String toString() {

        final StringBuilder sb = new StringBuilder();

        sb.append('{');

        boolean first = true;

        for (Map.Entry<S, V> e : this) {

            if (!first)
                sb.append(", ");

            sb.append(e.getKey());
            sb.append('=');
            sb.append(e.getValue());

            first = false;

        }

        sb.append('}');

        return sb.toString();

    }

    /**
     * Verify the structure of the tree using the effective level of the
     * {@link #dumpLog}.
     *
     * @param out
     *            The dump is written on this stream.
     *
     * @return <code>true</code> unless an inconsistency is detected.
     */
    public boolean dump(final PrintStream out) {

        return dump(dumpLog.getEffectiveLevel(), out);

    }

    /**
     * Verify the structure of the tree. Each inconsistency is reported on the
     * stream. When the level is {@link Level#DEBUG} or finer then each node is
     * also written, indented by its depth.
     *
     * @param level
     *            The logging level.
     * @param out
     *            The dump is written on this stream.
     *
     * @return <code>true</code> unless an inconsistency is detected.
     */
    public boolean dump(final Level level, final PrintStream out) {

        // True iff we will write out the node structure.
        final boolean debug = level.toInt() <= Level.DEBUG.toInt();

        // True iff we will write out the summary.
        final boolean info = level.toInt() <= Level.INFO.toInt();

        boolean ok = true;

        if (info)
            out.println("size=" + size + ", nchildren(root)="
                    + root.getChildCount());

        if (root.leaf || root.parent != null || root.owner != this) {
            out.println("ERROR: malformed root: " + root);
            ok = false;
        }

        if (root.getChildCount() == 0 || !root.lastChild().sentinel) {
            out.println("ERROR: the last child of the root is not the sentinel");
            ok = false;
        }

        int nleaves = 0;

        final Deque<Node<U, V>> stack = new ArrayDeque<Node<U, V>>();

        final Deque<Integer> depths = new ArrayDeque<Integer>();

        stack.push(root);

        depths.push(0);

        while (!stack.isEmpty()) {

            final Node<U, V> t = stack.pop();

            final int height = depths.pop();

            if (debug)
                out.println(indent(height) + t);

            if (t.released) {
                out.println(indent(height) + "ERROR: released node in tree");
                ok = false;
            }

            if (t.leaf && !t.sentinel)
                nleaves++;

            if (t != root && !t.leaf && t.getChildCount() == 0) {
                out.println(indent(height)
                        + "ERROR: node is neither a leaf nor a shared prefix");
                ok = false;
            }

            if (t.sentinel) {
                if (t.parent != root || t.getChildCount() != 0 || !t.leaf) {
                    out.println(indent(height) + "ERROR: malformed sentinel");
                    ok = false;
                }
            }

            final int n = t.getChildCount();

            for (int i = 0; i < n; i++) {

                final Node<U, V> child = t.getChild(i);

                if (child.parent != t) {
                    out.println(indent(height) + "ERROR: child[" + i
                            + "] has the wrong parent");
                    ok = false;
                }

                if (child.sentinel && (t != root || i != n - 1)) {
                    out.println(indent(height) + "ERROR: sentinel at child["
                            + i + "]");
                    ok = false;
                }

                if (i > 0 && !child.sentinel) {

                    final Node<U, V> prior = t.getChild(i - 1);

                    if (!prior.sentinel
                            && coder.compare(prior.unit, child.unit) >= 0) {
                        out.println(indent(height)
                                + "ERROR: children out of order at index=" + i);
                        ok = false;
                    }

                }

            }

            // push in reverse so that the children are visited in order.
            for (int i = n - 1; i >= 0; i--) {

                stack.push(t.getChild(i));

                depths.push(height + 1);

            }

        }

        if (nleaves != size) {
            out.println("ERROR: size=" + size + ", but #leaves=" + nleaves);
            ok = false;
        }

        return ok;

    }

    private static String indent(final int height) {

        final StringBuilder sb = new StringBuilder(height * 4);

        for (int i = 0; i < height; i++) {

            sb.append("    ");

        }

        return sb.toString();

    }

    /**
     * Called by {@link TrieCursor#advance(Object)} when relabeling merges its
     * entry into an existing entry.
     */
    void entryDropped() {

        size--;

    }

    /**
     * Validate the key.
     *
     * @return The #of key units.
     */
    private int checkKey(final S key) {

        if (key == null)
            throw new IllegalArgumentException("key is null");

        final int len = coder.length(key);

        for (int i = 0; i < len; i++) {

            if (coder.unitAt(key, i) == null)
                throw new IllegalArgumentException("null key unit at index="
                        + i);

        }

        return len;

    }

    /**
     * Return the node for the entry having that key.
     *
     * @return The node -or- <code>null</code> if there is no such entry.
     */
    private Node<U, V> lookupNode(final S key) {

        final int len = checkKey(key);

        if (len == 0)
            return null;

        Node<U, V> node = root;

        for (int i = 0; i < len; i++) {

            node = node.getChild(coder.unitAt(key, i), coder);

            if (node == null)
                return null;

        }

        return node.leaf ? node : null;

    }

}
