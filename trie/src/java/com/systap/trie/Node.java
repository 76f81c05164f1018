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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * A vertex of a {@link Trie}. Each node other than the root holds one key unit.
 * The children of a node are kept in a list which is strictly ascending by key
 * unit, so a pre-order traversal visits the stored keys in lexicographic order.
 * <p>
 * There are three kinds of nodes:
 * <ul>
 * <li>The root. It never has a key unit or a value, is never a leaf and has no
 * parent. It records the {@link Trie} which owns the tree.</li>
 * <li>The sentinel. It is always the last child of the root, is always a leaf
 * and marks the end of the trie. It has no key unit. It is never a candidate for
 * {@link #findChild(Object, IKeyCoder)} so it orders after any key unit.</li>
 * <li>Ordinary nodes. A node is a leaf iff a stored key terminates at that node,
 * in which case it holds the value for that key. A node which is not a leaf
 * exists only as the shared prefix of one or more longer keys.</li>
 * </ul>
 *
 * @version $Id$
 * @param <U>
 *            The generic type of the key unit.
 * @param <V>
 *            The generic type of the value.
 */
class Node<U, V> {

    /**
     * The key unit (<code>null</code> for the root and the sentinel).
     */
    final U unit;

    /**
     * The value (meaningful iff {@link #leaf}).
     */
    V value;

    /**
     * <code>true</code> iff a stored key terminates at this node.
     */
    boolean leaf;

    /**
     * <code>true</code> iff this is the end-of-trie marker.
     */
    final boolean sentinel;

    /**
     * Set once the node has been detached from its tree.
     */
    boolean released;

    /**
     * The parent (<code>null</code> for the root and for released nodes).
     */
    Node<U, V> parent;

    /**
     * The trie which owns this tree (root only).
     */
    Trie<?, U, V> owner;

    /**
     * The children in ascending key unit order (the sentinel, if present, is
     * last).
     */
    final ArrayList<Node<U, V>> children;

    /**
     * @param unit
     *            The key unit.
     * @param parent
     *            The parent (may be <code>null</code> for a node which will be
     *            linked into the tree later).
     */
    Node(final U unit, final Node<U, V> parent) {

        this(unit, parent, false/* sentinel */);

    }

    private Node(final U unit, final Node<U, V> parent, final boolean sentinel) {

        this.unit = unit;

        this.parent = parent;

        this.sentinel = sentinel;

        this.children = new ArrayList<Node<U, V>>(2);

    }

    /**
     * Return a new root. The root has a sentinel child.
     */
    static <U, V> Node<U, V> newRoot(final Trie<?, U, V> owner) {

        final Node<U, V> root = new Node<U, V>(null, null);

        root.owner = owner;

        root.children.add(newSentinel(root));

        return root;

    }

    /**
     * Return a new sentinel for the given root (not linked into the root).
     */
    static <U, V> Node<U, V> newSentinel(final Node<U, V> root) {

        final Node<U, V> sentinel = new Node<U, V>(null, root, true/* sentinel */);

        sentinel.leaf = true;

        return sentinel;

    }

    final boolean isRoot() {

        return parent == null && !released;

    }

    final int getChildCount() {

        return children.size();

    }

    final Node<U, V> getChild(final int index) {

        return children.get(index);

    }

    final Node<U, V> firstChild() {

        return children.get(0);

    }

    final Node<U, V> lastChild() {

        return children.get(children.size() - 1);

    }

    /**
     * The #of children which may be matched by a key unit (all children except
     * the sentinel).
     */
    final int getSearchableChildCount() {

        final int n = children.size();

        if (n > 0 && children.get(n - 1).sentinel) {

            return n - 1;

        }

        return n;

    }

    /**
     * Binary search of the children for the key unit.
     *
     * @param searchUnit
     *            The key unit.
     * @param coder
     *            Imposes the order on the key units.
     *
     * @return The index of the child with that key unit if one exists and
     *         otherwise <code>(-(insertion point) - 1)</code>, following the
     *         conventions of {@link java.util.Arrays#binarySearch(Object[], Object)}.
     *         The insertion point is never beyond the sentinel.
     */
    final int findChild(final U searchUnit, final IKeyCoder<?, U> coder) {

        int low = 0;

        int high = getSearchableChildCount() - 1;

        while (low <= high) {

            final int mid = (low + high) >>> 1;

            final int ret = coder.compare(children.get(mid).unit, searchUnit);

            if (ret < 0) {

                low = mid + 1;

            } else if (ret > 0) {

                high = mid - 1;

            } else {

                // Found: return offset.
                return mid;

            }

        }

        // Not found: return insertion point.
        return -(low + 1);

    }

    /**
     * Return the child having that key unit.
     *
     * @return The child -or- <code>null</code> if there is no such child.
     */
    final Node<U, V> getChild(final U searchUnit, final IKeyCoder<?, U> coder) {

        final int index = findChild(searchUnit, coder);

        return index < 0 ? null : children.get(index);

    }

    /**
     * The index of the given child within this node.
     *
     * @throws IllegalStateException
     *             if the node is not a child of this node.
     */
    final int indexOf(final Node<U, V> child, final IKeyCoder<?, U> coder) {

        if (child.parent != this)
            throw new IllegalStateException("Not a child of this node");

        if (child.sentinel) {

            return children.size() - 1;

        }

        final int index = findChild(child.unit, coder);

        assert index >= 0 && children.get(index) == child;

        return index;

    }

    /**
     * Insert a child at the position which keeps the children sorted. The
     * caller MUST have verified that there is no child with the same key unit.
     *
     * @param child
     *            The child (detached).
     * @param coder
     *            Imposes the order on the key units.
     *
     * @throws IllegalStateException
     *             if there is already a child with that key unit.
     */
    final void insertChild(final Node<U, V> child, final IKeyCoder<?, U> coder) {

        final int index = findChild(child.unit, coder);

        if (index >= 0)
            throw new IllegalStateException("Duplicate key unit: " + child.unit);

        children.add(-index - 1, child);

        child.parent = this;

    }

    /**
     * Detach the given child and release its subtree.
     */
    final void removeChild(final Node<U, V> child, final IKeyCoder<?, U> coder) {

        children.remove(indexOf(child, coder));

        child.release();

    }

    /**
     * Mark this node and every node in its subtree as released. This unlinks
     * the subtree and drops the values so that nothing remains reachable from a
     * stale cursor. The traversal uses a worklist, so very deep chains do not
     * exhaust the stack.
     */
    final void release() {

        final Deque<Node<U, V>> stack = new ArrayDeque<Node<U, V>>();

        stack.push(this);

        while (!stack.isEmpty()) {

            final Node<U, V> t = stack.pop();

            for (Node<U, V> child : t.children) {

                stack.push(child);

            }

            t.children.clear();

            t.released = true;

            t.parent = null;

            t.owner = null;

            t.value = null;

            t.leaf = false;

        }

    }

    /**
     * The #of key units on the path from the root to this node (zero for the
     * root).
     */
    final int depth() {

        int depth = 0;

        Node<U, V> t = this;

        while (t.parent != null) {

            depth++;

            t = t.parent;

        }

        return depth;

    }

    /**
     * The root of the tree containing this node.
     */
    final Node<U, V> root() {

        Node<U, V> t = this;

        while (t.parent != null) {

            t = t.parent;

        }

        return t;

    }

    /**
     * Deep copy of the subtree rooted at this node. The parent references are
     * rebuilt for the copy and the copy has no parent.
     */
    final Node<U, V> copy() {

        final Node<U, V> copy = shallowCopy(null);

        final Deque<Node<U, V>> src = new ArrayDeque<Node<U, V>>();

        final Deque<Node<U, V>> dst = new ArrayDeque<Node<U, V>>();

        src.push(this);

        dst.push(copy);

        while (!src.isEmpty()) {

            final Node<U, V> s = src.pop();

            final Node<U, V> d = dst.pop();

            for (Node<U, V> child : s.children) {

                final Node<U, V> c = child.shallowCopy(d);

                // children are visited in order so the copy stays sorted.
                d.children.add(c);

                src.push(child);

                dst.push(c);

            }

        }

        return copy;

    }

    private Node<U, V> shallowCopy(final Node<U, V> newParent) {

        final Node<U, V> t = new Node<U, V>(unit, newParent, sentinel);

        t.leaf = leaf;

        t.value = value;

        return t;

    }

    public String toString() {

        if (sentinel)
            return "Node{sentinel}";

        if (isRoot())
            return "Node{root, nchildren=" + children.size() + "}";

        return "Node{unit=" + unit + ", leaf=" + leaf
                + (leaf ? ", value=" + value : "") + ", nchildren="
                + children.size() + (released ? ", released" : "") + "}";

    }

}
