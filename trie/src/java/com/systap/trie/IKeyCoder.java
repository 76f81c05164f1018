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

import java.util.List;

/**
 * Bridges an application key type and the sequence of key units which a
 * {@link Trie} stores one per node. The key units MUST be totally ordered by
 * {@link #compare(Object, Object)}. That ordering determines the order in which
 * the children of a node are kept and therefore the order in which a
 * {@link TrieCursor} visits the stored keys.
 * <p>
 * Implementations are stateless (or at least immutable) and may be shared by
 * any number of {@link Trie}s.
 * 
 * @version $Id$
 * @param <S>
 *            The generic type of the application key (the key sequence).
 * @param <U>
 *            The generic type of a key unit.
 */
public interface IKeyCoder<S, U> {

    /**
     * The #of key units in the key.
     * 
     * @param key
     *            The key (required).
     */
    int length(S key);

    /**
     * The key unit at the given index in the key.
     * 
     * @param key
     *            The key (required).
     * @param index
     *            The index of the key unit in [0:length-1].
     * 
     * @return The key unit. <code>null</code> is never a legal key unit.
     */
    U unitAt(S key, int index);

    /**
     * Assemble an application key from its key units (in root to leaf order).
     * 
     * @param units
     *            The key units.
     * 
     * @return The key.
     */
    S decode(List<U> units);

    /**
     * Total order over the key units.
     * 
     * @return a negative integer, zero, or a positive integer as <i>a</i> is
     *         less than, equal to, or greater than <i>b</i>.
     */
    int compare(U a, U b);

}
