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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Keys are {@link List}s whose elements are the key units. The key units are
 * ordered by the {@link Comparator} given to the constructor or by their
 * natural order when no {@link Comparator} is given.
 * 
 * @version $Id$
 * @param <U>
 *            The generic type of the key unit.
 */
public class ListKeyCoder<U> implements IKeyCoder<List<U>, U> {

    /**
     * The optional comparator (natural order iff <code>null</code>).
     */
    private final Comparator<? super U> comparator;

    /**
     * A coder whose key units are ordered by their natural order. The key units
     * MUST implement {@link Comparable}.
     */
    public ListKeyCoder() {

        this(null);

    }

    /**
     * @param comparator
     *            The order imposed on the key units -or- <code>null</code> to
     *            use their natural order.
     */
    public ListKeyCoder(final Comparator<? super U> comparator) {

        this.comparator = comparator;

    }

    public int length(final List<U> key) {

        return key.size();

    }

    public U unitAt(final List<U> key, final int index) {

        return key.get(index);

    }

    /**
     * Returns an unmodifiable copy of the key units.
     */
    public List<U> decode(final List<U> units) {

        return Collections.unmodifiableList(new ArrayList<U>(units));

    }

    @SuppressWarnings("unchecked")
    public int compare(final U a, final U b) {

        if (comparator != null) {

            return comparator.compare(a, b);

        }

        return ((Comparable<? super U>) a).compareTo(b);

    }

}
