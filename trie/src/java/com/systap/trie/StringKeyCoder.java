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
 * Keys are {@link String}s and each <code>char</code> is one key unit. Key
 * units are ordered by their <code>char</code> value, so the visitation order
 * of a {@link Trie} using this coder is the same as {@link String#compareTo}.
 * 
 * @version $Id$
 */
public class StringKeyCoder implements IKeyCoder<String, Character> {

    /**
     * Shared instance.
     */
    public static final StringKeyCoder INSTANCE = new StringKeyCoder();

    public int length(final String key) {

        return key.length();

    }

    public Character unitAt(final String key, final int index) {

        return Character.valueOf(key.charAt(index));

    }

    public String decode(final List<Character> units) {

        final StringBuilder sb = new StringBuilder(units.size());

        for (Character c : units) {

            sb.append(c.charValue());

        }

        return sb.toString();

    }

    public int compare(final Character a, final Character b) {

        return Character.compare(a.charValue(), b.charValue());

    }

}
