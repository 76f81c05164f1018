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
 * Created on Oct 17, 2026
 */

package com.systap.trie;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import junit.framework.TestCase;

/**
 * Test suite for the {@link IKeyCoder} implementations.
 *
 * @version $Id$
 */
public class TestKeyCoders extends TestCase {

    public TestKeyCoders() {
    }

    public TestKeyCoders(String name) {
        super(name);
    }

    public void test_stringKeyCoder() {

        final StringKeyCoder coder = StringKeyCoder.INSTANCE;

        assertEquals(3, coder.length("abc"));
        assertEquals(Character.valueOf('b'), coder.unitAt("abc", 1));
        assertEquals("abc", coder.decode(Arrays.asList('a', 'b', 'c')));
        assertEquals("", coder.decode(Collections.<Character> emptyList()));

        assertTrue(coder.compare('a', 'b') < 0);
        assertTrue(coder.compare('b', 'a') > 0);
        assertEquals(0, coder.compare('q', 'q'));

        // unsigned char order.
        assertTrue(coder.compare('z', Character.MAX_VALUE) < 0);

    }

    public void test_listKeyCoder_naturalOrder() {

        final ListKeyCoder<Integer> coder = new ListKeyCoder<Integer>();

        final List<Integer> key = Arrays.asList(4, 5);

        assertEquals(2, coder.length(key));
        assertEquals(Integer.valueOf(5), coder.unitAt(key, 1));
        assertTrue(coder.compare(1, 2) < 0);
        assertEquals(0, coder.compare(7, 7));

    }

    public void test_listKeyCoder_comparator() {

        final ListKeyCoder<String> coder = new ListKeyCoder<String>(
                String.CASE_INSENSITIVE_ORDER);

        assertEquals(0, coder.compare("a", "A"));
        assertTrue(coder.compare("a", "B") < 0);

    }

    /**
     * The decoded key is a copy which can not be modified.
     */
    public void test_listKeyCoder_decode() {

        final ListKeyCoder<Integer> coder = new ListKeyCoder<Integer>();

        final List<Integer> units = new java.util.ArrayList<Integer>(
                Arrays.asList(1, 2));

        final List<Integer> key = coder.decode(units);

        units.add(3);

        assertEquals(Arrays.asList(1, 2), key);

        try {
            key.add(4);
            fail("Expecting: " + UnsupportedOperationException.class);
        } catch (UnsupportedOperationException ex) {
            // expected
        }

    }

    public void test_trie_requiresCoder() {

        try {
            new Trie<String, Character, Integer>((IKeyCoder<String, Character>) null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // expected
        }

        assertSame(StringKeyCoder.INSTANCE, Trie.newStringTrie().getKeyCoder());

    }

}
