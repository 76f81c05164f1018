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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import junit.framework.TestCase;

import org.apache.log4j.Logger;

/**
 * Stress test applying a random sequence of operations to a {@link Trie} and to
 * a {@link TreeMap} and verifying that they agree. The alphabet is small so
 * that keys share prefixes often.
 *
 * @version $Id$
 */
public class TestTrieStress extends TestCase {

    private static final Logger log = Logger.getLogger(TestTrieStress.class);

    public TestTrieStress() {
    }

    public TestTrieStress(String name) {
        super(name);
    }

    private static final String ALPHABET = "abcd";

    private static String randomKey(final Random r) {

        final int len = 1 + r.nextInt(6);

        final StringBuilder sb = new StringBuilder(len);

        for (int i = 0; i < len; i++) {

            sb.append(ALPHABET.charAt(r.nextInt(ALPHABET.length())));

        }

        return sb.toString();

    }

    private static void assertSameEntries(final TreeMap<String, Integer> expected,
            final Trie<String, Character, Integer> actual) {

        assertEquals(expected.size(), actual.size());

        final Iterator<Map.Entry<String, Integer>> eitr = expected.entrySet()
                .iterator();

        final TrieCursor<String, Character, Integer> c = actual.begin();

        while (eitr.hasNext()) {

            final Map.Entry<String, Integer> e = eitr.next();

            assertFalse(c.isEnd());
            assertEquals(e.getKey(), c.key());
            assertEquals(e.getValue(), c.value());

            c.next();

        }

        assertTrue(c.isEnd());

        // and backwards.
        final List<String> reverse = new ArrayList<String>();

        while (c.hasPrior()) {

            reverse.add(0, c.prior().key());

        }

        assertEquals(new ArrayList<String>(expected.keySet()), reverse);

    }

    public void test_randomOperations() {

        final long seed = 20261017L;

        final Random r = new Random(seed);

        final Trie<String, Character, Integer> trie = Trie.newStringTrie();

        final TreeMap<String, Integer> expected = new TreeMap<String, Integer>();

        final int nops = 5000;

        for (int i = 0; i < nops; i++) {

            final String key = randomKey(r);

            switch (r.nextInt(4)) {

            case 0:
            case 1: {

                if (expected.containsKey(key)) {

                    try {
                        trie.insert(key, i);
                        fail("Expecting: " + DuplicateKeyException.class);
                    } catch (DuplicateKeyException ex) {
                        // expected
                    }

                } else {

                    assertEquals(key, trie.insert(key, i).key());

                    expected.put(key, i);

                }

                break;

            }

            case 2: {

                final TrieCursor<String, Character, Integer> c = trie.find(key);

                if (expected.containsKey(key)) {

                    trie.erase(c);

                    expected.remove(key);

                } else {

                    assertTrue(c.isEnd());

                }

                break;

            }

            case 3: {

                assertEquals(expected.get(key), trie.lookup(key));

                assertEquals(expected.containsKey(key), trie.containsKey(key));

                break;

            }

            default:
                throw new AssertionError();

            }

            if (i % 500 == 0) {

                assertSameEntries(expected, trie);

                assertTrue(trie.dump(System.err));

            }

        }

        assertSameEntries(expected, trie);

        assertTrue(trie.dump(System.err));

        if (log.isInfoEnabled())
            log.info("seed=" + seed + ", size=" + trie.size());

        // a copy agrees and survives erasing everything from the source.
        final Trie<String, Character, Integer> copy = trie.copy();

        final Iterator<Map.Entry<String, Integer>> itr = trie.iterator();

        while (itr.hasNext()) {

            itr.next();

            itr.remove();

        }

        assertTrue(trie.isEmpty());
        assertTrue(trie.dump(System.err));

        assertSameEntries(expected, copy);

    }

}
