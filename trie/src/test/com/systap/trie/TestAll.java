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

import junit.framework.Test;
import junit.framework.TestCase;
import junit.framework.TestSuite;

/**
 * Aggregates the unit tests for the {@link Trie}.
 *
 * @version $Id$
 */
public class TestAll extends TestCase {

    public TestAll() {
    }

    public TestAll(String arg0) {
        super(arg0);
    }

    /**
     * Returns a test that will run each of the implementation specific test
     * suites in turn.
     */
    public static Test suite()
    {

        final TestSuite suite = new TestSuite("Trie");

        // key decomposition and unit order.
        suite.addTestSuite(TestKeyCoders.class);
        // ordering and search of the children of a node.
        suite.addTestSuite(TestNode.class);
        // insert, find, getValue.
        suite.addTestSuite(TestInsertLookup.class);
        // erase and pruning of dead prefixes.
        suite.addTestSuite(TestErase.class);
        // cursor navigation.
        suite.addTestSuite(TestCursor.class);
        // relabeling an entry with advance().
        suite.addTestSuite(TestAdvance.class);
        // copy, assign, swap, clear.
        suite.addTestSuite(TestCopySwapClear.class);
        // cursors on removed nodes.
        suite.addTestSuite(TestStaleCursor.class);
        // Iterable view.
        suite.addTestSuite(TestEntryIterator.class);
        // structural checks.
        suite.addTestSuite(TestDump.class);
        // end to end usage.
        suite.addTestSuite(TestScenarios.class);
        // random operations against a TreeMap.
        suite.addTestSuite(TestTrieStress.class);

        return suite;

    }

}
