/*
 * Copyright 2015 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.ledgersched.ledger;

import com.netflix.ledgersched.ResourceVector;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class MerkleTreeTest {

    private static SchedulingTransaction tx(String id, double score) {
        return new SchedulingTransaction(id, 1000L, 0, "task-" + id, ResourceVector.of(1, 1, 1, 1),
                ResourceVector.ZERO, ResourceVector.of(1, 1, 1, 1), score, TransactionStatus.ASSIGNED, null);
    }

    @Test
    public void testKnownDigest() throws Exception {
        Assert.assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                LedgerHashing.sha256Hex(""));
    }

    @Test
    public void testEmptyRoot() throws Exception {
        Assert.assertEquals(LedgerHashing.sha256Hex("empty_block"),
                MerkleTree.root(Collections.<SchedulingTransaction>emptyList()));
    }

    @Test
    public void testSingleLeafIsItsOwnRoot() throws Exception {
        Assert.assertEquals("a", MerkleTree.rootOfHashes(Collections.singletonList("a")));
    }

    @Test
    public void testPairsAndOddLevels() throws Exception {
        String ab = LedgerHashing.sha256Hex("ab");
        Assert.assertEquals(ab, MerkleTree.rootOfHashes(Arrays.asList("a", "b")));
        // the last hash of an odd level is paired with itself
        String cc = LedgerHashing.sha256Hex("cc");
        Assert.assertEquals(LedgerHashing.sha256Hex(ab + cc), MerkleTree.rootOfHashes(Arrays.asList("a", "b", "c")));
    }

    @Test
    public void testRootDependsOnContentAndOrder() throws Exception {
        SchedulingTransaction first = tx("1", 0.5);
        SchedulingTransaction second = tx("2", 0.7);
        String root = MerkleTree.root(Arrays.asList(first, second));
        Assert.assertEquals(root, MerkleTree.root(Arrays.asList(tx("1", 0.5), tx("2", 0.7))));
        Assert.assertNotEquals(root, MerkleTree.root(Arrays.asList(second, first)));
        Assert.assertNotEquals(root, MerkleTree.root(Arrays.asList(first, tx("2", 0.8))));
    }

    // the block hash stamped on a transaction is not part of its hash
    @Test
    public void testBlockHashNotHashed() throws Exception {
        SchedulingTransaction stamped = tx("1", 0.5);
        String before = LedgerHashing.hashTransaction(stamped);
        stamped.stampBlockHash("abc");
        Assert.assertEquals(before, LedgerHashing.hashTransaction(stamped));
    }

    @Test(expected = IllegalStateException.class)
    public void testStampedOnce() throws Exception {
        SchedulingTransaction stamped = tx("1", 0.5);
        stamped.stampBlockHash("abc");
        stamped.stampBlockHash("def");
    }
}
