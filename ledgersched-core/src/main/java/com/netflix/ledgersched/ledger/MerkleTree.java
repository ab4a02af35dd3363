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

import java.util.ArrayList;
import java.util.List;

/**
 * Merkle root computation over a block's transactions. Leaves are the transaction hashes; each level hashes
 * adjacent pairs of the level below until a single hash remains. A level with an odd number of hashes pairs its
 * last hash with itself.
 */
public final class MerkleTree {

    private MerkleTree() {
    }

    /**
     * Compute the merkle root of the given transactions, in order.
     *
     * @param transactions the transactions of a block
     * @return the root hash; for no transactions, the hash of the literal {@code empty_block}
     */
    public static String root(List<SchedulingTransaction> transactions) {
        List<String> leaves = new ArrayList<>(transactions.size());
        for (SchedulingTransaction tx : transactions)
            leaves.add(LedgerHashing.hashTransaction(tx));
        return rootOfHashes(leaves);
    }

    /**
     * Compute the merkle root over leaf hashes.
     *
     * @param leafHashes hex encoded leaf hashes, in order
     * @return the root hash; for no leaves, the hash of the literal {@code empty_block}
     */
    public static String rootOfHashes(List<String> leafHashes) {
        if (leafHashes.isEmpty())
            return LedgerHashing.sha256Hex(LedgerHashing.EMPTY_BLOCK_SEED);
        List<String> level = new ArrayList<>(leafHashes);
        while (level.size() > 1) {
            if (level.size() % 2 != 0)
                level.add(level.get(level.size() - 1));
            List<String> parents = new ArrayList<>(level.size() / 2);
            for (int i = 0; i < level.size(); i += 2)
                parents.add(LedgerHashing.sha256Hex(level.get(i) + level.get(i + 1)));
            level = parents;
        }
        return level.get(0);
    }
}
