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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A mined block of a {@link TransactionLedger}. A block links to its predecessor through the predecessor's hash,
 * summarizes its transactions with a merkle root and is identified by a hash over its header. Blocks do not
 * change once mined.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LedgerBlock {
    private final long blockId;
    private final long timestamp;
    private final List<SchedulingTransaction> transactions;
    private final String previousHash;
    private final String merkleRoot;
    private final String blockHash;

    @JsonCreator
    public LedgerBlock(@JsonProperty("blockId") long blockId,
                       @JsonProperty("timestamp") long timestamp,
                       @JsonProperty("transactions") List<SchedulingTransaction> transactions,
                       @JsonProperty("previousHash") String previousHash,
                       @JsonProperty("merkleRoot") String merkleRoot,
                       @JsonProperty("blockHash") String blockHash) {
        this.blockId = blockId;
        this.timestamp = timestamp;
        this.transactions = transactions == null ?
                Collections.<SchedulingTransaction>emptyList() :
                Collections.unmodifiableList(new ArrayList<>(transactions));
        this.previousHash = previousHash;
        this.merkleRoot = merkleRoot;
        this.blockHash = blockHash;
    }

    /**
     * Close the given transactions into a new block, computing its merkle root and hash, and stamp the block hash
     * on each transaction.
     */
    static LedgerBlock mine(long blockId, long timestamp, String previousHash, List<SchedulingTransaction> transactions) {
        String merkleRoot = MerkleTree.root(transactions);
        String blockHash = LedgerHashing.hashBlockHeader(blockId, timestamp, previousHash, merkleRoot, transactions.size());
        LedgerBlock block = new LedgerBlock(blockId, timestamp, transactions, previousHash, merkleRoot, blockHash);
        for (SchedulingTransaction tx : block.transactions)
            tx.stampBlockHash(blockHash);
        return block;
    }

    public long getBlockId() {
        return blockId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public List<SchedulingTransaction> getTransactions() {
        return transactions;
    }

    public String getPreviousHash() {
        return previousHash;
    }

    public String getMerkleRoot() {
        return merkleRoot;
    }

    public String getBlockHash() {
        return blockHash;
    }

    /**
     * Recompute the merkle root from this block's transactions as they are now.
     *
     * @return the recomputed merkle root
     */
    public String computeMerkleRoot() {
        return MerkleTree.root(transactions);
    }

    /**
     * Recompute this block's hash from its stored header fields.
     *
     * @return the recomputed block hash
     */
    public String computeBlockHash() {
        return LedgerHashing.hashBlockHeader(blockId, timestamp, previousHash, merkleRoot, transactions.size());
    }

    @Override
    public String toString() {
        return "LedgerBlock{" +
                "blockId=" + blockId +
                ", timestamp=" + timestamp +
                ", transactions=" + transactions.size() +
                ", previousHash='" + previousHash + '\'' +
                ", merkleRoot='" + merkleRoot + '\'' +
                ", blockHash='" + blockHash + '\'' +
                '}';
    }
}
