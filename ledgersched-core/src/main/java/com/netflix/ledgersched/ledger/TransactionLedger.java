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
import com.netflix.ledgersched.TaskRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * An append-only, block structured log of scheduling transactions. Transactions are appended to a pending list,
 * which is mined into a new block when it reaches the block size, or on demand with {@link #mine()}. Each block
 * carries the hash of its predecessor, starting from a genesis block created with the ledger, so that any change
 * to a mined block or transaction is detected by {@link #verifyIntegrity()}.
 * <p>
 * All methods are safe to call concurrently. Mining happens inline, in the thread that appends the transaction
 * that fills a block.
 */
public class TransactionLedger {

    private static final Logger logger = LoggerFactory.getLogger(TransactionLedger.class);
    public static final int DEFAULT_BLOCK_SIZE = 10;
    static final int REPORT_RECENT_TRANSACTIONS = 20;
    static final int REPORT_VM_SCAN_TRANSACTIONS = 100;

    private final int blockSize;
    private final Supplier<Long> timeSupplier;
    private final List<LedgerBlock> blocks = new ArrayList<>();
    private final List<SchedulingTransaction> pendingTransactions = new ArrayList<>();
    private long transactionCounter = 0;

    public TransactionLedger() {
        this(DEFAULT_BLOCK_SIZE, System::currentTimeMillis);
    }

    /**
     * Create a ledger with its genesis block.
     *
     * @param blockSize number of pending transactions that triggers mining a block
     * @param timeSupplier source of timestamps, in milliseconds since the epoch
     * @throws IllegalArgumentException if the block size is less than 1 or the time supplier is null
     */
    public TransactionLedger(int blockSize, Supplier<Long> timeSupplier) {
        this(blockSize, timeSupplier, true);
    }

    private TransactionLedger(int blockSize, Supplier<Long> timeSupplier, boolean withGenesis) {
        if (blockSize < 1)
            throw new IllegalArgumentException("Block size must be at least 1, got " + blockSize);
        if (timeSupplier == null)
            throw new IllegalArgumentException("Time supplier can't be null");
        this.blockSize = blockSize;
        this.timeSupplier = timeSupplier;
        if (withGenesis)
            blocks.add(LedgerBlock.mine(0L, timeSupplier.get(), LedgerHashing.GENESIS_PREVIOUS_HASH,
                    Collections.<SchedulingTransaction>emptyList()));
    }

    /**
     * Rebuild a ledger from an export and verify it.
     *
     * @param export the exported ledger
     * @param blockSize block size for transactions appended from now on
     * @return the rebuilt ledger
     * @throws MalformedRecordException if a block or transaction in the export is null or lacks a required field
     * @throws LedgerIntegrityException if the exported chain doesn't verify
     */
    public static TransactionLedger restore(LedgerExport export, int blockSize) {
        return restore(export, blockSize, System::currentTimeMillis);
    }

    public static TransactionLedger restore(LedgerExport export, int blockSize, Supplier<Long> timeSupplier) {
        TransactionLedger ledger = rebuild(export, blockSize, timeSupplier);
        ledger.verifyIntegrityOrThrow();
        logger.info("Restored ledger with " + ledger.blocks.size() + " blocks and " +
                ledger.pendingTransactions.size() + " pending transactions");
        return ledger;
    }

    /**
     * Rebuild a ledger from an export without verifying the chain. Pending transactions are copied.
     */
    static TransactionLedger rebuild(LedgerExport export, int blockSize, Supplier<Long> timeSupplier) {
        if (export == null)
            throw new IllegalArgumentException("Ledger export can't be null");
        TransactionLedger ledger = new TransactionLedger(blockSize, timeSupplier, false);
        for (LedgerBlock block : export.getBlocks()) {
            checkWellFormed(block);
            ledger.blocks.add(block);
        }
        for (SchedulingTransaction tx : export.getPendingTransactions()) {
            checkWellFormed(tx, "pending transactions");
            ledger.pendingTransactions.add(new SchedulingTransaction(tx));
        }
        long count = ledger.pendingTransactions.size();
        for (LedgerBlock block : ledger.blocks)
            count += block.getTransactions().size();
        ledger.transactionCounter = count;
        return ledger;
    }

    private static void checkWellFormed(LedgerBlock block) {
        if (block == null)
            throw new MalformedRecordException("Ledger export has a null block");
        if (block.getPreviousHash() == null || block.getMerkleRoot() == null || block.getBlockHash() == null)
            throw new MalformedRecordException("Block " + block.getBlockId() + " is missing a hash");
        for (SchedulingTransaction tx : block.getTransactions())
            checkWellFormed(tx, "block " + block.getBlockId());
    }

    private static void checkWellFormed(SchedulingTransaction tx, String where) {
        if (tx == null)
            throw new MalformedRecordException("Null transaction in " + where);
        if (tx.getTransactionId() == null || tx.getTaskId() == null || tx.getTaskRequirements() == null ||
                tx.getVmStateBefore() == null || tx.getVmStateAfter() == null || tx.getStatus() == null)
            throw new MalformedRecordException("Transaction " + tx.getTransactionId() + " in " + where +
                    " is missing required fields");
    }

    public int getBlockSize() {
        return blockSize;
    }

    /**
     * Append a transaction, mining a block if this fills the pending list.
     *
     * @param vmId the VM the transaction is about
     * @param task the task being scheduled
     * @param vmStateBefore the VM's usage before the decision
     * @param vmStateAfter the VM's usage after the decision
     * @param score the policy's score
     * @param status the outcome
     * @return the new transaction's id
     */
    public synchronized String append(int vmId, TaskRequest task, ResourceVector vmStateBefore,
                                      ResourceVector vmStateAfter, double score, TransactionStatus status) {
        if (task == null || vmStateBefore == null || vmStateAfter == null || status == null)
            throw new IllegalArgumentException("Task, VM states and status are required");
        final long now = timeSupplier.get();
        transactionCounter++;
        final String transactionId = "tx_" + transactionCounter + "_" + now;
        pendingTransactions.add(new SchedulingTransaction(transactionId, now, vmId, task.getId(), task.getDemand(),
                vmStateBefore, vmStateAfter, score, status, ""));
        if (pendingTransactions.size() >= blockSize)
            mine();
        return transactionId;
    }

    /**
     * Mine all pending transactions into a new block.
     *
     * @return the new block, or {@code null} if there were no pending transactions
     */
    public synchronized LedgerBlock mine() {
        if (pendingTransactions.isEmpty())
            return null;
        final LedgerBlock tip = blocks.get(blocks.size() - 1);
        final LedgerBlock block = LedgerBlock.mine(blocks.size(), timeSupplier.get(), tip.getBlockHash(),
                new ArrayList<>(pendingTransactions));
        blocks.add(block);
        pendingTransactions.clear();
        logger.info("Mined block " + block.getBlockId() + " with " + block.getTransactions().size() +
                " transactions, hash " + block.getBlockHash());
        return block;
    }

    /**
     * Verify the chain: the genesis block's previous hash, sequential block ids, each block's link to its
     * predecessor, each block's hash and merkle root, and the block hash stamped on every mined transaction.
     *
     * @return true if the chain verifies
     */
    public synchronized boolean verifyIntegrity() {
        final LedgerIntegrityException violation = findViolation();
        if (violation == null)
            return true;
        logger.error("Ledger integrity check failed: " + violation.getMessage());
        return false;
    }

    /**
     * Verify the chain as {@link #verifyIntegrity()} does.
     *
     * @throws LedgerIntegrityException describing the first violation found
     */
    public void verifyIntegrityOrThrow() {
        final LedgerIntegrityException violation;
        synchronized (this) {
            violation = findViolation();
        }
        if (violation != null)
            throw violation;
    }

    private LedgerIntegrityException findViolation() {
        if (blocks.isEmpty())
            return new LedgerIntegrityException(-1L, "chain has no genesis block");
        if (!LedgerHashing.GENESIS_PREVIOUS_HASH.equals(blocks.get(0).getPreviousHash()))
            return new LedgerIntegrityException(blocks.get(0).getBlockId(), "genesis block has wrong previous hash");
        for (int i = 0; i < blocks.size(); i++) {
            final LedgerBlock block = blocks.get(i);
            if (block.getBlockId() != i)
                return new LedgerIntegrityException(block.getBlockId(), "expected block id " + i);
            if (i > 0 && !blocks.get(i - 1).getBlockHash().equals(block.getPreviousHash()))
                return new LedgerIntegrityException(i, "previous hash doesn't match block " + (i - 1));
            if (!block.computeBlockHash().equals(block.getBlockHash()))
                return new LedgerIntegrityException(i, "block hash doesn't match its header");
            if (!block.computeMerkleRoot().equals(block.getMerkleRoot()))
                return new LedgerIntegrityException(i, "merkle root doesn't match its transactions");
            for (SchedulingTransaction tx : block.getTransactions()) {
                if (!block.getBlockHash().equals(tx.getBlockHash()))
                    return new LedgerIntegrityException(i, "transaction " + tx.getTransactionId() +
                            " carries block hash " + tx.getBlockHash());
            }
        }
        for (SchedulingTransaction tx : pendingTransactions) {
            if (!tx.getBlockHash().isEmpty())
                return new LedgerIntegrityException(blocks.size(), "pending transaction " + tx.getTransactionId() +
                        " is already stamped with a block hash");
        }
        return null;
    }

    /**
     * Get mined and pending transactions in ascending timestamp order, keeping ledger order among equal
     * timestamps.
     *
     * @param vmId only transactions for this VM, or all VMs if null
     * @param taskId only transactions for this task, or all tasks if null
     * @return the matching transactions
     */
    public synchronized List<SchedulingTransaction> history(Integer vmId, String taskId) {
        List<SchedulingTransaction> result = new ArrayList<>();
        for (SchedulingTransaction tx : allTransactions()) {
            if (vmId != null && tx.getVmId() != vmId)
                continue;
            if (taskId != null && !taskId.equals(tx.getTaskId()))
                continue;
            result.add(tx);
        }
        result.sort(Comparator.comparingLong(SchedulingTransaction::getTimestamp));
        return result;
    }

    /**
     * Get the most recent transactions.
     *
     * @param limit maximum number of transactions to return
     * @return up to {@code limit} of the latest transactions, oldest first
     */
    public synchronized List<SchedulingTransaction> recentTransactions(int limit) {
        if (limit <= 0)
            return Collections.emptyList();
        final List<SchedulingTransaction> all = history(null, null);
        return new ArrayList<>(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized VmLedgerStats vmStats(int vmId) {
        final List<SchedulingTransaction> vmTransactions = history(vmId, null);
        int assigned = 0;
        int failed = 0;
        double scoreSum = 0.0;
        double cpu = 0.0;
        double mem = 0.0;
        for (SchedulingTransaction tx : vmTransactions) {
            if (tx.getStatus() == TransactionStatus.ASSIGNED) {
                assigned++;
                scoreSum += tx.getScore();
                cpu += tx.getTaskRequirements().getCPU();
                mem += tx.getTaskRequirements().getMemory();
            } else if (tx.getStatus() == TransactionStatus.FAILED) {
                failed++;
            }
        }
        return new VmLedgerStats(vmId, assigned, failed, assigned / (double) Math.max(assigned + failed, 1),
                scoreSum / Math.max(assigned, 1), cpu, mem, vmTransactions.size());
    }

    public synchronized LedgerSummary summary() {
        final List<SchedulingTransaction> all = allTransactions();
        int assigned = 0;
        int failed = 0;
        for (SchedulingTransaction tx : all) {
            if (tx.getStatus() == TransactionStatus.ASSIGNED)
                assigned++;
            else if (tx.getStatus() == TransactionStatus.FAILED)
                failed++;
        }
        return new LedgerSummary(blocks.size(), all.size(), pendingTransactions.size(), assigned, failed,
                assigned / (double) Math.max(all.size(), 1), verifyIntegrity(),
                blocks.isEmpty() ? null : blocks.get(blocks.size() - 1).getBlockHash());
    }

    /**
     * Take a snapshot of this ledger. Pending transactions are copied, so mining this ledger later doesn't
     * change the export or any ledger restored from it.
     *
     * @return the export
     */
    public synchronized LedgerExport export() {
        final List<SchedulingTransaction> pending = new ArrayList<>(pendingTransactions.size());
        for (SchedulingTransaction tx : pendingTransactions)
            pending.add(new SchedulingTransaction(tx));
        return new LedgerExport(blocks, pending, summary());
    }

    /**
     * Get a dashboard view of this ledger: the summary, the latest transactions, statistics for each VM that
     * appears among the last transactions, and the full export.
     *
     * @return the report
     */
    public synchronized LedgerReport report() {
        final Map<Integer, VmLedgerStats> stats = new TreeMap<>();
        for (SchedulingTransaction tx : recentTransactions(REPORT_VM_SCAN_TRANSACTIONS)) {
            if (!stats.containsKey(tx.getVmId()))
                stats.put(tx.getVmId(), vmStats(tx.getVmId()));
        }
        return new LedgerReport(summary(), recentTransactions(REPORT_RECENT_TRANSACTIONS), stats, export());
    }

    public synchronized List<LedgerBlock> getBlocks() {
        return new ArrayList<>(blocks);
    }

    public synchronized List<SchedulingTransaction> getPendingTransactions() {
        return new ArrayList<>(pendingTransactions);
    }

    private List<SchedulingTransaction> allTransactions() {
        List<SchedulingTransaction> all = new ArrayList<>();
        for (LedgerBlock block : blocks)
            all.addAll(block.getTransactions());
        all.addAll(pendingTransactions);
        return all;
    }
}
