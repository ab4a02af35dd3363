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

package com.netflix.ledgersched.plugins;

import com.netflix.ledgersched.AbstractSchedulingPolicy;
import com.netflix.ledgersched.ResourceVector;
import com.netflix.ledgersched.SchedulerConfig;
import com.netflix.ledgersched.SchedulingDecision;
import com.netflix.ledgersched.SchedulingPolicyType;
import com.netflix.ledgersched.TaskRequest;
import com.netflix.ledgersched.VMResource;
import com.netflix.ledgersched.VirtualMachine;
import com.netflix.ledgersched.history.ResourceHistory;
import com.netflix.ledgersched.history.UtilizationSnapshot;
import com.netflix.ledgersched.ledger.LedgerBlock;
import com.netflix.ledgersched.ledger.LedgerExport;
import com.netflix.ledgersched.ledger.LedgerSummary;
import com.netflix.ledgersched.ledger.SchedulingTransaction;
import com.netflix.ledgersched.ledger.TransactionLedger;
import com.netflix.ledgersched.ledger.TransactionStatus;
import com.netflix.ledgersched.ledger.VmLedgerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * A policy that favors urgent tasks on VMs that are lightly loaded now and have been lightly loaded recently.
 * Each candidate that can take the task is scored as the task's urgency divided by the VM's dynamic weight, a
 * blend of its current and historical utilization. The highest score wins, equal scores going to the lower VM id.
 * <p>
 * Every decision is recorded in this policy's {@link TransactionLedger}. A successful decision records an
 * {@link TransactionStatus#ASSIGNED} transaction with the VM's usage before and after the assignment. When no
 * candidate can take the task, a {@link TransactionStatus#FAILED} transaction is recorded against the first
 * candidate. The policy itself does not change VM usage; use
 * {@link #scheduleAndAssign(TaskRequest, List)} to commit the selected VM in the same step.
 */
public class BlockchainInspiredPolicy extends AbstractSchedulingPolicy {

    private static final Logger logger = LoggerFactory.getLogger(BlockchainInspiredPolicy.class);
    private final double currentUsageWeight;
    private final double historicalUsageWeight;
    private final double epsilon;
    private final Supplier<Long> timeSupplier;
    private final ResourceHistory resourceHistory;
    private final TransactionLedger ledger;

    public BlockchainInspiredPolicy() {
        this(new SchedulerConfig.Builder().build());
    }

    public BlockchainInspiredPolicy(SchedulerConfig config) {
        super(SchedulingPolicyType.BLOCKCHAIN_INSPIRED);
        if (config == null)
            throw new IllegalArgumentException("Scheduler config can't be null");
        this.currentUsageWeight = config.getCurrentUsageWeight();
        this.historicalUsageWeight = config.getHistoricalUsageWeight();
        this.epsilon = config.getEpsilon();
        this.timeSupplier = config.getTimeSupplier();
        this.resourceHistory = new ResourceHistory(config.getHistoryWindow());
        this.ledger = new TransactionLedger(config.getLedgerBlockSize(), config.getTimeSupplier());
    }

    /**
     * Admission by predicted utilization: every resource's usage plus the task's demand, over the VM's capacity,
     * must be at most 1.0.
     */
    static boolean fits(TaskRequest task, VirtualMachine vm) {
        for (VMResource r : VMResource.values()) {
            if ((vm.getUsed(r) + task.getDemand().get(r)) / vm.getCapacity().get(r) > 1.0)
                return false;
        }
        return true;
    }

    double dynamicWeight(double currentUsage, double historicalUsage) {
        return Math.max(currentUsageWeight * currentUsage + historicalUsageWeight * historicalUsage, epsilon);
    }

    double urgency(TaskRequest task, long now) {
        return 1.0 / Math.max((task.getDeadline() - now) / 1000.0, epsilon);
    }

    static double score(double urgency, double dynamicWeight) {
        return urgency / dynamicWeight;
    }

    @Override
    protected SchedulingDecision doSchedule(TaskRequest task, List<VirtualMachine> candidates) {
        for (VirtualMachine vm : candidates)
            resourceHistory.record(vm);
        final long now = timeSupplier.get();
        final double urgency = urgency(task, now);
        VirtualMachine best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (VirtualMachine vm : candidates) {
            if (!fits(task, vm))
                continue;
            final double cru = vm.loadScore();
            final double hru = resourceHistory.historicalUsage(vm.getId());
            final double score = score(urgency, dynamicWeight(cru, hru));
            if (logger.isDebugEnabled())
                logger.debug("Task " + task.getId() + " on VM " + vm.getId() + ": cru=" + cru + ", hru=" + hru +
                        ", urgency=" + urgency + ", score=" + score);
            if (best == null || score > bestScore || (score == bestScore && vm.getId() < best.getId())) {
                best = vm;
                bestScore = score;
            }
        }
        if (best != null) {
            final ResourceVector before = best.getUsage();
            ledger.append(best.getId(), task, before, before.plus(task.getDemand()), bestScore,
                    TransactionStatus.ASSIGNED);
            return new SchedulingDecision(best, bestScore);
        }
        if (!candidates.isEmpty()) {
            final VirtualMachine first = candidates.get(0);
            final ResourceVector state = first.getUsage();
            ledger.append(first.getId(), task, state, state, 0.0, TransactionStatus.FAILED);
            logger.warn("No VM out of " + candidates.size() + " can take task " + task.getId());
        }
        return SchedulingDecision.rejected(Double.POSITIVE_INFINITY);
    }

    public TransactionLedger getLedger() {
        return ledger;
    }

    /**
     * Get the utilization snapshots this policy holds for a VM, read under the policy's lock.
     *
     * @param vmId the VM id
     * @return an unmodifiable copy of the VM's window, oldest first
     */
    public List<UtilizationSnapshot> getHistorySnapshots(int vmId) {
        return underMonitor(() -> resourceHistory.getSnapshots(vmId));
    }

    /**
     * Get a VM's historical resource usage as of the last scheduling call.
     *
     * @param vmId the VM id
     * @return the mean of the VM's recorded utilization means, 0.0 if none were recorded
     */
    public double getHistoricalUsage(int vmId) {
        return underMonitor(() -> resourceHistory.historicalUsage(vmId));
    }

    public LedgerSummary getLedgerStats() {
        return underMonitor(ledger::summary);
    }

    public VmLedgerStats getVmLedgerStats(int vmId) {
        return underMonitor(() -> ledger.vmStats(vmId));
    }

    public List<SchedulingTransaction> getTaskLedgerHistory(String taskId) {
        return underMonitor(() -> ledger.history(null, taskId));
    }

    public boolean validateLedgerIntegrity() {
        return underMonitor(ledger::verifyIntegrity);
    }

    /**
     * Mine the ledger's pending transactions into a block now, without waiting for the block to fill.
     *
     * @return the mined block, or {@code null} if nothing was pending
     */
    public LedgerBlock forceMinePendingTransactions() {
        return underMonitor(ledger::mine);
    }

    public List<SchedulingTransaction> getRecentTransactions(int limit) {
        return underMonitor(() -> ledger.recentTransactions(limit));
    }

    public LedgerExport exportLedgerData() {
        return underMonitor(ledger::export);
    }
}
