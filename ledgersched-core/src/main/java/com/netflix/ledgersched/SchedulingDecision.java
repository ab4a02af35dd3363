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

package com.netflix.ledgersched;

/**
 * The result of one call to {@link SchedulingPolicy#schedule(TaskRequest, java.util.List) schedule()}: the
 * selected virtual machine, if any, and the score the policy gave it.
 * <p>
 * When no candidate can admit the task, {@link #getVirtualMachine()} returns {@code null} and the score is a
 * policy specific sentinel. How to read the score also depends on the policy:
 * <UL>
 *     <LI>{@link SchedulingPolicyType#ROUND_ROBIN}: load score of the selected VM, 0 when nothing was selected.</LI>
 *     <LI>{@link SchedulingPolicyType#URGENCY_AWARE}: lower is better, positive infinity when nothing was selected.</LI>
 *     <LI>{@link SchedulingPolicyType#LEAST_LOADED}: lower is better, positive infinity when nothing was selected.</LI>
 *     <LI>{@link SchedulingPolicyType#BLOCKCHAIN_INSPIRED}: higher is better, positive infinity when nothing was
 *     selected.</LI>
 * </UL>
 */
public class SchedulingDecision {
    private final VirtualMachine virtualMachine;
    private final double score;

    public SchedulingDecision(VirtualMachine virtualMachine, double score) {
        this.virtualMachine = virtualMachine;
        this.score = score;
    }

    public static SchedulingDecision rejected(double sentinelScore) {
        return new SchedulingDecision(null, sentinelScore);
    }

    /**
     * Get the selected virtual machine.
     *
     * @return the selected VM, or {@code null} if no candidate could admit the task
     */
    public VirtualMachine getVirtualMachine() {
        return virtualMachine;
    }

    public double getScore() {
        return score;
    }

    public boolean isAssigned() {
        return virtualMachine != null;
    }

    @Override
    public String toString() {
        return "SchedulingDecision{" +
                "vmId=" + (virtualMachine == null ? "none" : String.valueOf(virtualMachine.getId())) +
                ", score=" + score +
                '}';
    }
}
