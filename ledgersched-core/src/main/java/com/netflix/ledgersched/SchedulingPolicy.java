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

import java.util.List;

/**
 * A policy that selects, for a task, one virtual machine out of a list of candidates. The set of policies is
 * fixed, see {@link SchedulingPolicyType}.
 * <p>
 * A policy may keep state across calls (a rotation cursor, utilization history, a ledger), so you should hold on
 * to one instance per policy, for example through a {@link SchedulerRegistry}. Calls on the same instance are
 * serialized by the instance.
 */
public interface SchedulingPolicy {

    /**
     * Get the type of this policy.
     *
     * @return the policy type
     */
    SchedulingPolicyType getType();

    /**
     * Select a virtual machine for the task. This does not commit the task's resources to the selected VM;
     * that is up to the caller. Not finding any VM that can admit the task is a normal outcome, returned as a
     * decision without a VM, never thrown.
     *
     * @param task       the task to place
     * @param candidates the candidate VMs, in the caller's order
     * @return the decision
     */
    SchedulingDecision schedule(TaskRequest task, List<VirtualMachine> candidates);

    /**
     * Select a virtual machine for the task and commit the task to it, both while holding this policy's lock.
     * Use this when more than one thread schedules against the same VM objects through this policy instance, so
     * that no two callers act on the same admission result. The lock is not shared with other policies; a set of
     * VMs shared across threads must be scheduled by a single policy instance.
     *
     * @param task       the task to place
     * @param candidates the candidate VMs, in the caller's order
     * @return the decision; if it has a VM, the task has been committed to it
     */
    SchedulingDecision scheduleAndAssign(TaskRequest task, List<VirtualMachine> candidates);
}
