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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Base class for the scheduling policies. It runs every call of a policy instance under one {@link PolicyMonitor},
 * so subclasses may mutate their state in {@link #doSchedule(TaskRequest, List)} without further locking.
 */
public abstract class AbstractSchedulingPolicy implements SchedulingPolicy {

    private static final Logger logger = LoggerFactory.getLogger(AbstractSchedulingPolicy.class);
    private final SchedulingPolicyType type;
    private final PolicyMonitor monitor = new PolicyMonitor();

    protected AbstractSchedulingPolicy(SchedulingPolicyType type) {
        this.type = type;
        logger.info("Created {} scheduling policy {}", type.getName(), Integer.toHexString(System.identityHashCode(this)));
    }

    @Override
    public SchedulingPolicyType getType() {
        return type;
    }

    @Override
    public final SchedulingDecision schedule(TaskRequest task, List<VirtualMachine> candidates) {
        if (task == null)
            throw new IllegalArgumentException("Task request must be non-null");
        if (candidates == null)
            throw new IllegalArgumentException("Candidate list must be non-null");
        try (PolicyMonitor.Entry ignored = monitor.enter()) {
            SchedulingDecision decision = doSchedule(task, candidates);
            if (logger.isDebugEnabled())
                logger.debug("{}: task {} over {} candidates -> {}", type.getName(), task.getId(), candidates.size(), decision);
            return decision;
        }
    }

    @Override
    public final SchedulingDecision scheduleAndAssign(TaskRequest task, List<VirtualMachine> candidates) {
        try (PolicyMonitor.Entry ignored = monitor.enter()) {
            SchedulingDecision decision = schedule(task, candidates);
            if (decision.isAssigned())
                decision.getVirtualMachine().commit(task);
            return decision;
        }
    }

    /**
     * Run a read of this policy's state under its monitor.
     *
     * @param <T>    the type read
     * @param reader the read to run
     * @return what {@code reader} returned
     */
    protected <T> T underMonitor(Supplier<T> reader) {
        try (PolicyMonitor.Entry ignored = monitor.enter()) {
            return reader.get();
        }
    }

    /**
     * Select a virtual machine for the task. Called while holding this policy's monitor.
     *
     * @param task       the task to place, never {@code null}
     * @param candidates the candidates, never {@code null}, possibly empty
     * @return the decision
     */
    protected abstract SchedulingDecision doSchedule(TaskRequest task, List<VirtualMachine> candidates);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{type=" + type + '}';
    }
}
