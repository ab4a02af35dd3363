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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Resolves a policy name to one scheduling policy instance. The instance for a name is created on first lookup and
 * returned for every later lookup, so a policy's rotation cursor, utilization history and ledger carry over from
 * one scheduling call to the next.
 * <p>
 * The service that composes scheduling owns the registry and keeps it for as long as policy state should live.
 * Lookups may be made from any thread.
 */
public class SchedulerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerRegistry.class);
    private final SchedulerConfig config;
    private final ConcurrentMap<SchedulingPolicyType, SchedulingPolicy> policies = new ConcurrentHashMap<>();

    public SchedulerRegistry(SchedulerConfig config) {
        if (config == null)
            throw new IllegalArgumentException("Scheduler config must be non-null");
        this.config = config;
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    /**
     * Get the policy with the given name, creating it on first use.
     *
     * @param name the policy name, one of {@code roundrobin}, {@code urgency}, {@code leastloaded} and
     *             {@code blockchain}
     * @return the single instance for that name
     * @throws UnknownPolicyException if no policy has that name
     */
    public SchedulingPolicy getPolicy(String name) {
        return getPolicy(SchedulingPolicyType.fromName(name));
    }

    /**
     * Get the policy of the given type, creating it on first use.
     *
     * @param type the policy type
     * @return the single instance for that type
     */
    public SchedulingPolicy getPolicy(SchedulingPolicyType type) {
        return policies.computeIfAbsent(type, t -> {
            logger.info("Creating {} policy with {}", t.getName(), config);
            return t.create(config);
        });
    }

    /**
     * Schedule the task with the named policy. See {@link SchedulingPolicy#schedule(TaskRequest, List)}.
     *
     * @param name       the policy name
     * @param task       the task to place
     * @param candidates the candidate VMs
     * @return the decision
     * @throws UnknownPolicyException if no policy has that name
     */
    public SchedulingDecision schedule(String name, TaskRequest task, List<VirtualMachine> candidates) {
        return getPolicy(name).schedule(task, candidates);
    }

    /**
     * Schedule the task with the named policy and commit it to the selected VM. See
     * {@link SchedulingPolicy#scheduleAndAssign(TaskRequest, List)}.
     *
     * @param name       the policy name
     * @param task       the task to place
     * @param candidates the candidate VMs
     * @return the decision
     * @throws UnknownPolicyException if no policy has that name
     */
    public SchedulingDecision scheduleAndAssign(String name, TaskRequest task, List<VirtualMachine> candidates) {
        return getPolicy(name).scheduleAndAssign(task, candidates);
    }
}
