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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;

/**
 * A virtual machine candidate with a fixed capacity per {@link VMResource} and the usage committed to it so far.
 * <p>
 * Usage must never exceed capacity. This is kept by callers running {@link #canAdmit(TaskRequest)} before
 * {@link #commit(TaskRequest)}; this class does not block an overcommit made without that check.
 * <p>
 * Instances are not thread safe. Callers that share them across threads should route every commit through
 * {@link SchedulingPolicy#scheduleAndAssign(TaskRequest, List)} on one and the same policy instance, which commits
 * under that policy's lock. Locks are per policy, so two policies committing to the same VMs can overcommit them.
 */
public class VirtualMachine {
    private final int id;
    private final ResourceVector capacity;
    private final EnumMap<VMResource, Double> usage;
    private final List<String> taskIds;

    public VirtualMachine(int id, ResourceVector capacity) {
        this(id, capacity, ResourceVector.ZERO, Collections.<String>emptyList());
    }

    /**
     * Create a virtual machine from a snapshot of its current state.
     *
     * @param id       the VM identifier
     * @param capacity capacity per resource, each must be greater than 0
     * @param usage    resources already in use
     * @param taskIds  identifiers of tasks already assigned, in assignment order
     * @throws IllegalArgumentException if any capacity is not positive or any usage is negative
     */
    public VirtualMachine(int id, ResourceVector capacity, ResourceVector usage, List<String> taskIds) {
        this.id = id;
        this.capacity = capacity;
        this.usage = new EnumMap<>(VMResource.class);
        for (VMResource r : VMResource.values()) {
            if (capacity.get(r) <= 0.0)
                throw new IllegalArgumentException("VM " + id + " capacity for " + r + " must be >0");
            if (usage.get(r) < 0.0)
                throw new IllegalArgumentException("VM " + id + " usage for " + r + " can't be negative");
            this.usage.put(r, usage.get(r));
        }
        this.taskIds = new ArrayList<>(taskIds);
    }

    public int getId() {
        return id;
    }

    public ResourceVector getCapacity() {
        return capacity;
    }

    /**
     * Get a snapshot of the resources currently in use on this VM.
     *
     * @return the current usage
     */
    public ResourceVector getUsage() {
        ResourceVector.Builder builder = new ResourceVector.Builder();
        for (VMResource r : VMResource.values())
            builder.with(r, usage.get(r));
        return builder.build();
    }

    public double getUsed(VMResource resource) {
        return usage.get(resource);
    }

    /**
     * Get the identifiers of the tasks committed to this VM, in commit order.
     *
     * @return an unmodifiable list of task ids
     */
    public List<String> getTaskIds() {
        return Collections.unmodifiableList(taskIds);
    }

    /**
     * Admission test: whether the task's demand fits in the remaining capacity on every resource at once.
     *
     * @param task the task to test
     * @return {@code true} if the task fits
     */
    public boolean canAdmit(TaskRequest task) {
        for (VMResource r : VMResource.values()) {
            if (usage.get(r) + task.getDemand().get(r) > capacity.get(r))
                return false;
        }
        return true;
    }

    /**
     * Add the task's demand to this VM's usage and record its id. There is no rollback; call
     * {@link #canAdmit(TaskRequest)} first.
     *
     * @param task the task to commit
     */
    public void commit(TaskRequest task) {
        for (VMResource r : VMResource.values())
            usage.put(r, usage.get(r) + task.getDemand().get(r));
        taskIds.add(task.getId());
    }

    /**
     * Get the fraction of the given resource's capacity that is in use.
     *
     * @param resource the resource
     * @return usage divided by capacity
     */
    public double utilization(VMResource resource) {
        return usage.get(resource) / capacity.get(resource);
    }

    /**
     * Get the load score, the mean of {@link #utilization(VMResource)} over all resources. The value is within
     * [0.0, 1.0] as long as every commit followed a passing admission test.
     *
     * @return the load score
     */
    public double loadScore() {
        double total = 0.0;
        for (VMResource r : VMResource.values())
            total += utilization(r);
        return total / VMResource.values().length;
    }

    @Override
    public String toString() {
        return "VirtualMachine{" +
                "id=" + id +
                ", capacity=" + capacity +
                ", usage=" + getUsage() +
                ", taskIds=" + taskIds +
                '}';
    }
}
