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
 * Describes a task to be assigned to a virtual machine and its requirements. A task request is immutable once
 * built.
 */
public final class TaskRequest {

    /**
     * The Builder is how you construct a {@link TaskRequest}. Chain its methods and then call {@link #build()}.
     */
    public static class Builder {
        private final String id;
        private ResourceVector.Builder demand = new ResourceVector.Builder();
        private long deadline = -1L;
        private long durationMillis = 0L;

        public Builder(String id) {
            this.id = id;
        }

        public Builder withCPU(double cpu) {
            demand.withCPU(cpu);
            return this;
        }

        public Builder withMemory(double memory) {
            demand.withMemory(memory);
            return this;
        }

        public Builder withIO(double io) {
            demand.withIO(io);
            return this;
        }

        public Builder withNetwork(double bandwidth) {
            demand.withNetwork(bandwidth);
            return this;
        }

        /**
         * Set the absolute deadline of the task.
         *
         * @param deadline the deadline, in milliseconds since the epoch
         * @return this same {@code Builder}
         */
        public Builder withDeadline(long deadline) {
            this.deadline = deadline;
            return this;
        }

        /**
         * Set the expected run time of the task. This is informational, none of the policies use it.
         *
         * @param durationMillis the duration, in milliseconds
         * @return this same {@code Builder}
         */
        public Builder withDurationMillis(long durationMillis) {
            this.durationMillis = durationMillis;
            return this;
        }

        /**
         * Build the task request.
         *
         * @return the task request
         * @throws IllegalArgumentException if the id is missing, the deadline was not set, or any demand or the
         *                                  duration is negative
         */
        public TaskRequest build() {
            if (id == null || id.isEmpty())
                throw new IllegalArgumentException("Task id must be non-empty");
            if (deadline < 0L)
                throw new IllegalArgumentException("Deadline must be set for task " + id);
            if (durationMillis < 0L)
                throw new IllegalArgumentException("Duration can't be negative: " + durationMillis);
            ResourceVector vector = demand.build();
            for (VMResource r : VMResource.values()) {
                if (vector.get(r) < 0.0)
                    throw new IllegalArgumentException("Task " + id + " demand for " + r + " can't be negative");
            }
            return new TaskRequest(id, vector, deadline, durationMillis);
        }
    }

    private final String id;
    private final ResourceVector demand;
    private final long deadline;
    private final long durationMillis;

    private TaskRequest(String id, ResourceVector demand, long deadline, long durationMillis) {
        this.id = id;
        this.demand = demand;
        this.deadline = deadline;
        this.durationMillis = durationMillis;
    }

    /**
     * Get an identifier for this task request.
     *
     * @return a task identifier
     */
    public String getId() {
        return id;
    }

    /**
     * Get the resources requested by the task.
     *
     * @return the demand per resource
     */
    public ResourceVector getDemand() {
        return demand;
    }

    public double getCPUs() {
        return demand.getCPU();
    }

    public double getMemory() {
        return demand.getMemory();
    }

    public double getIO() {
        return demand.getIO();
    }

    public double getNetwork() {
        return demand.getNetwork();
    }

    /**
     * Get the absolute deadline of the task.
     *
     * @return the deadline, in milliseconds since the epoch
     */
    public long getDeadline() {
        return deadline;
    }

    /**
     * Get the expected duration of the task.
     *
     * @return the duration in milliseconds, or 0 if it was not given
     */
    public long getDurationMillis() {
        return durationMillis;
    }

    public boolean hasDuration() {
        return durationMillis > 0L;
    }

    @Override
    public String toString() {
        return "TaskRequest{" +
                "id='" + id + '\'' +
                ", demand=" + demand +
                ", deadline=" + deadline +
                ", durationMillis=" + durationMillis +
                '}';
    }
}
