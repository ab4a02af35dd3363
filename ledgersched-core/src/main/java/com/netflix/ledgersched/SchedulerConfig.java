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
import java.util.List;
import java.util.function.Supplier;

/**
 * Settings shared by the scheduling policies of one {@link SchedulerRegistry}. You create a
 * {@code SchedulerConfig} by means of its {@link Builder}.
 */
public class SchedulerConfig {

    /**
     * The Builder is how you construct a {@link SchedulerConfig}. Chain its methods and then call
     * {@link #build build()}.
     */
    public final static class Builder {
        private ResourceVector vmCapacity = ResourceVector.of(500, 250, 300, 20);
        private double currentUsageWeight = 0.7;
        private double historicalUsageWeight = 0.3;
        private double epsilon = 1e-6;
        private int historyWindow = 10;
        private int ledgerBlockSize = 5;
        private Supplier<Long> timeSupplier = System::currentTimeMillis;

        /**
         * Set the capacity given to VMs made by {@link SchedulerConfig#createVMs(int)}. The default is
         * cpu 500, mem 250, io 300, bw 20.
         *
         * @param vmCapacity capacity per resource
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link SchedulerConfig}
         */
        public Builder withVMCapacity(ResourceVector vmCapacity) {
            this.vmCapacity = vmCapacity;
            return this;
        }

        /**
         * Set the weight (alpha) of current resource usage in the dynamic weight of the blockchain inspired
         * policy. The default is 0.7.
         *
         * @param alpha the weight, must not be negative
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link SchedulerConfig}
         */
        public Builder withCurrentUsageWeight(double alpha) {
            if (alpha < 0.0)
                throw new IllegalArgumentException("Current usage weight can't be negative: " + alpha);
            this.currentUsageWeight = alpha;
            return this;
        }

        /**
         * Set the weight (beta) of historical resource usage in the dynamic weight of the blockchain inspired
         * policy. The default is 0.3.
         *
         * @param beta the weight, must not be negative
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link SchedulerConfig}
         */
        public Builder withHistoricalUsageWeight(double beta) {
            if (beta < 0.0)
                throw new IllegalArgumentException("Historical usage weight can't be negative: " + beta);
            this.historicalUsageWeight = beta;
            return this;
        }

        /**
         * Set the floor used for the dynamic weight and for the time left before a deadline. The default is 1e-6.
         *
         * @param epsilon the floor, must be greater than 0
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link SchedulerConfig}
         */
        public Builder withEpsilon(double epsilon) {
            if (epsilon <= 0.0)
                throw new IllegalArgumentException("Epsilon must be >0: " + epsilon);
            this.epsilon = epsilon;
            return this;
        }

        /**
         * Set how many utilization snapshots are kept per VM. The default is 10.
         *
         * @param historyWindow the window size, must be greater than 0
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link SchedulerConfig}
         */
        public Builder withHistoryWindow(int historyWindow) {
            if (historyWindow < 1)
                throw new IllegalArgumentException("History window must be >0: " + historyWindow);
            this.historyWindow = historyWindow;
            return this;
        }

        /**
         * Set how many pending ledger transactions trigger mining of a block. The default is 5.
         *
         * @param ledgerBlockSize the block size, must be greater than 0
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link SchedulerConfig}
         */
        public Builder withLedgerBlockSize(int ledgerBlockSize) {
            if (ledgerBlockSize < 1)
                throw new IllegalArgumentException("Ledger block size must be >0: " + ledgerBlockSize);
            this.ledgerBlockSize = ledgerBlockSize;
            return this;
        }

        /**
         * Set the source of the current time, in milliseconds since the epoch. The default is
         * {@link System#currentTimeMillis()}.
         *
         * @param timeSupplier the time source
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link SchedulerConfig}
         */
        public Builder withTimeSupplier(Supplier<Long> timeSupplier) {
            if (timeSupplier == null)
                throw new IllegalArgumentException("Time supplier must be non-null");
            this.timeSupplier = timeSupplier;
            return this;
        }

        public SchedulerConfig build() {
            if (vmCapacity == null)
                throw new IllegalArgumentException("VM capacity must be non-null");
            return new SchedulerConfig(this);
        }
    }

    private final ResourceVector vmCapacity;
    private final double currentUsageWeight;
    private final double historicalUsageWeight;
    private final double epsilon;
    private final int historyWindow;
    private final int ledgerBlockSize;
    private final Supplier<Long> timeSupplier;

    private SchedulerConfig(Builder builder) {
        vmCapacity = builder.vmCapacity;
        currentUsageWeight = builder.currentUsageWeight;
        historicalUsageWeight = builder.historicalUsageWeight;
        epsilon = builder.epsilon;
        historyWindow = builder.historyWindow;
        ledgerBlockSize = builder.ledgerBlockSize;
        timeSupplier = builder.timeSupplier;
    }

    public ResourceVector getVMCapacity() {
        return vmCapacity;
    }

    public double getCurrentUsageWeight() {
        return currentUsageWeight;
    }

    public double getHistoricalUsageWeight() {
        return historicalUsageWeight;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public int getLedgerBlockSize() {
        return ledgerBlockSize;
    }

    public Supplier<Long> getTimeSupplier() {
        return timeSupplier;
    }

    /**
     * Create idle virtual machines with ids {@code 0} to {@code count-1}, each with the configured capacity.
     *
     * @param count how many VMs to create
     * @return the VMs, in id order
     */
    public List<VirtualMachine> createVMs(int count) {
        List<VirtualMachine> vms = new ArrayList<>(count);
        for (int i = 0; i < count; i++)
            vms.add(new VirtualMachine(i, vmCapacity));
        return vms;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "vmCapacity=" + vmCapacity +
                ", currentUsageWeight=" + currentUsageWeight +
                ", historicalUsageWeight=" + historicalUsageWeight +
                ", epsilon=" + epsilon +
                ", historyWindow=" + historyWindow +
                ", ledgerBlockSize=" + ledgerBlockSize +
                '}';
    }
}
