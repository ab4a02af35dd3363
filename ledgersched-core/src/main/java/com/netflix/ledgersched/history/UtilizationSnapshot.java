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

package com.netflix.ledgersched.history;

import com.netflix.ledgersched.VMResource;
import com.netflix.ledgersched.VirtualMachine;

import java.util.EnumMap;

/**
 * Utilization ratios of one VM at one point in time.
 */
public class UtilizationSnapshot {
    private final EnumMap<VMResource, Double> ratios;
    private final double mean;

    UtilizationSnapshot(EnumMap<VMResource, Double> ratios) {
        this.ratios = new EnumMap<>(ratios);
        double total = 0.0;
        for (double ratio : this.ratios.values())
            total += ratio;
        mean = total / VMResource.values().length;
    }

    public static UtilizationSnapshot of(VirtualMachine vm) {
        EnumMap<VMResource, Double> ratios = new EnumMap<>(VMResource.class);
        for (VMResource r : VMResource.values())
            ratios.put(r, vm.utilization(r));
        return new UtilizationSnapshot(ratios);
    }

    public double getRatio(VMResource resource) {
        return ratios.get(resource);
    }

    /**
     * Get the mean of the ratios over all resources.
     *
     * @return the mean utilization
     */
    public double getMean() {
        return mean;
    }

    @Override
    public String toString() {
        return "UtilizationSnapshot{" +
                "ratios=" + ratios +
                ", mean=" + mean +
                '}';
    }
}
