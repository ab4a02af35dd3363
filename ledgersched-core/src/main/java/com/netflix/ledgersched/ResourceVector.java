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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * An immutable amount of each {@link VMResource}. Used for VM capacities, VM usage snapshots and task demands.
 * <p>
 * You obtain a {@code ResourceVector} by means of the {@link Builder}, or with {@link #of(double, double, double, double)}.
 * The JSON form is a flat object keyed by the resource keys, for example
 * {@code {"bw":2.0,"cpu":2.0,"io":1.0,"mem":4.0}}.
 */
public final class ResourceVector {

    public static final ResourceVector ZERO = new Builder().build();

    /**
     * Builder class for {@link ResourceVector}. Unset resources default to 0.0.
     */
    public static class Builder {
        private final EnumMap<VMResource, Double> amounts = new EnumMap<>(VMResource.class);

        public Builder() {
            for (VMResource r : VMResource.values())
                amounts.put(r, 0.0);
        }

        public Builder withCPU(double cpu) {
            return with(VMResource.CPU, cpu);
        }

        public Builder withMemory(double memory) {
            return with(VMResource.Memory, memory);
        }

        public Builder withIO(double io) {
            return with(VMResource.IO, io);
        }

        public Builder withNetwork(double bandwidth) {
            return with(VMResource.Network, bandwidth);
        }

        public Builder with(VMResource resource, double amount) {
            amounts.put(resource, amount);
            return this;
        }

        public ResourceVector build() {
            return new ResourceVector(amounts);
        }
    }

    private final EnumMap<VMResource, Double> amounts;

    private ResourceVector(EnumMap<VMResource, Double> amounts) {
        this.amounts = new EnumMap<>(amounts);
    }

    public static ResourceVector of(double cpu, double memory, double io, double network) {
        return new Builder()
                .withCPU(cpu)
                .withMemory(memory)
                .withIO(io)
                .withNetwork(network)
                .build();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ResourceVector fromKeyedMap(Map<String, Double> keyed) {
        Builder builder = new Builder();
        if (keyed != null) {
            for (Map.Entry<String, Double> entry : keyed.entrySet())
                builder.with(VMResource.fromKey(entry.getKey()), entry.getValue() == null ? 0.0 : entry.getValue());
        }
        return builder.build();
    }

    public double get(VMResource resource) {
        return amounts.get(resource);
    }

    public double getCPU() {
        return get(VMResource.CPU);
    }

    public double getMemory() {
        return get(VMResource.Memory);
    }

    public double getIO() {
        return get(VMResource.IO);
    }

    public double getNetwork() {
        return get(VMResource.Network);
    }

    /**
     * Get a new vector with the amounts of this vector and {@code other} added per resource.
     *
     * @param other the amounts to add
     * @return the sum
     */
    public ResourceVector plus(ResourceVector other) {
        Builder builder = new Builder();
        for (VMResource r : VMResource.values())
            builder.with(r, get(r) + other.get(r));
        return builder.build();
    }

    /**
     * Get the amounts keyed by resource key, in sorted key order.
     *
     * @return a sorted map of resource key to amount
     */
    @JsonValue
    public Map<String, Double> asKeyedMap() {
        Map<String, Double> keyed = new TreeMap<>();
        for (Map.Entry<VMResource, Double> entry : amounts.entrySet())
            keyed.put(entry.getKey().getKey(), entry.getValue());
        return keyed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return amounts.equals(((ResourceVector) o).amounts);
    }

    @Override
    public int hashCode() {
        return amounts.hashCode();
    }

    @Override
    public String toString() {
        return "{ cpu: " + getCPU() +
                ", mem: " + getMemory() +
                ", io: " + getIO() +
                ", bw: " + getNetwork() + " }";
    }
}
