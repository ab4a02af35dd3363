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

import com.netflix.ledgersched.plugins.BlockchainInspiredPolicy;
import com.netflix.ledgersched.plugins.LeastLoadedPolicy;
import com.netflix.ledgersched.plugins.RoundRobinPolicy;
import com.netflix.ledgersched.plugins.UrgencyAwarePolicy;

/**
 * The fixed set of scheduling policies, each with the name it is looked up by in a {@link SchedulerRegistry}.
 */
public enum SchedulingPolicyType {
    ROUND_ROBIN("roundrobin") {
        @Override
        SchedulingPolicy create(SchedulerConfig config) {
            return new RoundRobinPolicy();
        }
    },
    URGENCY_AWARE("urgency") {
        @Override
        SchedulingPolicy create(SchedulerConfig config) {
            return new UrgencyAwarePolicy();
        }
    },
    LEAST_LOADED("leastloaded") {
        @Override
        SchedulingPolicy create(SchedulerConfig config) {
            return new LeastLoadedPolicy();
        }
    },
    BLOCKCHAIN_INSPIRED("blockchain") {
        @Override
        SchedulingPolicy create(SchedulerConfig config) {
            return new BlockchainInspiredPolicy(config);
        }
    };

    private final String policyName;

    SchedulingPolicyType(String name) {
        this.policyName = name;
    }

    public String getName() {
        return policyName;
    }

    abstract SchedulingPolicy create(SchedulerConfig config);

    /**
     * Find the policy type with the given name.
     *
     * @param name the policy name, for example {@code "blockchain"}
     * @return the policy type
     * @throws UnknownPolicyException if no policy has that name
     */
    public static SchedulingPolicyType fromName(String name) {
        for (SchedulingPolicyType t : values()) {
            if (t.policyName.equals(name))
                return t;
        }
        throw new UnknownPolicyException(name);
    }
}
