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
 * Thrown when a scheduling policy is requested by a name that no policy has.
 */
public class UnknownPolicyException extends RuntimeException {

    private final String policyName;

    public UnknownPolicyException(String policyName) {
        super("Unknown scheduling policy: " + policyName);
        this.policyName = policyName;
    }

    public String getPolicyName() {
        return policyName;
    }
}
