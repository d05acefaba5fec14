/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.apiflow.core;

import java.time.Instant;
import java.util.Objects;

/**
 * What the worker must do with a queue job once the coordinator has handled it.
 *
 * @param action the queue action
 * @param redeliverAfter when a deferred job becomes visible again, only for {@link Action#DEFER}
 * @param reason short description for logging
 */
public record DeliveryOutcome(Action action, Instant redeliverAfter, String reason) {

    public enum Action {
        /** The job is done with: acknowledge it. */
        ACK,
        /** The job arrived early: negatively acknowledge it until {@code redeliverAfter}. */
        DEFER,
        /** State could not be committed: leave the job unacknowledged so it is redelivered. */
        ABANDON
    }

    public DeliveryOutcome {
        Objects.requireNonNull(action, "action cannot be null");
        if (action == Action.DEFER && redeliverAfter == null) {
            throw new IllegalArgumentException("DEFER requires redeliverAfter");
        }
    }

    public static DeliveryOutcome ack(String reason) {
        return new DeliveryOutcome(Action.ACK, null, reason);
    }

    public static DeliveryOutcome defer(Instant until, String reason) {
        return new DeliveryOutcome(Action.DEFER, until, reason);
    }

    public static DeliveryOutcome abandon(String reason) {
        return new DeliveryOutcome(Action.ABANDON, null, reason);
    }
}
