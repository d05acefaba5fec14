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

package org.fireflyframework.apiflow.queue;

/**
 * Queue depth snapshot.
 *
 * @param ready jobs deliverable now
 * @param delayed jobs waiting for their delivery time
 * @param inFlight delivered jobs not acknowledged yet
 */
public record QueueStats(int ready, int delayed, int inFlight) {

    public int total() {
        return ready + delayed + inFlight;
    }
}
