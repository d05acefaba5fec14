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

import java.time.Instant;

/**
 * One delivery of a queue job.
 *
 * @param jobId the job id, compared against the execution's persisted job id
 * @param executionId the execution to drive
 * @param queueName the queue the job came from
 * @param deliveryCount how many times the job was delivered, this delivery included
 * @param deliveredAt delivery time
 */
public record QueueDelivery(
        String jobId,
        String executionId,
        String queueName,
        int deliveryCount,
        Instant deliveredAt
) {
}
