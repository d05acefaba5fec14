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

package org.fireflyframework.apiflow.exception;

/**
 * Thrown when a conditional update lost a race: the persisted version no longer
 * matches the version the caller read.
 */
public class StoreConsistencyException extends ApiFlowException {

    private final String executionId;
    private final long expectedVersion;

    public StoreConsistencyException(String executionId, long expectedVersion) {
        super("Execution " + executionId + " was modified concurrently (expected version " + expectedVersion + ")");
        this.executionId = executionId;
        this.expectedVersion = expectedVersion;
    }

    public String getExecutionId() {
        return executionId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
