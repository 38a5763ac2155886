/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.autoflow.core;

/**
 * Delay policy applied before a failed step attempt is retried.
 */
public enum BackoffStrategy {
    /** Every retry waits retry_delay_seconds. */
    FIXED,
    /** Retry n waits retry_delay_seconds * 2^n, capped at max_retry_delay_seconds. */
    EXPONENTIAL
}
