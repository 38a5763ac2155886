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

package dev.mars.autoflow.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the Autoflow execution engine.
 *
 * Provides:
 * - autoflow.workflow.active (gauge) - Runs currently RUNNING or RETRYING
 * - autoflow.workflow.started (counter) - Runs started, by workflow and trigger type
 * - autoflow.workflow.completed (counter) - Runs completed
 * - autoflow.workflow.failed (counter) - Runs failed, by error code
 * - autoflow.workflow.cancelled (counter) - Runs cancelled
 * - autoflow.workflow.steps.total (counter) - Step attempts that succeeded
 * - autoflow.workflow.steps.failed (counter) - Step attempts that failed, by error code
 * - autoflow.workflow.steps.retried (counter) - Step retries scheduled
 * - autoflow.workflow.duration.seconds (histogram) - Run duration
 * - autoflow.workflow.step.duration.ms (histogram) - Step attempt duration
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-08
 * @version 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "autoflow-workflow";

    private final LongCounter workflowsStarted;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;
    private final LongCounter stepsRetried;

    private final DoubleHistogram workflowDuration;
    private final DoubleHistogram stepDuration;

    private final AtomicLong activeWorkflows = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> TRIGGER_TYPE_KEY = AttributeKey.stringKey("trigger.type");
    private static final AttributeKey<String> STEP_TYPE_KEY = AttributeKey.stringKey("step.type");
    private static final AttributeKey<String> ERROR_CODE_KEY = AttributeKey.stringKey("error.code");

    public WorkflowMetrics(Meter meter) {
        workflowsStarted = meter.counterBuilder("autoflow.workflow.started")
                .setDescription("Number of workflow runs started")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("autoflow.workflow.completed")
                .setDescription("Number of workflow runs completed")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("autoflow.workflow.failed")
                .setDescription("Number of workflow runs failed")
                .setUnit("1")
                .build();

        workflowsCancelled = meter.counterBuilder("autoflow.workflow.cancelled")
                .setDescription("Number of workflow runs cancelled")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("autoflow.workflow.steps.total")
                .setDescription("Number of step attempts that succeeded")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("autoflow.workflow.steps.failed")
                .setDescription("Number of step attempts that failed or timed out")
                .setUnit("1")
                .build();

        stepsRetried = meter.counterBuilder("autoflow.workflow.steps.retried")
                .setDescription("Number of step retries scheduled")
                .setUnit("1")
                .build();

        workflowDuration = meter.histogramBuilder("autoflow.workflow.duration.seconds")
                .setDescription("Workflow run duration in seconds")
                .setUnit("s")
                .build();

        stepDuration = meter.histogramBuilder("autoflow.workflow.step.duration.ms")
                .setDescription("Step attempt duration in milliseconds")
                .setUnit("ms")
                .build();

        meter.gaugeBuilder("autoflow.workflow.active")
                .setDescription("Number of workflow runs currently running or waiting to retry")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.debug("WorkflowMetrics initialized");
    }

    public static WorkflowMetrics create(OpenTelemetry openTelemetry) {
        return new WorkflowMetrics(openTelemetry.getMeter(METER_NAME));
    }

    /**
     * Metrics bound to whatever OpenTelemetry instance is registered globally
     * (a no-op until an SDK is installed).
     */
    public static WorkflowMetrics global() {
        return new WorkflowMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
    }

    public static WorkflowMetrics noop() {
        return create(OpenTelemetry.noop());
    }

    public void recordWorkflowStarted(String workflowName, String triggerType) {
        workflowsStarted.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName, TRIGGER_TYPE_KEY, triggerType));
        activeWorkflows.incrementAndGet();
    }

    /**
     * Accounts for a run that was already active when this process started, such as
     * a run re-driven by crash recovery.
     */
    public void recordWorkflowResumed() {
        activeWorkflows.incrementAndGet();
    }

    public void recordWorkflowCompleted(String workflowName, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = Attributes.of(WORKFLOW_NAME_KEY, workflowName);
        workflowsCompleted.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    public void recordWorkflowFailed(String workflowName, String errorCode, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        workflowsFailed.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName,
                ERROR_CODE_KEY, errorCode != null ? errorCode : "unknown"));
        workflowDuration.record(durationSeconds, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
    }

    public void recordWorkflowCancelled(String workflowName) {
        activeWorkflows.decrementAndGet();
        workflowsCancelled.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
    }

    public void recordStepExecuted(String workflowName, String stepType, long durationMs) {
        Attributes attrs = Attributes.of(WORKFLOW_NAME_KEY, workflowName, STEP_TYPE_KEY, stepType);
        stepsTotal.add(1, attrs);
        stepDuration.record(durationMs, attrs);
    }

    public void recordStepFailed(String workflowName, String stepType, String errorCode, long durationMs) {
        stepsFailed.add(1, Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(STEP_TYPE_KEY, stepType)
                .put(ERROR_CODE_KEY, errorCode != null ? errorCode : "unknown")
                .build());
        stepDuration.record(durationMs, Attributes.of(WORKFLOW_NAME_KEY, workflowName, STEP_TYPE_KEY, stepType));
    }

    public void recordStepRetried(String workflowName, String stepType) {
        stepsRetried.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName, STEP_TYPE_KEY, stepType));
    }

    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }
}
