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

package dev.mars.autoflow.workflow.engine;

import dev.mars.autoflow.core.DefinitionStatus;
import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.StepResult;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.WorkflowDefinition;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowSnapshot;
import dev.mars.autoflow.core.WorkflowStep;
import dev.mars.autoflow.core.WorkflowStepLog;
import dev.mars.autoflow.core.config.AutoflowConfiguration;
import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.core.exceptions.ConcurrencyConflictException;
import dev.mars.autoflow.core.exceptions.DefinitionValidationException;
import dev.mars.autoflow.core.exceptions.InvalidTransitionException;
import dev.mars.autoflow.core.exceptions.RetryBudgetExceededException;
import dev.mars.autoflow.core.exceptions.StepExecutionException;
import dev.mars.autoflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.autoflow.core.step.StepContext;
import dev.mars.autoflow.core.step.StepOutcome;
import dev.mars.autoflow.core.storage.WorkflowStateStore;
import dev.mars.autoflow.workflow.CompiledWorkflow;
import dev.mars.autoflow.workflow.CompiledWorkflow.CompiledStep;
import dev.mars.autoflow.workflow.WorkflowCompiler;
import dev.mars.autoflow.workflow.definition.WorkflowDefinitionStore;
import dev.mars.autoflow.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * {@link WorkflowEngine} whose runs survive restarts: every transition is written
 * to the {@link WorkflowStateStore} before the next step begins.
 *
 * <h3>Advancing a run</h3>
 * <ol>
 *   <li>Under the run's lock: load it, resume it from RETRYING once due, and look up
 *       the step log of the next attempt. A terminal log means the outcome was
 *       recorded before a crash; it is applied without invoking the executor again.
 *       Otherwise a RUNNING log is written.</li>
 *   <li>Without the lock: invoke the step executor under the step deadline.</li>
 *   <li>Under the lock again: mark the log terminal and route the run. If the run
 *       was cancelled meanwhile the log is marked CANCELLED and the result dropped.</li>
 * </ol>
 *
 * <h3>Failures</h3>
 * <p>A failed attempt is retried while {@code retryCount < maxRetries}; the
 * budget resets whenever the run moves to a step. Once exhausted, an explicit
 * on_failure edge is followed, otherwise the run fails with
 * {@link RetryBudgetExceededException#ERROR_CODE}.</p>
 *
 * <p>With {@code autoDrive} disabled nothing runs on the worker pool: callers
 * step runs with {@link #advance(String)} themselves.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-07
 * @version 1.0
 */
public class DurableWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(DurableWorkflowEngine.class);

    static final String ERROR_DEFINITION_INVALID = "DefinitionValidation";
    static final String ERROR_ROUTED_TO_FAIL = "RoutedToFail";

    private static final Set<ExecutionStatus> OPEN_STATUSES =
            EnumSet.of(ExecutionStatus.PENDING, ExecutionStatus.RUNNING, ExecutionStatus.RETRYING);
    private static final Set<ExecutionStatus> RERUNNABLE_STATUSES =
            EnumSet.of(ExecutionStatus.FAILED, ExecutionStatus.CANCELLED);

    private final WorkflowStateStore store;
    private final WorkflowDefinitionStore definitions;
    private final WorkflowCompiler compiler;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final int conflictRetryLimit;
    private final long shutdownTimeoutMs;
    private final boolean autoDrive;

    private final ExecutorService workers;
    private final ExecutorService stepInvoker;
    private final ScheduledExecutorService retryTimer;

    private final ExecutionLocks locks = new ExecutionLocks();
    private final Map<String, CompiledWorkflow> compiledRuns = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Set<String> drivers = ConcurrentHashMap.newKeySet();
    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();
    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean shutdown = false;

    private DurableWorkflowEngine(Builder builder) {
        this.store = Objects.requireNonNull(builder.stateStore, "stateStore cannot be null");
        this.definitions = Objects.requireNonNull(builder.definitionStore, "definitionStore cannot be null");
        this.compiler = Objects.requireNonNull(builder.compiler, "compiler cannot be null");
        this.metrics = builder.metrics != null ? builder.metrics : WorkflowMetrics.noop();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        AutoflowConfiguration configuration = builder.configuration != null
                ? builder.configuration : new AutoflowConfiguration(new Properties());
        this.conflictRetryLimit = configuration.getConflictRetryLimit();
        this.shutdownTimeoutMs = configuration.getShutdownTimeoutMs();
        this.autoDrive = builder.autoDrive;
        this.workers = Executors.newFixedThreadPool(configuration.getWorkerThreads(), threadFactory("autoflow-worker"));
        this.stepInvoker = Executors.newFixedThreadPool(configuration.getStepThreads(), threadFactory("autoflow-step"));
        this.retryTimer = Executors.newSingleThreadScheduledExecutor(threadFactory("autoflow-retry"));
        logger.info("Workflow engine started ({} workers, {} step threads, autoDrive={})",
                configuration.getWorkerThreads(), configuration.getStepThreads(), autoDrive);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String start(WorkflowSnapshot snapshot, Map<String, Object> inputData, TriggerType triggerType,
                        String triggeredBy) throws DefinitionValidationException {
        if (shutdown) {
            throw new IllegalStateException("Workflow engine is shut down");
        }
        CompiledWorkflow workflow = compiler.compile(snapshot);
        CompiledStep first = workflow.firstStep();
        Instant now = clock.instant();
        String executionId = UUID.randomUUID().toString();

        WorkflowExecution pending = store.insertExecution(WorkflowExecution.builder()
                .id(executionId)
                .definitionId(snapshot.definitionId())
                .accountId(snapshot.accountId())
                .triggerType(triggerType != null ? triggerType : TriggerType.MANUAL)
                .triggeredBy(triggeredBy)
                .snapshot(snapshot)
                .status(ExecutionStatus.PENDING)
                .currentStepId(first.id())
                .currentStepIndex(first.index())
                .totalSteps(snapshot.steps().size())
                .maxRetries(snapshot.settings().maxRetries())
                .inputData(inputData)
                .createdAt(now)
                .updatedAt(now)
                .build());
        compiledRuns.put(executionId, workflow);

        ExecutionLocks.Held lock = locks.acquire(executionId);
        try {
            save(pending.transitionTo(ExecutionStatus.RUNNING, now).startedAt(now).build());
        } catch (ConcurrencyConflictException | InvalidTransitionException e) {
            logger.warn("Execution {} left PENDING for recovery: {}", executionId, e.getMessage());
        } finally {
            lock.unlock();
        }

        activeRuns.add(executionId);
        metrics.recordWorkflowStarted(snapshot.name(), pending.getTriggerType().name());
        logger.info("Started execution {} of workflow {} v{} ({} triggered by {})", executionId,
                snapshot.definitionId(), snapshot.version(), pending.getTriggerType(), triggeredBy);
        submitDrive(executionId);
        return executionId;
    }

    @Override
    public ExecutionStatus advance(String executionId) throws WorkflowNotFoundException {
        AdvanceResult result = advanceWithRetry(executionId);
        if (result.status() == ExecutionStatus.RUNNING) {
            submitDrive(executionId);
        }
        return result.status();
    }

    @Override
    public boolean complete(String executionId, Map<String, Object> output) throws WorkflowNotFoundException {
        return withConflictRetry(executionId, () -> {
            WorkflowExecution execution = load(executionId);
            if (execution.isTerminal()) {
                return false;
            }
            Instant now = clock.instant();
            WorkflowExecution running = resumeForCompletion(execution, now);
            finish(running.transitionTo(ExecutionStatus.COMPLETED, now)
                    .output(output != null ? output : running.getContext())
                    .build());
            return true;
        });
    }

    @Override
    public boolean cancel(String executionId) throws WorkflowNotFoundException {
        return withConflictRetry(executionId, () -> {
            WorkflowExecution execution = load(executionId);
            if (execution.isTerminal()) {
                return false;
            }
            Instant now = clock.instant();
            finish(execution.transitionTo(ExecutionStatus.CANCELLED, now)
                    .errorMessage("Cancelled while " + execution.getStatus() + " at step " + execution.getCurrentStepId())
                    .build());
            logger.info("Cancelled execution {}{}", executionId,
                    inFlight.contains(executionId) ? "; the step in flight will be discarded" : "");
            return true;
        });
    }

    @Override
    public String rerun(String executionId) throws WorkflowNotFoundException, DefinitionValidationException {
        WorkflowExecution previous = load(executionId);
        if (!RERUNNABLE_STATUSES.contains(previous.getStatus())) {
            throw new IllegalStateException("Execution " + executionId + " is " + previous.getStatus()
                    + "; only FAILED or CANCELLED runs can be rerun");
        }
        WorkflowDefinition definition = definitions.require(previous.getDefinitionId());
        if (definition.getStatus() == DefinitionStatus.ARCHIVED) {
            throw new IllegalStateException("Workflow " + definition.getId() + " is archived");
        }
        String rerunId = start(definition.snapshot(), previous.getInputData(), previous.getTriggerType(),
                previous.getTriggeredBy());
        logger.info("Execution {} reruns {} ({})", rerunId, executionId, previous.getStatus());
        return rerunId;
    }

    @Override
    public Optional<WorkflowExecution> getExecution(String executionId) {
        return store.findExecution(executionId);
    }

    @Override
    public Optional<ExecutionProgress> getProgress(String executionId) {
        return store.findExecution(executionId).map(e -> ExecutionProgress.of(e, clock.instant()));
    }

    @Override
    public List<WorkflowExecution> listExecutions(String definitionId) {
        return store.listExecutions(definitionId);
    }

    @Override
    public List<WorkflowExecution> listExecutions(String definitionId, ExecutionStatus status, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        Set<ExecutionStatus> statuses = status != null ? EnumSet.of(status) : EnumSet.allOf(ExecutionStatus.class);
        return store.findExecutionsByStatus(statuses).stream()
                .filter(e -> definitionId == null || definitionId.equals(e.getDefinitionId()))
                .sorted(Comparator.comparing(WorkflowExecution::getStartedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowStepLog> getStepLogs(String executionId) {
        return store.listStepLogs(executionId);
    }

    @Override
    public int recoverInFlight() {
        List<WorkflowExecution> open = store.findExecutionsByStatus(OPEN_STATUSES);
        Instant now = clock.instant();
        for (WorkflowExecution execution : open) {
            if (activeRuns.add(execution.getId())) {
                metrics.recordWorkflowResumed();
            }
            if (execution.getStatus() == ExecutionStatus.RETRYING && execution.getNextRetryAt() != null
                    && execution.getNextRetryAt().isAfter(now)) {
                scheduleRetry(execution.getId(), Duration.between(now, execution.getNextRetryAt()));
            } else {
                submitDrive(execution.getId());
            }
        }
        if (!open.isEmpty()) {
            logger.info("Recovered {} in-flight execution(s)", open.size());
        }
        return open.size();
    }

    @Override
    public void addListener(ExecutionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    @Override
    public void removeListener(ExecutionListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("Workflow engine shutdown initiated");
        retryTimer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warn("Workers did not finish within {} ms; {} run(s) will resume on recovery",
                        shutdownTimeoutMs, drivers.size());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        stepInvoker.shutdownNow();
        logger.info("Workflow engine shut down");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    int heldLocks() {
        return locks.size();
    }

    // Driving

    private void submitDrive(String executionId) {
        if (!autoDrive || shutdown || !drivers.add(executionId)) {
            return;
        }
        try {
            workers.execute(() -> drive(executionId));
        } catch (RejectedExecutionException e) {
            drivers.remove(executionId);
            logger.debug("Worker pool rejected execution {}; it will resume on recovery", executionId);
        }
    }

    private void drive(String executionId) {
        AdvanceResult result = null;
        try {
            do {
                result = advanceWithRetry(executionId);
            } while (result.progressed() && result.status() == ExecutionStatus.RUNNING && !shutdown);
        } catch (WorkflowNotFoundException e) {
            logger.warn("Execution {} disappeared from the state store", executionId);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure driving execution {}", executionId, e);
        } finally {
            drivers.remove(executionId);
        }
        if (result == null || shutdown) {
            return;
        }
        if (result.status() == ExecutionStatus.RETRYING) {
            // The retry timer may have fired while this driver still held the run.
            store.findExecution(executionId)
                    .filter(e -> e.getStatus() == ExecutionStatus.RETRYING && e.getNextRetryAt() != null)
                    .ifPresent(e -> scheduleRetry(executionId,
                            Duration.between(clock.instant(), e.getNextRetryAt())));
        } else if (result.contended() && !inFlight.contains(executionId)) {
            submitDrive(executionId);
        }
    }

    private void scheduleRetry(String executionId, Duration delay) {
        if (!autoDrive || shutdown) {
            return;
        }
        long delayMs = Math.max(0, delay.toMillis());
        try {
            retryTimer.schedule(() -> submitDrive(executionId), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Retry timer rejected execution {}; it will resume on recovery", executionId);
        }
    }

    private AdvanceResult advanceWithRetry(String executionId) throws WorkflowNotFoundException {
        for (int attempt = 1; ; attempt++) {
            try {
                return advanceOnce(executionId);
            } catch (WorkflowNotFoundException e) {
                throw e;
            } catch (ConcurrencyConflictException e) {
                if (attempt >= conflictRetryLimit) {
                    logger.warn("Giving up advancing execution {} after {} conflicting writes", executionId, attempt);
                    return AdvanceResult.idle(load(executionId).getStatus());
                }
                logger.debug("Conflict advancing execution {} (attempt {}): {}", executionId, attempt, e.getMessage());
            } catch (AutoflowException e) {
                logger.error("Execution {} could not advance: {}", executionId, e.getMessage(), e);
                return AdvanceResult.idle(load(executionId).getStatus());
            }
        }
    }

    private AdvanceResult advanceOnce(String executionId) throws AutoflowException {
        PreparedAttempt prepared;
        ExecutionLocks.Held lock = locks.acquire(executionId);
        try {
            WorkflowExecution execution = load(executionId);
            if (execution.isTerminal()) {
                return AdvanceResult.idle(execution.getStatus());
            }
            if (inFlight.contains(executionId)) {
                return AdvanceResult.contended(execution.getStatus());
            }
            Instant now = clock.instant();
            if (execution.getStatus() == ExecutionStatus.RETRYING) {
                if (execution.getNextRetryAt() != null && now.isBefore(execution.getNextRetryAt())) {
                    return AdvanceResult.idle(ExecutionStatus.RETRYING);
                }
                execution = save(execution.transitionTo(ExecutionStatus.RUNNING, now).nextRetryAt(null).build());
            } else if (execution.getStatus() == ExecutionStatus.PENDING) {
                execution = save(execution.transitionTo(ExecutionStatus.RUNNING, now).startedAt(now).build());
            }

            CompiledWorkflow workflow;
            try {
                workflow = compiled(execution);
            } catch (DefinitionValidationException e) {
                WorkflowExecution failed = finish(execution.transitionTo(ExecutionStatus.FAILED, now)
                        .errorMessage(e.getMessage())
                        .errorCode(ERROR_DEFINITION_INVALID)
                        .build());
                return AdvanceResult.progressed(failed.getStatus());
            }
            CompiledStep step = workflow.step(execution.getCurrentStepId());
            int attempt = execution.getAttemptSequence() + 1;
            StepContext context = new StepContext(executionId, execution.getDefinitionId(), step.id(), attempt,
                    execution.getInputData(), execution.getContext());

            Optional<WorkflowStepLog> recorded = store.findStepLog(WorkflowStepLog.idFor(executionId, attempt));
            if (recorded.isPresent() && recorded.get().isTerminal()) {
                logger.info("Applying recorded outcome of attempt {} ({}) for execution {} without re-invoking",
                        attempt, recorded.get().getStatus(), executionId);
                return AdvanceResult.progressed(applyOutcome(execution, workflow, step, recorded.get()).getStatus());
            }

            WorkflowStepLog running = store.saveStepLog(WorkflowStepLog.builder()
                    .executionId(executionId)
                    .stepId(step.id())
                    .stepType(step.step().type())
                    .stepName(step.step().name())
                    .attempt(attempt)
                    .status(ExecutionStatus.RUNNING)
                    .startedAt(now)
                    .input(context.asMap())
                    .build());
            inFlight.add(executionId);
            prepared = new PreparedAttempt(workflow, step, running, context);
        } finally {
            lock.unlock();
        }

        WorkflowStepLog finished;
        try {
            finished = invoke(prepared);
        } finally {
            inFlight.remove(executionId);
        }

        lock = locks.acquire(executionId);
        try {
            WorkflowExecution execution = load(executionId);
            if (execution.isTerminal() || execution.getAttemptSequence() >= finished.getAttempt()) {
                store.saveStepLog(prepared.log().toBuilder()
                        .output(finished.getOutput())
                        .errorMessage("Result discarded: execution is " + execution.getStatus())
                        .build()
                        .finish(ExecutionStatus.CANCELLED, clock.instant()));
                logger.info("Discarded result of step {} for execution {} ({})",
                        finished.getStepId(), executionId, execution.getStatus());
                return AdvanceResult.progressed(execution.getStatus());
            }
            store.saveStepLog(finished);
            return AdvanceResult.progressed(applyOutcome(execution, prepared.workflow(), prepared.step(), finished).getStatus());
        } finally {
            lock.unlock();
        }
    }

    private WorkflowStepLog invoke(PreparedAttempt prepared) {
        CompiledStep step = prepared.step();
        WorkflowStepLog log = prepared.log();
        StepExecutionException failure;
        Future<StepOutcome> future = null;
        try {
            CountDownLatch started = new CountDownLatch(1);
            future = stepInvoker.submit(() -> {
                started.countDown();
                return step.invoke(prepared.context());
            });
            // The deadline runs from the moment a step thread picks the attempt up.
            if (!started.await(step.timeoutSeconds(), TimeUnit.SECONDS) && future.cancel(false)) {
                failure = StepExecutionException.notStarted(step.id(), step.timeoutSeconds());
            } else {
                StepOutcome outcome = future.get(step.timeoutSeconds(), TimeUnit.SECONDS);
                if (outcome == null) {
                    failure = new StepExecutionException(step.id(), StepExecutionException.STEP_EXECUTION_ERROR,
                            "Step executor returned no outcome");
                } else if (outcome.isSuccess()) {
                    return log.toBuilder()
                            .output(outcome.output())
                            .tokensConsumed(outcome.tokensConsumed())
                            .apiCallsMade(outcome.apiCallsMade())
                            .build()
                            .finish(ExecutionStatus.COMPLETED, clock.instant());
                } else {
                    return log.toBuilder()
                            .output(outcome.output())
                            .errorMessage(outcome.error() != null ? outcome.error() : "Step reported failure")
                            .errorCode(StepExecutionException.STEP_EXECUTION_ERROR)
                            .tokensConsumed(outcome.tokensConsumed())
                            .apiCallsMade(outcome.apiCallsMade())
                            .build()
                            .finish(ExecutionStatus.FAILED, clock.instant());
                }
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            failure = StepExecutionException.timeout(step.id(), step.timeoutSeconds());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            failure = cause instanceof StepExecutionException
                    ? (StepExecutionException) cause
                    : new StepExecutionException(step.id(), StepExecutionException.STEP_EXECUTION_ERROR,
                            cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            failure = new StepExecutionException(step.id(), StepExecutionException.STEP_EXECUTION_ERROR,
                    "Interrupted while waiting for the step", e);
        } catch (RejectedExecutionException e) {
            failure = new StepExecutionException(step.id(), StepExecutionException.STEP_EXECUTION_ERROR,
                    "Step could not be scheduled: engine is shutting down", e);
        }

        logger.warn("Step {} of execution {} failed on attempt {}: {}", step.id(), log.getExecutionId(),
                log.getAttempt(), failure.getMessage());
        return log.toBuilder()
                .errorMessage(failure.getMessage())
                .errorCode(failure.getErrorCode())
                .build()
                .finish(ExecutionStatus.FAILED, clock.instant());
    }

    // Routing (callers hold the execution lock)

    private WorkflowExecution applyOutcome(WorkflowExecution execution, CompiledWorkflow workflow,
                                           CompiledStep step, WorkflowStepLog log) throws AutoflowException {
        Instant now = clock.instant();
        String workflowName = workflow.snapshot().name();
        WorkflowExecution recorded = execution.toBuilder()
                .attemptSequence(log.getAttempt())
                .addStepResult(StepResult.from(log))
                .updatedAt(now)
                .build();

        if (log.getStatus() == ExecutionStatus.COMPLETED) {
            metrics.recordStepExecuted(workflowName, step.step().type(), log.getDurationMs());
            WorkflowExecution withOutput = recorded.toBuilder().putContext(step.id(), log.getOutput()).build();
            return route(withOutput, workflow, step.successTarget(), now,
                    "Workflow routed to " + WorkflowStep.FAIL + " after step " + step.id());
        }

        metrics.recordStepFailed(workflowName, step.step().type(), log.getErrorCode(), log.getDurationMs());
        if (execution.getRetryCount() < execution.getMaxRetries()) {
            long delaySeconds = workflow.snapshot().settings().retryDelayFor(execution.getRetryCount());
            WorkflowExecution retrying = save(recorded.transitionTo(ExecutionStatus.RETRYING, now)
                    .retryCount(execution.getRetryCount() + 1)
                    .nextRetryAt(now.plusSeconds(delaySeconds))
                    .errorMessage(log.getErrorMessage())
                    .errorCode(log.getErrorCode())
                    .build());
            metrics.recordStepRetried(workflowName, step.step().type());
            logger.info("Execution {} will retry step {} in {}s (retry {}/{})", execution.getId(), step.id(),
                    delaySeconds, retrying.getRetryCount(), retrying.getMaxRetries());
            scheduleRetry(execution.getId(), Duration.ofSeconds(delaySeconds));
            return retrying;
        }

        RetryBudgetExceededException exhausted = new RetryBudgetExceededException(step.id(),
                execution.getRetryCount() + 1, log.getErrorMessage());
        if (step.step().hasExplicitFailureRoute()) {
            logger.info("Execution {} follows on_failure edge {} -> {} ({})", execution.getId(), step.id(),
                    step.failureTarget(), exhausted.getMessage());
            return route(recorded, workflow, step.failureTarget(), now, exhausted.getMessage());
        }
        return finish(recorded.transitionTo(ExecutionStatus.FAILED, now)
                .errorMessage(exhausted.getMessage())
                .errorCode(exhausted.getErrorCode())
                .build());
    }

    private WorkflowExecution route(WorkflowExecution execution, CompiledWorkflow workflow, String target,
                                    Instant now, String failMessage) throws AutoflowException {
        if (WorkflowStep.END.equals(target)) {
            return finish(execution.transitionTo(ExecutionStatus.COMPLETED, now)
                    .output(execution.getContext())
                    .errorMessage(null)
                    .errorCode(null)
                    .build());
        }
        if (WorkflowStep.FAIL.equals(target)) {
            return finish(execution.transitionTo(ExecutionStatus.FAILED, now)
                    .errorMessage(failMessage)
                    .errorCode(ERROR_ROUTED_TO_FAIL)
                    .build());
        }
        CompiledStep next = workflow.step(target);
        return save(execution.transitionTo(ExecutionStatus.RUNNING, now)
                .currentStepId(next.id())
                .currentStepIndex(next.index())
                .retryCount(0)
                .nextRetryAt(null)
                .errorMessage(null)
                .errorCode(null)
                .build());
    }

    private WorkflowExecution finish(WorkflowExecution terminal) throws ConcurrencyConflictException {
        WorkflowExecution saved = save(terminal);
        String executionId = saved.getId();
        compiledRuns.remove(executionId);

        try {
            definitions.recordExecutionOutcome(saved.getDefinitionId(), saved.getStatus(), saved.getCompletedAt());
        } catch (WorkflowNotFoundException e) {
            logger.warn("Definition {} of execution {} no longer exists; counters not updated",
                    saved.getDefinitionId(), executionId);
        }

        if (!activeRuns.remove(executionId)) {
            metrics.recordWorkflowResumed();
        }
        String workflowName = saved.getSnapshot() != null ? saved.getSnapshot().name() : saved.getDefinitionId();
        double seconds = saved.getDuration() != null ? saved.getDuration().toMillis() / 1000.0 : 0.0;
        switch (saved.getStatus()) {
            case COMPLETED -> metrics.recordWorkflowCompleted(workflowName, seconds);
            case FAILED -> metrics.recordWorkflowFailed(workflowName, saved.getErrorCode(), seconds);
            case CANCELLED -> metrics.recordWorkflowCancelled(workflowName);
            default -> throw new IllegalStateException("Not a terminal status: " + saved.getStatus());
        }
        logger.info("Execution {} finished {} after {} attempt(s){}", executionId, saved.getStatus(),
                saved.getAttemptSequence(), saved.getErrorMessage() != null ? ": " + saved.getErrorMessage() : "");

        for (ExecutionListener listener : listeners) {
            try {
                listener.onExecutionFinished(saved);
            } catch (RuntimeException e) {
                logger.error("Execution listener {} failed for {}", listener, executionId, e);
            }
        }
        return saved;
    }

    // Helpers

    private WorkflowExecution resumeForCompletion(WorkflowExecution execution, Instant now)
            throws InvalidTransitionException {
        if (execution.getStatus() == ExecutionStatus.RUNNING) {
            return execution;
        }
        WorkflowExecution.Builder running = execution.transitionTo(ExecutionStatus.RUNNING, now).nextRetryAt(null);
        if (execution.getStartedAt() == null) {
            running.startedAt(now);
        }
        return running.build();
    }

    private CompiledWorkflow compiled(WorkflowExecution execution) throws DefinitionValidationException {
        CompiledWorkflow workflow = compiledRuns.get(execution.getId());
        if (workflow == null) {
            workflow = compiler.compile(execution.getSnapshot());
            compiledRuns.put(execution.getId(), workflow);
        }
        return workflow;
    }

    private WorkflowExecution load(String executionId) throws WorkflowNotFoundException {
        return store.findExecution(executionId)
                .orElseThrow(() -> new WorkflowNotFoundException("WorkflowExecution", executionId));
    }

    private WorkflowExecution save(WorkflowExecution execution) throws ConcurrencyConflictException {
        return store.updateExecution(execution);
    }

    @FunctionalInterface
    private interface LockedAction<T> {
        T run() throws AutoflowException;
    }

    private <T> T withConflictRetry(String executionId, LockedAction<T> action) throws WorkflowNotFoundException {
        for (int attempt = 1; ; attempt++) {
            ExecutionLocks.Held lock = locks.acquire(executionId);
            try {
                return action.run();
            } catch (WorkflowNotFoundException e) {
                throw e;
            } catch (ConcurrencyConflictException e) {
                if (attempt >= conflictRetryLimit) {
                    throw new IllegalStateException("Execution " + executionId + " kept changing concurrently", e);
                }
            } catch (AutoflowException e) {
                throw new IllegalStateException("Execution " + executionId + " is in an unexpected state", e);
            } finally {
                lock.unlock();
            }
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record PreparedAttempt(CompiledWorkflow workflow, CompiledStep step, WorkflowStepLog log,
                                   StepContext context) {
    }

    /**
     * @param contended another caller held the step in flight, so nothing was done
     */
    private record AdvanceResult(ExecutionStatus status, boolean progressed, boolean contended) {

        static AdvanceResult idle(ExecutionStatus status) {
            return new AdvanceResult(status, false, false);
        }

        static AdvanceResult contended(ExecutionStatus status) {
            return new AdvanceResult(status, false, true);
        }

        static AdvanceResult progressed(ExecutionStatus status) {
            return new AdvanceResult(status, true, false);
        }
    }

    public static class Builder {
        private WorkflowStateStore stateStore;
        private WorkflowDefinitionStore definitionStore;
        private WorkflowCompiler compiler;
        private WorkflowMetrics metrics;
        private Clock clock;
        private AutoflowConfiguration configuration;
        private boolean autoDrive = true;

        public Builder stateStore(WorkflowStateStore stateStore) { this.stateStore = stateStore; return this; }
        public Builder definitionStore(WorkflowDefinitionStore definitionStore) { this.definitionStore = definitionStore; return this; }
        public Builder compiler(WorkflowCompiler compiler) { this.compiler = compiler; return this; }
        public Builder metrics(WorkflowMetrics metrics) { this.metrics = metrics; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder configuration(AutoflowConfiguration configuration) { this.configuration = configuration; return this; }
        public Builder autoDrive(boolean autoDrive) { this.autoDrive = autoDrive; return this; }

        public DurableWorkflowEngine build() {
            return new DurableWorkflowEngine(this);
        }
    }
}
