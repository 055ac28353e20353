package io.catena.core.supervisor;

import io.catena.core.chain.ChainDefinition;
import io.catena.core.chain.ChainRegistry;
import io.catena.core.chain.step.Step;
import io.catena.core.checkpoint.Checkpoint;
import io.catena.core.checkpoint.CheckpointManager;
import io.catena.core.exception.CatenaException;
import io.catena.core.execution.CancellationToken;
import io.catena.core.execution.ChainRunner;
import io.catena.core.execution.CompositeExecutionListener;
import io.catena.core.execution.ExecutionContext;
import io.catena.core.execution.ExecutionIds;
import io.catena.core.execution.ExecutionListener;
import io.catena.core.execution.ExecutionResult;
import io.catena.core.execution.ExecutionStatus;
import io.catena.core.execution.StepResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Accepts execution requests and runs them on a fixed pool of workers.
///
/// ### Scheduling
/// - {@link #submit} returns the new execution id immediately
/// - at most one execution per trigger id runs at a time; later requests for the same
///   trigger wait in a FIFO queue and start when the running one ends
/// - requests for distinct trigger ids run in parallel up to the pool size; excess work
///   queues in the pool
///
/// ### Contracts
/// - **Contained**: an exception escaping a run becomes a `FAILED` result at the worker
///   boundary; the supervisor keeps serving other executions
/// - **Cancellable**: {@link #cancel} removes a queued execution or signals the token of
///   a running one, which aborts its in-flight step wait
/// - **Recoverable**: {@link #resumeAll} re-enters every resumable checkpoint
///
/// @implNote Thread-safe. Trigger queues are guarded by one lock held only for queue
/// bookkeeping, never while a chain runs.
///
/// @see ChainRunner
/// @see CheckpointManager
public class ExecutionSupervisor implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ExecutionSupervisor.class.getName());

    static final int RETAINED_RESULTS = 1000;

    private final ChainRegistry chains;
    private final ChainRunner runner;
    private final CheckpointManager checkpoints;
    private final List<ExecutionListener> listeners;
    private final Clock clock;
    private final ExecutorService workers;

    private final Map<String, Handle> active = new ConcurrentHashMap<>();
    private final Map<String, Deque<Handle>> waiting = new HashMap<>();
    private final Map<String, Handle> runningByTrigger = new HashMap<>();
    private final ReentrantLock intakeLock = new ReentrantLock();

    private final Map<String, ExecutionResult> results =
            new LinkedHashMap<>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, ExecutionResult> eldest) {
                    return size() > RETAINED_RESULTS;
                }
            };

    /// Creates a supervisor with its own fixed worker pool.
    ///
    /// @param chains registry resolving chain ids, not null
    /// @param runner chain runner, not null
    /// @param checkpoints checkpoint manager used for recovery, not null
    /// @param listeners listeners attached to every top-level run, not null
    /// @param workerPoolSize number of worker threads, positive
    /// @param clock time source, not null
    public ExecutionSupervisor(
            ChainRegistry chains,
            ChainRunner runner,
            CheckpointManager checkpoints,
            List<ExecutionListener> listeners,
            int workerPoolSize,
            Clock clock) {
        this(
                chains,
                runner,
                checkpoints,
                listeners,
                Executors.newFixedThreadPool(workerPoolSize, new WorkerThreadFactory()),
                clock);
    }

    /// Creates a supervisor on a caller-supplied executor.
    ///
    /// @param workers executor running the chains, not null; shut down by {@link #close()}
    public ExecutionSupervisor(
            ChainRegistry chains,
            ChainRunner runner,
            CheckpointManager checkpoints,
            List<ExecutionListener> listeners,
            ExecutorService workers,
            Clock clock) {
        this.chains = Objects.requireNonNull(chains, "chains must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints must not be null");
        this.listeners =
                List.copyOf(Objects.requireNonNull(listeners, "listeners must not be null"));
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Accepts a request and queues it.
    ///
    /// @param request trigger request, not null
    /// @return the new execution id, never null
    /// @throws io.catena.core.exception.ChainNotFoundException if the chain is unknown
    public String submit(ExecutionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        chains.require(request.chainId());

        String executionId = ExecutionIds.generate(clock);
        ExecutionContext context =
                ExecutionContext.create(
                        executionId,
                        request.chainId(),
                        request.triggerId(),
                        request.input(),
                        request.env());
        enqueue(new Handle(context, null, clock.instant()));
        return executionId;
    }

    /// Re-enters every resumable checkpoint.
    ///
    /// Checkpoints that were kept after a cancellation are skipped. Checkpoints that fail
    /// integrity checks, cannot be read, or whose chain is no longer registered are
    /// reported as needing a manual restart and left in place; one bad checkpoint never
    /// stops the others from resuming.
    ///
    /// @return what was resumed, skipped and left behind, never null
    public RecoveryReport resumeAll() {
        List<String> resumed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Map<String, String> manual = new LinkedHashMap<>();

        for (String executionId : checkpoints.list()) {
            if (active.containsKey(executionId)) {
                continue;
            }
            try {
                Optional<Checkpoint> loaded = checkpoints.load(executionId);
                if (loaded.isEmpty()) {
                    continue;
                }
                Checkpoint checkpoint = loaded.get();
                if (!checkpoint.isResumable()) {
                    skipped.add(executionId);
                    continue;
                }
                chains.require(checkpoint.context().getChainId());
                enqueue(new Handle(checkpoint.context(), checkpoint, clock.instant()));
                resumed.add(executionId);
            } catch (CatenaException e) {
                logger.warning(
                        "Execution " + executionId + " needs a manual restart: " + e.getMessage());
                manual.put(executionId, e.getMessage());
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Execution " + executionId + " needs a manual restart",
                        e);
                manual.put(executionId, e.toString());
            }
        }

        logger.info(
                "Recovery resumed "
                        + resumed.size()
                        + ", skipped "
                        + skipped.size()
                        + ", left "
                        + manual.size()
                        + " for manual restart");
        return new RecoveryReport(resumed, skipped, manual);
    }

    /// Cancels a queued or running execution.
    ///
    /// A queued execution ends at once: listeners see `started` followed by the cancelled
    /// terminal callback, so every event stream opens with `started`. A running execution
    /// stops at its next step boundary.
    ///
    /// @param executionId execution to cancel, not null
    /// @param reason reason recorded on the result, not null
    /// @return true if the execution was queued or running
    public boolean cancel(String executionId, String reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        Handle handle = active.get(executionId);
        if (handle == null) {
            return false;
        }

        boolean dequeued;
        intakeLock.lock();
        try {
            Deque<Handle> queue = waiting.get(handle.context.getTriggerId());
            dequeued = queue != null && queue.remove(handle);
            if (queue != null && queue.isEmpty()) {
                waiting.remove(handle.context.getTriggerId());
            }
        } finally {
            intakeLock.unlock();
        }

        handle.token.cancel(reason);
        if (dequeued) {
            ExecutionListener listener = listenerFor(handle);
            Optional<ChainDefinition> chain = chains.find(handle.context.getChainId());
            if (chain.isPresent()) {
                listener.onExecutionStarted(handle.context, chain.get(), 0);
            }
            Instant now = clock.instant();
            List<StepResult> prior =
                    handle.checkpoint != null ? handle.checkpoint.results() : List.of();
            ExecutionResult result =
                    ExecutionResult.ended(
                            executionId,
                            handle.context.getChainId(),
                            ExecutionStatus.CANCELLED,
                            prior,
                            now,
                            now,
                            "Execution cancelled: " + reason,
                            ExecutionStatus.CANCELLED.wireName());
            listener.onExecutionCompleted(result);
            complete(handle, result);
        }
        logger.info("Cancel requested for execution " + executionId + ": " + reason);
        return true;
    }

    /// Lists queued and running executions, oldest first.
    ///
    /// @return summaries, never null
    public List<ExecutionSummary> list() {
        return active.values().stream()
                .map(Handle::summary)
                .sorted(Comparator.comparing(ExecutionSummary::submittedAt))
                .toList();
    }

    /// Returns the summary of a queued or running execution.
    ///
    /// @param executionId execution id, not null
    /// @return summary, empty once the execution ended or if unknown
    public Optional<ExecutionSummary> inspect(String executionId) {
        return Optional.ofNullable(active.get(executionId)).map(Handle::summary);
    }

    /// Returns the final result of a recently ended execution.
    ///
    /// @param executionId execution id, not null
    /// @return result, empty while the execution is active or once it aged out
    public Optional<ExecutionResult> result(String executionId) {
        synchronized (results) {
            return Optional.ofNullable(results.get(executionId));
        }
    }

    /// Waits for an execution to end.
    ///
    /// @param executionId execution id, not null
    /// @param timeout maximum wait, not null
    /// @return the final result, empty if the id is unknown
    /// @throws TimeoutException if the execution is still active after `timeout`
    /// @throws InterruptedException if the calling thread is interrupted
    public Optional<ExecutionResult> awaitResult(String executionId, Duration timeout)
            throws InterruptedException, TimeoutException {
        Handle handle = active.get(executionId);
        if (handle == null) {
            return result(executionId);
        }
        try {
            return Optional.of(handle.done.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Execution " + executionId + " future failed", e);
        }
    }

    /// Shuts the worker pool down. Running executions finish their current run.
    @Override
    public void close() {
        workers.shutdown();
    }

    private void enqueue(Handle handle) {
        active.put(handle.context.getExecutionId(), handle);
        String triggerId = handle.context.getTriggerId();
        boolean startNow;
        intakeLock.lock();
        try {
            startNow = !runningByTrigger.containsKey(triggerId);
            if (startNow) {
                runningByTrigger.put(triggerId, handle);
            } else {
                waiting.computeIfAbsent(triggerId, id -> new ArrayDeque<>()).addLast(handle);
            }
        } finally {
            intakeLock.unlock();
        }

        if (startNow) {
            dispatch(handle);
        } else {
            logger.fine(
                    "Execution "
                            + handle.context.getExecutionId()
                            + " queued behind trigger "
                            + triggerId);
        }
    }

    private void dispatch(Handle handle) {
        workers.execute(() -> runOnWorker(handle));
    }

    private void runOnWorker(Handle handle) {
        handle.startedAt = clock.instant();
        ExecutionListener listener = listenerFor(handle);
        ExecutionResult result = null;
        try {
            ChainDefinition chain = chains.require(handle.context.getChainId());
            if (handle.checkpoint != null) {
                result =
                        runner.resume(
                                chain,
                                handle.context,
                                handle.checkpoint.nextIndex(),
                                handle.checkpoint.results(),
                                handle.token,
                                listener);
            } else {
                result = runner.run(chain, handle.context, handle.token, listener);
            }
        } catch (CatenaException e) {
            result = boundaryFailure(handle, e.getMessage(), e.errorType());
            listener.onExecutionCompleted(result);
        } catch (RuntimeException e) {
            logger.log(
                    Level.SEVERE,
                    "Execution " + handle.context.getExecutionId() + " failed at worker boundary",
                    e);
            result = boundaryFailure(handle, e.toString(), "internal");
            listener.onExecutionCompleted(result);
        } finally {
            // an Error escaped the runner; the trigger queue must still move on
            if (result == null) {
                result = boundaryFailure(handle, "Worker aborted", "internal");
            }
            complete(handle, result);
            startNext(handle.context.getTriggerId());
        }
    }

    private ExecutionResult boundaryFailure(Handle handle, String error, String errorType) {
        Instant startedAt = handle.startedAt != null ? handle.startedAt : clock.instant();
        return ExecutionResult.ended(
                handle.context.getExecutionId(),
                handle.context.getChainId(),
                ExecutionStatus.FAILED,
                List.of(),
                startedAt,
                clock.instant(),
                error,
                errorType);
    }

    private void complete(Handle handle, ExecutionResult result) {
        synchronized (results) {
            results.put(result.executionId(), result);
        }
        active.remove(handle.context.getExecutionId());
        handle.done.complete(result);
    }

    private void startNext(String triggerId) {
        Handle next;
        intakeLock.lock();
        try {
            Deque<Handle> queue = waiting.get(triggerId);
            next = queue != null ? queue.pollFirst() : null;
            if (queue != null && queue.isEmpty()) {
                waiting.remove(triggerId);
            }
            if (next != null) {
                runningByTrigger.put(triggerId, next);
            } else {
                runningByTrigger.remove(triggerId);
            }
        } finally {
            intakeLock.unlock();
        }
        if (next != null) {
            dispatch(next);
        }
    }

    private ExecutionListener listenerFor(Handle handle) {
        List<ExecutionListener> all = new ArrayList<>(listeners.size() + 1);
        all.add(handle.tracker());
        all.addAll(listeners);
        return new CompositeExecutionListener(all);
    }

    /// Mutable bookkeeping of one accepted execution.
    private static final class Handle {
        final ExecutionContext context;
        final Checkpoint checkpoint;
        final Instant submittedAt;
        final CancellationToken token = new CancellationToken();
        final CompletableFuture<ExecutionResult> done = new CompletableFuture<>();
        final AtomicInteger completedSteps;
        volatile Instant startedAt;
        volatile String currentStepId;

        Handle(ExecutionContext context, Checkpoint checkpoint, Instant submittedAt) {
            this.context = context;
            this.checkpoint = checkpoint;
            this.submittedAt = submittedAt;
            this.completedSteps =
                    new AtomicInteger(checkpoint != null ? checkpoint.results().size() : 0);
        }

        ExecutionSummary summary() {
            return new ExecutionSummary(
                    context.getExecutionId(),
                    context.getChainId(),
                    context.getTriggerId(),
                    startedAt != null ? ExecutionStatus.RUNNING : ExecutionStatus.PENDING,
                    submittedAt,
                    startedAt,
                    currentStepId,
                    completedSteps.get(),
                    checkpoint != null);
        }

        ExecutionListener tracker() {
            return new ExecutionListener() {
                @Override
                public void onStepStarted(ExecutionContext ctx, Step step) {
                    currentStepId = step.getId();
                }

                @Override
                public void onStepCompleted(ExecutionContext ctx, StepResult result) {
                    currentStepId = null;
                    completedSteps.incrementAndGet();
                }
            };
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "catena-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
