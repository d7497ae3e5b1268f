package com.narrative.sge.engine;

import com.narrative.sge.api.NodeResult;
import com.narrative.sge.api.StoryEvent;
import com.narrative.sge.api.TraversalListener;
import com.narrative.sge.api.TraversalState;
import com.narrative.sge.graph.StoryGraph;
import com.narrative.sge.graph.StoryNode;
import com.narrative.sge.util.CompositeTraversalListener;

import java.time.Duration;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

import lombok.extern.log4j.Log4j2;

/**
 * Drives one traversal run through a story graph.
 *
 * The engine is an explicit state machine advanced by the host through
 * {@link #tick()}. It never blocks and never spawns threads: every suspension
 * is a {@link Suspension} record that later ticks inspect.
 *
 * Step, while RUNNING:
 * 1. Enter: clear temp data, make the node current (pushing the previous one
 * onto the history), run its enter hook, fire node-entered. A breakpoint node
 * in debug mode pauses here; resume continues with step 2 for the same node.
 * 2. Execute: the node returns a {@link NodeResult}.
 * 3. Apply: CONTINUE proceeds to step 4. WAIT, WAIT_FOR_CONDITION and
 * WAIT_FOR_INPUT store a suspension and leave RUNNING. END runs the exit hook
 * and completes the run with success.
 * 4. Exit: exit hook, node-exited.
 * 5. Follow the chosen port through the {@link GraphLookupCache}. No
 * connection ends the run with success = {@code context.isComplete()}.
 *
 * A chain of continuing nodes runs within one call, up to
 * {@code maxStepsPerTick} executions; the remainder continues on the next
 * tick. Cycles are legal and have no depth limit.
 *
 * Inputs ({@link #sendInput()}, {@link #selectChoice(int)},
 * {@link #selectPort(String)}) resolve a WAITING_FOR_INPUT suspension
 * synchronously. Timeouts only fire from {@link #tick()}, so a selection that
 * arrives before the tick that observes an expired deadline always wins.
 *
 * Every transition that abandons the current visit (stop, jump, completion,
 * failure) increments the run generation. Code that invokes callbacks compares
 * the generation afterwards, so a listener that stops or redirects the run
 * from inside a callback is honoured and the interrupted step is dropped.
 *
 * Runtime problems (no start node, unknown jump target, invalid selection) are
 * reported through {@link TraversalListener#onError(String)}. A node that throws
 * ends the run with success = false. Nothing propagates out of {@link #tick()}.
 *
 * Not thread-safe: one thread drives an engine. Engines may share a graph and
 * its lookup cache.
 */
@Log4j2
public final class TraversalEngine {
    private final String id;
    private final EngineConfig config;
    private final LongSupplier clock;
    private final CompositeTraversalListener listeners = new CompositeTraversalListener();
    private Consumer<StoryEvent> eventSink = e -> log.debug("No handler for story event {}", e.name());

    private StoryGraph graph;
    private GraphLookupCache cache;
    private ExecutionContext context;

    private TraversalState state = TraversalState.IDLE;
    private TraversalState resumeState;
    private long pausedAt;

    private StoryNode current;
    // True between the current node's enter hook and its exit hook.
    private boolean entered;
    private Suspension suspension;
    private Input pendingInput;
    private long generation;
    private boolean stepping;
    private long executedSteps;

    public TraversalEngine() {
        this(EngineConfig.defaults());
    }

    public TraversalEngine(EngineConfig config) {
        this(UUID.randomUUID().toString(), config);
    }

    public TraversalEngine(String id, EngineConfig config) {
        this.id = id;
        this.config = config;
        this.clock = config.getClock();
        if (config.getMaxStepsPerTick() < 1)
            throw new IllegalArgumentException("maxStepsPerTick must be positive: " + config.getMaxStepsPerTick());
    }

    // ---- Listeners ----

    public void addListener(TraversalListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(TraversalListener listener) {
        return listeners.remove(listener);
    }

    /** Receives events raised by Event and Audio nodes. */
    public void setEventSink(Consumer<StoryEvent> sink) {
        this.eventSink = sink;
    }

    // ---- Starting ----

    public boolean play(StoryGraph graph) {
        return play(graph, null);
    }

    /**
     * Starts a run at {@code startNodeId}, or at the graph's Start node when it
     * is null, and runs until the first suspension.
     *
     * @return false if the graph or start node could not be resolved; the
     *         problem has been reported through onError
     */
    public boolean play(StoryGraph graph, String startNodeId) {
        if (graph == null) {
            reportError("Cannot play: no graph given");
            return false;
        }
        return play(GraphLookupCache.build(graph), startNodeId);
    }

    /** Starts a run over a prebuilt (possibly shared) lookup cache. */
    public boolean play(GraphLookupCache cache, String startNodeId) {
        if (cache == null) {
            reportError("Cannot play: no graph given");
            return false;
        }
        StoryGraph g = cache.graph();
        if (cache.isStale())
            log.warn("Lookup cache for graph {} is stale; rebuild it after editing the graph", g.id());
        StoryNode start = startNodeId == null ? cache.getStartNode() : cache.getNode(startNodeId);
        if (start == null) {
            reportError(startNodeId == null
                    ? "Graph '" + g.name() + "' (" + g.id() + ") has no Start node"
                    : "Start node " + startNodeId + " not found in graph '" + g.name() + "'");
            return false;
        }
        if (state.isActive())
            stop();
        this.graph = g;
        this.cache = cache;
        this.context = newContext(g);
        begin(start);
        return true;
    }

    private ExecutionContext newContext(StoryGraph g) {
        ExecutionContext ctx = new ExecutionContext(g, config.getStoreKind().newStore(), config.newRandom());
        ctx.setEventSink(event -> eventSink.accept(event));
        return ctx;
    }

    private void begin(StoryNode start) {
        generation++;
        suspension = null;
        pendingInput = null;
        resumeState = null;
        current = start;
        entered = false;
        state = TraversalState.RUNNING;
        context.setPaused(false);
        log.debug("Engine {} starting graph {} at {}", id, graph.id(), start);
        listeners.onStoryStart(graph);
        runLoop();
    }

    // ---- Driving ----

    /**
     * Advances the run: resolves expired waits, polls conditions, applies
     * selection timeouts and continues yielded chains. Does nothing while
     * idle, paused or complete.
     */
    public void tick() {
        if (stepping || state == TraversalState.IDLE || state == TraversalState.COMPLETE
                || state == TraversalState.PAUSED)
            return;
        try {
            Suspension s = suspension;
            if (s != null && s.generation() != generation) {
                log.debug("Discarding stale suspension of generation {}", s.generation());
                suspension = s = null;
            }
            long now = clock.getAsLong();
            switch (state) {
                case WAITING -> {
                    if (s == null || s.expired(now))
                        advance(current, resumePort(s));
                }
                case WAITING_FOR_CONDITION -> {
                    if (s == null || s.condition().getAsBoolean()) {
                        advance(current, resumePort(s));
                    } else if (s.expired(now)) {
                        log.debug("Condition timed out at {}", current);
                        advance(current, s.timeoutPort() != null ? s.timeoutPort() : s.port());
                    }
                }
                case WAITING_FOR_INPUT -> {
                    if (pendingInput != null) {
                        applyInput();
                    } else if (s != null && s.expired(now) && current instanceof SelectableNode selectable) {
                        log.debug("Selection timed out at {}", current);
                        String port = selectable.selectFallback(context);
                        if (port == null)
                            log.warn("No choice available for timeout fallback at {}", current);
                        advance(current, port);
                    }
                }
                default -> {
                    // RUNNING: continue a yielded chain below
                }
            }
            runLoop();
        } catch (RuntimeException e) {
            failRun(current, e);
        }
    }

    private String resumePort(Suspension s) {
        return current.resumePort(context, s == null ? NodeResult.DEFAULT_PORT : s.port());
    }

    private void runLoop() {
        // Re-entrant calls from callbacks leave the work to the outer loop.
        if (stepping)
            return;
        stepping = true;
        try {
            int budget = config.getMaxStepsPerTick();
            while (state == TraversalState.RUNNING && budget-- > 0)
                step();
            if (state == TraversalState.RUNNING)
                log.debug("Engine {} yielding after {} steps at {}", id, config.getMaxStepsPerTick(), current);
        } finally {
            stepping = false;
        }
    }

    private void step() {
        StoryNode node = current;
        long gen = generation;
        try {
            if (!entered) {
                enter(node);
                if (gen != generation || state != TraversalState.RUNNING)
                    return;
                if (config.isDebugMode() && node.isBreakpoint()) {
                    log.info("Breakpoint hit at {}", node);
                    pauseFrom(TraversalState.RUNNING);
                    return;
                }
            }
            executedSteps++;
            NodeResult result = node.execute(context);
            if (gen != generation || state != TraversalState.RUNNING)
                return;
            apply(node, result == null ? NodeResult.next() : result);
        } catch (RuntimeException e) {
            if (gen == generation)
                failRun(node, e);
            else
                log.error("Node {} failed after its run was redirected", node, e);
        }
    }

    private void enter(StoryNode node) {
        entered = true;
        pendingInput = null;
        context.clearTempData();
        context.setCurrentNode(node);
        node.onEnter(context);
        if (config.isDebugMode())
            log.info("Entered {}", node);
        listeners.onNodeEnter(node);
    }

    private void apply(StoryNode node, NodeResult result) {
        long now = clock.getAsLong();
        switch (result.type()) {
            case CONTINUE -> advance(node, result.portId());
            case WAIT -> suspend(new Suspension(TraversalState.WAITING, result.portId(),
                    now + result.waitTime().toNanos(), null, null, generation));
            case WAIT_FOR_CONDITION -> {
                long deadline = result.timeout() == null ? Suspension.NO_DEADLINE : now + result.timeout().toNanos();
                suspend(new Suspension(TraversalState.WAITING_FOR_CONDITION, result.portId(), deadline,
                        result.condition(), result.timeoutPortId(), generation));
            }
            case WAIT_FOR_INPUT -> {
                long deadline = Suspension.NO_DEADLINE;
                if (node instanceof SelectableNode selectable) {
                    Duration timeout = selectable.selectionTimeout();
                    if (timeout != null && !timeout.isZero() && !timeout.isNegative())
                        deadline = now + timeout.toNanos();
                }
                suspend(new Suspension(TraversalState.WAITING_FOR_INPUT, result.portId(), deadline, null, null,
                        generation));
                // Input submitted by a listener during entry.
                if (pendingInput != null)
                    applyInput();
            }
            case END -> {
                long gen = generation;
                exit(node);
                if (gen != generation)
                    return;
                context.markComplete();
                complete(true);
            }
        }
    }

    private void suspend(Suspension s) {
        suspension = s;
        state = s.kind();
        log.trace("Suspended at {} in {}", current, state);
    }

    /** Leaves {@code node} through {@code port} and moves to the connected node. */
    private void advance(StoryNode node, String port) {
        long gen = generation;
        suspension = null;
        exit(node);
        if (gen != generation)
            return;
        StoryNode next = port == null ? null : cache.getConnectedNode(node.id(), port);
        if (next == null) {
            log.debug("No connection from {} port {}; run ends", node, port);
            complete(context.isComplete());
            return;
        }
        current = next;
        entered = false;
        if (state == TraversalState.PAUSED)
            resumeState = TraversalState.RUNNING;
        else
            state = TraversalState.RUNNING;
    }

    private void exit(StoryNode node) {
        entered = false;
        node.onExit(context);
        listeners.onNodeExit(node);
    }

    private void complete(boolean success) {
        state = TraversalState.COMPLETE;
        generation++;
        suspension = null;
        pendingInput = null;
        resumeState = null;
        context.setPaused(false);
        log.debug("Engine {} finished graph {} (success={}, steps={})", id, graph.id(), success, executedSteps);
        listeners.onStoryEnd(graph, success);
    }

    private void failRun(StoryNode node, RuntimeException e) {
        entered = false;
        state = TraversalState.COMPLETE;
        generation++;
        suspension = null;
        pendingInput = null;
        resumeState = null;
        if (context != null)
            context.setPaused(false);
        String where = node == null ? "engine" : "node '" + node.name() + "' (" + node.id() + ")";
        log.error("Run of graph {} failed in {}", graph == null ? null : graph.id(), where, e);
        listeners.onError("Failure in " + where + ": " + e.getMessage());
        listeners.onStoryEnd(graph, false);
    }

    // ---- Input ----

    /** Resumes a WAITING_FOR_INPUT suspension through the node's declared port. */
    public void sendInput() {
        submit(Input.PROCEED);
    }

    /**
     * Selects the option at {@code presentedIndex} of the current choice, as
     * presented (filtered and possibly shuffled).
     */
    public void selectChoice(int presentedIndex) {
        submit(new Input(Input.Kind.CHOICE, presentedIndex, null));
    }

    /** Resumes a WAITING_FOR_INPUT suspension through an explicit output port. */
    public void selectPort(String portId) {
        submit(new Input(Input.Kind.PORT, -1, portId));
    }

    private void submit(Input input) {
        TraversalState effective = state == TraversalState.PAUSED ? resumeState : state;
        boolean duringEntry = stepping && effective == TraversalState.RUNNING && entered;
        if (effective != TraversalState.WAITING_FOR_INPUT && !duringEntry) {
            reportError("Input ignored: engine is " + state + (current != null ? " at " + current.name() : ""));
            return;
        }
        pendingInput = input;
        if (state == TraversalState.WAITING_FOR_INPUT && !stepping) {
            try {
                applyInput();
                runLoop();
            } catch (RuntimeException e) {
                failRun(current, e);
            }
        }
    }

    private void applyInput() {
        Input input = pendingInput;
        pendingInput = null;
        StoryNode node = current;
        String port;
        switch (input.kind()) {
            case CHOICE -> {
                if (!(node instanceof SelectableNode selectable)) {
                    reportError("Node '" + node.name() + "' does not offer choices");
                    return;
                }
                port = selectable.select(context, input.index());
                if (port == null) {
                    reportError("Invalid choice index " + input.index() + " at node '" + node.name() + "' ("
                            + selectable.presentedCount(context) + " presented)");
                    return;
                }
            }
            case PORT -> {
                if (input.port() == null || node.getOutputPort(input.port()) == null) {
                    reportError("Node '" + node.name() + "' has no output port '" + input.port() + "'");
                    return;
                }
                port = input.port();
            }
            default -> {
                if (node instanceof SelectableNode selectable && selectable.presentedCount(context) > 0) {
                    reportError("Node '" + node.name() + "' is waiting for a choice selection");
                    return;
                }
                port = resumePort(suspension);
            }
        }
        advance(node, port);
    }

    // ---- Control ----

    /**
     * Ends the run. The current node's exit hook runs once if the node was
     * entered and not yet exited, then story-ended fires with success = false.
     * Safe in any suspended state; does nothing when idle or complete.
     */
    public void stop() {
        if (!state.isActive())
            return;
        generation++;
        state = TraversalState.COMPLETE;
        suspension = null;
        pendingInput = null;
        resumeState = null;
        context.setPaused(false);
        if (entered) {
            entered = false;
            try {
                current.onExit(context);
            } catch (RuntimeException e) {
                log.error("Exit hook of {} failed during stop", current, e);
                listeners.onError("Failure in node '" + current.name() + "' exit hook: " + e.getMessage());
            }
            listeners.onNodeExit(current);
        }
        log.debug("Engine {} stopped graph {}", id, graph.id());
        listeners.onStoryEnd(graph, false);
    }

    /**
     * Abandons the current visit and starts a fresh traversal at
     * {@code nodeId} with the same context. Pending suspensions are discarded
     * and no story-ended event fires.
     *
     * @return false if there is no graph or the node does not exist
     */
    public boolean jumpToNode(String nodeId) {
        if (cache == null || context == null) {
            reportError("Cannot jump to " + nodeId + ": no graph has been played");
            return false;
        }
        StoryNode target = cache.getNode(nodeId);
        if (target == null) {
            reportError("Jump target " + nodeId + " not found in graph '" + graph.name() + "'");
            return false;
        }
        long gen = ++generation;
        suspension = null;
        pendingInput = null;
        resumeState = null;
        if (entered && current != null) {
            try {
                exit(current);
            } catch (RuntimeException e) {
                log.error("Exit hook of {} failed during jump", current, e);
                listeners.onError("Failure in node '" + current.name() + "' exit hook: " + e.getMessage());
            }
            if (gen != generation)
                return true;
        }
        log.debug("Engine {} jumping to {}", id, target);
        current = target;
        entered = false;
        state = TraversalState.RUNNING;
        context.setPaused(false);
        runLoop();
        return true;
    }

    /** Freezes the run. Time spent paused does not count toward waits or timeouts. */
    public void pause() {
        if (!state.isActive() || state == TraversalState.PAUSED)
            return;
        pauseFrom(state);
    }

    private void pauseFrom(TraversalState previous) {
        resumeState = previous;
        pausedAt = clock.getAsLong();
        state = TraversalState.PAUSED;
        context.setPaused(true);
        log.debug("Engine {} paused at {}", id, current);
    }

    public void resume() {
        if (state != TraversalState.PAUSED)
            return;
        long pausedFor = clock.getAsLong() - pausedAt;
        if (suspension != null)
            suspension = suspension.postpone(pausedFor);
        state = resumeState;
        resumeState = null;
        context.setPaused(false);
        log.debug("Engine {} resumed in {}", id, state);
        try {
            if (state == TraversalState.WAITING_FOR_INPUT && pendingInput != null && !stepping)
                applyInput();
            runLoop();
        } catch (RuntimeException e) {
            failRun(current, e);
        }
    }

    // ---- Persistence ----

    /** Snapshot of the variables and current node, or null if nothing was played. */
    public StorySnapshot saveState() {
        if (graph == null || context == null)
            return null;
        return new StorySnapshot(graph.id(), current == null ? null : current.id(), context.saveState());
    }

    public boolean loadState(StorySnapshot snapshot, StoryGraph graph) {
        if (graph == null) {
            reportError("Cannot load state: no graph given");
            return false;
        }
        return loadState(snapshot, GraphLookupCache.build(graph));
    }

    /**
     * Replaces the current run with one restored from {@code snapshot}: fresh
     * context, snapshot variables, resumed at the saved node (or the Start node
     * when none was saved).
     */
    public boolean loadState(StorySnapshot snapshot, GraphLookupCache cache) {
        if (snapshot == null || cache == null) {
            reportError("Cannot load state: missing snapshot or graph");
            return false;
        }
        StoryGraph g = cache.graph();
        if (snapshot.graphId() != null && !snapshot.graphId().equals(g.id())) {
            reportError("Snapshot of graph " + snapshot.graphId() + " cannot be loaded into graph " + g.id());
            return false;
        }
        StoryNode resumeAt = snapshot.currentNodeId() == null ? cache.getStartNode()
                : cache.getNode(snapshot.currentNodeId());
        if (resumeAt == null) {
            reportError("Saved node " + snapshot.currentNodeId() + " not found in graph '" + g.name() + "'");
            return false;
        }
        if (state.isActive())
            stop();
        this.graph = g;
        this.cache = cache;
        this.context = newContext(g);
        context.loadState(snapshot.variables());
        begin(resumeAt);
        return true;
    }

    private void reportError(String message) {
        log.warn(message);
        listeners.onError(message);
    }

    // ---- Accessors ----

    public String id() {
        return id;
    }

    public TraversalState state() {
        return state;
    }

    public boolean isRunning() {
        return state.isActive();
    }

    public boolean isWaitingForInput() {
        return state == TraversalState.WAITING_FOR_INPUT;
    }

    public StoryNode currentNode() {
        return current;
    }

    public ExecutionContext context() {
        return context;
    }

    public StoryGraph graph() {
        return graph;
    }

    public GraphLookupCache cache() {
        return cache;
    }

    public EngineConfig config() {
        return config;
    }

    /** Node executions since the engine was created. */
    public long executedSteps() {
        return executedSteps;
    }

    private record Input(Kind kind, int index, String port) {
        static final Input PROCEED = new Input(Kind.PROCEED, -1, null);

        enum Kind {
            PROCEED,
            CHOICE,
            PORT
        }
    }
}
