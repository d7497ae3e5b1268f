package com.narrative.sge.engine;

import com.narrative.sge.api.StoryCondition;
import com.narrative.sge.api.StoryEvent;
import com.narrative.sge.api.StoryEventHandler;
import com.narrative.sge.api.TraversalListener;
import com.narrative.sge.graph.StoryGraph;
import com.narrative.sge.util.CompositeTraversalListener;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import lombok.extern.log4j.Log4j2;

/**
 * Host-owned registry of graphs and active runs.
 *
 * The host creates one session when its story subsystem starts and closes it
 * when the subsystem shuts down; there is no global instance. A session:
 * - catalogues graphs by id together with their lookup caches, loading
 * unknown ids through an optional graph loader,
 * - starts runs, tracks them until they end, and remembers the most recently
 * started one as the current run,
 * - forwards presentation input to the current run,
 * - routes {@link StoryEvent}s raised by nodes to registered handlers,
 * - attaches session-wide listeners to every run it starts,
 * - ticks, stops, saves and restores runs.
 *
 * Like the engines it owns, a session is driven by a single thread.
 */
@Log4j2
public final class StorySession implements AutoCloseable {
    private final EngineConfig config;
    private final Map<String, GraphLookupCache> catalog = new LinkedHashMap<>();
    private final Map<String, TraversalEngine> activeRuns = new LinkedHashMap<>();
    private final List<StoryEventHandler> handlers = new CopyOnWriteArrayList<>();
    private final CompositeTraversalListener runListeners = new CompositeTraversalListener();
    private Function<String, StoryGraph> graphLoader = graphId -> null;
    private TraversalEngine currentRun;
    private boolean closed;

    public StorySession() {
        this(EngineConfig.defaults());
    }

    public StorySession(EngineConfig config) {
        this.config = config;
    }

    public EngineConfig config() {
        return config;
    }

    // ---- Catalogue ----

    /** Adds or replaces a graph and builds its lookup cache. */
    public GraphLookupCache register(StoryGraph graph) {
        ensureOpen();
        if (graph == null)
            throw new IllegalArgumentException("Graph must not be null");
        GraphLookupCache cache = GraphLookupCache.build(graph);
        catalog.put(graph.id(), cache);
        return cache;
    }

    public boolean unregister(String graphId) {
        return catalog.remove(graphId) != null;
    }

    public void clearCatalog() {
        catalog.clear();
    }

    /** Resolves graphs that are not registered, e.g. from the host's asset store. */
    public void setGraphLoader(Function<String, StoryGraph> loader) {
        this.graphLoader = loader == null ? graphId -> null : loader;
    }

    public StoryGraph getGraph(String graphId) {
        GraphLookupCache cache = lookup(graphId);
        return cache == null ? null : cache.graph();
    }

    public Collection<String> graphIds() {
        return Collections.unmodifiableCollection(new ArrayList<>(catalog.keySet()));
    }

    /**
     * Catalogued cache for {@code graphId}, rebuilt if the graph changed since
     * registration, loaded through the graph loader if unknown.
     */
    private GraphLookupCache lookup(String graphId) {
        if (graphId == null)
            return null;
        GraphLookupCache cache = catalog.get(graphId);
        if (cache != null) {
            if (cache.isStale()) {
                log.debug("Rebuilding stale lookup cache for graph {}", graphId);
                cache = cache.rebuild();
                catalog.put(graphId, cache);
            }
            return cache;
        }
        StoryGraph loaded;
        try {
            loaded = graphLoader.apply(graphId);
        } catch (RuntimeException e) {
            log.error("Graph loader failed for {}", graphId, e);
            return null;
        }
        if (loaded == null)
            return null;
        log.debug("Loaded graph {} through the graph loader", graphId);
        return register(loaded);
    }

    // ---- Runs ----

    public TraversalEngine play(StoryGraph graph) {
        return play(graph, null);
    }

    /**
     * Starts a run of {@code graph}, registering it first if needed.
     *
     * @return the new run, or null if it could not start
     */
    public TraversalEngine play(StoryGraph graph, String startNodeId) {
        ensureOpen();
        if (graph == null) {
            reportError("Cannot play: no graph given");
            return null;
        }
        GraphLookupCache cache = catalog.get(graph.id());
        if (cache == null || cache.graph() != graph || cache.isStale())
            cache = register(graph);
        return start(cache, startNodeId);
    }

    public TraversalEngine play(String graphId) {
        return play(graphId, null);
    }

    /** Starts a run of a catalogued (or loadable) graph; unknown ids are reported as errors. */
    public TraversalEngine play(String graphId, String startNodeId) {
        ensureOpen();
        GraphLookupCache cache = lookup(graphId);
        if (cache == null) {
            reportError("Graph " + graphId + " could not be resolved");
            return null;
        }
        return start(cache, startNodeId);
    }

    private TraversalEngine start(GraphLookupCache cache, String startNodeId) {
        TraversalEngine engine = newEngine();
        activeRuns.put(engine.id(), engine);
        if (!engine.play(cache, startNodeId)) {
            activeRuns.remove(engine.id());
            return null;
        }
        if (engine.isRunning())
            currentRun = engine;
        return engine;
    }

    private TraversalEngine newEngine() {
        TraversalEngine engine = new TraversalEngine(config);
        engine.setEventSink(this::dispatch);
        engine.addListener(runListeners);
        engine.addListener(new TraversalListener() {
            @Override
            public void onStoryEnd(StoryGraph graph, boolean success) {
                finished(engine);
            }
        });
        return engine;
    }

    private void finished(TraversalEngine engine) {
        activeRuns.remove(engine.id());
        if (currentRun == engine)
            currentRun = activeRuns.isEmpty() ? null : activeRuns.values().iterator().next();
    }

    public TraversalEngine currentRun() {
        return currentRun;
    }

    public TraversalEngine getRun(String runId) {
        return activeRuns.get(runId);
    }

    public Collection<TraversalEngine> activeRuns() {
        return Collections.unmodifiableCollection(new ArrayList<>(activeRuns.values()));
    }

    /** Ticks every active run once. */
    public void tickAll() {
        for (TraversalEngine engine : activeRuns.values().toArray(new TraversalEngine[0]))
            engine.tick();
    }

    public void stopAll() {
        for (TraversalEngine engine : activeRuns.values().toArray(new TraversalEngine[0]))
            engine.stop();
        activeRuns.clear();
        currentRun = null;
    }

    // ---- Input forwarding ----

    public void sendInput() {
        TraversalEngine run = currentRun;
        if (run != null)
            run.sendInput();
        else
            log.debug("sendInput ignored: no current run");
    }

    public void selectChoice(int presentedIndex) {
        TraversalEngine run = currentRun;
        if (run != null)
            run.selectChoice(presentedIndex);
        else
            log.debug("selectChoice ignored: no current run");
    }

    public void selectPort(String portId) {
        TraversalEngine run = currentRun;
        if (run != null)
            run.selectPort(portId);
        else
            log.debug("selectPort ignored: no current run");
    }

    // ---- Events and listeners ----

    public void registerEventHandler(StoryEventHandler handler) {
        if (handler != null && !handlers.contains(handler))
            handlers.add(handler);
    }

    public void unregisterEventHandler(StoryEventHandler handler) {
        handlers.remove(handler);
    }

    /** Delivers {@code event} to every handler that accepts it. */
    public void dispatch(StoryEvent event) {
        int delivered = 0;
        for (StoryEventHandler handler : handlers) {
            try {
                if (handler.canHandle(event)) {
                    handler.handle(event);
                    delivered++;
                }
            } catch (RuntimeException e) {
                log.error("Event handler {} failed on {}", handler, event.name(), e);
            }
        }
        if (delivered == 0)
            log.debug("No handler for story event {} ({})", event.name(), event.category());
    }

    /** Attached to every run started after this call. */
    public void addListener(TraversalListener listener) {
        runListeners.add(listener);
    }

    public boolean removeListener(TraversalListener listener) {
        return runListeners.remove(listener);
    }

    // ---- Persistence ----

    /** Snapshot of the current run, or null when no run is active. */
    public StorySnapshot saveGameState() {
        TraversalEngine run = currentRun;
        return run != null && run.isRunning() ? run.saveState() : null;
    }

    /**
     * Stops every run and restores {@code snapshot} as the current run.
     *
     * @return the restored run, or null if the snapshot could not be loaded
     */
    public TraversalEngine loadGameState(StorySnapshot snapshot) {
        ensureOpen();
        stopAll();
        if (snapshot == null)
            return null;
        GraphLookupCache cache = lookup(snapshot.graphId());
        if (cache == null) {
            reportError("Graph " + snapshot.graphId() + " of the saved state could not be resolved");
            return null;
        }
        TraversalEngine engine = newEngine();
        activeRuns.put(engine.id(), engine);
        if (!engine.loadState(snapshot, cache)) {
            activeRuns.remove(engine.id());
            return null;
        }
        if (engine.isRunning())
            currentRun = engine;
        return engine;
    }

    // ---- Batch evaluation ----

    /**
     * Evaluates {@code conditions} on every active run.
     *
     * @return run id to whether all conditions hold for that run
     */
    public Map<String, Boolean> evaluateAcrossRuns(List<StoryCondition> conditions, boolean parallel) {
        List<TraversalEngine> runs = new ArrayList<>(activeRuns.values());
        List<ExecutionContext> contexts = new ArrayList<>(runs.size());
        for (TraversalEngine run : runs)
            contexts.add(run.context());
        boolean[] results = new ConditionBatch(conditions, parallel).evaluateAll(contexts);
        Map<String, Boolean> byRun = new LinkedHashMap<>();
        for (int i = 0; i < runs.size(); i++)
            byRun.put(runs.get(i).id(), results[i]);
        return byRun;
    }

    // ---- Lifecycle ----

    private void reportError(String message) {
        log.warn(message);
        runListeners.onError(message);
    }

    private void ensureOpen() {
        if (closed)
            throw new IllegalStateException("Story session is closed");
    }

    public boolean isClosed() {
        return closed;
    }

    /** Stops every run and drops all graphs and handlers. */
    @Override
    public void close() {
        if (closed)
            return;
        stopAll();
        handlers.clear();
        catalog.clear();
        closed = true;
        log.debug("Story session closed");
    }
}
