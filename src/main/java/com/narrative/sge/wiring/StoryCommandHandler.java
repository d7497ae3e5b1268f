package com.narrative.sge.wiring;

import com.lmax.disruptor.EventHandler;
import com.narrative.sge.engine.StorySession;
import com.narrative.sge.engine.TraversalEngine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that applies {@link StoryCommand}s to a
 * {@link StorySession} on the consumer thread.
 *
 * The session and its engines are single-threaded; this handler is the one
 * thread that touches them. Presentation threads publish commands instead of
 * calling the engines directly.
 *
 * Batching: input commands are applied as they arrive, but the session is
 * ticked only once per batch, when {@code endOfBatch} is set. A burst of
 * clicks therefore costs one tick.
 */
public final class StoryCommandHandler implements EventHandler<StoryCommand> {
    private static final Logger log = LogManager.getLogger(StoryCommandHandler.class);

    private final StorySession session;
    private BatchCallback afterBatch;
    private long applied;

    public StoryCommandHandler(StorySession session) {
        this.session = session;
    }

    /** Invoked on the consumer thread after every end-of-batch tick. */
    public void setAfterBatchCallback(BatchCallback cb) {
        this.afterBatch = cb;
    }

    @Override
    public void onEvent(StoryCommand command, long sequence, boolean endOfBatch) {
        try {
            apply(command);
        } catch (RuntimeException e) {
            // Keep the consumer thread alive.
            log.error("Failed to apply {} at sequence {}", command, sequence, e);
        } finally {
            command.clear();
        }

        if (endOfBatch && !session.isClosed()) {
            session.tickAll();
            if (afterBatch != null)
                afterBatch.onBatch(sequence, applied);
        }
    }

    private void apply(StoryCommand command) {
        if (command.type() == null || command.type() == StoryCommand.Type.TICK)
            return;
        TraversalEngine run = command.runId() == null ? session.currentRun() : session.getRun(command.runId());
        if (run == null) {
            log.warn("Dropping {}: no such run", command);
            return;
        }
        switch (command.type()) {
            case SEND_INPUT -> run.sendInput();
            case SELECT_CHOICE -> run.selectChoice(command.index());
            case SELECT_PORT -> run.selectPort(command.target());
            case PAUSE -> run.pause();
            case RESUME -> run.resume();
            case STOP -> run.stop();
            case JUMP -> run.jumpToNode(command.target());
            default -> throw new IllegalStateException("Unhandled command " + command.type());
        }
        applied++;
    }

    public long appliedCount() {
        return applied;
    }

    /** Callback for post-batch actions such as refreshing the presentation. */
    @FunctionalInterface
    public interface BatchCallback {
        /**
         * @param sequence last sequence of the batch
         * @param applied  commands applied since the handler was created
         */
        void onBatch(long sequence, long applied);
    }
}
