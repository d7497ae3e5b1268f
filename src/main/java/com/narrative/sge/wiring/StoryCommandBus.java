package com.narrative.sge.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.narrative.sge.engine.StorySession;

import lombok.extern.log4j.Log4j2;

/**
 * Serialises commands from any number of threads onto one consumer thread
 * that owns the {@link StorySession}.
 *
 * Producers call the publish methods; the consumer applies each command
 * through a {@link StoryCommandHandler}. The ring buffer size must be a power
 * of two.
 */
@Log4j2
public final class StoryCommandBus implements AutoCloseable {
    public static final int DEFAULT_RING_SIZE = 1024;

    private final Disruptor<StoryCommand> disruptor;
    private final RingBuffer<StoryCommand> ringBuffer;
    private final StoryCommandHandler handler;

    public StoryCommandBus(StorySession session) {
        this(session, DEFAULT_RING_SIZE);
    }

    public StoryCommandBus(StorySession session, int ringSize) {
        if (Integer.bitCount(ringSize) != 1)
            throw new IllegalArgumentException("Ring size must be a power of two: " + ringSize);
        this.handler = new StoryCommandHandler(session);
        this.disruptor = new Disruptor<>(
                StoryCommand::new,
                ringSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();
        log.debug("Story command bus started with ring size {}", ringSize);
    }

    public StoryCommandHandler handler() {
        return handler;
    }

    public void tick() {
        publish(StoryCommand.Type.TICK, null, -1, null);
    }

    public void sendInput(String runId) {
        publish(StoryCommand.Type.SEND_INPUT, runId, -1, null);
    }

    public void selectChoice(String runId, int presentedIndex) {
        publish(StoryCommand.Type.SELECT_CHOICE, runId, presentedIndex, null);
    }

    public void selectPort(String runId, String portId) {
        publish(StoryCommand.Type.SELECT_PORT, runId, -1, portId);
    }

    public void pause(String runId) {
        publish(StoryCommand.Type.PAUSE, runId, -1, null);
    }

    public void resume(String runId) {
        publish(StoryCommand.Type.RESUME, runId, -1, null);
    }

    public void stop(String runId) {
        publish(StoryCommand.Type.STOP, runId, -1, null);
    }

    public void jump(String runId, String nodeId) {
        publish(StoryCommand.Type.JUMP, runId, -1, nodeId);
    }

    /** Claims a slot, fills it and publishes it. Blocks while the ring is full. */
    public void publish(StoryCommand.Type type, String runId, int index, String target) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(type, runId, index, target, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /** Waits for published commands to be applied, then stops the consumer thread. */
    @Override
    public void close() {
        disruptor.shutdown();
        log.debug("Story command bus stopped after {} commands", handler.appliedCount());
    }
}
