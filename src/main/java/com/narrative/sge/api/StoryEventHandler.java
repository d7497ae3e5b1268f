package com.narrative.sge.api;

/**
 * Host-side consumer of {@link StoryEvent}s, registered with a session.
 */
public interface StoryEventHandler {

    /** Returns true if this handler wants {@code event}. */
    boolean canHandle(StoryEvent event);

    void handle(StoryEvent event);
}
