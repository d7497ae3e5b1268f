package com.narrative.sge.wiring;

import static org.junit.Assert.*;

import com.narrative.sge.api.TraversalState;
import com.narrative.sge.engine.EngineConfig;
import com.narrative.sge.engine.StorySession;
import com.narrative.sge.engine.TestGraphs;
import com.narrative.sge.engine.TraversalEngine;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class StoryCommandBusTest {
    private StorySession session;
    private StoryCommandBus bus;

    @Before
    public void setUp() {
        session = new StorySession(EngineConfig.builder().randomSeed(3L).build());
        bus = new StoryCommandBus(session, 64);
    }

    @After
    public void tearDown() {
        bus.close();
        session.close();
    }

    @Test
    public void testCommandsFromManyThreadsReachTheirRuns() throws Exception {
        int runs = 8;
        TraversalEngine[] engines = new TraversalEngine[runs];
        for (int i = 0; i < runs; i++)
            engines[i] = session.play(TestGraphs.threeChoices());

        AtomicLong appliedSeen = new AtomicLong();
        CountDownLatch done = new CountDownLatch(1);
        bus.handler().setAfterBatchCallback((sequence, applied) -> {
            appliedSeen.set(applied);
            if (applied == runs)
                done.countDown();
        });

        Thread[] producers = new Thread[runs];
        for (int i = 0; i < runs; i++) {
            String runId = engines[i].id();
            int choice = i % 3;
            producers[i] = new Thread(() -> bus.selectChoice(runId, choice));
            producers[i].start();
        }
        for (Thread t : producers)
            t.join();

        assertTrue("applied " + appliedSeen.get(), done.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < runs; i++) {
            assertEquals(TraversalState.COMPLETE, engines[i].state());
            assertEquals("end_" + (i % 3), engines[i].currentNode().id());
        }
    }

    @Test
    public void testTickReachesSession() throws Exception {
        CountDownLatch ticked = new CountDownLatch(1);
        bus.handler().setAfterBatchCallback((sequence, applied) -> ticked.countDown());

        bus.tick();

        assertTrue(ticked.await(5, TimeUnit.SECONDS));
        assertEquals(0, bus.handler().appliedCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRingSizeMustBePowerOfTwo() {
        new StoryCommandBus(session, 100);
    }
}
