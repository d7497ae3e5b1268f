package com.narrative.sge.engine;

import static com.narrative.sge.engine.TestGraphs.SECOND;
import static com.narrative.sge.engine.TestGraphs.named;
import static org.junit.Assert.*;

import com.narrative.sge.api.ConditionOperator;
import com.narrative.sge.api.NodeResult;
import com.narrative.sge.api.StoryCondition;
import com.narrative.sge.api.TraversalListener;
import com.narrative.sge.api.TraversalState;
import com.narrative.sge.api.VariableType;
import com.narrative.sge.graph.StoryGraph;
import com.narrative.sge.graph.StoryNode;
import com.narrative.sge.graph.StoryVariable;
import com.narrative.sge.node.BranchNode;
import com.narrative.sge.node.ChoiceNode;
import com.narrative.sge.node.DialogueNode;
import com.narrative.sge.node.EndNode;
import com.narrative.sge.node.SetVariableNode;
import com.narrative.sge.node.StartNode;
import com.narrative.sge.node.VariableOperation;
import com.narrative.sge.node.WaitNode;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.Before;
import org.junit.Test;

public class TraversalEngineTest {

    private AtomicLong clock;
    private RecordingListener recorder;
    private TraversalEngine engine;

    @Before
    public void setUp() {
        clock = new AtomicLong();
        recorder = new RecordingListener();
        engine = new TraversalEngine(TestGraphs.manualClock(clock));
        engine.addListener(recorder);
    }

    private static StoryGraph around(StoryNode middle) {
        StoryGraph g = new StoryGraph("g", "G");
        g.addNode(named(new StartNode("start"), "Start"));
        g.addNode(middle);
        g.addNode(named(new EndNode("end"), "End"));
        g.connect("start", NodeResult.DEFAULT_PORT, middle.id(), StoryNode.INPUT_PORT);
        g.connect(middle.id(), NodeResult.DEFAULT_PORT, "end", StoryNode.INPUT_PORT);
        return g;
    }

    @Test
    public void testLinearRunFiresEventsInOrder() {
        assertTrue(engine.play(TestGraphs.linear()));

        assertEquals(Arrays.asList("start", "enter:Start", "exit:Start", "enter:Dialogue", "exit:Dialogue",
                "enter:End", "exit:End", "end:true"), recorder.events);
        assertEquals(TraversalState.COMPLETE, engine.state());
        assertTrue(engine.context().isComplete());
        assertEquals(3, engine.executedSteps());
    }

    @Test
    public void testHistoryRecordsVisitedNodes() {
        engine.play(TestGraphs.linear());

        ExecutionContext ctx = engine.context();
        assertEquals(2, ctx.historySize());
        assertEquals("line", ctx.popHistory());
        assertEquals("start", ctx.popHistory());
        assertNull(ctx.popHistory());
    }

    @Test
    public void testChoiceTimeoutSelectsDefault() {
        StoryGraph g = TestGraphs.threeChoices();
        ChoiceNode choice = (ChoiceNode) g.getNode("choice");
        choice.setChoiceTimeout(2f);
        choice.setDefaultChoiceIndex(1);

        engine.play(g);
        assertEquals(TraversalState.WAITING_FOR_INPUT, engine.state());

        clock.set(SECOND * 19 / 10);
        engine.tick();
        assertEquals(TraversalState.WAITING_FOR_INPUT, engine.state());

        clock.set(2 * SECOND);
        engine.tick();
        assertEquals(TraversalState.COMPLETE, engine.state());
        assertTrue(recorder.events.contains("enter:End1"));
        assertEquals("end:true", recorder.last());
        assertEquals(1, engine.context().getInt("choice_choice", -1));
    }

    @Test
    public void testTimeoutFallsBackToFirstPresentedWhenDefaultHidden() {
        StoryGraph g = TestGraphs.threeChoices();
        ChoiceNode choice = (ChoiceNode) g.getNode("choice");
        choice.choices().get(0).setConditionVariable("never");
        choice.setChoiceTimeout(1f);
        choice.setDefaultChoiceIndex(0);
        g.addVariable(StoryVariable.ofBool("never", false));

        engine.play(g);
        clock.set(SECOND);
        engine.tick();

        assertTrue(recorder.events.contains("enter:End1"));
    }

    @Test
    public void testSelectionBeforeTimeoutWins() {
        StoryGraph g = TestGraphs.threeChoices();
        ChoiceNode choice = (ChoiceNode) g.getNode("choice");
        choice.setChoiceTimeout(2f);
        choice.setDefaultChoiceIndex(1);

        engine.play(g);
        clock.set(SECOND);
        engine.selectChoice(2);
        assertTrue(recorder.events.contains("enter:End2"));

        clock.set(10 * SECOND);
        engine.tick();
        assertFalse(recorder.events.contains("enter:End1"));
        assertEquals(1, recorder.count("end:true"));
    }

    @Test
    public void testLateSelectionBeatsUnobservedTimeout() {
        StoryGraph g = TestGraphs.threeChoices();
        ((ChoiceNode) g.getNode("choice")).setChoiceTimeout(1f);

        engine.play(g);
        // Deadline passed, but no tick has observed it yet.
        clock.set(5 * SECOND);
        engine.selectChoice(2);

        assertTrue(recorder.events.contains("enter:End2"));
    }

    @Test
    public void testStopWhileWaitingForInputExitsOnce() {
        ScriptedNode scripted = new ScriptedNode("scripted", ctx -> NodeResult.waitForInput());
        engine.play(around(scripted));
        assertEquals(TraversalState.WAITING_FOR_INPUT, engine.state());

        engine.stop();
        engine.stop();
        engine.tick();
        engine.sendInput();

        assertEquals(1, scripted.exits);
        assertEquals(1, recorder.count("end:false"));
        assertEquals(1, recorder.count("exit:scripted"));
        assertEquals(0, recorder.count("enter:End"));
        assertEquals(TraversalState.COMPLETE, engine.state());
    }

    @Test
    public void testStopWhenIdleIsNoOp() {
        engine.stop();
        assertTrue(recorder.events.isEmpty());
        assertEquals(TraversalState.IDLE, engine.state());
    }

    @Test
    public void testConcurrentRunsDoNotShareContext() {
        StoryGraph g = TestGraphs.threeChoices();
        GraphLookupCache cache = GraphLookupCache.build(g);
        TraversalEngine a = new TraversalEngine(TestGraphs.manualClock(clock));
        TraversalEngine b = new TraversalEngine(TestGraphs.manualClock(clock));
        RecordingListener ra = new RecordingListener();
        RecordingListener rb = new RecordingListener();
        a.addListener(ra);
        b.addListener(rb);

        assertTrue(a.play(cache, null));
        assertTrue(b.play(cache, null));
        assertNotSame(a.context(), b.context());

        a.context().setVariable("mood", "happy");
        a.selectChoice(0);
        b.selectChoice(2);

        assertTrue(ra.events.contains("enter:End0"));
        assertTrue(rb.events.contains("enter:End2"));
        assertFalse(ra.events.contains("enter:End2"));
        assertEquals(0, a.context().getInt("choice_choice", -1));
        assertEquals(2, b.context().getInt("choice_choice", -1));
        assertFalse(b.context().hasVariable("mood"));
    }

    @Test
    public void testJumpAbandonsVisitWithoutStoryEnd() {
        engine.play(TestGraphs.threeChoices());
        recorder.clear();

        assertTrue(engine.jumpToNode("end_2"));

        assertEquals(Arrays.asList("exit:Choice", "enter:End2", "exit:End2", "end:true"), recorder.events);
    }

    @Test
    public void testJumpToUnknownNodeLeavesRunUntouched() {
        engine.play(TestGraphs.threeChoices());

        assertFalse(engine.jumpToNode("nowhere"));

        assertEquals(1, recorder.errors.size());
        assertEquals(TraversalState.WAITING_FOR_INPUT, engine.state());
        assertEquals("choice", engine.currentNode().id());
        engine.selectChoice(0);
        assertTrue(recorder.events.contains("enter:End0"));
    }

    @Test
    public void testJumpDiscardsPendingWait() {
        WaitNode wait = named(new WaitNode("wait"), "Wait");
        wait.setWaitTime(5f);
        StoryGraph g = around(wait);
        g.addNode(named(new EndNode("other"), "Other"));

        engine.play(g);
        assertEquals(TraversalState.WAITING, engine.state());
        engine.jumpToNode("other");

        clock.set(10 * SECOND);
        engine.tick();
        assertEquals(0, recorder.count("enter:End"));
        assertEquals(1, recorder.count("enter:Other"));
    }

    @Test
    public void testPauseExtendsWaitDeadline() {
        WaitNode wait = named(new WaitNode("wait"), "Wait");
        wait.setWaitTime(2f);
        engine.play(around(wait));

        clock.set(SECOND);
        engine.pause();
        assertEquals(TraversalState.PAUSED, engine.state());
        assertTrue(engine.context().isPaused());

        clock.set(5 * SECOND);
        engine.tick();
        assertEquals(TraversalState.PAUSED, engine.state());

        engine.resume();
        engine.tick();
        assertEquals(TraversalState.WAITING, engine.state());

        clock.set(6 * SECOND);
        engine.tick();
        assertEquals(TraversalState.COMPLETE, engine.state());
    }

    @Test
    public void testInputWhilePausedAppliesOnResume() {
        engine.play(TestGraphs.threeChoices());
        engine.pause();

        engine.selectChoice(1);
        assertFalse(recorder.events.contains("enter:End1"));

        engine.resume();
        assertTrue(recorder.events.contains("enter:End1"));
    }

    @Test
    public void testBreakpointPausesInDebugMode() {
        TraversalEngine debug = new TraversalEngine(TestGraphs.manualClock(clock).toBuilder().debugMode(true).build());
        debug.addListener(recorder);
        ScriptedNode scripted = new ScriptedNode("scripted", ctx -> NodeResult.next());
        scripted.setBreakpoint(true);

        debug.play(around(scripted));

        assertEquals(TraversalState.PAUSED, debug.state());
        assertSame(scripted, debug.currentNode());
        assertEquals(1, scripted.enters);
        assertEquals(0, scripted.executes);

        debug.resume();
        assertEquals(1, scripted.executes);
        assertEquals(TraversalState.COMPLETE, debug.state());
    }

    @Test
    public void testBreakpointIgnoredOutsideDebugMode() {
        ScriptedNode scripted = new ScriptedNode("scripted", ctx -> NodeResult.next());
        scripted.setBreakpoint(true);

        engine.play(around(scripted));

        assertEquals(TraversalState.COMPLETE, engine.state());
    }

    @Test
    public void testConditionWaitPollsEachTick() {
        boolean[] ready = new boolean[1];
        ScriptedNode scripted = new ScriptedNode("scripted", ctx -> NodeResult.waitUntil(() -> ready[0], "alt"));
        StoryGraph g = around(scripted);
        g.addNode(named(new EndNode("alt_end"), "AltEnd"));
        g.connect("scripted", "alt", "alt_end", StoryNode.INPUT_PORT);

        engine.play(g);
        engine.tick();
        assertEquals(TraversalState.WAITING_FOR_CONDITION, engine.state());

        ready[0] = true;
        engine.tick();
        assertTrue(recorder.events.contains("enter:AltEnd"));
    }

    @Test
    public void testConditionTimeoutFollowsTimeoutPort() {
        ScriptedNode scripted = new ScriptedNode("scripted",
                ctx -> NodeResult.waitUntil(() -> false, NodeResult.DEFAULT_PORT, Duration.ofSeconds(3),
                        "alt"));
        StoryGraph g = around(scripted);
        g.addNode(named(new EndNode("alt_end"), "AltEnd"));
        g.connect("scripted", "alt", "alt_end", StoryNode.INPUT_PORT);

        engine.play(g);
        clock.set(2 * SECOND);
        engine.tick();
        assertEquals(TraversalState.WAITING_FOR_CONDITION, engine.state());

        clock.set(3 * SECOND);
        engine.tick();
        assertTrue(recorder.events.contains("enter:AltEnd"));
        assertFalse(recorder.events.contains("enter:End"));
    }

    @Test
    public void testCycleRunsAcrossTicksWithinStepBudget() {
        StoryGraph g = new StoryGraph("loop", "Loop");
        g.addVariable(StoryVariable.ofInt("counter", 0));
        g.addNode(new StartNode("start"));
        SetVariableNode inc = new SetVariableNode("inc");
        inc.addOperation("counter", VariableOperation.Type.ADD, "1");
        g.addNode(inc);
        BranchNode loop = new BranchNode("loop");
        loop.addCondition(new StoryCondition("counter", ConditionOperator.LESS_THAN, 50));
        g.addNode(loop);
        g.addNode(new EndNode("end"));
        g.connect("start", "output", "inc", "input");
        g.connect("inc", "output", "loop", "input");
        g.connect("loop", BranchNode.TRUE_PORT, "inc", "input");
        g.connect("loop", BranchNode.FALSE_PORT, "end", "input");

        TraversalEngine small = new TraversalEngine(TestGraphs.manualClock(clock).toBuilder()
                .maxStepsPerTick(10).build());
        small.play(g);
        assertEquals(TraversalState.RUNNING, small.state());
        assertEquals(10, small.executedSteps());

        int ticks = 0;
        while (small.isRunning() && ticks++ < 100)
            small.tick();

        assertEquals(TraversalState.COMPLETE, small.state());
        assertEquals(50, small.context().getInt("counter", -1));
        assertEquals(VariableType.INT, small.context().variableType("counter"));
    }

    @Test
    public void testNodeExceptionEndsRunWithFailure() {
        ScriptedNode scripted = new ScriptedNode("scripted", ctx -> {
            throw new IllegalStateException("boom");
        });

        engine.play(around(scripted));

        assertEquals(TraversalState.COMPLETE, engine.state());
        assertEquals("end:false", recorder.last());
        assertEquals(1, recorder.errors.size());
        assertTrue(recorder.errors.get(0).contains("boom"));
        assertEquals(0, scripted.exits);
    }

    @Test
    public void testInvalidChoiceIndexKeepsWaiting() {
        engine.play(TestGraphs.threeChoices());

        engine.selectChoice(3);
        engine.selectChoice(-1);

        assertEquals(2, recorder.errors.size());
        assertEquals(TraversalState.WAITING_FOR_INPUT, engine.state());
        engine.selectChoice(0);
        assertTrue(recorder.events.contains("enter:End0"));
    }

    @Test
    public void testSendInputOnChoiceIsRejected() {
        engine.play(TestGraphs.threeChoices());

        engine.sendInput();

        assertEquals(1, recorder.errors.size());
        assertTrue(engine.isWaitingForInput());
    }

    @Test
    public void testInputWhenNotWaitingIsReported() {
        engine.sendInput();
        assertEquals(1, recorder.errors.size());

        engine.play(TestGraphs.linear());
        engine.selectChoice(0);
        assertEquals(2, recorder.errors.size());
    }

    @Test
    public void testSelectPortOverridesDefault() {
        ScriptedNode scripted = new ScriptedNode("scripted", ctx -> NodeResult.waitForInput());
        StoryGraph g = around(scripted);
        g.addNode(named(new EndNode("alt_end"), "AltEnd"));
        g.connect("scripted", "alt", "alt_end", StoryNode.INPUT_PORT);
        engine.play(g);

        engine.selectPort("missing");
        assertEquals(1, recorder.errors.size());
        assertTrue(engine.isWaitingForInput());

        engine.selectPort("alt");
        assertTrue(recorder.events.contains("enter:AltEnd"));
    }

    @Test
    public void testSendInputFollowsDeclaredPort() {
        DialogueNode line = named(new DialogueNode("line"), "Line");
        line.setText("Wait for me");
        engine.play(around(line));
        assertTrue(engine.isWaitingForInput());

        engine.sendInput();

        assertEquals("end:true", recorder.last());
    }

    @Test
    public void testListenerMaySelectDuringEntry() {
        engine.addListener(new TraversalListener() {
            @Override
            public void onNodeEnter(StoryNode node) {
                if (node instanceof ChoiceNode)
                    engine.selectChoice(2);
            }
        });

        engine.play(TestGraphs.threeChoices());

        assertTrue(recorder.events.contains("enter:End2"));
        assertTrue(recorder.errors.isEmpty());
    }

    @Test
    public void testDeadEndCompletesWithoutSuccess() {
        StoryGraph g = new StoryGraph("dead", "Dead");
        g.addNode(named(new StartNode("start"), "Start"));

        engine.play(g);

        assertEquals("end:false", recorder.last());
    }

    @Test
    public void testMissingStartIsReported() {
        StoryGraph g = new StoryGraph("empty", "Empty");

        assertFalse(engine.play(g));
        assertFalse(engine.play(TestGraphs.linear(), "nope"));

        assertEquals(2, recorder.errors.size());
        assertEquals(TraversalState.IDLE, engine.state());
    }

    @Test
    public void testExplicitStartNode() {
        engine.play(TestGraphs.linear(), "line");

        assertEquals(Arrays.asList("start", "enter:Dialogue", "exit:Dialogue", "enter:End", "exit:End", "end:true"),
                recorder.events);
    }

    @Test
    public void testSaveAndLoadResumesAtSavedNode() {
        StoryGraph g = TestGraphs.threeChoices();
        engine.play(g);
        engine.context().setVariable("gold", 5);
        StorySnapshot snapshot = engine.saveState();
        assertEquals("choice", snapshot.currentNodeId());

        TraversalEngine restored = new TraversalEngine(TestGraphs.manualClock(clock));
        assertTrue(restored.loadState(snapshot, g));

        assertTrue(restored.isWaitingForInput());
        assertEquals("choice", restored.currentNode().id());
        assertEquals(5, restored.context().getInt("gold", 0));
    }

    @Test
    public void testLoadStateRejectsOtherGraph() {
        engine.play(TestGraphs.threeChoices());
        StorySnapshot snapshot = engine.saveState();

        TraversalEngine other = new TraversalEngine(TestGraphs.manualClock(clock));
        other.addListener(recorder);
        assertFalse(other.loadState(snapshot, TestGraphs.linear()));
        assertEquals(1, recorder.errors.size());
    }

    @Test
    public void testSaveStateBeforePlayIsNull() {
        assertNull(engine.saveState());
    }

    @Test
    public void testPlayWhileActiveStopsPreviousRun() {
        engine.play(TestGraphs.threeChoices());
        engine.play(TestGraphs.linear());

        assertEquals(1, recorder.count("end:false"));
        assertEquals(1, recorder.count("end:true"));
    }
}
