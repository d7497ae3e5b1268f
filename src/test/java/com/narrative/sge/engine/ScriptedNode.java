package com.narrative.sge.engine;

import com.narrative.sge.api.NodeResult;
import com.narrative.sge.graph.StoryNode;

import java.util.function.Function;

/** Test node with "output" and "alt" ports that counts its hook calls. */
public class ScriptedNode extends StoryNode {
    public int enters;
    public int executes;
    public int exits;
    private final Function<ExecutionContext, NodeResult> behaviour;

    public ScriptedNode(String id, Function<ExecutionContext, NodeResult> behaviour) {
        super(id);
        this.behaviour = behaviour;
        setName(id);
        addInputPort(INPUT_PORT, "Input");
        addOutputPort(NodeResult.DEFAULT_PORT, "Output");
        addOutputPort("alt", "Alternative");
    }

    @Override
    public String typeName() {
        return "Scripted";
    }

    @Override
    public String category() {
        return "Test";
    }

    @Override
    public void onEnter(ExecutionContext context) {
        enters++;
    }

    @Override
    public NodeResult execute(ExecutionContext context) {
        executes++;
        return behaviour.apply(context);
    }

    @Override
    public void onExit(ExecutionContext context) {
        exits++;
    }
}
