package com.narrative.sge.node;

import com.narrative.sge.api.NodeResult;
import com.narrative.sge.engine.ExecutionContext;
import com.narrative.sge.graph.StoryNode;

import java.util.List;

/** Entry point of a graph. Has no input port. */
public class StartNode extends StoryNode {
    private String startLabel = "Start";
    private boolean defaultStart = true;

    public StartNode(String id) {
        super(id);
        addOutputPort(NodeResult.DEFAULT_PORT, "Start");
    }

    @Override
    public String typeName() {
        return "Start";
    }

    @Override
    public String category() {
        return "Flow";
    }

    @Override
    public boolean isStart() {
        return true;
    }

    @Override
    public NodeResult execute(ExecutionContext context) {
        return NodeResult.next();
    }

    @Override
    public List<String> validate() {
        List<String> errors = super.validate();
        if (startLabel == null || startLabel.isEmpty())
            errors.add("Start node has no label");
        return errors;
    }

    public String startLabel() {
        return startLabel;
    }

    public void setStartLabel(String startLabel) {
        this.startLabel = startLabel;
    }

    public boolean isDefaultStart() {
        return defaultStart;
    }

    public void setDefaultStart(boolean defaultStart) {
        this.defaultStart = defaultStart;
    }
}
