package com.narrative.sge.node;

import com.narrative.sge.api.NodeResult;
import com.narrative.sge.engine.ExecutionContext;
import com.narrative.sge.graph.StoryNode;

/**
 * Terminal node. Marks the context complete and ends the run with success.
 * The end type and label are published as temp data for story-ended
 * subscribers that inspect the context.
 */
public class EndNode extends StoryNode {
    public static final String END_TYPE_KEY = "endType";
    public static final String END_LABEL_KEY = "endLabel";

    private String endLabel = "End";
    private EndType endType = EndType.COMPLETE;

    public EndNode(String id) {
        super(id);
        addInputPort(INPUT_PORT, "End");
    }

    @Override
    public String typeName() {
        return "End";
    }

    @Override
    public String category() {
        return "Flow";
    }

    @Override
    public NodeResult execute(ExecutionContext context) {
        context.markComplete();
        context.setTempData(END_TYPE_KEY, endType);
        context.setTempData(END_LABEL_KEY, endLabel);
        return NodeResult.end();
    }

    public String endLabel() {
        return endLabel;
    }

    public void setEndLabel(String endLabel) {
        this.endLabel = endLabel;
    }

    public EndType endType() {
        return endType;
    }

    public void setEndType(EndType endType) {
        this.endType = endType == null ? EndType.COMPLETE : endType;
    }
}
