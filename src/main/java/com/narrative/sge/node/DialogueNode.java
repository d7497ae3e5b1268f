package com.narrative.sge.node;

import com.narrative.sge.api.NodeResult;
import com.narrative.sge.engine.ExecutionContext;
import com.narrative.sge.graph.StoryNode;

import java.util.List;

/**
 * A line of dialogue.
 *
 * The text may reference variables as {@code {name}}; unknown variables render
 * as {@code [name]}. By default the node waits for the player to advance;
 * otherwise it either waits {@code autoAdvanceDelay} seconds or continues at
 * once.
 */
public class DialogueNode extends StoryNode {
    /** Temp data key holding the rendered text of the current visit. */
    public static final String RENDERED_TEXT_KEY = "processedDialogueText";

    private String speakerName = "";
    private String speakerId = "";
    private String speakerEmotion = "neutral";
    private String text = "";
    private String localizedTextKey = "";
    private float textSpeed = 0.05f;
    private boolean waitForInput = true;
    private float autoAdvanceDelay;

    public DialogueNode(String id) {
        super(id);
        addInputPort(INPUT_PORT, "Input");
        addOutputPort(NodeResult.DEFAULT_PORT, "Output");
    }

    @Override
    public String typeName() {
        return "Dialogue";
    }

    @Override
    public String category() {
        return "Dialogue";
    }

    @Override
    public NodeResult execute(ExecutionContext context) {
        context.setTempData(RENDERED_TEXT_KEY, renderText(context));
        if (waitForInput)
            return NodeResult.waitForInput();
        if (autoAdvanceDelay > 0)
            return NodeResult.waitForSeconds(autoAdvanceDelay, NodeResult.DEFAULT_PORT);
        return NodeResult.next();
    }

    /** The text with {@code {variable}} references replaced by current values. */
    public String renderText(ExecutionContext context) {
        if (text == null || text.isEmpty())
            return text;
        StringBuilder out = new StringBuilder(text.length() + 16);
        int pos = 0;
        while (pos < text.length()) {
            int open = text.indexOf('{', pos);
            int close = open < 0 ? -1 : text.indexOf('}', open);
            if (close < 0) {
                out.append(text, pos, text.length());
                break;
            }
            out.append(text, pos, open);
            String name = text.substring(open + 1, close);
            Object value = context.getVariable(name);
            out.append(value != null ? value.toString() : "[" + name + "]");
            pos = close + 1;
        }
        return out.toString();
    }

    @Override
    public List<String> validate() {
        List<String> errors = super.validate();
        if ((text == null || text.isEmpty()) && (localizedTextKey == null || localizedTextKey.isEmpty()))
            errors.add("Dialogue node has no text content");
        return errors;
    }

    public String speakerName() {
        return speakerName;
    }

    public void setSpeakerName(String speakerName) {
        this.speakerName = speakerName;
    }

    public String speakerId() {
        return speakerId;
    }

    public void setSpeakerId(String speakerId) {
        this.speakerId = speakerId;
    }

    public String speakerEmotion() {
        return speakerEmotion;
    }

    public void setSpeakerEmotion(String speakerEmotion) {
        this.speakerEmotion = speakerEmotion;
    }

    public String text() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String localizedTextKey() {
        return localizedTextKey;
    }

    public void setLocalizedTextKey(String localizedTextKey) {
        this.localizedTextKey = localizedTextKey;
    }

    public float textSpeed() {
        return textSpeed;
    }

    public void setTextSpeed(float textSpeed) {
        this.textSpeed = textSpeed;
    }

    public boolean isWaitForInput() {
        return waitForInput;
    }

    public void setWaitForInput(boolean waitForInput) {
        this.waitForInput = waitForInput;
    }

    public float autoAdvanceDelay() {
        return autoAdvanceDelay;
    }

    public void setAutoAdvanceDelay(float seconds) {
        this.autoAdvanceDelay = seconds;
    }
}
