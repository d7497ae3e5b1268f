package com.narrative.sge.io;

import static com.narrative.sge.io.StoryGraphCompiler.getBool;
import static com.narrative.sge.io.StoryGraphCompiler.getFloat;
import static com.narrative.sge.io.StoryGraphCompiler.getInt;
import static com.narrative.sge.io.StoryGraphCompiler.getList;
import static com.narrative.sge.io.StoryGraphCompiler.getString;

import com.narrative.sge.api.ConditionOperator;
import com.narrative.sge.api.StoryCondition;
import com.narrative.sge.graph.StoryNode;
import com.narrative.sge.node.AudioNode;
import com.narrative.sge.node.BranchNode;
import com.narrative.sge.node.Choice;
import com.narrative.sge.node.ChoiceNode;
import com.narrative.sge.node.CutsceneNode;
import com.narrative.sge.node.DialogueNode;
import com.narrative.sge.node.EndNode;
import com.narrative.sge.node.EndType;
import com.narrative.sge.node.EventNode;
import com.narrative.sge.node.SetVariableNode;
import com.narrative.sge.node.StartNode;
import com.narrative.sge.node.VariableOperation;
import com.narrative.sge.node.WaitNode;
import com.narrative.sge.util.Coercions;

import java.util.Map;

/** Built-in node types and the factories that build them from properties. */
public enum NodeType {
    START(StartNode.class, (id, props) -> {
        var node = new StartNode(id);
        node.setStartLabel(getString(props, "label", "Start"));
        node.setDefaultStart(getBool(props, "defaultStart", true));
        return node;
    }),
    END(EndNode.class, (id, props) -> {
        var node = new EndNode(id);
        node.setEndLabel(getString(props, "label", "End"));
        node.setEndType(EndType.valueOf(getString(props, "endType", "COMPLETE").toUpperCase()));
        return node;
    }),
    DIALOGUE(DialogueNode.class, (id, props) -> {
        var node = new DialogueNode(id);
        node.setSpeakerName(getString(props, "speakerName", ""));
        node.setSpeakerId(getString(props, "speakerId", ""));
        node.setSpeakerEmotion(getString(props, "emotion", "neutral"));
        node.setText(getString(props, "text", ""));
        node.setLocalizedTextKey(getString(props, "localizedTextKey", ""));
        node.setTextSpeed(getFloat(props, "textSpeed", 0.05f));
        node.setWaitForInput(getBool(props, "waitForInput", true));
        node.setAutoAdvanceDelay(getFloat(props, "autoAdvanceDelay", 0f));
        return node;
    }),
    CHOICE(ChoiceNode.class, (id, props) -> {
        var node = new ChoiceNode(id);
        node.setPromptText(getString(props, "prompt", ""));
        node.setChoiceTimeout(getFloat(props, "timeout", 0f));
        node.setDefaultChoiceIndex(getInt(props, "defaultChoice", -1));
        node.setShuffleChoices(getBool(props, "shuffle", false));
        for (Map<String, Object> c : getList(props, "choices")) {
            String text = getString(c, "text", "");
            String choiceId = getString(c, "id", null);
            Choice choice = choiceId == null ? node.addChoice(text) : node.addChoice(new Choice(choiceId, text));
            choice.setConditionVariable(getString(c, "condition", null));
            choice.setLocalizedKey(getString(c, "localizedKey", ""));
            String variable = getString(c, "setVariable", null);
            if (variable != null)
                choice.setsVariable(variable, c.get("setValue"));
        }
        return node;
    }),
    BRANCH(BranchNode.class, (id, props) -> {
        var node = new BranchNode(id);
        node.setLogic(BranchNode.ConditionLogic.valueOf(getString(props, "logic", "AND").toUpperCase()));
        for (Map<String, Object> c : getList(props, "conditions"))
            node.addCondition(new StoryCondition(getString(c, "variable", null),
                    ConditionOperator.fromString(getString(c, "operator", "IS_TRUE")), literal(c.get("value"))));
        return node;
    }),
    SET_VARIABLE(SetVariableNode.class, (id, props) -> {
        var node = new SetVariableNode(id);
        for (Map<String, Object> op : getList(props, "operations"))
            node.addOperation(getString(op, "variable", null),
                    VariableOperation.Type.fromString(getString(op, "operation", "SET")),
                    getString(op, "value", null));
        return node;
    }),
    WAIT(WaitNode.class, (id, props) -> {
        var node = new WaitNode(id);
        node.setWaitType(WaitNode.WaitType.valueOf(getString(props, "waitType", "TIME").toUpperCase()));
        node.setWaitTime(getFloat(props, "waitTime", 1f));
        node.setConditionVariable(getString(props, "conditionVariable", null));
        node.setConditionOperator(ConditionOperator.fromString(getString(props, "conditionOperator", "IS_TRUE")));
        node.setConditionValue(getString(props, "conditionValue", null));
        return node;
    }),
    EVENT(EventNode.class, (id, props) -> {
        var node = new EventNode(id);
        node.setEventName(getString(props, "eventName", ""));
        node.setEventCategory(getString(props, "category", ""));
        node.setWaitForCompletion(getBool(props, "waitForCompletion", false));
        node.setTimeout(getFloat(props, "timeout", 0f));
        if (props.get("parameters") instanceof Map<?, ?> params)
            params.forEach((k, v) -> node.addParameter(String.valueOf(k), v));
        return node;
    }),
    AUDIO(AudioNode.class, (id, props) -> {
        var node = new AudioNode(id);
        node.setClipPath(getString(props, "clipPath", ""));
        node.setAudioType(AudioNode.AudioType.valueOf(getString(props, "audioType", "SFX").toUpperCase()));
        node.setAction(AudioNode.AudioAction.valueOf(getString(props, "action", "PLAY").toUpperCase()));
        node.setVolume(getFloat(props, "volume", 1f));
        node.setFadeTime(getFloat(props, "fadeTime", 0f));
        node.setLoop(getBool(props, "loop", false));
        node.setWaitForCompletion(getBool(props, "waitForCompletion", false));
        node.setDuration(getFloat(props, "duration", 0f));
        node.setChannel(getString(props, "channel", ""));
        return node;
    }),
    CUTSCENE(CutsceneNode.class, (id, props) -> {
        var node = new CutsceneNode(id);
        node.setCutsceneId(getString(props, "cutsceneId", ""));
        node.setCutsceneName(getString(props, "cutsceneName", ""));
        node.setCutsceneType(CutsceneNode.CutsceneType.valueOf(getString(props, "cutsceneType", "TIMELINE")
                .toUpperCase()));
        node.setSkippable(getBool(props, "skippable", true));
        node.setSkipHoldTime(getFloat(props, "skipHoldTime", 1f));
        node.setPauseGameplay(getBool(props, "pauseGameplay", false));
        node.setHideUi(getBool(props, "hideUI", true));
        return node;
    });

    private final Class<? extends StoryNode> nodeClass;
    private final StoryGraphCompiler.NodeFactory factory;

    NodeType(Class<? extends StoryNode> nodeClass, StoryGraphCompiler.NodeFactory factory) {
        this.nodeClass = nodeClass;
        this.factory = factory;
    }

    public Class<? extends StoryNode> getNodeClass() {
        return nodeClass;
    }

    public StoryGraphCompiler.NodeFactory getFactory() {
        return factory;
    }

    // JSON strings stay strings unless they read as a literal.
    private static Object literal(Object value) {
        return value instanceof String s ? Coercions.parseLiteral(s) : value;
    }

    /** Accepts {@code SET_VARIABLE}, {@code set_variable} and {@code SetVariable}. */
    public static NodeType fromString(String text) {
        String normalized = text.replace("_", "");
        for (NodeType t : NodeType.values()) {
            if (t.name().replace("_", "").equalsIgnoreCase(normalized)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown NodeType: " + text);
    }
}
