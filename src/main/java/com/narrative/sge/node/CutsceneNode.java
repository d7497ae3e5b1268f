package com.narrative.sge.node;

import com.narrative.sge.api.NodeResult;
import com.narrative.sge.api.StoryEvent;
import com.narrative.sge.engine.ExecutionContext;
import com.narrative.sge.graph.StoryNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands control to the host's cutscene player and waits until the host calls
 * {@link #complete(ExecutionContext, boolean)}. Leaves through "complete", or
 * through "skipped" when the host reports a skip.
 */
public class CutsceneNode extends StoryNode {
    public static final String COMPLETE_PORT = "complete";
    public static final String SKIPPED_PORT = "skipped";
    public static final String CURRENT_CUTSCENE_KEY = "currentCutscene";
    public static final String COMPLETE_KEY = "cutsceneComplete";
    public static final String SKIPPED_KEY = "cutsceneSkipped";
    public static final String EVENT_NAME = "StoryCutscene";

    public enum CutsceneType {
        TIMELINE, ANIMATION, VIDEO, CUSTOM
    }

    private String cutsceneName = "";
    private String cutsceneId = "";
    private CutsceneType cutsceneType = CutsceneType.TIMELINE;
    private boolean skippable = true;
    private float skipHoldTime = 1f;
    private boolean pauseGameplay;
    private boolean hideUi = true;

    public CutsceneNode(String id) {
        super(id);
        addInputPort(INPUT_PORT, "Input");
        addOutputPort(COMPLETE_PORT, "Complete");
        addOutputPort(SKIPPED_PORT, "Skipped");
    }

    @Override
    public String typeName() {
        return "Cutscene";
    }

    @Override
    public String category() {
        return "Cinematic";
    }

    @Override
    public void onEnter(ExecutionContext context) {
        context.setTempData(CURRENT_CUTSCENE_KEY, this);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("cutsceneId", cutsceneId);
        params.put("cutsceneName", cutsceneName);
        params.put("cutsceneType", cutsceneType.name());
        params.put("skippable", skippable);
        params.put("pauseGameplay", pauseGameplay);
        params.put("hideUI", hideUi);
        context.raiseEvent(new StoryEvent(EVENT_NAME, "Cinematic", id(), params));
    }

    @Override
    public NodeResult execute(ExecutionContext context) {
        return NodeResult.waitUntil(() -> context.getTempData(COMPLETE_KEY, Boolean.FALSE), COMPLETE_PORT);
    }

    @Override
    public String resumePort(ExecutionContext context, String port) {
        return context.getTempData(SKIPPED_KEY, Boolean.FALSE) ? SKIPPED_PORT : port;
    }

    @Override
    public void onExit(ExecutionContext context) {
        context.removeTempData(COMPLETE_KEY);
        context.removeTempData(SKIPPED_KEY);
        context.removeTempData(CURRENT_CUTSCENE_KEY);
    }

    /**
     * Reports the end of playback. A skip on a non-skippable cutscene counts
     * as a normal completion. Takes effect on the engine's next tick.
     */
    public void complete(ExecutionContext context, boolean skipped) {
        context.setTempData(SKIPPED_KEY, skipped && skippable);
        context.setTempData(COMPLETE_KEY, Boolean.TRUE);
    }

    @Override
    public List<String> validate() {
        List<String> errors = super.validate();
        if ((cutsceneId == null || cutsceneId.isEmpty()) && (cutsceneName == null || cutsceneName.isEmpty()))
            errors.add("Cutscene has neither an id nor a name");
        return errors;
    }

    public String cutsceneName() {
        return cutsceneName;
    }

    public void setCutsceneName(String cutsceneName) {
        this.cutsceneName = cutsceneName;
    }

    public String cutsceneId() {
        return cutsceneId;
    }

    public void setCutsceneId(String cutsceneId) {
        this.cutsceneId = cutsceneId;
    }

    public CutsceneType cutsceneType() {
        return cutsceneType;
    }

    public void setCutsceneType(CutsceneType cutsceneType) {
        this.cutsceneType = cutsceneType;
    }

    public boolean isSkippable() {
        return skippable;
    }

    public void setSkippable(boolean skippable) {
        this.skippable = skippable;
    }

    public float skipHoldTime() {
        return skipHoldTime;
    }

    public void setSkipHoldTime(float skipHoldTime) {
        this.skipHoldTime = skipHoldTime;
    }

    public boolean isPauseGameplay() {
        return pauseGameplay;
    }

    public void setPauseGameplay(boolean pauseGameplay) {
        this.pauseGameplay = pauseGameplay;
    }

    public boolean isHideUi() {
        return hideUi;
    }

    public void setHideUi(boolean hideUi) {
        this.hideUi = hideUi;
    }
}
