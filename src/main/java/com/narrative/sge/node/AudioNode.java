package com.narrative.sge.node;

import com.narrative.sge.api.NodeResult;
import com.narrative.sge.api.StoryEvent;
import com.narrative.sge.engine.ExecutionContext;
import com.narrative.sge.graph.StoryNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes an audio cue as a {@code StoryAudio} event. Playback belongs to
 * the host. When {@code waitForCompletion} is set on a PLAY cue the node
 * waits for the clip duration, or for {@link #complete(ExecutionContext)} if
 * the duration is unknown.
 */
public class AudioNode extends StoryNode {
    public static final String EVENT_NAME = "StoryAudio";
    public static final String COMPLETE_KEY = "audioComplete";

    public enum AudioType {
        SFX, MUSIC, AMBIENT, VOICE
    }

    public enum AudioAction {
        PLAY, STOP, PAUSE, RESUME, FADE_IN, FADE_OUT, CROSS_FADE
    }

    private String clipPath = "";
    private AudioType audioType = AudioType.SFX;
    private AudioAction action = AudioAction.PLAY;
    private float volume = 1f;
    private float fadeTime;
    private boolean loop;
    private boolean waitForCompletion;
    private float duration;
    private String channel = "";

    public AudioNode(String id) {
        super(id);
        addInputPort(INPUT_PORT, "Input");
        addOutputPort(NodeResult.DEFAULT_PORT, "Output");
    }

    @Override
    public String typeName() {
        return "Audio";
    }

    @Override
    public String category() {
        return "Audio";
    }

    @Override
    public NodeResult execute(ExecutionContext context) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("clipPath", clipPath);
        params.put("audioType", audioType.name());
        params.put("action", action.name());
        params.put("volume", volume);
        params.put("fadeTime", fadeTime);
        params.put("loop", loop);
        params.put("channel", channel);
        context.raiseEvent(new StoryEvent(EVENT_NAME, "Audio", id(), params));

        if (!waitForCompletion || action != AudioAction.PLAY)
            return NodeResult.next();
        if (duration > 0)
            return NodeResult.waitForSeconds(duration, NodeResult.DEFAULT_PORT);
        return NodeResult.waitUntil(() -> context.getTempData(COMPLETE_KEY, Boolean.FALSE), NodeResult.DEFAULT_PORT);
    }

    /** Reports the end of playback for a cue without a known duration. */
    public void complete(ExecutionContext context) {
        context.setTempData(COMPLETE_KEY, Boolean.TRUE);
    }

    @Override
    public List<String> validate() {
        List<String> errors = super.validate();
        if (action == AudioAction.PLAY && (clipPath == null || clipPath.isEmpty()))
            errors.add("Audio node plays no clip");
        if (volume < 0f || volume > 1f)
            errors.add("Volume " + volume + " is outside [0, 1]");
        return errors;
    }

    public String clipPath() {
        return clipPath;
    }

    public void setClipPath(String clipPath) {
        this.clipPath = clipPath;
    }

    public AudioType audioType() {
        return audioType;
    }

    public void setAudioType(AudioType audioType) {
        this.audioType = audioType;
    }

    public AudioAction action() {
        return action;
    }

    public void setAction(AudioAction action) {
        this.action = action;
    }

    public float volume() {
        return volume;
    }

    public void setVolume(float volume) {
        this.volume = volume;
    }

    public float fadeTime() {
        return fadeTime;
    }

    public void setFadeTime(float fadeTime) {
        this.fadeTime = fadeTime;
    }

    public boolean isLoop() {
        return loop;
    }

    public void setLoop(boolean loop) {
        this.loop = loop;
    }

    public boolean isWaitForCompletion() {
        return waitForCompletion;
    }

    public void setWaitForCompletion(boolean waitForCompletion) {
        this.waitForCompletion = waitForCompletion;
    }

    /** Clip length in seconds; zero when unknown. */
    public float duration() {
        return duration;
    }

    public void setDuration(float duration) {
        this.duration = duration;
    }

    public String channel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }
}
