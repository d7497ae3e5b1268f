package com.narrative.sge.engine;

import com.narrative.sge.api.TraversalListener;
import com.narrative.sge.graph.StoryGraph;
import com.narrative.sge.graph.StoryNode;

import java.util.ArrayList;
import java.util.List;

/** Records traversal callbacks as "enter:Name", "exit:Name", "end:true", "error:..." strings. */
public class RecordingListener implements TraversalListener {
    public final List<String> events = new ArrayList<>();
    public final List<String> errors = new ArrayList<>();

    @Override
    public void onStoryStart(StoryGraph graph) {
        events.add("start");
    }

    @Override
    public void onNodeEnter(StoryNode node) {
        events.add("enter:" + node.name());
    }

    @Override
    public void onNodeExit(StoryNode node) {
        events.add("exit:" + node.name());
    }

    @Override
    public void onStoryEnd(StoryGraph graph, boolean success) {
        events.add("end:" + success);
    }

    @Override
    public void onError(String message) {
        events.add("error");
        errors.add(message);
    }

    public int count(String event) {
        int n = 0;
        for (String e : events)
            if (e.equals(event))
                n++;
        return n;
    }

    public String last() {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    public void clear() {
        events.clear();
        errors.clear();
    }
}
