package dev.ibuilder.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable navigation state of an interactive session: the path of the focused node plus a few
 * counters about the interaction.
 */
public final class NavigationState {
    private final List<String> path;
    private int interactionCount;
    private int rejectedCount;
    private int maxDepth;
    private final long startTime;

    public NavigationState() {
        this.path = new ArrayList<>();
        this.interactionCount = 0;
        this.rejectedCount = 0;
        this.maxDepth = 0;
        this.startTime = System.currentTimeMillis();
    }

    /** Read-only view of the current path. */
    public List<String> path() { return Collections.unmodifiableList(path); }
    public int depth() { return path.size(); }
    public boolean atRoot() { return path.isEmpty(); }
    public int interactionCount() { return interactionCount; }
    public int rejectedCount() { return rejectedCount; }
    public int maxDepth() { return maxDepth; }
    public long startTime() { return startTime; }

    /** Milliseconds since the session started. */
    public long elapsedMillis() { return System.currentTimeMillis() - startTime; }

    public void recordInteraction() { interactionCount++; }
    public void recordRejected() { rejectedCount++; }

    /**
     * Descend into a child: append the segment and track the deepest level reached.
     */
    public void descend(String segment) {
        path.add(segment);
        maxDepth = Math.max(maxDepth, path.size());
    }

    /**
     * Go back to the parent menu. Does nothing at the root.
     */
    public void ascend() {
        if (!path.isEmpty()) {
            path.remove(path.size() - 1);
        }
    }
}
