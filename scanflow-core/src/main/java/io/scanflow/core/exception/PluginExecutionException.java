package io.scanflow.core.exception;

import java.io.Serial;

/// Wraps an exception raised inside a plugin while processing one task.
///
/// Carries the node and task so that failed-result notifications can say where the
/// pipeline broke.
public class PluginExecutionException extends Exception {

    @Serial private static final long serialVersionUID = 6412938550718821203L;

    private final int nodeId;
    private final int task;

    public PluginExecutionException(int nodeId, int task, Throwable cause) {
        super(
                "Plugin of node #"
                        + nodeId
                        + " failed for task "
                        + task
                        + ": "
                        + cause.getMessage(),
                cause);
        this.nodeId = nodeId;
        this.task = task;
    }

    /// Creates an exception for a plugin that failed while preparing for a run.
    ///
    /// @param nodeId node whose plugin failed
    /// @param cause exception raised by the plugin, not null
    public PluginExecutionException(int nodeId, Throwable cause) {
        super("Plugin of node #" + nodeId + " failed to prepare: " + cause.getMessage(), cause);
        this.nodeId = nodeId;
        this.task = -1;
    }

    public int getNodeId() {
        return nodeId;
    }

    /// Returns the task that failed.
    ///
    /// @return task index, or -1 if the plugin failed during preparation
    public int getTask() {
        return task;
    }
}
