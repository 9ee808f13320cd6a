package io.scanflow.core.exception;

import java.io.Serial;
import java.util.Arrays;

/// Raised when a node result does not match the shape committed for that node.
///
/// Signals that a plugin's output shape changed after the result store (or the shared
/// buffer layout) had already been sized for it. The offending write is not applied.
public class ShapeMismatchException extends RuntimeException {

    @Serial private static final long serialVersionUID = -2296950532412236071L;

    private final int nodeId;

    public ShapeMismatchException(int nodeId, int[] expected, int[] actual) {
        super(
                "Result shape of node #"
                        + nodeId
                        + " changed: expected "
                        + Arrays.toString(expected)
                        + " but got "
                        + Arrays.toString(actual));
        this.nodeId = nodeId;
    }

    public ShapeMismatchException(int nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    /// Returns the id of the node whose shape drifted.
    ///
    /// @return node id
    public int getNodeId() {
        return nodeId;
    }
}
