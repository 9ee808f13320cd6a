package io.scanflow.core.exception;

import java.io.Serial;

/// Raised when a processing tree mutation would break the tree structure.
///
/// Covers unknown node or parent ids, moves that would create a cycle, and removals that
/// would leave more than one root. The tree is left unchanged when this is thrown.
public class TreeStructureException extends RuntimeException {

    @Serial private static final long serialVersionUID = 3170586113404283647L;

    public TreeStructureException(String message) {
        super(message);
    }
}
