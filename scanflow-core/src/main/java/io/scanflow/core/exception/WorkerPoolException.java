package io.scanflow.core.exception;

import java.io.Serial;

/// Reports that a worker of a pool terminated without being told to stop.
///
/// The pool does not respawn workers; receiving this means the run was aborted.
public class WorkerPoolException extends RuntimeException {

    @Serial private static final long serialVersionUID = -4702196374580264531L;

    private final String workerName;

    public WorkerPoolException(String workerName, Throwable cause) {
        super("Worker '" + workerName + "' died unexpectedly", cause);
        this.workerName = workerName;
    }

    public String getWorkerName() {
        return workerName;
    }
}
