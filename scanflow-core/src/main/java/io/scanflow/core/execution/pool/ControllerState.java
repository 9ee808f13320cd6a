package io.scanflow.core.execution.pool;

/// Lifecycle states of a {@link WorkerController}.
///
/// ```
/// IDLE -> RUNNING -> (SUSPENDED <-> RUNNING) -> DRAINING -> STOPPED
/// ```
public enum ControllerState {
    /// Created, workers not yet started. Tasks may be submitted.
    IDLE,
    /// Workers are processing and outcomes are delivered.
    RUNNING,
    /// Workers keep processing, but outcomes are held back until restart.
    SUSPENDED,
    /// No more tasks accepted; remaining work is finished before the workers exit.
    DRAINING,
    /// All workers have exited and every outcome was delivered.
    STOPPED
}
