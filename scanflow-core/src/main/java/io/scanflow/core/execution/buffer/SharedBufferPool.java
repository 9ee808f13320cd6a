package io.scanflow.core.execution.buffer;

import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/// Fixed number of fixed-size slots carved out of one pre-allocated direct buffer.
///
/// Workers {@link #acquire()} a slot, write their results into it and hand only the slot index
/// to the manager, which copies the data out and {@link #release(int)}s the slot. The pool size
/// therefore bounds the number of results in flight between computation and storage.
///
/// ### Contracts
/// - **Invariant**: a slot is either free or owned by exactly one in-flight result
/// - **Invariant**: at most {@link #getSlotCount()} slots are in use at any time
///
/// @implNote **Thread-safe**. The in-use flags are only read and modified under a lock. Slot
/// content is accessed through absolute operations on per-slot views, so distinct slots can be
/// written concurrently; a slot is only touched by its current owner.
public final class SharedBufferPool implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(SharedBufferPool.class.getName());

    private static final long ACQUIRE_BACKOFF_MS = 5;

    private final ByteBuffer masterBuffer;
    private final DoubleBuffer[] slots;
    private final boolean[] inUse;
    private final int slotBytes;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private int inUseCount;
    private int peakInUse;
    private boolean closed;

    /// Allocates the pool.
    ///
    /// @param slotCount number of slots, at least 1
    /// @param slotBytes bytes per slot, a positive multiple of 8
    /// @throws IllegalArgumentException if the sizes are invalid or the total exceeds 2 GiB
    public SharedBufferPool(int slotCount, int slotBytes) {
        if (slotCount <= 0) {
            throw new IllegalArgumentException("Slot count must be positive: " + slotCount);
        }
        if (slotBytes <= 0 || slotBytes % Double.BYTES != 0) {
            throw new IllegalArgumentException(
                    "Slot size must be a positive multiple of " + Double.BYTES + ": " + slotBytes);
        }
        long totalSize = (long) slotBytes * slotCount;
        if (totalSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Total buffer size exceeds maximum: " + totalSize);
        }
        this.slotBytes = slotBytes;
        this.masterBuffer = ByteBuffer.allocateDirect((int) totalSize);
        this.slots = new DoubleBuffer[slotCount];
        this.inUse = new boolean[slotCount];
        for (int i = 0; i < slotCount; i++) {
            slots[i] = masterBuffer.slice(i * slotBytes, slotBytes).asDoubleBuffer();
        }
        logger.fine("Allocated " + slotCount + " buffer slots of " + slotBytes + " bytes");
    }

    /// Takes a free slot, waiting with a short backoff while all slots are in use.
    ///
    /// @return index of the acquired slot
    /// @throws InterruptedException if interrupted while waiting
    /// @throws IllegalStateException if the pool is closed
    public int acquire() throws InterruptedException {
        while (true) {
            int slot = tryAcquire();
            if (slot >= 0) {
                return slot;
            }
            Thread.sleep(ACQUIRE_BACKOFF_MS);
        }
    }

    /// Takes a free slot if one is available.
    ///
    /// @return index of the acquired slot, or -1 if all slots are in use
    /// @throws IllegalStateException if the pool is closed
    public int tryAcquire() {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Buffer pool is closed");
            }
            for (int i = 0; i < inUse.length; i++) {
                if (!inUse[i]) {
                    inUse[i] = true;
                    inUseCount++;
                    peakInUse = Math.max(peakInUse, inUseCount);
                    return i;
                }
            }
            return -1;
        } finally {
            lock.unlock();
        }
    }

    /// Returns a slot to the pool.
    ///
    /// @param slot slot index
    /// @throws IllegalStateException if the slot is not in use
    /// @throws IndexOutOfBoundsException if the index is not a slot of this pool
    public void release(int slot) {
        lock.lock();
        try {
            if (!inUse[slot]) {
                throw new IllegalStateException("Buffer slot " + slot + " is not in use");
            }
            inUse[slot] = false;
            inUseCount--;
        } finally {
            lock.unlock();
        }
    }

    /// Writes values into a slot.
    ///
    /// @param slot slot index owned by the caller
    /// @param offset start position, counted in `double` values
    /// @param values values to write, not null
    public void write(int slot, int offset, double[] values) {
        slots[slot].put(offset, values);
    }

    /// Reads values from a slot.
    ///
    /// @param slot slot index owned by the caller
    /// @param offset start position, counted in `double` values
    /// @param length number of values
    /// @return new array, never null
    public double[] read(int slot, int offset, int length) {
        double[] values = new double[length];
        slots[slot].get(offset, values);
        return values;
    }

    public int getSlotCount() {
        return slots.length;
    }

    public int getSlotBytes() {
        return slotBytes;
    }

    public int getInUseCount() {
        lock.lock();
        try {
            return inUseCount;
        } finally {
            lock.unlock();
        }
    }

    /// Returns the largest number of slots that were in use at the same time.
    ///
    /// @return peak in-use count since allocation
    public int getPeakInUse() {
        lock.lock();
        try {
            return peakInUse;
        } finally {
            lock.unlock();
        }
    }

    /// Marks the pool closed. Further acquisitions fail. The memory is reclaimed with the pool.
    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
        } finally {
            lock.unlock();
        }
    }
}
