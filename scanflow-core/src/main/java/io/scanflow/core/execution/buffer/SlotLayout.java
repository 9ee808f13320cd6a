package io.scanflow.core.execution.buffer;

import io.scanflow.core.data.Dataset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/// Arrangement of the per-point results of all result-producing nodes inside one buffer slot.
///
/// Node results are concatenated in the iteration order of the shape map, each as a run of
/// `double` values. One status value per node follows the results; it tells the reader whether
/// the node's run holds a result or the node produced a result of another shape.
public final class SlotLayout {

    /// Status of a node whose result was written to the slot.
    public static final double STATUS_WRITTEN = 0.0;

    /// Status of a node whose result did not have the laid out shape; its run is not written.
    public static final double STATUS_DRIFTED = 1.0;

    private final List<Entry> entries;
    private final int doublesPerSlot;

    private SlotLayout(List<Entry> entries, int doublesPerSlot) {
        this.entries = entries;
        this.doublesPerSlot = doublesPerSlot;
    }

    /// Lays out the given per-point shapes one after another.
    ///
    /// @param shapes per-point shape by node id, not null
    /// @return layout, never null
    public static SlotLayout of(Map<Integer, int[]> shapes) {
        List<Entry> entries = new ArrayList<>(shapes.size());
        int offset = 0;
        for (int[] shape : shapes.values()) {
            offset = Math.addExact(offset, Dataset.sizeOf(shape));
        }
        int statusOffset = offset;
        offset = 0;
        for (Map.Entry<Integer, int[]> shape : shapes.entrySet()) {
            int size = Dataset.sizeOf(shape.getValue());
            entries.add(new Entry(shape.getKey(), shape.getValue(), offset, size, statusOffset++));
            offset += size;
        }
        return new SlotLayout(Collections.unmodifiableList(entries), statusOffset);
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public int getDoublesPerSlot() {
        return doublesPerSlot;
    }

    /// Returns the slot size in bytes. Never less than 8, so that empty layouts still get a
    /// usable slot.
    ///
    /// @return bytes per slot
    public int getSlotBytes() {
        return Math.max(Double.BYTES, Math.multiplyExact(doublesPerSlot, Double.BYTES));
    }

    /// Position of one node's result inside a slot.
    ///
    /// @param nodeId node id
    /// @param shape per-point shape
    /// @param offset start, counted in `double` values
    /// @param size number of `double` values
    /// @param statusOffset position of the node's status value
    public record Entry(int nodeId, int[] shape, int offset, int size, int statusOffset) {

        public Entry {
            shape = shape.clone();
        }

        @Override
        public int[] shape() {
            return shape.clone();
        }

        public boolean matches(int[] other) {
            return Arrays.equals(shape, other);
        }
    }
}
