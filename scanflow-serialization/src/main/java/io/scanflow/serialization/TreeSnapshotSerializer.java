package io.scanflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.scanflow.core.tree.NodeRecord;
import io.scanflow.core.tree.TreeSnapshot;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link TreeSnapshot} as a versioned list of node records.
///
/// ```
/// {
///   "formatVersion": 1,
///   "nodes": [
///     { "nodeId": 0, "parentId": null, "pluginClass": "...", "pluginParams": { ... } },
///     ...
///   ]
/// }
/// ```
///
/// @implNote Package-private. Registered by {@link ScanflowJacksonModule}.
/// @see TreeSnapshotDeserializer for the inverse operation
class TreeSnapshotSerializer extends StdSerializer<TreeSnapshot> {

    @Serial private static final long serialVersionUID = 3310712648917405521L;

    TreeSnapshotSerializer() {
        super(TreeSnapshot.class);
    }

    @Override
    public void serialize(TreeSnapshot snapshot, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeNumberField(TreeSnapshotDeserializer.FORMAT_VERSION, snapshot.formatVersion());
        gen.writeArrayFieldStart(TreeSnapshotDeserializer.NODES);
        for (NodeRecord record : snapshot.nodes()) {
            gen.writeStartObject();
            gen.writeNumberField(TreeSnapshotDeserializer.NODE_ID, record.nodeId());
            if (record.parentId() != null) {
                gen.writeNumberField(TreeSnapshotDeserializer.PARENT_ID, record.parentId());
            } else {
                gen.writeNullField(TreeSnapshotDeserializer.PARENT_ID);
            }
            gen.writeStringField(TreeSnapshotDeserializer.PLUGIN_CLASS, record.pluginClassName());
            provider.defaultSerializeField(
                    TreeSnapshotDeserializer.PLUGIN_PARAMS, record.parameterValues(), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
