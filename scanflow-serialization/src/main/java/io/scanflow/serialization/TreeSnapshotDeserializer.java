package io.scanflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.scanflow.core.tree.NodeRecord;
import io.scanflow.core.tree.TreeSnapshot;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Reads a {@link TreeSnapshot} written by {@link TreeSnapshotSerializer}.
///
/// Snapshots of a newer format version than {@link TreeSnapshot#CURRENT_FORMAT_VERSION} are
/// rejected. A missing version is read as version 1.
///
/// @implNote Package-private. Registered by {@link ScanflowJacksonModule}.
class TreeSnapshotDeserializer extends StdDeserializer<TreeSnapshot> {

    @Serial private static final long serialVersionUID = -6030377934166127849L;

    static final String FORMAT_VERSION = "formatVersion";
    static final String NODES = "nodes";
    static final String NODE_ID = "nodeId";
    static final String PARENT_ID = "parentId";
    static final String PLUGIN_CLASS = "pluginClass";
    static final String PLUGIN_PARAMS = "pluginParams";

    private static final TypeReference<LinkedHashMap<String, Object>> PARAMS =
            new TypeReference<>() {};

    TreeSnapshotDeserializer() {
        super(TreeSnapshot.class);
    }

    @Override
    public TreeSnapshot deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        int version = root.has(FORMAT_VERSION) ? root.get(FORMAT_VERSION).asInt() : 1;
        if (version < 1 || version > TreeSnapshot.CURRENT_FORMAT_VERSION) {
            throw JsonMappingException.from(
                    p,
                    "Unsupported tree format version "
                            + version
                            + " (supported: 1 to "
                            + TreeSnapshot.CURRENT_FORMAT_VERSION
                            + ")");
        }

        JsonNode nodes = root.get(NODES);
        if (nodes == null || !nodes.isArray()) {
            throw JsonMappingException.from(p, "Tree snapshot has no '" + NODES + "' array");
        }
        List<NodeRecord> records = new ArrayList<>(nodes.size());
        for (JsonNode node : nodes) {
            records.add(readRecord(p, mapper, node));
        }
        return new TreeSnapshot(version, records);
    }

    private NodeRecord readRecord(JsonParser p, ObjectMapper mapper, JsonNode node)
            throws IOException {
        JsonNode id = node.get(NODE_ID);
        JsonNode pluginClass = node.get(PLUGIN_CLASS);
        if (id == null || !id.canConvertToInt() || pluginClass == null || !pluginClass.isTextual()) {
            throw JsonMappingException.from(
                    p, "Node record needs '" + NODE_ID + "' and '" + PLUGIN_CLASS + "': " + node);
        }
        JsonNode parent = node.get(PARENT_ID);
        Integer parentId = parent == null || parent.isNull() ? null : parent.asInt();

        Map<String, Object> params = new LinkedHashMap<>();
        JsonNode paramNode = node.get(PLUGIN_PARAMS);
        if (paramNode != null && !paramNode.isNull()) {
            params = mapper.convertValue(paramNode, PARAMS);
        }
        return new NodeRecord(id.asInt(), parentId, pluginClass.asText(), params);
    }
}
