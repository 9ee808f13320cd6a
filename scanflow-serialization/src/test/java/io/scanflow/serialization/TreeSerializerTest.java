package io.scanflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.scanflow.core.plugin.BasePlugin;
import io.scanflow.core.tree.NodeRecord;
import io.scanflow.core.tree.ProcessingTree;
import io.scanflow.core.tree.TreeSnapshot;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TreeSerializerTest {

    @Nested
    class RoundTripTest {

        @Test
        void shouldPreserveStructureAndParameters() throws Exception {
            // Given
            ProcessingTree original = SamplePlugins.tree();

            // When
            String json = TreeSerializer.toJson(original.exportSnapshot());
            ProcessingTree restored = new ProcessingTree();
            restored.restore(TreeSerializer.fromJson(json), SamplePlugins.registry());

            // Then
            assertThat(restored.getNodeIds()).containsExactly(0, 1, 2);
            assertThat(restored.getNode(1).getParentId()).isZero();
            assertThat(restored.getNode(2).getParentId()).isZero();
            assertThat(restored.getNode(1).getPlugin().getParameterValues())
                    .containsEntry(BasePlugin.LABEL, "double")
                    .containsEntry(SamplePlugins.Scale.FACTOR, 2.0);
            assertThat(restored.getNode(2).getPlugin().getParameterValues())
                    .containsEntry(SamplePlugins.Scale.MODE, "log")
                    .containsEntry(BasePlugin.KEEP_RESULTS, false);
            assertThat(restored.exportSnapshot()).isEqualTo(original.exportSnapshot());
        }

        @Test
        void shouldWriteVersionedNodeList() throws Exception {
            String json = TreeSerializer.toJson(SamplePlugins.tree().exportSnapshot());

            JsonNode root = TreeSerializer.createMapper().readTree(json);

            assertThat(root.get("formatVersion").asInt())
                    .isEqualTo(TreeSnapshot.CURRENT_FORMAT_VERSION);
            assertThat(root.get("nodes")).hasSize(3);
            assertThat(root.get("nodes").get(0).get("parentId").isNull()).isTrue();
            assertThat(root.get("nodes").get(1).get("pluginClass").asText())
                    .isEqualTo(SamplePlugins.Scale.class.getName());
            assertThat(root.get("nodes").get(0).get("pluginParams").get("length").asInt())
                    .isEqualTo(3);
        }
    }

    @Nested
    class ReadTest {

        @Test
        void shouldTreatMissingVersionAsFirstFormat() {
            String json =
                    """
                    {"nodes": [{"nodeId": 4, "pluginClass": "x.Source"}]}
                    """;

            TreeSnapshot snapshot = TreeSerializer.fromJson(json);

            assertThat(snapshot.formatVersion()).isEqualTo(1);
            NodeRecord node = snapshot.nodes().get(0);
            assertThat(node.nodeId()).isEqualTo(4);
            assertThat(node.parentId()).isNull();
            assertThat(node.parameterValues()).isEmpty();
        }

        @Test
        void shouldIgnoreUnknownFields() {
            String json =
                    """
                    {"formatVersion": 1, "author": "beamline", "nodes": []}
                    """;

            assertThat(TreeSerializer.fromJson(json).nodes()).isEmpty();
        }

        @Test
        void shouldRejectNewerFormatVersion() {
            String json =
                    """
                    {"formatVersion": 99, "nodes": []}
                    """;

            assertThatThrownBy(() -> TreeSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unsupported tree format version 99");
        }

        @Test
        void shouldRejectRecordWithoutPluginClass() {
            String json =
                    """
                    {"formatVersion": 1, "nodes": [{"nodeId": 0}]}
                    """;

            assertThatThrownBy(() -> TreeSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("pluginClass");
        }

        @Test
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> TreeSerializer.fromJson("{\"nodes\": ["))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
