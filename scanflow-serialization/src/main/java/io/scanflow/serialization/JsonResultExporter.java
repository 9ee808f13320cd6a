package io.scanflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scanflow.core.exception.ResultExportException;
import io.scanflow.core.export.NodeResultExport;
import io.scanflow.core.export.ResultExporter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/// Exports a node result, with full provenance, as one JSON document.
///
/// ```
/// {
///   "nodeId": 2, "label": "...", "plugin": "...", "pluginClass": "...",
///   "exportedAt": "2024-01-01T00:00:00Z",
///   "result": { "shape": [...], "axes": [...], "data": [...] },
///   "provenance": { "tree": { ... }, "scan": { ... }, "experiment": { ... } }
/// }
/// ```
///
/// Discovered by `ScanflowFactory` through `META-INF/services`.
public class JsonResultExporter implements ResultExporter {

    private final ObjectMapper mapper = TreeSerializer.createMapper();

    @Override
    public String getFormat() {
        return "json";
    }

    @Override
    public String getExtension() {
        return "json";
    }

    @Override
    public void export(Path file, NodeResultExport result) {
        try (OutputStream out = Files.newOutputStream(file);
                JsonGenerator gen = mapper.createGenerator(out)) {
            gen.writeStartObject();
            gen.writeNumberField("nodeId", result.nodeId());
            gen.writeStringField("label", result.label());
            gen.writeStringField("plugin", result.pluginName());
            gen.writeStringField("pluginClass", result.pluginClassName());
            gen.writeObjectField("exportedAt", Instant.now());
            gen.writeObjectField("result", result.data());

            gen.writeObjectFieldStart("provenance");
            gen.writeObjectField("tree", result.tree());
            gen.writeObjectField("scan", result.context().scan());
            gen.writeObjectField("experiment", result.context().experiment());
            gen.writeEndObject();

            gen.writeEndObject();
        } catch (IOException e) {
            throw new ResultExportException(
                    "Failed to export result of node #" + result.nodeId() + " to " + file, e);
        }
    }
}
