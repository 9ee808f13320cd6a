package io.scanflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.scanflow.core.scan.Scan;
import io.scanflow.core.scan.ScanDimension;
import java.io.IOException;
import java.io.Serial;

/// Writes the geometry of a {@link Scan} for result provenance.
///
/// @implNote Package-private. Registered by {@link ScanflowJacksonModule}. Export only.
class ScanSerializer extends StdSerializer<Scan> {

    @Serial private static final long serialVersionUID = -725130412964618231L;

    ScanSerializer() {
        super(Scan.class);
    }

    @Override
    public void serialize(Scan scan, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("title", scan.getTitle());
        gen.writeArrayFieldStart("dimensions");
        for (ScanDimension dimension : scan.getDimensions()) {
            gen.writeStartObject();
            gen.writeStringField("label", dimension.label());
            gen.writeStringField("unit", dimension.unit());
            gen.writeNumberField("offset", dimension.offset());
            gen.writeNumberField("delta", dimension.delta());
            gen.writeNumberField("points", dimension.points());
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
