package io.scanflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.scanflow.core.data.AxisMetadata;
import io.scanflow.core.data.Dataset;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link Dataset} with its shape, axis metadata and flat row-major values.
///
/// NaN values, the marker for missing results, are written as the string `"NaN"`.
///
/// @implNote Package-private. Registered by {@link ScanflowJacksonModule}. Export only.
class DatasetSerializer extends StdSerializer<Dataset> {

    @Serial private static final long serialVersionUID = 1847730098453287110L;

    DatasetSerializer() {
        super(Dataset.class);
    }

    @Override
    public void serialize(Dataset dataset, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        int[] shape = dataset.getShape();
        gen.writeFieldName("shape");
        gen.writeArray(shape, 0, shape.length);
        gen.writeStringField("dataLabel", dataset.getDataLabel());
        gen.writeStringField("dataUnit", dataset.getDataUnit());

        gen.writeArrayFieldStart("axes");
        for (AxisMetadata axis : dataset.getAxes()) {
            gen.writeStartObject();
            gen.writeStringField("label", axis.label());
            gen.writeStringField("unit", axis.unit());
            double[] range = axis.range();
            if (range != null) {
                gen.writeFieldName("range");
                writeDoubles(gen, range);
            }
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeFieldName("data");
        writeDoubles(gen, dataset.getData());
        gen.writeEndObject();
    }

    private static void writeDoubles(JsonGenerator gen, double[] values) throws IOException {
        gen.writeStartArray();
        for (double value : values) {
            if (Double.isNaN(value)) {
                gen.writeString("NaN");
            } else {
                gen.writeNumber(value);
            }
        }
        gen.writeEndArray();
    }
}
