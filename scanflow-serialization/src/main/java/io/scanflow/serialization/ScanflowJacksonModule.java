package io.scanflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.scanflow.core.data.Dataset;
import io.scanflow.core.scan.Scan;
import io.scanflow.core.tree.TreeSnapshot;
import java.io.Serial;

/// Jackson `SimpleModule` registering all Scanflow type handlers in one place.
///
/// - `TreeSnapshot`: {@link TreeSnapshotSerializer} / {@link TreeSnapshotDeserializer}
/// - `Dataset`: {@link DatasetSerializer} (write only)
/// - `Scan`: {@link ScanSerializer} (write only)
///
/// @see TreeSerializer for the convenience factory API
public class ScanflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5520817392706318014L;

    public ScanflowJacksonModule() {
        super("ScanflowJacksonModule");

        addSerializer(TreeSnapshot.class, new TreeSnapshotSerializer());
        addDeserializer(TreeSnapshot.class, new TreeSnapshotDeserializer());

        addSerializer(Dataset.class, new DatasetSerializer());
        addSerializer(Scan.class, new ScanSerializer());
    }
}
