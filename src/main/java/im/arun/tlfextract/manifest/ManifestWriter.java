package im.arun.tlfextract.manifest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import im.arun.tlfextract.model.Manifest;
import im.arun.tlfextract.model.ManifestRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists manifest.json and manifest.csv.
 */
public class ManifestWriter {
    private static final Logger logger = LoggerFactory.getLogger(ManifestWriter.class);

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;
    private final ManifestBuilder manifestBuilder;

    public ManifestWriter(ManifestBuilder manifestBuilder) {
        this.manifestBuilder = manifestBuilder;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.csvMapper = new CsvMapper();
    }

    public void write(Manifest manifest, Path outputDir) throws IOException {
        Path jsonPath = outputDir.resolve(OutputLayout.MANIFEST_JSON);
        objectMapper.writeValue(jsonPath.toFile(), manifest);

        Path csvPath = outputDir.resolve(OutputLayout.MANIFEST_CSV);
        List<ManifestRow> rows = manifestBuilder.toRows(manifest);
        CsvSchema schema = csvMapper.schemaFor(ManifestRow.class).withHeader();
        csvMapper.writer(schema).writeValue(csvPath.toFile(), rows);

        logger.info("Wrote {} and {} ({} rows)", jsonPath, csvPath, rows.size());
    }
}
