package io.gdcc.healthdcat.reader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.gdcc.healthdcat.error.SourceReadException;
import io.gdcc.healthdcat.model.Record;
import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.plugin.ReaderPlugin;
import io.gdcc.healthdcat.plugin.StageOptions;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads UTF-8 CSV with a header row into a {@link RecordSet}. Every cell becomes a string value;
 * empty cells stay empty strings. Options: {@code delimiter} (single character, default {@code
 * ,}) and {@code trim} (strip surrounding whitespace, default false).
 */
public class CsvReaderPlugin implements ReaderPlugin {
    public static final String NAME = "csv_reader";

    private static final Logger log = LoggerFactory.getLogger(CsvReaderPlugin.class);
    private static final TypeReference<Map<String, String>> ROW_TYPE = new TypeReference<>() {};

    private final CsvMapper mapper = new CsvMapper();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RecordSet execute(RecordSource source, StageOptions options) throws SourceReadException {
        CsvSchema schema =
                CsvSchema.emptySchema()
                        .withHeader()
                        .withColumnSeparator(delimiter(options));
        ObjectReader reader = mapper.readerFor(ROW_TYPE).with(schema);
        if (options.getBoolean("trim", false)) {
            reader = reader.with(CsvParser.Feature.TRIM_SPACES);
        }
        List<Record> records = new ArrayList<>();
        try (InputStream in = source.open();
                MappingIterator<Map<String, String>> rows = reader.readValues(in)) {
            while (rows.hasNextValue()) {
                records.add(Record.of(rows.nextValue()));
            }
        } catch (NoSuchFileException e) {
            throw new SourceReadException(NAME, "Source not found: " + source.describe(), e);
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new SourceReadException(
                    NAME,
                    "Could not read CSV from " + source.describe() + ": " + e.getMessage(),
                    e);
        }
        if (records.isEmpty()) {
            log.warn("No data rows read from {}", source.describe());
        } else {
            log.debug("Read {} rows from {}", records.size(), source.describe());
        }
        return RecordSet.of(records);
    }

    private char delimiter(StageOptions options) throws SourceReadException {
        String delimiter = options.getString("delimiter");
        if (delimiter == null || delimiter.isEmpty()) {
            return ',';
        }
        if (delimiter.length() != 1) {
            throw new SourceReadException(
                    NAME, "Option 'delimiter' must be a single character, got '" + delimiter + "'");
        }
        return delimiter.charAt(0);
    }
}
