package gr.imsi.athenarc.uroflow.projection;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

/**
 * Writes exports as comma-separated files into a directory.
 */
public class CsvExportSink implements ExportSink {

    private static final Logger LOG = LoggerFactory.getLogger(CsvExportSink.class);

    private final Path directory;

    public CsvExportSink(Path directory) {
        this.directory = directory;
    }

    @Override
    public void export(String suggestedFilename, ExportTable table) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(suggestedFilename);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            CsvWriterSettings settings = new CsvWriterSettings();
            settings.getFormat().setLineSeparator("\n");
            CsvWriter csvWriter = new CsvWriter(writer, settings);
            for (List<String> record : table.toRecords()) {
                csvWriter.writeRow(record.toArray());
            }
            csvWriter.flush();
        }
        LOG.info("Exported {} rows to {}", table.getRows().size(), file);
    }
}
