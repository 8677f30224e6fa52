package gr.imsi.athenarc.uroflow.projection;

import java.io.IOException;

/**
 * Consumer of on-demand exports.
 */
public interface ExportSink {

    /**
     * @param suggestedFilename name built from the patient and the active date range
     * @param table the rows to export
     * @throws IOException if the export cannot be written
     */
    void export(String suggestedFilename, ExportTable table) throws IOException;
}
