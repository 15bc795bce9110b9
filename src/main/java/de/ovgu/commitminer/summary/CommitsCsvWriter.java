package de.ovgu.commitminer.summary;

import de.ovgu.commitminer.process.CommitErrorRecord;
import de.ovgu.commitminer.process.CommitResultRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Writes one line per commit record, ordered by position in the history.
 */
public class CommitsCsvWriter {
    private static final Logger LOG = Logger.getLogger(CommitsCsvWriter.class);

    public void write(File csvFile, List<CommitResultRecord> successes, List<CommitErrorRecord> errors) throws IOException {
        List<Object[]> rows = new ArrayList<>(successes.size() + errors.size());
        CommitsCsvColumns[] columns = CommitsCsvColumns.values();
        for (CommitResultRecord r : successes) {
            Object[] row = new Object[columns.length];
            for (int i = 0; i < columns.length; i++) {
                row[i] = columns[i].successValue(r);
            }
            rows.add(row);
        }
        for (CommitErrorRecord r : errors) {
            Object[] row = new Object[columns.length];
            for (int i = 0; i < columns.length; i++) {
                row[i] = columns[i].errorValue(r);
            }
            rows.add(row);
        }
        final int positionColumn = CommitsCsvColumns.POSITION.ordinal();
        rows.sort(Comparator.comparingInt(row -> (Integer) row[positionColumn]));

        try (Writer out = new OutputStreamWriter(new FileOutputStream(csvFile), StandardCharsets.UTF_8);
             CSVPrinter csv = new CSVPrinter(out, CSVFormat.EXCEL)) {
            Object[] header = new Object[columns.length];
            for (int i = 0; i < columns.length; i++) {
                header[i] = columns[i].name();
            }
            csv.printRecord(header);
            for (Object[] row : rows) {
                csv.printRecord(row);
            }
        }
        LOG.info("Wrote " + rows.size() + " commits to " + csvFile);
    }
}
