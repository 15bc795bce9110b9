package de.ovgu.commitminer.analysis;

import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reports one violation of rule <code>TodoComment</code> per line containing <code>TODO</code>, and one of
 * <code>SystemPrintln</code> per line containing <code>System.out</code>.  Fails for files containing
 * <code>FAIL_ANALYSIS</code>.  Remembers every request.
 */
public class RecordingAnalyzer implements Analyzer {
    public static final String FAIL_MARKER = "FAIL_ANALYSIS";

    private final List<List<String>> requests = Collections.synchronizedList(new ArrayList<>());

    @Override
    public AnalysisReport analyze(AnalysisRequest request) {
        requests.add(new ArrayList<>(request.getFiles()));
        AnalysisReport report = new AnalysisReport();
        for (String path : request.getFiles()) {
            final List<String> lines;
            try {
                lines = FileUtils.readLines(new File(request.getRoot(), path), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line.contains(FAIL_MARKER)) {
                    throw new AnalysisException(AnalysisException.Cause.EXIT_CODE, "Simulated failure on " + path);
                }
                if (line.contains("TODO")) {
                    report.addViolation(new Violation(path, "TodoComment", "TODO found", i + 1));
                }
                if (line.contains("System.out")) {
                    report.addViolation(new Violation(path, "SystemPrintln", "System.out used", i + 1));
                }
            }
        }
        return report;
    }

    /**
     * @return The file lists of all calls so far
     */
    public List<List<String>> getRequests() {
        synchronized (requests) {
            return new ArrayList<>(requests);
        }
    }

    public int getCallCount() {
        return requests.size();
    }
}
