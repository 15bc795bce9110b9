package de.ovgu.commitminer.analysis;

import de.ovgu.commitminer.util.ExternalCommand;
import de.ovgu.commitminer.util.ExternalCommandException;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the PMD executable once per request.  The files to analyze are passed in a file list, and the JSON report is
 * written to a temporary file outside the working tree, so neither pollutes the tree.
 */
public class PmdCommandLineAnalyzer implements Analyzer {
    private static final Logger LOG = Logger.getLogger(PmdCommandLineAnalyzer.class);

    /**
     * PMD exits with 4 if it found violations, unless told otherwise.
     */
    static final int EXIT_OK = 0;
    static final int EXIT_VIOLATIONS_FOUND = 4;

    private final String pmdProg;
    private final long timeoutMillis;

    public PmdCommandLineAnalyzer(String pmdProg, long timeoutMillis) {
        this.pmdProg = pmdProg;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public AnalysisReport analyze(AnalysisRequest request) {
        if (request.getFiles().isEmpty()) {
            return AnalysisReport.empty();
        }

        File fileList = null;
        File reportFile = null;
        try {
            try {
                fileList = Files.createTempFile("pmd-files-", ".txt").toFile();
                reportFile = Files.createTempFile("pmd-report-", ".json").toFile();
                writeFileList(fileList, request);
            } catch (IOException e) {
                throw new AnalysisException(AnalysisException.Cause.IO, "Failed to prepare PMD input files", e);
            }

            ExternalCommand.Result result;
            try {
                result = ExternalCommand.of(pmdProg, buildArgs(request, fileList, reportFile))
                        .in(request.getRoot())
                        .withTimeout(timeoutMillis)
                        .run();
            } catch (ExternalCommandException e) {
                throw new AnalysisException(AnalysisException.Cause.IO, "Failed to run PMD: " + e.getMessage(), e);
            }

            if (result.isTimedOut()) {
                throw new AnalysisException(AnalysisException.Cause.TIMEOUT,
                        "PMD did not finish within " + (timeoutMillis / 1000) + " seconds");
            }
            int exitCode = result.getExitCode();
            if (exitCode != EXIT_OK && exitCode != EXIT_VIOLATIONS_FOUND) {
                throw new AnalysisException(AnalysisException.Cause.EXIT_CODE, "PMD exited with code " + exitCode);
            }

            return new PmdReportParser(request.getRoot()).parse(reportFile);
        } finally {
            deleteQuietly(fileList);
            deleteQuietly(reportFile);
        }
    }

    List<String> buildArgs(AnalysisRequest request, File fileList, File reportFile) {
        List<String> args = new ArrayList<>();
        args.add("check");
        args.add("--file-list");
        args.add(fileList.getAbsolutePath());
        args.add("--rulesets");
        args.add(request.getRuleset().getAbsolutePath());
        args.add("--format");
        args.add("json");
        args.add("--report-file");
        args.add(reportFile.getAbsolutePath());
        args.add("--no-fail-on-violation");
        args.add("--no-cache");
        args.add("--no-progress");
        if (!request.getAuxClasspath().isEmpty()) {
            args.add("--aux-classpath");
            args.add(request.getAuxClasspath());
        }
        return args;
    }

    private static void writeFileList(File fileList, AnalysisRequest request) throws IOException {
        List<String> lines = new ArrayList<>(request.getFiles().size());
        for (String path : request.getFiles()) {
            lines.add(new File(request.getRoot(), path).getAbsolutePath());
        }
        Files.write(fileList.toPath(), lines, StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(File f) {
        if (f != null && f.exists() && !f.delete()) {
            LOG.debug("Could not delete temporary file " + f);
        }
    }
}
