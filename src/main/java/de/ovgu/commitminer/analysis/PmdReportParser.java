package de.ovgu.commitminer.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import de.ovgu.commitminer.util.FileUtils;
import de.ovgu.commitminer.util.Json;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;

/**
 * Reads PMD's JSON report format.  File names in the report are mapped to paths relative to the analyzed tree.
 */
public class PmdReportParser {
    private static final Logger LOG = Logger.getLogger(PmdReportParser.class);

    private final File root;

    /**
     * @param root Root of the analyzed working tree
     */
    public PmdReportParser(File root) {
        this.root = root.getAbsoluteFile();
    }

    public AnalysisReport parse(File reportFile) {
        if (!FileUtils.isNonEmptyRegularFile(reportFile)) {
            throw new AnalysisException(AnalysisException.Cause.REPORT, "PMD report " + reportFile + " is missing or empty");
        }
        final JsonNode rootNode;
        try {
            rootNode = Json.mapper().readTree(reportFile);
        } catch (IOException e) {
            throw new AnalysisException(AnalysisException.Cause.REPORT, "Malformed PMD report " + reportFile, e);
        }
        return parse(rootNode);
    }

    public AnalysisReport parse(byte[] reportJson) {
        final JsonNode rootNode;
        try {
            rootNode = Json.mapper().readTree(reportJson);
        } catch (IOException e) {
            throw new AnalysisException(AnalysisException.Cause.REPORT, "Malformed PMD report", e);
        }
        return parse(rootNode);
    }

    AnalysisReport parse(JsonNode rootNode) {
        if (rootNode == null || !rootNode.isObject()) {
            throw new AnalysisException(AnalysisException.Cause.REPORT, "PMD report is not a JSON object");
        }
        JsonNode filesNode = rootNode.path("files");
        if (!filesNode.isMissingNode() && !filesNode.isArray()) {
            throw new AnalysisException(AnalysisException.Cause.REPORT, "\"files\" of PMD report is not an array");
        }

        AnalysisReport report = new AnalysisReport();
        for (JsonNode fileNode : filesNode) {
            String reportedName = fileNode.has("filename") ? fileNode.path("filename").asText() : fileNode.path("name").asText();
            if (reportedName.isEmpty()) {
                LOG.warn("Ignoring entry without file name in PMD report");
                continue;
            }
            String path = toTreeRelativePath(reportedName);
            for (JsonNode violationNode : fileNode.path("violations")) {
                String rule = violationNode.path("rule").asText();
                if (rule.isEmpty()) {
                    LOG.warn("Ignoring violation without rule name in " + path);
                    continue;
                }
                report.addViolation(new Violation(path, rule,
                        violationNode.path("description").asText(""),
                        violationNode.path("beginline").asInt(0)));
            }
        }

        for (JsonNode errorNode : rootNode.path("processingErrors")) {
            String message = errorNode.path("filename").asText("?") + ": " + errorNode.path("message").asText("");
            LOG.warn("PMD could not process " + message);
            report.addProcessingError(message);
        }
        for (JsonNode errorNode : rootNode.path("configurationErrors")) {
            LOG.warn("PMD configuration error in rule " + errorNode.path("rule").asText("?") + ": "
                    + errorNode.path("message").asText(""));
        }
        return report;
    }

    String toTreeRelativePath(String reportedName) {
        File reported = new File(reportedName);
        String relative;
        if (reported.isAbsolute()) {
            relative = FileUtils.pathRelativeTo(reported, root);
        } else {
            relative = reportedName.replace('\\', '/');
            while (relative.startsWith("./")) {
                relative = relative.substring(2);
            }
        }
        if (relative.startsWith("../")) {
            LOG.warn("PMD reported file " + reportedName + " outside of " + root);
        }
        return relative;
    }
}
