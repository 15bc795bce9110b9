package de.ovgu.commitminer.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Violations found by one analyzer call, grouped by tree-relative file path.
 */
public class AnalysisReport {
    private final SortedMap<String, List<Violation>> violationsByFile = new TreeMap<>();
    private final List<String> processingErrors = new ArrayList<>();

    public static AnalysisReport empty() {
        return new AnalysisReport();
    }

    void addViolation(Violation violation) {
        List<Violation> violations = violationsByFile.get(violation.getFile());
        if (violations == null) {
            violations = new ArrayList<>();
            violationsByFile.put(violation.getFile(), violations);
        }
        violations.add(violation);
    }

    void addProcessingError(String error) {
        processingErrors.add(error);
    }

    /**
     * @return The violations in the given file, empty if the analyzer reported none
     */
    public List<Violation> violationsIn(String file) {
        List<Violation> violations = violationsByFile.get(file);
        return violations == null ? Collections.<Violation>emptyList() : Collections.unmodifiableList(violations);
    }

    /**
     * @return Number of violations per rule in the given file
     */
    public SortedMap<String, Integer> countsByRule(String file) {
        SortedMap<String, Integer> result = new TreeMap<>();
        for (Violation v : violationsIn(file)) {
            result.merge(v.getRule(), 1, Integer::sum);
        }
        return result;
    }

    public SortedMap<String, List<Violation>> getViolationsByFile() {
        return Collections.unmodifiableSortedMap(violationsByFile);
    }

    public int getViolationCount() {
        int result = 0;
        for (Map.Entry<String, List<Violation>> e : violationsByFile.entrySet()) {
            result += e.getValue().size();
        }
        return result;
    }

    /**
     * @return Messages about files the analyzer could not process (e.g., syntax errors)
     */
    public List<String> getProcessingErrors() {
        return Collections.unmodifiableList(processingErrors);
    }
}
