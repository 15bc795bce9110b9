package de.ovgu.commitminer.analysis;

/**
 * The static-analysis tool.  Implementations must be safe to call from several workers at once, each with its own
 * working tree.
 */
public interface Analyzer {
    /**
     * Analyze exactly the requested files.
     *
     * @throws AnalysisException if the tool fails, times out or produces no usable report
     */
    AnalysisReport analyze(AnalysisRequest request);
}
