package de.ovgu.commitminer.analysis;

import de.ovgu.commitminer.util.RetryPolicy;

/**
 * Repeats analyzer calls that failed in a way that is marked as retryable.
 */
public class RetryingAnalyzer implements Analyzer {
    private final Analyzer delegate;
    private final RetryPolicy retryPolicy;

    public RetryingAnalyzer(Analyzer delegate, RetryPolicy retryPolicy) {
        this.delegate = delegate;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public AnalysisReport analyze(AnalysisRequest request) {
        return retryPolicy.call("analysis of " + request, () -> delegate.analyze(request),
                e -> e instanceof AnalysisException && ((AnalysisException) e).isRetryable());
    }
}
