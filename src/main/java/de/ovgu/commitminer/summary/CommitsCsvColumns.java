package de.ovgu.commitminer.summary;

import de.ovgu.commitminer.process.CommitErrorRecord;
import de.ovgu.commitminer.process.CommitResultRecord;

/**
 * Columns of <code>commits.csv</code>.
 */
public enum CommitsCsvColumns {
    POSITION {
        @Override
        Object successValue(CommitResultRecord r) {
            return r.getPosition();
        }

        @Override
        Object errorValue(CommitErrorRecord r) {
            return r.getPosition();
        }
    },
    COMMIT {
        @Override
        Object successValue(CommitResultRecord r) {
            return r.getCommit();
        }

        @Override
        Object errorValue(CommitErrorRecord r) {
            return r.getCommit();
        }
    },
    STATUS {
        @Override
        Object successValue(CommitResultRecord r) {
            return r.getStatus();
        }

        @Override
        Object errorValue(CommitErrorRecord r) {
            return r.getStatus();
        }
    },
    SLOT {
        @Override
        Object successValue(CommitResultRecord r) {
            return r.getSlot();
        }

        @Override
        Object errorValue(CommitErrorRecord r) {
            return r.getSlot();
        }
    },
    FILES {
        @Override
        Object successValue(CommitResultRecord r) {
            return r.getFileCount();
        }
    },
    CHANGED_FILES {
        @Override
        Object successValue(CommitResultRecord r) {
            return r.getChangedFileCount();
        }
    },
    ANALYZED_FILES {
        @Override
        Object successValue(CommitResultRecord r) {
            return r.getAnalyzedFileCount();
        }
    },
    VIOLATIONS {
        @Override
        Object successValue(CommitResultRecord r) {
            return r.getViolationCount();
        }
    },
    FULL_SCAN {
        @Override
        Object successValue(CommitResultRecord r) {
            return r.isFullScan() ? 1 : 0;
        }
    },
    FAILURE_CAUSE {
        @Override
        Object successValue(CommitResultRecord r) {
            return "";
        }

        @Override
        Object errorValue(CommitErrorRecord r) {
            return r.describeCause();
        }
    },
    DURATION_MILLIS {
        @Override
        Object successValue(CommitResultRecord r) {
            return r.getDurationMillis();
        }

        @Override
        Object errorValue(CommitErrorRecord r) {
            return r.getDurationMillis();
        }
    };

    abstract Object successValue(CommitResultRecord r);

    /**
     * Columns without a meaningful value for failed commits stay empty.
     */
    Object errorValue(CommitErrorRecord r) {
        return "";
    }
}
