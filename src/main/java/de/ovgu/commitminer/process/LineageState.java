package de.ovgu.commitminer.process;

import de.ovgu.commitminer.cache.FileFingerprint;
import de.ovgu.commitminer.vcs.Commit;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * What the worker of one slot knows about the tree it last recorded: the commit and the fingerprints of its eligible
 * files.  Only used by the thread holding the slot.
 */
class LineageState {
    private Commit lastCommit;
    private Map<String, FileFingerprint> fingerprints = Collections.emptyMap();

    Optional<Commit> getLastCommit() {
        return Optional.ofNullable(lastCommit);
    }

    Optional<FileFingerprint> fingerprintOf(String path) {
        return Optional.ofNullable(fingerprints.get(path));
    }

    void update(Commit commit, Map<String, FileFingerprint> fingerprintsByPath) {
        this.lastCommit = commit;
        this.fingerprints = new HashMap<>(fingerprintsByPath);
    }

    /**
     * Forget everything, so that the next commit gets a full scan.
     */
    void clear() {
        this.lastCommit = null;
        this.fingerprints = Collections.emptyMap();
    }
}
