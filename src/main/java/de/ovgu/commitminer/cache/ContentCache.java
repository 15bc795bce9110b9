package de.ovgu.commitminer.cache;

import org.apache.log4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Maps file fingerprints to the findings of their first analysis.  Shared by all workers of a run.  Entries are never
 * replaced or evicted: the ruleset is fixed for a run, so the findings for a given content cannot change.
 * <p>
 * All methods hold the cache's monitor only for the duration of a map access.
 */
public class ContentCache {
    private static final Logger LOG = Logger.getLogger(ContentCache.class);

    private final Map<FileFingerprint, CacheEntry> entries = new HashMap<>();
    private long hits = 0;
    private long misses = 0;
    private long modificationCount = 0;

    public synchronized Optional<CacheEntry> lookup(FileFingerprint fingerprint) {
        CacheEntry entry = entries.get(fingerprint);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry);
    }

    /**
     * Add the findings for a fingerprint, unless another worker got there first.
     *
     * @return The entry now associated with the fingerprint
     */
    public synchronized CacheEntry store(FileFingerprint fingerprint, CacheEntry entry) {
        CacheEntry existing = entries.putIfAbsent(fingerprint, entry);
        if (existing != null) {
            if (!existing.equals(entry)) {
                LOG.warn("Analyzer reported different findings for identical content " + fingerprint + ": "
                        + existing + " vs. " + entry + ". Keeping the first.");
            }
            return existing;
        }
        modificationCount++;
        return entry;
    }

    /**
     * Add entries loaded from a snapshot.  Keys that are not valid fingerprints are skipped.
     */
    public synchronized void restore(Map<String, CacheEntry> snapshot) {
        int invalid = 0;
        for (Map.Entry<String, CacheEntry> e : snapshot.entrySet()) {
            final FileFingerprint fp;
            try {
                fp = FileFingerprint.fromHex(e.getKey());
            } catch (IllegalArgumentException iae) {
                invalid++;
                continue;
            }
            if (e.getValue() != null) {
                entries.putIfAbsent(fp, e.getValue());
            }
        }
        if (invalid > 0) {
            LOG.warn("Skipped " + invalid + " invalid entries of the cache snapshot.");
        }
    }

    /**
     * @return A copy of all entries, keyed by the hexadecimal fingerprint
     */
    public synchronized SortedMap<String, CacheEntry> snapshot() {
        SortedMap<String, CacheEntry> result = new TreeMap<>();
        for (Map.Entry<FileFingerprint, CacheEntry> e : entries.entrySet()) {
            result.put(e.getKey().toHex(), e.getValue());
        }
        return result;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long getHits() {
        return hits;
    }

    public synchronized long getMisses() {
        return misses;
    }

    /**
     * @return Number of entries added by {@link #store} so far; changes whenever the cache has grown
     */
    public synchronized long getModificationCount() {
        return modificationCount;
    }
}
