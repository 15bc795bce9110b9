package de.ovgu.commitminer.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import de.ovgu.commitminer.util.FileUtils;
import de.ovgu.commitminer.util.Json;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.SortedMap;

/**
 * Persists the whole {@link ContentCache} as one JSON object (fingerprint &rarr; entry).  Snapshots are written
 * atomically, so a crash during a save leaves the previous snapshot intact.
 */
public class CacheSnapshotFile {
    private static final Logger LOG = Logger.getLogger(CacheSnapshotFile.class);

    private static final TypeReference<Map<String, CacheEntry>> SNAPSHOT_TYPE = new TypeReference<Map<String, CacheEntry>>() {
    };

    private final File file;
    private long savedModificationCount = -1;

    public CacheSnapshotFile(File file) {
        this.file = file;
    }

    public File getFile() {
        return file;
    }

    /**
     * Fill the cache from the snapshot file, if there is one.
     *
     * @throws CacheIOException if the file exists but cannot be read or parsed
     */
    public synchronized void loadInto(ContentCache cache) {
        if (!file.exists()) {
            LOG.info("No cache snapshot at " + file + ". Starting with an empty cache.");
            return;
        }
        final Map<String, CacheEntry> entries;
        try {
            entries = Json.mapper().readValue(file, SNAPSHOT_TYPE);
        } catch (IOException e) {
            throw new CacheIOException("Failed to load cache snapshot " + file, e);
        }
        if (entries != null) {
            cache.restore(entries);
        }
        savedModificationCount = cache.getModificationCount();
        LOG.info("Loaded " + cache.size() + " cache entries from " + file);
    }

    /**
     * Write the current content of the cache, unless nothing was added since the last save.
     *
     * @throws CacheIOException if the snapshot cannot be written
     */
    public synchronized void save(ContentCache cache) {
        long modificationCount = cache.getModificationCount();
        if (modificationCount == savedModificationCount && file.exists()) {
            LOG.debug("Cache unchanged since last save. Not writing " + file);
            return;
        }
        SortedMap<String, CacheEntry> entries = cache.snapshot();
        try {
            FileUtils.writeAtomically(file, Json.mapper().writeValueAsBytes(entries));
        } catch (IOException e) {
            throw new CacheIOException("Failed to save cache snapshot " + file, e);
        }
        savedModificationCount = modificationCount;
        LOG.info("Saved " + entries.size() + " cache entries to " + file);
    }
}
