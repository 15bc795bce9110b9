package de.ovgu.commitminer.process;

import de.ovgu.commitminer.util.FileUtils;
import de.ovgu.commitminer.util.Json;
import de.ovgu.commitminer.vcs.Commit;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.FilenameFilter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The directory of per-commit records: <code>&lt;commit&gt;.json</code> for commits that were analyzed successfully,
 * <code>&lt;commit&gt;.error.json</code> for commits that failed.  A commit has at most one of the two.  Records are
 * written atomically, so a record that exists is always complete.
 */
public class ResultStore {
    private static final Logger LOG = Logger.getLogger(ResultStore.class);

    public static final String SUCCESS_SUFFIX = ".json";
    public static final String ERROR_SUFFIX = ".error.json";

    private static final FilenameFilter SUCCESS_FILTER = (dir, name) ->
            !name.startsWith(".") && name.endsWith(SUCCESS_SUFFIX) && !name.endsWith(ERROR_SUFFIX);
    private static final FilenameFilter ERROR_FILTER = (dir, name) ->
            !name.startsWith(".") && name.endsWith(ERROR_SUFFIX);

    private final File dir;

    public ResultStore(File dir) {
        this.dir = dir;
    }

    public File getDirectory() {
        return dir;
    }

    File successFile(String commitId) {
        return new File(dir, commitId + SUCCESS_SUFFIX);
    }

    File errorFile(String commitId) {
        return new File(dir, commitId + ERROR_SUFFIX);
    }

    /**
     * @return <code>true</code> if a success or error record exists for the commit
     */
    public boolean hasRecord(Commit commit) {
        return successFile(commit.getId()).isFile() || errorFile(commit.getId()).isFile();
    }

    public void writeSuccess(CommitResultRecord record) {
        write(successFile(record.getCommit()), record);
        removeIfExists(errorFile(record.getCommit()));
    }

    public void writeError(CommitErrorRecord record) {
        write(errorFile(record.getCommit()), record);
        removeIfExists(successFile(record.getCommit()));
    }

    private void write(File target, Object record) {
        try {
            FileUtils.writeAtomically(target, Json.mapper().writeValueAsBytes(record));
        } catch (IOException e) {
            throw new ResultStoreException("Failed to write record " + target, e);
        }
    }

    private static void removeIfExists(File f) {
        if (f.exists() && !f.delete()) {
            throw new ResultStoreException("Failed to delete outdated record " + f, null);
        }
    }

    /**
     * Read all success records.  Records that cannot be parsed are logged and left out.
     */
    public List<CommitResultRecord> readSuccessRecords() {
        return readAll(SUCCESS_FILTER, CommitResultRecord.class);
    }

    /**
     * Read all error records.  Records that cannot be parsed are logged and left out.
     */
    public List<CommitErrorRecord> readErrorRecords() {
        return readAll(ERROR_FILTER, CommitErrorRecord.class);
    }

    private <T> List<T> readAll(FilenameFilter filter, Class<T> recordClass) {
        String[] names = dir.list(filter);
        if (names == null) {
            return new ArrayList<>();
        }
        Arrays.sort(names);
        List<T> result = new ArrayList<>(names.length);
        for (String name : names) {
            File f = new File(dir, name);
            try {
                result.add(Json.mapper().readValue(f, recordClass));
            } catch (IOException e) {
                LOG.warn("Ignoring unreadable record " + f + ": " + e.getMessage());
            }
        }
        return result;
    }

    /**
     * Delete all error records, so that the failed commits are processed again.
     *
     * @return Number of records deleted
     */
    public int deleteErrorRecords() {
        String[] names = dir.list(ERROR_FILTER);
        if (names == null) return 0;
        int deleted = 0;
        for (String name : names) {
            File f = new File(dir, name);
            if (f.delete()) {
                deleted++;
            } else {
                LOG.warn("Failed to delete error record " + f);
            }
        }
        return deleted;
    }
}
