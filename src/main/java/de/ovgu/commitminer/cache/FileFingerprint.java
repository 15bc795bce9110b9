package de.ovgu.commitminer.cache;

import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectInserter;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

/**
 * Content hash of a single file.  The hash is the git blob id of the content, so a fingerprint equals the id git
 * itself assigns to the file.
 */
public final class FileFingerprint implements Comparable<FileFingerprint> {
    private final ObjectId id;

    private FileFingerprint(ObjectId id) {
        this.id = id;
    }

    public static FileFingerprint of(byte[] content) {
        try (ObjectInserter.Formatter formatter = new ObjectInserter.Formatter()) {
            return new FileFingerprint(formatter.idFor(Constants.OBJ_BLOB, content));
        }
    }

    public static FileFingerprint of(File file) throws IOException {
        return of(Files.readAllBytes(file.toPath()));
    }

    /**
     * @throws IllegalArgumentException if <code>hex</code> is not a 40-digit hexadecimal SHA-1
     */
    public static FileFingerprint fromHex(String hex) {
        if (hex == null || !ObjectId.isId(hex)) {
            throw new IllegalArgumentException("Not a valid fingerprint: " + hex);
        }
        return new FileFingerprint(ObjectId.fromString(hex));
    }

    public String toHex() {
        return id.getName();
    }

    @Override
    public int compareTo(FileFingerprint o) {
        return id.compareTo(o.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileFingerprint)) return false;
        return id.equals(((FileFingerprint) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return toHex();
    }
}
