package de.ovgu.commitminer.util;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Static helpers for files.
 */
public final class FileUtils {
    private FileUtils() {
    }

    public static boolean isNonEmptyRegularFile(File file) {
        return file.isFile() && file.length() > 0;
    }

    /**
     * @return The path of <code>file</code> relative to <code>dir</code>, with <code>/</code> as the separator,
     * regardless of the platform
     */
    public static String pathRelativeTo(File file, File dir) {
        final Path canonicalDir;
        final Path canonicalFile;
        try {
            canonicalDir = dir.getCanonicalFile().toPath();
        } catch (IOException e) {
            throw new RuntimeException("Failed to determine canonical name of directory " + dir.getAbsolutePath(), e);
        }
        try {
            canonicalFile = file.getCanonicalFile().toPath();
        } catch (IOException e) {
            throw new RuntimeException("Failed to determine canonical name of file " + file.getAbsolutePath(), e);
        }
        return canonicalDir.relativize(canonicalFile).toString().replace(File.separatorChar, '/');
    }

    /**
     * Write the given bytes to <code>target</code> such that readers see either the old or the new contents, never a
     * partially written file.  The data goes to a temporary file in the same directory first, which is then moved
     * over the target.
     */
    public static void writeAtomically(File target, byte[] contents) throws IOException {
        File dir = target.getAbsoluteFile().getParentFile();
        if (!dir.isDirectory() && !dir.mkdirs()) {
            throw new IOException("Failed to create directory " + dir);
        }
        Path tmp = Files.createTempFile(dir.toPath(), "." + target.getName(), ".tmp");
        try {
            Files.write(tmp, contents);
            try {
                Files.move(tmp, target.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target.toPath(), StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
