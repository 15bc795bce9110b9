package de.ovgu.commitminer.cache;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests the class {@link FileFingerprint}.
 */
class FileFingerprintTest {
    @TempDir
    File tempDir;

    @Test
    void shouldMatchGitBlobHash() {
        FileFingerprint fp = FileFingerprint.of("hello\n".getBytes(StandardCharsets.UTF_8));

        assertThat(fp.toHex()).isEqualTo("ce013625030ba8dba906f756967f9e9ca394464a");
    }

    @Test
    void shouldHashEmptyContentLikeGit() {
        assertThat(FileFingerprint.of(new byte[0]).toHex()).isEqualTo("e69de29bb2d1d6434b8b29ae775ad8c2e48c5391");
    }

    @Test
    void shouldDependOnContentOnly() throws IOException {
        File a = new File(tempDir, "a/A.java");
        File b = new File(tempDir, "b/Other.java");
        FileUtils.writeStringToFile(a, "class A {}", StandardCharsets.UTF_8);
        FileUtils.writeStringToFile(b, "class A {}", StandardCharsets.UTF_8);

        assertThat(FileFingerprint.of(a)).isEqualTo(FileFingerprint.of(b));
        assertThat(FileFingerprint.of(a)).isNotEqualTo(FileFingerprint.of("class B {}".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void shouldParseHexRepresentation() {
        FileFingerprint fp = FileFingerprint.of("x".getBytes(StandardCharsets.UTF_8));

        assertThat(FileFingerprint.fromHex(fp.toHex())).isEqualTo(fp).isEqualByComparingTo(fp);
    }

    @Test
    void shouldRejectInvalidHex() {
        assertThatIllegalArgumentException().isThrownBy(() -> FileFingerprint.fromHex("not-a-hash"));
        assertThatIllegalArgumentException().isThrownBy(() -> FileFingerprint.fromHex(null));
    }
}
