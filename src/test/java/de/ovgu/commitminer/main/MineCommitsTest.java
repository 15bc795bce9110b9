package de.ovgu.commitminer.main;

import de.ovgu.commitminer.process.CommitResultRecord;
import de.ovgu.commitminer.process.ResultStore;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.Collections;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests the class {@link MineCommits}.
 */
class MineCommitsTest {
    @TempDir
    File tempDir;

    @Test
    void shouldParseAllOptions() throws ParseException {
        MineCommitsConfig conf = new MineCommits().parseCommandLineArgs(new String[]{
                "-r", "rules.xml", "-w", "4", "-o", "out", "-a", "lib/a.jar", "-a", "lib/b.jar",
                "--daemon", "http://localhost:8080/analyze", "--ref", "main", "--extension", "kt",
                "--timeout", "60", "--cache-save-interval", "10", "--retry-failed", "-v",
                "https://example.com/repo.git"});

        assertThat(conf.getRepositoryLocation()).isEqualTo("https://example.com/repo.git");
        assertThat(conf.getRuleset()).isEqualTo(new File("rules.xml"));
        assertThat(conf.getNumberOfWorkers()).isEqualTo(4);
        assertThat(conf.getOutputDir()).isEqualTo(new File("out"));
        assertThat(conf.auxClasspathString()).isEqualTo("lib/a.jar" + File.pathSeparator + "lib/b.jar");
        assertThat(conf.getDaemonUrl()).contains("http://localhost:8080/analyze");
        assertThat(conf.getRef()).isEqualTo("main");
        assertThat(conf.getExtension()).isEqualTo(".kt");
        assertThat(conf.timeoutMillis()).isEqualTo(60000L);
        assertThat(conf.getCacheSaveInterval()).isEqualTo(10);
        assertThat(conf.isRetryFailed()).isTrue();
        assertThat(conf.isVerbose()).isTrue();
        assertThat(conf.resultsDir()).isEqualTo(new File("out", MineCommitsConfig.RESULTS_DIR_NAME));
    }

    @Test
    void shouldApplyDefaults() throws ParseException {
        MineCommitsConfig conf = new MineCommits().parseCommandLineArgs(new String[]{"-r", "rules.xml", "repo"});

        assertThat(conf.getOutputDir()).isEqualTo(new File(MineCommitsConfig.DEFAULT_OUTPUT_DIR_NAME));
        assertThat(conf.getExtension()).isEqualTo(".java");
        assertThat(conf.getRef()).isEqualTo("HEAD");
        assertThat(conf.getDaemonUrl()).isEmpty();
        assertThat(conf.getPmdProg()).isEqualTo("pmd");
        assertThat(conf.auxClasspathString()).isEmpty();
    }

    @Test
    void shouldRequireRulesetUnlessSummarizing() throws ParseException {
        assertThatExceptionOfType(ParseException.class)
                .isThrownBy(() -> new MineCommits().parseCommandLineArgs(new String[]{"repo"}))
                .withMessageContaining("--ruleset");

        MineCommitsConfig conf = new MineCommits().parseCommandLineArgs(new String[]{"--summarize-only", "repo"});
        assertThat(conf.isSummarizeOnly()).isTrue();
    }

    @Test
    void shouldRequireExactlyOneRepository() {
        assertThatExceptionOfType(ParseException.class)
                .isThrownBy(() -> new MineCommits().parseCommandLineArgs(new String[]{"-r", "rules.xml"}));
        assertThatExceptionOfType(ParseException.class)
                .isThrownBy(() -> new MineCommits().parseCommandLineArgs(new String[]{"-r", "rules.xml", "a", "b"}));
    }

    @Test
    void shouldRejectInvalidNumbers() {
        assertThatThrownBy(() -> new MineCommits().parseCommandLineArgs(new String[]{"-r", "x", "-w", "0", "repo"}))
                .hasMessageContaining("Invalid value for option `--workers'");
        assertThatThrownBy(() -> new MineCommits().parseCommandLineArgs(new String[]{"-r", "x", "--timeout", "soon", "repo"}))
                .hasMessageContaining("Not a valid integer");
    }

    @Test
    void shouldSummarizeExistingResults() {
        MineCommitsConfig conf = new MineCommitsConfig();
        conf.setRepositoryLocation("repo");
        conf.setOutputDir(tempDir);
        conf.setSummarizeOnly(true);
        CommitResultRecord record = new CommitResultRecord();
        record.setCommit("0123456789abcdef0123456789abcdef01234567");
        record.setFileCount(2);
        record.setViolationCount(1);
        record.setViolationsByRule(new TreeMap<>(Collections.singletonMap("UnusedImports", 1)));
        new ResultStore(conf.resultsDir()).writeSuccess(record);

        int status = new MineCommits().run(conf);

        assertThat(status).isZero();
        assertThat(conf.summaryFile()).isFile();
        assertThat(conf.commitsCsvFile()).isFile();
    }

    @Test
    void shouldFailSetupWithoutRuleset() {
        MineCommitsConfig conf = new MineCommitsConfig();
        conf.setRepositoryLocation("repo");
        conf.setOutputDir(tempDir);
        conf.setRuleset(new File(tempDir, "missing.xml"));

        assertThatExceptionOfType(SetupException.class).isThrownBy(() -> new MineCommits().run(conf));
    }

    @Test
    void shouldFormatDurations() {
        assertThat(MineCommits.formatDuration(3723000L)).isEqualTo("1:02:03");
        assertThat(MineCommits.formatDuration(999L)).isEqualTo("0:00:00");
    }
}
