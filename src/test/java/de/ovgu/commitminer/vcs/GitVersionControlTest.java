package de.ovgu.commitminer.vcs;

import de.ovgu.commitminer.util.ExternalCommand;
import de.ovgu.commitminer.util.ExternalCommandException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests the class {@link GitVersionControl}.
 */
class GitVersionControlTest {
    @TempDir
    File tempDir;

    private TestRepository repository;
    private GitVersionControl vcs;

    @BeforeEach
    void setUp() throws Exception {
        repository = new TestRepository(new File(tempDir, "repo"));
    }

    @AfterEach
    void tearDown() {
        if (vcs != null) {
            vcs.close();
        }
        repository.close();
    }

    private GitVersionControl open() {
        vcs = new GitVersionControl(repository.getDirectory());
        return vcs;
    }

    @Test
    void shouldListCommitsOldestFirst() throws Exception {
        String first = repository.write("A.java", "class A {}").commit("first");
        String second = repository.write("B.java", "class B {}").commit("second");
        String third = repository.write("A.java", "class A { int x; }").commit("third");

        List<Commit> commits = open().listCommits("HEAD");

        assertThat(commits).extracting(Commit::getId).containsExactly(first, second, third);
        assertThat(commits).extracting(Commit::getPosition).containsExactly(0, 1, 2);
    }

    @Test
    void shouldReportAddedModifiedAndDeletedFiles() throws Exception {
        String first = repository.write("A.java", "class A {}").write("B.java", "class B {}").commit("first");
        String second = repository.write("A.java", "class A { int x; }").write("C.java", "class C {}")
                .delete("B.java").commit("second");

        List<ChangedPath> diff = open().diff(first, second);

        assertThat(diff).extracting(ChangedPath::toString)
                .containsExactlyInAnyOrder("M A.java", "A C.java", "D B.java");
    }

    @Test
    void shouldDetectRenames() throws Exception {
        String content = "class A {\n  void f() {}\n  void g() {}\n  void h() {}\n}\n";
        String first = repository.write("old/A.java", content).commit("first");
        String second = repository.move("old/A.java", "new/A.java").commit("second");

        List<ChangedPath> diff = open().diff(first, second);

        assertThat(diff).hasSize(1);
        assertThat(diff.get(0).getChangeType()).isEqualTo(ChangedPath.ChangeType.RENAME);
        assertThat(diff.get(0).getNewPath()).isEqualTo("new/A.java");
    }

    @Test
    void shouldFailOnUnknownRevision() throws Exception {
        repository.write("A.java", "class A {}").commit("first");

        assertThatExceptionOfType(VersionControlException.class)
                .isThrownBy(() -> open().listCommits("no-such-branch"))
                .withMessageContaining("no-such-branch");
    }

    @Test
    void shouldFailToOpenMissingRepository() {
        assertThatExceptionOfType(VersionControlException.class)
                .isThrownBy(() -> new GitVersionControl(new File(tempDir, "missing")));
    }

    @Test
    void shouldCheckOutCommitsIntoLinkedWorktree() throws Exception {
        assumeTrue(isGitInstalled(), "git is not installed");
        String first = repository.write("A.java", "class A {}").commit("first");
        String second = repository.write("A.java", "class A { int x; }").write("B.java", "class B {}").commit("second");
        File worktree = new File(tempDir, "wt_0");

        open().addWorktree(worktree, first);
        assertThat(new File(worktree, "B.java")).doesNotExist();

        vcs.checkout(worktree, second);
        assertThat(new File(worktree, "A.java")).hasContent("class A { int x; }");
        assertThat(new File(worktree, "B.java")).exists();

        File junk = new File(worktree, "junk.txt");
        assertThat(junk.createNewFile()).isTrue();
        vcs.resetWorkTree(worktree);
        assertThat(junk).doesNotExist();

        vcs.removeWorktree(worktree);
        assertThat(worktree).doesNotExist();
        vcs.pruneWorktrees();
    }

    @Test
    void shouldSeeUpstreamCommitsAfterFetching() throws Exception {
        assumeTrue(isGitInstalled(), "git is not installed");
        String first = repository.write("A.java", "class A {}").commit("first");
        File baseRepoDir = new File(tempDir, "repo_base");

        GitVersionControl.cloneOrFetch(repository.getDirectory().getAbsolutePath(), baseRepoDir);
        try (GitVersionControl clone = new GitVersionControl(baseRepoDir)) {
            assertThat(clone.listCommits("HEAD")).extracting(Commit::getId).containsExactly(first);
        }

        String second = repository.write("B.java", "class B {}").commit("second");
        GitVersionControl.cloneOrFetch(repository.getDirectory().getAbsolutePath(), baseRepoDir);
        try (GitVersionControl clone = new GitVersionControl(baseRepoDir)) {
            assertThat(clone.listCommits("HEAD")).extracting(Commit::getId).containsExactly(first, second);
        }
    }

    private static boolean isGitInstalled() {
        try {
            return ExternalCommand.of(GitVersionControl.GIT_PROG, "--version").run().getExitCode() == 0;
        } catch (ExternalCommandException e) {
            return false;
        }
    }
}
