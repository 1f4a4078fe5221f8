package com.raditha.magpie.git;

import com.raditha.magpie.commit.DiffLines;
import com.raditha.magpie.model.CommitRecord;
import com.raditha.magpie.model.RepositorySnapshot;
import com.raditha.magpie.normalization.Language;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevTree;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.util.io.DisabledOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads repositories with JGit.
 * <p>
 * A repository id naming an existing directory is opened in place; anything else is treated
 * as a clone URL and cloned bare into a temporary directory that is removed afterwards.
 * Files come from the tree of the branch tip, never from a working copy.
 */
public class GitRepositoryMaterializer implements RepositoryMaterializer {
    private static final Logger logger = LoggerFactory.getLogger(GitRepositoryMaterializer.class);

    private final RepositoryLimits limits;

    public GitRepositoryMaterializer(RepositoryLimits limits) {
        this.limits = limits;
    }

    public GitRepositoryMaterializer() {
        this(RepositoryLimits.defaults());
    }

    @Override
    public RepositorySnapshot materialize(String repoId, String branch, Language language, int maxCommits)
            throws RepositoryMaterializationException {
        Path localDir = localDirectory(repoId);
        if (localDir != null) {
            try (Git git = Git.open(localDir.toFile())) {
                return read(repoId, git.getRepository(), branch, language, maxCommits);
            } catch (RepositoryMaterializationException e) {
                throw e;
            } catch (IOException e) {
                throw new RepositoryMaterializationException(repoId, e.getMessage(), e);
            }
        }

        Path cloneDir = null;
        try {
            cloneDir = Files.createTempDirectory("magpie-clone-");
            logger.info("Cloning {} to {}", repoId, cloneDir);
            try (Git git = Git.cloneRepository()
                    .setURI(repoId)
                    .setDirectory(cloneDir.toFile())
                    .setBare(true)
                    .call()) {
                return read(repoId, git.getRepository(), branch, language, maxCommits);
            }
        } catch (GitAPIException | JGitInternalException e) {
            throw new RepositoryMaterializationException(repoId, "clone failed: " + e.getMessage(), e);
        } catch (RepositoryMaterializationException e) {
            throw e;
        } catch (IOException e) {
            throw new RepositoryMaterializationException(repoId, e.getMessage(), e);
        } finally {
            if (cloneDir != null) {
                deleteRecursively(cloneDir);
            }
        }
    }

    private RepositorySnapshot read(String repoId, Repository repo, String branch, Language language,
            int maxCommits) throws IOException {
        ObjectId tip = resolveTip(repoId, repo, branch);
        if (tip == null) {
            logger.warn("Repository {} has no commits", repoId);
            return new RepositorySnapshot(repoId, Map.of(), List.of());
        }

        try (RevWalk walk = new RevWalk(repo); ObjectReader reader = repo.newObjectReader()) {
            RevCommit head = walk.parseCommit(tip);
            Map<String, String> files = readFiles(repoId, repo, reader, head.getTree(), language);
            List<CommitRecord> commits = maxCommits > 0
                    ? readCommits(repoId, repo, walk, reader, head, language, maxCommits)
                    : List.of();
            logger.info("Repository {}: {} {} files, {} commits", repoId, files.size(), language.tag(),
                    commits.size());
            return new RepositorySnapshot(repoId, files, commits);
        }
    }

    /**
     * The branch tip, or HEAD when the branch does not exist. Null for an empty repository.
     */
    private ObjectId resolveTip(String repoId, Repository repo, String branch) throws IOException {
        if (branch != null && !branch.isBlank()) {
            ObjectId id = repo.resolve(Constants.R_HEADS + branch);
            if (id == null) {
                id = repo.resolve(Constants.R_REMOTES + Constants.DEFAULT_REMOTE_NAME + "/" + branch);
            }
            if (id != null) {
                return id;
            }
            logger.warn("Branch {} not found in {}, falling back to HEAD", branch, repoId);
        }
        return repo.resolve(Constants.HEAD);
    }

    private Map<String, String> readFiles(String repoId, Repository repo, ObjectReader reader, RevTree tree,
            Language language) throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        try (TreeWalk treeWalk = new TreeWalk(repo, reader)) {
            treeWalk.addTree(tree);
            treeWalk.setRecursive(false);
            while (treeWalk.next()) {
                if (treeWalk.isSubtree()) {
                    if (!limits.skips(treeWalk.getNameString())) {
                        treeWalk.enterSubtree();
                    }
                    continue;
                }
                String path = treeWalk.getPathString();
                if ((treeWalk.getRawMode(0) & FileMode.TYPE_MASK) != FileMode.TYPE_FILE || !language.matches(path)) {
                    continue;
                }
                if (files.size() >= limits.maxFiles()) {
                    logger.warn("Repository {} has more than {} {} files, the rest are ignored",
                            repoId, limits.maxFiles(), language.tag());
                    break;
                }
                String text = readBlob(reader, treeWalk.getObjectId(0));
                if (text != null) {
                    files.put(path, text);
                }
            }
        }
        return files;
    }

    private List<CommitRecord> readCommits(String repoId, Repository repo, RevWalk walk, ObjectReader reader,
            RevCommit head, Language language, int maxCommits) throws IOException {
        List<CommitRecord> commits = new ArrayList<>();
        try (Git git = new Git(repo);
                DiffFormatter formatter = new DiffFormatter(DisabledOutputStream.INSTANCE)) {
            formatter.setRepository(repo);
            Iterable<RevCommit> log = git.log().add(head).setMaxCount(maxCommits).call();
            for (RevCommit commit : log) {
                RevTree parentTree = commit.getParentCount() > 0
                        ? walk.parseCommit(commit.getParent(0)).getTree()
                        : null;
                DiffLines changes = DiffLines.empty();
                for (DiffEntry entry : formatter.scan(parentTree, commit.getTree())) {
                    String path = entry.getChangeType() == DiffEntry.ChangeType.DELETE
                            ? entry.getOldPath()
                            : entry.getNewPath();
                    if (!language.matches(path) || isSkipped(path)
                            || FileMode.GITLINK.equals(entry.getNewMode()) || FileMode.GITLINK.equals(entry.getOldMode())) {
                        continue;
                    }
                    String oldText = entry.getChangeType() == DiffEntry.ChangeType.ADD
                            ? null
                            : readBlob(reader, entry.getOldId().toObjectId());
                    String newText = entry.getChangeType() == DiffEntry.ChangeType.DELETE
                            ? null
                            : readBlob(reader, entry.getNewId().toObjectId());
                    changes = changes.plus(DiffLines.between(oldText, newText));
                }
                commits.add(new CommitRecord(
                        repoId,
                        commit.getName(),
                        commit.getFullMessage().trim(),
                        changes.added(),
                        changes.removed(),
                        Instant.ofEpochSecond(commit.getCommitTime())));
            }
        } catch (GitAPIException e) {
            throw new RepositoryMaterializationException(repoId, "cannot read history: " + e.getMessage(), e);
        }
        return commits;
    }

    /**
     * UTF-8 text of a blob, or null when the blob is too large or binary.
     */
    private String readBlob(ObjectReader reader, ObjectId id) throws IOException {
        long size = reader.getObjectSize(id, Constants.OBJ_BLOB);
        if (size > limits.maxFileBytes()) {
            return null;
        }
        byte[] bytes = reader.open(id, Constants.OBJ_BLOB).getBytes();
        if (RawText.isBinary(bytes)) {
            return null;
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private boolean isSkipped(String path) {
        String[] parts = path.split("/");
        for (int i = 0; i < parts.length - 1; i++) {
            if (limits.skips(parts[i])) {
                return true;
            }
        }
        return false;
    }

    private static Path localDirectory(String repoId) {
        try {
            Path path = Path.of(repoId);
            return Files.isDirectory(path) ? path : null;
        } catch (InvalidPathException e) {
            logger.debug("{} is not a local path: {}", repoId, e.getMessage());
            return null;
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            List<Path> ordered = paths.sorted(Comparator.reverseOrder()).toList();
            for (Path path : ordered) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            logger.warn("Could not remove temporary clone {}: {}", dir, e.getMessage());
        }
    }
}
