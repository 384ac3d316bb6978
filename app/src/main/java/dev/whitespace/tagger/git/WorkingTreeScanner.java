package dev.whitespace.tagger.git;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the files of a Git work tree that differ from {@code HEAD}, so only edited sources get checked.
 */
public class WorkingTreeScanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkingTreeScanner.class);

    /**
     * Returns added, changed, modified and untracked files with one of the given extensions, as sorted paths
     * relative to {@code repositoryRoot}.
     */
    public List<String> changedFiles(Path repositoryRoot, Set<String> extensions) {
        Objects.requireNonNull(repositoryRoot, "repositoryRoot");
        Objects.requireNonNull(extensions, "extensions");
        if (!Files.isDirectory(repositoryRoot.resolve(".git"))) {
            throw new WorkTreeException(repositoryRoot + " is not a Git work tree");
        }
        try (Git git = Git.open(repositoryRoot.toFile())) {
            Status status = git.status().call();
            Set<String> files = new TreeSet<>();
            Stream.of(status.getAdded(), status.getChanged(), status.getModified(), status.getUntracked())
                    .flatMap(Set::stream)
                    .filter(path -> hasExtension(path, extensions))
                    .forEach(files::add);
            LOGGER.debug("Found {} changed files in {}", files.size(), repositoryRoot);
            return List.copyOf(files);
        } catch (GitAPIException | IOException ex) {
            throw new WorkTreeException("Failed to read status of " + repositoryRoot, ex);
        }
    }

    private static boolean hasExtension(String path, Set<String> extensions) {
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot < path.lastIndexOf('/')) {
            return false;
        }
        return extensions.contains(path.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
