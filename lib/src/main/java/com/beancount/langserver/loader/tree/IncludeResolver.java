package com.beancount.langserver.loader.tree;

import com.beancount.langserver.ledger.Entry;
import com.beancount.langserver.loader.LedgerGrammar;
import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.antlr.v4.runtime.tree.ParseTree;

/**
 * Expands an {@code include} glob relative to the including file and walks every match in
 * lexicographic order of its absolute path. Files already read in this traversal are reported and
 * skipped.
 */
public final class IncludeResolver {
    private static final Logger LOG = Logger.getLogger(IncludeResolver.class.getName());
    // A "**/" segment also matches no directory at all, so "**/*.bean" covers top-level files.
    private static final Pattern ZERO_DEPTH_DOUBLE_STAR = Pattern.compile("(^|/)\\*\\*/");

    private final LedgerGrammar grammar;
    private final TreeWalker walker;

    IncludeResolver(LedgerGrammar grammar, TreeWalker walker) {
        this.grammar = grammar;
        this.walker = walker;
    }

    public List<Entry> resolve(
            IncludeDirective directive, ParseTree node, ParseState state, SeenFiles seenFiles) {
        Path current = state.getFilename();
        if (current == null) {
            state.recordError(node, "Cannot resolve include when parsing a string");
            return List.of();
        }
        String pattern = directive.getGlobPattern();
        Path parent = current.toAbsolutePath().getParent();
        Path baseDir = parent != null ? parent : Path.of("").toAbsolutePath();
        List<Path> matches;
        try {
            matches = expand(baseDir, pattern);
        } catch (IOException | InvalidPathException ex) {
            state.recordError(node, "Unable to expand include '" + pattern + "': " + ex.getMessage());
            return List.of();
        }
        if (matches.isEmpty()) {
            state.recordError(node, "Include glob did not match any files: " + pattern);
            return List.of();
        }
        List<Entry> entries = new ArrayList<>();
        for (Path match : matches) {
            Path included = SeenFiles.canonical(match);
            if (!seenFiles.add(included)) {
                state.recordError(node, "Duplicate included file: " + included);
                continue;
            }
            byte[] contents;
            try {
                contents = Files.readAllBytes(included);
            } catch (IOException ex) {
                state.recordError(node, "Unable to read included file: " + included + " (" + ex + ")");
                continue;
            }
            LOG.fine(() -> "Including " + included);
            LedgerGrammar.ParsedSource parsed = grammar.parse(contents, included.toString());
            try (ParseState.FileScope scope = state.enterFile(contents, included)) {
                entries.addAll(walker.walk(parsed, state, included, seenFiles));
            }
        }
        return entries;
    }

    static List<Path> expand(Path baseDir, String rawPattern) throws IOException {
        String normalized = rawPattern.replace('\\', '/');
        int globIndex = firstGlobIndex(normalized);
        if (globIndex < 0) {
            Path path = toPath(baseDir, normalized);
            return Files.isRegularFile(path) ? List.of(path) : List.of();
        }
        int split = normalized.lastIndexOf('/', globIndex);
        String prefix = split < 0 ? "" : normalized.substring(0, split + 1);
        String pattern = normalized.substring(split + 1);
        Path searchRoot = toPath(baseDir, prefix);
        if (!Files.isDirectory(searchRoot)) {
            return List.of();
        }
        List<PathMatcher> matchers = new ArrayList<>();
        matchers.add(matcher(searchRoot, pattern));
        String flattened = ZERO_DEPTH_DOUBLE_STAR.matcher(pattern).replaceAll("$1");
        if (!flattened.equals(pattern)) {
            matchers.add(matcher(searchRoot, flattened));
        }
        int maxDepth = pattern.contains("**") ? Integer.MAX_VALUE : pattern.split("/").length;
        List<Path> matches = new ArrayList<>();
        Files.walkFileTree(
                searchRoot,
                EnumSet.noneOf(FileVisitOption.class),
                maxDepth,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile()) {
                            Path relative = searchRoot.relativize(file);
                            for (PathMatcher candidate : matchers) {
                                if (candidate.matches(relative)) {
                                    matches.add(file.toAbsolutePath().normalize());
                                    break;
                                }
                            }
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException ex) {
                        LOG.fine(() -> "Skipping unreadable path " + file + " (" + ex + ")");
                        return FileVisitResult.CONTINUE;
                    }
                });
        matches.sort(Comparator.comparing(Path::toString));
        return matches;
    }

    private static PathMatcher matcher(Path searchRoot, String pattern) {
        String separator = searchRoot.getFileSystem().getSeparator();
        String systemPattern = "/".equals(separator) ? pattern : pattern.replace("/", "\\\\");
        return searchRoot.getFileSystem().getPathMatcher("glob:" + systemPattern);
    }

    private static int firstGlobIndex(String value) {
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '*' || ch == '?' || ch == '{' || ch == '[') {
                return i;
            }
        }
        return -1;
    }

    private static Path toPath(Path baseDir, String raw) {
        if (raw.isEmpty()) {
            return baseDir;
        }
        Path path = Path.of(raw);
        if (!path.isAbsolute()) {
            path = baseDir.resolve(path);
        }
        return path.toAbsolutePath().normalize();
    }
}
