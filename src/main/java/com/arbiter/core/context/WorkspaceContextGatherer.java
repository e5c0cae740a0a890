package com.arbiter.core.context;

import com.arbiter.core.model.CodePatterns;
import com.arbiter.core.model.ContextBundle;
import com.arbiter.core.model.Specification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Walks the configured workspace root and collects source files whose names
 * match keywords from the intent, along with the code patterns they exhibit.
 * <p>
 * Common build-tool and IDE directories (e.g. {@code .git}, {@code node_modules},
 * {@code target}) are excluded. Unreadable files are skipped.
 */
@Service
public class WorkspaceContextGatherer implements ContextGatherer {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceContextGatherer.class);

    /** Directories to skip during the walk. */
    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            "__pycache__", ".gradle", "dist", "out", ".mvn", ".next", ".arbiter"
    );

    private static final Set<String> SOURCE_EXTENSIONS = Set.of(
            ".py", ".java", ".kt", ".js", ".ts", ".go", ".rs", ".rb", ".cs"
    );

    /** Verbs that describe the request rather than what it is about. */
    private static final Set<String> STOP_WORDS = Set.of("create", "build", "make", "implement");

    private static final Pattern WORD = Pattern.compile("\\b\\w{4,}\\b");

    private final WorkspaceProperties properties;

    public WorkspaceContextGatherer(WorkspaceProperties properties) {
        this.properties = properties;
    }

    @Override
    public ContextBundle gather(String intent, Specification specification) {
        Path root = Path.of(properties.getRoot());
        if (!Files.isDirectory(root)) {
            log.debug("Workspace root {} is not a directory, no context gathered", root);
            return ContextBundle.empty(intent);
        }
        List<String> keywords = extractKeywords(intent);
        if (keywords.isEmpty()) {
            return ContextBundle.empty(intent);
        }

        var files = new ArrayList<ContextBundle.FileSnippet>();
        var patterns = new LinkedHashSet<String>();
        for (Path path : matchingFiles(root, keywords)) {
            try {
                String content = Files.readString(path);
                String preview = content.length() > properties.getPreviewLength()
                        ? content.substring(0, properties.getPreviewLength())
                        : content;
                files.add(new ContextBundle.FileSnippet(root.relativize(path).toString(), preview));
                patterns.addAll(CodePatterns.detect(content));
            } catch (IOException e) {
                log.debug("Skipping unreadable file {}: {}", path, e.getMessage());
            }
        }

        log.info("Gathered {} relevant files from {} for keywords {}", files.size(), root, keywords);
        return new ContextBundle(intent, files, List.copyOf(patterns));
    }

    /**
     * Lower-cased words of four or more characters, minus generic request verbs.
     */
    static List<String> extractKeywords(String intent) {
        if (intent == null) {
            return List.of();
        }
        var matcher = WORD.matcher(intent.toLowerCase(Locale.ROOT));
        var keywords = new LinkedHashSet<String>();
        while (matcher.find()) {
            String word = matcher.group();
            if (!STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return List.copyOf(keywords);
    }

    private List<Path> matchingFiles(Path root, List<String> keywords) {
        try (var stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> !shouldIgnore(root, p))
                    .filter(this::isSource)
                    .filter(p -> matchesAny(p, keywords))
                    .sorted()
                    .limit(properties.getMaxFiles())
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to walk workspace {}: {}", root, e.getMessage());
            return List.of();
        }
    }

    private boolean isSource(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && SOURCE_EXTENSIONS.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    private static boolean matchesAny(Path path, List<String> keywords) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(name::contains);
    }

    /**
     * Returns {@code true} if any component of the path, relative to the root,
     * is an ignored directory.
     */
    private boolean shouldIgnore(Path root, Path path) {
        for (Path component : root.relativize(path)) {
            if (IGNORE_DIRS.contains(component.toString())) return true;
        }
        return false;
    }
}
