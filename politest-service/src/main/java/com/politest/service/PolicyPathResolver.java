package com.politest.service;

import com.politest.exception.PolicyLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves policy paths and glob patterns relative to a base directory.
 */
@Component
public class PolicyPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(PolicyPathResolver.class);

    public Path resolve(Path baseDir, String path) {
        Path candidate = Path.of(path);
        if (!candidate.isAbsolute() && baseDir != null) {
            candidate = baseDir.resolve(candidate);
        }
        return candidate.toAbsolutePath().normalize();
    }

    /**
     * Expands each pattern against {@code baseDir}. Matches of one pattern are sorted; results
     * keep pattern order and each file appears once. A literal path that exists is included
     * even if it contains glob characters that match nothing.
     */
    public List<Path> expand(Path baseDir, List<String> patterns) {
        Set<Path> files = new LinkedHashSet<>();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            Path resolved = resolve(baseDir, pattern.trim());
            List<Path> matches = hasGlob(resolved.toString()) ? glob(resolved) : new ArrayList<>();
            if (matches.isEmpty() && Files.isRegularFile(resolved)) {
                matches.add(resolved);
            }
            if (matches.isEmpty()) {
                logger.warn("Pattern {} matched no files", pattern);
            }
            matches.sort(null);
            files.addAll(matches);
        }
        return new ArrayList<>(files);
    }

    private List<Path> glob(Path pattern) {
        Path root = pattern.getRoot();
        int fixed = 0;
        for (Path part : pattern) {
            if (hasGlob(part.toString())) {
                break;
            }
            root = root == null ? part : root.resolve(part);
            fixed++;
        }
        if (root == null || !Files.isDirectory(root)) {
            return new ArrayList<>();
        }

        int depth = pattern.getNameCount() - fixed;
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        try (Stream<Path> walk = walk(root, depth)) {
            return walk.filter(Files::isRegularFile)
                    .map(p -> p.toAbsolutePath().normalize())
                    .filter(p -> p.getNameCount() == pattern.getNameCount())
                    .filter(matcher::matches)
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new PolicyLoadException(root, "Could not list policy directory", e);
        } catch (UncheckedIOException e) {
            // errors met while the walk is consumed surface unchecked
            throw new PolicyLoadException(root, "Could not list policy directory", e.getCause());
        }
    }

    Stream<Path> walk(Path root, int depth) throws IOException {
        return Files.walk(root, depth);
    }

    private static boolean hasGlob(String s) {
        return s.indexOf('*') >= 0 || s.indexOf('?') >= 0 || s.indexOf('[') >= 0 || s.indexOf('{') >= 0;
    }
}
