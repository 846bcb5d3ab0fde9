package com.politest.service;

import com.politest.exception.PolicyLoadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyPathResolverTest {

    @TempDir
    Path tempDir;

    private final PolicyPathResolver resolver = new PolicyPathResolver();

    private Path a;
    private Path b;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(tempDir.resolve("scp"));
        Files.createDirectories(tempDir.resolve("rcp"));
        b = Files.writeString(tempDir.resolve("scp/b.json"), "{}");
        a = Files.writeString(tempDir.resolve("scp/a.json"), "{}");
        Files.writeString(tempDir.resolve("scp/notes.txt"), "");
        Files.writeString(tempDir.resolve("rcp/c.json"), "{}");
    }

    @Test
    void testResolve_relativeAndAbsolute() {
        assertThat(resolver.resolve(tempDir, "scp/../scp/a.json")).isEqualTo(normal(a));
        assertThat(resolver.resolve(Path.of("/elsewhere"), a.toString())).isEqualTo(normal(a));
    }

    @Test
    void testExpand_globIsSortedAndFiltered() {
        List<Path> files = resolver.expand(tempDir, List.of("scp/*.json"));

        assertThat(files).containsExactly(normal(a), normal(b));
    }

    @Test
    void testExpand_keepsPatternOrderAndDeduplicates() {
        List<Path> files = resolver.expand(tempDir, Arrays.asList("scp/b.json", "scp/*.json", "rcp/*.json", " ", null));

        assertThat(files).containsExactly(normal(b), normal(a), normal(tempDir.resolve("rcp/c.json")));
    }

    @Test
    void testExpand_wildcardDirectory() {
        List<Path> files = resolver.expand(tempDir, List.of("*/*.json"));

        assertThat(files).containsExactly(normal(tempDir.resolve("rcp/c.json")), normal(a), normal(b));
    }

    @Test
    void testExpand_nothingMatches() {
        assertThat(resolver.expand(tempDir, List.of("missing/*.json", "scp/none.json"))).isEmpty();
    }

    @Test
    void testExpand_walkFailureNamesTheDirectory() {
        PolicyPathResolver failingWalk = new PolicyPathResolver() {
            @Override
            Stream<Path> walk(Path root, int depth) {
                return Stream.of(root).map(p -> {
                    throw new UncheckedIOException(new AccessDeniedException(p.resolve("locked").toString()));
                });
            }
        };

        assertThatThrownBy(() -> failingWalk.expand(tempDir, List.of("scp/*.json")))
                .isInstanceOf(PolicyLoadException.class)
                .hasMessageContaining("Could not list policy directory")
                .hasMessageContaining(normal(tempDir.resolve("scp")).toString())
                .hasCauseInstanceOf(AccessDeniedException.class);
    }

    private static Path normal(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
