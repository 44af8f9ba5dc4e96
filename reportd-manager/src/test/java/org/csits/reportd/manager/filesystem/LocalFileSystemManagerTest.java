package org.csits.reportd.manager.filesystem;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalFileSystemManagerTest {

    private LocalFileSystemManager manager;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        manager = new LocalFileSystemManager();
    }

    @Test
    void writeAtomically_createsParentAndLeavesNoTmpFile() throws IOException {
        Path target = tempDir.resolve("reports").resolve("a.json");

        manager.writeAtomically(target, "{}".getBytes(StandardCharsets.UTF_8));
        manager.writeAtomically(target, "{\"v\":2}".getBytes(StandardCharsets.UTF_8));

        assertThat(new String(Files.readAllBytes(target), StandardCharsets.UTF_8)).isEqualTo("{\"v\":2}");
        assertThat(Files.exists(target.resolveSibling("a.json.tmp"))).isFalse();
    }

    @Test
    void scanFiles_matchesGlobWithoutDescending() throws IOException {
        Files.write(tempDir.resolve("b.json"), new byte[0]);
        Files.write(tempDir.resolve("a.json"), new byte[0]);
        Files.write(tempDir.resolve("c.txt"), new byte[0]);
        Files.createDirectories(tempDir.resolve("sub"));
        Files.write(tempDir.resolve("sub").resolve("d.json"), new byte[0]);

        List<Path> files = manager.scanFiles(tempDir, "*.json");

        assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("a.json", "b.json");
    }

    @Test
    void scanFiles_whenRootMissing_returnsEmpty() throws IOException {
        assertThat(manager.scanFiles(tempDir.resolve("missing"), "*.json")).isEmpty();
    }

    @Test
    void deleteRecursively_removesTree() throws IOException {
        Path root = tempDir.resolve("work");
        Files.createDirectories(root.resolve("x").resolve("y"));
        Files.write(root.resolve("x").resolve("y").resolve("f.bin"), new byte[] {1, 2});

        manager.deleteRecursively(root);

        assertThat(Files.exists(root)).isFalse();
    }
}
