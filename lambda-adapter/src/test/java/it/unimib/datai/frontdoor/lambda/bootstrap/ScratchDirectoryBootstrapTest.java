package it.unimib.datai.frontdoor.lambda.bootstrap;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScratchDirectoryBootstrapTest {

    @TempDir
    Path tmp;

    @Test
    void run_createsMissingDirectories() {
        Path uploads = tmp.resolve("uploads");
        Path chunks = tmp.resolve("cache/cached_chunks");

        List<Path> created = new ScratchDirectoryBootstrap(List.of(uploads, chunks)).run();

        assertThat(created).containsExactly(uploads, chunks);
        assertThat(uploads).isDirectory();
        assertThat(chunks).isDirectory();
    }

    @Test
    void run_toleratesExistingDirectories() throws IOException {
        Path uploads = Files.createDirectory(tmp.resolve("uploads"));
        Files.writeString(uploads.resolve("keep.txt"), "data");

        new ScratchDirectoryBootstrap(List.of(uploads)).run();
        new ScratchDirectoryBootstrap(List.of(uploads)).run();

        assertThat(uploads.resolve("keep.txt")).hasContent("data");
    }

    @Test
    void run_fileInTheWay_throwsBootstrapException() throws IOException {
        Path blocker = Files.writeString(tmp.resolve("uploads"), "not a directory");

        assertThatThrownBy(() -> new ScratchDirectoryBootstrap(List.of(blocker)).run())
                .isInstanceOf(BootstrapException.class)
                .hasMessageContaining("uploads")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void run_noDirectories_isNoOp() {
        assertThat(new ScratchDirectoryBootstrap(null).run()).isEmpty();
    }

    @Test
    void parse_splitsCommaSeparatedList() {
        assertThat(ScratchDirectoryBootstrap.parse("/tmp/a, /tmp/b,,"))
                .containsExactly(Path.of("/tmp/a"), Path.of("/tmp/b"));
        assertThat(ScratchDirectoryBootstrap.parse("  ")).isEmpty();
        assertThat(ScratchDirectoryBootstrap.parse(null)).isEmpty();
    }
}
