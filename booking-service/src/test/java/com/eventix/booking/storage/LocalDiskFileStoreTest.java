package com.eventix.booking.storage;

import com.eventix.booking.config.BookingProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class LocalDiskFileStoreTest {

    @TempDir
    Path root;

    @Test
    void store_writesContentUnderRootWithRandomName() throws IOException {
        LocalDiskFileStore store = new LocalDiskFileStore(properties(root));

        String url = store.store(new byte[]{1, 2, 3}, "Receipt.PNG");

        Path stored = Path.of(URI.create(url));
        assertThat(stored.getParent()).isEqualTo(root.toAbsolutePath().normalize());
        assertThat(stored.getFileName().toString()).endsWith(".png").doesNotContain("Receipt");
        assertThat(Files.readAllBytes(stored)).containsExactly(1, 2, 3);
    }

    @Test
    void store_pathInOriginalName_staysInsideRoot() {
        LocalDiskFileStore store = new LocalDiskFileStore(properties(root));

        String url = store.store(new byte[]{9}, "../../etc/passwd");

        assertThat(Path.of(URI.create(url)).getParent()).isEqualTo(root.toAbsolutePath().normalize());
    }

    @Test
    void store_missingRoot_createdOnFirstWrite() {
        Path nested = root.resolve("proofs/2026");
        LocalDiskFileStore store = new LocalDiskFileStore(properties(nested));

        String first = store.store(new byte[]{1}, "a.jpg");
        String second = store.store(new byte[]{1}, "a.jpg");

        assertThat(Files.isDirectory(nested)).isTrue();
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void delete_storedFile_removesIt() {
        LocalDiskFileStore store = new LocalDiskFileStore(properties(root));
        String url = store.store(new byte[]{1}, "a.jpg");

        store.delete(url);

        assertThat(Files.exists(Path.of(URI.create(url)))).isFalse();
    }

    @Test
    void delete_outsideRoot_leavesFileAlone() throws IOException {
        Path outside = Files.createDirectories(root.resolve("other")).resolve("keep.jpg");
        Files.write(outside, new byte[]{1});
        LocalDiskFileStore store = new LocalDiskFileStore(properties(root.resolve("proofs")));

        store.delete(outside.toUri().toString());

        assertThat(Files.exists(outside)).isTrue();
    }

    private static BookingProperties properties(Path root) {
        BookingProperties properties = new BookingProperties();
        properties.getFileStore().setRoot(root.toString());
        return properties;
    }
}
