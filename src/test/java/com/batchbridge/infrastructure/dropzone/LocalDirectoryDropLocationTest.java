package com.batchbridge.infrastructure.dropzone;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LocalDirectoryDropLocationTest {

    @TempDir
    Path root;

    private Path inbox;
    private Path archive;
    private LocalDirectoryDropLocation dropLocation;

    @BeforeEach
    void setUp() throws IOException {
        inbox = Files.createDirectories(root.resolve("inbox"));
        archive = root.resolve("archive");
        dropLocation = new LocalDirectoryDropLocation(inbox.toString(), archive.toString());
    }

    @Test
    void list_skipsPartialAndHiddenFilesInNameOrder() throws IOException {
        write("b-settlements.csv", "x");
        write("a-disputes.csv", "y");
        write("c-upload.csv.part", "z");
        write(".hidden", "h");

        List<String> names = dropLocation.list(10).stream().map(DropFile::getName).collect(Collectors.toList());

        assertEquals(List.of("a-disputes.csv", "b-settlements.csv"), names);
    }

    @Test
    void list_respectsLimit() throws IOException {
        write("1.csv", "a");
        write("2.csv", "b");
        write("3.csv", "c");

        assertEquals(2, dropLocation.list(2).size());
    }

    @Test
    void markProcessed_movesToArchiveAndIsIdempotent() throws IOException {
        write("settlements.csv", "merchant_id\n");
        DropFile file = dropLocation.list(10).get(0);

        assertArrayEquals("merchant_id\n".getBytes(StandardCharsets.UTF_8), dropLocation.read(file));
        dropLocation.markProcessed(file);
        dropLocation.markProcessed(file);

        assertFalse(Files.exists(inbox.resolve("settlements.csv")));
        assertTrue(Files.exists(archive.resolve("settlements.csv")));
        assertTrue(dropLocation.list(10).isEmpty());
    }

    @Test
    void list_missingInboxIsEmpty() {
        LocalDirectoryDropLocation missing = new LocalDirectoryDropLocation(
                root.resolve("nowhere").toString(), archive.toString());

        assertTrue(missing.list(10).isEmpty());
    }

    private void write(String name, String content) throws IOException {
        Files.writeString(inbox.resolve(name), content);
    }
}
