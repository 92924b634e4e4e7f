package com.batchbridge.infrastructure.dropzone;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Drop location backed by a mounted directory (the SFTP landing area).
 *
 * Processed files are moved into the archive directory. Files still being
 * written by the transfer agent carry a .part or .tmp suffix and are skipped.
 */
@Slf4j
@Component
public class LocalDirectoryDropLocation implements DropLocation {

    private final Path inbox;
    private final Path archive;

    public LocalDirectoryDropLocation(@Value("${app.intake.inbox-dir}") String inboxDir,
                                      @Value("${app.intake.archive-dir}") String archiveDir) {
        this.inbox = Path.of(inboxDir);
        this.archive = Path.of(archiveDir);
    }

    @Override
    public List<DropFile> list(int limit) {
        if (!Files.isDirectory(inbox)) {
            log.warn("Inbox directory {} does not exist", inbox);
            return List.of();
        }
        List<DropFile> files = new ArrayList<>();
        try (Stream<Path> entries = Files.list(inbox)) {
            entries.filter(Files::isRegularFile)
                    .filter(p -> isCandidate(p.getFileName().toString()))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .limit(limit)
                    .forEach(p -> files.add(new DropFile(p.getFileName().toString(), p, sizeOf(p))));
        } catch (IOException e) {
            throw new DropLocationException("Failed to list inbox " + inbox, e);
        }
        return files;
    }

    @Override
    public byte[] read(DropFile file) {
        try {
            return Files.readAllBytes(file.getPath());
        } catch (IOException e) {
            throw new DropLocationException("Failed to read " + file.getName(), e);
        }
    }

    @Override
    public void markProcessed(DropFile file) {
        try {
            Files.createDirectories(archive);
            Files.move(file.getPath(), archive.resolve(file.getName()), StandardCopyOption.REPLACE_EXISTING);
            log.debug("Archived {}", file.getName());
        } catch (NoSuchFileException e) {
            log.debug("{} already moved out of the inbox", file.getName());
        } catch (IOException e) {
            throw new DropLocationException("Failed to archive " + file.getName(), e);
        }
    }

    static boolean isCandidate(String name) {
        return !name.startsWith(".") && !name.endsWith(".part") && !name.endsWith(".tmp");
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new DropLocationException("Failed to stat " + path, e);
        }
    }
}
