package com.eventix.booking.storage;

import com.eventix.booking.config.BookingProperties;
import com.eventix.common.exception.BusinessException;
import com.eventix.common.response.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Writes files under {@code booking.file-store.root}. Names are random so uploads never collide
 * and the original name cannot escape the root directory.
 */
@Slf4j
@Component
public class LocalDiskFileStore implements FileStore {

    private final Path root;

    public LocalDiskFileStore(BookingProperties properties) {
        this.root = Paths.get(properties.getFileStore().getRoot()).toAbsolutePath().normalize();
    }

    @Override
    public String store(byte[] content, String originalFilename) {
        String extension = StringUtils.getFilenameExtension(originalFilename);
        String name = UUID.randomUUID() + (extension != null ? "." + extension.toLowerCase() : "");
        Path target = root.resolve(name);
        try {
            Files.createDirectories(root);
            Files.write(target, content);
        } catch (IOException e) {
            log.error("Failed to store file: target={}", target, e);
            throw new BusinessException(ErrorCode.FILE_STORE_FAILED);
        }
        log.debug("File stored: name={}, bytes={}", name, content.length);
        return target.toUri().toString();
    }

    @Override
    public void delete(String reference) {
        Path target = Paths.get(URI.create(reference)).normalize();
        if (!root.equals(target.getParent())) {
            log.warn("Refusing to delete file outside store root: reference={}", reference);
            return;
        }
        try {
            Files.deleteIfExists(target);
            log.debug("File deleted: name={}", target.getFileName());
        } catch (IOException e) {
            log.warn("Failed to delete orphaned file: target={}", target, e);
        }
    }
}
