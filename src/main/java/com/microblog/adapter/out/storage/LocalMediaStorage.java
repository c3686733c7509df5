package com.microblog.adapter.out.storage;

import com.microblog.application.port.out.MediaStorage;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.config.AppProperties;
import com.microblog.infrastructure.exception.MediaStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Stores uploads on the local filesystem under {@code {root}/{userId}/}.
 * A taken name gets a numeric suffix ({@code pic_1.jpg}, {@code pic_2.jpg}, ...).
 */
@Component
public class LocalMediaStorage implements MediaStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalMediaStorage.class);

    private final String root;

    public LocalMediaStorage(AppProperties appProperties) {
        this(appProperties.getMedia().getRoot());
    }

    LocalMediaStorage(String root) {
        this.root = root;
    }

    @Override
    public String store(UserId owner, String filename, byte[] content) {
        // Only the last path segment is kept, so "../x" cannot escape the user directory
        Path nameOnly = Path.of(filename).getFileName();
        if (nameOnly == null) {
            throw new IllegalArgumentException("Filename has no name segment: " + filename);
        }
        String sanitized = nameOnly.toString();

        int dot = sanitized.lastIndexOf('.');
        String base = dot > 0 ? sanitized.substring(0, dot) : sanitized;
        String extension = dot > 0 ? sanitized.substring(dot) : "";

        Path directory = Path.of(root).resolve(owner.toString());
        try {
            Files.createDirectories(directory);
            for (int attempt = 0; ; attempt++) {
                String candidate = attempt == 0 ? base + extension : base + "_" + attempt + extension;
                Path target = directory.resolve(candidate);
                try {
                    Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                    log.debug("Stored {} bytes at {}", content.length, target);
                    return target.toString();
                } catch (FileAlreadyExistsException e) {
                    log.debug("Name taken, trying next suffix: {}", target);
                }
            }
        } catch (IOException e) {
            throw new MediaStorageException("Failed to store " + sanitized + " for user " + owner, e);
        }
    }
}
