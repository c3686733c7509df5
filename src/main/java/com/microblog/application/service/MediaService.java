package com.microblog.application.service;

import com.microblog.application.port.in.UploadMediaUseCase;
import com.microblog.application.port.out.IdGenerator;
import com.microblog.application.port.out.MediaRepository;
import com.microblog.application.port.out.MediaStorage;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.domain.error.MediaError;
import com.microblog.domain.model.Media;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class MediaService implements UploadMediaUseCase {

    private static final Logger log = LoggerFactory.getLogger(MediaService.class);

    private final MediaRepository mediaRepository;
    private final MediaStorage mediaStorage;
    private final IdGenerator idGenerator;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public MediaService(
            MediaRepository mediaRepository,
            MediaStorage mediaStorage,
            IdGenerator idGenerator,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.mediaRepository = mediaRepository;
        this.mediaStorage = mediaStorage;
        this.idGenerator = idGenerator;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    @Transactional
    public Result<Media, MediaError> upload(User owner, MediaUpload upload) {
        int size = upload.content() != null ? upload.content().length : 0;
        log.debug("Processing upload: user={}, filename={}, bytes={}", owner.id(), upload.filename(), size);

        if (upload.filename() == null || upload.filename().isBlank()) {
            log.warn("Upload rejected for user={}: no filename", owner.id());
            return Result.failure(MediaError.MissingFilename.INSTANCE);
        }

        long maxSize = appProperties.getMedia().getMaxFileSize().toBytes();
        if (size > maxSize) {
            log.warn("Upload rejected for user={}: {} bytes exceeds limit of {}", owner.id(), size, maxSize);
            return Result.failure(new MediaError.FileTooLarge(size, maxSize));
        }

        // The file write is outside the transaction; a failed insert leaves an orphaned file
        String path = mediaStorage.store(owner.id(), upload.filename(), upload.content());

        Media media = new Media(idGenerator.nextMediaId(), owner.id(), path);
        mediaRepository.save(media);

        metrics.incrementMediaUploaded();
        log.info("Media stored: mediaId={}, userId={}, path={}", media.id(), owner.id(), path);

        return Result.success(media);
    }
}
