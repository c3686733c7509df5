package com.microblog.application.service;

import com.microblog.application.port.in.UploadMediaUseCase.MediaUpload;
import com.microblog.application.port.out.IdGenerator;
import com.microblog.application.port.out.MediaRepository;
import com.microblog.application.port.out.MediaStorage;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.domain.error.MediaError;
import com.microblog.domain.model.Media;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.util.unit.DataSize;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MediaService")
class MediaServiceTest {

    private static final User ALICE = new User(UserId.of(1), "alice", "alice-key");

    @Mock
    private MediaRepository mediaRepository;

    @Mock
    private MediaStorage mediaStorage;

    @Mock
    private IdGenerator idGenerator;

    @Mock
    private MetricsPort metrics;

    private MediaService mediaService;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.getMedia().setMaxFileSize(DataSize.ofBytes(10));
        mediaService = new MediaService(mediaRepository, mediaStorage, idGenerator, appProperties, metrics);
    }

    @Test
    @DisplayName("Should store file and record media row")
    void shouldStoreAndRecord() {
        // Given
        byte[] content = {1, 2, 3};
        when(mediaStorage.store(ALICE.id(), "pic.jpg", content)).thenReturn("./images/1/pic.jpg");
        when(idGenerator.nextMediaId()).thenReturn(3L);

        // When
        var result = mediaService.upload(ALICE, new MediaUpload("pic.jpg", content));

        // Then
        assertTrue(result.isSuccess());
        assertEquals(new Media(3, ALICE.id(), "./images/1/pic.jpg"), result.getOrThrow());
        verify(mediaRepository).save(result.getOrThrow());
        verify(metrics).incrementMediaUploaded();
    }

    @Test
    @DisplayName("Should report a missing filename as NotFound")
    void shouldRejectMissingFilename() {
        var result = mediaService.upload(ALICE, new MediaUpload("", new byte[] {1}));

        var error = assertInstanceOf(MediaError.MissingFilename.class, result.errorOrNull());
        assertEquals("NotFound", error.code());
        verifyNoInteractions(mediaStorage, mediaRepository);
    }

    @Test
    @DisplayName("Should reject files over the configured limit")
    void shouldRejectTooLarge() {
        var result = mediaService.upload(ALICE, new MediaUpload("big.bin", new byte[11]));

        var error = assertInstanceOf(MediaError.FileTooLarge.class, result.errorOrNull());
        assertEquals("FileError", error.code());
        assertEquals(11, error.size());
        verify(mediaStorage, never()).store(any(), any(), any());
    }

    @Test
    @DisplayName("Should accept a file exactly at the limit")
    void shouldAcceptAtLimit() {
        when(mediaStorage.store(any(), any(), any())).thenReturn("./images/1/ok.bin");
        when(idGenerator.nextMediaId()).thenReturn(1L);

        var result = mediaService.upload(ALICE, new MediaUpload("ok.bin", new byte[10]));

        assertTrue(result.isSuccess());
    }
}
