package com.microblog.adapter.in.web;

import com.microblog.application.port.in.ResolveIdentityUseCase;
import com.microblog.application.port.in.UploadMediaUseCase;
import com.microblog.application.port.in.UploadMediaUseCase.MediaUpload;
import com.microblog.domain.error.IdentityError;
import com.microblog.domain.error.MediaError;
import com.microblog.domain.model.Media;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(MediaController.class)
class MediaControllerTest {

    private static final User ALICE = new User(UserId.of(1), "alice", "alice-key");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UploadMediaUseCase uploadMediaUseCase;

    @MockBean
    private ResolveIdentityUseCase resolveIdentityUseCase;

    @BeforeEach
    void authenticate() {
        when(resolveIdentityUseCase.resolve(any())).thenReturn(Result.failure(IdentityError.MissingApiKey.INSTANCE));
        when(resolveIdentityUseCase.resolve("alice-key")).thenReturn(Result.success(ALICE));
    }

    @Test
    void shouldUploadFile() throws Exception {
        when(uploadMediaUseCase.upload(eq(ALICE), any()))
            .thenReturn(Result.success(new Media(3, ALICE.id(), "./images/1/pic.jpg")));

        mockMvc.perform(multipart("/api/medias")
                .file(new MockMultipartFile("file", "pic.jpg", "image/jpeg", new byte[] {1, 2}))
                .header("api-key", "alice-key"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.result").value(true))
            .andExpect(jsonPath("$.media_id").value(3));

        ArgumentCaptor<MediaUpload> captor = ArgumentCaptor.forClass(MediaUpload.class);
        verify(uploadMediaUseCase).upload(eq(ALICE), captor.capture());
        assertEquals("pic.jpg", captor.getValue().filename());
        assertArrayEquals(new byte[] {1, 2}, captor.getValue().content());
    }

    @Test
    void shouldPassMissingPartAsNoFilename() throws Exception {
        when(uploadMediaUseCase.upload(eq(ALICE), any()))
            .thenReturn(Result.failure(MediaError.MissingFilename.INSTANCE));

        mockMvc.perform(multipart("/api/medias").header("api-key", "alice-key"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_type").value("NotFound"))
            .andExpect(jsonPath("$.error_message").value("File not found"));

        ArgumentCaptor<MediaUpload> captor = ArgumentCaptor.forClass(MediaUpload.class);
        verify(uploadMediaUseCase).upload(eq(ALICE), captor.capture());
        assertNull(captor.getValue().filename());
    }

    @Test
    void shouldReturnFileErrorWhenTooLarge() throws Exception {
        when(uploadMediaUseCase.upload(eq(ALICE), any()))
            .thenReturn(Result.failure(new MediaError.FileTooLarge(6 * 1024 * 1024, 5 * 1024 * 1024)));

        mockMvc.perform(multipart("/api/medias")
                .file(new MockMultipartFile("file", "big.bin", "application/octet-stream", new byte[] {0}))
                .header("api-key", "alice-key"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_type").value("FileError"));
    }
}
