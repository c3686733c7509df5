package com.microblog.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.microblog.application.port.in.UploadMediaUseCase;
import com.microblog.application.port.in.UploadMediaUseCase.MediaUpload;
import com.microblog.domain.error.MediaError;
import com.microblog.domain.model.Media;
import com.microblog.domain.model.Result;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api")
@Tag(name = "Media", description = "Media uploads")
public class MediaController {

    private final UploadMediaUseCase uploadMediaUseCase;

    public MediaController(UploadMediaUseCase uploadMediaUseCase) {
        this.uploadMediaUseCase = uploadMediaUseCase;
    }

    @PostMapping(value = "/medias", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a media file", description = "Returns the media id to reference from a new tweet")
    public ResponseEntity<?> upload(@RequestPart(value = "file", required = false) MultipartFile file) throws IOException {
        // A missing part is reported the same way as a part without a filename
        MediaUpload upload = file == null
            ? new MediaUpload(null, new byte[0])
            : new MediaUpload(file.getOriginalFilename(), file.getBytes());

        Result<Media, MediaError> result = uploadMediaUseCase.upload(RequestContext.getUser(), upload);

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(new UploadResponse(true, result.getOrThrow().id()))
            : ErrorResponse.toResponseEntity(result.errorOrNull());
    }

    public record UploadResponse(
        @JsonProperty("result") boolean result,
        @JsonProperty("media_id") long mediaId
    ) {}
}
