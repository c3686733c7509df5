package com.microblog.application.port.in;

import com.microblog.domain.error.MediaError;
import com.microblog.domain.model.Media;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;

public interface UploadMediaUseCase {

    Result<Media, MediaError> upload(User owner, MediaUpload upload);

    /**
     * Raw upload as received from the client. The filename may be null or blank.
     */
    record MediaUpload(String filename, byte[] content) {}
}
