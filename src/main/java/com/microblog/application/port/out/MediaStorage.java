package com.microblog.application.port.out;

import com.microblog.domain.model.UserId;

/**
 * Port for persisting uploaded file contents.
 * Writes are not part of the database transaction.
 */
public interface MediaStorage {

    /**
     * Stores the content under the owner's namespace, never overwriting an existing file.
     *
     * @return the stored path, as later shown to clients in tweet attachments
     */
    String store(UserId owner, String filename, byte[] content);
}
