package com.microblog.domain.model;

import com.microblog.domain.error.ValidationError.TweetError;

import java.util.List;

/**
 * A posted message. Attachments are the stored media paths copied at creation time,
 * in the order the author referenced them; later changes to media rows do not affect them.
 */
public record Tweet(
    long id,
    UserId userId,
    String content,
    List<String> attachments
) {
    public static final int MAX_CONTENT_LENGTH = 280;

    public Tweet {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    /**
     * Checks tweet text before an id is allocated, returning a Result for expected validation failures.
     * Length is counted in code points on the text as sent; the text is stored unchanged.
     */
    public static Result<String, TweetError> validateContent(String content) {
        if (content == null || content.isBlank()) {
            return Result.failure(TweetError.EmptyContent.INSTANCE);
        }
        int length = content.codePointCount(0, content.length());
        if (length > MAX_CONTENT_LENGTH) {
            return Result.failure(new TweetError.ContentTooLong(length, MAX_CONTENT_LENGTH));
        }
        return Result.success(content);
    }
}
