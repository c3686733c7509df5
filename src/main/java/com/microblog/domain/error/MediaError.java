package com.microblog.domain.error;

/**
 * Sealed type representing expected business errors for media uploads.
 */
public sealed interface MediaError extends DomainError {

    /**
     * An upload without a filename is reported exactly like a missing file.
     */
    record MissingFilename() implements MediaError {
        public static final MissingFilename INSTANCE = new MissingFilename();

        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }

        @Override
        public String message() {
            return "File not found";
        }

        @Override
        public String code() {
            return "NotFound";
        }
    }

    record FileTooLarge(long size, long maxSize) implements MediaError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.VALIDATION;
        }

        @Override
        public String message() {
            return "File size must not exceed " + (maxSize / (1024 * 1024)) + " MB (was " + size + " bytes)";
        }

        @Override
        public String code() {
            return "FileError";
        }
    }
}
