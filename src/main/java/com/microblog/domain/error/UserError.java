package com.microblog.domain.error;

import com.microblog.domain.model.UserId;

public sealed interface UserError extends DomainError {

    record UserNotFound(UserId userId) implements UserError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }

        @Override
        public String message() {
            return "User not found: " + userId;
        }

        @Override
        public String code() {
            return "NotFound";
        }
    }
}
