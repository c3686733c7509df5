package com.microblog.application.port.out;

/**
 * Port for generating unique identifiers.
 * Ids are allocated before insert so that domain objects are complete when constructed.
 */
public interface IdGenerator {

    long nextTweetId();

    long nextMediaId();
}
