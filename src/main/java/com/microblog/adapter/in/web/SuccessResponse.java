package com.microblog.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of mutations that return nothing but the outcome.
 */
public record SuccessResponse(@JsonProperty("result") boolean result) {

    public static final SuccessResponse OK = new SuccessResponse(true);
}
