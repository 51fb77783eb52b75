package com.expirebot.expiry.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body in the standard Matrix {@code errcode}/{@code error} shape.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatrixErrorResponse(
        @JsonProperty("errcode") String errcode,
        @JsonProperty("error") String error,
        @JsonProperty("trace_id") String traceId
) {
}
