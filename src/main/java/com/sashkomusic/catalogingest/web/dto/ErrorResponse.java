package com.sashkomusic.catalogingest.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sashkomusic.catalogingest.domain.model.DuplicateMatch;

public record ErrorResponse(Detail detail) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Detail(
            @JsonProperty("error_code") String errorCode,
            String message,
            DuplicateMatch match
    ) {
    }

    public static ErrorResponse of(String errorCode, String message) {
        return new ErrorResponse(new Detail(errorCode, message, null));
    }

    public static ErrorResponse of(String errorCode, String message, DuplicateMatch match) {
        return new ErrorResponse(new Detail(errorCode, message, match));
    }
}
