package com.scholary.sorter.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Error body returned by every endpoint. {@code currentStatus} is set for conflicts only. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(String error, int status, String currentStatus) {

  public static ApiError of(String error, int status) {
    return new ApiError(error, status, null);
  }
}
