package com.timemultiplier.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(T data, String status, String message, String error) {
  public static <T> ApiResponse<T> success(T data) {
    return new ApiResponse<>(data, "ok", null, null);
  }

  public static <T> ApiResponse<T> message(String message) {
    return new ApiResponse<>(null, "ok", message, null);
  }

  public static <T> ApiResponse<T> message(String message, T data) {
    return new ApiResponse<>(data, "ok", message, null);
  }

  public static <T> ApiResponse<T> error(String error) {
    return new ApiResponse<>(null, "error", null, error);
  }
}
