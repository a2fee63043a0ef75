package com.spotify.retry;

/**
 * A payload together with the status code it was delivered with, for operations such as HTTP
 * calls that report both.
 */
public record StatusResponse<T>(T body, int status) {

  public static <T> StatusResponse<T> of(T body, int status) {
    return new StatusResponse<>(body, status);
  }
}
