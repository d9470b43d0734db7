package com.timemultiplier.api.exception;

/**
 * The time-tracking provider could not answer: transport failure, 5xx, unreadable body, open
 * circuit or exhausted rate limit. A definitive "no such user" answer is not this exception.
 */
public class UpstreamUnavailableException extends RuntimeException {

  public UpstreamUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
