package com.timemultiplier.api.exception;

public class CorruptDataException extends RuntimeException {

  public CorruptDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
