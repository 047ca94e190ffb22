package com.streamfirst.ddns.application;

/** Raised when a content reference uses an encoding the decoder does not understand. */
public class ContentRefDecodingException extends RuntimeException {

  public ContentRefDecodingException(String message) {
    super(message);
  }

  public ContentRefDecodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
