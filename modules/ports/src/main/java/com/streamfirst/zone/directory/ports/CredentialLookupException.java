package com.streamfirst.zone.directory.ports;

import lombok.Getter;

/** Thrown by a {@link CredentialStorePort} when the backing store cannot answer a lookup. */
@Getter
public class CredentialLookupException extends RuntimeException {

  /** Negative errno-style code reported by the store. */
  private final int errorCode;

  public CredentialLookupException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  public CredentialLookupException(String message, int errorCode, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }
}
