package com.streamfirst.zone.directory.domain;

import java.util.Objects;
import java.util.Optional;
import lombok.EqualsAndHashCode;

/**
 * Either a value or a failure carrying a message and a numeric error code. Used where a
 * collaborator reports an expected failure that the caller degrades rather than propagates.
 *
 * @param <T> the type of the value on success
 */
@EqualsAndHashCode
public final class Result<T> {

  /** Error code used when a failure has no more specific code. */
  public static final int GENERIC_ERROR = -1;

  private final T value;
  private final String errorMessage;
  private final int errorCode;

  private Result(T value, String errorMessage, int errorCode) {
    this.value = value;
    this.errorMessage = errorMessage;
    this.errorCode = errorCode;
  }

  public static <T> Result<T> success(T value) {
    return new Result<>(Objects.requireNonNull(value, "Value cannot be null"), null, 0);
  }

  public static <T> Result<T> failure(String errorMessage) {
    return failure(errorMessage, GENERIC_ERROR);
  }

  /**
   * Creates a failure.
   *
   * @param errorMessage what went wrong
   * @param errorCode a negative errno-style code
   */
  public static <T> Result<T> failure(String errorMessage, int errorCode) {
    Objects.requireNonNull(errorMessage, "Error message cannot be null");
    if (errorCode >= 0) {
      throw new IllegalArgumentException("Error code must be negative, got " + errorCode);
    }
    return new Result<>(null, errorMessage, errorCode);
  }

  public boolean isSuccess() {
    return errorMessage == null;
  }

  public boolean isFailure() {
    return !isSuccess();
  }

  /** The value if successful, empty otherwise. */
  public Optional<T> getValue() {
    return Optional.ofNullable(value);
  }

  public Optional<String> getErrorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  /** The error code, or 0 on success. */
  public int getErrorCode() {
    return errorCode;
  }

  @Override
  public String toString() {
    if (isSuccess()) {
      return "Result.success(" + value + ")";
    }
    return "Result.failure(" + errorMessage + ", code=" + errorCode + ")";
  }
}
