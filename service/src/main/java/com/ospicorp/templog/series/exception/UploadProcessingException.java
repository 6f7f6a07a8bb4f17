package com.ospicorp.templog.series.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pipeline-level failure reported back to the uploader. {@link #details()} carries the
 * diagnostic context (columns read, columns chosen, variants tried).
 */
public abstract class UploadProcessingException extends RuntimeException {
  private final Map<String, Object> details;

  protected UploadProcessingException(String message, Map<String, Object> details) {
    this(message, details, null);
  }

  protected UploadProcessingException(String message, Map<String, Object> details,
      Throwable cause) {
    super(message, cause);
    this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public abstract String slug();

  public Map<String, Object> details() {
    return details;
  }
}
