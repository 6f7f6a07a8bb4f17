package com.ospicorp.templog.series.exception;

import java.util.List;
import java.util.Map;

public class UnreadableFileException extends UploadProcessingException {
  private final List<String> attempts;

  public UnreadableFileException(String message, List<String> attempts) {
    this(message, attempts, null);
  }

  public UnreadableFileException(String message, List<String> attempts, Throwable cause) {
    super(message, Map.of("attempts", List.copyOf(attempts)), cause);
    this.attempts = List.copyOf(attempts);
  }

  public List<String> attempts() {
    return attempts;
  }

  @Override
  public String slug() {
    return "unreadable-file";
  }
}
