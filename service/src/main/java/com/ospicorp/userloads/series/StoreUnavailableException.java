package com.ospicorp.userloads.series;

import java.nio.file.Path;

public class StoreUnavailableException extends UserLoadsException {
  private final Path path;

  public StoreUnavailableException(Path path, String message) {
    super(message);
    this.path = path;
  }

  public StoreUnavailableException(Path path, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  public Path path() {
    return path;
  }
}
