package com.ospicorp.userloads.series;

import java.nio.file.Path;

public class StoreClosedException extends UserLoadsException {

  public StoreClosedException(Path path) {
    super("Load store " + path + " has been closed");
  }
}
