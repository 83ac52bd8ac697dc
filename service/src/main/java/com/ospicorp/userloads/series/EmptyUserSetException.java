package com.ospicorp.userloads.series;

public class EmptyUserSetException extends UserLoadsException {

  public EmptyUserSetException() {
    super("At least one user ID is required to compute a total load");
  }
}
