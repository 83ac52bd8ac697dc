package com.ospicorp.userloads.series;

public class UserLoadsException extends RuntimeException {

  public UserLoadsException(String message) {
    super(message);
  }

  public UserLoadsException(String message, Throwable cause) {
    super(message, cause);
  }
}
