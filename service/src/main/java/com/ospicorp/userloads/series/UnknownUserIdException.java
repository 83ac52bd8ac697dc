package com.ospicorp.userloads.series;

public class UnknownUserIdException extends UserLoadsException {
  private final long userId;

  public UnknownUserIdException(long userId) {
    super("Invalid user ID " + userId + ". Check userIds() for the list of valid IDs.");
    this.userId = userId;
  }

  public long userId() {
    return userId;
  }
}
