package com.ospicorp.userloads.series.model;

import java.util.List;

// The seed is always the one that produced userIds, so the draw can be repeated
public record UserSubset(long seed, List<Long> userIds) {

  public UserSubset {
    userIds = List.copyOf(userIds);
  }

  public int size() {
    return userIds.size();
  }
}
