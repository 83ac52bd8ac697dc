package com.ospicorp.userloads.series.model;

import java.util.List;

public record SubsetLoad(UserSubset subset, List<LoadSeries> periodLoads) {

  public SubsetLoad {
    periodLoads = List.copyOf(periodLoads);
  }
}
