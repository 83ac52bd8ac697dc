package com.ospicorp.userloads.series.repository;

public enum IdentifierSelector {
  ALL("user_ids"),
  // meters selected for the clean+predict experiment
  EXPERIMENT("user_ids_cln_pred_exp");

  private final String entryName;

  IdentifierSelector(String entryName) {
    this.entryName = entryName;
  }

  public String entryName() {
    return entryName;
  }
}
