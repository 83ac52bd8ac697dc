package com.ospicorp.userloads.series.repository;

import com.ospicorp.userloads.series.model.LoadSeries;
import java.nio.file.Path;
import java.util.Set;

/**
 * Read-only keyed time-series container. Implementations are not thread-safe.
 */
public interface LoadStore extends AutoCloseable {

  Path path();

  /**
   * @return the ascending, unmodifiable set of user IDs registered under {@code selector}
   * @throws com.ospicorp.userloads.series.StoreClosedException if the store has been closed
   */
  Set<Long> userIds(IdentifierSelector selector);

  /**
   * Reads the full series of {@code userId}. Every call returns a new object.
   *
   * @throws com.ospicorp.userloads.series.UnknownUserIdException if {@code userId} is not in
   *     {@code userIds(IdentifierSelector.ALL)}
   * @throws com.ospicorp.userloads.series.StoreClosedException if the store has been closed
   */
  LoadSeries readSeries(long userId);

  boolean isClosed();

  /** Releases the underlying resources. Calling it again has no effect. */
  @Override
  void close();
}
