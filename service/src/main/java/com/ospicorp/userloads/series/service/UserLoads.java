package com.ospicorp.userloads.series.service;

import com.ospicorp.userloads.series.StoreClosedException;
import com.ospicorp.userloads.series.UnknownUserIdException;
import com.ospicorp.userloads.series.model.LoadSeries;
import com.ospicorp.userloads.series.repository.H2LoadStore;
import com.ospicorp.userloads.series.repository.IdentifierSelector;
import com.ospicorp.userloads.series.repository.LoadStore;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-user load series from a {@link LoadStore}, presented as a map keyed by user ID.
 *
 * <p>Loading is late: a series is not read until it is requested the first time, after which
 * the in-memory copy is returned. The in-memory copy can be replaced with {@link #set} and
 * restored from the store with {@link #forceRead}. Nothing is ever written back to the store.
 *
 * <p>The set of valid user IDs is fixed when the instance is created and depends on the
 * {@link IdentifierSelector}. Every key-based operation validates against that set, never
 * against what happens to be cached.
 *
 * <p>Instances are not thread-safe. Callers sharing one between threads must synchronize
 * externally.
 */
public class UserLoads implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(UserLoads.class);

  private final LoadStore store;
  private final IdentifierSelector selector;
  private final Set<Long> userIds;
  private final Map<Long, LoadSeries> loads = new LinkedHashMap<>();

  public UserLoads(LoadStore store, IdentifierSelector selector) {
    this.store = Objects.requireNonNull(store, "store");
    this.selector = Objects.requireNonNull(selector, "selector");
    this.userIds = store.userIds(selector);
    log.debug("User loads on {} ({}) expose {} user IDs", store.path(), selector.entryName(),
        userIds.size());
  }

  /** Opens the H2 store at {@code path} and exposes the users registered under {@code selector}. */
  public static UserLoads open(Path path, IdentifierSelector selector) {
    H2LoadStore store = H2LoadStore.open(path);
    try {
      return new UserLoads(store, selector);
    } catch (RuntimeException ex) {
      store.close();
      throw ex;
    }
  }

  /**
   * Returns the cached series for {@code userId}, reading it from the store on first access.
   * The returned object is the cached instance itself.
   *
   * @throws UnknownUserIdException if {@code userId} is not one of {@link #userIds()}
   * @throws StoreClosedException if {@link #close()} has been called
   */
  public LoadSeries get(long userId) {
    checkOpen();
    checkUserId(userId);
    LoadSeries cached = loads.get(userId);
    if (cached != null) {
      return cached;
    }
    return forceRead(userId);
  }

  /**
   * Replaces the in-memory series for {@code userId}. The store is not touched, and a later
   * {@link #forceRead} or {@link #readAll} restores the stored value.
   *
   * @throws UnknownUserIdException if {@code userId} is not one of {@link #userIds()}
   */
  public void set(long userId, LoadSeries series) {
    Objects.requireNonNull(series, "series");
    checkUserId(userId);
    loads.put(userId, series);
  }

  /**
   * Reads {@code userId} from the store, overwriting anything cached. Use {@link #get} for normal
   * access; call this only to reset a modified series to the stored value.
   */
  public LoadSeries forceRead(long userId) {
    checkOpen();
    checkUserId(userId);
    LoadSeries series = store.readSeries(userId);
    loads.put(userId, series);
    return series;
  }

  /** Reads every user from the store, discarding all in-memory modifications. */
  public void readAll() {
    checkOpen();
    log.info("Reading all {} users from {}", userIds.size(), store.path());
    for (Long userId : userIds) {
      forceRead(userId);
    }
  }

  /**
   * Removes and returns the cached series for {@code userId}, reading it first if it was not
   * cached. The user ID stays valid; the next {@link #get} reads it from the store again.
   */
  public LoadSeries pop(long userId) {
    checkOpen();
    checkUserId(userId);
    if (!loads.containsKey(userId)) {
      forceRead(userId);
    }
    return loads.remove(userId);
  }

  /** Whether {@code userId} is valid for this instance, whether or not it has been read. */
  public boolean contains(long userId) {
    return userIds.contains(userId);
  }

  public Set<Long> userIds() {
    return userIds;
  }

  /** Ascending copy of {@link #userIds()}, convenient for shuffling and slicing. */
  public List<Long> userIdList() {
    return List.copyOf(userIds);
  }

  /**
   * The series read or assigned so far. This is the live internal map: changes made through it
   * change this instance as well.
   */
  public Map<Long, LoadSeries> loads() {
    return loads;
  }

  public int size() {
    return userIds.size();
  }

  public Path path() {
    return store.path();
  }

  public IdentifierSelector selector() {
    return selector;
  }

  public boolean isClosed() {
    return store.isClosed();
  }

  /**
   * Closes the underlying store so the file can be used elsewhere. Any later attempt to read
   * fails with {@link StoreClosedException}.
   */
  @Override
  public void close() {
    store.close();
  }

  private void checkOpen() {
    if (store.isClosed()) {
      throw new StoreClosedException(store.path());
    }
  }

  private void checkUserId(long userId) {
    if (!userIds.contains(userId)) {
      throw new UnknownUserIdException(userId);
    }
  }

  @Override
  public String toString() {
    return "UserLoads[path=" + store.path() + ", selector=" + selector.entryName()
        + ", userIds=" + userIds + ", cached=" + loads.keySet() + "]";
  }
}
