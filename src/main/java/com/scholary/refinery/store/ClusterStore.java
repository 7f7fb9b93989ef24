package com.scholary.refinery.store;

import com.scholary.refinery.cluster.ClusterState;
import java.util.List;
import java.util.Optional;

/**
 * Durable persistence of research clusters, keyed by session id.
 *
 * <p>Entries expire a fixed retention window after their last write. Each {@link #put} replaces the
 * whole record in a single write, so a concurrent {@link #get} sees either the previous or the new
 * state, never a mix.
 *
 * <p>The store is not aware of which run owns a session. Callers guarantee that at most one run
 * writes a given session at a time.
 */
public interface ClusterStore {

  /**
   * Persist the full cluster state and refresh its expiry.
   *
   * @param state the state to write
   * @throws ClusterStoreException if the write could not be recorded
   */
  void put(ClusterState state);

  /**
   * Load a cluster.
   *
   * @param sessionId the session id
   * @return a private copy of the stored state, or empty if unknown or expired
   * @throws ClusterStoreException if the backend could not be read
   */
  Optional<ClusterState> get(String sessionId);

  /**
   * List all live clusters, newest first.
   *
   * <p>Best effort: entries that expire while the listing runs are left out.
   *
   * @return the live clusters
   */
  List<ClusterState> listAll();
}
