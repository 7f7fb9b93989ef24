package com.scholary.refinery.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.refinery.cluster.ClusterState;
import com.scholary.refinery.cluster.ClusterStatus;
import com.scholary.refinery.store.ClusterStateCodec;
import com.scholary.refinery.store.ClusterStore;
import com.scholary.refinery.store.ClusterStoreException;
import com.scholary.refinery.store.InMemoryClusterStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** In-memory store that records the status of every write and can be made to fail. */
class RecordingClusterStore implements ClusterStore {

  private final InMemoryClusterStore delegate =
      new InMemoryClusterStore(new ClusterStateCodec(new ObjectMapper()), Duration.ofDays(7), 100);

  final List<ClusterStatus> writtenStatuses = new ArrayList<>();
  private int writesBeforeFailure = Integer.MAX_VALUE;

  void failAfter(int writes) {
    this.writesBeforeFailure = writes;
  }

  @Override
  public void put(ClusterState state) {
    if (writesBeforeFailure-- <= 0) {
      throw new ClusterStoreException("Redis unavailable");
    }
    writtenStatuses.add(state.getStatus());
    delegate.put(state);
  }

  @Override
  public Optional<ClusterState> get(String sessionId) {
    return delegate.get(sessionId);
  }

  @Override
  public List<ClusterState> listAll() {
    return delegate.listAll();
  }
}
