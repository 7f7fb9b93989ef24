package com.scholary.refinery.task;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.refinery.config.RefineryProperties;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for task handles.
 *
 * <p>Uses a Caffeine cache so finished tasks age out after the configured retention. Updates go
 * through {@code compute} on the cache's map, so concurrent progress reports and the final result
 * never overwrite each other, and a terminal handle is left as it is.
 */
@Repository
public class TaskRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskRepository.class);

  private final Cache<String, TaskHandle> cache;

  public TaskRepository(RefineryProperties properties) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.taskMaxSize())
            .expireAfterWrite(properties.taskRetention())
            .build();
  }

  public void save(TaskHandle handle) {
    cache.put(handle.taskId(), handle);
  }

  public Optional<TaskHandle> findById(String taskId) {
    return Optional.ofNullable(cache.getIfPresent(taskId));
  }

  /**
   * Replace a handle with an updated one.
   *
   * @param taskId the task
   * @param update derives the new handle from the current one
   * @return the handle now stored, or empty if the task is unknown or expired
   */
  public Optional<TaskHandle> update(String taskId, UnaryOperator<TaskHandle> update) {
    TaskHandle stored =
        cache
            .asMap()
            .computeIfPresent(
                taskId,
                (id, current) -> {
                  if (current.isTerminal()) {
                    LOGGER.debug("Ignoring update to finished task {}", id);
                    return current;
                  }
                  return update.apply(current);
                });
    return Optional.ofNullable(stored);
  }
}
