package io.github.themoah.twindrift.metrics;

import io.github.themoah.twindrift.model.DivergenceResult;
import io.github.themoah.twindrift.model.DivergenceSeverity;
import io.vertx.core.Future;
import java.util.List;

/**
 * Interface for reporting divergence results to external systems.
 */
public interface DivergenceReporter {

  /**
   * Reports the outcome of one comparison.
   *
   * @param result the detection result
   * @param severity severity derived from the result
   * @return Future that completes when the result is recorded
   */
  Future<Void> report(DivergenceResult result, DivergenceSeverity severity);

  /**
   * Releases per-pair state for pairs absent from the latest batch.
   * Default implementation does nothing.
   *
   * @param activeResults results of the batch that was just reported
   */
  default void cleanupStalePairs(List<DivergenceResult> activeResults) {
    // No-op by default
  }

  /**
   * Closes the reporter and releases resources.
   *
   * @return Future that completes when closed
   */
  Future<Void> close();

  /**
   * Reporter that discards everything, used when metrics are disabled.
   */
  static DivergenceReporter noop() {
    return new DivergenceReporter() {
      @Override
      public Future<Void> report(DivergenceResult result, DivergenceSeverity severity) {
        return Future.succeededFuture();
      }

      @Override
      public Future<Void> close() {
        return Future.succeededFuture();
      }
    };
  }
}
