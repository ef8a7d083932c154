package io.github.themoah.twindrift.metrics;

import io.github.themoah.twindrift.model.DivergenceResult;
import io.github.themoah.twindrift.model.DivergenceSeverity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.vertx.core.Future;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports divergence results using a Micrometer MeterRegistry.
 *
 * <p>Gauges hold the latest drift statistics per twin/baseline pair, scaled by 1000
 * and rounded so that three decimal places survive the long-valued gauge.
 * Counters accumulate detections and significant divergences.
 *
 * <p>Every meter is tagged with its twin/baseline pair. Pairs that stop being
 * compared are removed with {@link #cleanupStalePairs} or {@link #removePair}.
 */
public class MicrometerDivergenceReporter implements DivergenceReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerDivergenceReporter.class);

  static final double GAUGE_SCALE = 1000.0;
  static final String METER_PREFIX = "twin.";

  private final MeterRegistry registry;
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> gaugeKeysByPair = new ConcurrentHashMap<>();
  private final Set<String> markedForDeletion = ConcurrentHashMap.newKeySet();

  public MicrometerDivergenceReporter(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public Future<Void> report(DivergenceResult result, DivergenceSeverity severity) {
    Tags tags = pairTags(result.twinName(), result.baselineName());
    Set<String> gaugeKeys = gaugeKeysByPair.computeIfAbsent(tags.toString(), k -> ConcurrentHashMap.newKeySet());

    gaugeKeys.add(recordGauge("twin.drift.score", tags, result.driftScore()));
    gaugeKeys.add(recordGauge("twin.drift.mad", tags, result.drift().meanAbsoluteDeviation()));
    gaugeKeys.add(recordGauge("twin.drift.rmsd", tags, result.drift().rootMeanSquareDeviation()));
    gaugeKeys.add(recordGauge("twin.early_deviation.percent", tags, result.earlyDeviation().deviationPercent()));

    Counter.builder("twin.comparisons")
      .tags(tags)
      .register(registry)
      .increment();

    if (result.detected()) {
      Counter.builder("twin.divergence.detected")
        .tags(tags)
        .register(registry)
        .increment();
    }
    if (severity == DivergenceSeverity.SIGNIFICANT) {
      Counter.builder("twin.divergence.significant")
        .tags(tags)
        .register(registry)
        .increment();
    }

    log.debug("Reported divergence metrics for twin={}, baseline={}, severity={}",
      result.twinName(), result.baselineName(), severity.getValue());
    return Future.succeededFuture();
  }

  /**
   * Two-phase cleanup for pairs missing from the latest batch.
   * Phase 1: Mark pairs that were not compared for deletion
   * Phase 2: Remove pairs that were marked AND are still missing
   *
   * @param activeResults results of the current batch
   */
  @Override
  public void cleanupStalePairs(List<DivergenceResult> activeResults) {
    Set<String> activePairs = new HashSet<>();
    for (DivergenceResult result : activeResults) {
      activePairs.add(pairTags(result.twinName(), result.baselineName()).toString());
    }

    // Phase 2: Remove pairs marked in the previous cycle that are still missing
    Set<String> toDelete = new HashSet<>(markedForDeletion);
    toDelete.removeAll(activePairs);

    for (String pairKey : toDelete) {
      removeMeters(pairKey);
      markedForDeletion.remove(pairKey);
    }

    if (!toDelete.isEmpty()) {
      log.info("Cleaned up meters of {} stale twin/baseline pairs", toDelete.size());
    }

    // Phase 1: Mark currently missing pairs for deletion
    Set<String> missing = new HashSet<>(gaugeKeysByPair.keySet());
    missing.removeAll(activePairs);
    missing.removeAll(toDelete);

    // Clear marks for pairs that came back
    markedForDeletion.retainAll(missing);

    for (String pairKey : missing) {
      if (markedForDeletion.add(pairKey)) {
        log.debug("Marked pair for deletion: {}", pairKey);
      }
    }
  }

  /**
   * Removes every gauge and counter of one twin/baseline pair immediately.
   */
  public void removePair(String twinName, String baselineName) {
    String pairKey = pairTags(twinName, baselineName).toString();
    markedForDeletion.remove(pairKey);
    removeMeters(pairKey);
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerDivergenceReporter");
    if (registry != null) {
      registry.close();
    }
    return Future.succeededFuture();
  }

  private String recordGauge(String name, Tags tags, double value) {
    long scaled = Math.round(value * GAUGE_SCALE);
    String key = name + tags.toString();
    AtomicLong atomicValue = gaugeValues.computeIfAbsent(key, k -> {
      AtomicLong newValue = new AtomicLong(scaled);
      Gauge.builder(name, newValue, AtomicLong::get)
        .tags(tags)
        .register(registry);
      return newValue;
    });
    atomicValue.set(scaled);
    return key;
  }

  private void removeMeters(String pairKey) {
    Set<String> gaugeKeys = gaugeKeysByPair.remove(pairKey);
    if (gaugeKeys != null) {
      gaugeKeys.forEach(gaugeValues::remove);
    }

    List<Meter> pairMeters = registry.getMeters().stream()
      .filter(meter -> meter.getId().getName().startsWith(METER_PREFIX))
      .filter(meter -> Tags.of(meter.getId().getTags()).toString().equals(pairKey))
      .toList();
    pairMeters.forEach(registry::remove);
    log.debug("Removed {} meters for pair {}", pairMeters.size(), pairKey);
  }

  private static Tags pairTags(String twinName, String baselineName) {
    return Tags.of(
      "twin", twinName,
      "baseline", baselineName
    );
  }
}
