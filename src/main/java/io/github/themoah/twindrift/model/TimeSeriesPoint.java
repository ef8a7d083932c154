package io.github.themoah.twindrift.model;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single observation in a metric series.
 *
 * @param timestamp observation time, or null when the source timestamp could not be parsed
 * @param value observed value
 * @param label optional display label (nullable)
 * @param metadata optional free-form attributes (never null)
 */
public record TimeSeriesPoint(
  Instant timestamp,
  double value,
  String label,
  Map<String, Object> metadata
) {

  private static final Logger log = LoggerFactory.getLogger(TimeSeriesPoint.class);

  public TimeSeriesPoint {
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static TimeSeriesPoint of(Instant timestamp, double value) {
    return new TimeSeriesPoint(timestamp, value, null, Map.of());
  }

  /**
   * Parses a point from JSON.
   *
   * <p>{@code timestamp} may be an ISO-8601 string or epoch milliseconds. A malformed
   * timestamp is kept as null: the value still counts for value-based checks, but the
   * point never falls inside a time window.
   *
   * @param json the JSON object
   * @return parsed point
   * @throws IllegalArgumentException if {@code value} is missing, null or not a number
   */
  public static TimeSeriesPoint fromJson(JsonObject json) {
    if (!hasNumericValue(json)) {
      throw new IllegalArgumentException("Point field 'value' must be a number, got: " + json.getValue("value"));
    }
    Instant timestamp = parseTimestamp(json.getValue("timestamp"));
    Number value = (Number) json.getValue("value");
    JsonObject metadata = json.getJsonObject("metadata");
    return new TimeSeriesPoint(
      timestamp,
      value.doubleValue(),
      json.getString("label"),
      metadata == null ? Map.of() : metadata.getMap()
    );
  }

  static boolean hasNumericValue(JsonObject json) {
    return json.getValue("value") instanceof Number;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("timestamp", timestamp == null ? null : timestamp.toString())
      .put("value", value);
    if (label != null) {
      json.put("label", label);
    }
    if (!metadata.isEmpty()) {
      json.put("metadata", new JsonObject(metadata));
    }
    return json;
  }

  private static Instant parseTimestamp(Object raw) {
    if (raw instanceof Number epochMillis) {
      return Instant.ofEpochMilli(epochMillis.longValue());
    }
    if (raw instanceof String text) {
      try {
        return Instant.parse(text);
      } catch (DateTimeParseException e) {
        log.warn("Unparseable timestamp '{}', point will be excluded from time windows", text);
        return null;
      }
    }
    if (raw instanceof Instant instant) {
      return instant;
    }
    log.warn("Missing or unsupported timestamp: {}", raw);
    return null;
  }
}
