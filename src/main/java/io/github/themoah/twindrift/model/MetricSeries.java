package io.github.themoah.twindrift.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A named, ordered collection of observations.
 * List order is the temporal order; the detector never sorts.
 *
 * @param name metric name
 * @param data observations in ascending timestamp order
 * @param color optional display color (nullable)
 * @param unit optional unit (nullable)
 */
public record MetricSeries(
  String name,
  List<TimeSeriesPoint> data,
  String color,
  String unit
) {

  private static final Logger log = LoggerFactory.getLogger(MetricSeries.class);

  public MetricSeries {
    Objects.requireNonNull(name, "name");
    data = data == null ? List.of() : List.copyOf(data);
  }

  public static MetricSeries of(String name, List<TimeSeriesPoint> data) {
    return new MetricSeries(name, data, null, null);
  }

  /**
   * Extracts the numeric values in series order.
   */
  public double[] values() {
    double[] values = new double[data.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = data.get(i).value();
    }
    return values;
  }

  public int size() {
    return data.size();
  }

  public boolean isEmpty() {
    return data.isEmpty();
  }

  /**
   * Parses a series from JSON. Points without a numeric {@code value} are logged
   * at WARN and skipped.
   */
  public static MetricSeries fromJson(JsonObject json) {
    JsonArray points = json.getJsonArray("data", new JsonArray());
    List<TimeSeriesPoint> data = new ArrayList<>(points.size());
    for (int i = 0; i < points.size(); i++) {
      JsonObject point = points.getJsonObject(i);
      if (!TimeSeriesPoint.hasNumericValue(point)) {
        log.warn("Skipping point {} of series '{}': missing or non-numeric value {}",
          i, json.getString("name", ""), point.getValue("value"));
        continue;
      }
      data.add(TimeSeriesPoint.fromJson(point));
    }
    return new MetricSeries(
      json.getString("name", ""),
      data,
      json.getString("color"),
      json.getString("unit")
    );
  }

  public JsonObject toJson() {
    JsonArray points = new JsonArray();
    data.forEach(point -> points.add(point.toJson()));
    JsonObject json = new JsonObject()
      .put("name", name)
      .put("data", points);
    if (color != null) {
      json.put("color", color);
    }
    if (unit != null) {
      json.put("unit", unit);
    }
    return json;
  }
}
