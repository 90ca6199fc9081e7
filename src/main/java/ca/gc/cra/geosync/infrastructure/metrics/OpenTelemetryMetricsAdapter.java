package ca.gc.cra.geosync.infrastructure.metrics;

import ca.gc.cra.geosync.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} forwarding sync counters and observations to OpenTelemetry.
 * <p><strong>Role:</strong> Default metrics adapter wired by the composition root.</p>
 * <p><strong>Thread-safety:</strong> Instruments are cached in concurrent maps; safe for concurrent use.</p>
 *
 * <p>Dotted keys such as {@code sync.records.inserted} become instrument names after sanitizing; the
 * original key is attached as the {@code geosync.metric.key} attribute.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("geosync.metric.key");
  private static final String FALLBACK_METRIC_NAME = "geosync.metric";

  private final OpenTelemetryBootstrap.Active active;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter configured from the {@code otel.*} system properties. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Active active) {
    this.active = active;
    if (active == null) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    if (active == null) {
      return;
    }
    Instrument<LongCounter> counter = counters.computeIfAbsent(key, k -> new Instrument<>(
        active.meter().counterBuilder(sanitizeName(k)).setUnit("1").setDescription("geosync counter " + k).build(),
        Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    if (active == null) {
      return;
    }
    Instrument<LongHistogram> histogram = histograms.computeIfAbsent(key, k -> new Instrument<>(
        active.meter().histogramBuilder(sanitizeName(k)).ofLongs().setDescription("geosync observation " + k).build(),
        Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    histogram.instrument().record(value, histogram.attributes());
  }

  boolean isNoop() {
    return active == null;
  }

  void forceFlush() {
    if (active != null) {
      active.forceFlush();
    }
  }

  @Override
  public void close() {
    if (active != null) {
      active.close();
    }
  }

  static String sanitizeName(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    if (lower.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (char c : lower.toCharArray()) {
      boolean allowed = Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
      name.append(allowed ? c : '_');
    }
    String sanitized = name.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record Instrument<T>(T instrument, Attributes attributes) {}
}
