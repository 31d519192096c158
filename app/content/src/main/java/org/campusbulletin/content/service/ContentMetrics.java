/*
 * Where: content service layer
 * What: Records fan-out outcomes and cleanup sweep results as Micrometer meters
 * Why: Partial fan-out and failing sweeps are visible from Prometheus without reading logs
 */
package org.campusbulletin.content.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.campusbulletin.content.model.ContentKind;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class ContentMetrics {

  static final String METRIC_FANOUT_DELIVERIES = "content.fanout.deliveries.total";
  static final String METRIC_SWEEP_DELETED = "content.sweep.deleted.total";
  static final String METRIC_SWEEP_FAILURES = "content.sweep.failures.total";
  static final String METRIC_SWEEP_DURATION = "content.sweep.duration";

  public static final String RESULT_DELIVERED = "delivered";
  public static final String RESULT_DUPLICATE = "duplicate";
  public static final String RESULT_FAILED = "failed";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> fanOutCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<ContentKind, Counter> sweepDeletedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<ContentKind, Counter> sweepFailureCounters = new ConcurrentHashMap<>();
  private final Timer sweepDurationTimer;

  public ContentMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.sweepDurationTimer =
        Timer.builder(METRIC_SWEEP_DURATION)
            .description("Wall time of one cleanup sweep across all content kinds")
            .register(meterRegistry);
  }

  public void recordFanOut(String result, int count) {
    if (count <= 0) {
      return;
    }
    fanOutCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_FANOUT_DELIVERIES)
                    .description("Delivery rows attempted by notification fan-out")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment(count);
  }

  public void recordSweepDeleted(ContentKind kind, int count) {
    sweepDeletedCounters
        .computeIfAbsent(
            kind,
            ignored ->
                Counter.builder(METRIC_SWEEP_DELETED)
                    .description("Expired content rows removed by the cleanup sweep")
                    .tags(Tags.of("kind", tagValue(kind)))
                    .register(meterRegistry))
        .increment(Math.max(count, 0));
  }

  public void recordSweepFailure(ContentKind kind) {
    sweepFailureCounters
        .computeIfAbsent(
            kind,
            ignored ->
                Counter.builder(METRIC_SWEEP_FAILURES)
                    .description("Cleanup sweep runs that failed for one content kind")
                    .tags(Tags.of("kind", tagValue(kind)))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSweepDuration(Duration duration) {
    sweepDurationTimer.record(duration);
  }

  private static String tagValue(ContentKind kind) {
    return kind.name().toLowerCase(Locale.ROOT);
  }
}
