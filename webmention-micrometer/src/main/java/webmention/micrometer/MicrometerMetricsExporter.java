package webmention.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import webmention.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Datadog and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code webmention.incoming.accepted}: inbound mentions created or updated</li>
 *   <li>{@code webmention.incoming.unchanged}: inbound re-processing with nothing to write</li>
 *   <li>{@code webmention.incoming.rejected}: inbound notifications failing validation</li>
 *   <li>{@code webmention.incoming.deleted}: inbound mentions marked deleted</li>
 *   <li>{@code webmention.outgoing.sent}: notifications sent</li>
 *   <li>{@code webmention.outgoing.unsupported}: targets without an endpoint</li>
 *   <li>{@code webmention.outgoing.failed}: targets that failed transiently</li>
 *   <li>{@code webmention.outgoing.retracted}: sent mentions retracted</li>
 *   <li>{@code webmention.callback.failure}: user callbacks that threw</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code webmention.outgoing.duration}: wall time of one outgoing run</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter incomingAccepted;
  private final Counter incomingUnchanged;
  private final Counter incomingRejected;
  private final Counter incomingDeleted;
  private final Counter outgoingSent;
  private final Counter outgoingUnsupported;
  private final Counter outgoingFailed;
  private final Counter outgoingRetracted;
  private final Counter callbackFailure;
  private final Timer outgoingDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "webmention"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "webmention");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several sites in one process.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "blog.webmention"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.incomingAccepted = counter(namePrefix + ".incoming.accepted", "Inbound mentions created or updated");
    this.incomingUnchanged = counter(namePrefix + ".incoming.unchanged", "Inbound re-processing that changed nothing");
    this.incomingRejected = counter(namePrefix + ".incoming.rejected", "Inbound notifications rejected by validation");
    this.incomingDeleted = counter(namePrefix + ".incoming.deleted", "Inbound mentions marked deleted");
    this.outgoingSent = counter(namePrefix + ".outgoing.sent", "Notifications sent");
    this.outgoingUnsupported = counter(namePrefix + ".outgoing.unsupported", "Targets advertising no endpoint");
    this.outgoingFailed = counter(namePrefix + ".outgoing.failed", "Targets that failed transiently");
    this.outgoingRetracted = counter(namePrefix + ".outgoing.retracted", "Sent mentions retracted");
    this.callbackFailure = counter(namePrefix + ".callback.failure", "User callbacks that threw");
    this.outgoingDuration = Timer.builder(namePrefix + ".outgoing.duration")
        .description("Wall time of one outgoing run for a source")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementIncomingAccepted() {
    if (closed) return;
    incomingAccepted.increment();
  }

  @Override
  public void incrementIncomingUnchanged() {
    if (closed) return;
    incomingUnchanged.increment();
  }

  @Override
  public void incrementIncomingRejected() {
    if (closed) return;
    incomingRejected.increment();
  }

  @Override
  public void incrementIncomingDeleted() {
    if (closed) return;
    incomingDeleted.increment();
  }

  @Override
  public void incrementOutgoingSent() {
    if (closed) return;
    outgoingSent.increment();
  }

  @Override
  public void incrementOutgoingUnsupported() {
    if (closed) return;
    outgoingUnsupported.increment();
  }

  @Override
  public void incrementOutgoingFailed() {
    if (closed) return;
    outgoingFailed.increment();
  }

  @Override
  public void incrementOutgoingRetracted() {
    if (closed) return;
    outgoingRetracted.increment();
  }

  @Override
  public void incrementCallbackFailure() {
    if (closed) return;
    callbackFailure.increment();
  }

  @Override
  public void recordOutgoingDurationMs(long durationMs) {
    if (closed) return;
    outgoingDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link webmention.Webmentions#close()} calls this when the exporter was handed to it.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(incomingAccepted, incomingUnchanged, incomingRejected,
        incomingDeleted, outgoingSent, outgoingUnsupported, outgoingFailed,
        outgoingRetracted, callbackFailure, outgoingDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
