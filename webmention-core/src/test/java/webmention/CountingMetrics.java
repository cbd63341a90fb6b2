package webmention;

import webmention.spi.MetricsExporter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link MetricsExporter} that counts calls by method name.
 */
public final class CountingMetrics implements MetricsExporter {
  private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();

  public int count(String name) {
    AtomicInteger c = counts.get(name);
    return c == null ? 0 : c.get();
  }

  private void inc(String name) {
    counts.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
  }

  @Override public void incrementIncomingAccepted() { inc("incomingAccepted"); }
  @Override public void incrementIncomingUnchanged() { inc("incomingUnchanged"); }
  @Override public void incrementIncomingRejected() { inc("incomingRejected"); }
  @Override public void incrementIncomingDeleted() { inc("incomingDeleted"); }
  @Override public void incrementOutgoingSent() { inc("outgoingSent"); }
  @Override public void incrementOutgoingUnsupported() { inc("outgoingUnsupported"); }
  @Override public void incrementOutgoingFailed() { inc("outgoingFailed"); }
  @Override public void incrementOutgoingRetracted() { inc("outgoingRetracted"); }
  @Override public void incrementCallbackFailure() { inc("callbackFailure"); }
  @Override public void recordOutgoingDurationMs(long durationMs) { inc("outgoingDuration"); }
}
