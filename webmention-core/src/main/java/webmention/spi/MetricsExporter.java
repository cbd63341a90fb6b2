package webmention.spi;

/**
 * Observability hook for exporting webmention counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of inbound mentions created or updated.
     */
    void incrementIncomingAccepted();

    /**
     * Increments the count of inbound re-processing that changed nothing.
     */
    default void incrementIncomingUnchanged() {
    }

    /**
     * Increments the count of inbound notifications rejected by validation.
     */
    void incrementIncomingRejected();

    /**
     * Increments the count of inbound mentions marked deleted because the source
     * stopped linking or disappeared.
     */
    void incrementIncomingDeleted();

    /**
     * Increments the count of notifications sent and recorded.
     */
    void incrementOutgoingSent();

    /**
     * Increments the count of targets that advertise no endpoint.
     */
    void incrementOutgoingUnsupported();

    /**
     * Increments the count of targets that failed transiently (network, timeout, 5xx).
     */
    void incrementOutgoingFailed();

    /**
     * Increments the count of previously sent mentions retracted.
     */
    void incrementOutgoingRetracted();

    /**
     * Increments the count of user callbacks that threw.
     */
    void incrementCallbackFailure();

    /**
     * Records the wall time of one outgoing run for a source.
     *
     * @param durationMs elapsed milliseconds (always non-negative)
     */
    default void recordOutgoingDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementIncomingAccepted() {
        }

        @Override
        public void incrementIncomingRejected() {
        }

        @Override
        public void incrementIncomingDeleted() {
        }

        @Override
        public void incrementOutgoingSent() {
        }

        @Override
        public void incrementOutgoingUnsupported() {
        }

        @Override
        public void incrementOutgoingFailed() {
        }

        @Override
        public void incrementOutgoingRetracted() {
        }

        @Override
        public void incrementCallbackFailure() {
        }
    }
}
