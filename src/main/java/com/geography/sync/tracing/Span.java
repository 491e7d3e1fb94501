package com.geography.sync.tracing;

/**
 * A traced sync operation, ended on {@link #close()}. Exactly one of
 * {@link #succeeded()} or {@link #failed(Throwable)} is expected before close.
 *
 * <pre>
 * try (Span span = tracing.start(SyncOperation.INGEST, attributes)) {
 *     span.setAttribute("outcome", "AUTO_LINK");
 *     span.succeeded();
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void succeeded();

    /**
     * Records the failure and marks the span as errored.
     */
    void failed(Throwable cause);

    @Override
    void close();
}
