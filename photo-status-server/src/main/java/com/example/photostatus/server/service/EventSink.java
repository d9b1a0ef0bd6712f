package com.example.photostatus.server.service;

/**
 * Write side of one open event stream. Implementations must not block.
 */
public interface EventSink {

    /**
     * Queues a fully formatted frame for the client.
     */
    WriteOutcome write(String frame);

    /**
     * Ends the stream. Calling it more than once is harmless.
     */
    void close();

    enum WriteOutcome {
        WRITTEN,
        /** The client is not draining fast enough and the buffer is full. */
        BACKPRESSURE,
        FAILED;

        public boolean isWritten() {
            return this == WRITTEN;
        }
    }
}
