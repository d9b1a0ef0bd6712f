package com.example.photostatus.server.service;

import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.UUID;

/**
 * {@link EventSink} backed by a unicast Reactor sink with a bounded buffer. The HTTP response
 * subscribes to {@link #asFlux()}.
 */
public class SseConnection implements EventSink {

    @Getter
    private final String connectionId = UUID.randomUUID().toString();
    private final Sinks.Many<String> sink;

    public SseConnection(int maxBufferedFrames) {
        this.sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(maxBufferedFrames).get());
    }

    @Override
    public WriteOutcome write(String frame) {
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        if (result.isSuccess()) {
            return WriteOutcome.WRITTEN;
        }
        return result == Sinks.EmitResult.FAIL_OVERFLOW ? WriteOutcome.BACKPRESSURE : WriteOutcome.FAILED;
    }

    @Override
    public void close() {
        sink.tryEmitComplete();
    }

    public Flux<String> asFlux() {
        return sink.asFlux();
    }
}
