package com.example.photostatus.client.stream;

import lombok.Value;
import org.springframework.http.codec.ServerSentEvent;

/**
 * One received frame. A frame with neither event name nor data is a comment, such as a heartbeat.
 */
@Value
public class StreamFrame {
    String eventName;
    String eventId;
    String data;

    public static StreamFrame comment() {
        return new StreamFrame(null, null, null);
    }

    public static StreamFrame from(ServerSentEvent<String> event) {
        return new StreamFrame(event.event(), event.id(), event.data());
    }

    public boolean isComment() {
        return eventName == null && data == null;
    }
}
