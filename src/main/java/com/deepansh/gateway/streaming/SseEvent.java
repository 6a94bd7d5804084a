package com.deepansh.gateway.streaming;

/**
 * One dispatched server-sent event. {@code event} is null when the stream
 * omitted the {@code event:} field.
 */
public record SseEvent(String event, String data, String id) {

    public boolean hasData() {
        return data != null;
    }

    public boolean isNamed(String name) {
        return name.equals(event);
    }
}
