package org.github.zzf.router.mux;

public class NoHandlerFoundException extends RuntimeException {

    private final String topic;

    public NoHandlerFoundException(String topic) {
        super("no handler found for topic: " + topic);
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }

}
