package org.github.zzf.router.mux;

@FunctionalInterface
public interface MessageHandler {

    /**
     * a RuntimeException thrown here stops the dispatch of the message and reaches the caller of
     * {@link ServeMux#handleMessage(Message)}
     */
    void handle(Message message);

}
