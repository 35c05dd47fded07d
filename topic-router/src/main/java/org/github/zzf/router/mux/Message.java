package org.github.zzf.router.mux;

import static java.nio.charset.StandardCharsets.UTF_8;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import java.util.List;
import java.util.Objects;
import lombok.Builder;

/**
 * An inbound message as the transport hands it to {@link ServeMux}.
 *
 * @param packetId null for QoS 0
 * @param clientId the publisher, set by the server side when known
 */
@Builder(toBuilder = true)
public record Message(String topic,
                      ByteBuf payload,
                      int qos,
                      boolean retain,
                      Integer packetId,
                      List<UserProperty> userProperties,
                      String clientId) {

    public Message {
        Objects.requireNonNull(topic, "topic");
        if (payload == null) {
            payload = Unpooled.EMPTY_BUFFER;
        }
        userProperties = userProperties == null ? List.of() : List.copyOf(userProperties);
    }

    public static Message of(String topic, ByteBuf payload) {
        return Message.builder().topic(topic).payload(payload).build();
    }

    public static Message of(String topic, String payload) {
        return of(topic, Unpooled.copiedBuffer(payload, UTF_8));
    }

    /**
     * the readable bytes decoded as UTF-8, the reader index is left untouched
     */
    public String payloadAsString() {
        return payload.toString(UTF_8);
    }

    public record UserProperty(String key, String value) {
    }

}
