package org.github.zzf.router.mux;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.router.subscription.Registration;
import org.github.zzf.router.subscription.SubscriptionIndex;

/**
 * Routes inbound messages to the handlers registered under matching topic filters.
 * <pre>
 * ServeMux mux = new ServeMux();
 * mux.handle("device/+/state", msg -> log.info("{}", msg.payloadAsString()));
 * mux.handleMessage(Message.of("device/gear-001/state", "on"));
 * </pre>
 */
@Slf4j
public class ServeMux {

    private static final String METRIC_MSG = "topic.router.mux.msg";

    final SubscriptionIndex<MessageHandler> index = new SubscriptionIndex<>();

    private final ConcurrentMap<Integer, String> aliases = new ConcurrentHashMap<>();

    private final DispatchMode dispatchMode;

    private final Counter routed;
    private final Counter unrouted;
    private final Counter failed;
    private final Timer handleTimer;

    public ServeMux() {
        this(DispatchMode.fromSystemProperty());
    }

    public ServeMux(DispatchMode dispatchMode) {
        this(dispatchMode, Metrics.globalRegistry);
    }

    public ServeMux(DispatchMode dispatchMode, MeterRegistry registry) {
        this.dispatchMode = Objects.requireNonNull(dispatchMode, "dispatchMode");
        this.routed = Counter.builder(METRIC_MSG).tag("result", "routed").register(registry);
        this.unrouted = Counter.builder(METRIC_MSG).tag("result", "unrouted").register(registry);
        this.failed = Counter.builder(METRIC_MSG).tag("result", "failed").register(registry);
        this.handleTimer = Timer.builder("topic.router.mux.handle")
            .tag("mode", dispatchMode.name())
            // 1μs
            .minimumExpectedValue(Duration.ofNanos(1000))
            .maximumExpectedValue(Duration.ofSeconds(8))
            .register(registry);
        log.info("ServeMux dispatchMode: {}", dispatchMode);
    }

    /**
     * register {@code handler} under {@code topicFilter}. several handlers may share a filter
     *
     * @return the registration with the '$share' / '$queue' prefix stripped
     */
    public Registration handle(String topicFilter, MessageHandler handler) {
        return index.register(topicFilter, handler);
    }

    /**
     * run every handler the message resolves to, in order. the first failure stops the dispatch
     *
     * @throws NoHandlerFoundException if no filter matches the topic
     */
    public void handleMessage(Message message) {
        String topic = message.topic();
        log.debug("handling message for topic: {}", topic);
        List<MessageHandler> handlers = handlers(topic);
        if (handlers.isEmpty()) {
            log.debug("no handler found for topic: {}", topic);
            unrouted.increment();
            throw new NoHandlerFoundException(topic);
        }
        try {
            handleTimer.record(() -> {
                for (MessageHandler h : handlers) {
                    h.handle(message);
                }
            });
        } catch (RuntimeException e) {
            failed.increment();
            throw e;
        }
        routed.increment();
    }

    /**
     * the handlers a message on {@code topic} is dispatched to, following {@link DispatchMode}
     */
    public List<MessageHandler> handlers(String topic) {
        return switch (dispatchMode) {
            case FIRST_MATCH -> index.get(topic).orElse(List.of());
            case ALL_MATCHES -> index.route(topic);
        };
    }

    public boolean hasHandlers(String topic) {
        return index.get(topic).isPresent();
    }

    public void registerAlias(int alias, String topic) {
        Objects.requireNonNull(topic, "topic");
        aliases.put(alias, topic);
    }

    public Optional<String> resolveAlias(int alias) {
        return Optional.ofNullable(aliases.get(alias));
    }

    public DispatchMode dispatchMode() {
        return dispatchMode;
    }

    @Override
    public String toString() {
        return "ServeMux{dispatchMode=" + dispatchMode + ", tree=\n" + index + "}";
    }

}
