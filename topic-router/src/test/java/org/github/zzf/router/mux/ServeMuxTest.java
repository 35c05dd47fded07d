package org.github.zzf.router.mux;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.BDDAssertions.then;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.buffer.Unpooled;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.github.zzf.router.subscription.InvalidShareSubscriptionException;
import org.github.zzf.router.subscription.Registration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ServeMuxTest {

    @Mock
    MessageHandler h1;

    @Mock
    MessageHandler h2;

    MeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
    }

    @Test
    void givenHandler_whenHandleMessage_thenInvoked() {
        ServeMux mux = new ServeMux(DispatchMode.FIRST_MATCH, registry);
        AtomicInteger counter = new AtomicInteger();
        mux.handle("test/topic", msg -> counter.incrementAndGet());

        mux.handleMessage(Message.of("test/topic", "hello"));

        then(counter.get()).isEqualTo(1);
        then(msgCount("routed")).isEqualTo(1.0);
    }

    @Test
    void givenWildcardHandler_whenHandleMessage_thenMatchingTopicsDispatched() {
        ServeMux mux = new ServeMux(DispatchMode.FIRST_MATCH, registry);
        mux.handle("device/+/state", h1);

        Message m1 = Message.of("device/gear-001/state", "data");
        Message m2 = Message.of("device/gear-002/state", "data");
        mux.handleMessage(m1);
        mux.handleMessage(m2);

        verify(h1).handle(m1);
        verify(h1).handle(m2);
        assertThatThrownBy(() -> mux.handleMessage(Message.of("device/gear-001/stats", "data")))
            .isInstanceOf(NoHandlerFoundException.class);
    }

    @Test
    void givenNoHandler_whenHandleMessage_thenNoHandlerFound() {
        ServeMux mux = new ServeMux(DispatchMode.FIRST_MATCH, registry);

        assertThatThrownBy(() -> mux.handleMessage(Message.of("nonexistent/topic", "data")))
            .isInstanceOfSatisfying(NoHandlerFoundException.class,
                e -> then(e.topic()).isEqualTo("nonexistent/topic"));
        then(msgCount("unrouted")).isEqualTo(1.0);
        then(mux.hasHandlers("nonexistent/topic")).isFalse();
    }

    @Test
    void givenOverlappingFilters_whenFirstMatch_thenOnlyHighestPriorityHandler() {
        ServeMux mux = new ServeMux(DispatchMode.FIRST_MATCH, registry);
        mux.handle("device/#", h2);
        mux.handle("device/+/state", h1);

        Message msg = Message.of("device/gear-001/state", "on");
        mux.handleMessage(msg);

        verify(h1).handle(msg);
        verify(h2, never()).handle(any());
    }

    @Test
    void givenOverlappingFilters_whenAllMatches_thenEveryHandlerInPriorityOrder() {
        ServeMux mux = new ServeMux(DispatchMode.ALL_MATCHES, registry);
        mux.handle("device/#", h2);
        mux.handle("$share/g1/device/+/state", h1);

        Message msg = Message.of("device/gear-001/state", "on");
        mux.handleMessage(msg);

        InOrder order = inOrder(h1, h2);
        order.verify(h1).handle(msg);
        order.verify(h2).handle(msg);
        then(mux.handlers("device/gear-001/state")).containsExactly(h1, h2);
    }

    @Test
    void givenFailingHandler_whenHandleMessage_thenDispatchStopsAndErrorPropagates() {
        ServeMux mux = new ServeMux(DispatchMode.ALL_MATCHES, registry);
        mux.handle("a/b", h1);
        mux.handle("a/+", h2);
        willThrow(new IllegalStateException("boom")).given(h1).handle(any());

        assertThatThrownBy(() -> mux.handleMessage(Message.of("a/b", "x")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("boom");
        verify(h2, never()).handle(any());
        then(msgCount("failed")).isEqualTo(1.0);
        then(msgCount("routed")).isZero();
    }

    @Test
    void givenShareSubscription_whenHandle_thenRegistrationReturned() {
        ServeMux mux = new ServeMux(DispatchMode.FIRST_MATCH, registry);
        Registration r = mux.handle("$share/g1/device/+/state", h1);

        then(r.shared()).isTrue();
        then(r.groupName()).isEqualTo("g1");
        then(mux.hasHandlers("device/gear-001/state")).isTrue();
        assertThatThrownBy(() -> mux.handle("$share/g1", h1))
            .isInstanceOf(InvalidShareSubscriptionException.class);
    }

    @Test
    void givenAlias_whenResolve_thenTopic() {
        ServeMux mux = new ServeMux(DispatchMode.FIRST_MATCH, registry);
        mux.registerAlias(1, "device/gear-001/state");

        then(mux.resolveAlias(1)).hasValue("device/gear-001/state");
        then(mux.resolveAlias(999)).isEmpty();

        mux.registerAlias(1, "device/gear-002/state");
        then(mux.resolveAlias(1)).hasValue("device/gear-002/state");
    }

    @Test
    void givenNoArgConstructor_whenCreated_thenFirstMatchByDefault() {
        then(new ServeMux().dispatchMode()).isEqualTo(DispatchMode.FIRST_MATCH);
    }

    @Test
    void givenMessage_whenBuilt_thenDefaults() {
        Message msg = Message.builder().topic("a/b").build();
        then(msg.payload().readableBytes()).isZero();
        then(msg.userProperties()).isEmpty();
        then(msg.qos()).isZero();
        then(msg.packetId()).isNull();

        Message full = msg.toBuilder()
            .payload(Unpooled.wrappedBuffer(new byte[]{'h', 'i'}))
            .qos(1)
            .packetId(7)
            .userProperties(List.of(new Message.UserProperty("k", "v")))
            .clientId("c1")
            .build();
        then(full.payloadAsString()).isEqualTo("hi");
        then(full.userProperties()).containsExactly(new Message.UserProperty("k", "v"));
        then(full.topic()).isEqualTo("a/b");
    }

    private double msgCount(String result) {
        return registry.get("topic.router.mux.msg").tag("result", result).counter().count();
    }

}
