package com.p14n.upsbridge.broker;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

public class TopicRouterTest {

    private static BusMessage message(String topic) {
        return new BusMessage(topic, "payload", 1, false);
    }

    @Test
    public void singleLevelWildcardMatchesExactlyOneLevel() {
        assertTrue(TopicRouter.matches("a/b/c", "a/+/c"));
        assertTrue(TopicRouter.matches("a//c", "a/+/c"));
        assertFalse(TopicRouter.matches("a/b/c/d", "a/+/c"));
        assertFalse(TopicRouter.matches("a/c", "a/+/c"));
        assertFalse(TopicRouter.matches("a/b/x", "a/+/c"));
    }

    @Test
    public void multiLevelWildcardMatchesAnyRemainder() {
        assertTrue(TopicRouter.matches("a/b", "a/#"));
        assertTrue(TopicRouter.matches("a/b/c/d", "a/#"));
        assertTrue(TopicRouter.matches("a", "a/#"));
        assertTrue(TopicRouter.matches("anything/at/all", "#"));
        assertFalse(TopicRouter.matches("b/c", "a/#"));
    }

    @Test
    public void literalPatternsNeedEqualLevels() {
        assertTrue(TopicRouter.matches("a/b", "a/b"));
        assertFalse(TopicRouter.matches("a/b", "a/b/c"));
        assertFalse(TopicRouter.matches("a/b/c", "a/b"));
        assertFalse(TopicRouter.matches("a/bc", "a/b+"));
    }

    @Test
    public void singleWildcardPatternReceivesMatchingTopicOnce() {
        TopicRouter router = new TopicRouter();
        List<String> received = new CopyOnWriteArrayList<>();
        router.register("a/+/c", 1, m -> received.add(m.topic()));

        assertEquals(1, router.dispatch(message("a/b/c")));
        assertEquals(List.of("a/b/c"), received);
    }

    @Test
    public void multiLevelPatternReceivesDeepTopicOnce() {
        TopicRouter router = new TopicRouter();
        AtomicInteger calls = new AtomicInteger();
        router.register("a/#", 1, m -> calls.incrementAndGet());

        router.dispatch(message("a/b/c/d"));

        assertEquals(1, calls.get());
    }

    @Test
    public void fanOutInvokesEveryMatchingSubscriberOnce() {
        TopicRouter router = new TopicRouter();
        AtomicInteger exact = new AtomicInteger();
        AtomicInteger single = new AtomicInteger();
        AtomicInteger multi = new AtomicInteger();
        AtomicInteger other = new AtomicInteger();
        router.register("a/b/c", 0, m -> exact.incrementAndGet());
        router.register("a/+/c", 0, m -> single.incrementAndGet());
        router.register("a/#", 0, m -> multi.incrementAndGet());
        router.register("x/#", 0, m -> other.incrementAndGet());

        assertEquals(3, router.dispatch(message("a/b/c")));
        assertEquals(1, exact.get());
        assertEquals(1, single.get());
        assertEquals(1, multi.get());
        assertEquals(0, other.get());
    }

    @Test
    public void throwingSubscriberIsIsolated() {
        TopicRouter router = new TopicRouter();
        AtomicReference<Throwable> reported = new AtomicReference<>();
        AtomicInteger delivered = new AtomicInteger();
        router.register("a/#", 1, new MessageSubscriber<>() {
            @Override
            public void onMessage(BusMessage message) {
                throw new IllegalStateException("Fell over intentionally");
            }

            @Override
            public void onError(Throwable error) {
                reported.set(error);
            }
        });
        router.register("a/+", 1, m -> delivered.incrementAndGet());

        assertDoesNotThrow(() -> router.dispatch(message("a/b")));
        assertEquals(1, delivered.get());
        assertInstanceOf(IllegalStateException.class, reported.get());
    }

    @Test
    public void registeringSamePatternReplacesSubscriber() {
        TopicRouter router = new TopicRouter();
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();
        assertTrue(router.register("a/b", 1, m -> first.incrementAndGet()));
        assertFalse(router.register("a/b", 1, m -> second.incrementAndGet()));

        router.dispatch(message("a/b"));

        assertEquals(0, first.get());
        assertEquals(1, second.get());
        assertEquals(1, router.size());
    }

    @Test
    @Timeout(5)
    public void subscriberMaySubscribeDuringDispatch() throws Exception {
        TopicRouter router = new TopicRouter();
        AtomicInteger nested = new AtomicInteger();
        router.register("a/b", 1, m -> router.register("a/c", 1, n -> nested.incrementAndGet()));

        Thread t = new Thread(() -> router.dispatch(message("a/b")));
        t.start();
        t.join();
        router.dispatch(message("a/c"));

        assertEquals(1, nested.get());
        assertEquals(2, router.size());
    }

    @Test
    public void removedPatternNoLongerReceives() {
        TopicRouter router = new TopicRouter();
        AtomicInteger calls = new AtomicInteger();
        router.register("a/b", 1, m -> calls.incrementAndGet());

        assertTrue(router.remove("a/b"));
        assertFalse(router.remove("a/b"));
        assertEquals(0, router.dispatch(message("a/b")));
        assertEquals(0, calls.get());
    }
}
