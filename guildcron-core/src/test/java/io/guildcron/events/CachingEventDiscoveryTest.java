package io.guildcron.events;

import io.guildcron.EventDiscovery;
import io.guildcron.core.LocalEvent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CachingEventDiscoveryTest {

    private static final Instant START = Instant.parse("2026-01-05T20:00:00Z");
    private static final Instant END = Instant.parse("2026-01-12T19:59:00Z");

    private final SteppingClock clock = new SteppingClock(Instant.parse("2026-01-05T20:00:00Z"));
    private final CountingProvider provider = new CountingProvider();
    private final CachingEventDiscovery discovery =
            new CachingEventDiscovery(provider, Duration.ofHours(1), 10, clock);

    @Test
    void repeatedLookupWithinTtlShouldHitCache() {
        discovery.discover("Los Angeles, CA", START, END);
        clock.advance(Duration.ofMinutes(59));
        discovery.discover("los angeles, ca", START, END);

        assertEquals(1, provider.calls.get());
    }

    @Test
    void lookupAfterTtlShouldRefetch() {
        discovery.discover("Los Angeles, CA", START, END);
        clock.advance(Duration.ofMinutes(61));
        discovery.discover("Los Angeles, CA", START, END);

        assertEquals(2, provider.calls.get());
    }

    @Test
    void differentWindowShouldMissCache() {
        discovery.discover("Los Angeles, CA", START, END);
        discovery.discover("Los Angeles, CA", START.plus(Duration.ofDays(7)), END.plus(Duration.ofDays(7)));

        assertEquals(2, provider.calls.get());
    }

    @Test
    void resultsShouldBeLimitedToMaxResults() {
        provider.size = 15;
        assertEquals(10, discovery.discover("Los Angeles, CA", START, END).size());
    }

    @Test
    void failuresShouldPropagateAndNotBeCached() {
        provider.failing = true;
        assertThrows(IllegalStateException.class, () -> discovery.discover("Los Angeles, CA", START, END));

        provider.failing = false;
        assertEquals(3, discovery.discover("Los Angeles, CA", START, END).size());
        assertEquals(2, provider.calls.get());
    }

    @Test
    void clearCacheShouldForceRefetch() {
        discovery.discover("Los Angeles, CA", START, END);
        discovery.clearCache();
        discovery.discover("Los Angeles, CA", START, END);

        assertEquals(2, provider.calls.get());
    }

    @Test
    void nameAndFormatShouldComeFromDelegate() {
        assertEquals("counting", discovery.name());
        assertEquals("Powered by counting • 3 events found",
                discovery.format(discovery.discover("Los Angeles, CA", START, END), "Los Angeles, CA").footer());
    }

    private static final class CountingProvider implements EventDiscovery {
        final AtomicInteger calls = new AtomicInteger();
        volatile int size = 3;
        volatile boolean failing;

        @Override
        public List<LocalEvent> discover(String location, Instant windowStart, Instant windowEnd) {
            calls.incrementAndGet();
            if (failing) {
                throw new IllegalStateException("upstream timeout");
            }
            List<LocalEvent> events = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                events.add(new LocalEvent("Event " + i, "", windowStart.plusSeconds(i * 60L), null, location, null,
                        "counting"));
            }
            return events;
        }

        @Override
        public String name() {
            return "counting";
        }
    }

    private static final class SteppingClock extends Clock {
        private Instant now;

        private SteppingClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return Clock.fixed(now, zone);
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
