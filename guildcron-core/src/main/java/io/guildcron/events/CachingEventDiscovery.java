package io.guildcron.events;

import io.guildcron.EventDiscovery;
import io.guildcron.core.AnnouncementPayload;
import io.guildcron.core.LocalEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wraps an {@link EventDiscovery} provider with a per-(location, window) cache and a result limit.
 * Provider failures propagate and are never cached.
 */
public class CachingEventDiscovery implements EventDiscovery {
    private static final Logger log = LoggerFactory.getLogger(CachingEventDiscovery.class);

    private final EventDiscovery delegate;
    private final Duration ttl;
    private final int maxResults;
    private final Clock clock;

    private final ConcurrentHashMap<String, CachedEvents> cache = new ConcurrentHashMap<>();

    private record CachedEvents(List<LocalEvent> events, Instant fetchedAt) {
    }

    public CachingEventDiscovery(EventDiscovery delegate, Duration ttl, int maxResults, Clock clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive");
        }
        this.maxResults = maxResults;
    }

    public CachingEventDiscovery(EventDiscovery delegate, Duration ttl, int maxResults) {
        this(delegate, ttl, maxResults, Clock.systemUTC());
    }

    @Override
    public List<LocalEvent> discover(String location, Instant windowStart, Instant windowEnd) {
        String key = cacheKey(location, windowStart, windowEnd);

        CachedEvents cached = cache.get(key);
        if (cached != null) {
            Duration age = Duration.between(cached.fetchedAt(), clock.instant());
            if (age.compareTo(ttl) <= 0) {
                log.info("guildcron returning cached events location={} count={} key={}",
                        location, cached.events().size(), key);
                return cached.events();
            }
            cache.remove(key, cached);
            log.debug("guildcron event cache expired key={} ageSeconds={}", key, age.toSeconds());
        }

        List<LocalEvent> events;
        try {
            events = delegate.discover(location, windowStart, windowEnd);
        } catch (RuntimeException e) {
            log.error("guildcron failed to discover events location={} provider={} msg={}",
                    location, delegate.name(), e.getMessage(), e);
            throw e;
        }

        List<LocalEvent> limited = events == null
                ? List.of()
                : List.copyOf(events.subList(0, Math.min(events.size(), maxResults)));
        cache.put(key, new CachedEvents(limited, clock.instant()));

        log.info("guildcron events fetched and cached location={} count={} provider={}",
                location, limited.size(), delegate.name());
        return limited;
    }

    @Override
    public AnnouncementPayload format(List<LocalEvent> events, String location) {
        return delegate.format(events, location);
    }

    @Override
    public String name() {
        return delegate.name();
    }

    public void clearCache() {
        cache.clear();
        log.info("guildcron event cache cleared");
    }

    private static String cacheKey(String location, Instant start, Instant end) {
        String s = start == null ? "" : start.atZone(ZoneOffset.UTC).toLocalDate().toString();
        String e = end == null ? "" : end.atZone(ZoneOffset.UTC).toLocalDate().toString();
        return (location + ":" + s + ":" + e).toLowerCase(Locale.ROOT);
    }
}
