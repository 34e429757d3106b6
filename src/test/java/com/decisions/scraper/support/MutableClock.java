package com.decisions.scraper.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock that only moves when told to.
 */
public class MutableClock extends Clock {

    private final AtomicReference<Instant> now;

    public MutableClock(final Instant start) {
        this.now = new AtomicReference<>(start);
    }

    public void advance(final Duration duration) {
        now.updateAndGet(t -> t.plus(duration));
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(final ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return now.get();
    }
}
