package com.escrowswap.common;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-plus-sequence ids ({@code prefix-<epochMillis>-<seq>}), unique for the lifetime of the generator.
 * The sequence starts at a random offset so ids from different runs rarely collide.
 */
public final class IdGenerator {

    private final String prefix;
    private final Clock clock;
    private final AtomicLong sequence;

    public IdGenerator(String prefix, Clock clock) {
        this.prefix = prefix;
        this.clock = clock;
        this.sequence = new AtomicLong(ThreadLocalRandom.current().nextInt(1000));
    }

    public String next() {
        return prefix + "-" + clock.millis() + "-" + sequence.incrementAndGet();
    }
}
