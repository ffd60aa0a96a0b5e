package com.ryuqq.composer.adapter.inmemory.cache;

import com.ryuqq.composer.core.exception.ComputationFailedException;
import com.ryuqq.composer.core.spi.CacheKey;
import com.ryuqq.composer.core.spi.CacheLayer;
import com.ryuqq.composer.core.spi.CacheStats;
import com.ryuqq.composer.core.statemachine.CacheEntryState;
import com.ryuqq.composer.core.statemachine.CacheEntryTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link CacheLayer} SPI.
 *
 * <p>Values live in a {@link ConcurrentHashMap}. Every key that has ever missed gets a
 * {@link KeySlot} from a lazily populated lock table; the slot's lock is taken only on a miss,
 * so hits never block and unrelated keys never contend.</p>
 *
 * <p><strong>Miss Protocol:</strong></p>
 * <pre>
 * 1. Fast path: READY and unexpired → return (no lock)
 * 2. Remember the slot's completion sequence, acquire the slot lock
 * 3. Double-check: READY and unexpired → return
 * 4. Sequence moved and last completion failed → rethrow that failure (queued waiter)
 * 5. ABSENT → PENDING, compute while holding the lock
 * 6. Success: PENDING → READY, store, evict LRU if bounded
 *    Failure: PENDING → ABSENT, nothing stored
 * </pre>
 *
 * <p><strong>Expiry:</strong> evaluated lazily against the injected {@link Clock} whenever a key is
 * accessed. {@link CacheLayer#PROCESS_LIFETIME} entries never expire.</p>
 *
 * <p><strong>Eviction:</strong> when {@link InMemoryCacheConfig#maximumSize()} is positive, the entry
 * with the oldest access tick is evicted after each store. A victim whose slot is currently locked
 * is left alone; the next store retries.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>The lock table keeps one slot per distinct key ever missed</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CacheLayer cache = new InMemoryCacheLayer(InMemoryCacheConfig.defaults().withMaximumSize(500));
 * List&lt;Rule&gt; rules = cache.getOrCompute("rules:ESS", () -&gt; source.load("ESS"), CacheLayer.PROCESS_LIFETIME);
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class InMemoryCacheLayer implements CacheLayer {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheLayer.class);

    private final InMemoryCacheConfig config;
    private final Clock clock;

    /**
     * READY entries. Written only while holding the key's slot lock.
     */
    private final ConcurrentHashMap<CacheKey, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Per-key lock table, created lazily on first miss.
     */
    private final ConcurrentHashMap<CacheKey, KeySlot> slots = new ConcurrentHashMap<>();

    private final AtomicLong accessTicks = new AtomicLong();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder computations = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    /**
     * Unbounded cache on the system UTC clock.
     */
    public InMemoryCacheLayer() {
        this(InMemoryCacheConfig.defaults(), Clock.systemUTC());
    }

    public InMemoryCacheLayer(InMemoryCacheConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Constructor.
     *
     * @param config cache configuration
     * @param clock clock used for TTL evaluation
     * @throws IllegalArgumentException if config or clock is null
     */
    public InMemoryCacheLayer(InMemoryCacheConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public <T> T getOrCompute(CacheKey key, Callable<T> computeFn, Duration ttl) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (computeFn == null) {
            throw new IllegalArgumentException("computeFn cannot be null");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }

        Entry cached = entries.get(key);
        if (cached != null && !isExpired(cached)) {
            return (T) hit(cached);
        }

        KeySlot slot = slots.computeIfAbsent(key, k -> new KeySlot());
        long seen = slot.sequence;
        slot.lock.lock();
        try {
            Entry current = entries.get(key);
            if (current != null) {
                if (!isExpired(current)) {
                    return (T) hit(current);
                }
                remove(key, slot, "expired");
            }

            misses.increment();
            Throwable lastFailure = slot.lastFailure;
            if (slot.sequence != seen && lastFailure != null) {
                log.debug("Cache key {} failed while this caller was waiting, propagating", key);
                throw new ComputationFailedException(key.getValue(), lastFailure);
            }
            return compute(key, slot, computeFn, ttl);
        } finally {
            slot.lock.unlock();
        }
    }

    @Override
    public boolean invalidate(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        KeySlot slot = slots.get(key);
        if (slot == null) {
            return false;
        }
        slot.lock.lock();
        try {
            return remove(key, slot, "invalidated");
        } finally {
            slot.lock.unlock();
        }
    }

    @Override
    public void clear() {
        int removed = 0;
        for (Map.Entry<CacheKey, KeySlot> e : slots.entrySet()) {
            KeySlot slot = e.getValue();
            slot.lock.lock();
            try {
                if (remove(e.getKey(), slot, "cleared")) {
                    removed++;
                }
            } finally {
                slot.lock.unlock();
            }
        }
        log.info("Cache cleared: {} entries removed", removed);
    }

    @Override
    public CacheEntryState state(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        KeySlot slot = slots.get(key);
        if (slot == null) {
            return CacheEntryState.ABSENT;
        }
        CacheEntryState state = slot.state;
        if (state == CacheEntryState.READY) {
            Entry entry = entries.get(key);
            if (entry == null || isExpired(entry)) {
                return CacheEntryState.ABSENT;
            }
        }
        return state;
    }

    @Override
    public CacheStats stats() {
        int live = 0;
        for (Entry entry : entries.values()) {
            if (!isExpired(entry)) {
                live++;
            }
        }
        return new CacheStats(
            hits.sum(),
            misses.sum(),
            computations.sum(),
            failures.sum(),
            evictions.sum(),
            live
        );
    }

    public InMemoryCacheConfig getConfig() {
        return config;
    }

    private Object hit(Entry entry) {
        entry.lastAccess = accessTicks.incrementAndGet();
        hits.increment();
        return entry.value;
    }

    // caller holds slot.lock
    private <T> T compute(CacheKey key, KeySlot slot, Callable<T> computeFn, Duration ttl) {
        slot.state = CacheEntryTransition.transition(slot.state, CacheEntryState.PENDING);
        computations.increment();

        T value;
        try {
            value = computeFn.call();
        } catch (Exception e) {
            recordFailure(slot, e);
            log.warn("Cache computation failed for key {}: {}", key, e.toString());
            throw new ComputationFailedException(key.getValue(), e);
        } catch (Error e) {
            recordFailure(slot, e);
            throw e;
        }

        entries.put(key, new Entry(value, expiryOf(ttl), accessTicks.incrementAndGet()));
        slot.lastFailure = null;
        slot.state = CacheEntryTransition.transition(slot.state, CacheEntryState.READY);
        slot.sequence++;
        log.debug("Cache key {} computed", key);

        evictIfOverCapacity(key);
        return value;
    }

    // caller holds slot.lock
    private void recordFailure(KeySlot slot, Throwable failure) {
        failures.increment();
        slot.lastFailure = failure;
        slot.state = CacheEntryTransition.transition(slot.state, CacheEntryState.ABSENT);
        slot.sequence++;
    }

    // caller holds slot.lock
    private boolean remove(CacheKey key, KeySlot slot, String reason) {
        if (entries.remove(key) == null) {
            return false;
        }
        slot.state = CacheEntryTransition.transition(slot.state, CacheEntryState.ABSENT);
        evictions.increment();
        log.debug("Cache key {} removed: {}", key, reason);
        return true;
    }

    private void evictIfOverCapacity(CacheKey justStored) {
        if (!config.isBounded()) {
            return;
        }
        while (entries.size() > config.maximumSize()) {
            CacheKey victim = null;
            long oldest = Long.MAX_VALUE;
            for (Map.Entry<CacheKey, Entry> e : entries.entrySet()) {
                if (e.getKey().equals(justStored)) {
                    continue;
                }
                long tick = e.getValue().lastAccess;
                if (tick < oldest) {
                    oldest = tick;
                    victim = e.getKey();
                }
            }
            if (victim == null || !tryEvict(victim)) {
                return;
            }
        }
    }

    private boolean tryEvict(CacheKey victim) {
        KeySlot slot = slots.get(victim);
        if (slot == null || !slot.lock.tryLock()) {
            return false;
        }
        try {
            return remove(victim, slot, "lru");
        } finally {
            slot.lock.unlock();
        }
    }

    private boolean isExpired(Entry entry) {
        return entry.expiresAtMillis != Long.MAX_VALUE && clock.millis() >= entry.expiresAtMillis;
    }

    private long expiryOf(Duration ttl) {
        if (ttl.compareTo(Duration.ofMillis(Long.MAX_VALUE)) >= 0) {
            return Long.MAX_VALUE;
        }
        long millis = ttl.toMillis();
        long now = clock.millis();
        return millis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + millis;
    }

    private static final class Entry {
        private final Object value;
        private final long expiresAtMillis;
        private volatile long lastAccess;

        private Entry(Object value, long expiresAtMillis, long lastAccess) {
            this.value = value;
            this.expiresAtMillis = expiresAtMillis;
            this.lastAccess = lastAccess;
        }
    }

    /**
     * Lock and completion bookkeeping for one key. Mutable fields change only under {@code lock}.
     */
    private static final class KeySlot {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile long sequence;
        private volatile Throwable lastFailure;
        private volatile CacheEntryState state = CacheEntryState.ABSENT;
    }
}
