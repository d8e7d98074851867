package com.triageplatform.dedup.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.triageplatform.common.exception.StoreUnavailableException;
import com.triageplatform.common.exception.ValidationException;
import com.triageplatform.dedup.config.DeduplicationProperties;
import com.triageplatform.dedup.model.DeduplicationAction;
import com.triageplatform.dedup.model.DeduplicationEntry;
import com.triageplatform.dedup.model.DeduplicationRequest;
import com.triageplatform.dedup.model.DeduplicationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Deduplicator shared by every process through Redis.
 *
 * <ul>
 *   <li>Entries live under {@code <prefix><hash>} as a hash of {@code executionId}, {@code firstSeen},
 *       {@code lastSeen} and {@code occurrenceCount}, expiring {@code ttl} after the last occurrence.</li>
 *   <li>A duplicate is counted by one Lua script ({@code HINCRBY} + {@code PEXPIRE}), so concurrent
 *       duplicates from any number of processes each see a distinct count.</li>
 *   <li>The first process to see a key must win {@code SET lock:<key> NX PX lockTtl}; losers get
 *       {@link DeduplicationAction#SKIP}. The lock TTL bounds how long a crashed holder blocks the key.
 *       Release only deletes the lock while it still carries this process's owner token.</li>
 *   <li>Redis failures fail open: the check answers {@link DeduplicationAction#NEW} and logs an error.</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(prefix = "triage.dedup", name = "mode", havingValue = "redis")
public class RedisEventDeduplicator implements EventDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(RedisEventDeduplicator.class);

    static final String LOCK_PREFIX = "lock:";

    // KEYS[1] entry key; ARGV[1] now (ISO-8601), ARGV[2] ttl millis
    private static final String TOUCH_LUA = """
        local count = redis.call('HINCRBY', KEYS[1], 'occurrenceCount', 1)
        redis.call('HSET', KEYS[1], 'lastSeen', ARGV[1])
        redis.call('PEXPIRE', KEYS[1], ARGV[2])
        return cjson.encode({executionId = redis.call('HGET', KEYS[1], 'executionId'),
            firstSeen = redis.call('HGET', KEYS[1], 'firstSeen'), lastSeen = ARGV[1],
            occurrenceCount = count, created = false})
        """;

    /** Counts a duplicate; nil when the key holds no live entry. */
    static final RedisScript<String> TOUCH_SCRIPT = RedisScript.of("""
        if redis.call('EXISTS', KEYS[1]) == 0 then return false end
        """ + TOUCH_LUA, String.class);

    /** Creates the entry, or counts a duplicate when another process created it first. ARGV[3] execution id. */
    static final RedisScript<String> CREATE_SCRIPT = RedisScript.of("""
        if redis.call('EXISTS', KEYS[1]) == 1 then
        """ + TOUCH_LUA + """
        end
        redis.call('HSET', KEYS[1], 'executionId', ARGV[3], 'firstSeen', ARGV[1],
            'lastSeen', ARGV[1], 'occurrenceCount', 1)
        redis.call('PEXPIRE', KEYS[1], ARGV[2])
        return cjson.encode({executionId = ARGV[3], firstSeen = ARGV[1], lastSeen = ARGV[1],
            occurrenceCount = 1, created = true})
        """, String.class);

    /** Deletes the lock only while it holds ARGV[1]. */
    static final RedisScript<Long> RELEASE_SCRIPT = RedisScript.of("""
        if redis.call('GET', KEYS[1]) == ARGV[1] then
            return redis.call('DEL', KEYS[1])
        end
        return 0
        """, Long.class);

    private record StoredEntry(
        @JsonProperty("executionId")     String executionId,
        @JsonProperty("firstSeen")       Instant firstSeen,
        @JsonProperty("lastSeen")        Instant lastSeen,
        @JsonProperty("occurrenceCount") int occurrenceCount,
        @JsonProperty("created")         boolean created
    ) {}

    private final ReactiveStringRedisTemplate redisTemplate;
    private final DeduplicationProperties properties;
    private final DeduplicationKeyGenerator keyGenerator;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String ownerToken = "owner-" + UUID.randomUUID();

    public RedisEventDeduplicator(ReactiveStringRedisTemplate redisTemplate,
                                  DeduplicationProperties properties,
                                  ObjectMapper objectMapper,
                                  Clock clock) {
        this.redisTemplate = redisTemplate;
        this.properties    = properties;
        this.keyGenerator  = new DeduplicationKeyGenerator(
            properties.keyPrefixOr(DeduplicationProperties.REDIS_KEY_PREFIX));
        this.objectMapper  = objectMapper;
        this.clock         = clock;
    }

    @Override
    public String name() {
        return "redis";
    }

    String ownerToken() {
        return ownerToken;
    }

    @Override
    public Mono<DeduplicationResult> check(DeduplicationRequest request) {
        String key = keyGenerator.keyFor(request);
        String now = clock.instant().toString();

        return redisTemplate.execute(TOUCH_SCRIPT, List.of(key), List.of(now, ttlMillis())).next()
            .map(json -> toDuplicate(key, decode(key, json)))
            .switchIfEmpty(Mono.defer(() -> onAbsent(key, now)))
            .onErrorResume(e -> !(e instanceof ValidationException), e -> {
                String executionId = DeduplicationKeyGenerator.newExecutionId();
                log.error("[Dedup] redis unavailable, failing open. key={} executionId={} error={}",
                    key, executionId, e.getMessage());
                return Mono.just(DeduplicationResult.fresh(key, executionId));
            });
    }

    @Override
    public Mono<Void> release(String key) {
        return redisTemplate.execute(RELEASE_SCRIPT, List.of(LOCK_PREFIX + key), List.of(ownerToken)).next()
            .doOnNext(deleted -> {
                if (deleted > 0) {
                    log.debug("[Dedup] lock released key={}", key);
                } else {
                    log.warn("[Dedup] lock not held by this process, left in place. key={}", key);
                }
            })
            .onErrorResume(e -> {
                log.warn("[Dedup] lock release failed, relying on lock TTL. key={} error={}", key, e.getMessage());
                return Mono.empty();
            })
            .then();
    }

    private Mono<DeduplicationResult> onAbsent(String key, String now) {
        return redisTemplate.opsForValue().setIfAbsent(LOCK_PREFIX + key, ownerToken, properties.getLockTtl())
            .flatMap(acquired -> {
                if (!Boolean.TRUE.equals(acquired)) {
                    log.info("[Dedup] lock held elsewhere, skipping. key={}", key);
                    return Mono.just(new DeduplicationResult(DeduplicationAction.SKIP, key, null, 0));
                }
                String executionId = DeduplicationKeyGenerator.newExecutionId();
                return redisTemplate.execute(CREATE_SCRIPT, List.of(key), List.of(now, ttlMillis(), executionId))
                    .next()
                    .flatMap(json -> {
                        StoredEntry stored = decode(key, json);
                        if (stored.created()) {
                            log.info("[Dedup] new key={} executionId={}", key, stored.executionId());
                            return Mono.just(DeduplicationResult.fresh(key, stored.executionId()));
                        }
                        // created elsewhere between the touch and the lock; this process starts no round
                        return release(key).thenReturn(toDuplicate(key, stored));
                    });
            });
    }

    private DeduplicationResult toDuplicate(String key, StoredEntry stored) {
        DeduplicationEntry entry = new DeduplicationEntry(key, stored.executionId(), stored.firstSeen(),
            stored.lastSeen(), stored.occurrenceCount(), properties.getTtl());
        DeduplicationResult result = DeduplicationResult.duplicate(properties.getActionOnDuplicate(), entry);
        log.info("[Dedup] duplicate key={} executionId={} occurrences={} action={}",
            key, entry.executionId(), entry.occurrenceCount(), result.action().wireName());
        return result;
    }

    private String ttlMillis() {
        return String.valueOf(properties.getTtl().toMillis());
    }

    private StoredEntry decode(String key, String json) {
        try {
            return objectMapper.readValue(json, StoredEntry.class);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("RedisDeduplicator", "corrupt entry under " + key, e);
        }
    }
}
