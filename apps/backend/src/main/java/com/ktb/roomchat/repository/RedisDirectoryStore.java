package com.ktb.roomchat.repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

/**
 * Redis 기반 DirectoryStore 구현체.
 *
 * [왜 Redis를 사용하는가?]
 * - 같은 connection 의 이벤트가 서로 다른 워커에서 동시에 처리될 수 있음
 * - 이벤트 사이의 상태는 프로세스 메모리가 아니라 공유 저장소에만 둔다
 *
 * [키 구조] (prefix 기본값 chat:dir)
 * - {prefix}:pk:{handle}   SET of sortKey       (getAll)
 * - {prefix}:sk:{sortKey}  SET of handle        (역인덱스, queryBySortKey)
 * - {prefix}:partitions    SET of handle        (scan 대상)
 *
 * [쓰기 원자성]
 * - put/delete 는 세 SET 을 Lua 스크립트 하나로 갱신한다
 *
 * [TTL 없음]
 * - 디렉터리 행은 disconnect 시 명시적으로 삭제될 때까지 유지된다
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "chat.datastore.type", havingValue = "redis", matchIfMissing = true)
public class RedisDirectoryStore implements DirectoryStore {

    /**
     * KEYS: 파티션, 역인덱스, partitions / ARGV: sortKey, handle
     */
    static final RedisScript<Long> PUT_SCRIPT = RedisScript.of(String.join("\n",
            "redis.call('SADD', KEYS[1], ARGV[1])",
            "redis.call('SADD', KEYS[2], ARGV[2])",
            "redis.call('SADD', KEYS[3], ARGV[2])",
            "return 1"), Long.class);

    /**
     * 마지막 행이 빠질 때만 scan 대상에서 제외한다.
     * SCARD 확인과 partitions SREM 사이에 다른 put 이 실행되지 않는다.
     */
    static final RedisScript<Long> DELETE_SCRIPT = RedisScript.of(String.join("\n",
            "redis.call('SREM', KEYS[1], ARGV[1])",
            "redis.call('SREM', KEYS[2], ARGV[2])",
            "if redis.call('SCARD', KEYS[1]) == 0 then",
            "    redis.call('SREM', KEYS[3], ARGV[2])",
            "end",
            "return 1"), Long.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final String keyPrefix;

    public RedisDirectoryStore(
            RedisTemplate<String, String> redisTemplate,
            @Value("${chat.directory.key-prefix:chat:dir}") String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public void put(DirectoryRow row) {
        execute("put", () -> {
            redisTemplate.execute(PUT_SCRIPT,
                    List.of(partitionKey(row.partitionKey()), indexKey(row.sortKey()), partitionsKey()),
                    row.sortKey(), row.partitionKey());
            log.debug("Directory put - pk: {}, sk: {}", row.partitionKey(), row.sortKey());
            return null;
        });
    }

    @Override
    public void delete(String partitionKey, String sortKey) {
        execute("delete", () -> {
            redisTemplate.execute(DELETE_SCRIPT,
                    List.of(partitionKey(partitionKey), indexKey(sortKey), partitionsKey()),
                    sortKey, partitionKey);
            log.debug("Directory delete - pk: {}, sk: {}", partitionKey, sortKey);
            return null;
        });
    }

    @Override
    public List<DirectoryRow> getAll(String partitionKey) {
        return execute("getAll", () -> {
            Set<String> sortKeys = redisTemplate.opsForSet().members(partitionKey(partitionKey));
            return toRows(partitionKey, sortKeys);
        });
    }

    @Override
    public List<DirectoryRow> queryBySortKey(String sortKey) {
        return execute("queryBySortKey", () -> {
            Set<String> handles = redisTemplate.opsForSet().members(indexKey(sortKey));
            List<DirectoryRow> rows = new ArrayList<>();
            if (handles != null) {
                for (String handle : handles) {
                    rows.add(new DirectoryRow(handle, sortKey));
                }
            }
            return rows;
        });
    }

    /**
     * [주의] 파티션 수에 비례하는 연산
     * - 방 목록 조회(/ls) 에서만 사용
     */
    @Override
    public List<DirectoryRow> scan() {
        return execute("scan", () -> {
            SetOperations<String, String> sets = redisTemplate.opsForSet();
            Set<String> partitions = sets.members(partitionsKey());
            List<DirectoryRow> rows = new ArrayList<>();
            if (partitions == null) {
                return rows;
            }
            for (String handle : partitions) {
                rows.addAll(toRows(handle, sets.members(partitionKey(handle))));
            }
            return rows;
        });
    }

    private List<DirectoryRow> toRows(String partitionKey, Set<String> sortKeys) {
        if (sortKeys == null || sortKeys.isEmpty()) {
            return List.of();
        }
        return sortKeys.stream()
                .sorted(Comparator.naturalOrder())
                .map(sk -> new DirectoryRow(partitionKey, sk))
                .toList();
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new DirectoryStoreException("Redis directory " + operation + " failed", e);
        }
    }

    String partitionKey(String handle) {
        return keyPrefix + ":pk:" + handle;
    }

    String indexKey(String sortKey) {
        return keyPrefix + ":sk:" + sortKey;
    }

    String partitionsKey() {
        return keyPrefix + ":partitions";
    }
}
