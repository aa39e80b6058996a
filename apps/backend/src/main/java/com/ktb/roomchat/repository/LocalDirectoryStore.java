package com.ktb.roomchat.repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * 인메모리 DirectoryStore.
 * 단일 노드 환경에서만 사용 (chat.datastore.type=local 일 때 SocketIOConfig 가 등록).
 */
public class LocalDirectoryStore implements DirectoryStore {

    // handle -> sortKeys
    private final Map<String, NavigableSet<String>> partitions = new ConcurrentHashMap<>();

    // sortKey -> handles
    private final Map<String, Set<String>> reverseIndex = new ConcurrentHashMap<>();

    @Override
    public void put(DirectoryRow row) {
        // delete 가 빈 집합을 맵에서 치우므로 add 도 compute 안에서 해야 유실되지 않는다
        partitions.compute(row.partitionKey(), (k, sortKeys) -> {
            NavigableSet<String> target = sortKeys != null ? sortKeys : new ConcurrentSkipListSet<>();
            target.add(row.sortKey());
            return target;
        });
        reverseIndex.compute(row.sortKey(), (k, handles) -> {
            Set<String> target = handles != null ? handles : ConcurrentHashMap.newKeySet();
            target.add(row.partitionKey());
            return target;
        });
    }

    @Override
    public void delete(String partitionKey, String sortKey) {
        partitions.computeIfPresent(partitionKey, (k, sortKeys) -> {
            sortKeys.remove(sortKey);
            return sortKeys.isEmpty() ? null : sortKeys;
        });
        reverseIndex.computeIfPresent(sortKey, (k, handles) -> {
            handles.remove(partitionKey);
            return handles.isEmpty() ? null : handles;
        });
    }

    @Override
    public List<DirectoryRow> getAll(String partitionKey) {
        NavigableSet<String> sortKeys = partitions.get(partitionKey);
        if (sortKeys == null) {
            return List.of();
        }
        return sortKeys.stream()
                .map(sk -> new DirectoryRow(partitionKey, sk))
                .toList();
    }

    @Override
    public List<DirectoryRow> queryBySortKey(String sortKey) {
        Set<String> handles = reverseIndex.get(sortKey);
        if (handles == null) {
            return List.of();
        }
        return handles.stream()
                .map(handle -> new DirectoryRow(handle, sortKey))
                .toList();
    }

    @Override
    public List<DirectoryRow> scan() {
        List<DirectoryRow> rows = new ArrayList<>();
        partitions.forEach((handle, sortKeys) ->
                sortKeys.forEach(sk -> rows.add(new DirectoryRow(handle, sk))));
        return rows;
    }
}
