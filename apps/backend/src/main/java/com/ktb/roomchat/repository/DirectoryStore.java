package com.ktb.roomchat.repository;

import java.util.List;

/**
 * 연결별 속성 행을 저장하는 디렉터리 저장소.
 *
 * 구현체:
 * - RedisDirectoryStore: 기본값, 여러 서버가 공유
 * - LocalDirectoryStore: 단일 노드/테스트용 인메모리
 *
 * 모든 메서드는 실패 시 {@link DirectoryStoreException} 을 던진다.
 */
public interface DirectoryStore {

    /**
     * 행 저장. 같은 키의 행이 있으면 덮어쓴다.
     */
    void put(DirectoryRow row);

    /**
     * 행 삭제. 없는 행이어도 오류가 아니다.
     */
    void delete(String partitionKey, String sortKey);

    /**
     * 파티션의 모든 행 (sortKey 순).
     */
    List<DirectoryRow> getAll(String partitionKey);

    /**
     * 역인덱스 조회: 같은 sortKey 를 가진 모든 행.
     * 결과 크기에 비례하는 비용이어야 한다.
     */
    List<DirectoryRow> queryBySortKey(String sortKey);

    /**
     * 전체 스캔. 비용이 크므로 자주 호출하지 않는다.
     */
    List<DirectoryRow> scan();
}
