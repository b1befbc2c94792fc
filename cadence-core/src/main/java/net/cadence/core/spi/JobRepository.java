package net.cadence.core.spi;

import net.cadence.core.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** 잡 저장소. 모든 호출은 {@link TxRunner} 스코프 안에서 이뤄진다고 가정. */
public interface JobRepository {
    Optional<Job> findById(long id) throws Exception;
    Optional<Job> findByName(String name) throws Exception;
    List<Job> findAll() throws Exception;
    List<Job> findAllByStatus(Job.Status status) throws Exception;

    /** id 발번 후 저장된 행을 반환 */
    Job insert(Job job) throws Exception;

    /** NAME 유니크 기준 멱등 upsert. 기존 행이면 설명/주기만 갱신하고 실행 이력은 유지 */
    Job upsert(String name, String description, String interval, Instant nextRun) throws Exception;

    /** 이름/설명/주기/상태/next_run 갱신 (ID 필수) */
    void update(Job job) throws Exception;

    /** 실행 결과 반영: last_run, next_run. 대상 행이 없으면 false */
    boolean recordRun(long id, Instant lastRun, Instant nextRun) throws Exception;

    boolean delete(long id) throws Exception;
}
