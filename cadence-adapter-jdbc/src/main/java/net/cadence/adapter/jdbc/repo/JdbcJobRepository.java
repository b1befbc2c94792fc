package net.cadence.adapter.jdbc.repo;

import net.cadence.adapter.jdbc.JdbcUtil;
import net.cadence.adapter.jdbc.TxContext;
import net.cadence.adapter.jdbc.mapper.RowMappers;
import net.cadence.core.model.Job;
import net.cadence.core.spi.JobRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** TB_JOB 저장소. 커넥션은 항상 TxContext 에서 가져온다. */
public final class JdbcJobRepository implements JobRepository {

    @Override
    public Optional<Job> findById(long id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM TB_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<Job> findByName(String name) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_JOB
                WHERE UPPER(NAME) = UPPER(?)
            """)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Job> findAll() throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM TB_JOB ORDER BY ID")) {
            return readAll(ps);
        }
    }

    @Override
    public List<Job> findAllByStatus(Job.Status status) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT * FROM TB_JOB WHERE STATUS = ? ORDER BY ID")) {
            ps.setString(1, status.code());
            return readAll(ps);
        }
    }

    @Override
    public Job insert(Job job) throws Exception {
        if (job.name() == null || job.interval() == null) {
            throw new IllegalArgumentException("name and interval are required for insert");
        }
        Connection c = TxContext.require();
        long id;
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_JOB(NAME, DESCRIPTION, INTERVAL_EXPR, LAST_RUN_AT, NEXT_RUN_AT, STATUS, CREATED_AT, UPDATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            """, new String[]{"ID"})) {
            int i = 1;
            ps.setString(i++, job.name());
            ps.setString(i++, job.description());
            ps.setString(i++, job.interval());
            ps.setTimestamp(i++, JdbcUtil.ts(job.lastRun()));
            ps.setTimestamp(i++, JdbcUtil.ts(job.nextRun() != null ? job.nextRun() : Instant.now()));
            ps.setString(i++, (job.status() == null ? Job.Status.PENDING : job.status()).code());
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new IllegalStateException("No generated key for TB_JOB insert: " + job.name());
                id = k.getLong(1);
            }
        }
        return findById(id).orElseThrow(() -> new IllegalStateException("insert failed to load job: " + job.name()));
    }

    @Override
    public Job upsert(String name, String description, String interval, Instant nextRun) throws Exception {
        // Oracle MERGE (name 유니크 기준). 기존 행의 실행 이력/상태는 건드리지 않는다
        var sql = """
            MERGE INTO TB_JOB d
            USING (SELECT ? NAME FROM dual) s
               ON (d.NAME = s.NAME)
            WHEN MATCHED THEN UPDATE SET
                 DESCRIPTION   = ?,
                 INTERVAL_EXPR = ?,
                 UPDATED_AT    = SYSTIMESTAMP
            WHEN NOT MATCHED THEN INSERT
                 (NAME, DESCRIPTION, INTERVAL_EXPR, NEXT_RUN_AT, STATUS, CREATED_AT, UPDATED_AT)
            VALUES (?,    ?,           ?,             ?,           'ACTIVE', SYSTIMESTAMP, SYSTIMESTAMP)
            """;

        try (var ps = TxContext.require().prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, name);
            ps.setString(i++, description);
            ps.setString(i++, interval);
            ps.setString(i++, name);
            ps.setString(i++, description);
            ps.setString(i++, interval);
            ps.setTimestamp(i++, JdbcUtil.ts(nextRun));
            ps.executeUpdate();
        }
        return findByName(name).orElseThrow(() -> new IllegalStateException("upsert failed to load job: " + name));
    }

    @Override
    public void update(Job job) throws Exception {
        if (job.id() == null) throw new IllegalArgumentException("job id is required for update");
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_JOB
                   SET NAME          = ?,
                       DESCRIPTION   = ?,
                       INTERVAL_EXPR = ?,
                       NEXT_RUN_AT   = ?,
                       STATUS        = ?,
                       UPDATED_AT    = CURRENT_TIMESTAMP
                 WHERE ID = ?
            """)) {
            ps.setString(1, job.name());
            ps.setString(2, job.description());
            ps.setString(3, job.interval());
            ps.setTimestamp(4, JdbcUtil.ts(job.nextRun()));
            ps.setString(5, job.status().code());
            ps.setLong(6, job.id());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("TB_JOB not found for ID=" + job.id());
            }
        }
    }

    @Override
    public boolean recordRun(long id, Instant lastRun, Instant nextRun) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_JOB
                   SET LAST_RUN_AT = ?,
                       NEXT_RUN_AT = ?,
                       UPDATED_AT  = CURRENT_TIMESTAMP
                 WHERE ID = ?
            """)) {
            ps.setTimestamp(1, JdbcUtil.ts(lastRun));
            ps.setTimestamp(2, JdbcUtil.ts(nextRun));
            ps.setLong(3, id);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public boolean delete(long id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("DELETE FROM TB_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    private static List<Job> readAll(PreparedStatement ps) throws Exception {
        try (ResultSet rs = ps.executeQuery()) {
            List<Job> list = new ArrayList<>();
            while (rs.next()) list.add(RowMappers.toJob(rs));
            return list;
        }
    }
}
