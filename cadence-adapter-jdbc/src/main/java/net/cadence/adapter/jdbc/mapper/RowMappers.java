package net.cadence.adapter.jdbc.mapper;

import net.cadence.adapter.jdbc.JdbcUtil;
import net.cadence.core.model.Job;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- Job ---
    public static Job toJob(ResultSet rs) throws SQLException {
        return new Job(
                rs.getLong("ID"),
                rs.getString("NAME"),
                rs.getString("DESCRIPTION"),
                rs.getString("INTERVAL_EXPR"),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_RUN_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("NEXT_RUN_AT")),
                Job.Status.from(rs.getString("STATUS")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }
}
