package com.insights.precompute.infrastructure.persistence;

import com.insights.precompute.domain.exception.RecordSourceException;
import com.insights.precompute.domain.model.FilterOptions;
import com.insights.precompute.domain.model.WatchRecord;
import com.insights.precompute.domain.port.out.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;

/**
 * Loads watch records from the watch_records table.
 * Filtering happens in SQL; "All" on timeframe or product means no restriction.
 */
@Repository
public class JdbcRecordSource implements RecordSource {

    private static final Logger logger = LoggerFactory.getLogger(JdbcRecordSource.class);

    private static final RowMapper<WatchRecord> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp watchedAt = rs.getTimestamp("watched_at");
        Array topics = rs.getArray("topics");
        return new WatchRecord(
                rs.getString("id"),
                watchedAt != null ? watchedAt.toInstant() : null,
                rs.getString("video_id"),
                rs.getString("video_title"),
                rs.getString("channel_title"),
                rs.getString("product"),
                topics != null ? Arrays.asList((String[]) topics.getArray()) : List.of()
        );
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcRecordSource(NamedParameterJdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public List<WatchRecord> loadRecords(String userId, FilterOptions filters) {
        StringBuilder sql = new StringBuilder("""
            SELECT id, watched_at, video_id, video_title, channel_title, product, topics
            FROM watch_records
            WHERE user_id = :userId
            """);
        MapSqlParameterSource params = new MapSqlParameterSource("userId", userId);

        if (isRestricted(filters.product())) {
            sql.append(" AND product = :product");
            params.addValue("product", filters.product());
        }

        TimeframeWindow.lowerBound(filters.timeframe(), clock).ifPresent(lowerBound -> {
            sql.append(" AND watched_at >= :watchedFrom");
            params.addValue("watchedFrom", Timestamp.from(lowerBound));
        });

        if (filters.channels() != null && !filters.channels().isEmpty()) {
            sql.append(" AND channel_title IN (:channels)");
            params.addValue("channels", filters.channels());
        }

        if (filters.topics() != null && !filters.topics().isEmpty()) {
            sql.append(" AND topics && CAST(ARRAY[:topics] AS text[])");
            params.addValue("topics", filters.topics());
        }

        sql.append(" ORDER BY watched_at NULLS LAST, id");

        try {
            List<WatchRecord> records = jdbcTemplate.query(sql.toString(), params, ROW_MAPPER);
            logger.debug("Loaded {} watch records for user {}", records.size(), userId);
            return records;
        } catch (DataAccessException e) {
            logger.error("Database error while loading watch records for user {}", userId, e);
            throw new RecordSourceException("Failed to load watch records for user " + userId, e);
        }
    }

    private static boolean isRestricted(String value) {
        return value != null && !FilterOptions.ALL.equals(value);
    }
}
