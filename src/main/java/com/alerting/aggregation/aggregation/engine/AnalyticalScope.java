package com.alerting.aggregation.aggregation.engine;

import com.alerting.aggregation.aggregation.query.EventColumns;
import com.alerting.aggregation.aggregation.query.TemplateParameters;
import com.alerting.aggregation.persistence.entity.EventEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.Array;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory DuckDB scope in which a strategy scan groups its events.
 *
 * <p>Each worker thread gets its own connection, and with it its own in-memory database,
 * so concurrent scans of different strategies never see each other's rows. The events
 * table is dropped and recreated on every load.</p>
 */
@Slf4j
@Component
public class AnalyticalScope {

    private static final String CREATE_TABLE = "CREATE TABLE " + EventColumns.TABLE + " ("
            + "event_id VARCHAR, external_id VARCHAR, action VARCHAR, received_at TIMESTAMP, level VARCHAR, "
            + "resource_name VARCHAR, resource_id VARCHAR, resource_type VARCHAR, item VARCHAR, source_id VARCHAR, "
            + "service VARCHAR, location VARCHAR, event_type VARCHAR, title VARCHAR, description VARCHAR, "
            + "labels VARCHAR, tags VARCHAR)";

    private static final String INSERT = "INSERT INTO " + EventColumns.TABLE + " ("
            + String.join(", ", EventColumns.ORDERED) + ") VALUES ("
            + EventColumns.ORDERED.stream()
                    .map(column -> "received_at".equals(column) ? "CAST(? AS TIMESTAMP)" : "?")
                    .collect(Collectors.joining(", "))
            + ")";

    private final ObjectMapper objectMapper;
    private final String jdbcUrl;
    private final ThreadLocal<Connection> connections = new ThreadLocal<>();
    private final Set<Connection> openConnections = ConcurrentHashMap.newKeySet();

    public AnalyticalScope(ObjectMapper objectMapper,
                           @Value("${alerting.aggregation.duckdb-url:jdbc:duckdb:}") String jdbcUrl) {
        this.objectMapper = objectMapper;
        this.jdbcUrl = jdbcUrl;
    }

    /**
     * Replaces the scope's events table with the given events.
     *
     * @return false, without touching the table, when the batch is empty
     */
    public boolean loadEvents(List<EventEntity> events) {
        if (events == null || events.isEmpty()) {
            log.warn("Empty event batch handed to analytical scope; upstream filter should have short-circuited");
            return false;
        }
        Connection connection = connection();
        try {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                statement.execute("DROP TABLE IF EXISTS " + EventColumns.TABLE);
                statement.execute(CREATE_TABLE);
            }
            try (PreparedStatement insert = connection.prepareStatement(INSERT)) {
                for (EventEntity event : events) {
                    bindEvent(insert, event);
                    insert.executeUpdate();
                }
            }
            connection.commit();
        } catch (SQLException e) {
            rollbackQuietly(connection);
            throw new AnalyticalEngineException("Failed to load " + events.size() + " events into analytical scope", e);
        } finally {
            restoreAutoCommit(connection);
        }
        log.debug("Loaded events into analytical scope: count={}, thread={}", events.size(), Thread.currentThread().getName());
        return true;
    }

    /**
     * Runs a query and returns its rows as column-to-value maps in projection order. Lists
     * come back as {@link List}, timestamps as UTC {@link java.time.Instant}.
     */
    public List<Map<String, Object>> execute(String sql) {
        Connection connection = connection();
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(sql)) {
            ResultSetMetaData metaData = resultSet.getMetaData();
            int columnCount = metaData.getColumnCount();
            List<Map<String, Object>> rows = new ArrayList<>();
            while (resultSet.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columnCount; i++) {
                    row.put(metaData.getColumnLabel(i), normalize(resultSet.getObject(i)));
                }
                rows.add(row);
            }
            return rows;
        } catch (SQLException e) {
            throw new AnalyticalEngineException("Analytical query failed: " + e.getMessage(), e);
        }
    }

    /**
     * Closes the calling thread's connection, discarding its in-memory tables.
     */
    public void release() {
        Connection connection = connections.get();
        connections.remove();
        if (connection != null) {
            openConnections.remove(connection);
            closeQuietly(connection);
        }
    }

    @PreDestroy
    public void shutdown() {
        openConnections.forEach(AnalyticalScope::closeQuietly);
        openConnections.clear();
    }

    private Connection connection() {
        Connection connection = connections.get();
        try {
            if (connection == null || connection.isClosed()) {
                connection = DriverManager.getConnection(jdbcUrl);
                connections.set(connection);
                openConnections.add(connection);
                log.debug("Opened analytical connection for thread {}", Thread.currentThread().getName());
            }
            return connection;
        } catch (SQLException e) {
            throw new AnalyticalEngineException("Cannot open analytical connection to " + jdbcUrl, e);
        }
    }

    private void bindEvent(PreparedStatement insert, EventEntity event) throws SQLException {
        int i = 1;
        insert.setString(i++, event.getEventId());
        insert.setString(i++, event.getExternalId());
        insert.setString(i++, event.getAction() == null ? null : event.getAction().name());
        insert.setString(i++, event.getReceivedAt() == null ? null : TemplateParameters.formatTimestamp(event.getReceivedAt()));
        insert.setString(i++, event.getLevel());
        insert.setString(i++, event.getResourceName());
        insert.setString(i++, event.getResourceId());
        insert.setString(i++, event.getResourceType());
        insert.setString(i++, event.getItem());
        insert.setString(i++, event.getSourceId());
        insert.setString(i++, event.getService());
        insert.setString(i++, event.getLocation());
        insert.setString(i++, event.getEventType());
        insert.setString(i++, event.getTitle());
        insert.setString(i++, event.getDescription());
        insert.setString(i++, toJson(event.getLabels()));
        insert.setString(i, toJson(event.getTags()));
    }

    private String toJson(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize event attributes", e);
        }
    }

    static Object normalize(Object value) throws SQLException {
        if (value instanceof Array) {
            Object[] elements = (Object[]) ((Array) value).getArray();
            List<Object> list = new ArrayList<>(elements.length);
            for (Object element : elements) {
                list.add(normalize(element));
            }
            return list;
        }
        if (value instanceof Object[]) {
            return new ArrayList<>(Arrays.asList((Object[]) value));
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        return value;
    }

    private static void rollbackQuietly(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Rollback of analytical load failed: {}", e.getMessage());
        }
    }

    private static void restoreAutoCommit(Connection connection) {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Could not restore auto-commit on analytical connection: {}", e.getMessage());
        }
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Closing analytical connection failed: {}", e.getMessage());
        }
    }
}
