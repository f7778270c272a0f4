package com.asiainfo.insights.infra.persistence;

import com.asiainfo.insights.core.exception.BackendUnavailableException;
import com.asiainfo.insights.core.exception.StatementExecutionException;
import com.asiainfo.insights.core.model.SqlRequest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 执行参数化语句并把结果集映射为 列标签 -> 值 的行
 */
@ApplicationScoped
public class StatementExecutor {

    private static final Logger log = LoggerFactory.getLogger(StatementExecutor.class);

    @Inject
    MeterRegistry registry;

    public List<Map<String, Object>> execute(ResolvedInsight target, String insightId, SqlRequest request) {
        String sql = target.dialect().translate(request.sql());
        String backend = target.type().wireName();

        Connection conn;
        try {
            conn = target.dataSource().getConnection();
        } catch (SQLException e) {
            log.error("[{}] Cannot obtain connection for insight {}: {}", backend, insightId, e.getMessage());
            throw new BackendUnavailableException("Backend " + backend + " unavailable for insight " + insightId, e);
        }

        Timer.Sample sample = Timer.start(registry);
        try (conn; PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, request.params());
            try (ResultSet rs = ps.executeQuery()) {
                List<Map<String, Object>> rows = resultSetToList(rs);
                log.debug("[{}] {} rows for insight {}", backend, rows.size(), insightId);
                return rows;
            }
        } catch (SQLException e) {
            log.error("[{}] Statement failed for insight {}: {}\n{}", backend, insightId, e.getMessage(), sql);
            throw new StatementExecutionException(insightId, target.type(), e);
        } finally {
            sample.stop(Timer.builder("insights.query.time")
                    .description("Insights statement execution time")
                    .tag("backend", backend)
                    .register(registry));
        }
    }

    private void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private List<Map<String, Object>> resultSetToList(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int colCount = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(colCount * 2);
            for (int i = 1; i <= colCount; i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }
}
