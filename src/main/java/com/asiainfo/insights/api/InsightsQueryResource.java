package com.asiainfo.insights.api;

import com.asiainfo.insights.api.dto.EventsQueryRequest;
import com.asiainfo.insights.api.dto.InsightsQueryRequest;
import com.asiainfo.insights.api.dto.InsightsQueryResult;
import com.asiainfo.insights.core.engine.InsightsQueryEngine;
import com.asiainfo.insights.core.exception.InsightsException;
import com.asiainfo.insights.core.model.EventPage;
import com.asiainfo.insights.core.model.TimeSeries;
import com.asiainfo.insights.core.schema.WideTableField;
import com.asiainfo.insights.infra.persistence.WarehouseApplicationRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 洞察查询 REST API
 */
@ApplicationScoped
@Path("/api/insights")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class InsightsQueryResource {
    private static final Logger log = LoggerFactory.getLogger(InsightsQueryResource.class);

    @Inject
    InsightsQueryEngine engine;
    @Inject
    WarehouseApplicationRegistry registry;

    /**
     * 聚合查询，返回按时间桶补齐的序列
     */
    @POST
    @Path("/query")
    public InsightsQueryResult<List<TimeSeries>> query(InsightsQueryRequest request) {
        try {
            log.info("收到查询请求: insight={}, type={}", request.insightId(), request.insightType());
            long t0 = System.currentTimeMillis();
            List<TimeSeries> series = engine.query(request.toQuery(), request.toContext());
            return InsightsQueryResult.success(series,
                    "查询成功! 返回 " + series.size() + " 条序列, 耗时 " + (System.currentTimeMillis() - t0) + " ms");
        } catch (InsightsException e) {
            return failure("query", e);
        } catch (Exception e) {
            log.error("Unexpected query failure", e);
            return InsightsQueryResult.error("查询失败: " + e.getMessage());
        }
    }

    /**
     * 原始事件分页
     */
    @POST
    @Path("/events")
    public InsightsQueryResult<EventPage> events(EventsQueryRequest request) {
        try {
            EventPage page = engine.queryEvents(request.toQuery(), request.toContext());
            return InsightsQueryResult.success(page, "查询成功! 返回 " + page.items().size() + " 条记录");
        } catch (InsightsException e) {
            return failure("events", e);
        } catch (Exception e) {
            log.error("Unexpected events failure", e);
            return InsightsQueryResult.error("查询失败: " + e.getMessage());
        }
    }

    @GET
    @Path("/warehouse/{applicationId}/fields")
    public InsightsQueryResult<List<WideTableField>> fields(@PathParam("applicationId") String applicationId) {
        try {
            List<WideTableField> fields = engine.listFields(applicationId);
            return InsightsQueryResult.success(fields, "");
        } catch (InsightsException e) {
            return failure("fields", e);
        }
    }

    @POST
    @Path("/warehouse/reload")
    public InsightsQueryResult<Void> reload() {
        registry.reload();
        return InsightsQueryResult.success(null, "已重新加载");
    }

    private <T> InsightsQueryResult<T> failure(String operation, InsightsException e) {
        if (e.isRequestError()) {
            log.warn("[{}] rejected: {}", operation, e.getMessage());
        } else {
            log.error("[{}] failed: {}", operation, e.getMessage(), e);
        }
        return InsightsQueryResult.error(e.getMessage());
    }
}
