package com.asiainfo.insights.infra.persistence;

import com.asiainfo.insights.core.exception.ApplicationConfigInvalidException;
import com.asiainfo.insights.core.exception.ApplicationNotFoundException;
import com.asiainfo.insights.core.exception.BackendUnavailableException;
import com.asiainfo.insights.core.generator.DuckDbDialect;
import com.asiainfo.insights.core.generator.MySqlDialect;
import com.asiainfo.insights.core.model.DateEncoding;
import com.asiainfo.insights.core.model.FilterValueType;
import com.asiainfo.insights.core.model.InsightType;
import com.asiainfo.insights.core.schema.LongTableApplication;
import com.asiainfo.insights.core.schema.WarehouseApplication;
import com.asiainfo.insights.core.schema.WideTableApplication;
import com.asiainfo.insights.infra.config.InsightsConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class WarehouseApplicationRegistryTest {

    private DuckDbTestSupport duckdb;
    private InsightsConfig config;
    private WarehouseApplicationRegistry registry;

    @BeforeEach
    public void setUp() throws Exception {
        duckdb = DuckDbTestSupport.open();
        config = Mockito.mock(InsightsConfig.class);
        when(config.isWarehouseEnabled()).thenReturn(true);
        when(config.getApplicationsJson()).thenReturn(fixture());
        when(config.getWarehouseUrl()).thenReturn(Optional.of("jdbc:mysql://warehouse:3306/analytics"));
        when(config.getWarehouseUsername()).thenReturn(Optional.empty());
        when(config.getWarehousePassword()).thenReturn(Optional.empty());
        when(config.getPoolMaxSize()).thenReturn(2);
        when(config.getPoolAcquisitionTimeoutSeconds()).thenReturn(1);
        when(config.getInternalDialect()).thenReturn("duckdb");
        registry = duckdb.registry(config);
    }

    @AfterEach
    public void tearDown() {
        registry.pools.shutdown();
        duckdb.close();
    }

    private static String fixture() throws IOException {
        try (InputStream in = WarehouseApplicationRegistryTest.class
                .getResourceAsStream("/warehouse-applications.json")) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    public void testParsesBothLayouts() {
        List<WarehouseApplication> apps = registry.getApplications();

        assertEquals(3, apps.size());
        LongTableApplication shop = assertInstanceOf(LongTableApplication.class, apps.get(0));
        assertEquals("ods.events", shop.eventTable().name());
        assertEquals(DateEncoding.TIMESTAMP_MS, shop.eventTable().createdAtFieldType());
        assertEquals("value_number", shop.eventParametersTable().paramsValueNumberField());

        WideTableApplication game = assertInstanceOf(WideTableApplication.class, apps.get(1));
        assertNull(game.databaseUrl());
        assertEquals(DateEncoding.TIMESTAMP, game.createdAtFieldType());
        assertEquals(FilterValueType.NUMBER, game.field("level").orElseThrow().type());
        assertEquals(DateEncoding.DATETIME, game.field("paid_at").orElseThrow().dateEncoding());
    }

    @Test
    public void testParsedOnceUntilReload() {
        List<WarehouseApplication> first = registry.getApplications();
        assertSame(first, registry.getApplications());
        verify(config, times(1)).getApplicationsJson();

        when(config.getApplicationsJson()).thenReturn("[]");
        assertSame(first, registry.getApplications());

        registry.reload();
        assertTrue(registry.getApplications().isEmpty());
        verify(config, times(2)).getApplicationsJson();
    }

    @Test
    public void testLookupByNameAndType() {
        assertInstanceOf(LongTableApplication.class, registry.findApplication("shop", InsightType.WAREHOUSE_LONG));
        assertInstanceOf(WideTableApplication.class, registry.findApplication("shop", InsightType.WAREHOUSE_WIDE));

        ApplicationNotFoundException e = assertThrows(ApplicationNotFoundException.class,
                () -> registry.findApplication("game", InsightType.WAREHOUSE_LONG));
        assertTrue(e.getMessage().contains("game"), e.getMessage());
        assertThrows(ApplicationNotFoundException.class,
                () -> registry.findApplication("missing", InsightType.WAREHOUSE_WIDE));
    }

    @Test
    public void testMissingTypeDefaultsToLongTable() {
        when(config.getApplicationsJson()).thenReturn("[{\"name\":\"legacy\","
                + "\"eventTable\":{\"name\":\"events\",\"eventNameField\":\"event\",\"createdAtField\":\"ts\"},"
                + "\"eventParametersTable\":{\"name\":\"params\",\"paramsNameField\":\"k\","
                + "\"paramsValueField\":\"v\",\"createdAtField\":\"ts\"}}]");

        assertInstanceOf(LongTableApplication.class, registry.findApplication("legacy", InsightType.WAREHOUSE_LONG));
    }

    @Test
    public void testInvalidDefinitions() {
        when(config.getApplicationsJson()).thenReturn("[{\"type\":\"wideTable\",");
        assertThrows(ApplicationConfigInvalidException.class, () -> registry.getApplications());

        // 解析失败不缓存
        when(config.getApplicationsJson()).thenReturn(
                "[{\"type\":\"wideTable\",\"name\":\"x\",\"tableName\":\"t`; DROP TABLE t\",\"createdAtField\":\"ts\"}]");
        ApplicationConfigInvalidException unsafe = assertThrows(ApplicationConfigInvalidException.class,
                () -> registry.getApplications());
        assertTrue(unsafe.getMessage().contains("tableName"), unsafe.getMessage());

        when(config.getApplicationsJson()).thenReturn(
                "[{\"type\":\"wideTable\",\"name\":\"x\",\"tableName\":\"t\"}]");
        ApplicationConfigInvalidException missing = assertThrows(ApplicationConfigInvalidException.class,
                () -> registry.getApplications());
        assertTrue(missing.getMessage().contains("createdAtField"), missing.getMessage());

        when(config.getApplicationsJson()).thenReturn(
                "[{\"type\":\"wideTable\",\"name\":\"x\",\"tableName\":\"t\",\"createdAtField\":\"ts\"},"
                        + "{\"type\":\"wideTable\",\"name\":\"x\",\"tableName\":\"u\",\"createdAtField\":\"ts\"}]");
        assertThrows(ApplicationConfigInvalidException.class, () -> registry.getApplications());

        when(config.getApplicationsJson()).thenReturn(
                "[{\"type\":\"wideTable\",\"name\":\"x\",\"tableName\":\"t\",\"createdAtField\":\"ts\"}]");
        assertEquals(1, registry.getApplications().size());
    }

    @Test
    public void testResolveInternal() {
        ResolvedInsight target = registry.resolve("site-1", InsightType.INTERNAL);

        assertSame(duckdb.dataSource(), target.dataSource());
        assertSame(DuckDbDialect.INSTANCE, target.dialect());
        assertNull(target.application());
        verify(config, times(0)).getApplicationsJson();
    }

    @Test
    public void testResolveWarehouseSharesPoolPerUrl() {
        ResolvedInsight shop = registry.resolve("shop", InsightType.WAREHOUSE_LONG);
        assertSame(DuckDbDialect.INSTANCE, shop.dialect());

        ResolvedInsight game = registry.resolve("game", InsightType.WAREHOUSE_WIDE);
        ResolvedInsight shopWide = registry.resolve("shop", InsightType.WAREHOUSE_WIDE);
        assertSame(MySqlDialect.INSTANCE, game.dialect());
        assertSame(game.dataSource(), shopWide.dataSource());
        assertFalse(game.dataSource() == shop.dataSource());
        assertEquals(2, registry.pools.size());
    }

    @Test
    public void testResolveWarehouseDisabled() {
        when(config.isWarehouseEnabled()).thenReturn(false);

        assertThrows(BackendUnavailableException.class, () -> registry.resolve("shop", InsightType.WAREHOUSE_LONG));
        assertEquals(0, registry.pools.size());
    }

    @Test
    public void testResolveWithoutUrl() {
        when(config.getWarehouseUrl()).thenReturn(Optional.empty());

        assertThrows(BackendUnavailableException.class, () -> registry.resolve("game", InsightType.WAREHOUSE_WIDE));
    }
}
