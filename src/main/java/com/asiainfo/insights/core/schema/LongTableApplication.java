package com.asiainfo.insights.core.schema;

import com.asiainfo.insights.core.exception.ApplicationConfigInvalidException;
import com.asiainfo.insights.core.model.InsightType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 长表应用：事件表 + 事件参数表
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LongTableApplication(
        String name,
        String databaseUrl,
        EventTableDef eventTable,
        EventParametersTableDef eventParametersTable
) implements WarehouseApplication {

    @JsonIgnore
    @Override
    public InsightType insightType() {
        return InsightType.WAREHOUSE_LONG;
    }

    @Override
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ApplicationConfigInvalidException("Warehouse application without name");
        }
        if (eventTable == null) {
            throw new ApplicationConfigInvalidException("Application " + name + ": eventTable is required");
        }
        if (eventParametersTable == null) {
            throw new ApplicationConfigInvalidException("Application " + name + ": eventParametersTable is required");
        }
        eventTable.validate(name);
        eventParametersTable.validate(name);
    }
}
