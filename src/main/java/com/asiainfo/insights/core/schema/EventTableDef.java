package com.asiainfo.insights.core.schema;

import com.asiainfo.insights.core.model.DateEncoding;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 长表模式的事件表
 *
 * @param idField                 join key referenced by parameter rows; needed only for parameter filters/groups
 * @param distinctField           session/user column, needed only for session metrics
 * @param dateBasedCreatedAtField optional calendar-date column used for partition pruning
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventTableDef(
        String name,
        String idField,
        String eventNameField,
        String createdAtField,
        DateEncoding createdAtFieldType,
        String dateBasedCreatedAtField,
        String distinctField
) {

    public EventTableDef {
        createdAtFieldType = createdAtFieldType == null ? DateEncoding.TIMESTAMP_MS : createdAtFieldType;
    }

    void validate(String application) {
        SchemaChecks.table(application, "eventTable.name", name);
        SchemaChecks.required(application, "eventTable.eventNameField", eventNameField);
        SchemaChecks.required(application, "eventTable.createdAtField", createdAtField);
        SchemaChecks.optional(application, "eventTable.idField", idField);
        SchemaChecks.optional(application, "eventTable.dateBasedCreatedAtField", dateBasedCreatedAtField);
        SchemaChecks.optional(application, "eventTable.distinctField", distinctField);
    }
}
