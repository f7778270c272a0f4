package com.asiainfo.insights.core.schema;

import com.asiainfo.insights.core.model.DateEncoding;
import com.asiainfo.insights.core.model.FilterValueType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 长表模式的事件参数表：每个事件的每个参数一行，按值类型分列存储
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventParametersTableDef(
        String name,
        String eventIdField,
        String paramsNameField,
        String paramsValueField,
        String paramsValueNumberField,
        String paramsValueStringField,
        String paramsValueDateField,
        DateEncoding paramsValueDateFieldType,
        String createdAtField,
        DateEncoding createdAtFieldType,
        String dateBasedCreatedAtField
) {

    public EventParametersTableDef {
        createdAtFieldType = createdAtFieldType == null ? DateEncoding.TIMESTAMP_MS : createdAtFieldType;
        paramsValueDateFieldType = paramsValueDateFieldType == null ? DateEncoding.DATETIME : paramsValueDateFieldType;
    }

    /**
     * Value column holding parameters of {@code type}, falling back to the generic value column.
     */
    public String valueFieldFor(FilterValueType type) {
        String typed = switch (type == null ? FilterValueType.OTHER : type) {
            case NUMBER -> paramsValueNumberField;
            case STRING -> paramsValueStringField;
            case DATE -> paramsValueDateField;
            case OTHER -> null;
        };
        return typed != null ? typed : paramsValueField;
    }

    /**
     * Storage of {@link #valueFieldFor} for date parameters.
     */
    public DateEncoding dateValueEncoding() {
        return paramsValueDateField != null ? paramsValueDateFieldType : DateEncoding.DATETIME;
    }

    void validate(String application) {
        SchemaChecks.table(application, "eventParametersTable.name", name);
        SchemaChecks.required(application, "eventParametersTable.paramsNameField", paramsNameField);
        SchemaChecks.required(application, "eventParametersTable.paramsValueField", paramsValueField);
        SchemaChecks.required(application, "eventParametersTable.createdAtField", createdAtField);
        SchemaChecks.optional(application, "eventParametersTable.eventIdField", eventIdField);
        SchemaChecks.optional(application, "eventParametersTable.paramsValueNumberField", paramsValueNumberField);
        SchemaChecks.optional(application, "eventParametersTable.paramsValueStringField", paramsValueStringField);
        SchemaChecks.optional(application, "eventParametersTable.paramsValueDateField", paramsValueDateField);
        SchemaChecks.optional(application, "eventParametersTable.dateBasedCreatedAtField", dateBasedCreatedAtField);
    }
}
