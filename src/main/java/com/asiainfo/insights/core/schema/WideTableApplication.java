package com.asiainfo.insights.core.schema;

import com.asiainfo.insights.core.exception.ApplicationConfigInvalidException;
import com.asiainfo.insights.core.model.DateEncoding;
import com.asiainfo.insights.core.model.InsightType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

/**
 * 宽表应用：一行一个事件，每个事件属性一列
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WideTableApplication(
        String name,
        String databaseUrl,
        String tableName,
        String idField,
        String createdAtField,
        DateEncoding createdAtFieldType,
        String dateBasedCreatedAtField,
        String distinctField,
        List<WideTableField> fields
) implements WarehouseApplication {

    public WideTableApplication {
        createdAtFieldType = createdAtFieldType == null ? DateEncoding.TIMESTAMP_MS : createdAtFieldType;
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    @JsonIgnore
    @Override
    public InsightType insightType() {
        return InsightType.WAREHOUSE_WIDE;
    }

    public Optional<WideTableField> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    /**
     * Declared fields plus the structural columns a query may reference.
     */
    public boolean isKnownColumn(String column) {
        if (column == null) {
            return false;
        }
        return field(column).isPresent()
                || column.equals(idField)
                || column.equals(createdAtField)
                || column.equals(dateBasedCreatedAtField)
                || column.equals(distinctField);
    }

    @Override
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ApplicationConfigInvalidException("Warehouse application without name");
        }
        SchemaChecks.table(name, "tableName", tableName);
        SchemaChecks.required(name, "createdAtField", createdAtField);
        SchemaChecks.optional(name, "idField", idField);
        SchemaChecks.optional(name, "dateBasedCreatedAtField", dateBasedCreatedAtField);
        SchemaChecks.optional(name, "distinctField", distinctField);
        for (WideTableField field : fields) {
            SchemaChecks.required(name, "fields.name", field.name());
        }
    }
}
