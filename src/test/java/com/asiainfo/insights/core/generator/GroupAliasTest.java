package com.asiainfo.insights.core.generator;

import com.asiainfo.insights.core.exception.InvalidQueryException;
import com.asiainfo.insights.core.model.FilterOperator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GroupAliasTest {

    @Test
    public void testRawAlias() {
        GroupAlias alias = GroupAlias.raw("country");
        assertEquals("%country", alias.encode());
        assertEquals("\"%country\"", alias.quoted());

        GroupAlias decoded = GroupAlias.decode("%country");
        assertEquals("country", decoded.value());
        assertFalse(decoded.isCustom());
        assertNull(decoded.operator());
        assertNull(decoded.literal());
    }

    @Test
    public void testCustomAliasRoundTrip() {
        GroupAlias alias = GroupAlias.custom("amount", FilterOperator.GREATER_THAN, 100);
        assertEquals("%amount|greater than|100", alias.encode());

        GroupAlias decoded = GroupAlias.decode(alias.encode());
        assertEquals(alias, decoded);
        assertTrue(decoded.isCustom());
        assertEquals("greater than 100", decoded.label());
    }

    @Test
    public void testListAndNullLiterals() {
        GroupAlias between = GroupAlias.custom("amount", FilterOperator.BETWEEN, List.of(1, 10));
        assertEquals("%amount|between|1,10", between.encode());
        assertEquals(between, GroupAlias.decode(between.encode()));

        GroupAlias isNull = GroupAlias.custom("coupon", FilterOperator.IS_NULL, null);
        assertEquals("%coupon|is null|", isNull.encode());
        assertEquals(isNull, GroupAlias.decode(isNull.encode()));
        assertEquals("is null", isNull.label());
    }

    @Test
    public void testEveryPrintableAsciiValueRoundTrips() {
        // 除保留字符外的全部可打印 ASCII
        StringBuilder value = new StringBuilder();
        for (char c = 0x20; c < 0x7f; c++) {
            if (c != '%' && c != '|' && c != '"' && c != '\'' && c != '`' && c != '\\') {
                value.append(c);
            }
        }
        String groupValue = value.toString().trim();
        GroupAlias alias = GroupAlias.custom(groupValue, FilterOperator.EQUALS, "a b.c");
        assertEquals(alias, GroupAlias.decode(alias.encode()));
        assertEquals(GroupAlias.raw(groupValue), GroupAlias.decode(GroupAlias.raw(groupValue).encode()));
    }

    @Test
    public void testRejectsDelimiterInValues() {
        assertThrows(InvalidQueryException.class, () -> GroupAlias.raw("a|b"));
        assertThrows(InvalidQueryException.class, () -> GroupAlias.raw("%a"));
        assertThrows(InvalidQueryException.class,
                () -> GroupAlias.custom("amount", FilterOperator.EQUALS, "x|y"));
        assertThrows(InvalidQueryException.class,
                () -> GroupAlias.custom("amount", FilterOperator.EQUALS, "1\" AS x, (SELECT 1) AS \"y"));
    }

    @Test
    public void testDecodeRejectsMalformedColumns() {
        assertTrue(GroupAlias.isGroupColumn("%a"));
        assertFalse(GroupAlias.isGroupColumn("date"));
        assertThrows(IllegalArgumentException.class, () -> GroupAlias.decode("country"));
        assertThrows(IllegalArgumentException.class, () -> GroupAlias.decode("%a|b"));
    }
}
