package com.asiainfo.insights.core.generator;

import com.asiainfo.insights.core.exception.InvalidQueryException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 经过白名单校验的 SQL 标识符 (表名/列名/别名)。
 * 标识符无法作为绑定参数传递，所有拼入 SQL 文本的名字都必须经过这里
 */
public final class SafeIdentifier {

    private static final int MAX_LENGTH = 128;

    // quotes, backslash, the group alias prefix/delimiter and control characters
    private static final Pattern FORBIDDEN = Pattern.compile("[\"'`\\\\%|\\p{Cntrl}]");

    private final List<String> parts;

    private SafeIdentifier(List<String> parts) {
        this.parts = parts;
    }

    /**
     * A single identifier; dots are part of the name.
     */
    public static SafeIdentifier of(String name) {
        return new SafeIdentifier(List.of(validate(name)));
    }

    /**
     * A possibly schema-qualified table name such as {@code analytics.events}.
     */
    public static SafeIdentifier table(String name) {
        if (name == null) {
            throw new InvalidQueryException("Identifier must not be null");
        }
        List<String> parts = new ArrayList<>();
        for (String part : name.split("\\.", -1)) {
            parts.add(validate(part));
        }
        return new SafeIdentifier(List.copyOf(parts));
    }

    public static boolean isSafe(String name) {
        return name != null
                && !name.isBlank()
                && name.length() <= MAX_LENGTH
                && !FORBIDDEN.matcher(name).find();
    }

    private static String validate(String name) {
        if (!isSafe(name)) {
            throw new InvalidQueryException("Illegal identifier: " + describe(name));
        }
        return name;
    }

    private static String describe(String name) {
        if (name == null) {
            return "null";
        }
        String printable = name.replaceAll("\\p{Cntrl}", "?");
        return printable.length() > 40 ? printable.substring(0, 40) + "..." : printable;
    }

    public String name() {
        return String.join(".", parts);
    }

    /**
     * Double-quoted form; dialects translate the quote character at execution time.
     */
    public String quoted() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append('"').append(parts.get(i)).append('"');
        }
        return sb.toString();
    }

    /**
     * {@code "qualifier"."name"}
     */
    public String qualifiedBy(String qualifier) {
        return SafeIdentifier.of(qualifier).quoted() + "." + quoted();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SafeIdentifier other && parts.equals(other.parts);
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
    }

    @Override
    public String toString() {
        return quoted();
    }
}
