package com.youtubestats;

import org.apache.spark.sql.types.DataType;
import org.apache.spark.sql.types.DataTypes;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Closed set of column types a text value can be coerced to.
 */
public enum TargetType {
    
    STRING("string", DataTypes.StringType) {
        @Override
        public Object coerce(String field, String value) {
            return value;
        }
    },
    
    BIGINT("bigint", DataTypes.LongType) {
        @Override
        public Object coerce(String field, String value) {
            String trimmed = value == null ? "" : value.trim();
            if (!DECIMAL_INTEGER.matcher(trimmed).matches()) {
                throw rejected(field, value);
            }
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                // digits only, so this is an overflow
                throw new TypeCoercionException(
                    "Field '" + field + "' value '" + value + "' is out of range for " + getName(), e);
            }
        }
    },
    
    BOOLEAN("boolean", DataTypes.BooleanType) {
        @Override
        public Object coerce(String field, String value) {
            String trimmed = value == null ? "" : value.trim();
            if ("true".equalsIgnoreCase(trimmed)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(trimmed)) {
                return Boolean.FALSE;
            }
            throw rejected(field, value);
        }
    };
    
    private static final Pattern DECIMAL_INTEGER = Pattern.compile("[+-]?[0-9]+");
    
    private final String name;
    private final DataType sparkType;
    
    TargetType(String name, DataType sparkType) {
        this.name = name;
        this.sparkType = sparkType;
    }
    
    /**
     * Converts the raw text of {@code field} to this type.
     *
     * @throws TypeCoercionException if the text is not a valid literal of this type
     */
    public abstract Object coerce(String field, String value);
    
    public String getName() {
        return name;
    }
    
    public DataType getSparkType() {
        return sparkType;
    }
    
    TypeCoercionException rejected(String field, String value) {
        String shown = value == null ? "null" : "'" + value + "'";
        return new TypeCoercionException("Field '" + field + "' value " + shown + " cannot be coerced to " + name);
    }
    
    /**
     * Parses a type tag as written in mapping tables ({@code string}, {@code bigint},
     * {@code long}, {@code boolean}).
     */
    public static TargetType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Type name is null");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "string":
                return STRING;
            case "bigint":
            case "long":
                return BIGINT;
            case "boolean":
                return BOOLEAN;
            default:
                throw new IllegalArgumentException("Unsupported type: " + name);
        }
    }
}
