package com.baykanat.insider.warehouse.domain.catalog;

import java.math.BigDecimal;
import java.sql.Types;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/** Sorgu parametre tipleri; HTTP'den gelen String değerler parse edilir, diğer uyumsuz Java tipleri reddedilir. */
public enum ParameterType {

    INTEGER(Types.INTEGER) {
        @Override
        Object convert(Object raw) {
            if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
                return ((Number) raw).intValue();
            }
            if (raw instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                return l.intValue();
            }
            if (raw instanceof String s) {
                return Integer.valueOf(s.trim());
            }
            throw mismatch(raw);
        }
    },
    LONG(Types.BIGINT) {
        @Override
        Object convert(Object raw) {
            if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
                return ((Number) raw).longValue();
            }
            if (raw instanceof String s) {
                return Long.valueOf(s.trim());
            }
            throw mismatch(raw);
        }
    },
    DECIMAL(Types.NUMERIC) {
        @Override
        Object convert(Object raw) {
            if (raw instanceof BigDecimal d) {
                return d;
            }
            if (raw instanceof Number n) {
                return new BigDecimal(n.toString());
            }
            if (raw instanceof String s) {
                return new BigDecimal(s.trim());
            }
            throw mismatch(raw);
        }
    },
    STRING(Types.VARCHAR) {
        @Override
        Object convert(Object raw) {
            if (raw instanceof String s) {
                return s;
            }
            throw mismatch(raw);
        }
    },
    BOOLEAN(Types.BOOLEAN) {
        @Override
        Object convert(Object raw) {
            if (raw instanceof Boolean b) {
                return b;
            }
            if (raw instanceof String s) {
                String v = s.trim().toLowerCase();
                if ("true".equals(v) || "false".equals(v)) {
                    return Boolean.valueOf(v);
                }
            }
            throw mismatch(raw);
        }
    },
    DATE(Types.DATE) {
        @Override
        Object convert(Object raw) {
            if (raw instanceof LocalDate d) {
                return d;
            }
            if (raw instanceof String s) {
                return LocalDate.parse(s.trim());
            }
            throw mismatch(raw);
        }
    };

    private final int sqlType;

    ParameterType(int sqlType) {
        this.sqlType = sqlType;
    }

    /** JDBC bind tipi; null değerlerin tipli bağlanması için. */
    public int sqlType() {
        return sqlType;
    }

    /** Ham değeri bu tipe çevirir; uyumsuzsa IllegalArgumentException. */
    public Object coerce(Object raw) {
        try {
            return convert(raw);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("expected " + name().toLowerCase() + " but got '" + raw + "'");
        }
    }

    abstract Object convert(Object raw);

    IllegalArgumentException mismatch(Object raw) {
        return new IllegalArgumentException("expected " + name().toLowerCase() + " but got "
                + raw.getClass().getSimpleName());
    }
}
