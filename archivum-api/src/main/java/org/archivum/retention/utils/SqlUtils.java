package org.archivum.retention.utils;

import org.springframework.r2dbc.core.DatabaseClient;

public class SqlUtils {

    private SqlUtils() {
    }

    public static DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec, String name,
                                                                 Object value, Class<?> type) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, type);
    }

    public static boolean isFirst(boolean first, StringBuilder sql) {
        if (first) {
            sql.append(" WHERE ");
        } else {
            sql.append(" AND ");
        }
        return false;
    }
}
