package in.digitflow.infrastructure.persistence;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row-to-map conversion for tables whose columns differ between schema generations.
 */
final class JdbcRows {

    /**
     * Current row as column label → value. SQL arrays become lists.
     */
    static Map<String, Object> toMap(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            Object value = rs.getObject(i);
            if (value instanceof Array) {
                value = Arrays.asList((Object[]) ((Array) value).getArray());
            }
            row.put(meta.getColumnLabel(i).toLowerCase(), value);
        }
        return row;
    }

    private JdbcRows() {}
}
