package io.datapillar.openlineage.extractor.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SQL 解析得到的血缘
 *
 * @param inputs        读取的表，按出现顺序去重
 * @param outputs       写入的表，按出现顺序去重
 * @param columnLineage 输出表 -> 输出列 -> 来源列，只覆盖能确定来源表的列
 */
public record SqlLineage(
        List<String> inputs,
        List<String> outputs,
        Map<String, Map<String, Set<SqlColumn>>> columnLineage
) {

    public SqlLineage {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        columnLineage = copyOf(columnLineage);
    }

    public SqlLineage(List<String> inputs, List<String> outputs) {
        this(inputs, outputs, null);
    }

    public static SqlLineage empty() {
        return new SqlLineage(List.of(), List.of());
    }

    public boolean isEmpty() {
        return inputs.isEmpty() && outputs.isEmpty();
    }

    /**
     * 输出表的列级血缘
     *
     * @return 输出列 -> 来源列，没有时返回空 Map
     */
    public Map<String, Set<SqlColumn>> columnLineage(String outputTable) {
        return columnLineage.getOrDefault(outputTable, Map.of());
    }

    private static Map<String, Map<String, Set<SqlColumn>>> copyOf(
            Map<String, Map<String, Set<SqlColumn>>> columnLineage) {
        if (columnLineage == null || columnLineage.isEmpty()) {
            return Map.of();
        }
        Map<String, Map<String, Set<SqlColumn>>> tables = new LinkedHashMap<>();
        columnLineage.forEach((table, columns) -> {
            Map<String, Set<SqlColumn>> copy = new LinkedHashMap<>();
            columns.forEach((column, sources) ->
                    copy.put(column, Collections.unmodifiableSet(new LinkedHashSet<>(sources))));
            tables.put(table, Collections.unmodifiableMap(copy));
        });
        return Collections.unmodifiableMap(tables);
    }
}
