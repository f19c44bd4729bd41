package io.datapillar.openlineage.extractor.sql;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectExpressionItem;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.WithItem;

/**
 * 列级血缘解析
 * <p>
 * 只处理单个 SELECT（无 UNION）的投影列：
 * 输出列名取 INSERT 显式列、别名或列名；来源列按表别名或唯一的 FROM 表确定所属表。
 * 无法确定来源表的列（子查询、CTE、多表下未限定的列）以及 {@code *} 不输出。
 */
class ColumnLineageResolver {

    /**
     * @param select        查询
     * @param targetColumns INSERT 显式列出的目标列，没有时为空
     * @return 输出列 -> 来源列
     */
    Map<String, Set<SqlColumn>> resolve(Select select, List<String> targetColumns) {
        if (select == null || !(select.getSelectBody() instanceof PlainSelect plainSelect)) {
            return Map.of();
        }
        Scope scope = new Scope(cteNames(select));
        scope.add(plainSelect.getFromItem());
        if (plainSelect.getJoins() != null) {
            for (Join join : plainSelect.getJoins()) {
                scope.add(join.getRightItem());
            }
        }

        List<SelectItem> items = plainSelect.getSelectItems();
        Map<String, Set<SqlColumn>> lineage = new LinkedHashMap<>();
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof SelectExpressionItem item)) {
                // 展开 * 需要表结构，显式列位置也随之失效
                if (!targetColumns.isEmpty()) {
                    return Map.of();
                }
                continue;
            }
            String output = outputColumn(item, i, targetColumns);
            if (output == null) {
                continue;
            }
            Set<SqlColumn> sources = sourceColumns(item.getExpression(), scope);
            if (!sources.isEmpty()) {
                lineage.computeIfAbsent(output, key -> new LinkedHashSet<>()).addAll(sources);
            }
        }
        return lineage;
    }

    private static String outputColumn(SelectExpressionItem item, int index, List<String> targetColumns) {
        if (!targetColumns.isEmpty()) {
            return index < targetColumns.size() ? targetColumns.get(index) : null;
        }
        if (item.getAlias() != null && item.getAlias().getName() != null) {
            return SqlTableParser.normalize(item.getAlias().getName());
        }
        if (item.getExpression() instanceof Column column) {
            return SqlTableParser.normalize(column.getColumnName());
        }
        return null;
    }

    private static Set<SqlColumn> sourceColumns(Expression expression, Scope scope) {
        Set<SqlColumn> columns = new LinkedHashSet<>();
        expression.accept(new ExpressionVisitorAdapter() {
            @Override
            public void visit(Column column) {
                SqlColumn source = scope.resolve(column);
                if (source != null) {
                    columns.add(source);
                }
            }
        });
        return columns;
    }

    private static Set<String> cteNames(Select select) {
        Set<String> names = new HashSet<>();
        if (select.getWithItemsList() != null) {
            for (WithItem withItem : select.getWithItemsList()) {
                names.add(SqlTableParser.normalize(withItem.getName()).toLowerCase());
            }
        }
        return names;
    }

    /**
     * FROM 子句中可见的表
     */
    private static final class Scope {

        private final Set<String> cteNames;

        /**
         * 别名 / 表名（小写） -> 表全名
         */
        private final Map<String, String> tables = new HashMap<>();

        private final List<String> sources = new ArrayList<>();

        /**
         * FROM 中存在子查询或 CTE
         */
        private boolean opaque;

        private Scope(Set<String> cteNames) {
            this.cteNames = cteNames;
        }

        private void add(FromItem fromItem) {
            if (!(fromItem instanceof Table table)) {
                opaque = opaque || fromItem != null;
                return;
            }
            String name = SqlTableParser.normalize(table.getFullyQualifiedName());
            if (cteNames.contains(name.toLowerCase())) {
                opaque = true;
                return;
            }
            sources.add(name);
            tables.put(name.toLowerCase(), name);
            tables.put(SqlTableParser.normalize(table.getName()).toLowerCase(), name);
            if (table.getAlias() != null && table.getAlias().getName() != null) {
                tables.put(SqlTableParser.normalize(table.getAlias().getName()).toLowerCase(), name);
            }
        }

        private SqlColumn resolve(Column column) {
            String columnName = SqlTableParser.normalize(column.getColumnName());
            Table qualifier = column.getTable();
            if (qualifier == null || qualifier.getName() == null) {
                if (opaque || sources.size() != 1) {
                    return null;
                }
                return new SqlColumn(sources.get(0), columnName);
            }
            String table = tables.get(SqlTableParser.normalize(qualifier.getFullyQualifiedName()).toLowerCase());
            return table == null ? null : new SqlColumn(table, columnName);
        }
    }
}
