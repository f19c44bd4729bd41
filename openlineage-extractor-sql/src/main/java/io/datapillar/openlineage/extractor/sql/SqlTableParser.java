package io.datapillar.openlineage.extractor.sql;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.merge.Merge;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 基于 JSqlParser 的表级血缘解析
 * <p>
 * 规则：
 * 1. FROM / JOIN / 子查询中读取的表为输入
 * 2. WITH 定义的 CTE 别名不是数据集
 * 3. INSERT、CREATE TABLE、UPDATE、DELETE、MERGE 的目标表以及 SELECT INTO 的表为输出
 * 4. INSERT ... SELECT 读取自身目标表时，目标表同时是输入
 * 5. INSERT ... SELECT / CREATE TABLE AS 额外给出列级血缘，见 {@link ColumnLineageResolver}
 * <p>
 * 表名去掉引号、反引号和方括号。无状态，可并发使用。
 */
public class SqlTableParser {

    private static final Logger log = LoggerFactory.getLogger(SqlTableParser.class);

    private final ColumnLineageResolver columnResolver = new ColumnLineageResolver();

    /**
     * 解析一条或多条（分号分隔）SQL
     *
     * @param sql SQL 文本
     * @return 表级血缘，空白 SQL 返回空血缘
     * @throws SqlParseException SQL 无法解析
     */
    public SqlLineage parse(String sql) throws SqlParseException {
        if (sql == null || sql.isBlank()) {
            return SqlLineage.empty();
        }

        List<Statement> statements;
        try {
            statements = CCJSqlParserUtil.parseStatements(sql).getStatements();
        } catch (JSQLParserException e) {
            throw new SqlParseException("SQL 解析失败: " + abbreviate(sql), e);
        }

        Set<String> inputs = new LinkedHashSet<>();
        Set<String> outputs = new LinkedHashSet<>();
        Map<String, Map<String, Set<SqlColumn>>> columnLineage = new LinkedHashMap<>();
        for (Statement statement : statements) {
            List<String> statementOutputs = outputTables(statement);
            inputs.addAll(inputTables(statement, statementOutputs));
            outputs.addAll(statementOutputs);
            collectColumnLineage(statement, columnLineage);
        }
        return new SqlLineage(new ArrayList<>(inputs), new ArrayList<>(outputs), columnLineage);
    }

    private void collectColumnLineage(Statement statement, Map<String, Map<String, Set<SqlColumn>>> columnLineage) {
        Table target;
        Select select;
        List<String> targetColumns = new ArrayList<>();
        if (statement instanceof Insert insert) {
            target = insert.getTable();
            select = insert.getSelect();
            if (insert.getColumns() != null) {
                for (Column column : insert.getColumns()) {
                    targetColumns.add(normalize(column.getColumnName()));
                }
            }
        } else if (statement instanceof CreateTable createTable) {
            target = createTable.getTable();
            select = createTable.getSelect();
        } else {
            return;
        }
        if (target == null || select == null) {
            return;
        }

        Map<String, Set<SqlColumn>> columns = columnResolver.resolve(select, targetColumns);
        if (columns.isEmpty()) {
            return;
        }
        Map<String, Set<SqlColumn>> merged =
                columnLineage.computeIfAbsent(normalize(target.getFullyQualifiedName()), key -> new LinkedHashMap<>());
        columns.forEach((column, sources) ->
                merged.computeIfAbsent(column, key -> new LinkedHashSet<>()).addAll(sources));
    }

    private List<String> outputTables(Statement statement) {
        List<Table> targets = new ArrayList<>();
        if (statement instanceof Insert insert) {
            targets.add(insert.getTable());
        } else if (statement instanceof CreateTable createTable) {
            targets.add(createTable.getTable());
        } else if (statement instanceof Update update) {
            targets.add(update.getTable());
        } else if (statement instanceof Delete delete) {
            targets.add(delete.getTable());
        } else if (statement instanceof Merge merge) {
            targets.add(merge.getTable());
        } else if (statement instanceof Select select
                && select.getSelectBody() instanceof PlainSelect plainSelect
                && plainSelect.getIntoTables() != null) {
            // SELECT ... INTO t
            targets.addAll(plainSelect.getIntoTables());
        }

        List<String> tables = new ArrayList<>(targets.size());
        for (Table target : targets) {
            if (target != null) {
                tables.add(normalize(target.getFullyQualifiedName()));
            }
        }
        return tables;
    }

    /**
     * 语句读取的表
     * <p>
     * INSERT / CREATE TABLE 只扫描其查询部分，目标表被自身查询读取时仍计为输入；
     * 其余语句的目标表会被 TablesNamesFinder 一并找到，需要排除。
     */
    private List<String> inputTables(Statement statement, List<String> statementOutputs) {
        if (statement instanceof Insert insert) {
            // INSERT ... VALUES 没有输入
            return insert.getSelect() == null ? List.of() : findTables(insert.getSelect());
        }
        if (statement instanceof CreateTable createTable) {
            return createTable.getSelect() == null ? List.of() : findTables(createTable.getSelect());
        }

        List<String> tables = new ArrayList<>();
        for (String table : findTables(statement)) {
            if (!statementOutputs.contains(table)) {
                tables.add(table);
            }
        }
        return tables;
    }

    private List<String> findTables(Statement statement) {
        try {
            List<String> tables = new ArrayList<>();
            for (String table : new TablesNamesFinder().getTableList(statement)) {
                tables.add(normalize(table));
            }
            return tables;
        } catch (UnsupportedOperationException e) {
            log.debug("不支持从该语句提取表: {}", statement.getClass().getSimpleName());
            return List.of();
        }
    }

    static String normalize(String tableName) {
        StringBuilder normalized = new StringBuilder(tableName.length());
        for (char c : tableName.toCharArray()) {
            if (c != '`' && c != '"' && c != '[' && c != ']') {
                normalized.append(c);
            }
        }
        return normalized.toString().trim();
    }

    private static String abbreviate(String sql) {
        String compact = sql.replaceAll("\\s+", " ").trim();
        int maxLength = 120;
        return compact.length() <= maxLength ? compact : compact.substring(0, maxLength) + "...";
    }
}
