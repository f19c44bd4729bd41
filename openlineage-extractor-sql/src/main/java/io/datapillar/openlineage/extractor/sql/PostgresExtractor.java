package io.datapillar.openlineage.extractor.sql;

import io.datapillar.openlineage.extractor.SupportedTaskTypes;

/**
 * PostgreSQL 任务 Extractor
 * <p>
 * 任务配置：
 * - sql: 执行的 SQL
 * - host / port: 数据库地址，port 默认 5432
 * - database: 数据库名，用于补全数据集名称
 * - namespace: 直接指定命名空间，优先于 host / port
 * <p>
 * 数据集名称为 {@code database.schema.table}，未带 schema 的表补 {@code public}。
 */
@SupportedTaskTypes({"PostgresOperator"})
public class PostgresExtractor extends SqlExtractor {

    public static final String HOST = "host";
    public static final String PORT = "port";
    public static final String DATABASE = "database";
    public static final String NAMESPACE = "namespace";

    static final String DEFAULT_PORT = "5432";
    static final String DEFAULT_SCHEMA = "public";

    @Override
    protected String getNamespace() {
        String namespace = getConfigString(NAMESPACE);
        if (namespace != null) {
            return namespace;
        }
        String host = getConfigString(HOST);
        if (host == null) {
            return null;
        }
        String port = getConfigString(PORT);
        return String.format("postgres://%s:%s", host, port == null ? DEFAULT_PORT : port);
    }

    @Override
    protected String toDatasetName(String table) {
        String qualified = table.indexOf('.') < 0 ? DEFAULT_SCHEMA + "." + table : table;
        String database = getConfigString(DATABASE);
        // database.schema.table 已是完整名称
        if (database == null || qualified.split("\\.").length >= 3) {
            return qualified;
        }
        return database + "." + qualified;
    }
}
