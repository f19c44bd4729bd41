package io.datapillar.openlineage.extractor.sql;

/**
 * 表中的一列
 *
 * @param table  表名（已去除引号）
 * @param column 列名
 */
public record SqlColumn(String table, String column) {
}
