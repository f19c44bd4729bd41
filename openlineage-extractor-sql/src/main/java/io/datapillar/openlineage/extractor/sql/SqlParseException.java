package io.datapillar.openlineage.extractor.sql;

/**
 * SQL 无法解析
 * <p>
 * 属于提取内部错误，由 {@link SqlExtractor} 转换为无元数据，不向分发器传播
 */
public class SqlParseException extends Exception {

    public SqlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
