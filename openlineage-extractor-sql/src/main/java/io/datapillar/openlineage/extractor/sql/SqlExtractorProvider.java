package io.datapillar.openlineage.extractor.sql;

import io.datapillar.openlineage.extractor.ExtractorProvider;
import io.datapillar.openlineage.extractor.ExtractorRegistry;
import org.pf4j.Extension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SQL Extractor PF4J 插件扩展
 * <p>
 * 注册 Postgres、BigQuery 等基于 SQL 解析的 Extractor
 */
@Extension
public class SqlExtractorProvider implements ExtractorProvider {

    private static final Logger log = LoggerFactory.getLogger(SqlExtractorProvider.class);

    @Override
    public void registerExtractors(ExtractorRegistry registry) {
        log.info("注册 SQL Extractor...");

        registry.register(PostgresExtractor.class, PostgresExtractor::new);
        registry.register(BigQueryExtractor.class, BigQueryExtractor::new);

        log.info("SQL Extractor 注册完成");
    }
}
