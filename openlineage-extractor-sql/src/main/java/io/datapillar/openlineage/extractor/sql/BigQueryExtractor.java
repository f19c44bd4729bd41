package io.datapillar.openlineage.extractor.sql;

import io.datapillar.openlineage.extractor.SupportedTaskTypes;
import io.datapillar.openlineage.extractor.model.TaskMetadata;
import io.datapillar.openlineage.extractor.task.TaskRun;
import io.openlineage.client.OpenLineage;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * BigQuery 任务 Extractor
 * <p>
 * BigQueryOperator 已废弃，仅继承 BigQueryExecuteQueryOperator，两者共用此 Extractor。
 * <p>
 * 任务配置：
 * - sql: 查询 SQL（可选）
 * - source_table / source_tables: 源表，字符串或列表
 * - destination_table: 目标表
 * <p>
 * 表名统一为 {@code project.dataset.table}，兼容旧格式 {@code project:dataset.table}。
 * 任务成功完成且运行结果带 {@code job_id} 时追加 externalQuery run facet。
 */
@SupportedTaskTypes({"BigQueryOperator", "BigQueryExecuteQueryOperator", "BigQueryInsertJobOperator"})
public class BigQueryExtractor extends SqlExtractor {

    public static final String NAMESPACE = "bigquery";

    public static final String SOURCE_TABLE = "source_table";
    public static final String SOURCE_TABLES = "source_tables";
    public static final String DESTINATION_TABLE = "destination_table";

    /** 运行结果中的 BigQuery 作业 ID。 */
    public static final String JOB_ID = "job_id";

    public static final String EXTERNAL_QUERY_FACET = "externalQuery";

    @Override
    protected String getNamespace() {
        return NAMESPACE;
    }

    @Override
    protected String toDatasetName(String table) {
        return table.replace("`", "").trim().replace(':', '.');
    }

    @Override
    protected Collection<String> getConfiguredInputs() {
        List<String> tables = new ArrayList<>(getConfigStrings(SOURCE_TABLE));
        tables.addAll(getConfigStrings(SOURCE_TABLES));
        return tables;
    }

    @Override
    protected Collection<String> getConfiguredOutputs() {
        return getConfigStrings(DESTINATION_TABLE);
    }

    @Override
    public Optional<TaskMetadata> extractOnComplete(TaskRun run) {
        Optional<TaskMetadata> metadata = extract();
        String jobId = run.resultAsString(JOB_ID);
        // 只有成功完成的作业才记录外部查询
        if (metadata.isEmpty() || jobId == null || !run.state().isSuccess()) {
            return metadata;
        }
        OpenLineage.ExternalQueryRunFacet externalQuery = OPEN_LINEAGE.newExternalQueryRunFacetBuilder()
                .externalQueryId(jobId)
                .source(NAMESPACE)
                .build();
        Map<String, OpenLineage.RunFacet> runFacets = new LinkedHashMap<>(metadata.get().runFacets());
        runFacets.put(EXTERNAL_QUERY_FACET, externalQuery);
        return Optional.of(metadata.get().toBuilder().runFacets(runFacets).build());
    }
}
