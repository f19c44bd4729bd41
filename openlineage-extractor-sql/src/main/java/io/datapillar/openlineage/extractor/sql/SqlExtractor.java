package io.datapillar.openlineage.extractor.sql;

import io.datapillar.openlineage.extractor.BaseExtractor;
import io.datapillar.openlineage.extractor.ExtractorConfig;
import io.datapillar.openlineage.extractor.model.Dataset;
import io.datapillar.openlineage.extractor.model.TaskMetadata;
import io.openlineage.client.OpenLineage;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 执行 SQL 的任务的 Extractor 基类
 * <p>
 * 从任务配置的 {@code sql}（字符串或字符串列表）解析输入输出表，
 * 映射为子类命名空间下的数据集，并附带 OpenLineage {@code sql} job facet；
 * 能解析出列级血缘的输出表带 {@code columnLineage} dataset facet。
 * <p>
 * SQL 缺失、无法解析或没有任何表时返回无元数据。
 */
public abstract class SqlExtractor extends BaseExtractor {

    public static final String SQL = "sql";

    public static final String SQL_FACET = "sql";

    public static final String COLUMN_LINEAGE_FACET = "columnLineage";

    protected static final OpenLineage OPEN_LINEAGE = new OpenLineage(ExtractorConfig.PRODUCER_URI);

    private final SqlTableParser parser = new SqlTableParser();

    /**
     * 同一实例多次提取复用同一个 facet
     */
    private OpenLineage.SQLJobFacet sqlFacet;

    private String columnFacetsKey;

    private Map<String, OpenLineage.ColumnLineageDatasetFacet> columnFacets;

    /**
     * 数据集命名空间
     *
     * @return 命名空间，连接信息不足时返回 null
     */
    protected abstract String getNamespace();

    /**
     * 表名 -> 数据集名称，默认原样返回
     */
    protected String toDatasetName(String table) {
        return table;
    }

    /**
     * 配置中直接声明的输入表
     */
    protected Collection<String> getConfiguredInputs() {
        return List.of();
    }

    /**
     * 配置中直接声明的输出表
     */
    protected Collection<String> getConfiguredOutputs() {
        return List.of();
    }

    @Override
    public Optional<TaskMetadata> extract() {
        String taskId = getTask().getTaskId();
        String namespace = getNamespace();
        if (namespace == null) {
            log.warn("缺少连接信息，无法确定数据集命名空间: taskId={}", taskId);
            return Optional.empty();
        }

        String sql = getSql();
        Set<String> inputs = new LinkedHashSet<>();
        Set<String> outputs = new LinkedHashSet<>();
        SqlLineage lineage = SqlLineage.empty();
        if (sql != null) {
            try {
                lineage = parser.parse(sql);
                inputs.addAll(lineage.inputs());
                outputs.addAll(lineage.outputs());
            } catch (SqlParseException e) {
                log.warn("SQL 解析失败，忽略 SQL 血缘: taskId={}, error={}", taskId, e.getMessage());
            }
        }
        inputs.addAll(getConfiguredInputs());
        outputs.addAll(getConfiguredOutputs());

        if (inputs.isEmpty() && outputs.isEmpty()) {
            log.debug("未提取到任何表: taskId={}", taskId);
            return Optional.empty();
        }

        TaskMetadata.TaskMetadataBuilder metadata = TaskMetadata.builder()
                .name(taskId)
                .inputs(toDatasets(namespace, inputs))
                .outputs(toOutputDatasets(namespace, outputs, columnLineageFacets(namespace, sql, lineage)));
        if (sql != null) {
            metadata.jobFacets(Map.of(SQL_FACET, sqlFacet(sql)));
        }
        return Optional.of(metadata.build());
    }

    /**
     * 读取任务 SQL，多条时以分号拼接
     *
     * @return SQL，未配置时返回 null
     */
    protected String getSql() {
        List<String> statements = getConfigStrings(SQL);
        if (statements.isEmpty()) {
            return null;
        }
        return String.join(";\n", statements);
    }

    private List<Dataset> toDatasets(String namespace, Collection<String> tables) {
        List<Dataset> datasets = new ArrayList<>(tables.size());
        for (String table : tables) {
            datasets.add(Dataset.of(namespace, toDatasetName(table)));
        }
        return datasets;
    }

    private List<Dataset> toOutputDatasets(String namespace, Collection<String> tables,
                                           Map<String, OpenLineage.ColumnLineageDatasetFacet> columnFacets) {
        List<Dataset> datasets = new ArrayList<>(tables.size());
        for (String table : tables) {
            OpenLineage.ColumnLineageDatasetFacet columnFacet = columnFacets.get(table);
            datasets.add(Dataset.builder()
                    .namespace(namespace)
                    .name(toDatasetName(table))
                    .facets(columnFacet == null ? null : Map.of(COLUMN_LINEAGE_FACET, columnFacet))
                    .build());
        }
        return datasets;
    }

    /**
     * 输出表 -> columnLineage facet，同一 SQL 复用已构建的 facet
     */
    private Map<String, OpenLineage.ColumnLineageDatasetFacet> columnLineageFacets(String namespace,
                                                                                String sql,
                                                                                SqlLineage lineage) {
        if (sql == null || lineage.columnLineage().isEmpty()) {
            return Map.of();
        }
        String key = namespace + "\n" + sql;
        if (key.equals(columnFacetsKey)) {
            return columnFacets;
        }

        Map<String, OpenLineage.ColumnLineageDatasetFacet> facets = new LinkedHashMap<>();
        lineage.columnLineage().forEach((table, columns) -> {
            OpenLineage.ColumnLineageDatasetFacetFieldsBuilder fields =
                    OPEN_LINEAGE.newColumnLineageDatasetFacetFieldsBuilder();
            columns.forEach((column, sources) -> {
                List<OpenLineage.InputField> inputFields = new ArrayList<>(sources.size());
                for (SqlColumn source : sources) {
                    inputFields.add(OPEN_LINEAGE.newInputFieldBuilder()
                            .namespace(namespace)
                            .name(toDatasetName(source.table()))
                            .field(source.column())
                            .build());
                }
                fields.put(column, OPEN_LINEAGE.newColumnLineageDatasetFacetFieldsAdditionalBuilder()
                        .inputFields(inputFields)
                        .build());
            });
            facets.put(table, OPEN_LINEAGE.newColumnLineageDatasetFacetBuilder().fields(fields.build()).build());
        });
        columnFacetsKey = key;
        columnFacets = facets;
        return facets;
    }

    private OpenLineage.SQLJobFacet sqlFacet(String sql) {
        if (sqlFacet == null || !sql.equals(sqlFacet.getQuery())) {
            sqlFacet = OPEN_LINEAGE.newSQLJobFacetBuilder().query(sql).build();
        }
        return sqlFacet;
    }
}
