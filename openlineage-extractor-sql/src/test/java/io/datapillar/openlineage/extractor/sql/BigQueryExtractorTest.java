package io.datapillar.openlineage.extractor.sql;

import io.datapillar.openlineage.extractor.exception.MismatchedExtractorException;
import io.datapillar.openlineage.extractor.model.Dataset;
import io.datapillar.openlineage.extractor.model.TaskMetadata;
import io.datapillar.openlineage.extractor.task.DefaultTask;
import io.datapillar.openlineage.extractor.task.Task;
import io.datapillar.openlineage.extractor.task.TaskRun;
import io.datapillar.openlineage.extractor.task.TaskRunState;
import io.openlineage.client.OpenLineage;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BigQueryExtractorTest {

    private static Task copyTask(String taskType) {
        return DefaultTask.builder()
                .taskId("copy_orders")
                .taskType(taskType)
                .config(Map.of(
                        "source_table", "project.ds.in",
                        "destination_table", "project.ds.out"))
                .build();
    }

    @Test
    void shouldExtractConfiguredTables() {
        BigQueryExtractor extractor = new BigQueryExtractor();
        extractor.bind(copyTask("BigQueryOperator"));

        Assertions.assertDoesNotThrow(extractor::validate);
        TaskMetadata metadata = extractor.extract().orElseThrow();

        Assertions.assertEquals(List.of(Dataset.of("bigquery", "project.ds.in")), metadata.inputs());
        Assertions.assertEquals(List.of(Dataset.of("bigquery", "project.ds.out")), metadata.outputs());
        Assertions.assertTrue(metadata.runFacets().isEmpty());
        Assertions.assertTrue(metadata.jobFacets().isEmpty());
    }

    @Test
    void shouldRejectPostgresTask() {
        BigQueryExtractor extractor = new BigQueryExtractor();
        extractor.bind(copyTask("PostgresOperator"));

        MismatchedExtractorException exception =
                Assertions.assertThrows(MismatchedExtractorException.class, extractor::validate);
        Assertions.assertEquals("PostgresOperator", exception.getTaskType());
    }

    @Test
    void shouldSupportDeprecatedAlias() {
        Assertions.assertEquals(
                Set.of("BigQueryOperator", "BigQueryExecuteQueryOperator", "BigQueryInsertJobOperator"),
                new BigQueryExtractor().getSupportedTaskTypes());
    }

    @Test
    void shouldCombineSqlAndConfiguredTables() {
        BigQueryExtractor extractor = new BigQueryExtractor();
        extractor.bind(DefaultTask.builder()
                .taskId("aggregate")
                .taskType("BigQueryExecuteQueryOperator")
                .config(Map.of(
                        "sql", "SELECT user_id, COUNT(*) FROM `project.web.events` GROUP BY user_id",
                        "source_tables", List.of("project:web.users"),
                        "destination_table", "project.reports.user_events"))
                .build());
        extractor.validate();

        TaskMetadata metadata = extractor.extract().orElseThrow();

        Assertions.assertEquals(List.of(
                Dataset.of("bigquery", "project.web.events"),
                Dataset.of("bigquery", "project.web.users")), metadata.inputs());
        Assertions.assertEquals(List.of(Dataset.of("bigquery", "project.reports.user_events")), metadata.outputs());
        Assertions.assertInstanceOf(OpenLineage.SQLJobFacet.class, metadata.jobFacets().get("sql"));
    }

    @Test
    void shouldReturnNoMetadataWithoutDatasetInfo() {
        BigQueryExtractor extractor = new BigQueryExtractor();
        extractor.bind(DefaultTask.builder().taskId("noop").taskType("BigQueryOperator").build());
        extractor.validate();

        Assertions.assertEquals(Optional.empty(), extractor.extract());
    }

    @Test
    void shouldAddExternalQueryFacetOnCompletion() {
        Task task = copyTask("BigQueryInsertJobOperator");
        BigQueryExtractor extractor = new BigQueryExtractor();
        extractor.bind(task);
        TaskRun run = TaskRun.builder().task(task).runId("run-1").results(Map.of("job_id", "job_abc123")).build();

        TaskMetadata metadata = extractor.extractOnComplete(run).orElseThrow();

        OpenLineage.ExternalQueryRunFacet facet =
                (OpenLineage.ExternalQueryRunFacet) metadata.runFacets().get(BigQueryExtractor.EXTERNAL_QUERY_FACET);
        Assertions.assertEquals("job_abc123", facet.getExternalQueryId());
        Assertions.assertEquals("bigquery", facet.getSource());
        Assertions.assertEquals(extractor.extract().orElseThrow().inputs(), metadata.inputs());
    }

    @Test
    void shouldSkipExternalQueryFacetForUnsuccessfulRun() {
        Task task = copyTask("BigQueryInsertJobOperator");
        BigQueryExtractor extractor = new BigQueryExtractor();
        extractor.bind(task);
        TaskRun failed = TaskRun.builder()
                .task(task)
                .runId("run-2")
                .state(TaskRunState.FAILED)
                .results(Map.of("job_id", "job_failed"))
                .build();

        TaskMetadata metadata = extractor.extractOnComplete(failed).orElseThrow();

        Assertions.assertFalse(metadata.runFacets().containsKey(BigQueryExtractor.EXTERNAL_QUERY_FACET));
        Assertions.assertEquals(extractor.extract(), extractor.extractOnComplete(failed));
    }

    @Test
    void shouldMatchExtractOnCompletionWithoutJobId() {
        Task task = copyTask("BigQueryOperator");
        BigQueryExtractor extractor = new BigQueryExtractor();
        extractor.bind(task);

        Assertions.assertEquals(extractor.extract(),
                extractor.extractOnComplete(TaskRun.builder().task(task).runId("run-1").build()));
    }
}
