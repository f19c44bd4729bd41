package io.datapillar.openlineage.extractor.sql;

import io.datapillar.openlineage.extractor.ExtractionDispatcher;
import io.datapillar.openlineage.extractor.ExtractorConfig;
import io.datapillar.openlineage.extractor.ExtractorProvider;
import io.datapillar.openlineage.extractor.ExtractorRegistry;
import io.datapillar.openlineage.extractor.model.Dataset;
import io.datapillar.openlineage.extractor.model.TaskMetadata;
import io.datapillar.openlineage.extractor.task.DefaultTask;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pf4j.PluginManager;

import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SqlExtractorProviderTest {

    @Mock
    private PluginManager pluginManager;

    @Test
    void shouldRegisterSqlExtractors() {
        ExtractorRegistry registry = new ExtractorRegistry();

        new SqlExtractorProvider().registerExtractors(registry);

        Assertions.assertEquals(PostgresExtractor.class, registry.getExtractorClass("PostgresOperator"));
        Assertions.assertEquals(BigQueryExtractor.class, registry.getExtractorClass("BigQueryOperator"));
        Assertions.assertEquals(BigQueryExtractor.class, registry.getExtractorClass("BigQueryExecuteQueryOperator"));
        Assertions.assertEquals(4, registry.size());
    }

    @Test
    void shouldDispatchThroughPluginRegistry() {
        when(pluginManager.getExtensions(ExtractorProvider.class)).thenReturn(List.of(new SqlExtractorProvider()));
        ExtractorRegistry registry = ExtractorRegistry.fromConfig(ExtractorConfig.defaults(), pluginManager);

        try (ExtractionDispatcher dispatcher = new ExtractionDispatcher(registry, ExtractorConfig.defaults())) {
            TaskMetadata metadata = dispatcher.extractOnStart(DefaultTask.builder()
                    .taskId("copy_orders")
                    .taskType("BigQueryOperator")
                    .config(Map.of("source_table", "project.ds.in", "destination_table", "project.ds.out"))
                    .build()).orElseThrow();

            Assertions.assertEquals(List.of(Dataset.of("bigquery", "project.ds.in")), metadata.inputs());
            Assertions.assertEquals(List.of(Dataset.of("bigquery", "project.ds.out")), metadata.outputs());

            Assertions.assertTrue(dispatcher.extractOnStart(DefaultTask.builder()
                    .taskId("broken_sql")
                    .taskType("PostgresOperator")
                    .config(Map.of("sql", "SELEC * FORM orders", "host", "db"))
                    .build()).isEmpty());
        }
    }
}
