package io.datapillar.openlineage.extractor;

import io.datapillar.openlineage.extractor.exception.MismatchedExtractorException;
import io.datapillar.openlineage.extractor.model.Dataset;
import io.datapillar.openlineage.extractor.model.TaskMetadata;
import io.datapillar.openlineage.extractor.task.DefaultTask;
import io.datapillar.openlineage.extractor.task.LineageAwareTask;
import io.datapillar.openlineage.extractor.task.TaskRun;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultExtractorTest {

    @Test
    void shouldDelegateToLineageAwareTask() {
        LineageAwareTask task = mock(LineageAwareTask.class);
        TaskMetadata onStart = TaskMetadata.of("export", List.of(Dataset.of("mysql://db:3306", "shop.orders")), List.of());
        TaskMetadata onComplete = onStart.toBuilder()
                .outputs(List.of(Dataset.of("s3://exports", "orders/2026-10-19.parquet")))
                .build();
        when(task.getTaskType()).thenReturn("ExportOperator");
        TaskRun run = TaskRun.builder().task(task).runId("run-7").build();
        when(task.getLineageOnStart()).thenReturn(Optional.of(onStart));
        when(task.getLineageOnComplete(run)).thenReturn(Optional.of(onComplete));

        DefaultExtractor extractor = new DefaultExtractor();
        extractor.bind(task);
        extractor.validate();

        Assertions.assertEquals(Optional.of(onStart), extractor.extract());
        Assertions.assertEquals(Optional.of(onComplete), extractor.extractOnComplete(run));
        verify(task).getLineageOnComplete(run);
    }

    @Test
    void shouldRejectPlainTask() {
        DefaultExtractor extractor = new DefaultExtractor();
        extractor.bind(DefaultTask.builder().taskId("t1").taskType("BashOperator").config(Map.of()).build());

        Assertions.assertThrows(MismatchedExtractorException.class, extractor::validate);
        Assertions.assertTrue(extractor.getSupportedTaskTypes().isEmpty());
    }
}
