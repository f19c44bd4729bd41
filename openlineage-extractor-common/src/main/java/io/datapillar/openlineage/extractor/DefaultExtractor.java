package io.datapillar.openlineage.extractor;

import io.datapillar.openlineage.extractor.exception.MismatchedExtractorException;
import io.datapillar.openlineage.extractor.model.TaskMetadata;
import io.datapillar.openlineage.extractor.task.LineageAwareTask;
import io.datapillar.openlineage.extractor.task.Task;
import io.datapillar.openlineage.extractor.task.TaskRun;
import java.util.Optional;

/**
 * 兜底 Extractor
 * <p>
 * 不按类型名注册，分发器在找不到专用 Extractor 时使用，
 * 仅适用于实现了 {@link LineageAwareTask} 的任务，血缘由任务自身提供。
 */
@SupportedTaskTypes({})
public class DefaultExtractor extends BaseExtractor {

    @Override
    public void validate() {
        Task task = getTask();
        if (!(task instanceof LineageAwareTask)) {
            throw new MismatchedExtractorException(getClass(), task.getTaskType(), getSupportedTaskTypes());
        }
    }

    @Override
    public Optional<TaskMetadata> extract() {
        return lineageAwareTask().getLineageOnStart();
    }

    @Override
    public Optional<TaskMetadata> extractOnComplete(TaskRun run) {
        return lineageAwareTask().getLineageOnComplete(run);
    }

    private LineageAwareTask lineageAwareTask() {
        return (LineageAwareTask) getTask();
    }
}
