package io.datapillar.openlineage.extractor.task;

import io.datapillar.openlineage.extractor.model.TaskMetadata;
import java.util.Optional;

/**
 * 能自行描述血缘的任务
 * <p>
 * 没有专用 Extractor 的任务可实现此接口，由 {@link io.datapillar.openlineage.extractor.DefaultExtractor} 兜底提取
 */
public interface LineageAwareTask extends Task {

    /**
     * 运行前可得的血缘信息
     */
    Optional<TaskMetadata> getLineageOnStart();

    /**
     * 运行完成后的血缘信息，默认与运行前一致
     */
    default Optional<TaskMetadata> getLineageOnComplete(TaskRun run) {
        return getLineageOnStart();
    }
}
