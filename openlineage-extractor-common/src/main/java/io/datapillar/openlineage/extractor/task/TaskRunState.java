package io.datapillar.openlineage.extractor.task;

/**
 * 任务运行结束时的状态
 */
public enum TaskRunState {

    SUCCESS,

    FAILED,

    SKIPPED,

    UP_FOR_RETRY;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
