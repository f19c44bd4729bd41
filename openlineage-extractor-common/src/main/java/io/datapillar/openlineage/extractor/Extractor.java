package io.datapillar.openlineage.extractor;

import io.datapillar.openlineage.extractor.exception.MismatchedExtractorException;
import io.datapillar.openlineage.extractor.model.TaskMetadata;
import io.datapillar.openlineage.extractor.task.Task;
import io.datapillar.openlineage.extractor.task.TaskRun;
import java.util.Optional;
import java.util.Set;

/**
 * 任务血缘元数据提取器
 * <p>
 * 每种任务类型族一个实现，每次任务执行一个实例，不跨执行复用。
 * <p>
 * 生命周期：
 * 构造（无副作用）→ bind（仅一次）→ validate（可选，可重复）→ extract / extractOnComplete（0~2 次）→ 丢弃
 * <p>
 * bind 必须在 validate、extract 之前完成。
 */
public interface Extractor {

    /**
     * 支持的任务类型，来自类上的 {@link SupportedTaskTypes} 声明
     * <p>
     * 实现类不应覆盖此方法：{@link ExtractorRegistry} 只读取类上的声明，
     * 覆盖后实例与注册表看到的类型会不一致。{@link BaseExtractor} 已将其声明为 final。
     *
     * @throws io.datapillar.openlineage.extractor.exception.ExtractorNotImplementedException 未声明时
     */
    default Set<String> getSupportedTaskTypes() {
        return Extractors.supportedTaskTypes(getClass());
    }

    /**
     * 绑定任务实例，并执行一次性的准备动作（如向任务注册埋点）
     *
     * @param task 任务实例
     */
    void bind(Task task);

    /**
     * 校验绑定的任务类型在支持集合内，纯本地检查
     *
     * @throws MismatchedExtractorException 类型不匹配
     */
    void validate();

    /**
     * 基于任务静态配置提取元数据，可在任务完成前调用
     *
     * @return 元数据；任务确实没有可提取内容时返回 empty，这不是错误
     */
    Optional<TaskMetadata> extract();

    /**
     * 任务完成后提取元数据，可使用运行结果
     * <p>
     * 默认退化为 {@link #extract()}
     *
     * @param run 任务运行结果
     * @return 元数据或 empty
     */
    default Optional<TaskMetadata> extractOnComplete(TaskRun run) {
        return extract();
    }
}
