package io.datapillar.openlineage.extractor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.datapillar.openlineage.extractor.exception.ExtractorException;
import io.datapillar.openlineage.extractor.model.TaskMetadata;
import io.datapillar.openlineage.extractor.task.LineageAwareTask;
import io.datapillar.openlineage.extractor.task.Task;
import io.datapillar.openlineage.extractor.task.TaskRun;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 提取分发器
 * <p>
 * 每次调用：按任务类型查找工厂 → 创建新实例 → bind → validate → 提取。
 * <p>
 * 错误处理：
 * 1. 契约错误（未声明支持类型、类型不匹配）向调用方抛出
 * 2. 提取内部异常、超时记录日志后视为无元数据，不影响其他任务的提取
 * <p>
 * 分发器本身不持有任务级状态，可被多个任务执行线程并发调用。
 */
public class ExtractionDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExtractionDispatcher.class);

    private final ExtractorRegistry registry;
    private final ExtractorConfig config;

    /**
     * 仅在配置了超时时创建
     */
    private final ExecutorService executorService;

    public ExtractionDispatcher(ExtractorRegistry registry, ExtractorConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("ExtractorRegistry 不能为空");
        }
        this.registry = registry;
        this.config = config == null ? ExtractorConfig.defaults() : config;
        this.executorService = this.config.hasTimeout()
                ? Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                        .setNameFormat("lineage-extractor-%d")
                        .setDaemon(true)
                        .build())
                : null;
    }

    /**
     * 任务开始前（或与完成无关）提取
     *
     * @param task 任务实例
     * @return 元数据，没有可提取内容时为 empty
     */
    public Optional<TaskMetadata> extractOnStart(Task task) {
        return dispatch(task, Extractor::extract, "start");
    }

    /**
     * 任务完成后提取
     *
     * @param run 任务运行结果
     * @return 元数据，没有可提取内容时为 empty
     */
    public Optional<TaskMetadata> extractOnComplete(TaskRun run) {
        if (run == null) {
            throw new IllegalArgumentException("TaskRun 不能为空");
        }
        return dispatch(run.task(), extractor -> extractor.extractOnComplete(run), "complete");
    }

    /**
     * 为任务创建未绑定的 Extractor
     *
     * @return Extractor，没有可用实现时返回 null
     */
    Extractor createExtractor(Task task) {
        ExtractorFactory factory = registry.getFactory(task.getTaskType());
        if (factory != null) {
            Extractor extractor = factory.create();
            if (extractor == null) {
                throw new ExtractorException("ExtractorFactory 返回 null: taskType=%s", task.getTaskType());
            }
            return extractor;
        }
        if (config.fallbackEnabled() && task instanceof LineageAwareTask) {
            return new DefaultExtractor();
        }
        return null;
    }

    private Optional<TaskMetadata> dispatch(Task task,
                                            Function<Extractor, Optional<TaskMetadata>> extraction,
                                            String phase) {
        if (task == null) {
            throw new IllegalArgumentException("Task 不能为空");
        }
        String taskType = task.getTaskType();
        if (config.isDisabled(taskType)) {
            log.debug("任务类型已禁用提取: taskType={}, taskId={}", taskType, task.getTaskId());
            return Optional.empty();
        }

        long startTime = System.currentTimeMillis();
        try {
            Extractor extractor = createExtractor(task);
            if (extractor == null) {
                log.debug("未找到 Extractor: taskType={}, taskId={}", taskType, task.getTaskId());
                return Optional.empty();
            }

            extractor.bind(task);
            extractor.validate();

            Optional<TaskMetadata> metadata = config.hasTimeout()
                    ? extractWithTimeout(extractor, extraction, task)
                    : extraction.apply(extractor);
            metadata = metadata == null ? Optional.empty() : metadata;

            log.info("提取完成: phase={}, taskType={}, taskId={}, extractor={}, hasMetadata={}, cost={}ms",
                    phase, taskType, task.getTaskId(), extractor.getClass().getSimpleName(),
                    metadata.isPresent(), System.currentTimeMillis() - startTime);
            return metadata;
        } catch (ExtractorException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("提取异常，视为无元数据: phase={}, taskType={}, taskId={}", phase, taskType, task.getTaskId(), e);
            return Optional.empty();
        }
    }

    private Optional<TaskMetadata> extractWithTimeout(Extractor extractor,
                                                      Function<Extractor, Optional<TaskMetadata>> extraction,
                                                      Task task) {
        Future<Optional<TaskMetadata>> future = executorService.submit(() -> extraction.apply(extractor));
        try {
            return future.get(config.extractTimeoutMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("提取超时: taskType={}, taskId={}, timeout={}ms",
                    task.getTaskType(), task.getTaskId(), config.extractTimeoutMillis());
            return Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("提取被中断: taskType={}, taskId={}", task.getTaskType(), task.getTaskId());
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("提取失败: " + cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        if (executorService != null) {
            executorService.shutdownNow();
        }
    }
}
