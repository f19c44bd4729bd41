package io.datapillar.openlineage.extractor;

import io.datapillar.openlineage.extractor.exception.MismatchedExtractorException;
import io.datapillar.openlineage.extractor.task.Task;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extractor 基类
 * <p>
 * 负责绑定阶段的状态控制：
 * 1. 构造不产生副作用，{@link #bind(Task)} 只允许调用一次
 * 2. 未绑定时调用 validate / extract 直接失败
 * <p>
 * 子类实现 {@link #extract()}，需要向任务注册埋点时覆盖 {@link #patch(Task)}。
 * 具体子类必须声明 {@link SupportedTaskTypes}。
 */
public abstract class BaseExtractor implements Extractor {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private Task task;

    @Override
    public final void bind(Task task) {
        if (task == null) {
            throw new IllegalArgumentException("绑定的任务不能为空");
        }
        if (this.task != null) {
            throw new IllegalStateException(String.format(
                    "%s 已绑定任务 %s，不能重复绑定", getClass().getSimpleName(), this.task.getTaskId()));
        }
        this.task = task;
        patch(task);
    }

    /**
     * 与注册表使用同一份 {@link SupportedTaskTypes} 声明，不允许子类改写
     */
    @Override
    public final Set<String> getSupportedTaskTypes() {
        return Extractors.supportedTaskTypes(getClass());
    }

    /**
     * 绑定时执行一次，默认不做任何事
     */
    protected void patch(Task task) {
    }

    @Override
    public void validate() {
        Task bound = getTask();
        Set<String> supported = getSupportedTaskTypes();
        if (!supported.contains(bound.getTaskType())) {
            throw new MismatchedExtractorException(getClass(), bound.getTaskType(), supported);
        }
    }

    public boolean isBound() {
        return task != null;
    }

    /**
     * 获取绑定的任务
     *
     * @throws IllegalStateException 尚未绑定
     */
    protected Task getTask() {
        if (task == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " 尚未绑定任务");
        }
        return task;
    }

    // ============ 配置读取 ============

    /**
     * 读取字符串配置，不存在或为空白时返回 null
     */
    protected String getConfigString(String key) {
        Object value = getTask().getConfig().get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * 读取字符串列表配置
     * <p>
     * 兼容单个字符串与集合两种写法，忽略空白项
     */
    protected List<String> getConfigStrings(String key) {
        Object value = getTask().getConfig().get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        List<String> values = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                addIfNotBlank(values, item);
            }
        } else {
            addIfNotBlank(values, value);
        }
        return values;
    }

    private static void addIfNotBlank(List<String> values, Object item) {
        if (item != null && !item.toString().isBlank()) {
            values.add(item.toString().trim());
        }
    }
}
