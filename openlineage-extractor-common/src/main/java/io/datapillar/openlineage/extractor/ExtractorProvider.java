package io.datapillar.openlineage.extractor;

import org.pf4j.ExtensionPoint;

/**
 * Extractor 提供者 PF4J 扩展点接口
 * <p>
 * 通过 PF4J 插件机制自动发现并加载 Extractor 实现
 * <p>
 * 使用方式：
 * 1. 实现此接口并添加 @Extension 注解
 * 2. 在插件 jar 的 MANIFEST.MF 中配置 Plugin-Id、Plugin-Version
 * 3. 将 jar 放到 plugins 目录，由 {@link ExtractorRegistry#loadFromPlugins} 加载
 */
public interface ExtractorProvider extends ExtensionPoint {

    /**
     * 注册 Extractor
     * <p>
     * 进程启动构建注册表时调用
     *
     * @param registry Extractor 注册表
     */
    void registerExtractors(ExtractorRegistry registry);
}
