package io.datapillar.openlineage.extractor;

import io.datapillar.openlineage.extractor.exception.ExtractorException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.pf4j.PluginManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extractor 注册表
 * <p>
 * 维护 任务类型名 -> Extractor 工厂 的映射，进程启动时构建，分发时只做一次 Map 查找。
 * <p>
 * 支持三种注册方式：
 * 1. 代码注册：{@link #register(Class, ExtractorFactory)}
 * 2. 按类名注册：{@link #registerClass(String, ClassLoader)}，用于配置中声明的自定义 Extractor
 * 3. PF4J 插件：{@link #loadFromPlugins(PluginManager)} 加载 {@link ExtractorProvider} 扩展
 * <p>
 * 类型名重复时保留先注册的工厂。
 */
public class ExtractorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExtractorRegistry.class);

    /**
     * 任务类型名 -> 工厂
     */
    private final ConcurrentHashMap<String, Registration> registrations = new ConcurrentHashMap<>();

    /**
     * 按配置构建注册表
     * <p>
     * 先加载 PF4J 插件，再注册配置中声明的自定义 Extractor
     *
     * @param config        提取配置
     * @param pluginManager PF4J 插件管理器，可为 null
     */
    public static ExtractorRegistry fromConfig(ExtractorConfig config, PluginManager pluginManager) {
        ExtractorRegistry registry = new ExtractorRegistry();
        registry.loadFromPlugins(pluginManager);
        ClassLoader classLoader = ExtractorRegistry.class.getClassLoader();
        for (String className : config.extractorClasses()) {
            registry.registerClass(className, classLoader);
        }
        log.info("Extractor 注册表构建完成，共 {} 个任务类型", registry.size());
        return registry;
    }

    /**
     * 注册 Extractor，登记到类上声明的所有任务类型下
     *
     * @param extractorClass Extractor 类
     * @param factory        创建新实例的工厂
     * @return 实际注册成功的类型数量
     * @throws io.datapillar.openlineage.extractor.exception.ExtractorNotImplementedException 类未声明支持类型
     */
    public int register(Class<? extends Extractor> extractorClass, ExtractorFactory factory) {
        if (factory == null) {
            throw new IllegalArgumentException("ExtractorFactory 不能为空: " + extractorClass.getName());
        }
        Set<String> taskTypes = Extractors.supportedTaskTypes(extractorClass);
        if (taskTypes.isEmpty()) {
            log.warn("Extractor 未声明任何任务类型，忽略: {}", extractorClass.getName());
            return 0;
        }

        int registered = 0;
        for (String taskType : taskTypes) {
            Registration registration = new Registration(extractorClass, factory);
            Registration existing = registrations.putIfAbsent(taskType, registration);
            if (existing != null) {
                log.error("任务类型重复注册: {}, 已存在于 {}，忽略 {}",
                        taskType, existing.extractorClass().getName(), extractorClass.getName());
                continue;
            }
            registered++;
            log.info("注册 Extractor: {} -> {}", taskType, extractorClass.getSimpleName());
        }
        return registered;
    }

    /**
     * 按类名注册 Extractor，要求存在 public 无参构造器
     *
     * @param className   Extractor 全限定类名
     * @param classLoader 加载用的类加载器
     * @return 实际注册成功的类型数量
     */
    public int registerClass(String className, ClassLoader classLoader) {
        Class<? extends Extractor> extractorClass = loadExtractorClass(className, classLoader);
        Constructor<? extends Extractor> constructor;
        try {
            constructor = extractorClass.getConstructor();
        } catch (NoSuchMethodException e) {
            throw new ExtractorException(e, "Extractor %s 缺少 public 无参构造器", className);
        }
        return register(extractorClass, () -> newInstance(constructor));
    }

    /**
     * 通过 PF4J 插件加载 Extractor
     *
     * @return 发现的 Provider 数量
     */
    public int loadFromPlugins(PluginManager pluginManager) {
        if (pluginManager == null) {
            log.info("PluginManager 未配置，跳过插件加载");
            return 0;
        }

        log.info("开始通过 PF4J 加载 ExtractorProvider 扩展...");

        List<ExtractorProvider> providers = pluginManager.getExtensions(ExtractorProvider.class);
        for (ExtractorProvider provider : providers) {
            log.info("发现 ExtractorProvider 扩展: {}", provider.getClass().getName());
            provider.registerExtractors(this);
        }

        log.info("PF4J 插件加载完成，共发现 {} 个 Provider", providers.size());
        return providers.size();
    }

    /**
     * 获取任务类型对应的工厂
     *
     * @return 工厂，不存在返回 null
     */
    public ExtractorFactory getFactory(String taskType) {
        Registration registration = taskType == null ? null : registrations.get(taskType);
        return registration == null ? null : registration.factory();
    }

    /**
     * 获取任务类型对应的 Extractor 类
     *
     * @return Extractor 类，不存在返回 null
     */
    public Class<? extends Extractor> getExtractorClass(String taskType) {
        Registration registration = taskType == null ? null : registrations.get(taskType);
        return registration == null ? null : registration.extractorClass();
    }

    public boolean hasExtractor(String taskType) {
        return taskType != null && registrations.containsKey(taskType);
    }

    /**
     * 获取所有已注册的任务类型
     */
    public Set<String> getTaskTypes() {
        return Collections.unmodifiableSet(registrations.keySet());
    }

    public int size() {
        return registrations.size();
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Extractor> loadExtractorClass(String className, ClassLoader classLoader) {
        Class<?> loaded;
        try {
            loaded = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new ExtractorException(e, "无法加载 Extractor 类: %s", className);
        }
        if (!Extractor.class.isAssignableFrom(loaded)) {
            throw new ExtractorException("%s 未实现 Extractor 接口", className);
        }
        return (Class<? extends Extractor>) loaded;
    }

    private static Extractor newInstance(Constructor<? extends Extractor> constructor) {
        try {
            return constructor.newInstance();
        } catch (InvocationTargetException e) {
            throw new ExtractorException(e.getCause(), "创建 Extractor 失败: %s", constructor.getDeclaringClass().getName());
        } catch (ReflectiveOperationException e) {
            throw new ExtractorException(e, "创建 Extractor 失败: %s", constructor.getDeclaringClass().getName());
        }
    }

    private record Registration(Class<? extends Extractor> extractorClass, ExtractorFactory factory) {
    }
}
