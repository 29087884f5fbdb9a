package com.exampack.core.util;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * YAML 工具类
 * <p>
 * SnakeYAML 2.x 默认禁止 !! 全局标签，这里只放行 com.exampack.* 包下的类型。
 */
public final class YamlCompatUtils {

    private static final String ALLOWED_TAG_PREFIX = "com.exampack.";

    private YamlCompatUtils() {
    }

    /**
     * 创建绑定到指定根类型、仅用于加载的 Yaml 实例
     */
    public static <T> Yaml createLoaderYaml(Class<T> rootType) {
        return new Yaml(new Constructor(rootType, createLoaderOptions()));
    }

    private static LoaderOptions createLoaderOptions() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        loaderOptions.setTagInspector(tag -> {
            String className = tag.getClassName();
            return className != null && className.startsWith(ALLOWED_TAG_PREFIX);
        });
        return loaderOptions;
    }
}
