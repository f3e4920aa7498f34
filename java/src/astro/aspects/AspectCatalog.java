package astro.aspects;

import astro.aspects.model.ActiveAspect;
import astro.aspects.model.AspectDefinition;
import astro.aspects.model.AspectName;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 相位目录
 *
 * 按度数升序保存相位定义。遍历顺序即匹配优先级：两个相位的容许范围重叠时，
 * 排在前面的相位胜出。
 */
public final class AspectCatalog {

    private final Map<AspectName, AspectDefinition> definitions;

    private AspectCatalog(Map<AspectName, AspectDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    /**
     * 从定义集合创建目录，顺序由 {@link AspectName} 决定
     */
    public static AspectCatalog of(Collection<AspectDefinition> definitions) {
        Map<AspectName, AspectDefinition> map = new EnumMap<>(AspectName.class);
        for (AspectDefinition definition : definitions) {
            if (map.put(definition.getName(), definition) != null) {
                throw new IllegalArgumentException("Duplicate aspect definition " + definition.getName());
            }
        }
        return new AspectCatalog(map);
    }

    /**
     * 全部11种相位，容许度取自设置
     */
    public static AspectCatalog fromSettings(AspectSettings settings) {
        Map<AspectName, AspectDefinition> map = new EnumMap<>(AspectName.class);
        for (AspectName name : AspectName.values()) {
            map.put(name, new AspectDefinition(name, settings.getDefaultOrb(name)));
        }
        return new AspectCatalog(map);
    }

    /**
     * 默认目录（使用默认配置）
     */
    public static AspectCatalog defaultCatalog() {
        return fromSettings(AspectSettingsLoader.defaults());
    }

    /**
     * 按调用方的选择收窄目录
     *
     * 只保留选择中出现的相位，并替换为选择中的容许度。输出保持目录顺序，
     * 而不是选择的顺序。目录中没有的名称被忽略。
     *
     * @param selection 启用的相位及容许度
     * @return 新目录
     */
    public AspectCatalog narrow(List<ActiveAspect> selection) {
        Map<AspectName, AspectDefinition> map = new EnumMap<>(AspectName.class);
        for (AspectDefinition definition : definitions.values()) {
            for (ActiveAspect active : selection) {
                if (active.getName() == definition.getName()) {
                    map.put(definition.getName(), definition.withOrb(active.getOrb()));
                    break;
                }
            }
        }
        return new AspectCatalog(map);
    }

    public Optional<AspectDefinition> find(AspectName name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /**
     * 按优先级顺序返回全部定义
     */
    public List<AspectDefinition> definitions() {
        return new ArrayList<>(definitions.values());
    }

    public int size() {
        return definitions.size();
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    @Override
    public String toString() {
        return "AspectCatalog" + definitions.values();
    }
}
