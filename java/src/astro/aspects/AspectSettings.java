package astro.aspects;

import astro.aspects.model.ActiveAspect;
import astro.aspects.model.AspectName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 相位设置
 *
 * 每个相位的默认容许度，以及默认启用的相位列表。由 {@link AspectSettingsLoader} 从配置加载。
 */
public final class AspectSettings {

    private final Map<AspectName, Double> defaultOrbs;
    private final List<AspectName> defaultActive;

    public AspectSettings(Map<AspectName, Double> defaultOrbs, List<AspectName> defaultActive) {
        for (AspectName name : AspectName.values()) {
            if (!defaultOrbs.containsKey(name)) {
                throw new IllegalArgumentException("Missing default orb for aspect " + name);
            }
        }
        this.defaultOrbs = Collections.unmodifiableMap(new EnumMap<>(defaultOrbs));
        this.defaultActive = Collections.unmodifiableList(new ArrayList<>(defaultActive));
    }

    public double getDefaultOrb(AspectName name) {
        return defaultOrbs.get(name);
    }

    public Map<AspectName, Double> getDefaultOrbs() {
        return defaultOrbs;
    }

    public List<AspectName> getDefaultActive() {
        return defaultActive;
    }

    /**
     * 默认启用的相位，容许度取默认值
     */
    public List<ActiveAspect> defaultActiveAspects() {
        List<ActiveAspect> result = new ArrayList<>();
        for (AspectName name : defaultActive) {
            result.add(ActiveAspect.of(name, getDefaultOrb(name)));
        }
        return result;
    }

    /**
     * 全部11种相位，容许度取默认值
     */
    public List<ActiveAspect> allActiveAspects() {
        List<ActiveAspect> result = new ArrayList<>();
        for (AspectName name : AspectName.values()) {
            result.add(ActiveAspect.of(name, getDefaultOrb(name)));
        }
        return result;
    }

    @Override
    public String toString() {
        return "AspectSettings{" +
                "defaultOrbs=" + defaultOrbs +
                ", defaultActive=" + defaultActive +
                '}';
    }
}
