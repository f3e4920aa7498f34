package astro.aspects;

import astro.aspects.model.AspectName;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * 相位设置加载器
 *
 * 先读取类路径上的 aspect-settings.properties，再用外部文件覆盖
 * （系统属性 astro.aspects.config.path 或环境变量 ASTRO_ASPECTS_CONFIG_PATH）。
 */
public final class AspectSettingsLoader {

    private static final Logger logger = Logger.getLogger(AspectSettingsLoader.class.getName());

    static final String DEFAULT_RESOURCE = "/aspect-settings.properties";
    static final String CONFIG_PATH_PROPERTY = "astro.aspects.config.path";
    static final String CONFIG_PATH_ENV = "ASTRO_ASPECTS_CONFIG_PATH";

    private static final String ORB_PREFIX = "orb.";
    private static final String ACTIVE_KEY = "active";

    private static volatile AspectSettings defaults;

    private AspectSettingsLoader() {
    }

    /**
     * 获取默认设置（首次调用时加载并缓存）
     */
    public static AspectSettings defaults() {
        AspectSettings result = defaults;
        if (result == null) {
            synchronized (AspectSettingsLoader.class) {
                result = defaults;
                if (result == null) {
                    result = load();
                    defaults = result;
                }
            }
        }
        return result;
    }

    /**
     * 加载设置：类路径默认值 + 可选的外部覆盖文件
     */
    public static AspectSettings load() {
        Properties props = new Properties();
        try (InputStream in = AspectSettingsLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE, e);
        }

        Path override = resolveOverridePath();
        if (override != null) {
            if (!Files.exists(override)) {
                throw new IllegalStateException("Aspect settings file not found: " + override.toAbsolutePath());
            }
            try (InputStream in = Files.newInputStream(override)) {
                props.load(in);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read aspect settings: " + override.toAbsolutePath(), e);
            }
        }

        return fromProperties(props);
    }

    /**
     * 从属性解析设置
     *
     * 未知的相位名称只记录警告并忽略。
     */
    public static AspectSettings fromProperties(Properties props) {
        Map<AspectName, Double> orbs = new EnumMap<>(AspectName.class);
        for (String key : props.stringPropertyNames()) {
            if (!key.startsWith(ORB_PREFIX)) {
                continue;
            }
            String label = key.substring(ORB_PREFIX.length());
            Optional<AspectName> name = AspectName.fromLabel(label);
            if (name.isEmpty()) {
                logger.warning("Ignoring orb for unknown aspect '" + label + "'");
                continue;
            }
            orbs.put(name.get(), parseOrb(key, props.getProperty(key)));
        }

        List<AspectName> active = new ArrayList<>();
        String activeList = props.getProperty(ACTIVE_KEY, "");
        for (String label : activeList.split(",")) {
            if (label.trim().isEmpty()) {
                continue;
            }
            Optional<AspectName> name = AspectName.fromLabel(label);
            if (name.isEmpty()) {
                logger.warning("Ignoring unknown active aspect '" + label.trim() + "'");
                continue;
            }
            if (!active.contains(name.get())) {
                active.add(name.get());
            }
        }

        return new AspectSettings(orbs, active);
    }

    private static double parseOrb(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid orb value for " + key + ": " + value, e);
        }
    }

    private static Path resolveOverridePath() {
        String override = pick(
                System.getProperty(CONFIG_PATH_PROPERTY),
                System.getenv(CONFIG_PATH_ENV)
        );
        return override == null ? null : Paths.get(override);
    }

    private static String pick(String... values) {
        for (String value : values) {
            if (value == null) continue;
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return null;
    }
}
