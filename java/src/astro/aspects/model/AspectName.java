package astro.aspects.model;

import java.util.Optional;

/**
 * 相位名称
 *
 * 枚举顺序就是度数升序，也是相位匹配时的优先级顺序。
 */
public enum AspectName {
    CONJUNCTION("conjunction", 0, true),
    SEMI_SEXTILE("semi-sextile", 30, false),
    SEMI_SQUARE("semi-square", 45, false),
    SEXTILE("sextile", 60, true),
    QUINTILE("quintile", 72, false),
    SQUARE("square", 90, true),
    TRINE("trine", 120, true),
    SESQUIQUADRATE("sesquiquadrate", 135, false),
    BIQUINTILE("biquintile", 144, false),
    QUINCUNX("quincunx", 150, false),
    OPPOSITION("opposition", 180, true);

    private final String label;
    private final int exactDegree;
    private final boolean major;

    AspectName(String label, int exactDegree, boolean major) {
        this.label = label;
        this.exactDegree = exactDegree;
        this.major = major;
    }

    public String getLabel() { return label; }
    public int getExactDegree() { return exactDegree; }
    public boolean isMajor() { return major; }

    /**
     * 按标签查找（配置文件、脚本桥接使用）
     *
     * @param label 例如 "semi-sextile"
     * @return 对应的相位，未知标签返回空
     */
    public static Optional<AspectName> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        for (AspectName name : values()) {
            if (name.label.equalsIgnoreCase(trimmed)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
