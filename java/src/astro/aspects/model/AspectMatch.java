package astro.aspects.model;

/**
 * 两点相位匹配结果
 */
public final class AspectMatch {

    private final boolean matched;
    private final AspectName name;
    private final int exactDegree;
    private final double orbit;
    private final double distance;
    private final double diff;

    private AspectMatch(boolean matched, AspectName name, int exactDegree,
                        double orbit, double distance, double diff) {
        this.matched = matched;
        this.name = name;
        this.exactDegree = exactDegree;
        this.orbit = orbit;
        this.distance = distance;
        this.diff = diff;
    }

    public static AspectMatch of(AspectName name, double orbit, double distance, double diff) {
        return new AspectMatch(true, name, name.getExactDegree(), orbit, distance, diff);
    }

    /**
     * 未匹配：名称为空，度数和偏差为0
     *
     * distance 与 diff 仍保留两点的实际距离，便于调用方诊断。
     */
    public static AspectMatch none(double distance, double diff) {
        return new AspectMatch(false, null, 0, 0.0, distance, diff);
    }

    public boolean isMatched() { return matched; }
    public AspectName getName() { return name; }
    public int getExactDegree() { return exactDegree; }
    /** 实际距离与精确度数之差的绝对值 */
    public double getOrbit() { return orbit; }
    /** 圆周距离，[0, 180] */
    public double getDistance() { return distance; }
    /** 原始黄经差 |pos1 - pos2|，未取模 */
    public double getDiff() { return diff; }

    @Override
    public String toString() {
        if (!matched) {
            return String.format("AspectMatch[none, distance=%.4f]", distance);
        }
        return String.format("AspectMatch[%s, orbit=%.4f, distance=%.4f]", name, orbit, distance);
    }
}
