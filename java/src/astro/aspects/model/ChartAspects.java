package astro.aspects.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 相位分析结果
 *
 * 单盘时 secondOwner 与 firstOwner 相同。
 */
public class ChartAspects {
    private final boolean dualChart;
    private final String firstOwner;
    private final String secondOwner;
    private final List<AspectRecord> aspects;
    private final List<PointId> activePoints;
    private final List<ActiveAspect> activeAspects;
    private final AspectStats stats;

    public ChartAspects(boolean dualChart, String firstOwner, String secondOwner,
                        List<AspectRecord> aspects,
                        List<PointId> activePoints,
                        List<ActiveAspect> activeAspects,
                        AspectStats stats) {
        this.dualChart = dualChart;
        this.firstOwner = firstOwner;
        this.secondOwner = secondOwner;
        this.aspects = Collections.unmodifiableList(new ArrayList<>(aspects));
        this.activePoints = Collections.unmodifiableList(new ArrayList<>(activePoints));
        this.activeAspects = Collections.unmodifiableList(new ArrayList<>(activeAspects));
        this.stats = stats;
    }

    public String getFirstOwner() { return firstOwner; }
    public String getSecondOwner() { return secondOwner; }
    public List<AspectRecord> getAspects() { return aspects; }
    public List<PointId> getActivePoints() { return activePoints; }
    public List<ActiveAspect> getActiveAspects() { return activeAspects; }
    public AspectStats getStats() { return stats; }

    public boolean isDualChart() {
        return dualChart;
    }

    /**
     * 按相位过滤
     */
    public List<AspectRecord> getAspects(AspectName name) {
        List<AspectRecord> result = new ArrayList<>();
        for (AspectRecord record : aspects) {
            if (record.getAspect() == name) {
                result.add(record);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("ChartAspects[%s / %s: %d aspects, %s]",
            firstOwner, secondOwner, aspects.size(), stats);
    }
}
