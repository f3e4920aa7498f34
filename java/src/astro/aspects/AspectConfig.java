package astro.aspects;

import astro.aspects.model.ActiveAspect;
import astro.aspects.model.PointId;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 相位计算配置
 *
 * 控制单盘/双盘相位计算的参数
 */
public class AspectConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<ActiveAspect> activeAspects = null;   // 为空时使用默认启用的相位
    private Set<PointId> activePoints = null;          // 为空时使用星盘中的全部点
    private Double axisOrbLimit = null;                // 轴点相位的更严格容许度（度）
    private boolean firstIsFixed = false;              // 第一张盘视为静止
    private boolean secondIsFixed = false;             // 第二张盘视为静止

    public AspectConfig() {
    }

    // Getters and Setters
    public List<ActiveAspect> getActiveAspects() {
        return activeAspects;
    }

    public void setActiveAspects(List<ActiveAspect> activeAspects) {
        this.activeAspects = activeAspects == null ? null : new ArrayList<>(activeAspects);
    }

    public Set<PointId> getActivePoints() {
        return activePoints;
    }

    public void setActivePoints(Set<PointId> activePoints) {
        this.activePoints = activePoints == null ? null : copyOf(activePoints);
    }

    public Double getAxisOrbLimit() {
        return axisOrbLimit;
    }

    public void setAxisOrbLimit(Double axisOrbLimit) {
        this.axisOrbLimit = axisOrbLimit;
    }

    public boolean isFirstIsFixed() {
        return firstIsFixed;
    }

    public void setFirstIsFixed(boolean firstIsFixed) {
        this.firstIsFixed = firstIsFixed;
    }

    public boolean isSecondIsFixed() {
        return secondIsFixed;
    }

    public void setSecondIsFixed(boolean secondIsFixed) {
        this.secondIsFixed = secondIsFixed;
    }

    private static Set<PointId> copyOf(Set<PointId> points) {
        Set<PointId> copy = EnumSet.noneOf(PointId.class);
        copy.addAll(points);
        return copy;
    }

    @Override
    public String toString() {
        return "AspectConfig{" +
                "activeAspects=" + activeAspects +
                ", activePoints=" + activePoints +
                ", axisOrbLimit=" + axisOrbLimit +
                ", firstIsFixed=" + firstIsFixed +
                ", secondIsFixed=" + secondIsFixed +
                '}';
    }
}
