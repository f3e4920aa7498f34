package astro.returns;

import java.io.Serializable;

/**
 * 回归搜索配置
 *
 * 控制二分求解与回归盘搜索窗口的参数
 */
public class ReturnSearchConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private double tolerance = ReturnSolver.DEFAULT_TOLERANCE;          // 黄经容差（度），也用作区间宽度下限（日）
    private int maxIterations = ReturnSolver.DEFAULT_MAX_ITERATIONS;    // 最大迭代（星历查询）次数
    private double solarLeadDays = 2.0;     // 太阳回归：窗口在生日前多少天开始
    private double solarWindowDays = 4.0;   // 太阳回归窗口长度（日）
    private double lunarWindowDays = 31.0;  // 月亮回归窗口长度（日）
    private boolean useParallel = true;     // 批量求解是否并行

    public ReturnSearchConfig() {
    }

    // Getters and Setters
    public double getTolerance() {
        return tolerance;
    }

    public void setTolerance(double tolerance) {
        this.tolerance = tolerance;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public double getSolarLeadDays() {
        return solarLeadDays;
    }

    public void setSolarLeadDays(double solarLeadDays) {
        this.solarLeadDays = solarLeadDays;
    }

    public double getSolarWindowDays() {
        return solarWindowDays;
    }

    public void setSolarWindowDays(double solarWindowDays) {
        this.solarWindowDays = solarWindowDays;
    }

    public double getLunarWindowDays() {
        return lunarWindowDays;
    }

    public void setLunarWindowDays(double lunarWindowDays) {
        this.lunarWindowDays = lunarWindowDays;
    }

    public boolean isUseParallel() {
        return useParallel;
    }

    public void setUseParallel(boolean useParallel) {
        this.useParallel = useParallel;
    }

    @Override
    public String toString() {
        return "ReturnSearchConfig{" +
                "tolerance=" + tolerance +
                ", maxIterations=" + maxIterations +
                ", solarLeadDays=" + solarLeadDays +
                ", solarWindowDays=" + solarWindowDays +
                ", lunarWindowDays=" + lunarWindowDays +
                ", useParallel=" + useParallel +
                '}';
    }
}
