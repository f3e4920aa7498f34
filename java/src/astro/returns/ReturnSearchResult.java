package astro.returns;

/**
 * 回归求解的诊断信息
 *
 * converged 表示搜索在 maxIterations 之内停止：残差小于容差，或区间宽度
 * 收缩到容差以下。后一种情况下 |lastResidual| 可能大于容差（例如月亮每日
 * 约13°，1e-4日对应约1.3e-3°）；窗口不包含回归时也会在窗口端点附近收敛。
 * 需要角度精度时检查 lastResidual。
 */
public final class ReturnSearchResult {

    private final double julianDay;
    private final double intervalWidth;
    private final int iterations;
    private final double lastResidual;
    private final boolean converged;

    /**
     * @param julianDay 最佳估计时刻
     * @param intervalWidth 返回时搜索区间的宽度（日）
     * @param iterations 星历查询次数
     * @param lastResidual 最后一次查询时黄经超过目标的角度（度，带符号）
     * @param converged 是否在最大迭代次数内停止
     */
    public ReturnSearchResult(double julianDay, double intervalWidth, int iterations,
                              double lastResidual, boolean converged) {
        this.julianDay = julianDay;
        this.intervalWidth = intervalWidth;
        this.iterations = iterations;
        this.lastResidual = lastResidual;
        this.converged = converged;
    }

    public double getJulianDay() { return julianDay; }
    public double getIntervalWidth() { return intervalWidth; }
    public int getIterations() { return iterations; }
    public double getLastResidual() { return lastResidual; }
    public boolean isConverged() { return converged; }

    @Override
    public String toString() {
        return String.format("ReturnSearchResult{jd=%.6f, width=%.3e, iterations=%d, residual=%.3e, converged=%s}",
            julianDay, intervalWidth, iterations, lastResidual, converged);
    }
}
