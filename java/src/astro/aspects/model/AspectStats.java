package astro.aspects.model;

import java.io.Serializable;

/**
 * 相位计算统计信息
 */
public class AspectStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long computationTimeMs;
    private final int pairsExamined;
    private final int pairsExcluded;
    private final int matches;
    private final int axisFiltered;

    public AspectStats(long computationTimeMs, int pairsExamined, int pairsExcluded,
                       int matches, int axisFiltered) {
        this.computationTimeMs = computationTimeMs;
        this.pairsExamined = pairsExamined;
        this.pairsExcluded = pairsExcluded;
        this.matches = matches;
        this.axisFiltered = axisFiltered;
    }

    public long getComputationTimeMs() {
        return computationTimeMs;
    }

    /** 实际做了匹配的点对数 */
    public int getPairsExamined() {
        return pairsExamined;
    }

    /** 因对轴规则跳过的点对数 */
    public int getPairsExcluded() {
        return pairsExcluded;
    }

    /** 过滤前匹配到的相位数 */
    public int getMatches() {
        return matches;
    }

    /** 被轴点容许度过滤掉的相位数 */
    public int getAxisFiltered() {
        return axisFiltered;
    }

    @Override
    public String toString() {
        return String.format(
            "AspectStats{time=%dms, examined=%d, excluded=%d, matches=%d, axisFiltered=%d}",
            computationTimeMs, pairsExamined, pairsExcluded, matches, axisFiltered
        );
    }
}
