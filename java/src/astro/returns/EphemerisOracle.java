package astro.returns;

/**
 * 星历查询接口
 *
 * 回归求解器唯一的外部依赖。实现在无法给出结果时（超出星历范围、不支持的天体）
 * 抛出非受检异常，求解器不捕获，直接传给调用方。
 */
public interface EphemerisOracle {

    /**
     * 查询天体位置
     *
     * @param julianDay 儒略日（UT）
     * @param body 天体
     * @return 地心黄经（度）与黄经速度（度/日）
     */
    BodyPosition positionAt(double julianDay, Body body);
}
