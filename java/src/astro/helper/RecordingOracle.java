package astro.helper;

import astro.returns.Body;
import astro.returns.BodyPosition;
import astro.returns.EphemerisOracle;

import java.util.ArrayList;

/**
 * RecordingOracle - 星历查询记录器
 *
 * 包装另一个星历实现，记录每一次查询，用于检查求解过程（查询次数、收敛轨迹）。
 *
 * 数据格式：每行3列 [julian_day, longitude, speed]
 * - julian_day: 查询时刻（儒略日）
 * - longitude: 黄经（度）
 * - speed: 黄经速度（度/日）
 *
 * 非线程安全，每个求解过程使用独立的实例。
 */
public class RecordingOracle implements EphemerisOracle {
    private final EphemerisOracle delegate;
    private final ArrayList<double[]> data = new ArrayList<>();

    public RecordingOracle(EphemerisOracle delegate) {
        this.delegate = delegate;
    }

    /**
     * 转发查询并记录结果
     *
     * 底层星历抛出的异常原样传出，不记录。
     */
    @Override
    public BodyPosition positionAt(double julianDay, Body body) {
        BodyPosition position = delegate.positionAt(julianDay, body);

        // [julian_day, longitude, speed]
        double[] row = new double[3];
        row[0] = julianDay;
        row[1] = position.getLongitude();
        row[2] = position.getSpeed();

        data.add(row);
        return position;
    }

    /**
     * 获取所有记录
     *
     * @return double[][] 二维数组，每行包含 [julian_day, longitude, speed]
     */
    public double[][] getResults() {
        return data.toArray(new double[0][]);
    }

    /**
     * 获取查询次数
     */
    public int getCount() {
        return data.size();
    }

    /**
     * 清空记录
     */
    public void clear() {
        data.clear();
    }
}
