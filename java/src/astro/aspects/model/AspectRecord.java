package astro.aspects.model;

/**
 * 相位记录
 *
 * 相位引擎的输出，每次查询新建，创建后不可变。
 */
public class AspectRecord {
    private final PointId point1;
    private final String point1Owner;
    private final double point1AbsPos;
    private final double point1Speed;
    private final PointId point2;
    private final String point2Owner;
    private final double point2AbsPos;
    private final double point2Speed;
    private final AspectName aspect;
    private final int exactDegree;
    private final double orbit;
    private final double diff;
    private final AspectMovement movement;

    /**
     * 创建相位记录
     *
     * @param point1 第一个点
     * @param point1Owner 第一个点所属星盘
     * @param point1AbsPos 第一个点黄经（度）
     * @param point1Speed 第一个点参与运动判断的速度（度/日）
     * @param point2 第二个点
     * @param point2Owner 第二个点所属星盘
     * @param point2AbsPos 第二个点黄经（度）
     * @param point2Speed 第二个点参与运动判断的速度（度/日）
     * @param aspect 相位
     * @param orbit 与精确相位的偏差（度）
     * @param diff 原始黄经差 |p1 - p2|
     * @param movement 运动状态
     */
    public AspectRecord(PointId point1, String point1Owner, double point1AbsPos, double point1Speed,
                        PointId point2, String point2Owner, double point2AbsPos, double point2Speed,
                        AspectName aspect, double orbit, double diff, AspectMovement movement) {
        this.point1 = point1;
        this.point1Owner = point1Owner;
        this.point1AbsPos = point1AbsPos;
        this.point1Speed = point1Speed;
        this.point2 = point2;
        this.point2Owner = point2Owner;
        this.point2AbsPos = point2AbsPos;
        this.point2Speed = point2Speed;
        this.aspect = aspect;
        this.exactDegree = aspect.getExactDegree();
        this.orbit = orbit;
        this.diff = diff;
        this.movement = movement;
    }

    public PointId getPoint1() { return point1; }
    public String getPoint1Name() { return point1.getLabel(); }
    public String getPoint1Owner() { return point1Owner; }
    public double getPoint1AbsPos() { return point1AbsPos; }
    public double getPoint1Speed() { return point1Speed; }
    public PointId getPoint2() { return point2; }
    public String getPoint2Name() { return point2.getLabel(); }
    public String getPoint2Owner() { return point2Owner; }
    public double getPoint2AbsPos() { return point2AbsPos; }
    public double getPoint2Speed() { return point2Speed; }
    public AspectName getAspect() { return aspect; }
    public int getExactDegree() { return exactDegree; }
    public double getOrbit() { return orbit; }
    public double getDiff() { return diff; }
    public AspectMovement getMovement() { return movement; }

    /**
     * 是否涉及轴点
     */
    public boolean involvesAxis() {
        return point1.isAxis() || point2.isAxis();
    }

    @Override
    public String toString() {
        return String.format("AspectRecord[%s(%s) %s %s(%s), orbit=%.2f°, %s]",
            point1, point1Owner, aspect, point2, point2Owner, orbit, movement.getLabel());
    }
}
