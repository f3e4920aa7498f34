package astro.aspects;

import astro.aspects.model.AspectMovement;
import astro.helper.AngleUtils;
import org.hipparchus.util.FastMath;

/**
 * 相位运动状态判断
 *
 * 两个点按各自速度向前推进一个很小的时间步，比较推进前后的容许度偏差：
 * 偏差缩小为入相（Applying），扩大为出相（Separating）。
 */
public final class MovementClassifier {

    /** 相对速度低于该值视为静止（度/日） */
    public static final double SPEED_EPSILON = 1e-9;

    /** 偏差变化低于该值视为静止（度） */
    public static final double ORB_EPSILON = 1e-6;

    /** 前推时间步（日），约1.44分钟 */
    public static final double LOOKAHEAD_DAYS = 0.001;

    private MovementClassifier() {
    }

    /**
     * 判断相位运动状态
     *
     * @param pos1 第一个点黄经（度）
     * @param pos2 第二个点黄经（度）
     * @param exactDegree 相位精确度数，大于180时按 360 - 度数 处理
     * @param speed1 第一个点速度（度/日）
     * @param speed2 第二个点速度（度/日）
     * @return 运动状态
     */
    public static AspectMovement classify(double pos1, double pos2, double exactDegree,
                                          double speed1, double speed2) {
        AngleUtils.requireFinite(pos1, "pos1");
        AngleUtils.requireFinite(pos2, "pos2");
        AngleUtils.requireFinite(exactDegree, "exactDegree");
        AngleUtils.requireFinite(speed1, "speed1");
        AngleUtils.requireFinite(speed2, "speed2");

        if (FastMath.abs(speed1 - speed2) < SPEED_EPSILON) {
            return AspectMovement.STATIC;
        }

        double aspect = AngleUtils.normalize(exactDegree);
        if (aspect > AngleUtils.HALF_CIRCLE) {
            aspect = AngleUtils.FULL_CIRCLE - aspect;
        }

        double currentOrb = orbOf(pos1, pos2, aspect);

        double future1 = AngleUtils.normalize(pos1 + speed1 * LOOKAHEAD_DAYS);
        double future2 = AngleUtils.normalize(pos2 + speed2 * LOOKAHEAD_DAYS);
        double futureOrb = orbOf(future1, future2, aspect);

        double delta = futureOrb - currentOrb;
        if (FastMath.abs(delta) < ORB_EPSILON) {
            return AspectMovement.STATIC;
        }
        return delta < 0 ? AspectMovement.APPLYING : AspectMovement.SEPARATING;
    }

    private static double orbOf(double pos1, double pos2, double aspect) {
        return FastMath.abs(AngleUtils.unsignedCircularDistance(pos1, pos2) - aspect);
    }
}
