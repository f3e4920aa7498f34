package astro.aspects;

import astro.aspects.model.AspectDefinition;
import astro.aspects.model.AspectMatch;
import astro.helper.AngleUtils;
import org.hipparchus.util.FastMath;

/**
 * 两点相位匹配
 *
 * 按目录顺序查找第一个容许范围覆盖两点圆周距离的相位，找到即停止。
 */
public final class AspectMatcher {

    private AspectMatcher() {
    }

    /**
     * 匹配两点之间的相位
     *
     * @param catalog 相位目录（通常已收窄）
     * @param pos1 第一个点黄经（度）
     * @param pos2 第二个点黄经（度）
     * @return 匹配结果，未匹配时 {@link AspectMatch#isMatched()} 为 false
     */
    public static AspectMatch match(AspectCatalog catalog, double pos1, double pos2) {
        AngleUtils.requireFinite(pos1, "pos1");
        AngleUtils.requireFinite(pos2, "pos2");

        double distance = AngleUtils.unsignedCircularDistance(pos1, pos2);
        double diff = FastMath.abs(pos1 - pos2);

        for (AspectDefinition aspect : catalog.definitions()) {
            double exact = aspect.getExactDegree();
            double orb = aspect.getOrb();
            if (exact - orb <= distance && distance <= exact + orb) {
                return AspectMatch.of(aspect.getName(), FastMath.abs(distance - exact), distance, diff);
            }
        }

        return AspectMatch.none(distance, diff);
    }
}
