package astro.returns;

import astro.helper.JulianDays;
import astro.helper.AngleUtils;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.orekit.bodies.CelestialBody;
import org.orekit.bodies.CelestialBodyFactory;
import org.orekit.errors.OrekitException;
import org.orekit.frames.Frame;
import org.orekit.frames.FramesFactory;
import org.orekit.time.AbsoluteDate;
import org.orekit.time.TimeScale;
import org.orekit.time.TimeScalesFactory;
import org.orekit.utils.IERSConventions;
import org.orekit.utils.PVCoordinates;

import java.util.EnumMap;
import java.util.Map;

/**
 * 基于Orekit的星历
 *
 * 在平黄道坐标系（地心）中计算天体的黄经和黄经速度。需要先通过
 * {@link astro.helper.OrekitDataLoader} 配置Orekit数据（含JPL星历和闰秒表）。
 * 儒略日按UTC时间尺度理解。
 */
public class OrekitEphemerisOracle implements EphemerisOracle {

    private final TimeScale utc;
    private final Frame ecliptic;
    private final Map<Body, CelestialBody> bodies = new EnumMap<>(Body.class);

    /**
     * @throws OrekitException Orekit数据未配置或不完整
     */
    public OrekitEphemerisOracle() throws OrekitException {
        this.utc = TimeScalesFactory.getUTC();
        this.ecliptic = FramesFactory.getEcliptic(IERSConventions.IERS_2010);
    }

    @Override
    public BodyPosition positionAt(double julianDay, Body body) throws OrekitException {
        AbsoluteDate date = new AbsoluteDate(JulianDays.toDateTime(julianDay), utc);
        PVCoordinates pv = celestialBody(body).getPVCoordinates(date, ecliptic);

        return eclipticPosition(pv.getPosition(), pv.getVelocity());
    }

    /**
     * 黄道坐标系下的位置、速度转换为黄经和黄经速度
     *
     * @param p 位置（m）
     * @param v 速度（m/s）
     * @return 黄经（度）与黄经速度（度/日）
     */
    static BodyPosition eclipticPosition(Vector3D p, Vector3D v) {
        double longitude = AngleUtils.normalize(FastMath.toDegrees(FastMath.atan2(p.getY(), p.getX())));

        // dλ/dt = (x·vy - y·vx) / (x² + y²)，单位 rad/s
        double rho2 = p.getX() * p.getX() + p.getY() * p.getY();
        double rate = (p.getX() * v.getY() - p.getY() * v.getX()) / rho2;
        double speed = FastMath.toDegrees(rate) * JulianDays.SECONDS_PER_DAY;

        return new BodyPosition(longitude, speed);
    }

    private synchronized CelestialBody celestialBody(Body body) {
        return bodies.computeIfAbsent(body, b -> CelestialBodyFactory.getBody(b.getOrekitName()));
    }
}
