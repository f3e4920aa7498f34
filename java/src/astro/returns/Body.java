package astro.returns;

import org.orekit.bodies.CelestialBodyFactory;

/**
 * 可求回归的天体
 *
 * orekitName 对应 {@link CelestialBodyFactory} 中的天体名称。
 */
public enum Body {
    SUN(CelestialBodyFactory.SUN),
    MOON(CelestialBodyFactory.MOON),
    MERCURY(CelestialBodyFactory.MERCURY),
    VENUS(CelestialBodyFactory.VENUS),
    MARS(CelestialBodyFactory.MARS),
    JUPITER(CelestialBodyFactory.JUPITER),
    SATURN(CelestialBodyFactory.SATURN),
    URANUS(CelestialBodyFactory.URANUS),
    NEPTUNE(CelestialBodyFactory.NEPTUNE),
    PLUTO(CelestialBodyFactory.PLUTO);

    private final String orekitName;

    Body(String orekitName) {
        this.orekitName = orekitName;
    }

    public String getOrekitName() {
        return orekitName;
    }
}
