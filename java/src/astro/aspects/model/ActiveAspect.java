package astro.aspects.model;

import astro.helper.AngleUtils;

import java.io.Serializable;
import java.util.Objects;

/**
 * 调用方选择启用的相位及其容许度
 */
public final class ActiveAspect implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AspectName name;
    private final double orb;

    public ActiveAspect(AspectName name, double orb) {
        if (name == null) {
            throw new IllegalArgumentException("Aspect name must not be null");
        }
        AngleUtils.requireFinite(orb, "orb of " + name);
        if (orb < 0.0) {
            throw new IllegalArgumentException("Orb of " + name + " must be >= 0, got " + orb);
        }
        this.name = name;
        this.orb = orb;
    }

    public static ActiveAspect of(AspectName name, double orb) {
        return new ActiveAspect(name, orb);
    }

    public AspectName getName() { return name; }
    public double getOrb() { return orb; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActiveAspect)) return false;
        ActiveAspect that = (ActiveAspect) o;
        return name == that.name && Double.compare(orb, that.orb) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, orb);
    }

    @Override
    public String toString() {
        return name + "(" + orb + ")";
    }
}
