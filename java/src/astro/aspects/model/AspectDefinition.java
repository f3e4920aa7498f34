package astro.aspects.model;

import astro.helper.AngleUtils;

/**
 * 相位定义：名称、精确度数与容许度
 */
public final class AspectDefinition {

    private final AspectName name;
    private final double orb;

    public AspectDefinition(AspectName name, double orb) {
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

    /**
     * 替换容许度后的副本
     */
    public AspectDefinition withOrb(double newOrb) {
        return new AspectDefinition(name, newOrb);
    }

    public AspectName getName() { return name; }
    public int getExactDegree() { return name.getExactDegree(); }
    public double getOrb() { return orb; }
    public boolean isMajor() { return name.isMajor(); }

    @Override
    public String toString() {
        return String.format("AspectDefinition[%s %d° orb=%.2f]", name, getExactDegree(), orb);
    }
}
