package astro.aspects.model;

/**
 * 相位运动状态
 */
public enum AspectMovement {
    /** 容许度在缩小，相位趋向精确 */
    APPLYING("Applying"),
    /** 容许度在扩大 */
    SEPARATING("Separating"),
    /** 相对运动可忽略 */
    STATIC("Static");

    private final String label;

    AspectMovement(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
