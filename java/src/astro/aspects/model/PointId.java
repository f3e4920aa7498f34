package astro.aspects.model;

import java.util.Optional;

/**
 * 星盘点标识
 *
 * 行星、小行星、月交点、阿拉伯点以及四个轴点。数字编号沿用星盘设置中的编号。
 */
public enum PointId {
    SUN(0, "Sun"),
    MOON(1, "Moon"),
    MERCURY(2, "Mercury"),
    VENUS(3, "Venus"),
    MARS(4, "Mars"),
    JUPITER(5, "Jupiter"),
    SATURN(6, "Saturn"),
    URANUS(7, "Uranus"),
    NEPTUNE(8, "Neptune"),
    PLUTO(9, "Pluto"),
    MEAN_NORTH_LUNAR_NODE(10, "Mean_North_Lunar_Node"),
    TRUE_NORTH_LUNAR_NODE(11, "True_North_Lunar_Node"),
    CHIRON(12, "Chiron"),
    ASCENDANT(13, "Ascendant"),
    MEDIUM_COELI(14, "Medium_Coeli"),
    DESCENDANT(15, "Descendant"),
    IMUM_COELI(16, "Imum_Coeli"),
    MEAN_LILITH(17, "Mean_Lilith"),
    MEAN_SOUTH_LUNAR_NODE(18, "Mean_South_Lunar_Node"),
    TRUE_SOUTH_LUNAR_NODE(19, "True_South_Lunar_Node"),
    TRUE_LILITH(20, "True_Lilith"),
    EARTH(21, "Earth"),
    PHOLUS(22, "Pholus"),
    CERES(23, "Ceres"),
    PALLAS(24, "Pallas"),
    JUNO(25, "Juno"),
    VESTA(26, "Vesta"),
    ERIS(27, "Eris"),
    SEDNA(28, "Sedna"),
    HAUMEA(29, "Haumea"),
    MAKEMAKE(30, "Makemake"),
    IXION(31, "Ixion"),
    ORCUS(32, "Orcus"),
    QUAOAR(33, "Quaoar"),
    REGULUS(34, "Regulus"),
    SPICA(35, "Spica"),
    PARS_FORTUNAE(36, "Pars_Fortunae"),
    PARS_SPIRITUS(37, "Pars_Spiritus"),
    PARS_AMORIS(38, "Pars_Amoris"),
    PARS_FIDEI(39, "Pars_Fidei"),
    VERTEX(40, "Vertex"),
    ANTI_VERTEX(41, "Anti_Vertex");

    private final int id;
    private final String label;

    PointId(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int getId() { return id; }
    public String getLabel() { return label; }

    /**
     * 是否为轴点（上升、天顶、下降、天底）
     */
    public boolean isAxis() {
        switch (this) {
            case ASCENDANT:
            case MEDIUM_COELI:
            case DESCENDANT:
            case IMUM_COELI:
                return true;
            default:
                return false;
        }
    }

    /**
     * 构造上恒定相对180°的点
     *
     * 单盘相位计算时跳过这些点对。
     *
     * @return 对点，没有则为空
     */
    public Optional<PointId> oppositeAxis() {
        switch (this) {
            case ASCENDANT: return Optional.of(DESCENDANT);
            case DESCENDANT: return Optional.of(ASCENDANT);
            case MEDIUM_COELI: return Optional.of(IMUM_COELI);
            case IMUM_COELI: return Optional.of(MEDIUM_COELI);
            case TRUE_NORTH_LUNAR_NODE: return Optional.of(TRUE_SOUTH_LUNAR_NODE);
            case TRUE_SOUTH_LUNAR_NODE: return Optional.of(TRUE_NORTH_LUNAR_NODE);
            case MEAN_NORTH_LUNAR_NODE: return Optional.of(MEAN_SOUTH_LUNAR_NODE);
            case MEAN_SOUTH_LUNAR_NODE: return Optional.of(MEAN_NORTH_LUNAR_NODE);
            default: return Optional.empty();
        }
    }

    public boolean isOppositeAxisOf(PointId other) {
        return oppositeAxis().map(p -> p == other).orElse(false);
    }

    /**
     * 按标签查找，大小写不敏感
     */
    public static Optional<PointId> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        for (PointId point : values()) {
            if (point.label.equalsIgnoreCase(trimmed)) {
                return Optional.of(point);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
