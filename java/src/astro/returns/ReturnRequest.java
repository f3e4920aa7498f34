package astro.returns;

/**
 * 批量求解中的单个回归请求
 */
public final class ReturnRequest {

    private final String id;
    private final Body body;
    private final double targetLongitude;
    private final double searchStart;
    private final double windowDays;

    /**
     * @param id 请求标识，结果按此返回
     * @param body 天体
     * @param targetLongitude 目标黄经（度）
     * @param searchStart 搜索起点（儒略日）
     * @param windowDays 窗口长度（日）
     */
    public ReturnRequest(String id, Body body, double targetLongitude,
                         double searchStart, double windowDays) {
        if (id == null) {
            throw new IllegalArgumentException("Request id must not be null");
        }
        this.id = id;
        this.body = body;
        this.targetLongitude = targetLongitude;
        this.searchStart = searchStart;
        this.windowDays = windowDays;
    }

    public String getId() { return id; }
    public Body getBody() { return body; }
    public double getTargetLongitude() { return targetLongitude; }
    public double getSearchStart() { return searchStart; }
    public double getWindowDays() { return windowDays; }

    @Override
    public String toString() {
        return "ReturnRequest{" +
                "id='" + id + '\'' +
                ", body=" + body +
                ", targetLongitude=" + targetLongitude +
                ", searchStart=" + searchStart +
                ", windowDays=" + windowDays +
                '}';
    }
}
