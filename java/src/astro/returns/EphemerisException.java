package astro.returns;

/**
 * 星历无法给出指定时刻/天体的位置
 */
public class EphemerisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EphemerisException(String message) {
        super(message);
    }

    public EphemerisException(String message, Throwable cause) {
        super(message, cause);
    }
}
