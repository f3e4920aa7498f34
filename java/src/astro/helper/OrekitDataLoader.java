package astro.helper;

import org.orekit.data.DataContext;
import org.orekit.data.DirectoryCrawler;

import java.io.File;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Orekit数据目录配置
 *
 * 目录由系统属性 orekit.data.path 或环境变量 OREKIT_DATA_PATH 指定。
 */
public final class OrekitDataLoader {

    private static final Logger logger = Logger.getLogger(OrekitDataLoader.class.getName());

    public static final String DATA_PATH_PROPERTY = "orekit.data.path";
    public static final String DATA_PATH_ENV = "OREKIT_DATA_PATH";

    private static boolean configured = false;

    private OrekitDataLoader() {
    }

    /**
     * 查找配置的数据目录
     *
     * @return 存在的目录，未配置或不存在时为空
     */
    public static Optional<File> findDataDirectory() {
        String path = System.getProperty(DATA_PATH_PROPERTY);
        if (path == null || path.trim().isEmpty()) {
            path = System.getenv(DATA_PATH_ENV);
        }
        if (path == null || path.trim().isEmpty()) {
            return Optional.empty();
        }
        File dir = new File(path.trim());
        return dir.isDirectory() ? Optional.of(dir) : Optional.empty();
    }

    /**
     * 注册数据目录到默认数据上下文，重复调用无副作用
     *
     * @param dataDirectory orekit-data 目录
     */
    public static synchronized void configure(File dataDirectory) {
        if (configured) {
            return;
        }
        if (!dataDirectory.isDirectory()) {
            throw new IllegalArgumentException("Orekit data directory not found: " + dataDirectory.getAbsolutePath());
        }
        DataContext.getDefault().getDataProvidersManager().addProvider(new DirectoryCrawler(dataDirectory));
        configured = true;
        logger.info("Orekit data configured from " + dataDirectory.getAbsolutePath());
    }

    /**
     * 按系统属性/环境变量配置
     *
     * @return 是否找到并配置了数据目录
     */
    public static boolean configureFromEnvironment() {
        Optional<File> dir = findDataDirectory();
        dir.ifPresent(OrekitDataLoader::configure);
        return dir.isPresent();
    }
}
