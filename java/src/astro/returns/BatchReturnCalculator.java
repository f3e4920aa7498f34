package astro.returns;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * 批量回归计算器
 *
 * 各个求解之间没有共享状态，可以并行执行。任何一个求解失败时，
 * 取消其余任务并把异常抛给调用方，不返回部分结果。
 */
public class BatchReturnCalculator {

    private static final Logger logger = Logger.getLogger(BatchReturnCalculator.class.getName());

    private final ReturnCalculator calculator;
    private final ReturnSearchConfig config;

    public BatchReturnCalculator(EphemerisOracle oracle, ReturnSearchConfig config) {
        this.calculator = new ReturnCalculator(oracle, config);
        this.config = config;
    }

    /**
     * 批量求解（主入口）
     *
     * @param requests 回归请求列表，id不能重复
     * @return id -> 回归时刻，顺序与请求一致
     */
    public Map<String, ReturnEvent> computeAll(List<ReturnRequest> requests) {
        checkUniqueIds(requests);
        long startNs = System.nanoTime();

        Map<String, ReturnEvent> results;
        if (config.isUseParallel() && requests.size() > 1) {
            results = computeParallel(requests);
        } else {
            results = computeSequential(requests);
        }

        logger.fine(String.format("Solved %d returns in %d ms (parallel=%s)",
            results.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs),
            config.isUseParallel()));
        return results;
    }

    /**
     * 串行求解
     */
    private Map<String, ReturnEvent> computeSequential(List<ReturnRequest> requests) {
        Map<String, ReturnEvent> results = new LinkedHashMap<>();
        for (ReturnRequest request : requests) {
            results.put(request.getId(), solve(request));
        }
        return results;
    }

    /**
     * 并行求解（每个请求独立一个任务）
     */
    private Map<String, ReturnEvent> computeParallel(List<ReturnRequest> requests) {
        ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(requests.size(), Runtime.getRuntime().availableProcessors())
        );

        try {
            List<Future<ReturnEvent>> futures = new ArrayList<>();
            for (ReturnRequest request : requests) {
                futures.add(executor.submit(() -> solve(request)));
            }

            // 等待所有求解完成
            Map<String, ReturnEvent> results = new LinkedHashMap<>();
            for (int i = 0; i < requests.size(); i++) {
                try {
                    results.put(requests.get(i).getId(), futures.get(i).get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Parallel return search interrupted", e);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    }
                    if (cause instanceof Error) {
                        throw (Error) cause;
                    }
                    throw new IllegalStateException("Parallel return search failed", cause);
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private ReturnEvent solve(ReturnRequest request) {
        return calculator.planetReturn(
            request.getBody(),
            request.getTargetLongitude(),
            request.getSearchStart(),
            request.getWindowDays()
        );
    }

    private static void checkUniqueIds(List<ReturnRequest> requests) {
        Map<String, ReturnRequest> seen = new LinkedHashMap<>();
        for (ReturnRequest request : requests) {
            if (seen.put(request.getId(), request) != null) {
                throw new IllegalArgumentException("Duplicate return request id " + request.getId());
            }
        }
    }
}
