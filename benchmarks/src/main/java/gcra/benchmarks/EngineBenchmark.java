package gcra.benchmarks;

import gcra.core.clock.SystemClock;
import gcra.core.model.GcraResult;
import gcra.engine.RateLimiterConfig;
import gcra.engine.RateLimiterEngine;
import org.openjdk.jmh.annotations.*;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for RateLimiterEngine (thread-safe multi-key wrapper).
 *
 * Measures throughput (ops/sec) across 3 scenarios:
 * - singleKey: All requests to same key (high contention)
 * - multiKey: Rotating through 1000 different keys (low contention)
 * - parallel: 8 threads with high contention on single key
 *
 * Run:
 *   java -jar benchmarks/target/benchmarks.jar Engine
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class EngineBenchmark {

    private RateLimiterEngine engine;

    @Setup
    public void setup() {
        RateLimiterConfig config = RateLimiterConfig.of(1_000_000, Duration.ofMillis(1));
        engine = new RateLimiterEngine(SystemClock.instance(), config);
    }

    @Benchmark
    public GcraResult singleKey() {
        return engine.tryAcquire("user1", 1);
    }

    @Benchmark
    public GcraResult multiKey() {
        String key = "user:" + ThreadLocalRandom.current().nextInt(1000);
        return engine.tryAcquire(key, 1);
    }

    @Benchmark
    @Threads(8)
    public GcraResult parallel() {
        return engine.tryAcquire("user1", 1);
    }
}
