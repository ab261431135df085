package gcra.benchmarks;

import gcra.core.clock.SystemClock;
import gcra.core.limiter.GcraLimiter;
import gcra.core.model.GcraResult;
import gcra.core.model.Quota;
import gcra.core.state.GcraState;
import org.openjdk.jmh.annotations.*;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks for the GCRA decision path.
 *
 * Scenarios:
 * - state_allow / state_reject: bare GcraState, caller supplies the time (no clock read)
 * - limiter_allow / limiter_reject: GcraLimiter, SystemClock read + monitor per call
 * - limiter_parallel: 8 threads contending on one GcraLimiter
 *
 * Run:
 *   mvn -pl benchmarks -am package -DskipTests
 *   java -jar benchmarks/target/benchmarks.jar Gcra
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Thread)
public class GcraBenchmark {

    // Allow scenario: one unit per nanosecond never runs out
    private Quota generous;
    // Reject scenario: one unit per hour, exhausted in setup
    private Quota stingy;

    private GcraState allowState;
    private GcraState rejectState;
    private long now;

    private GcraLimiter allowLimiter;
    private GcraLimiter rejectLimiter;

    @Setup
    public void setup() {
        generous = new Quota(1_000_000, Duration.ofMillis(1));
        stingy = Quota.perHour(1);

        allowState = new GcraState();
        rejectState = new GcraState();
        now = 0L;
        rejectState.checkAndModify(stingy, 1, now);

        SystemClock clock = SystemClock.instance();
        allowLimiter = new GcraLimiter(clock, generous);
        rejectLimiter = new GcraLimiter(clock, stingy);
        rejectLimiter.tryAcquire(1);
    }

    @Benchmark
    public GcraResult state_allow() {
        // keeps the schedule level: one interval per call
        now += 1;
        return allowState.checkAndModify(generous, 1, now);
    }

    @Benchmark
    public GcraResult state_reject() {
        return rejectState.checkAndModify(stingy, 1, now);
    }

    @Benchmark
    public GcraResult limiter_allow() {
        return allowLimiter.tryAcquire(1);
    }

    @Benchmark
    public GcraResult limiter_reject() {
        return rejectLimiter.tryAcquire(1);
    }

    @Benchmark
    @Threads(8)
    public GcraResult limiter_parallel(SharedLimiter shared) {
        return shared.limiter.tryAcquire(1);
    }

    @State(Scope.Benchmark)
    public static class SharedLimiter {
        GcraLimiter limiter;

        @Setup
        public void setup() {
            limiter = new GcraLimiter(SystemClock.instance(), new Quota(1_000_000, Duration.ofMillis(1)));
        }
    }
}
