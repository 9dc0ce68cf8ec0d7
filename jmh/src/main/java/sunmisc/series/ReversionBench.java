package sunmisc.series;

import org.apache.commons.numbers.fraction.BigFraction;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import sunmisc.series.ring.Rationals;

import java.util.List;
import java.util.concurrent.TimeUnit;

@State(Scope.Thread)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@BenchmarkMode(Mode.AverageTime)
@Warmup(iterations = 2, time = 1)
@Measurement(iterations = 6, time = 1)
@Threads(1)
@Fork(1)
public class ReversionBench {
    @Param({"4", "6", "8"})
    int terms;

    // sin keeps its computed prefix across invocations, the reversion is rebuilt
    private final PowerSeries<BigFraction> ps = new PowerSeries<>(new Rationals());

    @Benchmark
    public List<BigFraction> arcsin() {
        return this.ps.take(terms, this.ps.revert(this.ps.sin()));
    }

    @Benchmark
    public List<BigFraction> sqrtOfOnePlusX() {
        return this.ps.take(terms, this.ps.sqrt(this.ps.add(this.ps.one(), this.ps.x())));
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(ReversionBench.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
