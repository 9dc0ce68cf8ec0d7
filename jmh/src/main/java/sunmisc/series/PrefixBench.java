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

/*
 * Every invocation builds fresh series, so the memoized prefix of a
 * previous invocation is never reused.
 */
@State(Scope.Thread)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@BenchmarkMode(Mode.AverageTime)
@Warmup(iterations = 2, time = 1)
@Measurement(iterations = 6, time = 1)
@Threads(1)
@Fork(1)
public class PrefixBench {
    @Param({"8", "16", "32"})
    int terms;

    @Benchmark
    public List<BigFraction> exp() {
        final PowerSeries<BigFraction> ps = new PowerSeries<>(new Rationals());
        return ps.take(terms, ps.exp());
    }

    @Benchmark
    public List<BigFraction> tan() {
        final PowerSeries<BigFraction> ps = new PowerSeries<>(new Rationals());
        return ps.take(terms, ps.tan());
    }

    @Benchmark
    public List<BigFraction> squareOfExp() {
        final PowerSeries<BigFraction> ps = new PowerSeries<>(new Rationals());
        return ps.take(terms, ps.multiply(ps.exp(), ps.exp()));
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(PrefixBench.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
