package io.tessera.benchmarks;

import io.tessera.sequence.Sequence;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class SequenceBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({"1000", "100000"})
        int size;

        Sequence<Integer> filled;

        @Setup(Level.Trial)
        public void setUp() {
            filled = new Sequence<>();
            filled.reserve(size);
            for (var i = 0; i < size; i++) {
                filled.append(i);
            }
        }
    }

    @Benchmark
    public int appendAll(BenchmarkState state) {
        var sequence = new Sequence<Integer>();
        for (var i = 0; i < state.size; i++) {
            sequence.append(i);
        }
        return sequence.size();
    }

    @Benchmark
    public void shareAndRead(BenchmarkState state, Blackhole blackhole) {
        var view = new Sequence<>(state.filled);
        blackhole.consume(view.get(view.size() / 2));
    }

    @Benchmark
    public int shareAndWrite(BenchmarkState state) {
        var view = new Sequence<>(state.filled);
        view.set(0, -1);
        return view.size();
    }

    @Benchmark
    public int drainFromHead(BenchmarkState state) {
        var view = new Sequence<Integer>().copy(state.filled);
        var sum = 0;
        while (!view.isEmpty()) {
            sum += view.get(0);
            view.remove(0);
        }
        return sum;
    }
}
