package io.tessera.benchmarks;

import io.tessera.collection.HashedMap;
import io.tessera.collection.OrderedMap;
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

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class TableBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({"1000", "50000"})
        int size;

        HashedMap<Integer, Integer> hashed;
        OrderedMap<Integer, Integer> ordered;
        int probe;

        @Setup(Level.Trial)
        public void setUp() {
            hashed = new HashedMap<>();
            ordered = new OrderedMap<>();
            for (var i = 0; i < size; i++) {
                hashed.put(i, i);
                ordered.put(i, i);
            }
        }
    }

    @Benchmark
    public Integer hashedLookup(BenchmarkState state) {
        state.probe = (state.probe + 7919) % state.size;
        return state.hashed.get(Integer.valueOf(state.probe));
    }

    @Benchmark
    public Integer orderedLookup(BenchmarkState state) {
        state.probe = (state.probe + 7919) % state.size;
        return state.ordered.get(Integer.valueOf(state.probe));
    }

    @Benchmark
    public int hashedBuild(BenchmarkState state) {
        var map = new HashedMap<Integer, Integer>();
        for (var i = 0; i < state.size; i++) {
            map.put(i, i);
        }
        return map.bucketCount();
    }

    @Benchmark
    public int copyAndWrite(BenchmarkState state) {
        var copy = new HashedMap<>(state.hashed);
        copy.put(-1, -1);
        return copy.size();
    }
}
