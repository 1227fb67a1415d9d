/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.benchmark;

import com.tessera.grammar.runtime.kernels.DType;
import com.tessera.grammar.runtime.kernels.TokenBitmask;
import com.tessera.grammar.runtime.kernels.TokenBitmaskKernel;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

/**
 * Per-step cost of masking logits.
 *
 * <p>Sparsity is the fraction of allowed tokens: grammar-constrained decoding usually allows
 * very few tokens (JSON structure) or nearly all of them (free text inside a string).
 *
 * USAGE:
 *   mvn clean package -pl tessera-benchmarks -am -DskipTests
 *   java -jar tessera-benchmarks/target/tessera-benchmarks.jar TokenBitmaskKernelBenchmark
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g", "-XX:+AlwaysPreTouch"})
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 10, time = 2)
public class TokenBitmaskKernelBenchmark {

    @Param({"1", "16", "64"})
    private int batchSize;

    @Param({"32000", "128256"})
    private int vocabSize;

    @Param({"0.01", "0.5", "0.99"})
    private double allowedFraction;

    private TokenBitmask bitmask;
    private float[] source;
    private float[] logits;
    private ByteBuffer rawSource;
    private ByteBuffer rawLogits;
    private TokenBitmaskKernel sequential;
    private TokenBitmaskKernel parallel;

    @Setup(Level.Trial)
    public void setupTrial() {
        java.util.logging.Logger.getLogger("com.tessera").setLevel(java.util.logging.Level.WARNING);

        SplittableRandom random = new SplittableRandom(42);
        bitmask = TokenBitmask.allocate(batchSize, vocabSize);
        for (int row = 0; row < batchSize; row++) {
            for (int token = 0; token < vocabSize; token++) {
                bitmask.setAllowed(row, token, random.nextDouble() < allowedFraction);
            }
        }
        source = new float[batchSize * vocabSize];
        for (int i = 0; i < source.length; i++) {
            source[i] = (float) random.nextGaussian();
        }
        logits = source.clone();
        rawSource = ByteBuffer.allocateDirect(source.length * 4).order(ByteOrder.nativeOrder());
        rawSource.asFloatBuffer().put(source);
        rawLogits = ByteBuffer.allocateDirect(source.length * 4).order(ByteOrder.nativeOrder());

        sequential = new TokenBitmaskKernel(Long.MAX_VALUE);
        parallel = new TokenBitmaskKernel(1);
    }

    @Setup(Level.Invocation)
    public void restoreLogits() {
        System.arraycopy(source, 0, logits, 0, source.length);
        rawLogits.clear();
        rawLogits.put(rawSource.duplicate().clear());
        rawLogits.clear();
    }

    @Benchmark
    public float[] floatArraySequential() {
        sequential.apply(bitmask.buffer().array(), logits, batchSize, vocabSize, null);
        return logits;
    }

    @Benchmark
    public float[] floatArrayParallel() {
        parallel.apply(bitmask.buffer().array(), logits, batchSize, vocabSize, null);
        return logits;
    }

    @Benchmark
    public ByteBuffer directBufferFloat32() {
        sequential.apply(bitmask.buffer(), rawLogits, DType.FLOAT32, batchSize, vocabSize, null);
        return rawLogits;
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(TokenBitmaskKernelBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
