/*******************************************************************************
 *     ___                  _   ____  ____
 *    / _ \ _   _  ___  ___| |_|  _ \| __ )
 *   | | | | | | |/ _ \/ __| __| | | |  _ \
 *   | |_| | |_| |  __/\__ \ |_| |_| | |_) |
 *    \__\_\\__,_|\___||___/\__|____/|____/
 *
 *  Copyright (c) 2014-2019 Appsicle
 *  Copyright (c) 2019-2026 QuestDB
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 ******************************************************************************/

package org.numparse;

import io.numparse.FloatingPointParser;
import io.numparse.ParseResult;
import io.numparse.std.Rnd;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;

@State(Scope.Thread)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class ParseDoubleBenchmark {
    private final static int count = 1024;
    private final static String d = "78899.9";
    private final ParseResult result = new ParseResult();
    private final String[] values = new String[count];
    private int index;

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(ParseDoubleBenchmark.class.getSimpleName())
                .warmupIterations(2)
                .measurementIterations(2)
                .addProfiler("gc")
                .forks(1)
                .build();

        new Runner(opt).run();
    }

    @Setup(Level.Iteration)
    public void setup() {
        Rnd rnd = new Rnd();
        for (int i = 0; i < count; i++) {
            values[i] = Double.toString(rnd.nextDouble() * Math.pow(10, rnd.nextInt(20) - 10));
        }
        index = 0;
    }

    @Benchmark
    public double testJdkParse() {
        return Double.parseDouble(next());
    }

    @Benchmark
    public double testParse() {
        return FloatingPointParser.parseDouble(next());
    }

    @Benchmark
    public double testParseConstant() {
        return FloatingPointParser.parseDouble(d);
    }

    @Benchmark
    public BigDecimal testParseDecimal() {
        return FloatingPointParser.parseDecimal(next());
    }

    @Benchmark
    public boolean testTryParse() {
        return FloatingPointParser.tryParseDouble(next(), result);
    }

    private String next() {
        return values[index++ & (count - 1)];
    }
}
