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

import io.numparse.NumberParser;
import io.numparse.ParseResult;
import io.numparse.std.Rnd;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

@State(Scope.Thread)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class ParseLongBenchmark {
    private final static int count = 1024;
    private final ParseResult result = new ParseResult();
    private final String[] values = new String[count];
    private final String[] malformed = new String[count];
    private int index;

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(ParseLongBenchmark.class.getSimpleName())
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
            values[i] = Long.toString(rnd.nextLong());
            malformed[i] = values[i] + 'x';
        }
        index = 0;
    }

    @Benchmark
    public long testJdkParse() {
        return Long.parseLong(next(values));
    }

    @Benchmark
    public int testParseIntMalformed() {
        // failure path: int parse, then the long re-parse
        return NumberParser.parseInt(next(malformed));
    }

    @Benchmark
    public long testParseLong() {
        return NumberParser.parseLong(next(values));
    }

    @Benchmark
    public boolean testTryParseLong() {
        return NumberParser.tryParseLong(next(values), result);
    }

    @Benchmark
    public boolean testTryParseLongMalformed() {
        return NumberParser.tryParseLong(next(malformed), result);
    }

    private String next(String[] source) {
        return source[index++ & (count - 1)];
    }
}
