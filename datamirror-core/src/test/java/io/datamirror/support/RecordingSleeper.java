package io.datamirror.support;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.datamirror.download.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/// A Sleeper that returns at once and remembers each requested delay.
public class RecordingSleeper implements Sleeper {
    private final List<Duration> delays = new CopyOnWriteArrayList<>();
    private boolean interrupt;

    /// @return a sleeper that fails every wait with an InterruptedException
    public static RecordingSleeper interrupting() {
        RecordingSleeper sleeper = new RecordingSleeper();
        sleeper.interrupt = true;
        return sleeper;
    }

    @Override
    public void sleep(Duration delay) throws InterruptedException {
        delays.add(delay);
        if (interrupt) {
            throw new InterruptedException("interrupted by test");
        }
    }

    public List<Duration> delays() {
        return List.copyOf(delays);
    }
}
