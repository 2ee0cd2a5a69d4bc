package io.datamirror.download;

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

import java.time.Duration;

/// Blocks the calling thread between retry attempts. Tests substitute a recording sleeper.
@FunctionalInterface
public interface Sleeper {

    /// Sleeps on the calling thread.
    Sleeper SYSTEM = delay -> Thread.sleep(delay.toMillis());

    /// @param delay How long to wait
    /// @throws InterruptedException if the thread is interrupted while waiting
    void sleep(Duration delay) throws InterruptedException;
}
