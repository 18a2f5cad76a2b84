// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package vir.util;

import java.io.PrintStream;

/**
 * Receives timed progress messages from long running components.
 */
public interface Logger {

    /**
     * Log a message, along with a time and memory usage.
     *
     * @param msg    The message to be logged
     * @param time   Elapsed time (in milliseconds)
     * @param memory Memory used (in bytes)
     */
    public void logTimedMessage(String msg, long time, long memory);

    /**
     * A logger which discards everything.
     */
    public static final Logger NULL = new Logger() {
        @Override
        public void logTimedMessage(String msg, long time, long memory) {
            // do nothing
        }
    };

    /**
     * Writes each message on its own line to a given stream.
     */
    public static class Default implements Logger {
        private final PrintStream out;

        public Default(PrintStream out) {
            this.out = out;
        }

        @Override
        public void logTimedMessage(String msg, long time, long memory) {
            StringBuilder sb = new StringBuilder(msg);
            sb.append(" [").append(time).append("ms");
            if (memory > 0) {
                sb.append(", +").append(memory).append(" bytes");
            }
            sb.append("]");
            out.println(sb);
            out.flush();
        }
    }
}
