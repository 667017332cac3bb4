// Copyright 2020-2025 The Defold Foundation
// Copyright 2014-2020 King
// Copyright 2009-2014 Ragnar Svensson, Christian Murray
// Licensed under the Defold License version 1.0 (the "License"); you may not use
// this file except in compliance with the License.
//
// You may obtain a copy of the License, together with FAQs at
// https://www.defold.com/license
//
// Unless required by applicable law or agreed to in writing, software distributed
// under the License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR
// CONDITIONS OF ANY KIND, either express or implied. See the License for the
// specific language governing permissions and limitations under the License.


package com.dynamo.shaderir.logging;

import java.util.logging.Level;

/**
 * Thin wrapper around java.util.logging.Logger accepting printf-style
 * arguments. Formatting is deferred to {@link LogFormatter}.
 */
public class Logger {

    private final java.util.logging.Logger logger;

    private Logger(java.util.logging.Logger logger) {
        this.logger = logger;
    }

    public static Logger getLogger(String name) {
        java.util.logging.Logger logger = java.util.logging.Logger.getLogger(name);
        if (logger.getHandlers().length == 0) {
            LogHelper.configureLogger(logger);
        }
        return new Logger(logger);
    }

    public boolean isLoggable(Level level) {
        return logger.isLoggable(level);
    }

    public void log(Level level, String message, Object... args) {
        if (!logger.isLoggable(level)) {
            return;
        }
        if (args.length == 0) {
            logger.log(level, message);
        }
        else {
            logger.log(level, message, args);
        }
    }

    public void log(Level level, String message, Throwable thrown) {
        logger.log(level, message, thrown);
    }

    public void severe(String message, Object... args) {
        log(Level.SEVERE, message, args);
    }

    public void warning(String message, Object... args) {
        log(Level.WARNING, message, args);
    }

    public void info(String message, Object... args) {
        log(Level.INFO, message, args);
    }

    public void fine(String message, Object... args) {
        log(Level.FINE, message, args);
    }

    public void finer(String message, Object... args) {
        log(Level.FINER, message, args);
    }
}
