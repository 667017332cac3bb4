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

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;

public class LogHelper {

    public static final String NAMESPACE = "com.dynamo.shaderir";

    private static Level logLevel = Level.INFO;

    /**
     * Configure a Logger instance by adding a handler and setting a log level.
     * Parent handlers are disabled so records are printed once.
     * @param logger The logger instance to configure
     */
    public static void configureLogger(java.util.logging.Logger logger) {
        for (Handler h : logger.getHandlers()) {
            logger.removeHandler(h);
        }
        Handler handler = new LogHandler();
        handler.setFormatter(new LogFormatter());
        handler.setLevel(Level.ALL);
        logger.addHandler(handler);
        logger.setUseParentHandlers(false);
        logger.setLevel(logLevel);
    }

    public static Level getLogLevel() {
        return logLevel;
    }

    /**
     * Set the log level to use for all loggers in the com.dynamo.shaderir namespace
     * @param level The java.util.logging.Level to use
     */
    public static void setLogLevel(Level level) {
        logLevel = level;

        LogManager logManager = LogManager.getLogManager();
        logManager.getLoggerNames().asIterator().forEachRemaining(loggerName -> {
            if (loggerName.startsWith(NAMESPACE)) {
                java.util.logging.Logger logger = logManager.getLogger(loggerName);
                if (logger != null) {
                    configureLogger(logger);
                }
            }
        });
    }

    /**
     * Enable or disable verbose logging
     * @param enabled Set to true to enable verbose logging
     */
    public static void setVerboseLogging(boolean enabled) {
        setLogLevel(enabled ? Level.FINE : Level.INFO);
    }
}
