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

import java.util.Date;
import java.util.Locale;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;


/**
 * Log formatter with format set from constructor instead of system
 * property. Record parameters are applied printf-style.
 */
public class LogFormatter extends Formatter {
    public static final String DEFAULT_FORMAT = "%1$tF %1$tT %4$-7s %5$s %n";

    private final String format;

    public LogFormatter() {
        this(DEFAULT_FORMAT);
    }

    public LogFormatter(String format) {
        this.format = format;
    }

    @Override
    public String format(LogRecord record) {
        Date date = new Date(record.getMillis());
        String loggerName = record.getLoggerName();
        String methodName = record.getSourceMethodName();
        String source = (methodName != null) ? methodName : loggerName;
        Level level = record.getLevel();
        String message = record.getMessage();
        if (record.getParameters() != null && record.getParameters().length > 0) {
            message = String.format(Locale.ROOT, message, record.getParameters());
        }
        Throwable thrown = record.getThrown();
        return String.format(Locale.ROOT, this.format, date, source, loggerName, level, message, thrown);
    }
}
