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


package com.dynamo.shaderir;

import java.util.Locale;

/**
 * Compile exception
 *
 * Raised when a program handed to the compiler references something it
 * does not declare. The location names the declaration being rendered,
 * e.g. "F2" or "main (fragment)".
 */
public class CompileExceptionError extends Exception {
    private static final long serialVersionUID = 6127436287115307412L;

    private String location;

    public CompileExceptionError(String message) {
        this(null, message);
    }

    public CompileExceptionError(String location, String message) {
        super(location != null ? String.format(Locale.ROOT, "%s: %s", location, message) : message);
        this.location = location;
    }

    public CompileExceptionError(String location, String message, Throwable e) {
        super(location != null ? String.format(Locale.ROOT, "%s: %s", location, message) : message, e);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
