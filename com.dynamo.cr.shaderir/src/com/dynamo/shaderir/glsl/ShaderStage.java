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


package com.dynamo.shaderir.glsl;

/**
 * The two pipeline stages a compiled program serves. The combined source
 * guards each entry point with the stage symbol.
 */
public enum ShaderStage {
    VERTEX("COMPILING_VERTEX_SHADER", "vp", "vertex"),
    FRAGMENT("COMPILING_FRAGMENT_SHADER", "fp", "fragment");

    private final String symbol;
    private final String extension;
    private final String label;

    ShaderStage(String symbol, String extension, String label) {
        this.symbol = symbol;
        this.extension = extension;
        this.label = label;
    }

    /**
     * @return the preprocessor symbol selecting this stage
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return file extension used for this stage's program source
     */
    public String getExtension() {
        return extension;
    }

    public String getLabel() {
        return label;
    }
}
