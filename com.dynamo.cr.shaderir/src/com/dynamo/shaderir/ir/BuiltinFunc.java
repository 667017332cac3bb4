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


package com.dynamo.shaderir.ir;

/**
 * Functions provided by the target language, referenced by tag rather than
 * declared by the program. Type constructors are included since they are
 * called the same way.
 */
public enum BuiltinFunc {
    // Constructors
    BOOL_F("bool"),
    INT_F("int"),
    FLOAT_F("float"),
    VEC2_F("vec2"),
    VEC3_F("vec3"),
    VEC4_F("vec4"),
    MAT2_F("mat2"),
    MAT3_F("mat3"),
    MAT4_F("mat4"),

    // Angle and trigonometry
    RADIANS("radians"),
    DEGREES("degrees"),
    SIN("sin"),
    COS("cos"),
    TAN("tan"),
    ASIN("asin"),
    ACOS("acos"),
    ATAN("atan"),

    // Exponential
    POW("pow"),
    EXP("exp"),
    LOG("log"),
    EXP2("exp2"),
    LOG2("log2"),
    SQRT("sqrt"),
    INVERSE_SQRT("inversesqrt"),

    // Common
    ABS("abs"),
    SIGN("sign"),
    FLOOR("floor"),
    CEIL("ceil"),
    FRACT("fract"),
    MOD("mod"),
    MIN("min"),
    MAX("max"),
    CLAMP("clamp"),
    MIX("mix"),
    STEP("step"),
    SMOOTHSTEP("smoothstep"),

    // Geometric
    LENGTH("length"),
    DISTANCE("distance"),
    DOT("dot"),
    CROSS("cross"),
    NORMALIZE("normalize"),
    FACEFORWARD("faceforward"),
    REFLECT("reflect"),
    REFRACT("refract"),

    // Matrix
    MATRIX_COMP_MULT("matrixCompMult"),

    // Vector relational
    LESS_THAN("lessThan"),
    LESS_THAN_EQUAL("lessThanEqual"),
    GREATER_THAN("greaterThan"),
    GREATER_THAN_EQUAL("greaterThanEqual"),
    EQUAL("equal"),
    NOT_EQUAL("notEqual"),
    ANY("any"),
    ALL("all"),
    NOT("not"),

    // Texture lookup
    TEXTURE2D("texture2D");

    private final String glslName;

    BuiltinFunc(String glslName) {
        this.glslName = glslName;
    }

    public String getGlslName() {
        return glslName;
    }
}
