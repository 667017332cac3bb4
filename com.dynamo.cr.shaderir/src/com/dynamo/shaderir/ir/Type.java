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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Shape of a declared quantity: a basic kind, a fixed-length array of
 * an element type, or a structure made of member types. Types are
 * immutable and compare structurally.
 *
 * @param kind    the type tag
 * @param members element type for arrays (a single entry), member types for structures, empty otherwise
 * @param length  array length, 0 for anything that is not an array
 */
public record Type(Kind kind, List<Type> members, int length) {

    public enum Kind {
        BOOL("bool"),
        INT("int"),
        FLOAT("float"),
        VEC2("vec2"),
        VEC3("vec3"),
        VEC4("vec4"),
        MAT2("mat2"),
        MAT3("mat3"),
        MAT4("mat4"),
        SAMPLER2D("sampler2D"),
        ARRAY(null),
        STRUCT(null);

        private final String glslName;

        Kind(String glslName) {
            this.glslName = glslName;
        }

        /**
         * @return the target spelling of a basic kind, null for arrays and structures
         */
        public String getGlslName() {
            return glslName;
        }

        public boolean isBasic() {
            return glslName != null;
        }
    }

    public static final Type BOOL = new Type(Kind.BOOL);
    public static final Type INT = new Type(Kind.INT);
    public static final Type FLOAT = new Type(Kind.FLOAT);
    public static final Type VEC2 = new Type(Kind.VEC2);
    public static final Type VEC3 = new Type(Kind.VEC3);
    public static final Type VEC4 = new Type(Kind.VEC4);
    public static final Type MAT2 = new Type(Kind.MAT2);
    public static final Type MAT3 = new Type(Kind.MAT3);
    public static final Type MAT4 = new Type(Kind.MAT4);
    public static final Type SAMPLER2D = new Type(Kind.SAMPLER2D);

    public Type {
        if (kind == null) {
            throw new IllegalArgumentException("Type kind must be set");
        }
        members = members == null ? List.of() : List.copyOf(members);
        switch (kind) {
            case ARRAY -> {
                if (members.size() != 1) {
                    throw new IllegalArgumentException("Array type needs exactly one element type");
                }
                if (length < 1) {
                    throw new IllegalArgumentException("Array length must be positive, got " + length);
                }
            }
            case STRUCT -> {
                if (members.isEmpty()) {
                    throw new IllegalArgumentException("Struct type needs at least one member");
                }
                if (length != 0) {
                    throw new IllegalArgumentException("Struct type cannot have a length");
                }
            }
            default -> {
                if (!members.isEmpty() || length != 0) {
                    throw new IllegalArgumentException("Basic type " + kind + " cannot have members or a length");
                }
            }
        }
    }

    private Type(Kind kind) {
        this(kind, List.of(), 0);
    }

    public static Type of(Kind kind) {
        return switch (kind) {
            case BOOL -> BOOL;
            case INT -> INT;
            case FLOAT -> FLOAT;
            case VEC2 -> VEC2;
            case VEC3 -> VEC3;
            case VEC4 -> VEC4;
            case MAT2 -> MAT2;
            case MAT3 -> MAT3;
            case MAT4 -> MAT4;
            case SAMPLER2D -> SAMPLER2D;
            case ARRAY, STRUCT -> throw new IllegalArgumentException(kind + " is not a basic kind");
        };
    }

    public static Type array(Type elementType, int length) {
        if (elementType == null) {
            throw new IllegalArgumentException("Array element type must be set");
        }
        return new Type(Kind.ARRAY, List.of(elementType), length);
    }

    public static Type struct(Type... members) {
        return struct(Arrays.asList(members));
    }

    public static Type struct(List<Type> members) {
        return new Type(Kind.STRUCT, members, 0);
    }

    public boolean isStruct() {
        return kind == Kind.STRUCT;
    }

    public boolean isArray() {
        return kind == Kind.ARRAY;
    }

    public Type elementType() {
        if (!isArray()) {
            throw new IllegalStateException(kind + " has no element type");
        }
        return members.get(0);
    }

    /**
     * Adds every distinct structure type reachable from this type to the
     * output, nested structures before the structure that contains them.
     * Structures already present are not added again.
     * @param out destination, iteration order of the collection is kept
     */
    public void collectStructs(Collection<Type> out) {
        if (kind == Kind.ARRAY || kind == Kind.STRUCT) {
            for (Type member : members) {
                member.collectStructs(out);
            }
        }
        if (kind == Kind.STRUCT && !out.contains(this)) {
            out.add(this);
        }
    }

    public List<Type> structs() {
        List<Type> out = new ArrayList<>();
        collectStructs(out);
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ARRAY -> elementType() + "[" + length + "]";
            case STRUCT -> "struct" + members;
            default -> kind.getGlslName();
        };
    }
}
