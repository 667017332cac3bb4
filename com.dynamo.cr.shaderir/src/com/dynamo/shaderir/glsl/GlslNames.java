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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.dynamo.shaderir.CompileExceptionError;
import com.dynamo.shaderir.ir.Func;
import com.dynamo.shaderir.ir.Program;
import com.dynamo.shaderir.ir.Type;

/**
 * Identifiers of everything a program declares. Uniforms, attributes,
 * varyings, structures and structure members are numbered by independent
 * counters in declaration order, user functions by their declaration index
 * and locals by their slot in the enclosing function.
 */
public class GlslNames {

    public static final String UNIFORM_PREFIX = "U";
    public static final String ATTRIBUTE_PREFIX = "A";
    public static final String VARYING_PREFIX = "V";
    public static final String STRUCT_PREFIX = "S";
    public static final String MEMBER_PREFIX = "M";
    public static final String FUNCTION_PREFIX = "F";
    public static final String LOCAL_PREFIX = "l";

    public static final String POSITION = "gl_Position";
    public static final String FRAG_COORD = "gl_FragCoord";

    private final Program program;
    private final List<Type> structTypes;
    private final Map<Type, Integer> structIndices = new HashMap<>();
    private final Set<Integer> funcIndices = new HashSet<>();

    private GlslNames(Program program) {
        this.program = program;
        this.structTypes = program.structTypes();
        for (int i = 0; i < structTypes.size(); ++i) {
            structIndices.put(structTypes.get(i), i);
        }
    }

    /**
     * Numbers every declaration of the program.
     * @param program program to compile
     * @return the names
     * @throws CompileExceptionError if function indices are negative or used twice
     */
    public static GlslNames assign(Program program) throws CompileExceptionError {
        GlslNames names = new GlslNames(program);
        for (Func f : program.funcs()) {
            if (f.index() < 0) {
                throw new CompileExceptionError("functions", String.format(Locale.ROOT, "Negative function index %d", f.index()));
            }
            if (!names.funcIndices.add(f.index())) {
                throw new CompileExceptionError("functions", String.format(Locale.ROOT, "Function index %d is declared more than once", f.index()));
            }
        }
        return names;
    }

    public List<Type> getStructTypes() {
        return structTypes;
    }

    public boolean hasUniform(int index) {
        return index >= 0 && index < program.uniforms().size();
    }

    public String uniform(int index) {
        return UNIFORM_PREFIX + index;
    }

    public String attribute(int index) {
        return ATTRIBUTE_PREFIX + index;
    }

    public String varying(int index) {
        return VARYING_PREFIX + index;
    }

    public boolean hasFunction(int index) {
        return funcIndices.contains(index);
    }

    public String function(int index) {
        return FUNCTION_PREFIX + index;
    }

    public String struct(Type type) {
        Integer index = structIndices.get(type);
        if (index == null) {
            // Every structure reachable from the program is numbered up front
            throw new IllegalStateException("Structure type was not collected: " + type);
        }
        return STRUCT_PREFIX + index;
    }

    public String member(int index) {
        return MEMBER_PREFIX + index;
    }

    /**
     * Spelling of a type where no declarator follows, e.g. a return type.
     */
    public String typeName(Type type) {
        return switch (type.kind()) {
            case ARRAY -> typeName(type.elementType()) + "[" + type.length() + "]";
            case STRUCT -> struct(type);
            default -> type.kind().getGlslName();
        };
    }

    /**
     * Declarator of a named quantity, array lengths go after the name.
     */
    public String varDecl(Type type, String name) {
        StringBuilder dims = new StringBuilder();
        Type base = type;
        while (base.isArray()) {
            dims.append('[').append(base.length()).append(']');
            base = base.elementType();
        }
        return typeName(base) + " " + name + dims;
    }

    /**
     * Scope of a user function, its parameters already declared.
     */
    public LocalScope functionScope(Func func) {
        LocalScope scope = new LocalScope(FUNCTION_PREFIX + func.index(), List.of(), new BitSet());
        for (int i = 0; i < func.paramCount(); ++i) {
            scope.declare();
        }
        return scope;
    }

    public LocalScope vertexScope() {
        List<String> implicit = new ArrayList<>();
        int attributeCount = program.attributes().size();
        for (int i = 0; i < attributeCount; ++i) {
            implicit.add(attribute(i));
        }
        for (int i = 0; i < program.varyings().size(); ++i) {
            implicit.add(varying(i));
        }
        implicit.add(POSITION);

        BitSet readOnly = new BitSet();
        readOnly.set(0, attributeCount);
        return new LocalScope(GlslCompiler.ENTRY_POINT + " (" + ShaderStage.VERTEX.getLabel() + ")", implicit, readOnly);
    }

    public LocalScope fragmentScope() {
        List<String> implicit = new ArrayList<>();
        for (int i = 0; i < program.varyings().size(); ++i) {
            implicit.add(varying(i));
        }
        implicit.add(FRAG_COORD);

        BitSet readOnly = new BitSet();
        readOnly.set(0, implicit.size());
        return new LocalScope(GlslCompiler.ENTRY_POINT + " (" + ShaderStage.FRAGMENT.getLabel() + ")", implicit, readOnly);
    }
}
