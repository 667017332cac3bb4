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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Root of the IR. Built once by the caller and never modified by the
 * compiler.
 */
public record Program(List<Type> uniforms,
                      List<Type> attributes,
                      List<Type> varyings,
                      List<Func> funcs,
                      VertexFunc vertexFunc,
                      FragmentFunc fragmentFunc) {

    public static final Program EMPTY = new Program(null, null, null, null, null, null);

    public Program {
        uniforms = uniforms == null ? List.of() : List.copyOf(uniforms);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        varyings = varyings == null ? List.of() : List.copyOf(varyings);
        funcs = funcs == null ? List.of() : List.copyOf(funcs);
        vertexFunc = vertexFunc == null ? VertexFunc.EMPTY : vertexFunc;
        fragmentFunc = fragmentFunc == null ? FragmentFunc.EMPTY : fragmentFunc;
    }

    /**
     * Every distinct structure type used by the program, in the order they
     * are first met walking uniforms, attributes, varyings, user functions
     * and the two entry points. Nested structures come before their parent.
     */
    public List<Type> structTypes() {
        Set<Type> out = new LinkedHashSet<>();
        for (Type t : uniforms) {
            t.collectStructs(out);
        }
        for (Type t : attributes) {
            t.collectStructs(out);
        }
        for (Type t : varyings) {
            t.collectStructs(out);
        }
        for (Func f : funcs) {
            f.collectStructs(out);
        }
        vertexFunc.block().collectStructs(out);
        fragmentFunc.block().collectStructs(out);
        return Collections.unmodifiableList(new ArrayList<>(out));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Type> uniforms = new ArrayList<>();
        private final List<Type> attributes = new ArrayList<>();
        private final List<Type> varyings = new ArrayList<>();
        private final List<Func> funcs = new ArrayList<>();
        private VertexFunc vertexFunc = VertexFunc.EMPTY;
        private FragmentFunc fragmentFunc = FragmentFunc.EMPTY;

        public Builder uniforms(Type... types) {
            uniforms.addAll(Arrays.asList(types));
            return this;
        }

        public Builder attributes(Type... types) {
            attributes.addAll(Arrays.asList(types));
            return this;
        }

        public Builder varyings(Type... types) {
            varyings.addAll(Arrays.asList(types));
            return this;
        }

        public Builder func(Func func) {
            funcs.add(func);
            return this;
        }

        public Builder vertex(Block block) {
            this.vertexFunc = new VertexFunc(block);
            return this;
        }

        public Builder fragment(Block block) {
            this.fragmentFunc = new FragmentFunc(block);
            return this;
        }

        public Program build() {
            return new Program(uniforms, attributes, varyings, funcs, vertexFunc, fragmentFunc);
        }
    }
}
