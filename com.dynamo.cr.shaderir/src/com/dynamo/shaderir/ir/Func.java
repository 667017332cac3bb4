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
import java.util.List;

/**
 * A user declared function. Its parameters take the first local slots:
 * in params, then inout params, then out params.
 *
 * @param index       declaration index, names the function and is used by {@link Expr.UserFunction}
 * @param returnType  null for void
 */
public record Func(int index,
                   List<Type> inParams,
                   List<Type> inOutParams,
                   List<Type> outParams,
                   Type returnType,
                   Block block) {

    public Func {
        inParams = inParams == null ? List.of() : List.copyOf(inParams);
        inOutParams = inOutParams == null ? List.of() : List.copyOf(inOutParams);
        outParams = outParams == null ? List.of() : List.copyOf(outParams);
        block = block == null ? Block.EMPTY : block;
    }

    public int paramCount() {
        return inParams.size() + inOutParams.size() + outParams.size();
    }

    public void collectStructs(Collection<Type> out) {
        for (Type t : inParams) {
            t.collectStructs(out);
        }
        for (Type t : inOutParams) {
            t.collectStructs(out);
        }
        for (Type t : outParams) {
            t.collectStructs(out);
        }
        if (returnType != null) {
            returnType.collectStructs(out);
        }
        block.collectStructs(out);
    }

    public static Builder builder(int index) {
        return new Builder(index);
    }

    public static class Builder {
        private final int index;
        private final List<Type> inParams = new ArrayList<>();
        private final List<Type> inOutParams = new ArrayList<>();
        private final List<Type> outParams = new ArrayList<>();
        private Type returnType = null;
        private Block block = Block.EMPTY;

        private Builder(int index) {
            this.index = index;
        }

        public Builder in(Type... types) {
            inParams.addAll(Arrays.asList(types));
            return this;
        }

        public Builder inOut(Type... types) {
            inOutParams.addAll(Arrays.asList(types));
            return this;
        }

        public Builder out(Type... types) {
            outParams.addAll(Arrays.asList(types));
            return this;
        }

        public Builder returns(Type type) {
            this.returnType = type;
            return this;
        }

        public Builder block(Block block) {
            this.block = block;
            return this;
        }

        public Func build() {
            return new Func(index, inParams, inOutParams, outParams, returnType, block);
        }
    }
}
