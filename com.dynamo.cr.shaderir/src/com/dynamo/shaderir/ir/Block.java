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

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * An ordered list of local variable declarations followed by an ordered
 * list of statements. Locals are addressed by {@link Expr.LocalVariable}
 * slots continuing the slot count of the enclosing function.
 */
public record Block(List<Type> localVars, List<Stmt> stmts) {

    public static final Block EMPTY = new Block(List.of(), List.of());

    public Block {
        localVars = localVars == null ? List.of() : List.copyOf(localVars);
        stmts = stmts == null ? List.of() : List.copyOf(stmts);
    }

    public static Block of(Stmt... stmts) {
        return new Block(List.of(), Arrays.asList(stmts));
    }

    public static Block of(List<Type> localVars, Stmt... stmts) {
        return new Block(localVars, Arrays.asList(stmts));
    }

    public boolean isEmpty() {
        return localVars.isEmpty() && stmts.isEmpty();
    }

    /**
     * Structure types of the locals of this block and of every block nested in it.
     */
    public void collectStructs(Collection<Type> out) {
        for (Type t : localVars) {
            t.collectStructs(out);
        }
        for (Stmt stmt : stmts) {
            for (Block child : stmt.blocks()) {
                child.collectStructs(out);
            }
        }
    }
}
