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

import java.util.BitSet;
import java.util.List;
import java.util.Locale;

import com.dynamo.shaderir.CompileExceptionError;

/**
 * Local variable slots of one function being rendered.
 *
 * Slots below the local base are implicit (entry point inputs and outputs)
 * and have fixed names. Every other slot is handed out by {@link #declare()}
 * in program order and named "l" followed by its distance from the local
 * base. The slot counter never goes back: leaving a block only hides the
 * slots it declared.
 */
public class LocalScope {

    private final String owner;
    private final List<String> implicitNames;
    private final BitSet readOnly;
    private final BitSet visible = new BitSet();
    private int next;

    LocalScope(String owner, List<String> implicitNames, BitSet readOnly) {
        this.owner = owner;
        this.implicitNames = List.copyOf(implicitNames);
        this.readOnly = (BitSet) readOnly.clone();
        this.next = implicitNames.size();
        this.visible.set(0, next);
    }

    /**
     * @return name of the function owning this scope, used in error messages
     */
    public String getOwner() {
        return owner;
    }

    public int getLocalBase() {
        return implicitNames.size();
    }

    /**
     * @return the next slot {@link #declare()} will hand out
     */
    public int mark() {
        return next;
    }

    public int declare() {
        int slot = next++;
        visible.set(slot);
        return slot;
    }

    /**
     * Skips slots belonging to declarations that are not rendered.
     */
    public void reserve(int count) {
        next += count;
    }

    /**
     * Hides every slot declared since the given mark.
     */
    public void release(int mark) {
        if (mark < next) {
            visible.clear(mark, next);
        }
    }

    public boolean isReadOnly(int slot) {
        return slot >= 0 && readOnly.get(slot);
    }

    public String name(int slot) throws CompileExceptionError {
        if (slot < 0 || !visible.get(slot)) {
            throw new CompileExceptionError(owner, String.format(Locale.ROOT, "Local variable slot %d is not declared in this scope", slot));
        }
        int localBase = implicitNames.size();
        if (slot < localBase) {
            return implicitNames.get(slot);
        }
        return GlslNames.LOCAL_PREFIX + (slot - localBase);
    }
}
