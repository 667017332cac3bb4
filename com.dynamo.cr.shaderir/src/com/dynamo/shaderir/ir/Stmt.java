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

import java.util.List;

import com.dynamo.shaderir.CompileExceptionError;

/**
 * Statement tree node, traversed through {@link IVisitor}.
 */
public sealed interface Stmt {

    public interface IVisitor<R> {
        public R visitExprStmt(ExprStmt stmt) throws CompileExceptionError;
        public R visitAssign(Assign stmt) throws CompileExceptionError;
        public R visitBlockStmt(BlockStmt stmt) throws CompileExceptionError;
        public R visitIf(If stmt) throws CompileExceptionError;
        public R visitFor(For stmt) throws CompileExceptionError;
        public R visitReturn(Return stmt) throws CompileExceptionError;
        public R visitBreak(Break stmt) throws CompileExceptionError;
        public R visitContinue(Continue stmt) throws CompileExceptionError;
        public R visitDiscard(Discard stmt) throws CompileExceptionError;
    }

    public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError;

    /**
     * @return the blocks directly owned by this statement, in program order
     */
    public default List<Block> blocks() {
        return List.of();
    }

    public record ExprStmt(Expr expr) implements Stmt {
        public ExprStmt {
            if (expr == null) {
                throw new IllegalArgumentException("Expression statement needs an expression");
            }
        }

        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitExprStmt(this);
        }
    }

    public record Assign(Expr lhs, Expr rhs) implements Stmt {
        public Assign {
            if (lhs == null || rhs == null) {
                throw new IllegalArgumentException("Assignment needs both sides");
            }
        }

        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitAssign(this);
        }
    }

    public record BlockStmt(Block block) implements Stmt {
        public BlockStmt {
            if (block == null) {
                throw new IllegalArgumentException("Block statement needs a block");
            }
        }

        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitBlockStmt(this);
        }

        @Override
        public List<Block> blocks() {
            return List.of(block);
        }
    }

    /**
     * @param elseBlock rendered only when it has statements
     */
    public record If(Expr condition, Block thenBlock, Block elseBlock) implements Stmt {
        public If {
            if (condition == null || thenBlock == null) {
                throw new IllegalArgumentException("If statement needs a condition and a block");
            }
            if (elseBlock == null) {
                elseBlock = Block.EMPTY;
            }
        }

        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitIf(this);
        }

        @Override
        public List<Block> blocks() {
            return List.of(thenBlock, elseBlock);
        }
    }

    /**
     * Counting loop over a fresh int induction variable that takes the next
     * free local slot.
     *
     * @param init  initial value of the induction variable
     * @param end   value compared against
     * @param op    comparison between the induction variable and end
     * @param delta per-iteration step, non-zero
     */
    public record For(int init, int end, BinaryOp op, int delta, Block body) implements Stmt {
        public For {
            if (op == null || body == null) {
                throw new IllegalArgumentException("For statement needs an operator and a body");
            }
        }

        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitFor(this);
        }

        @Override
        public List<Block> blocks() {
            return List.of(body);
        }
    }

    /**
     * @param value null for a bare return
     */
    public record Return(Expr value) implements Stmt {
        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitReturn(this);
        }
    }

    public record Break() implements Stmt {
        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitBreak(this);
        }
    }

    public record Continue() implements Stmt {
        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitContinue(this);
        }
    }

    /**
     * Fragment only.
     */
    public record Discard() implements Stmt {
        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitDiscard(this);
        }
    }

    // Shorthands for building trees

    public static Stmt expr(Expr expr) {
        return new ExprStmt(expr);
    }

    public static Stmt assign(Expr lhs, Expr rhs) {
        return new Assign(lhs, rhs);
    }

    public static Stmt block(Block block) {
        return new BlockStmt(block);
    }

    public static Stmt ifThen(Expr condition, Block thenBlock) {
        return new If(condition, thenBlock, Block.EMPTY);
    }

    public static Stmt ifElse(Expr condition, Block thenBlock, Block elseBlock) {
        return new If(condition, thenBlock, elseBlock);
    }

    public static Stmt forLoop(int init, int end, BinaryOp op, int delta, Block body) {
        return new For(init, end, op, delta, body);
    }

    public static Stmt returnValue(Expr value) {
        return new Return(value);
    }

    public static Stmt returnVoid() {
        return new Return(null);
    }

    public static Stmt breakLoop() {
        return new Break();
    }

    public static Stmt continueLoop() {
        return new Continue();
    }

    public static Stmt discard() {
        return new Discard();
    }
}
