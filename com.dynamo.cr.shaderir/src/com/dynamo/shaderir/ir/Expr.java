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
import java.util.List;

import com.dynamo.shaderir.CompileExceptionError;

/**
 * Expression tree node. Nodes are immutable; every traversal goes through
 * {@link IVisitor} so that each variant has to be handled.
 */
public sealed interface Expr {

    public interface IVisitor<R> {
        public R visitFloatLiteral(FloatLiteral expr) throws CompileExceptionError;
        public R visitIntLiteral(IntLiteral expr) throws CompileExceptionError;
        public R visitBoolLiteral(BoolLiteral expr) throws CompileExceptionError;
        public R visitUniformVariable(UniformVariable expr) throws CompileExceptionError;
        public R visitLocalVariable(LocalVariable expr) throws CompileExceptionError;
        public R visitBuiltinFunction(BuiltinFunction expr) throws CompileExceptionError;
        public R visitUserFunction(UserFunction expr) throws CompileExceptionError;
        public R visitSwizzling(Swizzling expr) throws CompileExceptionError;
        public R visitUnary(Unary expr) throws CompileExceptionError;
        public R visitBinary(Binary expr) throws CompileExceptionError;
        public R visitSelection(Selection expr) throws CompileExceptionError;
        public R visitCall(Call expr) throws CompileExceptionError;
        public R visitFieldSelector(FieldSelector expr) throws CompileExceptionError;
        public R visitIndex(Index expr) throws CompileExceptionError;
    }

    public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError;

    public record FloatLiteral(float value) implements Expr {
        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitFloatLiteral(this);
        }
    }

    public record IntLiteral(int value) implements Expr {
        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitIntLiteral(this);
        }
    }

    public record BoolLiteral(boolean value) implements Expr {
        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitBoolLiteral(this);
        }
    }

    /**
     * @param index position of the uniform in {@link Program#uniforms()}
     */
    public record UniformVariable(int index) implements Expr {
        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitUniformVariable(this);
        }
    }

    /**
     * @param index flattened slot of the parameter or local in the enclosing function
     */
    public record LocalVariable(int index) implements Expr {
        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitLocalVariable(this);
        }
    }

    public record BuiltinFunction(BuiltinFunc func) implements Expr {
        public BuiltinFunction {
            if (func == null) {
                throw new IllegalArgumentException("Builtin function must be set");
            }
        }

        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitBuiltinFunction(this);
        }
    }

    /**
     * @param index declaration index of the called {@link Func}
     */
    public record UserFunction(int index) implements Expr {
        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitUserFunction(this);
        }
    }

    /**
     * Component selection such as "xz", used as the field of a {@link FieldSelector}.
     */
    public record Swizzling(String components) implements Expr {
        public Swizzling {
            if (components == null || components.isEmpty()) {
                throw new IllegalArgumentException("Swizzling needs at least one component");
            }
        }

        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitSwizzling(this);
        }
    }

    public record Unary(UnaryOp op, Expr operand) implements Expr {
        public Unary {
            if (op == null || operand == null) {
                throw new IllegalArgumentException("Unary expression needs an operator and an operand");
            }
        }

        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitUnary(this);
        }
    }

    public record Binary(BinaryOp op, Expr lhs, Expr rhs) implements Expr {
        public Binary {
            if (op == null || lhs == null || rhs == null) {
                throw new IllegalArgumentException("Binary expression needs an operator and two operands");
            }
        }

        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitBinary(this);
        }
    }

    public record Selection(Expr condition, Expr whenTrue, Expr whenFalse) implements Expr {
        public Selection {
            if (condition == null || whenTrue == null || whenFalse == null) {
                throw new IllegalArgumentException("Selection needs a condition and two branches");
            }
        }

        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitSelection(this);
        }
    }

    public record Call(Expr callee, List<Expr> args) implements Expr {
        public Call {
            if (callee == null) {
                throw new IllegalArgumentException("Call needs a callee");
            }
            args = args == null ? List.of() : List.copyOf(args);
        }

        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitCall(this);
        }
    }

    public record FieldSelector(Expr base, Expr field) implements Expr {
        public FieldSelector {
            if (base == null || field == null) {
                throw new IllegalArgumentException("Field selector needs a base and a field");
            }
        }

        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitFieldSelector(this);
        }
    }

    public record Index(Expr base, Expr index) implements Expr {
        public Index {
            if (base == null || index == null) {
                throw new IllegalArgumentException("Index expression needs a base and an index");
            }
        }

        public <R> R accept(IVisitor<R> visitor) throws CompileExceptionError {
            return visitor.visitIndex(this);
        }
    }

    // Shorthands for building trees

    public static Expr floatLiteral(float value) {
        return new FloatLiteral(value);
    }

    public static Expr intLiteral(int value) {
        return new IntLiteral(value);
    }

    public static Expr boolLiteral(boolean value) {
        return new BoolLiteral(value);
    }

    public static Expr uniform(int index) {
        return new UniformVariable(index);
    }

    public static Expr local(int index) {
        return new LocalVariable(index);
    }

    public static Expr builtin(BuiltinFunc func) {
        return new BuiltinFunction(func);
    }

    public static Expr function(int index) {
        return new UserFunction(index);
    }

    public static Expr swizzling(String components) {
        return new Swizzling(components);
    }

    public static Expr unary(UnaryOp op, Expr operand) {
        return new Unary(op, operand);
    }

    public static Expr binary(BinaryOp op, Expr lhs, Expr rhs) {
        return new Binary(op, lhs, rhs);
    }

    public static Expr selection(Expr condition, Expr whenTrue, Expr whenFalse) {
        return new Selection(condition, whenTrue, whenFalse);
    }

    public static Expr call(Expr callee, Expr... args) {
        return new Call(callee, Arrays.asList(args));
    }

    public static Expr fieldSelector(Expr base, Expr field) {
        return new FieldSelector(base, field);
    }

    public static Expr index(Expr base, Expr index) {
        return new Index(base, index);
    }
}
