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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import static com.dynamo.shaderir.ir.Expr.binary;
import static com.dynamo.shaderir.ir.Expr.builtin;
import static com.dynamo.shaderir.ir.Expr.call;
import static com.dynamo.shaderir.ir.Expr.fieldSelector;
import static com.dynamo.shaderir.ir.Expr.floatLiteral;
import static com.dynamo.shaderir.ir.Expr.function;
import static com.dynamo.shaderir.ir.Expr.index;
import static com.dynamo.shaderir.ir.Expr.intLiteral;
import static com.dynamo.shaderir.ir.Expr.local;
import static com.dynamo.shaderir.ir.Expr.selection;
import static com.dynamo.shaderir.ir.Expr.swizzling;
import static com.dynamo.shaderir.ir.Expr.unary;
import static com.dynamo.shaderir.ir.Expr.uniform;
import static com.dynamo.shaderir.ir.Stmt.assign;
import static com.dynamo.shaderir.ir.Stmt.expr;
import static com.dynamo.shaderir.ir.Stmt.forLoop;
import static com.dynamo.shaderir.ir.Stmt.ifElse;
import static com.dynamo.shaderir.ir.Stmt.ifThen;
import static com.dynamo.shaderir.ir.Stmt.returnValue;

import java.util.List;

import org.junit.Test;

import com.dynamo.shaderir.ir.BinaryOp;
import com.dynamo.shaderir.ir.Block;
import com.dynamo.shaderir.ir.BuiltinFunc;
import com.dynamo.shaderir.ir.Func;
import com.dynamo.shaderir.ir.Program;
import com.dynamo.shaderir.ir.Stmt;
import com.dynamo.shaderir.ir.Type;
import com.dynamo.shaderir.ir.UnaryOp;

public class GlslCompilerTest {

    private static Program funcProgram(Func func) {
        return Program.builder().func(func).build();
    }

    private static void assertGlsl(String expected, Program program) throws Exception {
        assertEquals(expected + "\n", GlslCompiler.compile(program));
    }

    @Test
    public void testEmpty() throws Exception {
        assertEquals("", GlslCompiler.compile(Program.EMPTY));
        assertEquals("", GlslCompiler.compile(Program.builder().build()));
    }

    @Test
    public void testEmptyEntryPoints() throws Exception {
        Program program = Program.builder()
                .vertex(Block.EMPTY)
                .fragment(new Block(List.of(Type.VEC4), List.of()))
                .build();
        assertEquals("", GlslCompiler.compile(program));
    }

    @Test
    public void testUniform() throws Exception {
        assertGlsl("uniform float U0;", Program.builder().uniforms(Type.FLOAT).build());
    }

    @Test
    public void testUniformStruct() throws Exception {
        Program program = Program.builder()
                .uniforms(Type.struct(Type.FLOAT))
                .build();
        assertGlsl("struct S0 {\n" +
                   "\tfloat M0;\n" +
                   "};\n" +
                   "uniform S0 U0;", program);
    }

    @Test
    public void testVars() throws Exception {
        Program program = Program.builder()
                .uniforms(Type.FLOAT)
                .attributes(Type.VEC2)
                .varyings(Type.VEC3)
                .build();
        assertGlsl("uniform float U0;\n" +
                   "attribute vec2 A0;\n" +
                   "varying vec3 V0;", program);
    }

    @Test
    public void testArrays() throws Exception {
        Program program = Program.builder()
                .uniforms(Type.array(Type.VEC4, 4), Type.array(Type.array(Type.FLOAT, 3), 2))
                .func(Func.builder(0)
                        .in(Type.array(Type.FLOAT, 2))
                        .returns(Type.array(Type.FLOAT, 2))
                        .block(Block.of(returnValue(local(0))))
                        .build())
                .build();
        assertGlsl("uniform vec4 U0[4];\n" +
                   "uniform float U1[2][3];\n" +
                   "float[2] F0(in float l0[2]) {\n" +
                   "\treturn l0;\n" +
                   "}", program);
    }

    @Test
    public void testFunc() throws Exception {
        assertGlsl("void F0(void) {\n" +
                   "}", funcProgram(Func.builder(0).build()));
    }

    @Test
    public void testFuncParams() throws Exception {
        Func func = Func.builder(0)
                .in(Type.FLOAT, Type.VEC2, Type.VEC4)
                .inOut(Type.MAT2)
                .out(Type.MAT4)
                .build();
        assertGlsl("void F0(in float l0, in vec2 l1, in vec4 l2, inout mat2 l3, out mat4 l4) {\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testFuncReturn() throws Exception {
        Func func = Func.builder(0)
                .in(Type.FLOAT)
                .returns(Type.FLOAT)
                .block(Block.of(returnValue(local(0))))
                .build();
        assertGlsl("float F0(in float l0) {\n" +
                   "\treturn l0;\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testFuncLocals() throws Exception {
        Func func = Func.builder(0)
                .in(Type.FLOAT)
                .inOut(Type.FLOAT)
                .out(Type.FLOAT)
                .block(Block.of(List.of(Type.MAT4, Type.MAT4)))
                .build();
        assertGlsl("void F0(in float l0, inout float l1, out float l2) {\n" +
                   "\tmat4 l3;\n" +
                   "\tmat4 l4;\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testFuncBlocks() throws Exception {
        Func func = Func.builder(0)
                .in(Type.FLOAT)
                .inOut(Type.FLOAT)
                .out(Type.FLOAT)
                .block(Block.of(List.of(Type.MAT4, Type.MAT4),
                        Stmt.block(Block.of(List.of(Type.MAT4, Type.MAT4)))))
                .build();
        assertGlsl("void F0(in float l0, inout float l1, out float l2) {\n" +
                   "\tmat4 l3;\n" +
                   "\tmat4 l4;\n" +
                   "\t{\n" +
                   "\t\tmat4 l5;\n" +
                   "\t\tmat4 l6;\n" +
                   "\t}\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testAssignOutFromIn() throws Exception {
        Func func = Func.builder(0)
                .in(Type.FLOAT)
                .out(Type.FLOAT)
                .block(Block.of(assign(local(1), local(0))))
                .build();
        assertGlsl("void F0(in float l0, out float l1) {\n" +
                   "\tl1 = l0;\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testAdd() throws Exception {
        Func func = Func.builder(0)
                .in(Type.FLOAT, Type.FLOAT)
                .out(Type.FLOAT)
                .block(Block.of(assign(local(2), binary(BinaryOp.ADD, local(0), local(1)))))
                .build();
        assertGlsl("void F0(in float l0, in float l1, out float l2) {\n" +
                   "\tl2 = (l0) + (l1);\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testNestedBinaryIsFullyParenthesized() throws Exception {
        Func func = Func.builder(0)
                .in(Type.FLOAT, Type.FLOAT, Type.FLOAT)
                .out(Type.FLOAT)
                .block(Block.of(assign(local(3),
                        binary(BinaryOp.MUL,
                                binary(BinaryOp.ADD, local(0), local(1)),
                                binary(BinaryOp.SUB, local(2), unary(UnaryOp.NEGATE, local(0)))))))
                .build();
        assertGlsl("void F0(in float l0, in float l1, in float l2, out float l3) {\n" +
                   "\tl3 = ((l0) + (l1)) * ((l2) - (-(l0)));\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testSelection() throws Exception {
        Func func = Func.builder(0)
                .in(Type.BOOL, Type.FLOAT, Type.FLOAT)
                .out(Type.FLOAT)
                .block(Block.of(assign(local(3), selection(local(0), local(1), local(2)))))
                .build();
        assertGlsl("void F0(in bool l0, in float l1, in float l2, out float l3) {\n" +
                   "\tl3 = (l0) ? (l1) : (l2);\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testCall() throws Exception {
        Program program = Program.builder()
                .func(Func.builder(0)
                        .in(Type.FLOAT, Type.FLOAT)
                        .out(Type.VEC2)
                        .block(Block.of(
                                expr(call(function(1))),
                                assign(local(2), call(function(2), local(0), local(1)))))
                        .build())
                .func(Func.builder(1).build())
                .func(Func.builder(2)
                        .in(Type.FLOAT, Type.FLOAT)
                        .returns(Type.VEC2)
                        .block(Block.of(returnValue(call(builtin(BuiltinFunc.VEC2_F), local(0), local(1)))))
                        .build())
                .build();
        assertGlsl("void F0(in float l0, in float l1, out vec2 l2) {\n" +
                   "\t(F1)();\n" +
                   "\tl2 = (F2)(l0, l1);\n" +
                   "}\n" +
                   "void F1(void) {\n" +
                   "}\n" +
                   "vec2 F2(in float l0, in float l1) {\n" +
                   "\treturn (vec2)(l0, l1);\n" +
                   "}", program);
    }

    @Test
    public void testSparseFunctionIndices() throws Exception {
        Program program = Program.builder()
                .func(Func.builder(7).block(Block.of(expr(call(function(3))))).build())
                .func(Func.builder(3).build())
                .build();
        assertGlsl("void F7(void) {\n" +
                   "\t(F3)();\n" +
                   "}\n" +
                   "void F3(void) {\n" +
                   "}", program);
    }

    @Test
    public void testBuiltinFunc() throws Exception {
        Func func = Func.builder(0)
                .in(Type.FLOAT, Type.FLOAT)
                .out(Type.FLOAT)
                .block(Block.of(assign(local(2), call(builtin(BuiltinFunc.MIN), local(0), local(1)))))
                .build();
        assertGlsl("void F0(in float l0, in float l1, out float l2) {\n" +
                   "\tl2 = (min)(l0, l1);\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testFieldSelector() throws Exception {
        Func func = Func.builder(0)
                .in(Type.VEC4)
                .out(Type.VEC2)
                .block(Block.of(assign(local(1), fieldSelector(local(0), swizzling("xz")))))
                .build();
        assertGlsl("void F0(in vec4 l0, out vec2 l1) {\n" +
                   "\tl1 = (l0).xz;\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testStructMemberAndIndex() throws Exception {
        Type light = Type.struct(Type.VEC3, Type.FLOAT);
        Program program = Program.builder()
                .uniforms(Type.array(light, 2))
                .func(Func.builder(0)
                        .out(Type.FLOAT)
                        .block(Block.of(assign(local(0),
                                fieldSelector(index(uniform(0), intLiteral(1)), swizzling("M1")))))
                        .build())
                .build();
        assertGlsl("struct S0 {\n" +
                   "\tvec3 M0;\n" +
                   "\tfloat M1;\n" +
                   "};\n" +
                   "uniform S0 U0[2];\n" +
                   "void F0(out float l0) {\n" +
                   "\tl0 = ((U0)[1]).M1;\n" +
                   "}", program);
    }

    @Test
    public void testIf() throws Exception {
        Func func = Func.builder(0)
                .in(Type.FLOAT, Type.FLOAT)
                .out(Type.FLOAT)
                .block(Block.of(ifElse(
                        binary(BinaryOp.EQUAL, local(0), floatLiteral(0)),
                        Block.of(assign(local(2), local(0))),
                        Block.of(assign(local(2), local(1))))))
                .build();
        assertGlsl("void F0(in float l0, in float l1, out float l2) {\n" +
                   "\tif ((l0) == (0.000000000e+00)) {\n" +
                   "\t\tl2 = l0;\n" +
                   "\t} else {\n" +
                   "\t\tl2 = l1;\n" +
                   "\t}\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testIfWithoutElse() throws Exception {
        Func func = Func.builder(0)
                .in(Type.BOOL)
                .out(Type.FLOAT)
                .block(Block.of(ifThen(local(0), Block.of(assign(local(1), floatLiteral(1.5f))))))
                .build();
        assertGlsl("void F0(in bool l0, out float l1) {\n" +
                   "\tif (l0) {\n" +
                   "\t\tl1 = 1.500000000e+00;\n" +
                   "\t}\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testFor() throws Exception {
        Func func = Func.builder(0)
                .in(Type.FLOAT, Type.FLOAT)
                .out(Type.FLOAT)
                .block(Block.of(forLoop(0, 100, BinaryOp.LESS_THAN, 1,
                        Block.of(assign(local(2), local(0))))))
                .build();
        assertGlsl("void F0(in float l0, in float l1, out float l2) {\n" +
                   "\tfor (int l3 = 0; l3 < 100; l3++) {\n" +
                   "\t\tl2 = l0;\n" +
                   "\t}\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testForDeltas() throws Exception {
        Func func = Func.builder(0)
                .block(Block.of(
                        forLoop(10, 0, BinaryOp.GREATER_THAN, -1, Block.EMPTY),
                        forLoop(0, 16, BinaryOp.LESS_EQUAL, 4, Block.of(Stmt.breakLoop())),
                        forLoop(8, -8, BinaryOp.GREATER_EQUAL, -2, Block.of(Stmt.continueLoop()))))
                .build();
        assertGlsl("void F0(void) {\n" +
                   "\tfor (int l0 = 10; l0 > 0; l0--) {\n" +
                   "\t}\n" +
                   "\tfor (int l1 = 0; l1 <= 16; l1 += 4) {\n" +
                   "\t\tbreak;\n" +
                   "\t}\n" +
                   "\tfor (int l2 = 8; l2 >= -8; l2 += -2) {\n" +
                   "\t\tcontinue;\n" +
                   "\t}\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testForBodyLocalsFollowInductionVariable() throws Exception {
        Func func = Func.builder(0)
                .in(Type.FLOAT)
                .block(Block.of(List.of(Type.VEC2),
                        forLoop(0, 4, BinaryOp.LESS_THAN, 1,
                                Block.of(List.of(Type.FLOAT), assign(local(3), local(2))))))
                .build();
        assertGlsl("void F0(in float l0) {\n" +
                   "\tvec2 l1;\n" +
                   "\tfor (int l2 = 0; l2 < 4; l2++) {\n" +
                   "\t\tfloat l3;\n" +
                   "\t\tl3 = l2;\n" +
                   "\t}\n" +
                   "}", funcProgram(func));
    }

    @Test
    public void testVertexFunc() throws Exception {
        Program program = Program.builder()
                .uniforms(Type.FLOAT)
                .attributes(Type.VEC4, Type.FLOAT, Type.VEC2)
                .varyings(Type.FLOAT, Type.VEC2)
                .vertex(Block.of(
                        assign(local(5), local(0)),
                        assign(local(3), local(1)),
                        assign(local(4), local(2))))
                .build();
        assertGlsl("uniform float U0;\n" +
                   "attribute vec4 A0;\n" +
                   "attribute float A1;\n" +
                   "attribute vec2 A2;\n" +
                   "varying float V0;\n" +
                   "varying vec2 V1;\n" +
                   "#if defined(COMPILING_VERTEX_SHADER)\n" +
                   "void main(void) {\n" +
                   "\tgl_Position = A0;\n" +
                   "\tV0 = A1;\n" +
                   "\tV1 = A2;\n" +
                   "}\n" +
                   "#endif", program);
    }

    @Test
    public void testVertexFuncLocals() throws Exception {
        Program program = Program.builder()
                .attributes(Type.VEC4)
                .varyings(Type.VEC2)
                .vertex(Block.of(List.of(Type.VEC4),
                        assign(local(3), local(0)),
                        assign(local(2), local(3))))
                .build();
        assertGlsl("attribute vec4 A0;\n" +
                   "varying vec2 V0;\n" +
                   "#if defined(COMPILING_VERTEX_SHADER)\n" +
                   "void main(void) {\n" +
                   "\tvec4 l0;\n" +
                   "\tl0 = A0;\n" +
                   "\tgl_Position = l0;\n" +
                   "}\n" +
                   "#endif", program);
    }

    @Test
    public void testFragmentFunc() throws Exception {
        Program program = Program.builder()
                .uniforms(Type.FLOAT)
                .attributes(Type.VEC4, Type.FLOAT, Type.VEC2)
                .varyings(Type.FLOAT, Type.VEC2)
                .vertex(Block.of(
                        assign(local(5), local(0)),
                        assign(local(3), local(1)),
                        assign(local(4), local(2))))
                .fragment(Block.of(List.of(Type.VEC2, Type.VEC4, Type.FLOAT),
                        assign(local(5), local(0)),
                        assign(local(3), local(1)),
                        assign(local(4), local(2))))
                .build();
        assertGlsl("uniform float U0;\n" +
                   "attribute vec4 A0;\n" +
                   "attribute float A1;\n" +
                   "attribute vec2 A2;\n" +
                   "varying float V0;\n" +
                   "varying vec2 V1;\n" +
                   "#if defined(COMPILING_VERTEX_SHADER)\n" +
                   "void main(void) {\n" +
                   "\tgl_Position = A0;\n" +
                   "\tV0 = A1;\n" +
                   "\tV1 = A2;\n" +
                   "}\n" +
                   "#endif\n" +
                   "#if defined(COMPILING_FRAGMENT_SHADER)\n" +
                   "void main(void) {\n" +
                   "\tvec2 l0;\n" +
                   "\tvec4 l1;\n" +
                   "\tfloat l2;\n" +
                   "\tl2 = V0;\n" +
                   "\tl0 = V1;\n" +
                   "\tl1 = gl_FragCoord;\n" +
                   "}\n" +
                   "#endif", program);
    }

    @Test
    public void testFragmentDiscard() throws Exception {
        Program program = Program.builder()
                .varyings(Type.FLOAT)
                .fragment(Block.of(ifThen(
                        binary(BinaryOp.LESS_THAN, local(0), floatLiteral(0.5f)),
                        Block.of(Stmt.discard()))))
                .build();
        assertGlsl("varying float V0;\n" +
                   "#if defined(COMPILING_FRAGMENT_SHADER)\n" +
                   "void main(void) {\n" +
                   "\tif ((V0) < (5.000000000e-01)) {\n" +
                   "\t\tdiscard;\n" +
                   "\t}\n" +
                   "}\n" +
                   "#endif", program);
    }

    @Test
    public void testDeterminism() throws Exception {
        Type material = Type.struct(Type.VEC4, Type.struct(Type.FLOAT, Type.INT));
        Program program = Program.builder()
                .uniforms(material, Type.SAMPLER2D)
                .attributes(Type.VEC4)
                .varyings(Type.VEC2)
                .func(Func.builder(0)
                        .in(material)
                        .returns(Type.VEC4)
                        .block(Block.of(returnValue(fieldSelector(local(0), swizzling("M0")))))
                        .build())
                .vertex(Block.of(assign(local(2), local(0))))
                .fragment(Block.of(List.of(Type.VEC4),
                        assign(local(2), call(builtin(BuiltinFunc.TEXTURE2D), uniform(1), local(0)))))
                .build();
        String first = GlslCompiler.compile(program);
        String second = GlslCompiler.compile(program);
        assertEquals(first, second);
        assertTrue(first.endsWith("\n"));
    }
}
