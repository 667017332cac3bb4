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
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import com.dynamo.shaderir.CompileExceptionError;
import com.dynamo.shaderir.ir.Block;
import com.dynamo.shaderir.ir.Expr;
import com.dynamo.shaderir.ir.Func;
import com.dynamo.shaderir.ir.Program;
import com.dynamo.shaderir.ir.Stmt;
import com.dynamo.shaderir.ir.Type;
import com.dynamo.shaderir.logging.Logger;

/**
 * Lowers a {@link Program} to GLSL source text.
 *
 * The output lists structure declarations, uniforms, attributes, varyings
 * and user functions, followed by the vertex and fragment entry points,
 * each guarded by its {@link ShaderStage} symbol so the same text serves
 * both stages. Compilation is a pure function of the program: equal
 * programs give identical text and no state is shared between calls.
 */
public class GlslCompiler {

    public static final String ENTRY_POINT = "main";

    private static final String INDENT = "\t";

    private static Logger logger = Logger.getLogger(GlslCompiler.class.getName());

    private final Program program;
    private final GlslNames names;
    private final List<String> lines = new ArrayList<>();

    private GlslCompiler(Program program, GlslNames names) {
        this.program = program;
        this.names = names;
    }

    /**
     * Compile a program.
     * @param program program to compile
     * @return newline terminated source, or an empty string when nothing is declared
     * @throws CompileExceptionError if the program references an undeclared
     * uniform, function or local slot, assigns to a read-only slot, or holds
     * a malformed loop or literal
     */
    public static String compile(Program program) throws CompileExceptionError {
        GlslCompiler compiler = new GlslCompiler(program, GlslNames.assign(program));
        compiler.writeProgram();

        List<String> lines = compiler.lines;
        logger.fine("Compiled program with %d uniforms, %d attributes, %d varyings, %d functions and %d structs into %d lines",
                program.uniforms().size(), program.attributes().size(), program.varyings().size(),
                program.funcs().size(), compiler.names.getStructTypes().size(), lines.size());

        if (lines.isEmpty()) {
            return "";
        }
        return StringUtils.join(lines, '\n') + "\n";
    }

    private void writeProgram() throws CompileExceptionError {
        writeStructs();

        List<Type> uniforms = program.uniforms();
        for (int i = 0; i < uniforms.size(); ++i) {
            lines.add("uniform " + names.varDecl(uniforms.get(i), names.uniform(i)) + ";");
        }
        List<Type> attributes = program.attributes();
        for (int i = 0; i < attributes.size(); ++i) {
            lines.add("attribute " + names.varDecl(attributes.get(i), names.attribute(i)) + ";");
        }
        List<Type> varyings = program.varyings();
        for (int i = 0; i < varyings.size(); ++i) {
            lines.add("varying " + names.varDecl(varyings.get(i), names.varying(i)) + ";");
        }

        for (Func func : program.funcs()) {
            writeFunc(func);
        }

        writeEntryPoint(ShaderStage.VERTEX, program.vertexFunc().block(), names.vertexScope());
        writeEntryPoint(ShaderStage.FRAGMENT, program.fragmentFunc().block(), names.fragmentScope());
    }

    private void writeStructs() {
        for (Type struct : names.getStructTypes()) {
            lines.add("struct " + names.struct(struct) + " {");
            List<Type> members = struct.members();
            for (int i = 0; i < members.size(); ++i) {
                lines.add(INDENT + names.varDecl(members.get(i), names.member(i)) + ";");
            }
            lines.add("};");
        }
    }

    private void writeFunc(Func func) throws CompileExceptionError {
        LocalScope scope = names.functionScope(func);

        List<String> params = new ArrayList<>();
        int slot = 0;
        for (Type t : func.inParams()) {
            params.add("in " + names.varDecl(t, scope.name(slot++)));
        }
        for (Type t : func.inOutParams()) {
            params.add("inout " + names.varDecl(t, scope.name(slot++)));
        }
        for (Type t : func.outParams()) {
            params.add("out " + names.varDecl(t, scope.name(slot++)));
        }

        String returnType = func.returnType() == null ? "void" : names.typeName(func.returnType());
        String paramList = params.isEmpty() ? "void" : StringUtils.join(params, ", ");
        lines.add(String.format(Locale.ROOT, "%s %s(%s) {", returnType, names.function(func.index()), paramList));
        new BlockWriter(scope, null, 1, 0).writeBlock(func.block());
        lines.add("}");
    }

    private void writeEntryPoint(ShaderStage stage, Block block, LocalScope scope) throws CompileExceptionError {
        if (block.stmts().isEmpty()) {
            return;
        }
        lines.add("#if defined(" + stage.getSymbol() + ")");
        lines.add("void " + ENTRY_POINT + "(void) {");
        new BlockWriter(scope, stage, 1, 0).writeBlock(block);
        lines.add("}");
        lines.add("#endif");
    }

    /**
     * Innermost variable written by an assignment target, looking through
     * field selection and indexing.
     */
    private static Expr assignedVariable(Expr lhs) {
        if (lhs instanceof Expr.FieldSelector selector) {
            return assignedVariable(selector.base());
        }
        if (lhs instanceof Expr.Index index) {
            return assignedVariable(index.base());
        }
        return lhs;
    }

    private class ExprWriter implements Expr.IVisitor<String> {
        private final LocalScope scope;

        ExprWriter(LocalScope scope) {
            this.scope = scope;
        }

        String write(Expr expr) throws CompileExceptionError {
            return expr.accept(this);
        }

        @Override
        public String visitFloatLiteral(Expr.FloatLiteral expr) throws CompileExceptionError {
            if (!Float.isFinite(expr.value())) {
                throw new CompileExceptionError(scope.getOwner(), "Float literal must be finite, got " + expr.value());
            }
            return GlslLiterals.formatFloat(expr.value());
        }

        @Override
        public String visitIntLiteral(Expr.IntLiteral expr) {
            return GlslLiterals.formatInt(expr.value());
        }

        @Override
        public String visitBoolLiteral(Expr.BoolLiteral expr) {
            return GlslLiterals.formatBool(expr.value());
        }

        @Override
        public String visitUniformVariable(Expr.UniformVariable expr) throws CompileExceptionError {
            if (!names.hasUniform(expr.index())) {
                throw new CompileExceptionError(scope.getOwner(), String.format(Locale.ROOT, "Uniform index %d is out of range (%d declared)", expr.index(), program.uniforms().size()));
            }
            return names.uniform(expr.index());
        }

        @Override
        public String visitLocalVariable(Expr.LocalVariable expr) throws CompileExceptionError {
            return scope.name(expr.index());
        }

        @Override
        public String visitBuiltinFunction(Expr.BuiltinFunction expr) {
            return expr.func().getGlslName();
        }

        @Override
        public String visitUserFunction(Expr.UserFunction expr) throws CompileExceptionError {
            if (!names.hasFunction(expr.index())) {
                throw new CompileExceptionError(scope.getOwner(), String.format(Locale.ROOT, "Function index %d is not declared", expr.index()));
            }
            return names.function(expr.index());
        }

        @Override
        public String visitSwizzling(Expr.Swizzling expr) {
            return expr.components();
        }

        @Override
        public String visitUnary(Expr.Unary expr) throws CompileExceptionError {
            return String.format(Locale.ROOT, "%s(%s)", expr.op().getSymbol(), write(expr.operand()));
        }

        @Override
        public String visitBinary(Expr.Binary expr) throws CompileExceptionError {
            return String.format(Locale.ROOT, "(%s) %s (%s)", write(expr.lhs()), expr.op().getSymbol(), write(expr.rhs()));
        }

        @Override
        public String visitSelection(Expr.Selection expr) throws CompileExceptionError {
            return String.format(Locale.ROOT, "(%s) ? (%s) : (%s)", write(expr.condition()), write(expr.whenTrue()), write(expr.whenFalse()));
        }

        @Override
        public String visitCall(Expr.Call expr) throws CompileExceptionError {
            List<String> args = new ArrayList<>();
            for (Expr arg : expr.args()) {
                args.add(write(arg));
            }
            return String.format(Locale.ROOT, "(%s)(%s)", write(expr.callee()), StringUtils.join(args, ", "));
        }

        @Override
        public String visitFieldSelector(Expr.FieldSelector expr) throws CompileExceptionError {
            return String.format(Locale.ROOT, "(%s).%s", write(expr.base()), write(expr.field()));
        }

        @Override
        public String visitIndex(Expr.Index expr) throws CompileExceptionError {
            return String.format(Locale.ROOT, "(%s)[%s]", write(expr.base()), write(expr.index()));
        }
    }

    private class BlockWriter implements Stmt.IVisitor<Void> {
        private final LocalScope scope;
        // null inside user functions
        private final ShaderStage stage;
        private final int level;
        private final int loopDepth;
        private final String indent;
        private final ExprWriter exprs;

        BlockWriter(LocalScope scope, ShaderStage stage, int level, int loopDepth) {
            this.scope = scope;
            this.stage = stage;
            this.level = level;
            this.loopDepth = loopDepth;
            this.indent = StringUtils.repeat(INDENT, level);
            this.exprs = new ExprWriter(scope);
        }

        void writeBlock(Block block) throws CompileExceptionError {
            int mark = scope.mark();
            for (Type t : block.localVars()) {
                lines.add(indent + names.varDecl(t, scope.name(scope.declare())) + ";");
            }
            for (Stmt stmt : block.stmts()) {
                stmt.accept(this);
            }
            scope.release(mark);
        }

        private BlockWriter nested() {
            return new BlockWriter(scope, stage, level + 1, loopDepth);
        }

        @Override
        public Void visitExprStmt(Stmt.ExprStmt stmt) throws CompileExceptionError {
            lines.add(indent + exprs.write(stmt.expr()) + ";");
            return null;
        }

        @Override
        public Void visitAssign(Stmt.Assign stmt) throws CompileExceptionError {
            Expr target = assignedVariable(stmt.lhs());
            if (target instanceof Expr.LocalVariable local && scope.isReadOnly(local.index())) {
                throw new CompileExceptionError(scope.getOwner(), String.format(Locale.ROOT, "Cannot assign to read-only %s", scope.name(local.index())));
            }
            if (target instanceof Expr.UniformVariable uniform) {
                throw new CompileExceptionError(scope.getOwner(), String.format(Locale.ROOT, "Cannot assign to uniform %s", names.uniform(uniform.index())));
            }
            lines.add(String.format(Locale.ROOT, "%s%s = %s;", indent, exprs.write(stmt.lhs()), exprs.write(stmt.rhs())));
            return null;
        }

        @Override
        public Void visitBlockStmt(Stmt.BlockStmt stmt) throws CompileExceptionError {
            lines.add(indent + "{");
            nested().writeBlock(stmt.block());
            lines.add(indent + "}");
            return null;
        }

        @Override
        public Void visitIf(Stmt.If stmt) throws CompileExceptionError {
            lines.add(String.format(Locale.ROOT, "%sif (%s) {", indent, exprs.write(stmt.condition())));
            nested().writeBlock(stmt.thenBlock());
            Block elseBlock = stmt.elseBlock();
            if (!elseBlock.stmts().isEmpty()) {
                lines.add(indent + "} else {");
                nested().writeBlock(elseBlock);
            } else {
                // Slots stay tied to program order even when the branch is dropped
                scope.reserve(elseBlock.localVars().size());
            }
            lines.add(indent + "}");
            return null;
        }

        @Override
        public Void visitFor(Stmt.For stmt) throws CompileExceptionError {
            if (stmt.delta() == 0) {
                throw new CompileExceptionError(scope.getOwner(), "Loop delta must not be 0");
            }
            if (!stmt.op().isComparison()) {
                throw new CompileExceptionError(scope.getOwner(), String.format(Locale.ROOT, "Loop condition needs a comparison, got '%s'", stmt.op().getSymbol()));
            }

            int mark = scope.mark();
            String var = scope.name(scope.declare());
            String step = switch (stmt.delta()) {
                case 1 -> var + "++";
                case -1 -> var + "--";
                default -> var + " += " + stmt.delta();
            };
            lines.add(String.format(Locale.ROOT, "%sfor (int %s = %d; %s %s %d; %s) {",
                    indent, var, stmt.init(), var, stmt.op().getSymbol(), stmt.end(), step));
            new BlockWriter(scope, stage, level + 1, loopDepth + 1).writeBlock(stmt.body());
            scope.release(mark);
            lines.add(indent + "}");
            return null;
        }

        @Override
        public Void visitReturn(Stmt.Return stmt) throws CompileExceptionError {
            if (stmt.value() == null) {
                lines.add(indent + "return;");
            } else {
                lines.add(indent + "return " + exprs.write(stmt.value()) + ";");
            }
            return null;
        }

        @Override
        public Void visitBreak(Stmt.Break stmt) throws CompileExceptionError {
            if (loopDepth == 0) {
                throw new CompileExceptionError(scope.getOwner(), "break outside of a loop");
            }
            lines.add(indent + "break;");
            return null;
        }

        @Override
        public Void visitContinue(Stmt.Continue stmt) throws CompileExceptionError {
            if (loopDepth == 0) {
                throw new CompileExceptionError(scope.getOwner(), "continue outside of a loop");
            }
            lines.add(indent + "continue;");
            return null;
        }

        @Override
        public Void visitDiscard(Stmt.Discard stmt) throws CompileExceptionError {
            if (stage == ShaderStage.VERTEX) {
                throw new CompileExceptionError(scope.getOwner(), "discard is only allowed in the fragment stage");
            }
            lines.add(indent + "discard;");
            return null;
        }
    }
}
