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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

import com.dynamo.shaderir.CompileExceptionError;
import com.dynamo.shaderir.ir.Program;
import com.dynamo.shaderir.logging.Logger;

/**
 * Splits the combined output of {@link GlslCompiler} into the source of a
 * single stage by defining the stage symbol ahead of it.
 */
public class StageSources {

    private static Logger logger = Logger.getLogger(StageSources.class.getName());

    public static class Options {
        /**
         * Extra preprocessor definitions, "NAME" or "NAME VALUE", written
         * before the stage symbol.
         */
        public ArrayList<String> defines = new ArrayList<>();
    }

    public static String forStage(String source, ShaderStage stage) {
        return forStage(source, stage, new Options());
    }

    public static String forStage(String source, ShaderStage stage, Options options) {
        StringBuilder sb = new StringBuilder();
        for (String define : options.defines) {
            sb.append("#define ").append(define).append('\n');
        }
        sb.append("#define ").append(stage.getSymbol()).append('\n');
        sb.append(source);
        return sb.toString();
    }

    /**
     * @return true if the program has an entry point for the stage
     */
    public static boolean hasStage(Program program, ShaderStage stage) {
        return switch (stage) {
            case VERTEX -> !program.vertexFunc().block().stmts().isEmpty();
            case FRAGMENT -> !program.fragmentFunc().block().stmts().isEmpty();
        };
    }

    /**
     * Compiles the program once and writes one source file per stage that
     * has an entry point, named baseName.vp and baseName.fp.
     * @param program program to compile
     * @param outputDir directory, created if missing
     * @param baseName file name without extension
     * @param options extra definitions
     * @return the written files, vertex stage first
     */
    public static List<File> write(Program program, File outputDir, String baseName, Options options) throws IOException, CompileExceptionError {
        String source = GlslCompiler.compile(program);
        FileUtils.forceMkdir(outputDir);

        List<File> written = new ArrayList<>();
        for (ShaderStage stage : ShaderStage.values()) {
            if (!hasStage(program, stage)) {
                continue;
            }
            File file = new File(outputDir, baseName + FilenameUtils.EXTENSION_SEPARATOR + stage.getExtension());
            FileUtils.writeStringToFile(file, forStage(source, stage, options), StandardCharsets.UTF_8);
            logger.fine("Wrote %s stage to '%s'", stage.getLabel(), file);
            written.add(file);
        }
        return written;
    }
}
