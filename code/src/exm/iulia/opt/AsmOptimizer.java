/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.iulia.opt;

import java.io.PrintStream;

import org.apache.log4j.Logger;

import exm.iulia.analysis.AnalysisInfo;
import exm.iulia.ast.AsmTree.Block;
import exm.iulia.common.Settings;
import exm.iulia.common.exceptions.UserException;

public class AsmOptimizer {

  /**
   * Optimize the program and return the result.
   *
   * NOTE: the input is not modified, since the first pass copies it
   * @param treeOutput where to log the tree between passes.  Null for
   *              no output
   * @param info analysis of program, from the front end
   * @throws UserException if settings are invalid
   */
  public static Block optimize(Logger logger, PrintStream treeOutput,
              Block program, AnalysisInfo info) throws UserException {
    for (String key: Settings.getKeys()) {
      String setting = String.format("%-30s: %s", key, Settings.get(key));
      logger.debug("Setting " + setting);
      if (treeOutput != null) {
        treeOutput.println("// " + setting);
      }
    }
    if (treeOutput != null) {
      OptimizerPipeline.log(treeOutput, "Initial tree before optimization",
                            program);
    }

    boolean debug = Settings.getBoolean(Settings.COMPILER_DEBUG);

    OptimizerPipeline preprocess = new OptimizerPipeline(treeOutput);
    // Analysis info is only valid for the tree it was computed on
    preprocess.addPass(new UniqueNames(info));
    if (debug)
      preprocess.addPass(new Validate());
    program = preprocess.runPipeline(logger, program, 0);

    OptimizerPipeline pipe = new OptimizerPipeline(treeOutput);
    pipe.addPass(new FunctionInline());
    if (debug)
      pipe.addPass(new Validate());
    program = pipe.runPipeline(logger, program, 1);

    if (treeOutput != null) {
      OptimizerPipeline.log(treeOutput, "Final optimized tree", program);
    }
    return program;
  }
}
