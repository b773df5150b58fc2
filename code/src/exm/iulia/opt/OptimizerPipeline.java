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
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.iulia.ast.AsmPrinter;
import exm.iulia.ast.AsmTree.Block;
import exm.iulia.common.Settings;
import exm.iulia.common.exceptions.InvalidOptionException;
import exm.iulia.common.exceptions.IuliaRuntimeError;
import exm.iulia.common.exceptions.UserException;


public class OptimizerPipeline {

  public OptimizerPipeline(PrintStream treeOutput) {
    this.treeOutput = treeOutput;
  }

  private final List<OptimizerPass> passes = new ArrayList<OptimizerPass>();
  private final PrintStream treeOutput;

  public void addPass(OptimizerPass pass) {
    passes.add(pass);
  }

  /**
   * @return the program after all enabled passes
   */
  public Block runPipeline(Logger logger, Block program, long iteration)
                                                    throws UserException {
    for (OptimizerPass pass: passes) {
      if (passEnabled(pass)) {
        logger.debug("Iteration: " + iteration + " Pass: "
                   + pass.getPassName());
        program = pass.optimize(logger, program);
        if (treeOutput != null) {
          log(treeOutput, "Iteration " + iteration + " after " +
                          pass.getPassName(), program);
        }
      }
    }
    return program;
  }

  public boolean passEnabled(OptimizerPass pass) {
    try {
      String key = pass.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new IuliaRuntimeError("Expected config key " +
                  pass.getConfigEnabledKey() + " to exist");
    }
  }

  static void log(PrintStream out, String title, Block program) {
    out.println("// " + title);
    out.println(AsmPrinter.print(program));
    out.flush();
  }
}
