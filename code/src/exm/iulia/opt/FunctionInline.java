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

import org.apache.log4j.Logger;

import exm.iulia.ast.AsmTree.Block;
import exm.iulia.common.Logging;
import exm.iulia.common.Settings;
import exm.iulia.common.exceptions.InvalidOptionException;
import exm.iulia.common.exceptions.IuliaRuntimeError;

/**
 * Inline function calls until no more can be inlined.  Each round works
 * from a fresh snapshot of the program, so functions created by an earlier
 * round (copies of nested function definitions) are candidates in the
 * next one.
 */
public class FunctionInline implements OptimizerPass {

  @Override
  public String getPassName() {
    return "Inline functions";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_FULL_INLINE;
  }

  @Override
  public Block optimize(Logger logger, Block program) {
    long maxIters;
    try {
      maxIters = Settings.getLong(Settings.OPT_MAX_ITERATIONS);
    } catch (InvalidOptionException e) {
      throw new IuliaRuntimeError(e.getMessage());
    }

    for (long i = 0; i < maxIters; i++) {
      int inlined = new FullInliner(logger, program).run();
      logger.debug("Inlining round " + i + ": " + inlined + " calls");
      if (inlined == 0) {
        return program;
      }
    }
    Logging.uniqueWarn("Function inlining did not reach a fixed point after "
                        + maxIters + " rounds");
    return program;
  }
}
