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

import exm.iulia.analysis.AnalysisInfo;
import exm.iulia.ast.AsmTree.Block;

/**
 * Rename declarations so that every name in the program is unique.
 * Needs analysis info for the tree it is run on, so must run before any
 * pass that changes the tree.
 */
public class UniqueNames implements OptimizerPass {

  private final AnalysisInfo info;

  public UniqueNames(AnalysisInfo info) {
    this.info = info;
  }

  @Override
  public String getPassName() {
    return "Uniquify names";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public Block optimize(Logger logger, Block program) {
    return Disambiguator.disambiguate(logger, program, info);
  }
}
