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
import exm.iulia.common.exceptions.UserException;

/**
 * An optimizer pass
 */
public interface OptimizerPass {
  public abstract String getPassName();
  /**
   * @return Key indicating whether pass is enabled.  If null, always enabled
   */
  public abstract String getConfigEnabledKey();
  /**
   * @return the optimized program.  May be the input, modified in place,
   *         or a new tree.
   */
  public abstract Block optimize(Logger logger, Block program)
                                              throws UserException;
}
