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

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Hands out names that have not been used before.  One dispenser is shared
 * by everything that creates names during a single pass run.
 */
public class NameDispenser {

  private final Set<String> usedNames;

  public NameDispenser() {
    this(Collections.<String>emptySet());
  }

  /**
   * @param usedNames names that must never be handed out
   */
  public NameDispenser(Collection<String> usedNames) {
    this.usedNames = new HashSet<String>(usedNames);
  }

  /**
   * Return prefix if unused, otherwise prefix_1, prefix_2, etc., whichever
   * is the first unused.  The returned name is marked as used.
   * @param prefix
   * @return a name not returned before and not in the initial set
   */
  public String newName(String prefix) {
    String base = prefix.isEmpty() ? "_" : prefix;
    String name = base;
    int counter = 0;
    while (usedNames.contains(name)) {
      counter++;
      name = base + "_" + counter;
    }
    usedNames.add(name);
    return name;
  }

  public boolean isUsed(String name) {
    return usedNames.contains(name);
  }
}
