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

import java.util.HashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.iulia.analysis.AnalysisInfo;
import exm.iulia.analysis.Scope;
import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.Declaration;
import exm.iulia.ast.AsmTree.FunctionDefinition;
import exm.iulia.ast.AsmTree.Identifier;
import exm.iulia.ast.AsmTree.Label;
import exm.iulia.common.exceptions.IuliaRuntimeError;
import exm.iulia.common.util.StackLite;

/**
 * Creates a copy of a tree where every declared name is unique across the
 * whole tree.  Names are assigned in program order: the first declaration
 * of a name keeps it, later ones get the first free name_1, name_2, ...
 *
 * Uses of names are resolved through the binding information of the
 * analysis that produced the tree.  Running the pass on its own output
 * changes nothing.
 */
public class Disambiguator extends AsmCopier {

  private final Logger logger;
  private final AnalysisInfo info;

  /** Starts empty: names are only taken once a declaration is seen */
  private final NameDispenser nameDispenser = new NameDispenser();

  private final StackLite<ScopeFrame> frames = new StackLite<ScopeFrame>();

  private boolean done = false;

  public Disambiguator(Logger logger, AnalysisInfo info) {
    this.logger = logger;
    this.info = info;
  }

  public static Block disambiguate(Logger logger, Block program,
                                   AnalysisInfo info) {
    return new Disambiguator(logger, info).run(program);
  }

  /**
   * @param program tree that info was computed for
   * @return renamed copy of program
   */
  public Block run(Block program) {
    if (done) {
      throw new IuliaRuntimeError("Disambiguator can only be run once");
    }
    done = true;
    Block result = copy(program);
    assert(frames.isEmpty()) : frames;
    return result;
  }

  @Override
  protected void enterScope(Block block) {
    frames.push(new ScopeFrame(info.scopeOpenedBy(block)));
  }

  @Override
  protected void leaveScope(Block block) {
    popFrame(info.scopeOpenedBy(block));
  }

  @Override
  protected void enterFunction(FunctionDefinition fn) {
    frames.push(new ScopeFrame(info.scopeOpenedBy(fn)));
  }

  @Override
  protected void leaveFunction(FunctionDefinition fn) {
    popFrame(info.scopeOpenedBy(fn));
  }

  private void popFrame(Scope expected) {
    ScopeFrame frame = frames.pop();
    if (frame.scope != expected) {
      throw new IuliaRuntimeError("Scope mismatch: left " + frame.scope +
                                  " but expected " + expected);
    }
  }

  @Override
  protected String translateDeclaredName(Declaration decl) {
    String name = decl.getName();
    ScopeFrame frame = findFrame(info.declarationScope(decl), name);
    String translated = frame.renames.get(name);
    if (translated == null) {
      return bind(frame, name);
    } else if (isVisibleInWholeScope(decl)) {
      // Already named by a reference preceding the definition
      return translated;
    } else {
      throw new IuliaRuntimeError("Duplicate declaration of " + name +
                                  " in " + frame.scope);
    }
  }

  @Override
  protected String translateReferencedName(Identifier ref) {
    Declaration decl = info.resolve(ref);
    if (decl == AnalysisInfo.PRIMITIVE) {
      return ref.getName();
    }
    String name = decl.getName();
    ScopeFrame frame = findFrame(info.declarationScope(decl), name);
    String translated = frame.renames.get(name);
    if (translated != null) {
      return translated;
    } else if (isVisibleInWholeScope(decl)) {
      return bind(frame, name);
    } else {
      throw new IuliaRuntimeError("Variable " + name +
                                  " referenced before its declaration");
    }
  }

  private static boolean isVisibleInWholeScope(Declaration decl) {
    return decl instanceof FunctionDefinition || decl instanceof Label;
  }

  /**
   * Search from innermost to outermost scope
   */
  private ScopeFrame findFrame(Scope scope, String name) {
    for (int depth = 0; depth < frames.size(); depth++) {
      ScopeFrame frame = frames.peek(depth);
      if (frame.scope == scope) {
        return frame;
      }
    }
    throw new IuliaRuntimeError("Scope declaring " + name +
                                " does not enclose its use");
  }

  private String bind(ScopeFrame frame, String name) {
    String translated = nameDispenser.newName(name);
    frame.renames.put(name, translated);
    if (!translated.equals(name) && logger.isTraceEnabled()) {
      logger.trace("Renamed " + name + " to " + translated);
    }
    return translated;
  }

  private static class ScopeFrame {
    final Scope scope;
    /** Name as written in this scope -> name in output */
    final Map<String, String> renames = new HashMap<String, String>();

    ScopeFrame(Scope scope) {
      this.scope = scope;
    }

    @Override
    public String toString() {
      return scope + " " + renames;
    }
  }
}
