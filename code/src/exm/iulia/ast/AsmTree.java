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
package exm.iulia.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;

/**
 * This has the definitions for the assembly tree consumed and produced by
 * the optimizer.
 *
 * The tree looks like:
 *
 * Block -> Statement
 *       -> FunctionDefinition -> parameters, returns, Block
 *       -> VariableDeclaration -> Expression
 *       -> If/Switch/ForLoop   -> Expression, Block(s)
 *
 * Expression -> FunctionCall | FunctionalInstruction -> Expression*
 *            -> Identifier | Literal
 *
 * The set of node kinds is closed: every node reports its {@link NodeKind}
 * and passes dispatch on it.  Nodes compare by identity.
 */
public class AsmTree {

  public static enum NodeKind {
    BLOCK,
    FUNCTION_DEFINITION,
    VARIABLE_DECLARATION,
    ASSIGNMENT,
    IF,
    SWITCH,
    FOR_LOOP,
    FUNCTION_CALL,
    FUNCTIONAL_INSTRUCTION,
    INSTRUCTION,
    IDENTIFIER,
    LITERAL,
    LABEL,
    STACK_ASSIGNMENT,
  }

  public static interface Node {
    public NodeKind kind();
  }

  /** Anything that can appear in a block */
  public static interface Statement extends Node {
  }

  /**
   * Expressions can also appear directly in a block as expression
   * statements
   */
  public static interface Expression extends Statement {
  }

  /** Something that introduces a name */
  public static interface Declaration {
    public String getName();
  }

  private static abstract class NodeBase implements Node {
    @Override
    public String toString() {
      return AsmPrinter.print(this);
    }
  }

  public static class TypedName implements Declaration {
    private final String name;
    private final String type;

    public TypedName(String name) {
      this(name, "");
    }

    public TypedName(String name, String type) {
      assert(name != null && type != null);
      this.name = name;
      this.type = type;
    }

    @Override
    public String getName() {
      return name;
    }

    /**
     * @return type name, or empty string if untyped
     */
    public String getType() {
      return type;
    }

    public boolean hasType() {
      return !type.isEmpty();
    }

    @Override
    public String toString() {
      return hasType() ? name + ":" + type : name;
    }
  }

  public static class Block extends NodeBase implements Statement {
    private final ArrayList<Statement> statements;

    public Block() {
      this.statements = new ArrayList<Statement>();
    }

    public Block(List<? extends Statement> statements) {
      this.statements = new ArrayList<Statement>(statements);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BLOCK;
    }

    public List<Statement> getStatements() {
      return Collections.unmodifiableList(statements);
    }

    public void addStatement(Statement stmt) {
      statements.add(stmt);
    }

    public ListIterator<Statement> statementIterator() {
      return statements.listIterator();
    }
  }

  public static class FunctionDefinition extends NodeBase
                                  implements Statement, Declaration {
    private final String name;
    private final List<TypedName> parameters;
    private final List<TypedName> returns;
    private final Block body;

    public FunctionDefinition(String name, List<TypedName> parameters,
                              List<TypedName> returns, Block body) {
      this.name = name;
      this.parameters = new ArrayList<TypedName>(parameters);
      this.returns = new ArrayList<TypedName>(returns);
      this.body = body;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.FUNCTION_DEFINITION;
    }

    @Override
    public String getName() {
      return name;
    }

    public List<TypedName> getParameters() {
      return Collections.unmodifiableList(parameters);
    }

    public List<TypedName> getReturns() {
      return Collections.unmodifiableList(returns);
    }

    public Block getBody() {
      return body;
    }
  }

  public static class VariableDeclaration extends NodeBase
                                          implements Statement {
    private final List<TypedName> variables;
    /** Null if not initialized */
    private Expression value;

    public VariableDeclaration(List<TypedName> variables, Expression value) {
      assert(!variables.isEmpty());
      this.variables = new ArrayList<TypedName>(variables);
      this.value = value;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.VARIABLE_DECLARATION;
    }

    public List<TypedName> getVariables() {
      return Collections.unmodifiableList(variables);
    }

    public Expression getValue() {
      return value;
    }

    public void setValue(Expression value) {
      this.value = value;
    }
  }

  public static class Assignment extends NodeBase implements Statement {
    private final List<Identifier> targets;
    private Expression value;

    public Assignment(List<Identifier> targets, Expression value) {
      assert(!targets.isEmpty() && value != null);
      this.targets = new ArrayList<Identifier>(targets);
      this.value = value;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ASSIGNMENT;
    }

    public List<Identifier> getTargets() {
      return Collections.unmodifiableList(targets);
    }

    public Expression getValue() {
      return value;
    }

    public void setValue(Expression value) {
      this.value = value;
    }
  }

  public static class If extends NodeBase implements Statement {
    private Expression condition;
    private final Block body;

    public If(Expression condition, Block body) {
      this.condition = condition;
      this.body = body;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.IF;
    }

    public Expression getCondition() {
      return condition;
    }

    public void setCondition(Expression condition) {
      this.condition = condition;
    }

    public Block getBody() {
      return body;
    }
  }

  public static class Case {
    private final Literal value;
    private final Block body;

    public Case(Literal value, Block body) {
      this.value = value;
      this.body = body;
    }

    public Literal getValue() {
      return value;
    }

    public Block getBody() {
      return body;
    }
  }

  public static class Switch extends NodeBase implements Statement {
    private Expression expression;
    private final List<Case> cases;
    /** Null if no default */
    private final Block defaultBody;

    public Switch(Expression expression, List<Case> cases, Block defaultBody) {
      this.expression = expression;
      this.cases = new ArrayList<Case>(cases);
      this.defaultBody = defaultBody;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.SWITCH;
    }

    public Expression getExpression() {
      return expression;
    }

    public void setExpression(Expression expression) {
      this.expression = expression;
    }

    public List<Case> getCases() {
      return Collections.unmodifiableList(cases);
    }

    public Block getDefault() {
      return defaultBody;
    }

    public boolean hasDefault() {
      return defaultBody != null;
    }
  }

  /**
   * Declarations in the init block are visible in the condition, the post
   * block and the body.
   */
  public static class ForLoop extends NodeBase implements Statement {
    private final Block pre;
    private final Expression condition;
    private final Block post;
    private final Block body;

    public ForLoop(Block pre, Expression condition, Block post, Block body) {
      this.pre = pre;
      this.condition = condition;
      this.post = post;
      this.body = body;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.FOR_LOOP;
    }

    public Block getPre() {
      return pre;
    }

    public Expression getCondition() {
      return condition;
    }

    public Block getPost() {
      return post;
    }

    public Block getBody() {
      return body;
    }
  }

  public static class FunctionCall extends NodeBase implements Expression {
    private final Identifier functionName;
    private final ArrayList<Expression> arguments;

    public FunctionCall(Identifier functionName, List<Expression> arguments) {
      this.functionName = functionName;
      this.arguments = new ArrayList<Expression>(arguments);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.FUNCTION_CALL;
    }

    public Identifier getFunctionName() {
      return functionName;
    }

    public List<Expression> getArguments() {
      return Collections.unmodifiableList(arguments);
    }

    public void setArgument(int i, Expression arg) {
      arguments.set(i, arg);
    }
  }

  public static class FunctionalInstruction extends NodeBase
                                            implements Expression {
    private final Opcode instruction;
    private final ArrayList<Expression> arguments;

    public FunctionalInstruction(Opcode instruction,
                                 List<Expression> arguments) {
      this.instruction = instruction;
      this.arguments = new ArrayList<Expression>(arguments);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.FUNCTIONAL_INSTRUCTION;
    }

    public Opcode getInstruction() {
      return instruction;
    }

    public List<Expression> getArguments() {
      return Collections.unmodifiableList(arguments);
    }

    public void setArgument(int i, Expression arg) {
      arguments.set(i, arg);
    }
  }

  /** Bare opcode in statement position */
  public static class Instruction extends NodeBase implements Statement {
    private final Opcode instruction;

    public Instruction(Opcode instruction) {
      this.instruction = instruction;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.INSTRUCTION;
    }

    public Opcode getInstruction() {
      return instruction;
    }
  }

  public static class Identifier extends NodeBase implements Expression {
    private final String name;

    public Identifier(String name) {
      assert(name != null);
      this.name = name;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.IDENTIFIER;
    }

    public String getName() {
      return name;
    }
  }

  public static enum LiteralKind {
    NUMBER, BOOLEAN, STRING
  }

  public static class Literal extends NodeBase implements Expression {
    private final LiteralKind literalKind;
    private final String value;
    private final String type;

    public Literal(LiteralKind literalKind, String value, String type) {
      assert(value != null && type != null);
      this.literalKind = literalKind;
      this.value = value;
      this.type = type;
    }

    public static Literal number(long value) {
      return new Literal(LiteralKind.NUMBER, Long.toString(value), "");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.LITERAL;
    }

    public LiteralKind getLiteralKind() {
      return literalKind;
    }

    public String getValue() {
      return value;
    }

    public String getType() {
      return type;
    }

    public boolean hasType() {
      return !type.isEmpty();
    }
  }

  public static class Label extends NodeBase
                            implements Statement, Declaration {
    private final String name;

    public Label(String name) {
      this.name = name;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.LABEL;
    }

    @Override
    public String getName() {
      return name;
    }
  }

  /** Pops the top of the stack into a variable */
  public static class StackAssignment extends NodeBase implements Statement {
    private final Identifier variableName;

    public StackAssignment(Identifier variableName) {
      this.variableName = variableName;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.STACK_ASSIGNMENT;
    }

    public Identifier getVariableName() {
      return variableName;
    }
  }
}
