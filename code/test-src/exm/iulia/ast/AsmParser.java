package exm.iulia.ast;

import java.util.ArrayList;
import java.util.List;

import exm.iulia.ast.AsmTree.Assignment;
import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.Case;
import exm.iulia.ast.AsmTree.Expression;
import exm.iulia.ast.AsmTree.ForLoop;
import exm.iulia.ast.AsmTree.FunctionCall;
import exm.iulia.ast.AsmTree.FunctionDefinition;
import exm.iulia.ast.AsmTree.FunctionalInstruction;
import exm.iulia.ast.AsmTree.Identifier;
import exm.iulia.ast.AsmTree.If;
import exm.iulia.ast.AsmTree.Instruction;
import exm.iulia.ast.AsmTree.Label;
import exm.iulia.ast.AsmTree.Literal;
import exm.iulia.ast.AsmTree.LiteralKind;
import exm.iulia.ast.AsmTree.StackAssignment;
import exm.iulia.ast.AsmTree.Statement;
import exm.iulia.ast.AsmTree.Switch;
import exm.iulia.ast.AsmTree.TypedName;
import exm.iulia.ast.AsmTree.VariableDeclaration;

/**
 * Minimal parser for the textual form printed by {@link AsmPrinter}, so
 * tests can write trees as source text.  Opcode mnemonics are parsed as
 * instructions, other names as identifiers or function calls.
 */
public class AsmParser {

  private final List<String> tokens;
  private int pos = 0;

  private AsmParser(String text) {
    this.tokens = tokenize(text);
  }

  public static Block parse(String text) {
    AsmParser parser = new AsmParser(text);
    Block block = parser.block();
    if (parser.pos != parser.tokens.size()) {
      throw parser.error("trailing input");
    }
    return block;
  }

  /**
   * Parse and print, giving the canonical form of some source text
   */
  public static String format(String text) {
    return AsmPrinter.print(parse(text));
  }

  private Block block() {
    expect("{");
    Block block = new Block();
    while (!peekIs("}")) {
      block.addStatement(statement());
    }
    expect("}");
    return block;
  }

  private Statement statement() {
    String tok = peek();
    if (tok.isEmpty()) {
      throw error("unexpected end of input");
    } else if (tok.equals("{")) {
      return block();
    } else if (tok.equals("function")) {
      return functionDefinition();
    } else if (tok.equals("let")) {
      next();
      List<TypedName> vars = typedNames();
      Expression value = null;
      if (accept(":=")) {
        value = expression();
      }
      return new VariableDeclaration(vars, value);
    } else if (tok.equals("if")) {
      next();
      Expression cond = expression();
      return new If(cond, block());
    } else if (tok.equals("switch")) {
      return switchStatement();
    } else if (tok.equals("for")) {
      next();
      Block pre = block();
      Expression cond = expression();
      Block post = block();
      return new ForLoop(pre, cond, post, block());
    } else if (tok.equals("=:")) {
      next();
      return new StackAssignment(new Identifier(name()));
    } else if (isName(tok) && !isLiteralStart(tok)) {
      String after = peek(1);
      if (after.equals(":")) {
        next();
        next();
        return new Label(tok);
      } else if (after.equals(",") || after.equals(":=")) {
        List<Identifier> targets = new ArrayList<Identifier>();
        do {
          targets.add(new Identifier(name()));
        } while (accept(","));
        expect(":=");
        return new Assignment(targets, expression());
      } else if (!after.equals("(") && Opcode.fromMnemonic(tok) != null) {
        next();
        return new Instruction(Opcode.fromMnemonic(tok));
      }
    }
    return expression();
  }

  private FunctionDefinition functionDefinition() {
    expect("function");
    String name = name();
    expect("(");
    List<TypedName> params = new ArrayList<TypedName>();
    if (!peekIs(")")) {
      params = typedNames();
    }
    expect(")");
    List<TypedName> returns = new ArrayList<TypedName>();
    if (accept("->")) {
      returns = typedNames();
    }
    return new FunctionDefinition(name, params, returns, block());
  }

  private Switch switchStatement() {
    expect("switch");
    Expression expr = expression();
    List<Case> cases = new ArrayList<Case>();
    while (accept("case")) {
      Literal value = literal();
      cases.add(new Case(value, block()));
    }
    Block defaultBody = null;
    if (accept("default")) {
      defaultBody = block();
    }
    return new Switch(expr, cases, defaultBody);
  }

  private List<TypedName> typedNames() {
    List<TypedName> result = new ArrayList<TypedName>();
    do {
      String name = name();
      if (accept(":")) {
        result.add(new TypedName(name, name()));
      } else {
        result.add(new TypedName(name));
      }
    } while (accept(","));
    return result;
  }

  private Expression expression() {
    String tok = peek();
    if (isLiteralStart(tok)) {
      return literal();
    }
    String name = name();
    if (!accept("(")) {
      return new Identifier(name);
    }
    List<Expression> args = new ArrayList<Expression>();
    if (!peekIs(")")) {
      do {
        args.add(expression());
      } while (accept(","));
    }
    expect(")");
    Opcode op = Opcode.fromMnemonic(name);
    if (op != null) {
      return new FunctionalInstruction(op, args);
    }
    return new FunctionCall(new Identifier(name), args);
  }

  private Literal literal() {
    String tok = next();
    LiteralKind kind;
    String value;
    if (tok.startsWith("\"")) {
      kind = LiteralKind.STRING;
      value = tok.substring(1, tok.length() - 1);
    } else if (tok.equals("true") || tok.equals("false")) {
      kind = LiteralKind.BOOLEAN;
      value = tok;
    } else if (Character.isDigit(tok.charAt(0))) {
      kind = LiteralKind.NUMBER;
      value = tok;
    } else {
      throw error("expected literal but got " + tok);
    }
    String type = "";
    if (accept(":")) {
      type = name();
    }
    return new Literal(kind, value, type);
  }

  private static boolean isLiteralStart(String tok) {
    if (tok.isEmpty()) {
      return false;
    }
    return tok.startsWith("\"") || tok.equals("true") || tok.equals("false")
        || Character.isDigit(tok.charAt(0));
  }

  private static boolean isName(String tok) {
    if (tok.isEmpty()) {
      return false;
    }
    char c = tok.charAt(0);
    return Character.isLetterOrDigit(c) || c == '_' || c == '$';
  }

  private String name() {
    String tok = next();
    if (!isName(tok)) {
      throw error("expected name but got " + tok);
    }
    return tok;
  }

  private String peek() {
    return peek(0);
  }

  private String peek(int ahead) {
    if (pos + ahead >= tokens.size()) {
      return "";
    }
    return tokens.get(pos + ahead);
  }

  private boolean peekIs(String tok) {
    return peek().equals(tok);
  }

  private String next() {
    if (pos >= tokens.size()) {
      throw error("unexpected end of input");
    }
    return tokens.get(pos++);
  }

  private boolean accept(String tok) {
    if (peekIs(tok)) {
      pos++;
      return true;
    }
    return false;
  }

  private void expect(String tok) {
    if (!accept(tok)) {
      throw error("expected " + tok + " but got '" + peek() + "'");
    }
  }

  private IllegalArgumentException error(String msg) {
    return new IllegalArgumentException("Parse error at token " + pos +
                                        ": " + msg + " in " + tokens);
  }

  private static List<String> tokenize(String text) {
    List<String> result = new ArrayList<String>();
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (text.startsWith(":=", i) || text.startsWith("=:", i) ||
                 text.startsWith("->", i)) {
        result.add(text.substring(i, i + 2));
        i += 2;
      } else if ("{}(),:".indexOf(c) >= 0) {
        result.add(String.valueOf(c));
        i++;
      } else if (c == '"') {
        int end = text.indexOf('"', i + 1);
        if (end < 0) {
          throw new IllegalArgumentException("Unterminated string: " + text);
        }
        result.add(text.substring(i, end + 1));
        i = end + 1;
      } else if (Character.isLetterOrDigit(c) || c == '_' || c == '$' ||
                 c == '.') {
        int start = i;
        while (i < text.length() &&
              (Character.isLetterOrDigit(text.charAt(i)) ||
               "_$.".indexOf(text.charAt(i)) >= 0)) {
          i++;
        }
        result.add(text.substring(start, i));
      } else {
        throw new IllegalArgumentException("Unexpected character '" + c +
                                           "' in " + text);
      }
    }
    return result;
  }
}
