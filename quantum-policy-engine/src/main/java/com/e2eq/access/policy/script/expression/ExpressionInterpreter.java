package com.e2eq.access.policy.script.expression;

import com.e2eq.access.grammar.PolicyScriptBaseVisitor;
import com.e2eq.access.grammar.PolicyScriptParser;
import com.e2eq.access.policy.script.ScriptBindings;
import com.e2eq.access.policy.script.ScriptExecutionException;
import com.e2eq.access.policy.script.ScriptResourceExceededException;
import com.e2eq.access.policy.script.ScriptTimeoutException;
import com.e2eq.access.util.Deadline;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tree-walking interpreter for one run of a parsed expression script. Not thread
 * safe; a new instance is created per evaluation so no state outlives a run.
 * <p>
 * Every visited node costs one operation. The deadline is checked every
 * {@value #DEADLINE_CHECK_INTERVAL} operations, so a script that never yields still
 * stops shortly after its deadline.
 */
public class ExpressionInterpreter extends PolicyScriptBaseVisitor<Object> {

   static final int DEADLINE_CHECK_INTERVAL = 256;

   private static final class ReturnSignal extends RuntimeException {
      final transient Object value;

      ReturnSignal(Object value) {
         super(null, null, false, false);
         this.value = value;
      }
   }

   private static final class LoopSignal extends RuntimeException {
      final boolean isBreak;

      LoopSignal(boolean isBreak) {
         super(null, null, false, false);
         this.isBreak = isBreak;
      }
   }

   private static final LoopSignal BREAK = new LoopSignal(true);
   private static final LoopSignal CONTINUE = new LoopSignal(false);

   private final ExpressionLimits limits;
   private final Deadline deadline;
   private final long timeoutMillis;
   private final Map<String, PolicyScriptParser.FunctionDefinitionContext> functions = new HashMap<>();

   private ExpressionScope globals;
   private ExpressionScope scope;
   private long operations;
   private int callDepth;

   public ExpressionInterpreter(ExpressionLimits limits, Deadline deadline, long timeoutMillis) {
      this.limits = limits;
      this.deadline = deadline;
      this.timeoutMillis = timeoutMillis;
   }

   /**
    * Runs {@code script} with {@code variables} bound as constants, plus
    * {@code context} holding all of them.
    *
    * @return the value of the last statement, or of the first {@code return}
    */
   public Object run(PolicyScriptParser.ScriptContext script, Map<String, Object> variables) {
      globals = new ExpressionScope(null);
      Map<String, Object> context = new LinkedHashMap<>(variables);
      variables.forEach((name, value) -> globals.define(name, value, true));
      globals.define(ScriptBindings.CONTEXT, context, true);
      scope = new ExpressionScope(globals);

      for (PolicyScriptParser.StatementContext statement : script.statement()) {
         if (statement instanceof PolicyScriptParser.FunctionDefinitionContext fn) {
            int arity = fn.parameters() == null ? 0 : fn.parameters().IDENT().size();
            functions.put(fn.IDENT().getText() + "/" + arity, fn);
         }
      }
      try {
         return executeStatements(script.statement());
      } catch (ReturnSignal r) {
         return r.value;
      } catch (LoopSignal l) {
         throw new ScriptExecutionException((l.isBreak ? "break" : "continue") + " used outside of a loop");
      }
   }

   public long operations() {
      return operations;
   }

   @Override
   public Object visit(ParseTree tree) {
      tick();
      return tree.accept(this);
   }

   private void tick() {
      if (++operations > limits.maxOperations()) {
         throw new ScriptResourceExceededException("operations",
                 "Script exceeded the maximum of " + limits.maxOperations() + " operations");
      }
      if (operations % DEADLINE_CHECK_INTERVAL == 0 && deadline.isExpired()) {
         throw new ScriptTimeoutException(timeoutMillis);
      }
   }

   private Object executeStatements(List<PolicyScriptParser.StatementContext> statements) {
      Object last = null;
      for (PolicyScriptParser.StatementContext statement : statements) {
         last = visit(statement);
      }
      return last;
   }

   private Object executeBlock(PolicyScriptParser.BlockContext block, ExpressionScope blockScope) {
      ExpressionScope saved = scope;
      scope = blockScope;
      try {
         return executeStatements(block.statement());
      } finally {
         scope = saved;
      }
   }

   private Object executeBlock(PolicyScriptParser.BlockContext block) {
      return executeBlock(block, new ExpressionScope(scope));
   }

   // statements

   @Override
   public Object visitEmptyStatement(PolicyScriptParser.EmptyStatementContext ctx) {
      return null;
   }

   @Override
   public Object visitLetStatement(PolicyScriptParser.LetStatementContext ctx) {
      Object value = ctx.expression() == null ? null : visit(ctx.expression());
      scope.define(ctx.IDENT().getText(), value, false);
      return null;
   }

   @Override
   public Object visitConstStatement(PolicyScriptParser.ConstStatementContext ctx) {
      scope.define(ctx.IDENT().getText(), visit(ctx.expression()), true);
      return null;
   }

   @Override
   public Object visitFunctionDefinition(PolicyScriptParser.FunctionDefinitionContext ctx) {
      if (ctx.getParent() instanceof PolicyScriptParser.BlockContext) {
         throw new ScriptExecutionException("Functions can only be defined at the top level: " + ctx.IDENT().getText());
      }
      return null;
   }

   @Override
   public Object visitWhileStatement(PolicyScriptParser.WhileStatementContext ctx) {
      while (ExpressionValues.requireBoolean(visit(ctx.expression()), "while condition")) {
         if (runLoopBody(ctx.block(), new ExpressionScope(scope))) {
            break;
         }
      }
      return null;
   }

   @Override
   public Object visitLoopStatement(PolicyScriptParser.LoopStatementContext ctx) {
      while (true) {
         tick();
         if (runLoopBody(ctx.block(), new ExpressionScope(scope))) {
            return null;
         }
      }
   }

   @Override
   public Object visitForStatement(PolicyScriptParser.ForStatementContext ctx) {
      String itemName = ctx.IDENT(0).getText();
      String secondName = ctx.IDENT().size() > 1 ? ctx.IDENT(1).getText() : null;
      Object iterable = visit(ctx.expression());

      if (iterable instanceof List<?> list) {
         List<?> snapshot = new ArrayList<>(list);
         for (int i = 0; i < snapshot.size(); i++) {
            ExpressionScope iteration = new ExpressionScope(scope);
            iteration.define(itemName, snapshot.get(i), false);
            if (secondName != null) {
               iteration.define(secondName, (long) i, false);
            }
            if (runLoopBody(ctx.block(), iteration)) {
               break;
            }
         }
      } else if (iterable instanceof Map<?, ?> map) {
         List<Map.Entry<?, ?>> entries = new ArrayList<>(map.entrySet());
         for (Map.Entry<?, ?> entry : entries) {
            ExpressionScope iteration = new ExpressionScope(scope);
            iteration.define(itemName, entry.getKey(), false);
            if (secondName != null) {
               iteration.define(secondName, entry.getValue(), false);
            }
            if (runLoopBody(ctx.block(), iteration)) {
               break;
            }
         }
      } else if (iterable instanceof String s) {
         for (int i = 0; i < s.length(); i++) {
            ExpressionScope iteration = new ExpressionScope(scope);
            iteration.define(itemName, String.valueOf(s.charAt(i)), false);
            if (secondName != null) {
               iteration.define(secondName, (long) i, false);
            }
            if (runLoopBody(ctx.block(), iteration)) {
               break;
            }
         }
      } else {
         throw new ScriptExecutionException("Cannot iterate over " + ExpressionValues.typeOf(iterable));
      }
      return null;
   }

   /**
    * @return true when the body executed {@code break}
    */
   private boolean runLoopBody(PolicyScriptParser.BlockContext body, ExpressionScope iterationScope) {
      try {
         executeBlock(body, iterationScope);
         return false;
      } catch (LoopSignal signal) {
         return signal.isBreak;
      }
   }

   @Override
   public Object visitReturnStatement(PolicyScriptParser.ReturnStatementContext ctx) {
      throw new ReturnSignal(ctx.expression() == null ? null : visit(ctx.expression()));
   }

   @Override
   public Object visitBreakStatement(PolicyScriptParser.BreakStatementContext ctx) {
      throw BREAK;
   }

   @Override
   public Object visitContinueStatement(PolicyScriptParser.ContinueStatementContext ctx) {
      throw CONTINUE;
   }

   @Override
   public Object visitThrowStatement(PolicyScriptParser.ThrowStatementContext ctx) {
      Object value = ctx.expression() == null ? null : visit(ctx.expression());
      throw new ScriptExecutionException(value == null ? "Script threw an error" : ExpressionValues.display(value));
   }

   @Override
   public Object visitAssignStatement(PolicyScriptParser.AssignStatementContext ctx) {
      String op = ctx.op.getText();
      Object value = visit(ctx.value);
      PolicyScriptParser.ExpressionContext target = ctx.target;

      if (target instanceof PolicyScriptParser.PrimaryExpressionContext p
              && p.primary() instanceof PolicyScriptParser.IdentifierPrimaryContext id) {
         String name = id.IDENT().getText();
         Object assigned = "=".equals(op) ? value : binary(compoundOperator(op), scope.get(name), value);
         scope.assign(name, assigned);
      } else if (target instanceof PolicyScriptParser.MemberExpressionContext m) {
         Map<String, Object> map = requireMap(visit(m.expression()), m.IDENT().getText());
         String key = m.IDENT().getText();
         putChecked(map, key, "=".equals(op) ? value : binary(compoundOperator(op), map.get(key), value));
      } else if (target instanceof PolicyScriptParser.IndexExpressionContext ix) {
         Object container = visit(ix.expression(0));
         Object index = visit(ix.expression(1));
         if (container instanceof List<?> list) {
            @SuppressWarnings("unchecked")
            List<Object> values = (List<Object>) list;
            int i = listIndex(values, index);
            values.set(i, "=".equals(op) ? value : binary(compoundOperator(op), values.get(i), value));
         } else if (container instanceof Map<?, ?>) {
            Map<String, Object> map = requireMap(container, "index");
            String key = ExpressionValues.requireString(index, "Map index");
            putChecked(map, key, "=".equals(op) ? value : binary(compoundOperator(op), map.get(key), value));
         } else {
            throw new ScriptExecutionException("Cannot index into " + ExpressionValues.typeOf(container));
         }
      } else {
         throw new ScriptExecutionException("Invalid assignment target: " + target.getText());
      }
      return null;
   }

   private static String compoundOperator(String op) {
      return op.substring(0, op.length() - 1);
   }

   @Override
   public Object visitExpressionStatement(PolicyScriptParser.ExpressionStatementContext ctx) {
      return visit(ctx.expression());
   }

   // expressions

   @Override
   public Object visitPrimaryExpression(PolicyScriptParser.PrimaryExpressionContext ctx) {
      return visit(ctx.primary());
   }

   @Override
   public Object visitMethodCallExpression(PolicyScriptParser.MethodCallExpressionContext ctx) {
      Object target = visit(ctx.expression());
      if (target == null && "?.".equals(ctx.op.getText())) {
         return null;
      }
      return callMethod(target, ctx.IDENT().getText(), arguments(ctx.arguments()));
   }

   @Override
   public Object visitMemberExpression(PolicyScriptParser.MemberExpressionContext ctx) {
      Object target = visit(ctx.expression());
      String name = ctx.IDENT().getText();
      if (target == null) {
         if ("?.".equals(ctx.op.getText())) {
            return null;
         }
         throw new ScriptExecutionException("Cannot read property '" + name + "' of ()");
      }
      if (target instanceof Map<?, ?> map) {
         return map.get(name);
      }
      if ("len".equals(name) && (target instanceof List || target instanceof String)) {
         return callMethod(target, name, List.of());
      }
      throw new ScriptExecutionException("Property '" + name + "' not found on " + ExpressionValues.typeOf(target));
   }

   @Override
   public Object visitIndexExpression(PolicyScriptParser.IndexExpressionContext ctx) {
      Object container = visit(ctx.expression(0));
      Object index = visit(ctx.expression(1));
      if (container instanceof List<?> list) {
         return list.get(listIndex(list, index));
      }
      if (container instanceof Map<?, ?> map) {
         return map.get(ExpressionValues.requireString(index, "Map index"));
      }
      if (container instanceof String s) {
         long i = ExpressionValues.requireInteger(index, "String index");
         long resolved = i < 0 ? s.length() + i : i;
         if (resolved < 0 || resolved >= s.length()) {
            throw new ScriptExecutionException("String index " + i + " out of bounds");
         }
         return String.valueOf(s.charAt((int) resolved));
      }
      throw new ScriptExecutionException("Cannot index into " + ExpressionValues.typeOf(container));
   }

   private static int listIndex(List<?> list, Object index) {
      long i = ExpressionValues.requireInteger(index, "Array index");
      long resolved = i < 0 ? list.size() + i : i;
      if (resolved < 0 || resolved >= list.size()) {
         throw new ScriptExecutionException("Array index " + i + " out of bounds");
      }
      return (int) resolved;
   }

   @Override
   public Object visitUnaryExpression(PolicyScriptParser.UnaryExpressionContext ctx) {
      Object operand = visit(ctx.expression());
      switch (ctx.op.getText()) {
         case "!":
            return !ExpressionValues.requireBoolean(operand, "Operator '!'");
         case "-":
            if (operand instanceof Long l) {
               return Math.negateExact(l);
            }
            if (operand instanceof Double d) {
               return -d;
            }
            throw new ScriptExecutionException("Operator '-' is not defined for " + ExpressionValues.typeOf(operand));
         default:
            if (ExpressionValues.isNumber(operand)) {
               return operand;
            }
            throw new ScriptExecutionException("Operator '+' is not defined for " + ExpressionValues.typeOf(operand));
      }
   }

   @Override
   public Object visitMultiplicativeExpression(PolicyScriptParser.MultiplicativeExpressionContext ctx) {
      return binary(ctx.op.getText(), visit(ctx.expression(0)), visit(ctx.expression(1)));
   }

   @Override
   public Object visitAdditiveExpression(PolicyScriptParser.AdditiveExpressionContext ctx) {
      return binary(ctx.op.getText(), visit(ctx.expression(0)), visit(ctx.expression(1)));
   }

   @Override
   public Object visitInExpression(PolicyScriptParser.InExpressionContext ctx) {
      Object needle = visit(ctx.expression(0));
      Object haystack = visit(ctx.expression(1));
      return contains(haystack, needle);
   }

   @Override
   public Object visitRelationalExpression(PolicyScriptParser.RelationalExpressionContext ctx) {
      String op = ctx.op.getText();
      int cmp = ExpressionValues.compare(visit(ctx.expression(0)), visit(ctx.expression(1)), op);
      switch (op) {
         case "<":
            return cmp < 0;
         case "<=":
            return cmp <= 0;
         case ">":
            return cmp > 0;
         default:
            return cmp >= 0;
      }
   }

   @Override
   public Object visitEqualityExpression(PolicyScriptParser.EqualityExpressionContext ctx) {
      boolean equal = ExpressionValues.valuesEqual(visit(ctx.expression(0)), visit(ctx.expression(1)));
      return "==".equals(ctx.op.getText()) == equal;
   }

   @Override
   public Object visitAndExpression(PolicyScriptParser.AndExpressionContext ctx) {
      return ExpressionValues.requireBoolean(visit(ctx.expression(0)), "Operator '&&'")
              && ExpressionValues.requireBoolean(visit(ctx.expression(1)), "Operator '&&'");
   }

   @Override
   public Object visitOrExpression(PolicyScriptParser.OrExpressionContext ctx) {
      return ExpressionValues.requireBoolean(visit(ctx.expression(0)), "Operator '||'")
              || ExpressionValues.requireBoolean(visit(ctx.expression(1)), "Operator '||'");
   }

   @Override
   public Object visitCoalesceExpression(PolicyScriptParser.CoalesceExpressionContext ctx) {
      Object left = visit(ctx.expression(0));
      return left != null ? left : visit(ctx.expression(1));
   }

   // primaries

   @Override
   public Object visitLiteralPrimary(PolicyScriptParser.LiteralPrimaryContext ctx) {
      return visit(ctx.literal());
   }

   @Override
   public Object visitFunctionCallPrimary(PolicyScriptParser.FunctionCallPrimaryContext ctx) {
      return callFunction(ctx.IDENT().getText(), arguments(ctx.arguments()));
   }

   @Override
   public Object visitIdentifierPrimary(PolicyScriptParser.IdentifierPrimaryContext ctx) {
      return scope.get(ctx.IDENT().getText());
   }

   @Override
   public Object visitParenthesizedPrimary(PolicyScriptParser.ParenthesizedPrimaryContext ctx) {
      return visit(ctx.expression());
   }

   @Override
   public Object visitArrayPrimary(PolicyScriptParser.ArrayPrimaryContext ctx) {
      List<Object> values = new ArrayList<>(ctx.expression().size());
      for (PolicyScriptParser.ExpressionContext e : ctx.expression()) {
         values.add(visit(e));
      }
      return checkArray(values);
   }

   @Override
   public Object visitMapPrimary(PolicyScriptParser.MapPrimaryContext ctx) {
      Map<String, Object> map = new LinkedHashMap<>();
      for (PolicyScriptParser.MapEntryContext entry : ctx.mapEntry()) {
         String key = entry.STRING() != null ? ExpressionValues.unquote(entry.STRING().getText()) : entry.IDENT().getText();
         map.put(key, visit(entry.expression()));
      }
      return checkMap(map);
   }

   @Override
   public Object visitIfPrimary(PolicyScriptParser.IfPrimaryContext ctx) {
      return visit(ctx.ifExpression());
   }

   @Override
   public Object visitIfExpression(PolicyScriptParser.IfExpressionContext ctx) {
      if (ExpressionValues.requireBoolean(visit(ctx.expression()), "if condition")) {
         return executeBlock(ctx.block(0));
      }
      if (ctx.ifExpression() != null) {
         return visit(ctx.ifExpression());
      }
      if (ctx.block().size() > 1) {
         return executeBlock(ctx.block(1));
      }
      return null;
   }

   @Override
   public Object visitClosurePrimary(PolicyScriptParser.ClosurePrimaryContext ctx) {
      List<String> params = new ArrayList<>();
      for (TerminalNode id : ctx.parameters().IDENT()) {
         params.add(id.getText());
      }
      return new ExpressionClosure(params, ctx.expression(), scope);
   }

   @Override
   public Object visitIntegerLiteral(PolicyScriptParser.IntegerLiteralContext ctx) {
      try {
         return Long.parseLong(ctx.INTEGER().getText());
      } catch (NumberFormatException e) {
         throw new ScriptExecutionException("Integer literal out of range: " + ctx.INTEGER().getText());
      }
   }

   @Override
   public Object visitDecimalLiteral(PolicyScriptParser.DecimalLiteralContext ctx) {
      return Double.parseDouble(ctx.DECIMAL().getText());
   }

   @Override
   public Object visitStringLiteral(PolicyScriptParser.StringLiteralContext ctx) {
      return checkString(ExpressionValues.unquote(ctx.STRING().getText()));
   }

   @Override
   public Object visitBooleanLiteral(PolicyScriptParser.BooleanLiteralContext ctx) {
      return Boolean.valueOf(ctx.value.getText());
   }

   @Override
   public Object visitUnitLiteral(PolicyScriptParser.UnitLiteralContext ctx) {
      return null;
   }

   // operators

   private Object binary(String op, Object left, Object right) {
      try {
         switch (op) {
            case "+":
               return add(left, right);
            case "-":
               if (left instanceof Long a && right instanceof Long b) {
                  return Math.subtractExact(a, b);
               }
               return numeric(op, left, right) ? toDouble(left) - toDouble(right) : null;
            case "*":
               if (left instanceof Long a && right instanceof Long b) {
                  return Math.multiplyExact(a, b);
               }
               return numeric(op, left, right) ? toDouble(left) * toDouble(right) : null;
            case "/":
               if (left instanceof Long a && right instanceof Long b) {
                  if (b == 0) {
                     throw new ScriptExecutionException("Division by zero");
                  }
                  return a / b;
               }
               return numeric(op, left, right) ? toDouble(left) / toDouble(right) : null;
            case "%":
               if (left instanceof Long a && right instanceof Long b) {
                  if (b == 0) {
                     throw new ScriptExecutionException("Division by zero");
                  }
                  return a % b;
               }
               return numeric(op, left, right) ? toDouble(left) % toDouble(right) : null;
            default:
               throw new ScriptExecutionException("Unknown operator " + op);
         }
      } catch (ArithmeticException e) {
         throw new ScriptExecutionException("Arithmetic overflow in '" + op + "'");
      }
   }

   private Object add(Object left, Object right) {
      if (left instanceof Long a && right instanceof Long b) {
         return Math.addExact(a, b);
      }
      if (ExpressionValues.isNumber(left) && ExpressionValues.isNumber(right)) {
         return toDouble(left) + toDouble(right);
      }
      if (left instanceof String || right instanceof String) {
         String l = ExpressionValues.display(left);
         String r = ExpressionValues.display(right);
         if ((long) l.length() + r.length() > limits.maxStringSize()) {
            throw stringTooLong();
         }
         return l + r;
      }
      if (left instanceof List<?> a && right instanceof List<?> b) {
         List<Object> joined = new ArrayList<>(a);
         joined.addAll(b);
         return checkArray(joined);
      }
      if (left instanceof Map<?, ?> a && right instanceof Map<?, ?> b) {
         Map<String, Object> merged = new LinkedHashMap<>();
         a.forEach((k, v) -> merged.put(String.valueOf(k), v));
         b.forEach((k, v) -> merged.put(String.valueOf(k), v));
         return checkMap(merged);
      }
      throw ExpressionValues.typeMismatch("+", left, right);
   }

   private static boolean numeric(String op, Object left, Object right) {
      if (ExpressionValues.isNumber(left) && ExpressionValues.isNumber(right)) {
         return true;
      }
      throw ExpressionValues.typeMismatch(op, left, right);
   }

   private static double toDouble(Object value) {
      return ((Number) value).doubleValue();
   }

   private static boolean contains(Object haystack, Object needle) {
      if (haystack instanceof List<?> list) {
         for (Object item : list) {
            if (ExpressionValues.valuesEqual(item, needle)) {
               return true;
            }
         }
         return false;
      }
      if (haystack instanceof Map<?, ?> map) {
         return map.containsKey(ExpressionValues.requireString(needle, "Operator 'in' on a map"));
      }
      if (haystack instanceof String s) {
         return s.contains(ExpressionValues.requireString(needle, "Operator 'in' on a string"));
      }
      throw new ScriptExecutionException("Operator 'in' is not defined for " + ExpressionValues.typeOf(haystack));
   }

   // calls

   private List<Object> arguments(PolicyScriptParser.ArgumentsContext ctx) {
      if (ctx == null) {
         return new ArrayList<>();
      }
      List<Object> values = new ArrayList<>(ctx.expression().size());
      for (PolicyScriptParser.ExpressionContext e : ctx.expression()) {
         values.add(visit(e));
      }
      return values;
   }

   private Object callFunction(String name, List<Object> args) {
      if (scope.isDefined(name) && scope.get(name) instanceof ExpressionClosure closure) {
         return invoke(closure, args);
      }
      PolicyScriptParser.FunctionDefinitionContext fn = functions.get(name + "/" + args.size());
      if (fn != null) {
         return invoke(fn, args);
      }
      if ("range".equals(name)) {
         return range(args);
      }
      ExpressionBuiltins.Builtin builtin = ExpressionBuiltins.lookup(name);
      if (builtin != null) {
         return builtin.apply(args);
      }
      if (!args.isEmpty()) {
         // f(x, y) is also x.f(y)
         return callMethod(args.get(0), name, new ArrayList<>(args.subList(1, args.size())));
      }
      throw new ScriptExecutionException("Function not found: " + name + "()");
   }

   private Object invoke(PolicyScriptParser.FunctionDefinitionContext fn, List<Object> args) {
      ExpressionScope frame = new ExpressionScope(globals);
      List<TerminalNode> params = fn.parameters() == null ? List.of() : fn.parameters().IDENT();
      for (int i = 0; i < params.size(); i++) {
         frame.define(params.get(i).getText(), args.get(i), false);
      }
      enterCall(fn.IDENT().getText());
      try {
         return executeBlock(fn.block(), frame);
      } catch (ReturnSignal r) {
         return r.value;
      } catch (LoopSignal l) {
         throw new ScriptExecutionException("break or continue used outside of a loop in " + fn.IDENT().getText());
      } finally {
         callDepth--;
      }
   }

   Object invoke(ExpressionClosure closure, List<Object> args) {
      if (args.size() != closure.parameters().size()) {
         throw new ScriptExecutionException("Closure expects " + closure.parameters().size()
                 + " argument(s) but got " + args.size());
      }
      ExpressionScope frame = new ExpressionScope(closure.captured());
      for (int i = 0; i < args.size(); i++) {
         frame.define(closure.parameters().get(i), args.get(i), false);
      }
      enterCall("closure");
      ExpressionScope saved = scope;
      scope = frame;
      try {
         return visit(closure.body());
      } catch (ReturnSignal r) {
         return r.value;
      } finally {
         scope = saved;
         callDepth--;
      }
   }

   private void enterCall(String name) {
      if (++callDepth > limits.maxCallLevels()) {
         callDepth--;
         throw new ScriptResourceExceededException("call-levels",
                 "Call depth exceeded " + limits.maxCallLevels() + " in " + name);
      }
   }

   private List<Object> range(List<Object> args) {
      if (args.size() != 2) {
         throw new ScriptExecutionException("range expects (from, to)");
      }
      long from = ExpressionValues.requireInteger(args.get(0), "range");
      long to = ExpressionValues.requireInteger(args.get(1), "range");
      if (from >= to) {
         return new ArrayList<>();
      }
      long span;
      try {
         span = Math.subtractExact(to, from);
      } catch (ArithmeticException e) {
         throw arrayTooLarge();
      }
      if (span > limits.maxArraySize()) {
         throw arrayTooLarge();
      }
      List<Object> values = new ArrayList<>((int) span);
      for (long i = from; i < to; i++) {
         tick();
         values.add(i);
      }
      return values;
   }

   private Object callMethod(Object target, String name, List<Object> args) {
      if (target instanceof ExpressionClosure closure && "call".equals(name)) {
         return invoke(closure, args);
      }
      switch (name) {
         case "to_string":
            return checkString(ExpressionValues.display(target));
         case "type_of":
            return ExpressionValues.typeOf(target);
         default:
            break;
      }
      if (target instanceof String s) {
         return stringMethod(s, name, args);
      }
      if (target instanceof List<?> list) {
         @SuppressWarnings("unchecked")
         List<Object> values = (List<Object>) list;
         return listMethod(values, name, args);
      }
      if (target instanceof Map<?, ?>) {
         return mapMethod(requireMap(target, name), name, args);
      }
      ExpressionBuiltins.Builtin builtin = ExpressionBuiltins.lookup(name);
      if (builtin != null) {
         List<Object> all = new ArrayList<>();
         all.add(target);
         all.addAll(args);
         return builtin.apply(all);
      }
      throw new ScriptExecutionException("Method " + name + "() not found on " + ExpressionValues.typeOf(target));
   }

   private Object stringMethod(String s, String name, List<Object> args) {
      switch (name) {
         case "len":
            return (long) s.length();
         case "is_empty":
            return s.isEmpty();
         case "contains":
            return s.contains(ExpressionValues.requireString(arg(args, 0, name), name));
         case "starts_with":
            return s.startsWith(ExpressionValues.requireString(arg(args, 0, name), name));
         case "ends_with":
            return s.endsWith(ExpressionValues.requireString(arg(args, 0, name), name));
         case "index_of":
            return (long) s.indexOf(ExpressionValues.requireString(arg(args, 0, name), name));
         case "to_upper":
            return s.toUpperCase(Locale.ROOT);
         case "to_lower":
            return s.toLowerCase(Locale.ROOT);
         case "trim":
            return s.trim();
         case "replace":
            return checkString(s.replace(ExpressionValues.requireString(arg(args, 0, name), name),
                    ExpressionValues.requireString(arg(args, 1, name), name)));
         case "split": {
            String sep = ExpressionValues.requireString(arg(args, 0, name), name);
            List<Object> parts = new ArrayList<>();
            if (sep.isEmpty()) {
               for (int i = 0; i < s.length(); i++) {
                  parts.add(String.valueOf(s.charAt(i)));
               }
            } else {
               int start = 0;
               int at;
               while ((at = s.indexOf(sep, start)) >= 0) {
                  parts.add(s.substring(start, at));
                  start = at + sep.length();
               }
               parts.add(s.substring(start));
            }
            return checkArray(parts);
         }
         case "sub_string": {
            long start = ExpressionValues.requireInteger(arg(args, 0, name), name);
            long length = args.size() > 1 ? ExpressionValues.requireInteger(args.get(1), name) : s.length() - start;
            int from = (int) Math.max(0, Math.min(start, s.length()));
            int to = (int) Math.max(from, Math.min((long) from + length, s.length()));
            return s.substring(from, to);
         }
         default:
            throw new ScriptExecutionException("Method " + name + "() not found on string");
      }
   }

   private Object listMethod(List<Object> list, String name, List<Object> args) {
      switch (name) {
         case "len":
            return (long) list.size();
         case "is_empty":
            return list.isEmpty();
         case "contains":
            return contains(list, arg(args, 0, name));
         case "index_of": {
            Object needle = arg(args, 0, name);
            for (int i = 0; i < list.size(); i++) {
               if (ExpressionValues.valuesEqual(list.get(i), needle)) {
                  return (long) i;
               }
            }
            return -1L;
         }
         case "get": {
            long i = ExpressionValues.requireInteger(arg(args, 0, name), name);
            long resolved = i < 0 ? list.size() + i : i;
            return resolved < 0 || resolved >= list.size() ? null : list.get((int) resolved);
         }
         case "first":
            return list.isEmpty() ? null : list.get(0);
         case "last":
            return list.isEmpty() ? null : list.get(list.size() - 1);
         case "push":
            list.add(arg(args, 0, name));
            checkArray(list);
            return null;
         case "pop":
            return list.isEmpty() ? null : list.remove(list.size() - 1);
         case "reverse":
            Collections.reverse(list);
            return null;
         case "join": {
            String sep = args.isEmpty() ? "," : ExpressionValues.requireString(args.get(0), name);
            StringBuilder sb = new StringBuilder();
            for (Object item : list) {
               if (sb.length() > 0) {
                  sb.append(sep);
               }
               sb.append(ExpressionValues.display(item));
               if (sb.length() > limits.maxStringSize()) {
                  throw stringTooLong();
               }
            }
            return sb.toString();
         }
         case "filter": {
            ExpressionClosure predicate = closureArg(args, name);
            List<Object> kept = new ArrayList<>();
            for (Object item : new ArrayList<>(list)) {
               if (ExpressionValues.requireBoolean(invoke(predicate, singleton(item)), "filter predicate")) {
                  kept.add(item);
               }
            }
            return kept;
         }
         case "map": {
            ExpressionClosure mapper = closureArg(args, name);
            List<Object> mapped = new ArrayList<>(list.size());
            for (Object item : new ArrayList<>(list)) {
               mapped.add(invoke(mapper, singleton(item)));
            }
            return mapped;
         }
         case "any":
         case "some": {
            ExpressionClosure predicate = closureArg(args, name);
            for (Object item : new ArrayList<>(list)) {
               if (ExpressionValues.requireBoolean(invoke(predicate, singleton(item)), name + " predicate")) {
                  return true;
               }
            }
            return false;
         }
         case "all": {
            ExpressionClosure predicate = closureArg(args, name);
            for (Object item : new ArrayList<>(list)) {
               if (!ExpressionValues.requireBoolean(invoke(predicate, singleton(item)), "all predicate")) {
                  return false;
               }
            }
            return true;
         }
         default:
            throw new ScriptExecutionException("Method " + name + "() not found on array");
      }
   }

   private Object mapMethod(Map<String, Object> map, String name, List<Object> args) {
      switch (name) {
         case "len":
            return (long) map.size();
         case "is_empty":
            return map.isEmpty();
         case "contains":
            return map.containsKey(ExpressionValues.requireString(arg(args, 0, name), name));
         case "get":
            return map.get(ExpressionValues.requireString(arg(args, 0, name), name));
         case "keys":
            return new ArrayList<Object>(map.keySet());
         case "values":
            return new ArrayList<>(map.values());
         case "remove":
            return map.remove(ExpressionValues.requireString(arg(args, 0, name), name));
         default:
            throw new ScriptExecutionException("Method " + name + "() not found on map");
      }
   }

   private static List<Object> singleton(Object item) {
      List<Object> args = new ArrayList<>(1);
      args.add(item);
      return args;
   }

   private static Object arg(List<Object> args, int index, String method) {
      if (index >= args.size()) {
         throw new ScriptExecutionException("Method " + method + "() expects at least " + (index + 1) + " argument(s)");
      }
      return args.get(index);
   }

   private static ExpressionClosure closureArg(List<Object> args, String method) {
      if (args.size() != 1 || !(args.get(0) instanceof ExpressionClosure closure)) {
         throw new ScriptExecutionException("Method " + method + "() expects a closure");
      }
      return closure;
   }

   // limits

   @SuppressWarnings("unchecked")
   private static Map<String, Object> requireMap(Object value, String where) {
      if (value instanceof Map) {
         return (Map<String, Object>) value;
      }
      throw new ScriptExecutionException("Cannot set property '" + where + "' on " + ExpressionValues.typeOf(value));
   }

   private void putChecked(Map<String, Object> map, String key, Object value) {
      map.put(key, value);
      checkMap(map);
   }

   private String checkString(String value) {
      if (value.length() > limits.maxStringSize()) {
         throw stringTooLong();
      }
      return value;
   }

   private List<Object> checkArray(List<Object> values) {
      if (values.size() > limits.maxArraySize()) {
         throw arrayTooLarge();
      }
      return values;
   }

   private Map<String, Object> checkMap(Map<String, Object> map) {
      if (map.size() > limits.maxMapSize()) {
         throw new ScriptResourceExceededException("map-size",
                 "Map exceeds the maximum size of " + limits.maxMapSize());
      }
      return map;
   }

   private ScriptResourceExceededException stringTooLong() {
      return new ScriptResourceExceededException("string-size",
              "String exceeds the maximum length of " + limits.maxStringSize());
   }

   private ScriptResourceExceededException arrayTooLarge() {
      return new ScriptResourceExceededException("array-size",
              "Array exceeds the maximum size of " + limits.maxArraySize());
   }
}
