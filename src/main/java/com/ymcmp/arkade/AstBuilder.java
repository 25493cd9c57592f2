package com.ymcmp.arkade;

import java.util.Set;
import java.util.Map;
import java.util.List;
import java.util.Arrays;
import java.util.HashSet;
import java.util.HashMap;
import java.util.ArrayList;
import java.util.Collections;

import java.util.stream.Collectors;

import java.util.logging.Logger;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;

import com.ymcmp.arkade.ast.*;
import com.ymcmp.arkade.except.*;

import com.ymcmp.arkade.grammar.ArkadeLexer;
import com.ymcmp.arkade.grammar.ArkadeParser;
import com.ymcmp.arkade.grammar.ArkadeParser.*;
import com.ymcmp.arkade.grammar.ArkadeBaseVisitor;

/**
 * Turns Arkade source into a {@link Contract}. Property paths rooted at
 * {@code tx} are resolved into typed introspection nodes here, so later
 * stages never inspect path strings.
 */
public class AstBuilder extends ArkadeBaseVisitor<Object> {

    public static final Logger LOGGER = Logger.getLogger(AstBuilder.class.getName());

    public static final Set<String> BASE_TYPES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "pubkey", "signature", "bytes", "bytes20", "bytes32", "int", "bool", "asset", "value")));

    private static final String OPT_SERVER = "server";
    private static final String OPT_EXIT = "exit";
    private static final String OPT_RENEW = "renew";

    private Map<String, String> options;
    private String currentFunction;

    public Contract build(final CharStream input) {
        final List<String> errors = new ArrayList<>();
        final BaseErrorListener listener = new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                    int line, int charPositionInLine, String msg, RecognitionException e) {
                errors.add(line + ":" + charPositionInLine + " " + msg);
            }
        };

        final ArkadeLexer lexer = new ArkadeLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);

        final ArkadeParser parser = new ArkadeParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        final ProgramContext program = parser.program();
        if (!errors.isEmpty()) {
            throw new ParseException(errors);
        }

        options = new HashMap<>();
        currentFunction = null;
        return (Contract) visit(program);
    }

    @Override
    public Object visitProgram(final ProgramContext ctx) {
        if (ctx.optionsBlock() != null) {
            visitOptionsBlock(ctx.optionsBlock());
        }
        return visitContractDecl(ctx.contractDecl());
    }

    @Override
    public Object visitOptionsBlock(final OptionsBlockContext ctx) {
        for (final OptionSettingContext setting : ctx.optionSetting()) {
            final String key = setting.key.getText();
            final String value = setting.getChild(2).getText();
            switch (key) {
                case OPT_SERVER:
                case OPT_EXIT:
                case OPT_RENEW:
                    if (options.put(key, value) != null) {
                        throw new DuplicateSymbolException(key, "options");
                    }
                    break;
                default:
                    LOGGER.warning("Ignoring unknown option " + key);
                    break;
            }
        }
        return null;
    }

    @Override
    public Object visitContractDecl(final ContractDeclContext ctx) {
        final String name = ctx.name.getText();
        final List<Parameter> params = visitParameters(ctx.parameterList(), "contract " + name);

        final String serverKey = options.get(OPT_SERVER);
        if (serverKey != null && params.stream().noneMatch(p -> p.name.equals(serverKey))) {
            // The operator key is supplied by the operator, not the constructor
            LOGGER.fine(() -> "Server key " + serverKey + " is not a parameter of " + name);
        }

        final Long exit = parseTimelock(OPT_EXIT);
        final Long renew = parseTimelock(OPT_RENEW);

        final Set<String> seen = new HashSet<>();
        final List<Function> functions = new ArrayList<>();
        for (final FunctionDeclContext fctx : ctx.functionDecl()) {
            final Function function = visitFunctionDecl(fctx);
            if (!seen.add(function.name)) {
                throw new DuplicateSymbolException(function.name, "contract " + name);
            }
            functions.add(function);
        }

        LOGGER.info("Parsed contract " + name + " with " + functions.size() + " function(s)");
        return new Contract(name, params, functions, serverKey, exit, renew);
    }

    private Long parseTimelock(final String key) {
        final String value = options.get(key);
        if (value == null) return null;
        try {
            return parseNumber(value);
        } catch (ParseException ex) {
            throw new ParseException("option " + key + " must be a block count, got " + value);
        }
    }

    @Override
    public Function visitFunctionDecl(final FunctionDeclContext ctx) {
        final String name = ctx.name.getText();
        currentFunction = name;
        final List<Parameter> params = visitParameters(ctx.parameterList(), "function " + name);
        final List<Statement> body = visitBlock(ctx.block());
        currentFunction = null;
        return new Function(name, params, body, ctx.internal != null);
    }

    private List<Parameter> visitParameters(final ParameterListContext ctx, final String scope) {
        if (ctx == null) return Collections.emptyList();

        final Set<String> seen = new HashSet<>();
        final List<Parameter> params = new ArrayList<>();
        for (final ParameterContext pctx : ctx.parameter()) {
            final String name = pctx.IDENT().getText();
            if (!seen.add(name)) {
                throw new DuplicateSymbolException(name, scope);
            }
            params.add(new Parameter(name, visitTypeName(pctx.typeName())));
        }
        return params;
    }

    @Override
    public String visitTypeName(final TypeNameContext ctx) {
        final String base = ctx.IDENT().getText();
        if (!BASE_TYPES.contains(base)) {
            throw new ParseException(ctx.getStart().getLine() + ":" + ctx.getStart().getCharPositionInLine()
                    + " unknown type " + base);
        }
        return ctx.array == null ? base : base + Parameter.ARRAY_SUFFIX;
    }

    @Override
    public List<Statement> visitBlock(final BlockContext ctx) {
        final List<Statement> list = new ArrayList<>();
        for (final StatementContext sctx : ctx.statement()) {
            final Statement stmt = (Statement) visit(sctx);
            if (stmt != null) list.add(stmt);
        }
        return list;
    }

    // Statements

    @Override
    public Statement visitRequireStmt(final RequireStmtContext ctx) {
        final String message = ctx.STRING() == null ? null : unquote(ctx.STRING().getText());
        return new Require(toRequirement(ctx.expression()), message);
    }

    @Override
    public Statement visitLetStmt(final LetStmtContext ctx) {
        return new LetBinding(ctx.IDENT().getText(), expr(ctx.expression()));
    }

    @Override
    public Statement visitDeclStmt(final DeclStmtContext ctx) {
        // Typed declarations bind like let, the type is only checked
        visitTypeName(ctx.typeName());
        return new LetBinding(ctx.IDENT().getText(), expr(ctx.expression()));
    }

    @Override
    public Statement visitAssignStmt(final AssignStmtContext ctx) {
        return new VarAssign(ctx.IDENT().getText(), expr(ctx.expression()));
    }

    @Override
    public Statement visitIfStmt(final IfStmtContext ctx) {
        return visitIfStatement(ctx.ifStatement());
    }

    @Override
    public Statement visitIfStatement(final IfStatementContext ctx) {
        final Expression cond = expr(ctx.expression());
        final List<Statement> thenBody = visitBlock(ctx.block(0));

        List<Statement> elseBody = null;
        if (ctx.ifStatement() != null) {
            elseBody = Collections.singletonList(visitIfStatement(ctx.ifStatement()));
        } else if (ctx.block().size() > 1) {
            elseBody = visitBlock(ctx.block(1));
        }
        return new IfElse(cond, thenBody, elseBody);
    }

    @Override
    public Statement visitForStmt(final ForStmtContext ctx) {
        return new ForIn(ctx.indexVar.getText(), ctx.valueVar.getText(), expr(ctx.expression()), visitBlock(ctx.block()));
    }

    @Override
    public Statement visitCallStmt(final CallStmtContext ctx) {
        LOGGER.warning("Ignoring call statement " + ctx.getText() + " in function " + currentFunction);
        return null;
    }

    private Requirement toRequirement(final ExpressionContext ctx) {
        if (ctx instanceof CallExprContext) {
            final CallExprContext call = (CallExprContext) ctx;
            final List<ExpressionContext> args = arguments(call.arguments());
            switch (call.IDENT().getText()) {
                case "checkSig":
                    expectArity(call, args, 2);
                    return new CheckSig(args.get(0).getText(), args.get(1).getText());
                case "checkSigFromStack":
                    expectArity(call, args, 3);
                    return new CheckSigFromStack(args.get(0).getText(), args.get(1).getText(), args.get(2).getText());
                case "checkMultisig":
                    return toMultisig(call, args);
                default:
                    return Comparison.standalone(expr(ctx));
            }
        }

        if (ctx instanceof CmpExprContext) {
            final CmpExprContext cmp = (CmpExprContext) ctx;
            final ExpressionContext lhs = cmp.expression(0);
            final ExpressionContext rhs = cmp.expression(1);
            final String op = cmp.op.getText();

            if (">=".equals(op) && "tx.time".equals(lhs.getText())) {
                if (rhs instanceof NumberExprContext) {
                    return new After(parseNumber(rhs.getText()), null);
                }
                return new After(0, rhs.getText());
            }

            if ("==".equals(op) && lhs instanceof CallExprContext
                    && "sha256".equals(((CallExprContext) lhs).IDENT().getText())) {
                final List<ExpressionContext> args = arguments(((CallExprContext) lhs).arguments());
                expectArity((CallExprContext) lhs, args, 1);
                return new HashEqual(args.get(0).getText(), rhs.getText());
            }

            return new Comparison(expr(lhs), BinaryOperator.fromSymbol(op), expr(rhs));
        }

        return Comparison.standalone(expr(ctx));
    }

    private CheckMultisig toMultisig(final CallExprContext call, final List<ExpressionContext> args) {
        if (args.isEmpty() || args.size() > 2 || !(args.get(0) instanceof ArrayExprContext)) {
            throw new ParseException(position(call) + " checkMultisig expects a key list and a signature list or threshold");
        }

        final List<String> keys = texts(((ArrayExprContext) args.get(0)).arguments());
        if (args.size() == 1) {
            return new CheckMultisig(Collections.emptyList(), keys, keys.size());
        }

        final ExpressionContext second = args.get(1);
        if (second instanceof ArrayExprContext) {
            final List<String> sigs = texts(((ArrayExprContext) second).arguments());
            return new CheckMultisig(sigs, keys, sigs.size());
        }
        if (second instanceof NumberExprContext) {
            final long threshold = parseNumber(second.getText());
            if (threshold < 1 || threshold > keys.size()) {
                throw new InvalidThresholdException(threshold, keys.size());
            }
            return new CheckMultisig(Collections.emptyList(), keys, (int) threshold);
        }
        throw new ParseException(position(call) + " checkMultisig threshold must be a number");
    }

    // Expressions

    private Expression expr(final ExpressionContext ctx) {
        return (Expression) visit(ctx);
    }

    @Override
    public Expression visitMethodExpr(final MethodExprContext ctx) {
        return resolvePath(ctx);
    }

    @Override
    public Expression visitMemberExpr(final MemberExprContext ctx) {
        return resolvePath(ctx);
    }

    @Override
    public Expression visitIndexExpr(final IndexExprContext ctx) {
        return resolvePath(ctx);
    }

    @Override
    public Expression visitMulExpr(final MulExprContext ctx) {
        return new BinaryOp(expr(ctx.expression(0)), BinaryOperator.fromSymbol(ctx.op.getText()), expr(ctx.expression(1)));
    }

    @Override
    public Expression visitAddExpr(final AddExprContext ctx) {
        return new BinaryOp(expr(ctx.expression(0)), BinaryOperator.fromSymbol(ctx.op.getText()), expr(ctx.expression(1)));
    }

    @Override
    public Expression visitCmpExpr(final CmpExprContext ctx) {
        return new BinaryOp(expr(ctx.expression(0)), BinaryOperator.fromSymbol(ctx.op.getText()), expr(ctx.expression(1)));
    }

    @Override
    public Expression visitNewExpr(final NewExprContext ctx) {
        return new CovenantScript(ctx.IDENT().getText(), texts(ctx.arguments()));
    }

    @Override
    public Expression visitCallExpr(final CallExprContext ctx) {
        final String name = ctx.IDENT().getText();
        final List<ExpressionContext> args = arguments(ctx.arguments());

        final Primitive.Kind primitive = Primitive.Kind.fromFunctionName(name);
        if (primitive != null) {
            expectArity(ctx, args, primitive.arity);
            return new Primitive(primitive, args.stream().map(this::expr).collect(Collectors.toList()));
        }

        switch (name) {
            case "ecMulScalarVerify":
                expectArity(ctx, args, 3);
                return new EcMulScalarVerify(expr(args.get(0)), expr(args.get(1)), expr(args.get(2)));
            case "tweakVerify":
                expectArity(ctx, args, 3);
                return new TweakVerify(expr(args.get(0)), expr(args.get(1)), expr(args.get(2)));
            case "checkSig":
                expectArity(ctx, args, 2);
                return new SignatureCheck(SignatureCheck.Kind.CHECKSIG, args.get(0).getText(), args.get(1).getText(), null);
            case "checkSigFromStack":
                expectArity(ctx, args, 3);
                return new SignatureCheck(SignatureCheck.Kind.FROM_STACK,
                        args.get(0).getText(), args.get(1).getText(), args.get(2).getText());
            case "checkSigFromStackVerify":
                expectArity(ctx, args, 3);
                return new SignatureCheck(SignatureCheck.Kind.FROM_STACK_VERIFY,
                        args.get(0).getText(), args.get(1).getText(), args.get(2).getText());
            default:
                LOGGER.warning("Unknown function " + name + " in function " + currentFunction + ", emitted as placeholder");
                return new Property(ctx.getText());
        }
    }

    @Override
    public Expression visitArrayExpr(final ArrayExprContext ctx) {
        return new Property(ctx.getText());
    }

    @Override
    public Expression visitParenExpr(final ParenExprContext ctx) {
        return expr(ctx.expression());
    }

    @Override
    public Expression visitNumberExpr(final NumberExprContext ctx) {
        return new Literal(ctx.getText());
    }

    @Override
    public Expression visitBoolExpr(final BoolExprContext ctx) {
        return "true".equals(ctx.value.getText()) ? Literal.TRUE : Literal.FALSE;
    }

    @Override
    public Expression visitIdentExpr(final IdentExprContext ctx) {
        return new Variable(ctx.IDENT().getText());
    }

    // Property paths

    private enum SegmentKind {
        MEMBER, INDEX, CALL
    }

    private static final class Segment {

        final SegmentKind kind;
        final String name;
        final ExpressionContext index;
        final List<ExpressionContext> args;

        Segment(SegmentKind kind, String name, ExpressionContext index, List<ExpressionContext> args) {
            this.kind = kind;
            this.name = name;
            this.index = index;
            this.args = args;
        }

        boolean isMember(final String expected) {
            return kind == SegmentKind.MEMBER && name.equals(expected);
        }

        boolean isCall(final String expected, final int arity) {
            return kind == SegmentKind.CALL && name.equals(expected) && args.size() == arity;
        }
    }

    /**
     * Collects member, index and call suffixes into {@code out} (outermost
     * last) and returns the root expression.
     */
    private static ExpressionContext flatten(final ExpressionContext ctx, final List<Segment> out) {
        if (ctx instanceof MemberExprContext) {
            final MemberExprContext m = (MemberExprContext) ctx;
            final ExpressionContext root = flatten(m.expression(), out);
            out.add(new Segment(SegmentKind.MEMBER, m.IDENT().getText(), null, null));
            return root;
        }
        if (ctx instanceof IndexExprContext) {
            final IndexExprContext i = (IndexExprContext) ctx;
            final ExpressionContext root = flatten(i.expression(0), out);
            out.add(new Segment(SegmentKind.INDEX, null, i.expression(1), null));
            return root;
        }
        if (ctx instanceof MethodExprContext) {
            final MethodExprContext c = (MethodExprContext) ctx;
            final ExpressionContext root = flatten(c.expression(), out);
            out.add(new Segment(SegmentKind.CALL, c.IDENT().getText(), null, arguments(c.arguments())));
            return root;
        }
        return ctx;
    }

    private Expression resolvePath(final ExpressionContext ctx) {
        final List<Segment> segs = new ArrayList<>();
        final ExpressionContext root = flatten(ctx, segs);

        Expression result = null;
        if (root instanceof IdentExprContext) {
            final String name = root.getText();
            result = "tx".equals(name) ? resolveTx(segs) : resolveNamed(name, segs);
        } else if (segs.size() == 1 && segs.get(0).kind == SegmentKind.INDEX) {
            result = new ArrayIndex(expr(root), expr(segs.get(0).index));
        }

        if (result == null) {
            LOGGER.fine(() -> "Unresolved property " + ctx.getText() + " kept as placeholder");
            return new Property(ctx.getText());
        }
        return result;
    }

    private Expression resolveNamed(final String name, final List<Segment> segs) {
        if (segs.size() != 1) return null;

        final Segment seg = segs.get(0);
        switch (seg.kind) {
            case MEMBER:
                if ("length".equals(seg.name)) {
                    return new ArrayLength(name);
                }
                return new GroupProperty(new Variable(name), seg.name);
            case INDEX:
                return new ArrayIndex(new Variable(name), expr(seg.index));
            default:
                return null;
        }
    }

    private Expression resolveTx(final List<Segment> segs) {
        if (segs.isEmpty() || segs.get(0).kind != SegmentKind.MEMBER) return null;

        final String head = segs.get(0).name;
        final int size = segs.size();
        switch (head) {
            case "time":
                return size == 1 ? new Property("tx.time") : null;
            case "input":
                if (size >= 2 && size <= 3 && segs.get(1).isMember("current")) {
                    if (size == 2) return new CurrentInput(null);
                    return segs.get(2).kind == SegmentKind.MEMBER ? new CurrentInput(segs.get(2).name) : null;
                }
                return null;
            case "inputs":
                return resolveIo(IoSource.INPUTS, segs);
            case "outputs":
                return resolveIo(IoSource.OUTPUTS, segs);
            case "assetGroups":
                return resolveGroups(segs);
            default:
                return size == 1 ? new TxIntrospection(head) : null;
        }
    }

    private Expression resolveIo(final IoSource source, final List<Segment> segs) {
        final int size = segs.size();
        if (size < 3 || segs.get(1).kind != SegmentKind.INDEX || segs.get(2).kind != SegmentKind.MEMBER) {
            return null;
        }

        final Expression index = expr(segs.get(1).index);
        if (segs.get(2).isMember("assets")) {
            if (size == 4 && segs.get(3).isCall("lookup", 1)) {
                return new AssetLookup(source, index, segs.get(3).args.get(0).getText());
            }
            if (size == 4 && segs.get(3).isMember("length")) {
                return new AssetCount(source, index);
            }
            if (size == 5 && segs.get(3).kind == SegmentKind.INDEX && segs.get(4).kind == SegmentKind.MEMBER) {
                return new AssetAt(source, index, expr(segs.get(3).index), segs.get(4).name);
            }
            return null;
        }

        if (size != 3) return null;
        final String property = segs.get(2).name;
        return source == IoSource.INPUTS
                ? new InputIntrospection(index, property)
                : new OutputIntrospection(index, property);
    }

    private Expression resolveGroups(final List<Segment> segs) {
        final int size = segs.size();
        if (size == 1) {
            return new Property(Property.ASSET_GROUPS);
        }

        final Segment second = segs.get(1);
        if (size == 2 && second.isCall("find", 1)) {
            return new GroupFind(second.args.get(0).getText());
        }
        if (size == 2 && second.isMember("length")) {
            return AssetGroupsLength.INSTANCE;
        }
        if (second.kind != SegmentKind.INDEX || size < 3 || segs.get(2).kind != SegmentKind.MEMBER) {
            return null;
        }

        final Expression group = expr(second.index);
        final String property = segs.get(2).name;
        switch (property) {
            case "sumInputs":
                return size == 3 ? new GroupSum(group, IoSource.INPUTS) : null;
            case "sumOutputs":
                return size == 3 ? new GroupSum(group, IoSource.OUTPUTS) : null;
            case "numInputs":
                return size == 3 ? new GroupNumIO(group, IoSource.INPUTS) : null;
            case "numOutputs":
                return size == 3 ? new GroupNumIO(group, IoSource.OUTPUTS) : null;
            case "inputs":
            case "outputs": {
                final IoSource source = "inputs".equals(property) ? IoSource.INPUTS : IoSource.OUTPUTS;
                if (size < 4 || size > 5 || segs.get(3).kind != SegmentKind.INDEX) return null;
                final Expression io = expr(segs.get(3).index);
                if (size == 4) return new GroupIOAccess(group, io, source, null);
                return segs.get(4).kind == SegmentKind.MEMBER
                        ? new GroupIOAccess(group, io, source, segs.get(4).name)
                        : null;
            }
            default:
                return size == 3 ? new GroupProperty(group, property) : null;
        }
    }

    // Helpers

    private static List<ExpressionContext> arguments(final ArgumentsContext ctx) {
        return ctx == null ? Collections.emptyList() : ctx.expression();
    }

    private static List<String> texts(final ArgumentsContext ctx) {
        return arguments(ctx).stream().map(ExpressionContext::getText).collect(Collectors.toList());
    }

    private static void expectArity(final CallExprContext ctx, final List<ExpressionContext> args, final int arity) {
        if (args.size() != arity) {
            throw new ParseException(position(ctx) + " " + ctx.IDENT().getText() + " expects "
                    + arity + " argument(s), got " + args.size());
        }
    }

    private static String position(final ExpressionContext ctx) {
        final Token start = ctx.getStart();
        return start.getLine() + ":" + start.getCharPositionInLine();
    }

    static long parseNumber(final String text) {
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                return Long.parseLong(text.substring(2), 16);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException ex) {
            throw new ParseException("invalid number " + text);
        }
    }

    static String unquote(final String literal) {
        final String body = literal.substring(1, literal.length() - 1);
        final StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); ++i) {
            final char ch = body.charAt(i);
            if (ch == '\\' && i + 1 < body.length()) {
                final char next = body.charAt(++i);
                switch (next) {
                    case 'n':
                        sb.append('\n');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    default:
                        sb.append(next);
                        break;
                }
            } else {
                sb.append(ch);
            }
        }
        return sb.toString();
    }
}
