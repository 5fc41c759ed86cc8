package io.github.eutro.yul2cairo.passes.convert;

import io.github.eutro.yul2cairo.builtins.BuiltinHandler;
import io.github.eutro.yul2cairo.builtins.CairoFunctions;
import io.github.eutro.yul2cairo.conf.CairoConventions;
import io.github.eutro.yul2cairo.ir.Yul;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static io.github.eutro.yul2cairo.passes.convert.CairoProgram.indent;

/**
 * The state of one translation of a Yul unit into Cairo.
 * <p>
 * Implicit arguments are discovered while rendering: each call adds what it uses to
 * the implicits of the function it is in, so a function's signature can only be
 * rendered after its body. Calls to functions that have not been rendered yet
 * assume they use every implicit.
 * <p>
 * An emitter is used for exactly one {@link #translate(Yul.Node)}.
 */
public class CairoEmitter implements Yul.Visitor<String> {
    private static final Logger LOGGER = LoggerFactory.getLogger(CairoEmitter.class);

    private static final String BUILTIN_IMPLICITS =
            "{pedersen_ptr : HashBuiltin*, range_check_ptr, syscall_ptr : felt*, bitwise_ptr : BitwiseBuiltin*}";
    private static final String CALLDATA_PARAMS = "(calldata_size, calldata_len, calldata : felt*)";
    private static final String FINALIZE_MEMORY = "default_dict_finalize(memory_dict_start, memory_dict, 0)";
    private static final String IF_CONDITION = "__warp_if_cond";
    private static final String RETURN_RETURNDATA =
            "return (exec_env.to_returndata_size, exec_env.to_returndata_len, exec_env.to_returndata)";

    private final CairoConventions conventions;
    private final CairoFunctions cairoFunctions = new CairoFunctions();
    private final Map<String, BuiltinHandler> builtins;
    private final Imports imports = new Imports();
    private final Map<String, SortedSet<String>> functionToImplicits = new HashMap<>();
    private final SortedMap<String, StorageVar> storageVariables = new TreeMap<>();

    @Nullable
    private Yul.FunctionDefinition currentFunction = null;
    private SortedSet<String> lastUsedImplicits = Collections.emptySortedSet();
    private boolean nextStatementIsLeave = false;
    private boolean terminatingCallSeen = false;
    /**
     * Functions whose bodies are being rendered, so whose implicits are not complete yet.
     */
    private final Set<String> rendering = new HashSet<>();
    private boolean used = false;

    public CairoEmitter(CairoConventions conventions) {
        this.conventions = conventions;
        builtins = conventions.builtins.apply(cairoFunctions);
        imports.merge(conventions.baseImports);
    }

    /**
     * Translate a whole unit, usually the top-level block, into a complete Cairo program.
     *
     * @param node The unit.
     * @return The program text.
     */
    public String translate(Yul.Node node) {
        if (used) {
            throw new IllegalStateException("CairoEmitter has already translated a unit");
        }
        used = true;
        String body = node.accept(this);
        SortedMap<String, StorageVar> allStorageVars = new TreeMap<>(storageVariables);
        for (StorageVar storageVar : cairoFunctions.getStorageVars()) {
            allStorageVars.putIfAbsent(storageVar.name, storageVar);
        }
        return CairoProgram.assemble(
                conventions.preamble,
                imports,
                cairoFunctions.getDefinitions(),
                allStorageVars.values(),
                body
        );
    }

    /**
     * Get the implicits discovered for a function so far.
     *
     * @param functionName The function.
     * @return Its implicits, empty if it is not known.
     */
    public SortedSet<String> getImplicits(String functionName) {
        SortedSet<String> implicits = functionToImplicits.get(functionName);
        return implicits == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(implicits);
    }

    public Collection<StorageVar> getStorageVariables() {
        return Collections.unmodifiableCollection(storageVariables.values());
    }

    public Imports getImports() {
        return imports;
    }

    private void addImplicits(String functionName, Collection<String> implicits) {
        functionToImplicits.computeIfAbsent(functionName, $ -> new TreeSet<>()).addAll(implicits);
    }

    @NotNull
    private SortedSet<String> implicitsOfCallee(String functionName) {
        if (rendering.contains(functionName)) {
            return new TreeSet<>(Implicits.ALL);
        }
        return new TreeSet<>(functionToImplicits.computeIfAbsent(functionName, $ -> new TreeSet<>(Implicits.ALL)));
    }

    @NotNull
    private Yul.FunctionDefinition requireFunction(String what) {
        if (currentFunction == null) {
            throw new IllegalStateException(what + " outside of a function");
        }
        return currentFunction;
    }

    private String join(List<? extends Yul.Node> nodes) {
        StringJoiner sj = new StringJoiner(", ");
        for (Yul.Node node : nodes) {
            sj.add(node.accept(this));
        }
        return sj.toString();
    }

    @Override
    public String visitTypedName(Yul.TypedName node) {
        return node.name + " : " + node.type;
    }

    @Override
    public String visitLiteral(Yul.Literal node) {
        return Uint256Literal.of(node).render();
    }

    @Override
    public String visitIdentifier(Yul.Identifier node) {
        return node.name;
    }

    @Override
    public String visitFunctionCall(Yul.FunctionCall node) {
        String name = node.functionName.name;
        List<String> args = new ArrayList<>();
        for (Yul.Expression argument : node.arguments) {
            args.add(argument.accept(this));
        }
        if ("revert".equals(name)) {
            return "assert 0 = 1\njmp rel 0";
        }
        if ("pop".equals(name)) {
            return "";
        }

        String result;
        BuiltinHandler handler = builtins.get(name);
        if (handler != null) {
            result = handler.getFunctionCall(args);
            imports.merge(handler.requiredImports());
            lastUsedImplicits = new TreeSet<>(handler.getUsedImplicits());
        } else {
            lastUsedImplicits = implicitsOfCallee(name);
            result = name + "(" + String.join(", ", args) + ")";
        }

        if (currentFunction == null) return result;
        addImplicits(currentFunction.name, lastUsedImplicits);
        if (!lastUsedImplicits.contains(Implicits.TERMINATION_TOKEN)) return result;
        if (!lastUsedImplicits.contains(Implicits.EXEC_ENV)) {
            throw new IllegalStateException("Call to " + name
                    + " may terminate, but cannot write the return data without " + Implicits.EXEC_ENV);
        }
        terminatingCallSeen = true;
        if (nextStatementIsLeave) return result;
        return result + "\n"
                + "if termination_token == 1:\n"
                + indent(terminationActions()) + "\n"
                + "end";
    }

    /**
     * Get the code that exits the current function once execution has terminated.
     */
    private String terminationActions() {
        Yul.FunctionDefinition function = requireFunction("Termination");
        if (conventions.isEntryPoint(function.name)) {
            return FINALIZE_MEMORY + "\n" + RETURN_RETURNDATA;
        }
        if (conventions.isConstructor(function.name) || conventions.isConstructorHelper(function.name)) {
            return FINALIZE_MEMORY + "\nreturn ()";
        }
        StringJoiner dummies = new StringJoiner(", ", "return (", ")");
        for (int i = 0; i < function.returnVariables.size(); i++) {
            dummies.add("Uint256(0, 0)");
        }
        return dummies.toString();
    }

    @Override
    public String visitExpressionStatement(Yul.ExpressionStatement node) {
        if (!(node.expression instanceof Yul.FunctionCall)) {
            throw new IllegalStateException("Only calls can be used as statements, got " + node.expression);
        }
        return node.expression.accept(this);
    }

    @Override
    public String visitAssignment(Yul.Assignment node) {
        List<String> names = new ArrayList<>();
        for (Yul.Identifier variable : node.variableNames) {
            names.add(variable.name);
        }
        return visitVariableDeclaration(new Yul.VariableDeclaration(Yul.typedNames(names), node.value));
    }

    @Override
    public String visitVariableDeclaration(Yul.VariableDeclaration node) {
        if (node.value == null) {
            StringJoiner decls = new StringJoiner("\n");
            for (Yul.TypedName variable : node.variables) {
                decls.add(visitVariableDeclaration(new Yul.VariableDeclaration(
                        Collections.singletonList(variable),
                        new Yul.Literal(0)
                )));
            }
            return decls.toString();
        }
        String value = node.value.accept(this);
        String vars = join(node.variables);
        if (node.value instanceof Yul.FunctionCall) {
            return "let (" + vars + ") = " + value;
        }
        if (node.variables.size() != 1) {
            throw new IllegalStateException("Cannot bind " + node.variables.size()
                    + " variables to the single value " + node.value);
        }
        return "let " + vars + " = " + value;
    }

    @Override
    public String visitBlock(Yul.Block node) {
        StringJoiner sj = new StringJoiner("\n");
        List<Yul.Statement> statements = node.statements;
        for (int i = 0; i < statements.size(); i++) {
            nextStatementIsLeave = i + 1 < statements.size() && statements.get(i + 1) instanceof Yul.Leave;
            SortedSet<String> outerImplicits = lastUsedImplicits;
            lastUsedImplicits = Collections.emptySortedSet();
            try {
                sj.add(statements.get(i).accept(this));
            } finally {
                lastUsedImplicits = outerImplicits;
            }
        }
        return sj.toString();
    }

    @Override
    public String visitFunctionDefinition(Yul.FunctionDefinition node) {
        Yul.FunctionDefinition outer = currentFunction;
        currentFunction = node;
        rendering.add(node.name);
        try {
            if (conventions.isConstructor(node.name)) {
                return emitConstructor(node);
            } else if (conventions.isEntryPoint(node.name)) {
                return emitEntryPoint(node);
            } else {
                return emitFunction(node);
            }
        } finally {
            rendering.remove(node.name);
            currentFunction = outer;
        }
    }

    private String emitFunction(Yul.FunctionDefinition node) {
        String body;
        StorageAccessors.Accessor accessor = StorageAccessors.synthesize(node);
        if (accessor != null) {
            addImplicits(node.name, StorageAccessors.IMPLICITS);
            storageVariables.putIfAbsent(accessor.storageVar.name, accessor.storageVar);
            body = accessor.body;
        } else {
            body = node.body.accept(this);
        }

        // the body has now reported every implicit it uses
        SortedSet<String> implicits = functionToImplicits.computeIfAbsent(node.name, $ -> new TreeSet<>());
        LOGGER.debug("Emitted function {} with implicits {}", node.name, implicits);
        return "func " + node.name + Implicits.printAll(implicits)
                + "(" + join(node.parameters) + ") -> (" + join(node.returnVariables) + "):\n"
                + indent("alloc_locals\n" + body) + "\n"
                + "end\n";
    }

    private static String contextPreamble(String execEnvDecl) {
        return "let termination_token = 0\n"
                + "let (returndata_ptr : felt*) = alloc()\n"
                + "let (__fp__, _) = get_fp_and_pc()\n"
                + "local exec_env_ : ExecutionEnvironment = ExecutionEnvironment("
                + "calldata_size=calldata_size, calldata_len=calldata_len, calldata=calldata, "
                + "returndata_size=0, returndata_len=0, returndata=returndata_ptr, "
                + "to_returndata_size=0, to_returndata_len=0, to_returndata=returndata_ptr)\n"
                + execEnvDecl + "\n"
                + "let (memory_dict) = default_dict_new(0)\n"
                + "let memory_dict_start = memory_dict\n"
                + "let msize = 0\n";
    }

    private static boolean endsWithLeave(Yul.Block block) {
        return !block.statements.isEmpty()
                && block.statements.get(block.statements.size() - 1) instanceof Yul.Leave;
    }

    private String emitConstructor(Yul.FunctionDefinition node) {
        String body = node.body.accept(this);
        if (!endsWithLeave(node.body)) {
            body = body + "\n" + terminationActions();
        }
        return "@constructor\n"
                + "func " + node.name + BUILTIN_IMPLICITS + CALLDATA_PARAMS + ":\n"
                + indent("alloc_locals\n"
                + contextPreamble("let exec_env : ExecutionEnvironment* = &exec_env_")
                + "with memory_dict, msize, exec_env, termination_token:\n"
                + indent(body) + "\n"
                + "end") + "\n"
                + "end\n";
    }

    private String emitEntryPoint(Yul.FunctionDefinition node) {
        String body = node.body.accept(this);
        if (!endsWithLeave(node.body)) {
            body = body + "\n" + terminationActions();
        }
        return "@external\n"
                + "func " + node.name + BUILTIN_IMPLICITS + CALLDATA_PARAMS
                + " -> (returndata_size : felt, returndata_len : felt, returndata : felt*):\n"
                + indent("alloc_locals\n"
                + contextPreamble("let exec_env = &exec_env_")
                + "with exec_env, msize, memory_dict, termination_token:\n"
                + indent(body) + "\n"
                + "end") + "\n"
                + "end\n";
    }

    @Override
    public String visitIf(Yul.If node) {
        // a terminating call in the condition is checked before the branch, not at the next leave
        boolean outerLeave = nextStatementIsLeave;
        boolean outerSeen = terminatingCallSeen;
        nextStatementIsLeave = true;
        terminatingCallSeen = false;
        String cond;
        String check = "";
        try {
            cond = node.condition.accept(this);
            if (terminatingCallSeen) {
                check = "let (" + IF_CONDITION + ") = " + cond + "\n"
                        + "if termination_token == 1:\n"
                        + indent(terminationActions()) + "\n"
                        + "end\n";
                cond = IF_CONDITION;
            }
        } finally {
            nextStatementIsLeave = outerLeave;
            terminatingCallSeen = outerSeen;
        }
        StringBuilder sb = new StringBuilder(check)
                .append("if ").append(cond).append(".low + ").append(cond).append(".high != 0:\n")
                .append(indent(node.body.accept(this))).append('\n');
        if (node.elseBody != null) {
            sb.append("else:\n").append(indent(node.elseBody.accept(this))).append('\n');
        }
        return sb.append("end").toString();
    }

    @Override
    public String visitCase(Yul.Case node) {
        throw new IllegalStateException("There should be no cases, run switch elimination first");
    }

    @Override
    public String visitSwitch(Yul.Switch node) {
        throw new IllegalStateException("There should be no switches, run switch elimination first");
    }

    @Override
    public String visitForLoop(Yul.ForLoop node) {
        throw new IllegalStateException("There should be no for loops, run for loop elimination first");
    }

    @Override
    public String visitBreak(Yul.Break node) {
        throw new IllegalStateException("There should be no breaks, run for loop elimination first");
    }

    @Override
    public String visitContinue(Yul.Continue node) {
        throw new IllegalStateException("There should be no continues, run for loop elimination first");
    }

    @Override
    public String visitLeave(Yul.Leave node) {
        Yul.FunctionDefinition function = requireFunction("leave");
        if (conventions.isEntryPoint(function.name) || conventions.isConstructor(function.name)) {
            return terminationActions();
        }
        StringJoiner names = new StringJoiner(", ", "return (", ")");
        for (Yul.TypedName variable : function.returnVariables) {
            names.add(variable.name);
        }
        return names.toString();
    }
}
