package io.github.eutro.yul2cairo.test;

import io.github.eutro.yul2cairo.builtins.BuiltinHandler;
import io.github.eutro.yul2cairo.builtins.Builtins;
import io.github.eutro.yul2cairo.builtins.CairoBuiltin;
import io.github.eutro.yul2cairo.conf.CairoConventions;
import io.github.eutro.yul2cairo.conf.Conventions;
import io.github.eutro.yul2cairo.ir.Yul;
import io.github.eutro.yul2cairo.passes.Passes;
import io.github.eutro.yul2cairo.passes.convert.CairoEmitter;
import io.github.eutro.yul2cairo.passes.convert.Implicits;
import io.github.eutro.yul2cairo.passes.convert.StorageVar;
import io.github.eutro.yul2cairo.passes.convert.YulToCairo;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.*;

import static io.github.eutro.yul2cairo.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class YulToCairoTest {
    private static final String ZERO = "Uint256(low=0, high=0)";

    private static String translate(Yul.Statement... statements) {
        return YulToCairo.INSTANCE.run(new Yul.Block(statements));
    }

    private static void assertContains(String expected, String actual) {
        assertTrue(actual.contains(expected), () -> "expected to find:\n" + expected + "\nin:\n" + actual);
    }

    @Test
    void testLiterals() {
        String program = translate(fn("f", names(), names("a", "b", "c", "d"),
                new Yul.VariableDeclaration(Yul.typedNames(Arrays.asList("a", "b")), null),
                assign("c", new Yul.Literal(BigInteger.ONE.shiftLeft(128).add(BigInteger.valueOf(7)))),
                assign("d", new Yul.Literal(true)),
                assign("d", new Yul.Literal("ab"))
        ));
        assertContains("    let a : Uint256 = " + ZERO + "\n"
                + "    let b : Uint256 = " + ZERO + "\n"
                + "    let c : Uint256 = Uint256(low=7, high=1)\n"
                + "    let d : Uint256 = Uint256(low=1, high=0)\n"
                + "    let d : Uint256 = Uint256(low='', high='ab' * 256**14)\n", program);
        assertThrows(IllegalArgumentException.class,
                () -> translate(fn("g", stmt("pop", new Yul.Literal(BigInteger.ONE.shiftLeft(256))))));
    }

    @Test
    void testPlainFunction() {
        String program = translate(fn("f", names("a"), names("r"),
                assign("r", call("add", id("a"), lit(1))),
                stmt("pop", id("r")),
                new Yul.If(id("r"),
                        new Yul.Block(stmt("revert", lit(0), lit(0))),
                        new Yul.Block(new Yul.Leave()))
        ));
        assertContains("func f{range_check_ptr}(a : Uint256) -> (r : Uint256):\n"
                + "    alloc_locals\n"
                + "    let (r : Uint256) = u256_add(a, Uint256(low=1, high=0))\n"
                + "\n"
                + "    if r.low + r.high != 0:\n"
                + "        assert 0 = 1\n"
                + "        jmp rel 0\n"
                + "    else:\n"
                + "        return (r)\n"
                + "    end\n"
                + "end\n", program);
        assertTrue(program.startsWith(Conventions.DEFAULT_CONVENTIONS.preamble));
        assertContains("from evm.uint256 import u256_add\n", program);
        assertContains("from starkware.cairo.common.uint256 import Uint256\n", program);
    }

    @Test
    void testImportsAreMerged() {
        String program = translate(fn("f", names("a"), names("r"),
                assign("r", call("sub", call("add", id("a"), id("a")), id("a"))),
                assign("r", call("shl", id("r"), id("a")))
        ));
        assertContains("from evm.uint256 import u256_add, u256_shl, u256_sub\n", program);
        assertContains("func f{bitwise_ptr : BitwiseBuiltin*, range_check_ptr}(", program);
    }

    @Test
    void testGetter() {
        CairoEmitter emitter = new CairoEmitter(Conventions.DEFAULT_CONVENTIONS);
        String program = emitter.translate(new Yul.Block(
                fn("get_balance", names("addr"), names("val"), stmt("mystery"))
        ));
        assertContains("func get_balance{pedersen_ptr : HashBuiltin*, range_check_ptr, syscall_ptr : felt*}"
                + "(addr : Uint256) -> (val : Uint256):\n"
                + "    alloc_locals\n"
                + "    let (val) = balance.read(addr)\n"
                + "    return (val)\n"
                + "end\n", program);
        assertContains("@storage_var\nfunc balance(arg0 : Uint256) -> (res : Uint256):\nend\n", program);
        assertFalse(program.contains("mystery"));
        assertEquals(Collections.singletonList(new StorageVar(
                "balance",
                Collections.singletonList(Yul.DEFAULT_TYPE),
                Yul.DEFAULT_TYPE
        )), new ArrayList<>(emitter.getStorageVariables()));
    }

    @Test
    void testSetter() {
        String program = translate(fn("fun_set_owner_setter",
                names("key", "value"), names()));
        assertContains("    owner.write(key, value)\n    return ()\n", program);
        assertContains("func owner(arg0 : Uint256) -> (res : Uint256):", program);
    }

    @Test
    void testMalformedAccessors() {
        assertThrows(IllegalStateException.class,
                () -> translate(fn("get_x", names(), names("a", "b"))));
        assertThrows(IllegalStateException.class,
                () -> translate(fn("set_x", names(), names())));
    }

    @Test
    void testStorageDeclarationsAreSorted() {
        String program = translate(
                fn("set_zeta", names("v"), names()),
                fn("f", stmt("sstore", lit(0), lit(1))),
                fn("get_alpha", names(), names("r"))
        );
        int alpha = program.indexOf("func alpha(");
        int evmStorage = program.indexOf("func evm_storage(");
        int zeta = program.indexOf("func zeta(");
        assertTrue(alpha >= 0 && alpha < evmStorage && evmStorage < zeta, program);
        assertContains("func sstore{pedersen_ptr : HashBuiltin*, range_check_ptr, syscall_ptr : felt*}"
                + "(key : Uint256, value : Uint256) -> ():", program);
        assertContains("    sstore(" + ZERO + ", Uint256(low=1, high=0))\n", program);
    }

    @Test
    void testImplicitsOfCallees() {
        CairoEmitter emitter = new CairoEmitter(Conventions.DEFAULT_CONVENTIONS);
        emitter.translate(new Yul.Block(
                fn("g", names("a"), names("r"), assign("r", call("add", id("a"), id("a")))),
                fn("f", names("a"), names("r"), assign("r", call("g", id("a")))),
                fn("h", names(), names("r"), assign("r", call("later"))),
                fn("later", names(), names("r"))
        ));
        assertEquals(Collections.singleton(Implicits.RANGE_CHECK_PTR), emitter.getImplicits("f"));
        assertEquals(Implicits.ALL, emitter.getImplicits("h"));
        assertEquals(Implicits.ALL, emitter.getImplicits("later"));
        assertEquals(Collections.emptySet(), emitter.getImplicits("nothing"));
        assertEquals(Collections.singleton("u256_add"), emitter.getImports().asMap().get("evm.uint256"));
    }

    @Test
    void testRecursiveCallIsChecked() {
        CairoEmitter emitter = new CairoEmitter(Conventions.DEFAULT_CONVENTIONS);
        String program = emitter.translate(new Yul.Block(fn("f", names("a"), names(),
                assign("a", call("add", id("a"), lit(1))),
                stmt("f", id("a")),
                stmt("sstore", lit(0), lit(1)),
                stmt("return", lit(0), lit(0))
        )));
        assertContains("    f(a)\n"
                + "    if termination_token == 1:\n"
                + "        return ()\n"
                + "    end\n"
                + "    sstore(", program);
        assertEquals(Implicits.ALL, emitter.getImplicits("f"));
    }

    @Test
    void testTerminatingConditionIsChecked() {
        String program = translate(fn("f",
                new Yul.If(call("later"), new Yul.Block(stmt("sstore", lit(0), lit(1)))),
                new Yul.Leave()
        ));
        assertContains("    let (__warp_if_cond) = later()\n"
                + "    if termination_token == 1:\n"
                + "        return ()\n"
                + "    end\n"
                + "    if __warp_if_cond.low + __warp_if_cond.high != 0:\n"
                + "        sstore(", program);
    }

    @Test
    void testTerminationCheckBeforeLeave() {
        String program = translate(fn("f", names(), names("r"),
                stmt("return", lit(0), lit(32)),
                new Yul.Leave()
        ));
        assertContains("    warp_return(" + ZERO + ", Uint256(low=32, high=0))\n"
                + "    return (r)\n"
                + "end\n", program);
        assertFalse(program.contains("termination_token == 1"));
    }

    @Test
    void testTerminationCheckInFunction() {
        String program = translate(fn("f", names(), names("r", "s"),
                stmt("return", lit(0), lit(32))
        ));
        assertContains("func f{exec_env : ExecutionEnvironment*, memory_dict : DictAccess*, msize, "
                + "range_check_ptr, termination_token}() -> (r : Uint256, s : Uint256):\n"
                + "    alloc_locals\n"
                + "    warp_return(" + ZERO + ", Uint256(low=32, high=0))\n"
                + "    if termination_token == 1:\n"
                + "        return (Uint256(0, 0), Uint256(0, 0))\n"
                + "    end\n"
                + "end\n", program);
    }

    @Test
    void testTerminationPropagatesToCallers() {
        String program = translate(
                fn("g", stmt("return", lit(0), lit(0))),
                fn("f", stmt("g"))
        );
        assertContains("    g()\n"
                + "    if termination_token == 1:\n"
                + "        return ()\n"
                + "    end\n", program);
    }

    @Test
    void testTerminationCheckInConstructorHelper() {
        String program = translate(fn("fun_warp_constructor_1",
                stmt("return", lit(0), lit(0))
        ));
        assertContains("    if termination_token == 1:\n"
                + "        default_dict_finalize(memory_dict_start, memory_dict, 0)\n"
                + "        return ()\n"
                + "    end\n", program);
    }

    @Test
    void testConstructor() {
        String program = translate(fn("constructor",
                stmt("sstore", lit(0), lit(1)),
                stmt("return", lit(0), lit(0))
        ));
        assertContains("@constructor\n"
                + "func constructor{pedersen_ptr : HashBuiltin*, range_check_ptr, syscall_ptr : felt*, "
                + "bitwise_ptr : BitwiseBuiltin*}(calldata_size, calldata_len, calldata : felt*):\n"
                + "    alloc_locals\n"
                + "    let termination_token = 0\n", program);
        assertContains("    let exec_env : ExecutionEnvironment* = &exec_env_\n", program);
        assertContains("    with memory_dict, msize, exec_env, termination_token:\n"
                + "        sstore(" + ZERO + ", Uint256(low=1, high=0))\n"
                + "        warp_return(" + ZERO + ", " + ZERO + ")\n"
                + "        if termination_token == 1:\n"
                + "            default_dict_finalize(memory_dict_start, memory_dict, 0)\n"
                + "            return ()\n"
                + "        end\n"
                + "        default_dict_finalize(memory_dict_start, memory_dict, 0)\n"
                + "        return ()\n"
                + "    end\n"
                + "end\n", program);
    }

    @Test
    void testEntryPoint() {
        String program = translate(fn("fun_ENTRY_POINT",
                stmt("return", lit(0), lit(0)),
                new Yul.Leave()
        ));
        assertContains("@external\n"
                + "func fun_ENTRY_POINT{pedersen_ptr : HashBuiltin*, range_check_ptr, syscall_ptr : felt*, "
                + "bitwise_ptr : BitwiseBuiltin*}(calldata_size, calldata_len, calldata : felt*) "
                + "-> (returndata_size : felt, returndata_len : felt, returndata : felt*):\n", program);
        assertContains("    let exec_env = &exec_env_\n", program);
        assertContains("    with exec_env, msize, memory_dict, termination_token:\n"
                + "        warp_return(" + ZERO + ", " + ZERO + ")\n"
                + "        default_dict_finalize(memory_dict_start, memory_dict, 0)\n"
                + "        return (exec_env.to_returndata_size, exec_env.to_returndata_len, exec_env.to_returndata)\n"
                + "    end\n"
                + "end\n", program);
        assertFalse(program.contains("termination_token == 1"));
    }

    @Test
    void testEntryPointWithoutLeave() {
        String program = translate(fn("fun_ENTRY_POINT", stmt("mstore", lit(0), lit(1))));
        assertContains("        mstore_(" + ZERO + ", Uint256(low=1, high=0))\n"
                + "        default_dict_finalize(memory_dict_start, memory_dict, 0)\n"
                + "        return (exec_env.to_returndata_size, exec_env.to_returndata_len, exec_env.to_returndata)\n",
                program);
        assertContains("from evm.memory import mstore_\n", program);
    }

    @Test
    void testTerminationWithoutExecEnv() {
        CairoConventions conventions = Conventions.createBuilder()
                .setBuiltins(functions -> {
                    Map<String, BuiltinHandler> handlers = Builtins.defaultHandlers(functions);
                    handlers.put("halt", new CairoBuiltin("evm.calls", "halt", Implicits.TERMINATION_TOKEN));
                    return handlers;
                })
                .build();
        Yul.Block block = new Yul.Block(fn("f", stmt("halt")));
        assertThrows(IllegalStateException.class, () -> new YulToCairo(conventions).run(block));
    }

    @Test
    void testEliminatedControlFlow() {
        assertThrows(IllegalStateException.class, () -> translate(fn("f",
                new Yul.Switch(id("x"), Collections.singletonList(
                        new Yul.Case(null, new Yul.Block()))))));
        assertThrows(IllegalStateException.class, () -> translate(fn("f",
                new Yul.ForLoop(new Yul.Block(), id("x"), new Yul.Block(), new Yul.Block(new Yul.Break())))));
        assertThrows(IllegalStateException.class, () -> translate(new Yul.Continue()));
    }

    @Test
    void testMalformedStatements() {
        assertThrows(IllegalStateException.class, () -> translate(new Yul.Leave()));
        assertThrows(IllegalStateException.class, () -> translate(fn("f",
                new Yul.ExpressionStatement(id("x")))));
        assertThrows(IllegalStateException.class, () -> translate(fn("f",
                new Yul.VariableDeclaration(Yul.typedNames(Arrays.asList("a", "b")), id("x")))));
    }

    @Test
    void testEmitterIsSingleUse() {
        CairoEmitter emitter = new CairoEmitter(Conventions.DEFAULT_CONVENTIONS);
        emitter.translate(new Yul.Block());
        assertThrows(IllegalStateException.class, () -> emitter.translate(new Yul.Block()));
    }

    @Test
    void testPipeline() {
        String program = Passes.LOWER_TO_CAIRO.run(new Yul.Block(
                fn("used"),
                fn("fun_ENTRY_POINT", stmt("used")),
                fn("unused", stmt("add", lit(1), lit(2)))
        ));
        assertContains("func used() -> ():\n", program);
        assertFalse(program.contains("unused"));
        assertFalse(program.contains("u256_add"));
    }
}
