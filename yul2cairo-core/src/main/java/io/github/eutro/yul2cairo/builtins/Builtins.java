package io.github.eutro.yul2cairo.builtins;

import java.util.HashMap;
import java.util.Map;

import static io.github.eutro.yul2cairo.passes.convert.Implicits.*;

/**
 * The default registry of Yul builtins and their Cairo implementations.
 * <p>
 * {@code revert} and {@code pop} are not here, the code generator handles them itself.
 */
public class Builtins {
    private static final String UINT256 = "evm.uint256";
    private static final String MEMORY = "evm.memory";
    private static final String CALLS = "evm.calls";

    public static Map<String, BuiltinHandler> defaultHandlers(CairoFunctions functions) {
        Map<String, BuiltinHandler> map = new HashMap<>();

        // arithmetic
        arith(map, "add", "u256_add");
        arith(map, "sub", "u256_sub");
        arith(map, "mul", "u256_mul");
        arith(map, "div", "u256_div");
        arith(map, "sdiv", "u256_sdiv");
        arith(map, "mod", "u256_mod");
        arith(map, "smod", "u256_smod");
        arith(map, "exp", "u256_exp");
        arith(map, "addmod", "u256_addmod");
        arith(map, "mulmod", "u256_mulmod");

        // comparison
        arith(map, "lt", "is_lt");
        arith(map, "gt", "is_gt");
        arith(map, "slt", "slt");
        arith(map, "sgt", "sgt");
        arith(map, "eq", "is_eq");
        arith(map, "iszero", "is_zero");

        // bitwise
        bitwise(map, "and", "uint256_and");
        bitwise(map, "or", "uint256_or");
        bitwise(map, "xor", "uint256_xor");
        bitwise(map, "not", "uint256_not");
        bitwise(map, "shl", "u256_shl");
        bitwise(map, "shr", "u256_shr");
        bitwise(map, "sar", "u256_sar");
        bitwise(map, "byte", "u256_byte");

        // memory
        map.put("mload", new CairoBuiltin(MEMORY, "mload_", MEMORY_DICT, MSIZE, RANGE_CHECK_PTR));
        map.put("mstore", new CairoBuiltin(MEMORY, "mstore_", MEMORY_DICT, MSIZE, RANGE_CHECK_PTR));
        map.put("mstore8", new CairoBuiltin(MEMORY, "mstore8_", MEMORY_DICT, MSIZE, RANGE_CHECK_PTR));
        map.put("msize", new CairoBuiltin(MEMORY, "get_msize", MSIZE, RANGE_CHECK_PTR));

        // execution environment
        map.put("calldataload", new CairoBuiltin(CALLS, "calldataload", EXEC_ENV, RANGE_CHECK_PTR));
        map.put("calldatasize", new CairoBuiltin(CALLS, "calldatasize_", EXEC_ENV, RANGE_CHECK_PTR));
        map.put("calldatacopy", new CairoBuiltin(CALLS, "calldatacopy_", EXEC_ENV, MEMORY_DICT, MSIZE, RANGE_CHECK_PTR));
        map.put("caller", new CairoBuiltin(CALLS, "get_caller_data_uint256", SYSCALL_PTR));
        map.put("return", new CairoBuiltin(CALLS, "warp_return",
                EXEC_ENV, MEMORY_DICT, MSIZE, RANGE_CHECK_PTR, TERMINATION_TOKEN));

        // storage
        map.put("sload", new HelperBuiltin(functions, CairoFunctions::sloadFunction,
                PEDERSEN_PTR, RANGE_CHECK_PTR, SYSCALL_PTR));
        map.put("sstore", new HelperBuiltin(functions, CairoFunctions::sstoreFunction,
                PEDERSEN_PTR, RANGE_CHECK_PTR, SYSCALL_PTR));

        return map;
    }

    private static void arith(Map<String, BuiltinHandler> map, String yulName, String cairoName) {
        map.put(yulName, new CairoBuiltin(UINT256, cairoName, RANGE_CHECK_PTR));
    }

    private static void bitwise(Map<String, BuiltinHandler> map, String yulName, String cairoName) {
        map.put(yulName, new CairoBuiltin(UINT256, cairoName, BITWISE_PTR, RANGE_CHECK_PTR));
    }
}
