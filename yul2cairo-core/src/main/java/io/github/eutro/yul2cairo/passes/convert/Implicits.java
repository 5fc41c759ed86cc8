package io.github.eutro.yul2cairo.passes.convert;

import java.util.*;

/**
 * The implicit arguments Cairo functions can be threaded.
 * <p>
 * Builtins declare which of these they use; functions declare the union of what
 * their body uses in their signature.
 */
public final class Implicits {
    public static final String BITWISE_PTR = "bitwise_ptr";
    public static final String EXEC_ENV = "exec_env";
    public static final String MEMORY_DICT = "memory_dict";
    public static final String MSIZE = "msize";
    public static final String PEDERSEN_PTR = "pedersen_ptr";
    public static final String RANGE_CHECK_PTR = "range_check_ptr";
    public static final String SYSCALL_PTR = "syscall_ptr";
    public static final String TERMINATION_TOKEN = "termination_token";

    private static final Map<String, String> DECLARATIONS = new TreeMap<>();

    static {
        DECLARATIONS.put(BITWISE_PTR, "bitwise_ptr : BitwiseBuiltin*");
        DECLARATIONS.put(EXEC_ENV, "exec_env : ExecutionEnvironment*");
        DECLARATIONS.put(MEMORY_DICT, "memory_dict : DictAccess*");
        DECLARATIONS.put(MSIZE, "msize");
        DECLARATIONS.put(PEDERSEN_PTR, "pedersen_ptr : HashBuiltin*");
        DECLARATIONS.put(RANGE_CHECK_PTR, "range_check_ptr");
        DECLARATIONS.put(SYSCALL_PTR, "syscall_ptr : felt*");
        DECLARATIONS.put(TERMINATION_TOKEN, "termination_token");
    }

    /**
     * Every implicit, assumed for calls to functions whose implicits are not yet known.
     */
    public static final SortedSet<String> ALL = Collections.unmodifiableSortedSet(new TreeSet<>(DECLARATIONS.keySet()));

    private Implicits() {
    }

    public static SortedSet<String> of(String... implicits) {
        SortedSet<String> set = new TreeSet<>();
        for (String implicit : implicits) {
            if (!DECLARATIONS.containsKey(implicit)) {
                throw new IllegalArgumentException("Unknown implicit " + implicit);
            }
            set.add(implicit);
        }
        return Collections.unmodifiableSortedSet(set);
    }

    /**
     * Render the declaration of an implicit argument, with its type.
     *
     * @param implicit The implicit.
     * @return Its declaration.
     */
    public static String print(String implicit) {
        String decl = DECLARATIONS.get(implicit);
        if (decl == null) {
            throw new IllegalArgumentException("Unknown implicit " + implicit);
        }
        return decl;
    }

    /**
     * Render the implicit argument list of a function signature, in sorted order.
     *
     * @param implicits The implicits.
     * @return The braced list, or the empty string if there are none.
     */
    public static String printAll(Collection<String> implicits) {
        if (implicits.isEmpty()) return "";
        StringJoiner sj = new StringJoiner(", ", "{", "}");
        for (String implicit : new TreeSet<>(implicits)) {
            sj.add(print(implicit));
        }
        return sj.toString();
    }
}
