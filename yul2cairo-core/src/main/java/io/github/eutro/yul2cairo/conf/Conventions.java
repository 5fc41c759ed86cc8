package io.github.eutro.yul2cairo.conf;

public class Conventions {
    public static final CairoConventions DEFAULT_CONVENTIONS = createBuilder().build();

    public static CairoConventions.Builder createBuilder() {
        return new CairoConventions.Builder();
    }
}
