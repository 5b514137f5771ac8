package io.github.plangc.api;

import io.github.plangc.core.passes.convert.AstToIr;
import org.jetbrains.annotations.NotNull;

/**
 * Options for a {@link PolicyCompiler}. Create with {@link #builder()}.
 */
public final class CompilerOptions {
    /**
     * Whether IR is verified between stages when not set explicitly.
     * On unless {@code PLANGC_VERIFY_IR} is {@code false} or {@code 0}.
     */
    public static boolean VERIFY_IR_DEFAULT = envFlag("PLANGC_VERIFY_IR", true);
    /**
     * Whether the final IR is dumped to the log when not set explicitly.
     * On if {@code PLANGC_DUMP_IR} is set.
     */
    public static boolean DUMP_IR_DEFAULT = System.getenv("PLANGC_DUMP_IR") != null;

    private final String moduleName;
    private final boolean optimize;
    private final boolean verify;
    private final boolean dumpIr;

    private CompilerOptions(Builder builder) {
        moduleName = builder.moduleName;
        optimize = builder.optimize;
        verify = builder.verify;
        dumpIr = builder.dumpIr;
    }

    private static boolean envFlag(String name, boolean dflt) {
        String value = System.getenv(name);
        if (value == null) return dflt;
        return !(value.equalsIgnoreCase("false") || value.equals("0"));
    }

    /**
     * Start a {@link Builder} with the default options.
     *
     * @return The new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the name given to compiled modules.
     *
     * @return The module name.
     */
    public String getModuleName() {
        return moduleName;
    }

    public boolean isOptimize() {
        return optimize;
    }

    public boolean isVerify() {
        return verify;
    }

    public boolean isDumpIr() {
        return dumpIr;
    }

    /**
     * Create a builder starting from these options.
     *
     * @return The new builder.
     */
    public Builder toBuilder() {
        return new Builder()
                .setModuleName(moduleName)
                .setOptimize(optimize)
                .setVerify(verify)
                .setDumpIr(dumpIr);
    }

    @Override
    public String toString() {
        return "CompilerOptions{moduleName=" + moduleName
                + ", optimize=" + optimize
                + ", verify=" + verify
                + ", dumpIr=" + dumpIr + "}";
    }

    /**
     * A builder for {@link CompilerOptions}.
     */
    public static class Builder {
        private String moduleName = AstToIr.DEFAULT_MODULE_NAME;
        private boolean optimize = true;
        private boolean verify = VERIFY_IR_DEFAULT;
        private boolean dumpIr = DUMP_IR_DEFAULT;

        private Builder() {
        }

        /**
         * Set the name given to compiled modules.
         *
         * @param moduleName The module name.
         * @return This builder, for convenience.
         */
        public Builder setModuleName(@NotNull String moduleName) {
            if (moduleName.isEmpty()) {
                throw new IllegalArgumentException("Module name must not be empty");
            }
            this.moduleName = moduleName;
            return this;
        }

        /**
         * Set whether the optimisation passes are run.
         *
         * @param optimize Whether to optimise.
         * @return This builder, for convenience.
         */
        public Builder setOptimize(boolean optimize) {
            this.optimize = optimize;
            return this;
        }

        /**
         * Set whether the IR is verified after it is built and after it is optimised.
         *
         * @param verify Whether to verify.
         * @return This builder, for convenience.
         */
        public Builder setVerify(boolean verify) {
            this.verify = verify;
            return this;
        }

        /**
         * Set whether the final IR is printed to the log at INFO.
         *
         * @param dumpIr Whether to dump the IR.
         * @return This builder, for convenience.
         */
        public Builder setDumpIr(boolean dumpIr) {
            this.dumpIr = dumpIr;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(this);
        }
    }
}
