package io.valspec.core.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root configuration for schema bootstrap.
 *
 * <p>Use {@link #builder()} to construct instances; missing values receive the defaults documented
 * on the builder.
 *
 * @param schemasDir  directory that relative schema file paths resolve against
 * @param schemaFiles schema definition files, in compile order
 * @param compiler    compiler settings
 */
public record ValspecConfig(String schemasDir, List<String> schemaFiles, CompilerConfig compiler) {

    public ValspecConfig {
        Objects.requireNonNull(schemasDir, "schemasDir must not be null");
        schemaFiles = List.copyOf(schemaFiles);
        Objects.requireNonNull(compiler, "compiler must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder with defaults: {@code schemas} directory, no files, {@link CompilerConfig#defaults()}. */
    public static final class Builder {

        private String schemasDir = "schemas";
        private final List<String> schemaFiles = new ArrayList<>();
        private CompilerConfig compiler = CompilerConfig.defaults();

        Builder() {}

        public Builder schemasDir(String schemasDir) {
            this.schemasDir = schemasDir;
            return this;
        }

        public Builder schemaFile(String schemaFile) {
            this.schemaFiles.add(schemaFile);
            return this;
        }

        public Builder schemaFiles(List<String> schemaFiles) {
            this.schemaFiles.clear();
            this.schemaFiles.addAll(schemaFiles);
            return this;
        }

        public Builder compiler(CompilerConfig compiler) {
            this.compiler = compiler;
            return this;
        }

        public ValspecConfig build() {
            return new ValspecConfig(schemasDir, schemaFiles, compiler);
        }
    }
}
