package com.syntaxforge.parser;

import com.syntaxforge.ast.SourceType;

/**
 * Parser options. A config built with {@link #builder()} is partial: fields left
 * unset are {@code null} and keep their current value when merged.
 */
public record ParserConfig(
    SourceType sourceType,
    Integer ecmaVersion,
    Boolean allowReturnOutsideFunction,
    Boolean allowImportExportEverywhere,
    Boolean locations,
    Boolean ranges,
    Boolean preserveParens
) {

    private static final ParserConfig DEFAULTS = new ParserConfig(
        SourceType.MODULE, 2020, false, false, true, true, false);

    public static ParserConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a new config in which every non-null field of {@code partial} replaces this config's value.
     */
    public ParserConfig merge(ParserConfig partial) {
        if (partial == null) {
            return this;
        }
        return new ParserConfig(
            partial.sourceType != null ? partial.sourceType : sourceType,
            partial.ecmaVersion != null ? partial.ecmaVersion : ecmaVersion,
            partial.allowReturnOutsideFunction != null ? partial.allowReturnOutsideFunction : allowReturnOutsideFunction,
            partial.allowImportExportEverywhere != null ? partial.allowImportExportEverywhere : allowImportExportEverywhere,
            partial.locations != null ? partial.locations : locations,
            partial.ranges != null ? partial.ranges : ranges,
            partial.preserveParens != null ? partial.preserveParens : preserveParens);
    }

    public boolean locationsEnabled() {
        return Boolean.TRUE.equals(locations);
    }

    public boolean rangesEnabled() {
        return Boolean.TRUE.equals(ranges);
    }

    public boolean preserveParensEnabled() {
        return Boolean.TRUE.equals(preserveParens);
    }

    public boolean returnOutsideFunctionAllowed() {
        return Boolean.TRUE.equals(allowReturnOutsideFunction);
    }

    public boolean importExportEverywhereAllowed() {
        return Boolean.TRUE.equals(allowImportExportEverywhere);
    }

    /**
     * The ECMAScript version as a year. Edition numbers 3 and 5 map to years
     * before 2015, 6 to 15 map to 2015 to 2024; years pass through.
     */
    public int ecmaYear() {
        int version = ecmaVersion != null ? ecmaVersion : DEFAULTS.ecmaVersion;
        if (version >= 2015) {
            return version;
        }
        if (version >= 6) {
            return 2009 + version;
        }
        return version == 5 ? 2009 : 1999;
    }

    public static final class Builder {
        private SourceType sourceType;
        private Integer ecmaVersion;
        private Boolean allowReturnOutsideFunction;
        private Boolean allowImportExportEverywhere;
        private Boolean locations;
        private Boolean ranges;
        private Boolean preserveParens;

        private Builder() {
        }

        public Builder sourceType(SourceType sourceType) {
            this.sourceType = sourceType;
            return this;
        }

        public Builder ecmaVersion(int ecmaVersion) {
            this.ecmaVersion = ecmaVersion;
            return this;
        }

        public Builder allowReturnOutsideFunction(boolean allow) {
            this.allowReturnOutsideFunction = allow;
            return this;
        }

        public Builder allowImportExportEverywhere(boolean allow) {
            this.allowImportExportEverywhere = allow;
            return this;
        }

        public Builder locations(boolean locations) {
            this.locations = locations;
            return this;
        }

        public Builder ranges(boolean ranges) {
            this.ranges = ranges;
            return this;
        }

        public Builder preserveParens(boolean preserveParens) {
            this.preserveParens = preserveParens;
            return this;
        }

        public ParserConfig build() {
            return new ParserConfig(sourceType, ecmaVersion, allowReturnOutsideFunction,
                allowImportExportEverywhere, locations, ranges, preserveParens);
        }
    }
}
