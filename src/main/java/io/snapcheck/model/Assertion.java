package io.snapcheck.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * One reconciliation unit: a captured value tied to a call site in a test source file.
 *
 * <p>Identity is (file, line, test name, group id). The only field that changes after
 * construction is the regenerated code, which is set through {@link #withRegeneratedCode}
 * once a decision has been made.
 */
public final class Assertion {
    private final String file;
    private final int line;
    private final String testName;
    private final String groupId;
    private final Stage stage;
    private final String code;
    private final JsonNode value;
    private final String valueRepr;
    private final String expected;
    private final List<String> patterns;
    private final AssertionOptions options;
    private final String regeneratedCode;

    private Assertion(Builder b, String regeneratedCode) {
        this.file = Objects.requireNonNull(b.file, "file");
        this.line = b.line;
        this.testName = b.testName == null ? "" : b.testName;
        this.groupId = b.groupId == null ? "" : b.groupId;
        this.stage = b.stage == null ? Stage.NEW : b.stage;
        this.code = Objects.requireNonNull(b.code, "code");
        this.value = b.value;
        this.valueRepr = b.valueRepr == null ? String.valueOf(b.value) : b.valueRepr;
        this.expected = b.expected;
        this.patterns = b.patterns == null ? List.of() : List.copyOf(b.patterns);
        this.options = b.options == null ? AssertionOptions.NONE : b.options;
        this.regeneratedCode = regeneratedCode;
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1: " + line);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String file() {
        return file;
    }

    public int line() {
        return line;
    }

    public String testName() {
        return testName;
    }

    public String groupId() {
        return groupId;
    }

    public Stage stage() {
        return stage;
    }

    /**
     * Source text of the call site as it appears in the file, one or more full lines.
     */
    public String code() {
        return code;
    }

    public JsonNode value() {
        return value;
    }

    public String valueRepr() {
        return valueRepr;
    }

    /**
     * Expectation currently written at the call site, {@code null} for new assertions.
     */
    public String expected() {
        return expected;
    }

    public List<String> patterns() {
        return patterns;
    }

    public AssertionOptions options() {
        return options;
    }

    public String regeneratedCode() {
        return regeneratedCode;
    }

    public String location() {
        return file + ":" + line;
    }

    public Assertion withPatterns(List<String> candidates) {
        Builder b = toBuilder();
        b.patterns = candidates;
        return new Assertion(b, regeneratedCode);
    }

    public Assertion withRegeneratedCode(String newCode) {
        return new Assertion(toBuilder(), newCode);
    }

    private Builder toBuilder() {
        Builder b = new Builder();
        b.file = file;
        b.line = line;
        b.testName = testName;
        b.groupId = groupId;
        b.stage = stage;
        b.code = code;
        b.value = value;
        b.valueRepr = valueRepr;
        b.expected = expected;
        b.patterns = patterns;
        b.options = options;
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Assertion other)) {
            return false;
        }
        return line == other.line
                && file.equals(other.file)
                && testName.equals(other.testName)
                && groupId.equals(other.groupId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, testName, groupId);
    }

    @Override
    public String toString() {
        return "Assertion[" + groupId + " > " + testName + " @ " + location() + ", " + stage + "]";
    }

    public static final class Builder {
        private String file;
        private int line;
        private String testName;
        private String groupId;
        private Stage stage;
        private String code;
        private JsonNode value;
        private String valueRepr;
        private String expected;
        private List<String> patterns;
        private AssertionOptions options;

        private Builder() {
        }

        public Builder file(String value) {
            this.file = value;
            return this;
        }

        public Builder line(int value) {
            this.line = value;
            return this;
        }

        public Builder testName(String value) {
            this.testName = value;
            return this;
        }

        public Builder groupId(String value) {
            this.groupId = value;
            return this;
        }

        public Builder stage(Stage value) {
            this.stage = value;
            return this;
        }

        public Builder code(String value) {
            this.code = value;
            return this;
        }

        public Builder value(JsonNode node) {
            this.value = node;
            return this;
        }

        public Builder valueRepr(String repr) {
            this.valueRepr = repr;
            return this;
        }

        public Builder expected(String value) {
            this.expected = value;
            return this;
        }

        public Builder patterns(List<String> value) {
            this.patterns = value;
            return this;
        }

        public Builder options(AssertionOptions value) {
            this.options = value;
            return this;
        }

        public Assertion build() {
            return new Assertion(this, null);
        }
    }
}
