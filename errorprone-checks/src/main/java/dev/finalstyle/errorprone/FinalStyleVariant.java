package dev.finalstyle.errorprone;

/**
 * The two diagnostics {@link UnnecessaryFinalChecker} can emit. A declaration that spells out its type only needs the
 * {@code final} deleted; one declared with {@code var} keeps {@code var} as its only keyword.
 */
enum FinalStyleVariant {
    WITH_TYPE("Remove the 'final'."),
    WITHOUT_TYPE("Replace 'final var' with 'var'.");

    static final String CODE = "UnnecessaryFinal";
    static final String MESSAGE = "Local variables should not be marked as 'final'.";

    private final String correction;

    FinalStyleVariant(String correction) {
        this.correction = correction;
    }

    static FinalStyleVariant classify(boolean hasExplicitType) {
        return hasExplicitType ? WITH_TYPE : WITHOUT_TYPE;
    }

    String code() {
        return CODE;
    }

    String message() {
        return MESSAGE;
    }

    String correction() {
        return correction;
    }

    /** Text handed to the diagnostic sink. */
    String diagnosticText() {
        return MESSAGE + " " + correction;
    }
}
