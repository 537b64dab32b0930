package net.littleredcomputer.dpll;

/**
 * Thrown when a formula is malformed: a clause holds the literal 0 or a null literal.
 */
public class InvalidFormulaException extends IllegalArgumentException {
    public InvalidFormulaException(String message) {
        super(message);
    }
}
