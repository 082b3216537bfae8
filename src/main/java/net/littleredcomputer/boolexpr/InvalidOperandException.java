package net.littleredcomputer.boolexpr;

public class InvalidOperandException extends LogicException {
    public InvalidOperandException(String message) {
        super(message);
    }
}
