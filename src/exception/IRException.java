package exception;

import ir.value.Opcode;

/**
 * Raised on programmer misuse of the IR API. Never recoverable: the graph
 * being built is considered broken once one of these escapes.
 */
public class IRException extends RuntimeException {
    public IRException(String message) {
        super(message);
    }

    public static IRException noInsertionBlock() {
        return new IRException("no insertion block set");
    }

    public static IRException wrongArity(Opcode opcode, int count) {
        return new IRException("Wrong operand count for " + opcode.getMnemonic()
                               + ": " + count + " (expected " + opcode.describeArity() + ")");
    }

    public static IRException illegalOperand(String msg) {
        return new IRException("Illegal operand: " + msg);
    }

    public static IRException unSupported(String msg) {
        return new IRException("UnSupported: " + msg);
    }
}
