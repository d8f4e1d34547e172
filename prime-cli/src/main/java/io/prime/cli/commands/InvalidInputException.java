package io.prime.cli.commands;

import java.io.Serial;

/// Raised when a command argument or input file cannot be used.
class InvalidInputException extends Exception {

    @Serial private static final long serialVersionUID = -5402176940018839236L;

    InvalidInputException(String message) {
        super(message);
    }

    InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
