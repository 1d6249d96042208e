package com.cburch.logsim.circuit;

import com.cburch.logsim.file.ErrorType;

import java.util.Arrays;

/**
 * A declaration that cannot be applied to the network. The network is left
 * untouched when this is thrown.
 */
public class NetworkException extends Exception {
    private final ErrorType type;
    private final Object[] args;

    public NetworkException(ErrorType type, Object... args) {
        super(type.format(args));
        this.type = type;
        this.args = args.clone();
    }

    public ErrorType type() {
        return type;
    }

    public Object[] args() {
        return args.clone();
    }

    @Override
    public String toString() {
        return "NetworkException{" + type + ", args=" + Arrays.toString(args) + "}";
    }
}
