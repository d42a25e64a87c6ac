package com.hdlsim.proxy.error;

/**
 * Base class for failures raised while resolving or accessing simulation
 * objects. These are local failures: they never leave the proxy graph in an
 * inconsistent state.
 */
public abstract class SimHandleException extends RuntimeException {

    protected SimHandleException(String message) {
        super(message);
    }

    protected SimHandleException(String message, Throwable cause) {
        super(message, cause);
    }
}
