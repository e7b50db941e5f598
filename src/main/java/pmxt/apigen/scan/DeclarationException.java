package pmxt.apigen.scan;

import pmxt.apigen.GenerationException;

/**
 * The canonical declaration cannot be parsed or breaks a structural rule (e.g. overloaded members).
 */
public class DeclarationException extends GenerationException {

    public DeclarationException(String message) {
        super(message);
    }
}
