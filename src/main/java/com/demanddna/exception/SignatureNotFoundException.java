package com.demanddna.exception;

import java.util.UUID;

public class SignatureNotFoundException extends DemandDnaException {
    public SignatureNotFoundException(UUID id) {
        super("SIGNATURE_NOT_FOUND", "Shock signature with id '" + id + "' not found.");
    }
}
