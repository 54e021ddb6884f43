package com.demanddna.exception;

import java.util.Collection;

public class ProfileDataMissingException extends DemandDnaException {
    public ProfileDataMissingException(Collection<String> entities) {
        super("PROFILE_DATA_MISSING", "No monthly profile rows found for entities " + entities + ".");
    }
}
