package com.syntharb.exception;

import java.util.Map;

/** Lookup of a position or risk alert by an id the service does not know. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                resourceType + " " + identifier + " does not exist",
                Map.of("resource", resourceType, "id", identifier));
    }
}
