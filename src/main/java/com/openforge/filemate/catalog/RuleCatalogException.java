package com.openforge.filemate.catalog;

/**
 * Raised when a rule document exists but cannot be turned into a {@link RuleCatalog}.
 */
public class RuleCatalogException extends RuntimeException {

    public RuleCatalogException(String message) {
        super(message);
    }

    public RuleCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
