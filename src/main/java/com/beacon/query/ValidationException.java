package com.beacon.query;

import com.beacon.domain.PanelType;

/**
 * The results of a request do not fit the shape its panel type requires.
 * Raised even when every sub-query succeeded, and kept apart from
 * {@link QueryExecutionException} so callers can tell the two apart.
 */
public class ValidationException extends RuntimeException {
    
    private final PanelType panelType;
    
    public ValidationException(String message, PanelType panelType) {
        super(message);
        this.panelType = panelType;
    }
    
    public PanelType getPanelType() {
        return panelType;
    }
}
