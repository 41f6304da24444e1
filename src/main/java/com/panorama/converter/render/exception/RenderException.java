package com.panorama.converter.render.exception;

/**
 * Raised when a Terraform template cannot be loaded or processed.
 */
public class RenderException extends RuntimeException {

    private final String templateName;

    public RenderException(String templateName, String message, Throwable cause) {
        super("Failed to render " + templateName + ": " + message, cause);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
