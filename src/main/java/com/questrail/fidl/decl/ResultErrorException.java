package com.questrail.fidl.decl;

/**
 * Raised by {@link UnionValue#unwrap()} when a result union holds an error
 * variant.
 */
public final class ResultErrorException extends RuntimeException
{
    private final String typeName;
    private final String variant;
    private final transient Object error;

    public ResultErrorException(String typeName, String variant, Object error) {
        super(typeName + ("framework_err".equals(variant) ? " framework error " : " error ") + error);
        this.typeName = typeName;
        this.variant = variant;
        this.error = error;
    }

    /**
     * @return the raw fully-qualified name of the result union
     */
    public String typeName() {
        return typeName;
    }

    /**
     * @return {@code err} or {@code framework_err}
     */
    public String variant() {
        return variant;
    }

    public Object error() {
        return error;
    }

    public boolean isFrameworkError() {
        return "framework_err".equals(variant);
    }
}
