package com.peargent.tools;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method that {@link ToolBuilder#fromMethod} turns into a {@link Tool}.
 * Empty name means the method name; negative numbers mean "use the builder default".
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface ToolSpec {
    String name() default "";
    String description() default "";
    double timeout() default -1;
    int maxRetries() default -1;
    double retryDelay() default -1;
    boolean retryBackoff() default true;
    ErrorPolicy onError() default ErrorPolicy.RAISE;
}
