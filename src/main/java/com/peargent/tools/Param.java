package com.peargent.tools;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Param {
    String NO_DEFAULT = "\u0000";

    String name() default "";
    String description() default "";
    /** Textual default; its presence makes the parameter optional. */
    String defaultValue() default NO_DEFAULT;
}
