package com.syncnest.identityservice.authorization;

import java.lang.annotation.*;

/**
 * Capabilities a controller method (or every method of a controller) requires.
 * Method-level declarations replace the class-level set.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequireCapabilities {
    Capability[] value();
}
