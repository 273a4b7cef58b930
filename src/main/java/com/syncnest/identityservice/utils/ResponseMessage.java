package com.syncnest.identityservice.utils;

import java.lang.annotation.*;

/**
 * Message placed in the success envelope for a handler or controller.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ResponseMessage {
    String value() default "OK";
}
