package com.example.docstandards.security.annotation;

import java.lang.annotation.*;

/**
 * Injects the caller into a controller method parameter.
 *
 * <p>Supported parameter types are {@code AuthContext} (subject and roles) and
 * {@code String}, which receives only the subject. The subject is what audit events
 * and job retries record as the actor.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ResolvedAuth {
}
