package com.example.docstandards.security.annotation;

import com.example.docstandards.security.context.Role;

import java.lang.annotation.*;

// value(): roles allowed (OR logic). Absent annotation = any authenticated subject
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequiredRole {

    Role[] value();
}
