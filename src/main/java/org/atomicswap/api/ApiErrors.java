package org.atomicswap.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Errors an API call may return, added to its OpenAPI responses by {@link org.atomicswap.api.resource.AnnotationPostProcessor}. */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ApiErrors {
	ApiError[] value() default {};
}
