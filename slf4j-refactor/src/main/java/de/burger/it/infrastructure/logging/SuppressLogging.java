package de.burger.it.infrastructure.logging;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Excludes a method, or every method of a type, from {@link MethodLoggingAspect} tracing.
 * Used on per-character helpers whose entry/exit lines would drown the log.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface SuppressLogging {
}
