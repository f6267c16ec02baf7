package net.unishelf.controller.support;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a {@link net.unishelf.domain.caller.CallerIdentity} parameter from the gateway
 * identity headers. With {@code required = true} a missing identity yields 401.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface CurrentCaller {

    boolean required() default true;
}
