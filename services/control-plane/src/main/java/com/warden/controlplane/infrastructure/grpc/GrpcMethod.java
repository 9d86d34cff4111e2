package com.warden.controlplane.infrastructure.grpc;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a public method as a unary RPC. The method takes the request message as its only
 * parameter and returns the response message.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface GrpcMethod {

    /** Method name within the service, e.g. {@code CreateProfile}. */
    String value();
}
