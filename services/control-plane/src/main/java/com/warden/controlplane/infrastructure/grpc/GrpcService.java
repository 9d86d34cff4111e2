package com.warden.controlplane.infrastructure.grpc;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class whose {@link GrpcMethod} methods implement one gRPC service.
 *
 * @see GrpcServiceBinder
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface GrpcService {

    /** Fully qualified service name, e.g. {@code warden.v1.ProfileService}. */
    String value();
}
