package com.warden.controlplane.infrastructure.grpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/** Encodes gRPC messages as JSON. An empty body decodes as an empty object. */
public final class JsonMarshaller<T> implements MethodDescriptor.Marshaller<T> {

    private final ObjectMapper mapper;
    private final Class<T> type;

    public JsonMarshaller(ObjectMapper mapper, Class<T> type) {
        this.mapper = mapper;
        this.type = type;
    }

    @Override
    public InputStream stream(T value) {
        try {
            return new ByteArrayInputStream(mapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw Status.INTERNAL
                    .withDescription("cannot encode " + type.getSimpleName())
                    .withCause(e)
                    .asRuntimeException();
        }
    }

    @Override
    public T parse(InputStream stream) {
        try {
            byte[] body = stream.readAllBytes();
            if (body.length == 0) {
                body = "{}".getBytes(StandardCharsets.UTF_8);
            }
            return mapper.readValue(body, type);
        } catch (IOException e) {
            throw Status.INVALID_ARGUMENT
                    .withDescription("malformed " + type.getSimpleName())
                    .withCause(e)
                    .asRuntimeException();
        }
    }

    public Class<T> type() {
        return type;
    }
}
