package com.warden.controlplane.infrastructure.grpc;

import com.warden.observability.MetricFactory;
import com.warden.security.MethodPolicy;
import com.warden.security.RpcPolicyIndex;
import io.grpc.ForwardingServerCall;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the outcome and latency of every call, and records them as metrics.
 *
 * <p>Sits inside {@link GrpcCorrelationInterceptor}, so log lines carry the correlation MDC keys,
 * and outside {@link GrpcExceptionInterceptor}, so it sees the final status. Methods whose policy
 * sets {@code noLog} are counted but not logged.
 */
public class GrpcLoggingInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GrpcLoggingInterceptor.class);

    static final String CALLS_METRIC = "warden.grpc.calls";

    static final String LATENCY_METRIC = "warden.grpc.latency";

    private final RpcPolicyIndex policies;
    private final MetricFactory metrics;

    public GrpcLoggingInterceptor(RpcPolicyIndex policies, MetricFactory metrics) {
        this.policies = policies;
        this.metrics = metrics;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
        String method = call.getMethodDescriptor().getFullMethodName();
        MethodPolicy policy = policies.lookup(method);
        long start = System.nanoTime();

        ServerCall<ReqT, RespT> loggingCall =
                new ForwardingServerCall.SimpleForwardingServerCall<>(call) {
                    @Override
                    public void close(Status status, Metadata trailers) {
                        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                        record(method, policy, status, elapsed);
                        super.close(status, trailers);
                    }
                };
        return next.startCall(loggingCall, headers);
    }

    private void record(String method, MethodPolicy policy, Status status, Duration elapsed) {
        String code = status.getCode().name();
        metrics.counter(CALLS_METRIC, "gRPC calls handled", "method", method, "code", code)
                .increment();
        metrics.timer(LATENCY_METRIC, "gRPC call latency", "method", method).record(elapsed);
        if (policy.noLog()) {
            return;
        }
        if (status.isOk()) {
            log.info("{} completed OK in {} ms", method, elapsed.toMillis());
        } else {
            log.info("{} completed {} in {} ms: {}",
                    method, code, elapsed.toMillis(), status.getDescription());
        }
    }
}
