package com.warden.controlplane.infrastructure.grpc;

import io.grpc.Context;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.Status;

/**
 * Listener that inspects the request message before any downstream code sees it.
 *
 * <p>On the first message {@link #admit(Object)} either returns the {@link Context} in which
 * downstream callbacks run, or throws. A throw closes the call and drops every later callback
 * except cancellation and completion.
 */
abstract class GatedListener<ReqT, RespT>
        extends ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT> {

    private final ServerCall<ReqT, RespT> call;
    private Context admitted;
    private boolean closed;

    GatedListener(ServerCall<ReqT, RespT> call, ServerCall.Listener<ReqT> delegate) {
        super(delegate);
        this.call = call;
    }

    /** Checks the request; returns the context downstream callbacks run in. */
    protected abstract Context admit(ReqT message);

    @Override
    public void onMessage(ReqT message) {
        if (closed) {
            return;
        }
        if (admitted == null) {
            try {
                admitted = admit(message);
            } catch (RuntimeException e) {
                closed = true;
                call.close(Status.fromThrowable(e), new Metadata());
                return;
            }
        }
        admitted.run(() -> super.onMessage(message));
    }

    @Override
    public void onHalfClose() {
        if (!closed) {
            runAdmitted(super::onHalfClose);
        }
    }

    @Override
    public void onReady() {
        if (!closed) {
            runAdmitted(super::onReady);
        }
    }

    @Override
    public void onCancel() {
        runAdmitted(super::onCancel);
    }

    @Override
    public void onComplete() {
        runAdmitted(super::onComplete);
    }

    private void runAdmitted(Runnable step) {
        if (admitted != null) {
            admitted.run(step);
        } else {
            step.run();
        }
    }
}
