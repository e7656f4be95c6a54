package hostedauth.adapter.out.telemetry;

import hostedauth.core.model.flow.RedirectReason;
import hostedauth.core.model.flow.ResponseType;
import hostedauth.core.port.out.FlowMetrics;

/**
 * FlowMetrics that records nothing, used when no meter registry is supplied.
 */
public final class NoopFlowMetrics implements FlowMetrics {

    public static final NoopFlowMetrics INSTANCE = new NoopFlowMetrics();

    private NoopFlowMetrics() {}

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void recordRedirect(RedirectReason reason) {}

    @Override
    public void recordSessionResolved(ResponseType responseType) {}

    @Override
    public void recordCacheHit() {}

    @Override
    public void recordRefresh(boolean success) {}

    @Override
    public void recordFailure(String errorType) {}
}
