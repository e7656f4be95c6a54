package hostedauth.adapter.out.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import hostedauth.core.model.flow.RedirectReason;
import hostedauth.core.model.flow.ResponseType;
import hostedauth.core.port.out.FlowMetrics;

/**
 * Micrometer counters for the hosted UI flow.
 *
 * <p>Metrics:
 * <ul>
 *   <li>hostedauth.flow.redirects - redirects to the hosted UI, tagged by reason</li>
 *   <li>hostedauth.flow.sessions.resolved - callbacks turned into sessions, tagged by response type</li>
 *   <li>hostedauth.flow.cache.hits - sessions served without a network call</li>
 *   <li>hostedauth.flow.refreshes - refresh grants, tagged by outcome</li>
 *   <li>hostedauth.flow.failures - failed operations, tagged by error type</li>
 * </ul>
 */
public class MicrometerFlowMetrics implements FlowMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    public MicrometerFlowMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = registry != null && enabled;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordRedirect(RedirectReason reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("hostedauth.flow.redirects")
                .description("Redirects to the hosted UI")
                .tag("reason", reason.name().toLowerCase())
                .register(registry)
                .increment();
    }

    @Override
    public void recordSessionResolved(ResponseType responseType) {
        if (!enabled) {
            return;
        }

        Counter.builder("hostedauth.flow.sessions.resolved")
                .description("Sessions resolved from provider callbacks")
                .tag("response_type", responseType.wireValue())
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheHit() {
        if (!enabled) {
            return;
        }

        Counter.builder("hostedauth.flow.cache.hits")
                .description("Sessions served from held or cached tokens")
                .register(registry)
                .increment();
    }

    @Override
    public void recordRefresh(boolean success) {
        if (!enabled) {
            return;
        }

        Counter.builder("hostedauth.flow.refreshes")
                .description("Refresh token grants")
                .tag("outcome", success ? "success" : "rejected")
                .register(registry)
                .increment();
    }

    @Override
    public void recordFailure(String errorType) {
        if (!enabled) {
            return;
        }

        Counter.builder("hostedauth.flow.failures")
                .description("Failed flow operations")
                .tag("error_type", errorType == null ? "unknown" : errorType)
                .register(registry)
                .increment();
    }
}
