package tech.oauthplayground.flowengine.device;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.config.FlowEngineConfig;
import tech.oauthplayground.flowengine.exception.DeviceTimeoutException;
import tech.oauthplayground.flowengine.exception.FlowEngineException;
import tech.oauthplayground.flowengine.exception.ProtocolException;
import tech.oauthplayground.flowengine.exception.TransientException;
import tech.oauthplayground.flowengine.exception.ValidationException;
import tech.oauthplayground.flowengine.exception.ValidationException.ValidationError;
import tech.oauthplayground.flowengine.metrics.FlowMetrics;
import tech.oauthplayground.flowengine.model.Credentials;
import tech.oauthplayground.flowengine.model.DeviceAuthorization;
import tech.oauthplayground.flowengine.model.FlowState;
import tech.oauthplayground.flowengine.model.PollerState;
import tech.oauthplayground.flowengine.model.PollingStatus;
import tech.oauthplayground.flowengine.server.AuthorizationServerClient;
import tech.oauthplayground.flowengine.server.TokenEndpointResponse;
import tech.oauthplayground.flowengine.support.Masking;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Device authorization grant (RFC 8628): requests the device code, then polls the
 * token endpoint until the user approves, the server rejects, or time runs out.
 *
 * <p>At most one run exists per flow. The run map is the single-flight guard, so the
 * automatic start on device code arrival and a manual start cannot both win.
 *
 * <p>Each run's state is guarded by the run's monitor. The HTTP call is made outside
 * the monitor and its result is applied only if the run is still live, so once
 * {@link #stop(String)} returns nothing more is written to the flow and no further
 * event is delivered.
 */
@ApplicationScoped
public class DeviceAuthorizationPoller {

    private static final Logger LOG = Logger.getLogger(DeviceAuthorizationPoller.class);

    public static final String DEVICE_CODE_GRANT = "urn:ietf:params:oauth:grant-type:device_code";

    private final AuthorizationServerClient serverClient;
    private final FlowEngineConfig.Device config;
    private final ScheduledExecutorService scheduler;
    private final FlowMetrics metrics;
    private final Clock clock;

    private final ConcurrentMap<String, PollingRun> runs = new ConcurrentHashMap<>();

    @Inject
    public DeviceAuthorizationPoller(AuthorizationServerClient serverClient,
                                     FlowEngineConfig config,
                                     ScheduledExecutorService scheduler,
                                     FlowMetrics metrics,
                                     Clock clock) {
        this.serverClient = serverClient;
        this.config = config.device();
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Request a device code and user code from the device authorization endpoint.
     */
    public DeviceAuthorization requestAuthorization(Credentials credentials) {
        List<ValidationError> errors = new ArrayList<>();
        if (isBlank(credentials.environmentId())) {
            errors.add(new ValidationError("environmentId", "Environment ID is required", "MISSING_ENVIRONMENT_ID"));
        }
        if (isBlank(credentials.clientId())) {
            errors.add(new ValidationError("clientId", "Client ID is required", "MISSING_CLIENT_ID"));
        }
        if (!errors.isEmpty()) {
            throw ValidationException.of(errors);
        }

        DeviceAuthorization authorization = serverClient.requestDeviceAuthorization(credentials);
        LOG.infof("Device authorization received: userCode=%s, deviceCode=%s, expiresIn=%ds, interval=%s",
            authorization.userCode(), Masking.mask(authorization.deviceCode()),
            authorization.expiresIn(), authorization.interval());
        return authorization;
    }

    /**
     * Start polling for a flow that holds a device code.
     *
     * <p>The first attempt fires immediately. The interval starts at the larger of the
     * configured base and the server's requested interval.
     *
     * @return true if a run was started, false if one was already active or tokens already exist
     * @throws ValidationException if the flow has no device code or the client id is missing
     */
    public boolean start(FlowState flow, Credentials credentials, PollEventListener listener) {
        List<ValidationError> errors = new ArrayList<>();
        if (isBlank(flow.getDeviceCode())) {
            errors.add(new ValidationError("deviceCode", "Request a device code before polling", "MISSING_DEVICE_CODE"));
        }
        if (isBlank(credentials.clientId())) {
            errors.add(new ValidationError("clientId", "Client ID is required", "MISSING_CLIENT_ID"));
        }
        if (!errors.isEmpty()) {
            throw ValidationException.of(errors);
        }
        if (flow.hasAccessToken()) {
            LOG.debugf("Flow [%s] already has tokens, not polling", flow.getFlowId());
            return false;
        }

        long interval = initialInterval(flow);
        PollingRun run = new PollingRun(flow, credentials, listener, interval, false);

        // Publish the run while holding its monitor so a concurrent stop waits for the start to complete.
        synchronized (run) {
            if (runs.putIfAbsent(flow.getFlowId(), run) != null) {
                LOG.debugf("Polling already active for flow [%s], ignoring start", flow.getFlowId());
                return false;
            }
            flow.setPollingStatus(new PollingStatus(true, 0, null, null, PollerState.POLLING, interval));
            LOG.infof("Device polling started for flow [%s], interval=%ds, maxAttempts=%d",
                flow.getFlowId(), interval, config.maxAttempts());
            emit(run, new PollEvent.Started(flow.getFlowId(), interval));
            schedule(run, 0);
        }
        return true;
    }

    /**
     * Stop the active run for a flow. Idempotent.
     *
     * @return true if this call stopped a live run
     */
    public boolean stop(String flowId) {
        PollingRun run = runs.get(flowId);
        if (run == null || run.oneShot) {
            return false;
        }
        synchronized (run) {
            if (run.finished) {
                return false;
            }
            finish(run, PollerState.CANCELLED, null, new PollEvent.Cancelled(flowId, run.attempts));
        }
        LOG.infof("Device polling cancelled for flow [%s] after %d attempts", flowId, run.attempts);
        return true;
    }

    public boolean isRunning(String flowId) {
        PollingRun run = runs.get(flowId);
        return run != null && !run.oneShot && !run.finished;
    }

    /**
     * A single manual poll attempt, only when no run is active and the flow holds no tokens.
     *
     * @return the attempt's outcome, or empty if a run is active or tokens already exist
     */
    public Optional<PollEvent> checkOnce(FlowState flow, Credentials credentials) {
        if (isBlank(flow.getDeviceCode())) {
            throw ValidationException.single("deviceCode", "Request a device code before polling", "MISSING_DEVICE_CODE");
        }
        if (flow.hasAccessToken()) {
            LOG.debugf("Flow [%s] already has tokens, manual check skipped", flow.getFlowId());
            return Optional.empty();
        }
        List<PollEvent> events = new ArrayList<>();
        PollingRun run = new PollingRun(flow, credentials, events::add, initialInterval(flow), true);
        run.attempts = flow.getPollingStatus().pollCount();
        if (runs.putIfAbsent(flow.getFlowId(), run) != null) {
            LOG.debugf("Polling active for flow [%s], manual check skipped", flow.getFlowId());
            return Optional.empty();
        }
        try {
            runAttempt(run);
        } finally {
            runs.remove(flow.getFlowId(), run);
        }
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
    }

    long initialInterval(FlowState flow) {
        long base = config.pollInterval().toSeconds();
        Integer server = flow.getDeviceInterval();
        return server != null ? Math.max(base, server) : base;
    }

    private void schedule(PollingRun run, long delaySeconds) {
        try {
            run.future = scheduler.schedule(() -> runScheduled(run), delaySeconds, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            LOG.errorf("Poll scheduler rejected flow [%s]: %s", run.flow.getFlowId(), e.getMessage());
            FlowEngineException failure = new FlowEngineException("Polling could not be scheduled", e);
            finish(run, PollerState.FAILED, failure.getMessage(),
                new PollEvent.Failed(run.flow.getFlowId(), run.attempts, failure));
        }
    }

    private void runScheduled(PollingRun run) {
        try {
            runAttempt(run);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error polling flow [%s]", run.flow.getFlowId());
            synchronized (run) {
                if (!run.finished) {
                    FlowEngineException failure = new FlowEngineException("Polling failed: " + e.getMessage(), e);
                    finish(run, PollerState.FAILED, failure.getMessage(),
                        new PollEvent.Failed(run.flow.getFlowId(), run.attempts, failure));
                }
            }
        }
    }

    private void runAttempt(PollingRun run) {
        FlowState flow = run.flow;
        int attempt;
        synchronized (run) {
            if (run.finished) {
                return;
            }
            if (flow.isDeviceCodeExpired(clock.instant())) {
                timeOut(run, DeviceTimeoutException.deviceCodeExpired(run.attempts));
                return;
            }
            attempt = ++run.attempts;
            flow.setPollingStatus(flow.getPollingStatus().withAttempt(attempt, clock.instant()));
        }

        TokenEndpointResponse response = null;
        FlowEngineException failure = null;
        try {
            response = serverClient.requestToken(run.credentials,
                Map.of("grant_type", DEVICE_CODE_GRANT, "device_code", flow.getDeviceCode()), true);
        } catch (FlowEngineException e) {
            failure = e;
        }

        synchronized (run) {
            if (run.finished) {
                LOG.debugf("Discarding poll result for stopped flow [%s]", flow.getFlowId());
                return;
            }
            if (failure != null) {
                applyFailure(run, attempt, failure);
            } else {
                applyResponse(run, attempt, response);
            }
            if (run.oneShot) {
                run.finished = true;
            }
        }
    }

    private void applyFailure(PollingRun run, int attempt, FlowEngineException failure) {
        String flowId = run.flow.getFlowId();
        if (failure instanceof TransientException transientFailure) {
            metrics.recordPollAttempt("transient");
            run.consecutiveTransientFailures++;
            if (run.consecutiveTransientFailures >= config.maxConsecutiveTransientFailures()) {
                LOG.errorf("Device polling for flow [%s] failed after %d consecutive transport failures: %s",
                    flowId, run.consecutiveTransientFailures, failure.getMessage());
                finish(run, PollerState.FAILED, failure.getMessage(),
                    new PollEvent.Failed(flowId, attempt, failure));
                return;
            }
            LOG.warnf("Poll attempt %d for flow [%s] failed transiently: %s", attempt, flowId, failure.getMessage());
            emit(run, new PollEvent.TransientFailure(flowId, attempt, transientFailure));
            continueOrTimeOut(run, attempt, failure);
            return;
        }
        metrics.recordPollAttempt("error");
        LOG.errorf("Device polling for flow [%s] failed: %s", flowId, failure.getMessage());
        finish(run, PollerState.FAILED, failure.getMessage(), new PollEvent.Failed(flowId, attempt, failure));
    }

    private void applyResponse(PollingRun run, int attempt, TokenEndpointResponse response) {
        FlowState flow = run.flow;
        String flowId = flow.getFlowId();
        run.consecutiveTransientFailures = 0;

        if (response.isSuccess()) {
            metrics.recordPollAttempt("success");
            flow.setTokens(response.tokens());
            LOG.infof("Device authorization completed for flow [%s] on attempt %d, accessToken=%s",
                flowId, attempt, Masking.mask(response.tokens().accessToken()));
            finish(run, PollerState.SUCCEEDED, null, new PollEvent.Succeeded(flowId, attempt, response.tokens()));
            return;
        }

        if (response.isError(TokenEndpointResponse.AUTHORIZATION_PENDING)) {
            metrics.recordPollAttempt("pending");
            LOG.debugf("Poll attempt %d for flow [%s]: authorization_pending", attempt, flowId);
            emit(run, new PollEvent.Pending(flowId, attempt));
            continueOrTimeOut(run, attempt, null);
            return;
        }

        if (response.isError(TokenEndpointResponse.SLOW_DOWN)) {
            metrics.recordPollAttempt("slow_down");
            long current = run.intervalSeconds;
            Long requested = response.interval();
            run.intervalSeconds = requested != null && requested > current
                ? requested
                : current + config.slowDownIncrement().toSeconds();
            flow.setPollingStatus(flow.getPollingStatus().withInterval(run.intervalSeconds));
            LOG.warnf("Server asked flow [%s] to slow down, interval now %ds", flowId, run.intervalSeconds);
            emit(run, new PollEvent.SlowDown(flowId, attempt, run.intervalSeconds));
            continueOrTimeOut(run, attempt, null);
            return;
        }

        metrics.recordPollAttempt("error");
        ProtocolException error = response.toException();
        PollerState terminal = error.requiresNewDeviceCode() ? PollerState.EXPIRED : PollerState.FAILED;
        LOG.errorf("Device polling for flow [%s] stopped by server: %s", flowId, error.getMessage());
        finish(run, terminal, error.getMessage(), new PollEvent.Failed(flowId, attempt, error));
    }

    private void continueOrTimeOut(PollingRun run, int attempt, FlowEngineException lastFailure) {
        if (run.oneShot) {
            return;
        }
        if (attempt >= config.maxAttempts()) {
            timeOut(run, DeviceTimeoutException.attemptsExhausted(attempt, lastFailure));
        } else if (run.flow.isDeviceCodeExpired(clock.instant())) {
            timeOut(run, DeviceTimeoutException.deviceCodeExpired(attempt));
        } else {
            schedule(run, run.intervalSeconds);
        }
    }

    private void timeOut(PollingRun run, DeviceTimeoutException timeout) {
        LOG.errorf("Device polling for flow [%s] timed out (%s) after %d attempts",
            run.flow.getFlowId(), timeout.getReason(), timeout.getAttempts());
        finish(run, PollerState.EXPIRED, timeout.getMessage(),
            new PollEvent.TimedOut(run.flow.getFlowId(), timeout.getAttempts(), timeout));
    }

    /**
     * Must hold the run's monitor.
     */
    private void finish(PollingRun run, PollerState state, String error, PollEvent event) {
        run.finished = true;
        if (run.future != null) {
            run.future.cancel(false);
        }
        if (!run.oneShot) {
            runs.remove(run.flow.getFlowId(), run);
        }
        run.flow.setPollingStatus(run.flow.getPollingStatus().finished(state, error));
        emit(run, event);
    }

    private static void emit(PollingRun run, PollEvent event) {
        try {
            run.listener.onEvent(event);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Poll event listener failed on %s", event.getClass().getSimpleName());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class PollingRun {
        final FlowState flow;
        final Credentials credentials;
        final PollEventListener listener;
        final boolean oneShot;

        long intervalSeconds;
        int attempts;
        int consecutiveTransientFailures;
        volatile boolean finished;
        ScheduledFuture<?> future;

        PollingRun(FlowState flow, Credentials credentials, PollEventListener listener,
                   long intervalSeconds, boolean oneShot) {
            this.flow = flow;
            this.credentials = credentials;
            this.listener = listener;
            this.intervalSeconds = intervalSeconds;
            this.oneShot = oneShot;
        }
    }
}
