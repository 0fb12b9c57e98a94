package tech.oauthplayground.flowengine.step;

import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.definition.FlowDefinitionRegistry;
import tech.oauthplayground.flowengine.model.Credentials;
import tech.oauthplayground.flowengine.model.FlowState;
import tech.oauthplayground.flowengine.model.StepKind;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Tracks the current step of one flow run and gates forward navigation on validation.
 *
 * <p>Completion is derived: a step is complete whenever its validation passes against
 * the current flow state, so clearing a step's data un-completes it.
 */
public class StepStateMachine {

    private static final Logger LOG = Logger.getLogger(StepStateMachine.class);

    private final FlowState flow;
    private final Clock clock;
    private Credentials credentials;
    private int currentStep;

    public StepStateMachine(FlowState flow, Credentials credentials, Clock clock) {
        this.flow = flow;
        this.credentials = credentials;
        this.clock = clock;
    }

    public List<StepKind> steps() {
        return FlowDefinitionRegistry.steps(flow.getFlowType(), credentials.usePkce());
    }

    public int totalSteps() {
        return steps().size();
    }

    public int currentStep() {
        return currentStep;
    }

    public StepKind currentStepKind() {
        return steps().get(currentStep);
    }

    /**
     * Jump to a step. Backward jumps are always allowed; forward jumps require every
     * step from the current one up to the target to validate.
     *
     * @return false if a step on the way does not validate
     * @throws IllegalArgumentException if the index is outside [0, totalSteps)
     */
    public boolean goTo(int step) {
        int total = totalSteps();
        if (step < 0 || step >= total) {
            throw new IllegalArgumentException("Step " + step + " is outside [0, " + total + ")");
        }
        for (int i = currentStep; i < step; i++) {
            if (!validate(i).isEmpty()) {
                LOG.debugf("Flow [%s] cannot move to step %d, step %d (%s) is incomplete",
                    flow.getFlowId(), step, i, steps().get(i));
                return false;
            }
        }
        currentStep = step;
        return true;
    }

    public boolean goNext() {
        if (currentStep + 1 >= totalSteps()) {
            return false;
        }
        return goTo(currentStep + 1);
    }

    public boolean goPrevious() {
        if (currentStep == 0) {
            return false;
        }
        currentStep--;
        return true;
    }

    public void reset() {
        currentStep = 0;
    }

    public List<String> validate(int step) {
        return StepValidator.validate(steps().get(step), flow, credentials, clock.instant());
    }

    /**
     * Errors blocking the current step.
     */
    public List<String> validationErrors() {
        return validate(currentStep);
    }

    public boolean isComplete(int step) {
        return validate(step).isEmpty();
    }

    public SortedSet<Integer> completedSteps() {
        SortedSet<Integer> completed = new TreeSet<>();
        for (int i = 0; i < totalSteps(); i++) {
            if (isComplete(i)) {
                completed.add(i);
            }
        }
        return Collections.unmodifiableSortedSet(completed);
    }

    public Credentials credentials() {
        return credentials;
    }

    /**
     * Replace the credentials. When the PKCE setting changes the step list changes too;
     * the machine stays on the same kind of step if it still exists, otherwise clamps.
     */
    public void updateCredentials(Credentials updated) {
        StepKind currentKind = currentStepKind();
        boolean topologyChanged = updated.usePkce() != credentials.usePkce();
        this.credentials = updated;
        if (!topologyChanged) {
            return;
        }
        List<StepKind> steps = steps();
        int index = steps.indexOf(currentKind);
        currentStep = index >= 0 ? index : Math.min(currentStep, steps.size() - 1);
        LOG.debugf("Flow [%s] step list changed (pkce=%s), now on step %d (%s)",
            flow.getFlowId(), updated.usePkce(), currentStep, steps.get(currentStep));
    }
}
