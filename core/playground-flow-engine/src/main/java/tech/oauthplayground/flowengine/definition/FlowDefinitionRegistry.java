package tech.oauthplayground.flowengine.definition;

import tech.oauthplayground.flowengine.model.FlowType;
import tech.oauthplayground.flowengine.model.StepKind;

import java.util.ArrayList;
import java.util.List;

import static tech.oauthplayground.flowengine.model.StepKind.*;

/**
 * The only place step sequences are defined. Every component that needs to know
 * which step it is on asks here instead of counting locally.
 */
public final class FlowDefinitionRegistry {

    private static final List<StepKind> IMPLICIT_STEPS =
        List.of(CONFIGURE, AUTHORIZATION_URL, CALLBACK, TOKENS, INTROSPECT);

    private static final List<StepKind> DIRECT_GRANT_STEPS =
        List.of(CONFIGURE, REQUEST_TOKEN, TOKENS, INTROSPECT);

    private static final List<StepKind> DEVICE_STEPS =
        List.of(CONFIGURE, DEVICE_AUTHORIZATION, POLLING, TOKENS, INTROSPECT);

    private static final List<StepKind> CODE_STEPS_WITH_PKCE =
        List.of(CONFIGURE, PKCE, AUTHORIZATION_URL, CALLBACK, EXCHANGE, TOKENS, INTROSPECT);

    private static final List<StepKind> CODE_STEPS_WITHOUT_PKCE;

    static {
        List<StepKind> steps = new ArrayList<>(CODE_STEPS_WITH_PKCE);
        steps.remove(PKCE);
        CODE_STEPS_WITHOUT_PKCE = List.copyOf(steps);
    }

    private FlowDefinitionRegistry() {
    }

    /**
     * Ordered steps for a flow. {@code usePkce} only matters for flows that redeem
     * an authorization code.
     */
    public static List<StepKind> steps(FlowType flowType, boolean usePkce) {
        return switch (flowType) {
            case AUTHORIZATION_CODE, HYBRID -> usePkce ? CODE_STEPS_WITH_PKCE : CODE_STEPS_WITHOUT_PKCE;
            case IMPLICIT -> IMPLICIT_STEPS;
            case CLIENT_CREDENTIALS, ROPC -> DIRECT_GRANT_STEPS;
            case DEVICE_CODE -> DEVICE_STEPS;
        };
    }

    public static int totalSteps(FlowType flowType, boolean usePkce) {
        return steps(flowType, usePkce).size();
    }

    /**
     * @return index of the step, or -1 when the flow does not have it
     */
    public static int indexOf(FlowType flowType, boolean usePkce, StepKind kind) {
        return steps(flowType, usePkce).indexOf(kind);
    }

    public static StepKind stepAt(FlowType flowType, boolean usePkce, int index) {
        List<StepKind> steps = steps(flowType, usePkce);
        if (index < 0 || index >= steps.size()) {
            throw new IllegalArgumentException(
                "Step " + index + " is outside [0, " + steps.size() + ") for " + flowType.value());
        }
        return steps.get(index);
    }
}
