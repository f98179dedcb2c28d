package com.example.canarycontroller.error;

/**
 * An operation that the deployment's current status does not allow.
 */
public class IllegalTransitionException extends CanaryException {

    private final String deploymentId;
    private final String currentState;
    private final String operation;

    public IllegalTransitionException(String deploymentId, Object currentState, String operation) {
        super(ErrorCode.STATE_TRANSITION_INVALID,
                String.format("Cannot %s deployment %s in state %s", operation, deploymentId, currentState));
        this.deploymentId = deploymentId;
        this.currentState = String.valueOf(currentState);
        this.operation = operation;
    }

    public String getDeploymentId() {
        return deploymentId;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getOperation() {
        return operation;
    }
}
