package com.nowqueue.exception;

import com.nowqueue.strategy.RelaxedConstraint;

/**
 * Exception thrown when a soft selection constraint cannot be met together with
 * the hard ones. Recovered by relaxing the constraint and flagging the result.
 */
public class InfeasibleSelectionException extends NowQueueException {

    private final RelaxedConstraint constraint;

    public InfeasibleSelectionException(RelaxedConstraint constraint, String message) {
        super(message);
        this.constraint = constraint;
    }

    public RelaxedConstraint getConstraint() {
        return constraint;
    }
}
