package dev.reviewflow.domain.enums;

/**
 * Approval policy of a workflow step. Each constant owns its quorum rule,
 * evaluated over the active assignments of the step.
 *
 * <p>A REJECT decision vetoes the request under every policy; quorum only
 * counts approvals.
 */
public enum StepType {

    /** Any one approval satisfies the step. */
    SINGLE_APPROVAL {
        @Override
        public boolean isSatisfied(long approvals, int activeAssignments, int requiredApprovals) {
            return approvals >= 1;
        }
    },

    /**
     * N-of-M: {@code requiredApprovals} approvals satisfy the step. The threshold is
     * capped at the number of active assignees, which can be lower than the number
     * of configured assignees once role members are de-duplicated.
     */
    MULTI_APPROVAL {
        @Override
        public boolean isSatisfied(long approvals, int activeAssignments, int requiredApprovals) {
            int needed = Math.min(Math.max(requiredApprovals, 1), activeAssignments);
            return activeAssignments > 0 && approvals >= needed;
        }

        @Override
        public boolean takesThreshold() {
            return true;
        }
    },

    /** Every active assignee of the step must approve. */
    ALL_APPROVAL {
        @Override
        public boolean isSatisfied(long approvals, int activeAssignments, int requiredApprovals) {
            return activeAssignments > 0 && approvals >= activeAssignments;
        }
    };

    public abstract boolean isSatisfied(long approvals, int activeAssignments, int requiredApprovals);

    /** Whether {@code requiredApprovals} other than 1 is meaningful for this policy. */
    public boolean takesThreshold() {
        return false;
    }
}
