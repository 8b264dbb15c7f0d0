package com.example.anchormud.combat;

/**
 * Result of an intent, with the notice shown to the acting session.
 * Rejections leave every piece of state untouched.
 */
public final class ActionOutcome {

    public enum Status {
        ACCEPTED,
        NO_OP,
        INVALID_TARGET,
        INSUFFICIENT_RESOURCE,
        NOT_ALLOWED
    }

    private final Status status;
    private final String notice;

    private ActionOutcome(Status status, String notice) {
        this.status = status;
        this.notice = notice;
    }

    public static ActionOutcome accepted(String notice) {
        return new ActionOutcome(Status.ACCEPTED, notice);
    }

    public static ActionOutcome noOp(String notice) {
        return new ActionOutcome(Status.NO_OP, notice);
    }

    public static ActionOutcome invalidTarget(String notice) {
        return new ActionOutcome(Status.INVALID_TARGET, notice);
    }

    public static ActionOutcome insufficientResource(String notice) {
        return new ActionOutcome(Status.INSUFFICIENT_RESOURCE, notice);
    }

    public static ActionOutcome notAllowed(String notice) {
        return new ActionOutcome(Status.NOT_ALLOWED, notice);
    }

    public Status getStatus() { return status; }
    public String getNotice() { return notice; }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    @Override
    public String toString() {
        return status + ": " + notice;
    }
}
