package de.ovgu.commitminer.process;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Persisted result of a commit that could not be analyzed.
 */
@JsonPropertyOrder({"commit", "position", "slot", "status", "cause", "detail", "message", "durationMillis"})
public class CommitErrorRecord {
    public static final String STATUS = "error";

    private String commit;
    private int position;
    private int slot;
    private String status = STATUS;
    private FailureCause cause;
    private String detail;
    private String message;
    private long durationMillis;

    public String getCommit() {
        return commit;
    }

    public void setCommit(String commit) {
        this.commit = commit;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public int getSlot() {
        return slot;
    }

    public void setSlot(int slot) {
        this.slot = slot;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public FailureCause getCause() {
        return cause;
    }

    public void setCause(FailureCause cause) {
        this.cause = cause;
    }

    /**
     * @return For analysis failures, what went wrong with the analyzer (e.g., <code>TIMEOUT</code>); otherwise
     * <code>null</code>
     */
    public String getDetail() {
        return detail;
    }

    public void setDetail(String detail) {
        this.detail = detail;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public void setDurationMillis(long durationMillis) {
        this.durationMillis = durationMillis;
    }

    /**
     * @return The cause, refined by the detail if there is one, e.g. <code>ANALYSIS/TIMEOUT</code>
     */
    public String describeCause() {
        String c = String.valueOf(cause);
        return detail == null ? c : c + "/" + detail;
    }
}
