package com.ebayseller.scraper;

/**
 * Progress and status of the current run as seen by the loading view.
 * <p>
 * Progress never decreases within a run: {@link #advance(double, String)} keeps the maximum of the
 * current and the requested value. Only {@link #beginRun()} resets it.
 */
public class PipelineState {
    private double progress;
    private String statusMessage = "";
    private boolean captchaDetected;
    private boolean waitingForUserInput;
    private Stage stage = Stage.IDLE;

    public void beginRun() {
        progress = 0.0;
        statusMessage = "";
        captchaDetected = false;
        waitingForUserInput = false;
        stage = Stage.CONNECTING;
    }

    /**
     * Moves progress forward to {@code value} (clamped to [0, 1]) and sets the status message.
     * A lower value only updates the message.
     */
    public void advance(double value, String message) {
        double clamped = Math.max(0.0, Math.min(1.0, value));
        if (clamped > progress) {
            progress = clamped;
        }
        if (message != null) {
            statusMessage = message;
        }
    }

    public void fail(String message) {
        stage = Stage.FAILED;
        statusMessage = message == null ? "" : message;
        captchaDetected = false;
        waitingForUserInput = false;
    }

    public double getProgress() { return progress; }

    public String getStatusMessage() { return statusMessage; }
    public void setStatusMessage(String statusMessage) { this.statusMessage = statusMessage == null ? "" : statusMessage; }

    public boolean isCaptchaDetected() { return captchaDetected; }
    public void setCaptchaDetected(boolean captchaDetected) { this.captchaDetected = captchaDetected; }

    public boolean isWaitingForUserInput() { return waitingForUserInput; }
    public void setWaitingForUserInput(boolean waitingForUserInput) { this.waitingForUserInput = waitingForUserInput; }

    public Stage getStage() { return stage; }
    public void setStage(Stage stage) { this.stage = stage; }
}
