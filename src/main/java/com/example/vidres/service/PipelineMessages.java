package com.example.vidres.service;

import com.example.vidres.domain.OwnerKey;
import com.example.vidres.domain.TrackedJob;

import java.time.Duration;
import java.util.Locale;

/**
 * Texts sent to owners and operators.
 */
public final class PipelineMessages {

    private PipelineMessages() {
    }

    public static String systemBusy() {
        return "The system is busy right now. Please try again in a few minutes.";
    }

    public static String videoTooLarge(long maxBytes) {
        return String.format(Locale.ROOT, "The video is too large. The maximum size is %.1f GB.",
                maxBytes / (1024.0 * 1024 * 1024));
    }

    public static String unsupportedFormat() {
        return "This video format is not supported. Please send an H.264 or HEVC video in MP4 or MKV.";
    }

    public static String queued(int position, boolean premium, int premiumLimit) {
        String text = "You already have the maximum number of videos processing. Your video was queued at position "
                + position + ".";
        if (!premium) {
            text += " Premium subscribers can process up to " + premiumLimit + " videos at once.";
        }
        return text;
    }

    public static String queuePosition(int position) {
        return "Queued at position " + position + ".";
    }

    public static String processing(int estimatedMinutes) {
        return "Your video is being processed. Estimated time: about " + Math.max(estimatedMinutes, 1) + " min.";
    }

    public static String startFailed() {
        return "Failed to start processing your video. Please try again.";
    }

    public static String timedOut(Duration timeout) {
        return "Processing your video took longer than " + timeout.toMinutes() + " minutes and was stopped. "
                + "Please try again later.";
    }

    public static String completed(int renditionsDelivered) {
        return "Your video is ready. " + renditionsDelivered + " quality version(s) were sent.";
    }

    public static String deliveryFailed() {
        return "Your video was processed but could not be delivered. Please try again.";
    }

    public static String cancelled(int remainingInFlight) {
        if (remainingInFlight > 0) {
            return "Video processing cancelled. You still have " + remainingInFlight + " video(s) processing.";
        }
        return "Video processing cancelled.";
    }

    public static String nothingToCancel() {
        return "You have no videos being processed.";
    }

    public static String completionReport(TrackedJob job, int renditionsDelivered, boolean delivered,
                                          Duration actual) {
        StringBuilder report = new StringBuilder()
                .append("Job ").append(job.jobId()).append(" completed for ").append(describe(job.ownerKey()))
                .append("\nSize: ").append(String.format(Locale.ROOT, "%.2f MB", job.originalSize() / (1024.0 * 1024)))
                .append("\nDuration: ").append(formatDuration(job.durationSeconds()))
                .append("\nProcessing: ").append(actual.toMinutes()).append(" min (estimated ")
                .append(job.estimatedMinutes()).append(" min)");
        if (job.ownerKey().isUser()) {
            report.append("\nQualities sent: ").append(renditionsDelivered);
        } else {
            report.append("\nChannel post replaced: ").append(delivered ? "yes" : "no");
        }
        return report.toString();
    }

    public static String timeoutReport(TrackedJob job, Duration elapsed) {
        return "Job " + job.jobId() + " for " + describe(job.ownerKey()) + " timed out after "
                + elapsed.toMinutes() + " min (duration " + formatDuration(job.durationSeconds()) + ")";
    }

    static String formatDuration(int seconds) {
        return String.format(Locale.ROOT, "%d:%02d", seconds / 60, seconds % 60);
    }

    private static String describe(OwnerKey owner) {
        return owner.isUser() ? "user " + owner.id() : "channel " + owner.id();
    }
}
