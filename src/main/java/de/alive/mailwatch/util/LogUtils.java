package de.alive.mailwatch.util;

import java.time.Duration;

public final class LogUtils {
    public static final String SUCCESS_EMOJI = "✅";
    public static final String ERROR_EMOJI = "❌";
    public static final String WARNING_EMOJI = "⚠️";
    public static final String INFO_EMOJI = "ℹ️";
    public static final String SEARCH_EMOJI = "🔍";
    public static final String FOLDER_EMOJI = "📁";
    public static final String EMAIL_EMOJI = "📧";
    public static final String PROCESS_EMOJI = "⚙️";
    public static final String STOP_EMOJI = "🛑";
    public static final String HEARTBEAT_EMOJI = "💓";
    public static final String ROCKET_EMOJI = "🚀";
    public static final String KEY_EMOJI = "🔑";
    public static final String IDLE_EMOJI = "💤";
    public static final String RECONNECT_EMOJI = "🔄";
    public static final String PHISH_EMOJI = "🎣";

    private LogUtils() {
    }

    public static String formatDuration(Duration duration) {
        long seconds = duration.toSeconds();
        long minutes = seconds / 60;
        long hours = minutes / 60;

        if (hours > 0) return String.format("%dh %dm %ds", hours, minutes % 60, seconds % 60);
        if (minutes > 0) return String.format("%dm %ds", minutes, seconds % 60);
        return String.format("%ds", seconds);
    }

    public static String maskEmail(String email) {
        if (email == null || !email.contains("@")) return "***";

        int at = email.lastIndexOf('@');
        String username = email.substring(0, at);
        String domain = email.substring(at + 1);

        if (username.length() <= 2) {
            return "***@" + domain;
        }
        return username.substring(0, 2) + "***@" + domain;
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) return "";
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }
}
