package de.alive.mailwatch.service.config;

import java.util.Set;

public record NotificationSettings(String url, String topic, String title, Set<String> notifyOn) {

    public static final String DEFAULT_URL = "https://ntfy.sh";
    public static final String DEFAULT_TITLE = "Mailwatch Email Report";

    public NotificationSettings {
        url = url == null || url.isBlank() ? DEFAULT_URL : url.trim();
        url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        topic = topic == null ? "" : topic.trim();
        title = title == null || title.isBlank() ? DEFAULT_TITLE : title;
        notifyOn = notifyOn == null ? Set.of() : Set.copyOf(notifyOn);
    }

    public boolean isEnabled() {
        return !topic.isEmpty();
    }

    public String topicUrl() {
        return url + "/" + topic;
    }
}
