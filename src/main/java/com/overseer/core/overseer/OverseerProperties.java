package com.overseer.core.overseer;

import com.overseer.core.model.Priority;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "overseer")
public class OverseerProperties {

    /** Overseer id; a random UUID is used when blank. */
    private String id = "";
    private String name = "Supervisory Board";
    private DirectiveSettings directive = new DirectiveSettings();
    private DispatchSettings dispatch = new DispatchSettings();
    private QuerySettings query = new QuerySettings();

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public DirectiveSettings getDirective() { return directive; }
    public void setDirective(DirectiveSettings directive) { this.directive = directive; }
    public DispatchSettings getDispatch() { return dispatch; }
    public void setDispatch(DispatchSettings dispatch) { this.dispatch = dispatch; }
    public QuerySettings getQuery() { return query; }
    public void setQuery(QuerySettings query) { this.query = query; }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    public static class DirectiveSettings {
        private int titleMaxLength = 100;
        private Priority defaultPriority = Priority.HIGH;

        public int getTitleMaxLength() { return titleMaxLength; }
        public void setTitleMaxLength(int titleMaxLength) { this.titleMaxLength = titleMaxLength; }
        public Priority getDefaultPriority() { return defaultPriority; }
        public void setDefaultPriority(Priority defaultPriority) { this.defaultPriority = defaultPriority; }
    }

    public static class DispatchSettings {
        private int timeoutSeconds = 30;
        private int threads = 2;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    public static class QuerySettings {
        private int pendingPreviewLimit = 5;
        private int descriptionPreviewLength = 50;

        public int getPendingPreviewLimit() { return pendingPreviewLimit; }
        public void setPendingPreviewLimit(int pendingPreviewLimit) { this.pendingPreviewLimit = pendingPreviewLimit; }
        public int getDescriptionPreviewLength() { return descriptionPreviewLength; }
        public void setDescriptionPreviewLength(int descriptionPreviewLength) { this.descriptionPreviewLength = descriptionPreviewLength; }
    }
}
