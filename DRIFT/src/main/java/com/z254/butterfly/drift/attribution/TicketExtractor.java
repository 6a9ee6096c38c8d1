package com.z254.butterfly.drift.attribution;

import com.z254.butterfly.drift.config.DriftProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Captures a ticket id from an automation run message and renders its URL.
 * <p>
 * Disabled unless both the ticket pattern and the ticket base URL are configured.
 */
@Slf4j
@Component
public class TicketExtractor {

    private final Pattern ticketPattern;
    private final String ticketBaseUrl;

    @Autowired
    public TicketExtractor(DriftProperties properties) {
        this(properties.isTicketEnrichmentEnabled() ? properties.getTicketPattern() : null,
                properties.isTicketEnrichmentEnabled() ? properties.getTicketBaseUrl() : null);
    }

    TicketExtractor(String ticketPattern, String ticketBaseUrl) {
        boolean enabled = ticketPattern != null && ticketBaseUrl != null;
        this.ticketPattern = enabled ? Pattern.compile(ticketPattern) : null;
        this.ticketBaseUrl = enabled ? stripTrailingSlash(ticketBaseUrl) : null;
    }

    public boolean isEnabled() {
        return ticketPattern != null;
    }

    /**
     * Ticket id captured by the first group, underscores replaced by hyphens.
     */
    public Optional<String> extractTicketId(String runMessage) {
        if (!isEnabled() || runMessage == null) {
            return Optional.empty();
        }
        Matcher matcher = ticketPattern.matcher(runMessage);
        if (!matcher.find()) {
            return Optional.empty();
        }
        if (matcher.groupCount() < 1 || matcher.group(1) == null) {
            log.warn("Ticket pattern '{}' has no capture for run message '{}'", ticketPattern, runMessage);
            return Optional.empty();
        }
        return Optional.of(matcher.group(1).replace('_', '-'));
    }

    /**
     * Ticket URL for a run message, if a ticket id can be captured.
     */
    public Optional<String> extractTicketUrl(String runMessage) {
        return extractTicketId(runMessage).map(ticketId -> ticketBaseUrl + "/" + ticketId);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
