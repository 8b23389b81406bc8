package com.poc.chmigrator.notification;

import com.poc.chmigrator.config.MigrationProperties;
import com.poc.chmigrator.config.NotificationProperties;
import com.poc.chmigrator.engine.MigrationEventListener;
import com.poc.chmigrator.engine.model.MigrationTask;
import com.poc.chmigrator.engine.model.TableResult;
import com.poc.chmigrator.engine.model.TableSpec;
import com.poc.chmigrator.engine.model.TaskResult;
import com.poc.chmigrator.engine.model.TaskStatus;
import com.poc.chmigrator.util.Formats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Posts Feishu interactive cards when a task starts, succeeds or fails.
 * Delivery problems are logged; they never affect the migration.
 */
@Component
@Slf4j
public class WebhookNotifier implements MigrationEventListener {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final NotificationProperties notification;
    private final MigrationProperties migration;
    private final RestTemplate restTemplate;

    public WebhookNotifier(NotificationProperties notification, MigrationProperties migration,
                           @Qualifier("webhookRestTemplate") RestTemplate restTemplate) {
        this.notification = notification;
        this.migration = migration;
        this.restTemplate = restTemplate;
        if (notification.isEnabled() && !notification.isActive()) {
            log.warn("[FEISHU] Notification enabled but webhook-url is not configured; notifications are off");
        }
    }

    @Override
    public void onTaskStarted(MigrationTask task) {
        if (!notification.isActive() || !notification.isNotifyOnStart()) {
            return;
        }
        List<String> tableLines = new ArrayList<>();
        List<TableSpec> tables = task.getTables();
        for (int i = 0; i < tables.size(); i++) {
            TableSpec spec = tables.get(i);
            tableLines.add((i + 1) + ". **" + spec.getSourceTable() + "** -> **" + spec.getDestinationTable()
                + "** (batch: " + spec.getBatchSize() + ")");
        }

        List<Map<String, Object>> elements = new ArrayList<>();
        elements.add(markdown(
            "**Environment**: " + notification.getEnvName() + "\n\n"
                + "**Task**: " + task.getName() + " (#" + task.getId() + ")\n\n"
                + "**Time**: " + now() + "\n\n"
                + "**Source DB**: " + migration.getSource().getDatabase() + "\n\n"
                + "**Target DB**: " + migration.getDestination().getDatabase() + "\n\n"
                + "**Tables Count**: " + tables.size()));
        elements.add(divider());
        elements.add(markdown("**Table List**:\n\n" + String.join("\n\n", tableLines)));
        send("[START] " + notification.getProjectName(), "blue", elements);
    }

    @Override
    public void onTaskCompleted(MigrationTask task, TaskResult result) {
        boolean failed = result.getOverallStatus() == TaskStatus.FAILED;
        if (!notification.isActive()) {
            return;
        }
        if (failed && notification.isNotifyOnFailure()) {
            send("[FAILURE] " + notification.getProjectName(), "red", failureElements(result));
        } else if (!failed && notification.isNotifyOnSuccess()) {
            String color = result.getOverallStatus() == TaskStatus.SUCCEEDED ? "green" : "orange";
            String tag = result.getOverallStatus() == TaskStatus.SUCCEEDED ? "[SUCCESS] " : "[FINISHED] ";
            send(tag + notification.getProjectName(), color, successElements(result));
        }
    }

    List<Map<String, Object>> successElements(TaskResult result) {
        long seconds = result.getDuration().getSeconds();
        long avgSpeed = seconds > 0 ? result.totalRowsWritten() / seconds : result.totalRowsWritten();

        List<Map<String, Object>> elements = new ArrayList<>();
        elements.add(markdown(
            "**Environment**: " + notification.getEnvName() + "\n\n"
                + "**Status**: " + result.getOverallStatus().getDisplayName() + "\n\n"
                + "**Complete Time**: " + now() + "\n\n"
                + "**Success Tables**: " + result.succeededCount() + "/" + result.getTableResults().size() + "\n\n"
                + "**Total Rows**: " + Formats.number(result.totalRowsWritten()) + "\n\n"
                + "**Total Time**: " + Formats.duration(result.getDuration()) + "\n\n"
                + "**Avg Speed**: " + Formats.number(avgSpeed) + " rows/s"));

        String details = result.getTableResults().stream()
            .map(WebhookNotifier::tableLine)
            .collect(Collectors.joining("\n\n"));
        if (!details.isEmpty()) {
            elements.add(divider());
            elements.add(markdown("**Migration Details**:\n\n" + details));
        }
        return elements;
    }

    List<Map<String, Object>> failureElements(TaskResult result) {
        String failedTable = result.firstFailure()
            .map(failure -> failure.getTable().getSourceTable())
            .orElse("N/A");
        String error = result.getTaskError() != null
            ? result.getTaskError()
            : result.firstFailure().map(failure -> failure.getError().summary()).orElse("Unknown error");

        List<Map<String, Object>> elements = new ArrayList<>();
        elements.add(markdown(
            "**Environment**: " + notification.getEnvName() + "\n\n"
                + "**Failed Time**: " + now() + "\n\n"
                + "**Failed Table**: " + failedTable + "\n\n"
                + "**Progress**: " + result.succeededCount() + "/" + result.getTableResults().size()
                + " tables completed\n\n"
                + "**Total Time**: " + Formats.duration(result.getDuration())));
        elements.add(divider());
        elements.add(markdown("**Error Message**:\n\n```\n" + truncate(error, 500) + "\n```"));
        return elements;
    }

    private static String tableLine(TableResult table) {
        String icon = table.isSucceeded() ? "[OK]" : table.isFailed() ? "[FAIL]" : "[SKIP]";
        Duration duration = table.getDuration() != null ? table.getDuration() : Duration.ZERO;
        return icon + " **" + table.getTable().getSourceTable() + "**: "
            + Formats.number(table.getRowsWritten()) + " rows, "
            + Formats.duration(duration) + ", "
            + Formats.number((long) table.rowsPerSecond()) + " rows/s";
    }

    private void send(String title, String color, List<Map<String, Object>> elements) {
        Map<String, Object> mention = mentionElement();
        if (mention != null) {
            elements.add(divider());
            elements.add(mention);
        }

        Map<String, Object> titleText = new LinkedHashMap<>();
        titleText.put("tag", "plain_text");
        titleText.put("content", title);
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("title", titleText);
        header.put("template", color);

        Map<String, Object> card = new LinkedHashMap<>();
        card.put("config", Map.of("wide_screen_mode", true));
        card.put("header", header);
        card.put("elements", elements);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("msg_type", "interactive");
        payload.put("card", card);

        try {
            Map<?, ?> response = restTemplate.postForObject(notification.getWebhookUrl(), payload, Map.class);
            Object code = response != null ? response.get("code") : null;
            if (code instanceof Number && ((Number) code).intValue() == 0) {
                log.info("[FEISHU] Message sent successfully: {}", title);
            } else {
                log.error("[FEISHU] Failed to send {}: {}", title, response != null ? response.get("msg") : "empty response");
            }
        } catch (RestClientException e) {
            log.error("[FEISHU] Error sending {}: {}", title, e.getMessage());
        }
    }

    private Map<String, Object> mentionElement() {
        if (notification.isMentionAll()) {
            return markdown("<at id=all></at>");
        }
        if (notification.getMentionUsers().isEmpty()) {
            return null;
        }
        return markdown(notification.getMentionUsers().stream()
            .map(user -> "<at id=" + user + "></at>")
            .collect(Collectors.joining(" ")));
    }

    private static Map<String, Object> markdown(String content) {
        Map<String, Object> text = new LinkedHashMap<>();
        text.put("tag", "lark_md");
        text.put("content", content);
        Map<String, Object> element = new LinkedHashMap<>();
        element.put("tag", "div");
        element.put("text", text);
        return element;
    }

    private static Map<String, Object> divider() {
        return Map.of("tag", "hr");
    }

    private static String now() {
        return LocalDateTime.now().format(TIME_FORMAT);
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
