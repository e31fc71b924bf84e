package io.rota4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for recurring series. Status is stored by its lowercase value.
 */
@Document(collection = "rota_series")
public class SeriesDocument {

    @Id
    private String id;

    private String recurrenceRule;
    private Instant dtstart;
    private String duration;
    private String timezone;
    private String entityTable;
    private Map<String, Object> entityTemplate;
    private String timeRangeColumn;
    private Instant expandedUntil;
    private String status;
    private String statusReason;
    private String createdBy;

    public SeriesDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getRecurrenceRule() {
        return recurrenceRule;
    }

    public void setRecurrenceRule(String recurrenceRule) {
        this.recurrenceRule = recurrenceRule;
    }

    public Instant getDtstart() {
        return dtstart;
    }

    public void setDtstart(Instant dtstart) {
        this.dtstart = dtstart;
    }

    public String getDuration() {
        return duration;
    }

    public void setDuration(String duration) {
        this.duration = duration;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getEntityTable() {
        return entityTable;
    }

    public void setEntityTable(String entityTable) {
        this.entityTable = entityTable;
    }

    public Map<String, Object> getEntityTemplate() {
        return entityTemplate;
    }

    public void setEntityTemplate(Map<String, Object> entityTemplate) {
        this.entityTemplate = entityTemplate;
    }

    public String getTimeRangeColumn() {
        return timeRangeColumn;
    }

    public void setTimeRangeColumn(String timeRangeColumn) {
        this.timeRangeColumn = timeRangeColumn;
    }

    public Instant getExpandedUntil() {
        return expandedUntil;
    }

    public void setExpandedUntil(Instant expandedUntil) {
        this.expandedUntil = expandedUntil;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getStatusReason() {
        return statusReason;
    }

    public void setStatusReason(String statusReason) {
        this.statusReason = statusReason;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }
}
